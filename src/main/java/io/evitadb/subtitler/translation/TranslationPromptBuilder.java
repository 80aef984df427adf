package io.evitadb.subtitler.translation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.evitadb.subtitler.context.ContextWindow;
import io.evitadb.subtitler.context.TranslatedContext;
import io.evitadb.subtitler.context.WindowEntry;
import io.evitadb.subtitler.llm.PromptLoader;
import io.evitadb.subtitler.model.Glossary;
import io.evitadb.subtitler.quality.ErrorKind;
import io.evitadb.subtitler.quality.TranslationException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns a {@link ContextWindow} into the system prompt and JSON payload sent to the model.
 */
public final class TranslationPromptBuilder {

	static final String SYSTEM_TEMPLATE = "translate-subtitles-system.txt";
	static final String FEEDBACK_TEMPLATE = "translate-subtitles-feedback.txt";
	static final String STRICT_JSON_REMINDER =
		"Your previous answer could not be read. Answer with the JSON object only, without markdown or commentary.";

	@Nonnull
	private final PromptLoader promptLoader;
	@Nonnull
	private final ObjectMapper mapper;
	private final double maxLengthRatio;

	public TranslationPromptBuilder(@Nonnull PromptLoader promptLoader, double maxLengthRatio) {
		this.promptLoader = Objects.requireNonNull(promptLoader, "promptLoader must not be null");
		this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
		this.maxLengthRatio = maxLengthRatio;
	}

	/**
	 * Builds the system prompt.
	 *
	 * @param window     the window being translated
	 * @param feedback   corrections from a previous attempt, may be empty
	 * @param strictJson whether to remind the model that its previous output was unreadable
	 * @return the system prompt
	 */
	@Nonnull
	public String systemPrompt(@Nonnull ContextWindow window, @Nonnull List<String> feedback, boolean strictJson) {
		final StringBuilder prompt = new StringBuilder(
			this.promptLoader.loadAndInterpolate(
				SYSTEM_TEMPLATE,
				Map.of(
					"sourceLanguage", window.sourceLanguage(),
					"targetLanguage", window.targetLanguage(),
					"maxLengthPercent", String.valueOf(Math.round(this.maxLengthRatio * 100))
				)
			)
		);
		if (!feedback.isEmpty()) {
			prompt.append("\n\n").append(
				this.promptLoader.loadAndInterpolate(FEEDBACK_TEMPLATE, Map.of("feedback", bulletList(feedback)))
			);
		}
		if (strictJson) {
			prompt.append("\n\n").append(STRICT_JSON_REMINDER);
		}
		return prompt.toString();
	}

	/**
	 * Builds the request object for the window.
	 */
	@Nonnull
	public TranslationRequest request(
		@Nonnull ContextWindow window,
		@Nullable String customInstructions,
		@Nonnull List<String> feedback,
		boolean strictJson
	) {
		final List<TranslationRequest.RecentTranslation> recent = new ArrayList<>(window.recent().size());
		for (final TranslatedContext context : window.recent()) {
			recent.add(new TranslationRequest.RecentTranslation(context.id(), context.original(), context.translated()));
		}
		final List<TranslationRequest.LookaheadEntry> lookahead = new ArrayList<>(window.lookahead().size());
		for (final WindowEntry entry : window.lookahead()) {
			lookahead.add(new TranslationRequest.LookaheadEntry(entry.id(), entry.text()));
		}
		final List<TranslationRequest.EntryToTranslate> batch = new ArrayList<>(window.batch().size());
		for (final WindowEntry entry : window.batch()) {
			batch.add(new TranslationRequest.EntryToTranslate(entry.id(), entry.text(), entry.timecode()));
		}

		return new TranslationRequest(
			TranslationRequest.TASK,
			window.sourceLanguage(),
			window.targetLanguage(),
			new TranslationRequest.Context(
				window.historySummary(),
				recent.isEmpty() ? null : recent,
				lookahead.isEmpty() ? null : lookahead,
				glossaryContext(window.glossary())
			),
			batch,
			new TranslationRequest.Instructions(
				true, true, this.maxLengthRatio, customInstructions,
				feedback.isEmpty() ? null : List.copyOf(feedback), strictJson
			)
		);
	}

	/**
	 * Serializes the request for the window to JSON.
	 */
	@Nonnull
	public String payload(
		@Nonnull ContextWindow window,
		@Nullable String customInstructions,
		@Nonnull List<String> feedback,
		boolean strictJson
	) {
		try {
			return this.mapper.writeValueAsString(request(window, customInstructions, feedback, strictJson));
		} catch (JsonProcessingException e) {
			throw new TranslationException(ErrorKind.UNKNOWN, "Failed to serialize translation request", e);
		}
	}

	@Nullable
	private static TranslationRequest.GlossaryContext glossaryContext(@Nonnull Glossary glossary) {
		if (glossary.isEmpty()) {
			return null;
		}
		return new TranslationRequest.GlossaryContext(
			List.copyOf(glossary.getCharacterNames()),
			glossary.allTranslations()
		);
	}

	@Nonnull
	private static String bulletList(@Nonnull List<String> lines) {
		final StringBuilder result = new StringBuilder();
		for (final String line : lines) {
			if (result.length() > 0) {
				result.append('\n');
			}
			result.append("- ").append(line);
		}
		return result.toString();
	}
}
