package io.evitadb.subtitler.translation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * JSON payload sent to the model for one batch.
 *
 * @param task               fixed task identifier
 * @param sourceLanguage     source language
 * @param targetLanguage     target language
 * @param context            surrounding context
 * @param entriesToTranslate lines the model must translate
 * @param instructions       output constraints
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TranslationRequest(
	@JsonProperty("task") @Nonnull String task,
	@JsonProperty("source_language") @Nonnull String sourceLanguage,
	@JsonProperty("target_language") @Nonnull String targetLanguage,
	@JsonProperty("context") @Nonnull Context context,
	@JsonProperty("entries_to_translate") @Nonnull List<EntryToTranslate> entriesToTranslate,
	@JsonProperty("instructions") @Nonnull Instructions instructions
) {

	public static final String TASK = "translate_subtitles";

	public TranslationRequest {
		Objects.requireNonNull(task, "task must not be null");
		Objects.requireNonNull(sourceLanguage, "sourceLanguage must not be null");
		Objects.requireNonNull(targetLanguage, "targetLanguage must not be null");
		Objects.requireNonNull(context, "context must not be null");
		entriesToTranslate = List.copyOf(entriesToTranslate);
		Objects.requireNonNull(instructions, "instructions must not be null");
	}

	/**
	 * Context of the batch. Absent parts are omitted from the JSON.
	 */
	@JsonInclude(JsonInclude.Include.NON_EMPTY)
	public record Context(
		@JsonProperty("history_summary") @Nullable String historySummary,
		@JsonProperty("recent_translations") @Nullable List<RecentTranslation> recentTranslations,
		@JsonProperty("lookahead") @Nullable List<LookaheadEntry> lookahead,
		@JsonProperty("glossary") @Nullable GlossaryContext glossary
	) {
	}

	public record RecentTranslation(
		@JsonProperty("id") int id,
		@JsonProperty("original") @Nonnull String original,
		@JsonProperty("translated") @Nonnull String translated
	) {
	}

	public record EntryToTranslate(
		@JsonProperty("id") int id,
		@JsonProperty("text") @Nonnull String text,
		@JsonProperty("timecode") @Nonnull String timecode
	) {
	}

	public record LookaheadEntry(
		@JsonProperty("id") int id,
		@JsonProperty("text") @Nonnull String text
	) {
	}

	/**
	 * Names that must stay untranslated and terms with a fixed translation.
	 */
	@JsonInclude(JsonInclude.Include.NON_EMPTY)
	public record GlossaryContext(
		@JsonProperty("character_names") @Nonnull List<String> characterNames,
		@JsonProperty("terms") @Nonnull Map<String, String> terms
	) {
	}

	/**
	 * Output constraints. {@code feedback} carries corrections from a previous attempt.
	 */
	@JsonInclude(JsonInclude.Include.NON_EMPTY)
	public record Instructions(
		@JsonProperty("preserve_formatting") boolean preserveFormatting,
		@JsonProperty("preserve_sound_effects") boolean preserveSoundEffects,
		@JsonProperty("max_length_ratio") double maxLengthRatio,
		@JsonProperty("custom") @Nullable String custom,
		@JsonProperty("feedback") @Nullable List<String> feedback,
		@JsonProperty("strict_json") boolean strictJson
	) {
	}
}
