package io.evitadb.subtitler.translation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.evitadb.subtitler.quality.ErrorKind;
import io.evitadb.subtitler.quality.TranslationException;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Pulls the JSON answer out of model output, which may wrap it in markdown fences or prose.
 *
 * Extraction order: the trimmed text as-is when it starts with `{`, a ```json fenced block, a plain fenced block
 * starting with `{`, then the span between the first `{` and the last `}`.
 */
public final class ResponseExtractor {

	private static final String JSON_FENCE = "```json";
	private static final String FENCE = "```";

	@Nonnull
	private final ObjectMapper mapper;

	public ResponseExtractor() {
		this(new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
	}

	public ResponseExtractor(@Nonnull ObjectMapper mapper) {
		this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
	}

	/**
	 * Locates the JSON object inside the model output.
	 *
	 * @param response raw model output
	 * @return the JSON text, empty when no candidate was found
	 */
	@Nonnull
	public static Optional<String> extractJson(@Nonnull String response) {
		Objects.requireNonNull(response, "response must not be null");
		final String trimmed = response.trim();
		if (trimmed.startsWith("{")) {
			return Optional.of(trimmed);
		}

		final int jsonFence = trimmed.indexOf(JSON_FENCE);
		if (jsonFence >= 0) {
			final int contentStart = jsonFence + JSON_FENCE.length();
			final int end = trimmed.indexOf(FENCE, contentStart);
			if (end >= 0) {
				return Optional.of(trimmed.substring(contentStart, end).trim());
			}
		}

		final int fence = trimmed.indexOf(FENCE);
		if (fence >= 0) {
			final int contentStart = fence + FENCE.length();
			final int end = trimmed.indexOf(FENCE, contentStart);
			if (end >= 0) {
				final String block = trimmed.substring(contentStart, end).trim();
				if (block.startsWith("{")) {
					return Optional.of(block);
				}
			}
		}

		final int open = trimmed.indexOf('{');
		final int close = trimmed.lastIndexOf('}');
		if (open >= 0 && close > open) {
			return Optional.of(trimmed.substring(open, close + 1));
		}
		return Optional.empty();
	}

	/**
	 * Parses the model output into a response. Translation items that cannot be read (no id, wrong types) are
	 * left out and reported as warnings; their ids then show up as missing in the batch result.
	 *
	 * @param response raw model output
	 * @return parsed response
	 * @throws TranslationException {@link ErrorKind#INVALID_RESPONSE} when no JSON object with a `translations`
	 *                              array is present, {@link ErrorKind#PARSE_ERROR} when the JSON is malformed
	 */
	@Nonnull
	public TranslationResponse parse(@Nonnull String response) {
		final String json = extractJson(response).orElseThrow(
			() -> new TranslationException(ErrorKind.INVALID_RESPONSE, "Could not find JSON in model response")
		);
		try {
			final JsonNode root = this.mapper.readTree(json);
			if (root == null || !root.isObject()) {
				throw new TranslationException(ErrorKind.INVALID_RESPONSE, "Model response is not a JSON object");
			}
			final JsonNode translationsNode = root.get("translations");
			if (translationsNode == null || !translationsNode.isArray()) {
				throw new TranslationException(ErrorKind.INVALID_RESPONSE, "Model response has no translations array");
			}

			final List<TranslatedEntry> translations = new ArrayList<>(translationsNode.size());
			final List<String> problems = new ArrayList<>();
			for (final JsonNode item : translationsNode) {
				if (!item.hasNonNull("id") || !item.get("id").canConvertToInt()) {
					problems.add("Ignored translation without a numeric id: " + item);
					continue;
				}
				try {
					translations.add(this.mapper.treeToValue(item, TranslatedEntry.class));
				} catch (JsonProcessingException e) {
					problems.add("Ignored unreadable translation " + item.get("id").asInt() + ": " + e.getOriginalMessage());
				}
			}

			TranslationResponse.Notes notes = null;
			final JsonNode notesNode = root.get("notes");
			if (notesNode != null && notesNode.isObject()) {
				try {
					notes = this.mapper.treeToValue(notesNode, TranslationResponse.Notes.class);
				} catch (JsonProcessingException e) {
					problems.add("Ignored unreadable notes: " + e.getOriginalMessage());
				}
			}
			if (!problems.isEmpty()) {
				final List<String> warnings = new ArrayList<>(notes == null ? List.of() : notes.warnings());
				warnings.addAll(problems);
				notes = notes == null
					? new TranslationResponse.Notes(null, warnings, null)
					: new TranslationResponse.Notes(notes.glossaryUpdates(), warnings, notes.sceneContext());
			}
			return new TranslationResponse(translations, notes);
		} catch (JsonProcessingException e) {
			throw new TranslationException(ErrorKind.PARSE_ERROR, "Failed to parse model response: " + e.getOriginalMessage(), e);
		}
	}
}
