package io.evitadb.subtitler.translation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * One translated line as returned by the model.
 *
 * @param id         entry id, must match a requested id
 * @param translated translated text
 * @param confidence model confidence in [0, 1], null when not reported
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TranslatedEntry(
	@JsonProperty("id") int id,
	@JsonProperty("translated") @Nonnull String translated,
	@JsonProperty("confidence") @Nullable Double confidence
) {

	public TranslatedEntry {
		translated = translated == null ? "" : translated;
		if (confidence != null) {
			confidence = Math.max(0.0, Math.min(1.0, confidence));
		}
	}

	/**
	 * Creates an empty placeholder with zero confidence, used when a batch could not be translated.
	 *
	 * @param id entry id
	 * @return placeholder entry
	 */
	@Nonnull
	public static TranslatedEntry placeholder(int id) {
		return new TranslatedEntry(id, "", 0.0);
	}

	public boolean isEmpty() {
		return this.translated.isBlank();
	}
}
