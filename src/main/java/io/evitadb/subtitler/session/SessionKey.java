package io.evitadb.subtitler.session;

import com.fasterxml.jackson.annotation.JsonProperty;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Identifies the translation of one source content into one language by one model. A changed source file
 * has a different content hash and therefore a different key.
 *
 * @param contentHash    SHA-256 of the source file content
 * @param sourceLanguage source language
 * @param targetLanguage target language
 * @param provider       model provider name
 * @param model          model name
 */
public record SessionKey(
	@JsonProperty("contentHash") @Nonnull String contentHash,
	@JsonProperty("sourceLanguage") @Nonnull String sourceLanguage,
	@JsonProperty("targetLanguage") @Nonnull String targetLanguage,
	@JsonProperty("provider") @Nonnull String provider,
	@JsonProperty("model") @Nonnull String model
) {

	public SessionKey {
		Objects.requireNonNull(contentHash, "contentHash must not be null");
		Objects.requireNonNull(sourceLanguage, "sourceLanguage must not be null");
		Objects.requireNonNull(targetLanguage, "targetLanguage must not be null");
		Objects.requireNonNull(provider, "provider must not be null");
		Objects.requireNonNull(model, "model must not be null");
	}
}
