package io.evitadb.subtitler.llm;

import io.evitadb.subtitler.quality.TranslationException;

import javax.annotation.Nonnull;

/**
 * Text completion backend used by the translation pass.
 */
public interface LanguageModelClient {

	/**
	 * Sends one request to the model.
	 *
	 * @param systemPrompt instructions describing the task
	 * @param payload      the request body, usually JSON
	 * @return the raw model output with token usage
	 * @throws TranslationException classified failure
	 */
	@Nonnull
	CompletionResult complete(@Nonnull String systemPrompt, @Nonnull String payload);

}
