package io.evitadb.subtitler.llm;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Raw model output with the tokens the request consumed.
 *
 * @param text         model output
 * @param inputTokens  prompt tokens, 0 when the provider does not report usage
 * @param outputTokens completion tokens, 0 when the provider does not report usage
 */
public record CompletionResult(
	@Nonnull String text,
	int inputTokens,
	int outputTokens
) {

	public CompletionResult {
		Objects.requireNonNull(text, "text must not be null");
	}

	@Nonnull
	public static CompletionResult of(@Nonnull String text) {
		return new CompletionResult(text, 0, 0);
	}
}
