package io.evitadb.subtitler.analysis;

import javax.annotation.Nonnull;

/**
 * Settings of the {@link HistorySummarizer}.
 *
 * @param maxSummaryChars         upper bound on summary length
 * @param includeCharacterNames   whether recurring names are listed
 * @param includeDialogueSnippets whether evenly spaced dialogue snippets are quoted
 */
public record SummarizationConfig(
	int maxSummaryChars,
	boolean includeCharacterNames,
	boolean includeDialogueSnippets
) {

	public SummarizationConfig {
		if (maxSummaryChars < 10) {
			throw new IllegalArgumentException("maxSummaryChars must be at least 10");
		}
	}

	@Nonnull
	public static SummarizationConfig defaults() {
		return new SummarizationConfig(500, true, true);
	}

	@Nonnull
	public SummarizationConfig withMaxSummaryChars(int newMax) {
		return new SummarizationConfig(newMax, this.includeCharacterNames, this.includeDialogueSnippets);
	}
}
