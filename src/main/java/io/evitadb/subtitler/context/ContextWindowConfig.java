package io.evitadb.subtitler.context;

import javax.annotation.Nonnull;

/**
 * Sizes of the three context regions and the summarization trigger.
 *
 * @param recentCount            translated entries shown before the batch
 * @param batchSize              entries to translate per window
 * @param lookaheadCount         upcoming entries shown after the batch
 * @param enableSummarization    whether earlier history is summarized for long documents
 * @param summarizationThreshold position from which a summary is attached
 */
public record ContextWindowConfig(
	int recentCount,
	int batchSize,
	int lookaheadCount,
	boolean enableSummarization,
	int summarizationThreshold
) {

	public ContextWindowConfig {
		if (recentCount < 0 || lookaheadCount < 0) {
			throw new IllegalArgumentException("recentCount and lookaheadCount must not be negative");
		}
		if (batchSize < 1) {
			throw new IllegalArgumentException("batchSize must be at least 1");
		}
		if (summarizationThreshold < 0) {
			throw new IllegalArgumentException("summarizationThreshold must not be negative");
		}
	}

	@Nonnull
	public static ContextWindowConfig defaults() {
		return new ContextWindowConfig(10, 15, 5, true, 50);
	}

	/**
	 * Small windows without summarization, for cheap models or short documents.
	 */
	@Nonnull
	public static ContextWindowConfig minimal() {
		return new ContextWindowConfig(3, 5, 2, false, 100);
	}

	/**
	 * Wide windows for models with large context.
	 */
	@Nonnull
	public static ContextWindowConfig largeContext() {
		return new ContextWindowConfig(20, 10, 10, true, 30);
	}

	@Nonnull
	public ContextWindowConfig withBatchSize(int newBatchSize) {
		return new ContextWindowConfig(this.recentCount, newBatchSize, this.lookaheadCount, this.enableSummarization, this.summarizationThreshold);
	}

	@Nonnull
	public ContextWindowConfig withRecentCount(int newRecentCount) {
		return new ContextWindowConfig(newRecentCount, this.batchSize, this.lookaheadCount, this.enableSummarization, this.summarizationThreshold);
	}

	@Nonnull
	public ContextWindowConfig withLookaheadCount(int newLookaheadCount) {
		return new ContextWindowConfig(this.recentCount, this.batchSize, newLookaheadCount, this.enableSummarization, this.summarizationThreshold);
	}

	@Nonnull
	public ContextWindowConfig withSummarization(boolean enabled, int threshold) {
		return new ContextWindowConfig(this.recentCount, this.batchSize, this.lookaheadCount, enabled, threshold);
	}
}
