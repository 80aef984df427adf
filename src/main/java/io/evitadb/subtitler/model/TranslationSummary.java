package io.evitadb.subtitler.model;

import javax.annotation.Nonnull;

/**
 * Totals of a translation run across all files and target languages.
 *
 * @param successCount      files translated and written
 * @param failedCount       files that failed
 * @param skippedCount      files skipped as up to date or unreadable
 * @param entriesTranslated subtitle entries translated
 * @param inputTokens       prompt tokens used
 * @param outputTokens      completion tokens used
 */
public record TranslationSummary(
	int successCount,
	int failedCount,
	int skippedCount,
	int entriesTranslated,
	long inputTokens,
	long outputTokens
) {

	@Nonnull
	public static TranslationSummary empty() {
		return new TranslationSummary(0, 0, 0, 0, 0, 0);
	}

	public int getTotalCount() {
		return this.successCount + this.failedCount + this.skippedCount;
	}

	public boolean isAllSuccessful() {
		return this.failedCount == 0;
	}

	public boolean hasFailures() {
		return this.failedCount > 0;
	}

	@Nonnull
	public TranslationSummary add(@Nonnull TranslationSummary other) {
		return new TranslationSummary(
			this.successCount + other.successCount,
			this.failedCount + other.failedCount,
			this.skippedCount + other.skippedCount,
			this.entriesTranslated + other.entriesTranslated,
			this.inputTokens + other.inputTokens,
			this.outputTokens + other.outputTokens
		);
	}

	@Nonnull
	public TranslationSummary withSuccess(int entries, long inputTokens, long outputTokens) {
		return new TranslationSummary(
			this.successCount + 1,
			this.failedCount,
			this.skippedCount,
			this.entriesTranslated + entries,
			this.inputTokens + inputTokens,
			this.outputTokens + outputTokens
		);
	}

	/**
	 * Counts a failure; tokens spent on the failed attempt are still added.
	 */
	@Nonnull
	public TranslationSummary withFailure(long inputTokens, long outputTokens) {
		return new TranslationSummary(
			this.successCount,
			this.failedCount + 1,
			this.skippedCount,
			this.entriesTranslated,
			this.inputTokens + inputTokens,
			this.outputTokens + outputTokens
		);
	}

	@Nonnull
	public TranslationSummary withFailure() {
		return withFailure(0, 0);
	}

	@Nonnull
	public TranslationSummary withSkipped() {
		return new TranslationSummary(
			this.successCount,
			this.failedCount,
			this.skippedCount + 1,
			this.entriesTranslated,
			this.inputTokens,
			this.outputTokens
		);
	}

	@Override
	public String toString() {
		return String.format(
			"TranslationSummary[success=%d, failed=%d, skipped=%d, entries=%d, tokens=%d/%d]",
			this.successCount, this.failedCount, this.skippedCount, this.entriesTranslated,
			this.inputTokens, this.outputTokens
		);
	}
}
