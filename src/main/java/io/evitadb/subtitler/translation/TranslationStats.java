package io.evitadb.subtitler.translation;

import javax.annotation.Nonnull;
import java.util.Locale;

/**
 * Counters collected while translating a document.
 *
 * @param totalBatches      batches processed, including those answered from the cache
 * @param completedBatches  batches that returned every requested id
 * @param entriesTranslated entries that received a non-empty translation
 * @param totalRetries      retries across all batches
 * @param fallbackCount     batches that ended with placeholders
 * @param inputTokens       prompt tokens reported by the provider
 * @param outputTokens      completion tokens reported by the provider
 * @param cancelled         whether the run stopped on a cancellation request
 * @param cachedBatches     batches answered from the {@link TranslationCache} without a model call
 */
public record TranslationStats(
	int totalBatches,
	int completedBatches,
	int entriesTranslated,
	int totalRetries,
	int fallbackCount,
	long inputTokens,
	long outputTokens,
	boolean cancelled,
	int cachedBatches
) {

	@Nonnull
	public static TranslationStats empty() {
		return new TranslationStats(0, 0, 0, 0, 0, 0, 0, false, 0);
	}

	/**
	 * Share of batches that came back complete.
	 *
	 * @return percentage, 100 when no batch ran
	 */
	public double successRate() {
		if (this.totalBatches == 0) {
			return 100.0;
		}
		return this.completedBatches * 100.0 / this.totalBatches;
	}

	@Nonnull
	public String summary() {
		return String.format(
			Locale.ROOT,
			"%d/%d batches complete, %d entries translated, %d retries, %d fallbacks, %d/%d tokens%s%s",
			this.completedBatches, this.totalBatches, this.entriesTranslated, this.totalRetries, this.fallbackCount,
			this.inputTokens, this.outputTokens, this.cachedBatches > 0 ? ", " + this.cachedBatches + " from cache" : "",
			this.cancelled ? ", cancelled" : ""
		);
	}
}
