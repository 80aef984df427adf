package io.evitadb.subtitler.context;

import javax.annotation.Nonnull;

/**
 * Bounds and targets of the {@link DynamicWindowSizer}.
 *
 * @param minBatchSize           smallest batch produced (unless fewer entries remain)
 * @param maxBatchSize           largest batch produced
 * @param targetTokens           estimated token budget of a batch
 * @param respectSceneBoundaries whether batches are aligned to scene ends
 * @param lookaheadFactor        how far past {@code maxBatchSize} a scene end may lie and still be aligned to
 */
public record DynamicWindowConfig(
	int minBatchSize,
	int maxBatchSize,
	int targetTokens,
	boolean respectSceneBoundaries,
	double lookaheadFactor
) {

	public DynamicWindowConfig {
		if (minBatchSize < 1) {
			throw new IllegalArgumentException("minBatchSize must be at least 1");
		}
		if (maxBatchSize < minBatchSize) {
			throw new IllegalArgumentException("maxBatchSize must not be smaller than minBatchSize");
		}
		if (targetTokens < 1) {
			throw new IllegalArgumentException("targetTokens must be positive");
		}
		if (lookaheadFactor < 1.0) {
			throw new IllegalArgumentException("lookaheadFactor must be at least 1.0");
		}
	}

	@Nonnull
	public static DynamicWindowConfig defaults() {
		return new DynamicWindowConfig(5, 25, 2000, true, 1.5);
	}

	@Nonnull
	public static DynamicWindowConfig fast() {
		return new DynamicWindowConfig(10, 30, 3000, false, 1.0);
	}

	@Nonnull
	public static DynamicWindowConfig quality() {
		return new DynamicWindowConfig(3, 15, 1500, true, 2.0);
	}
}
