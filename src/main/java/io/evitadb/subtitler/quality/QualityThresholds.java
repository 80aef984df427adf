package io.evitadb.subtitler.quality;

import javax.annotation.Nonnull;

/**
 * Limits used by {@link QualityMetrics}.
 *
 * @param minOverall        overall score required to pass
 * @param maxLengthRatio    upper bound of translated/original length
 * @param minLengthRatio    lower bound of translated/original length
 * @param maxCharsPerSecond reading speed limit
 * @param maxCharsPerLine   line length limit
 * @param minConfidence     lowest acceptable model confidence
 */
public record QualityThresholds(
	double minOverall,
	double maxLengthRatio,
	double minLengthRatio,
	double maxCharsPerSecond,
	int maxCharsPerLine,
	double minConfidence
) {

	public QualityThresholds {
		if (minLengthRatio <= 0 || maxLengthRatio <= minLengthRatio) {
			throw new IllegalArgumentException("Length ratio bounds must satisfy 0 < min < max");
		}
		if (maxCharsPerSecond <= 0 || maxCharsPerLine <= 0) {
			throw new IllegalArgumentException("Readability limits must be positive");
		}
	}

	@Nonnull
	public static QualityThresholds defaults() {
		return new QualityThresholds(0.7, 1.5, 0.3, 25.0, 42, 0.5);
	}

	@Nonnull
	public static QualityThresholds strict() {
		return new QualityThresholds(0.85, 1.3, 0.5, 20.0, 37, 0.7);
	}

	@Nonnull
	public static QualityThresholds lenient() {
		return new QualityThresholds(0.5, 2.0, 0.2, 30.0, 50, 0.3);
	}
}
