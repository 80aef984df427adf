package io.evitadb.subtitler.quality;

import javax.annotation.Nonnull;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Multi-dimensional quality assessment of a translated document.
 *
 * @param overall           weighted average of the dimension scores
 * @param completeness      share of entries with a non-empty translation
 * @param accuracy          length ratios within bounds
 * @param consistency       glossary terms and names carried over
 * @param formatting        formatting tags preserved
 * @param readability       reading speed and line length
 * @param entriesEvaluated  number of entries assessed
 * @param entriesWithIssues number of entries with at least one problem
 */
public record QualityScore(
	double overall,
	@Nonnull DimensionScore completeness,
	@Nonnull DimensionScore accuracy,
	@Nonnull DimensionScore consistency,
	@Nonnull DimensionScore formatting,
	@Nonnull DimensionScore readability,
	int entriesEvaluated,
	int entriesWithIssues
) {

	public QualityScore {
		Objects.requireNonNull(completeness, "completeness must not be null");
		Objects.requireNonNull(accuracy, "accuracy must not be null");
		Objects.requireNonNull(consistency, "consistency must not be null");
		Objects.requireNonNull(formatting, "formatting must not be null");
		Objects.requireNonNull(readability, "readability must not be null");
	}

	/**
	 * Combines dimension scores into an overall weighted score.
	 */
	@Nonnull
	public static QualityScore fromDimensions(
		@Nonnull DimensionScore completeness,
		@Nonnull DimensionScore accuracy,
		@Nonnull DimensionScore consistency,
		@Nonnull DimensionScore formatting,
		@Nonnull DimensionScore readability,
		int entriesEvaluated,
		int entriesWithIssues
	) {
		final double totalWeight = completeness.weight() + accuracy.weight() + consistency.weight()
			+ formatting.weight() + readability.weight();
		final double overall = totalWeight > 0
			? (completeness.weighted() + accuracy.weighted() + consistency.weighted()
			+ formatting.weighted() + readability.weighted()) / totalWeight
			: 1.0;
		return new QualityScore(
			overall, completeness, accuracy, consistency, formatting, readability,
			entriesEvaluated, entriesWithIssues
		);
	}

	public boolean meetsThreshold(double threshold) {
		return this.overall >= threshold;
	}

	/**
	 * Returns the name of the lowest scoring dimension.
	 *
	 * @return dimension name
	 */
	@Nonnull
	public String weakestDimension() {
		return Map.of(
				"completeness", this.completeness.score(),
				"accuracy", this.accuracy.score(),
				"consistency", this.consistency.score(),
				"formatting", this.formatting.score(),
				"readability", this.readability.score()
			).entrySet().stream()
			.min(Map.Entry.<String, Double>comparingByValue().thenComparing(Map.Entry.comparingByKey()))
			.map(Map.Entry::getKey)
			.orElse("unknown");
	}

	/**
	 * Letter grade: A from 0.9, B from 0.8, C from 0.7, D from 0.6, F below.
	 *
	 * @return grade letter
	 */
	public char grade() {
		if (this.overall >= 0.9) {
			return 'A';
		} else if (this.overall >= 0.8) {
			return 'B';
		} else if (this.overall >= 0.7) {
			return 'C';
		} else if (this.overall >= 0.6) {
			return 'D';
		}
		return 'F';
	}

	@Nonnull
	public String summary() {
		return String.format(
			Locale.ROOT,
			"Quality: %.1f%% (Grade: %c) - %d entries, %d with issues",
			this.overall * 100.0, grade(), this.entriesEvaluated, this.entriesWithIssues
		);
	}
}
