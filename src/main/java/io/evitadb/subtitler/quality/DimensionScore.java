package io.evitadb.subtitler.quality;

import javax.annotation.Nonnull;

/**
 * Score of one quality dimension.
 *
 * @param score  value in [0, 1]
 * @param weight contribution to the overall score
 * @param issues number of problems found in this dimension
 */
public record DimensionScore(double score, double weight, int issues) {

	public DimensionScore {
		score = Math.max(0.0, Math.min(1.0, score));
	}

	@Nonnull
	public static DimensionScore perfect(double weight) {
		return new DimensionScore(1.0, weight, 0);
	}

	public double weighted() {
		return this.score * this.weight;
	}
}
