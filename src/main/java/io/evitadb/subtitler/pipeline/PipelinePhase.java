package io.evitadb.subtitler.pipeline;

/**
 * Phases of {@link TranslationPipeline} with their share of the overall progress.
 */
public enum PipelinePhase {

	ANALYSIS(0.0, 0.1),
	TRANSLATION(0.1, 0.8),
	VALIDATION(0.9, 0.1);

	private final double offset;
	private final double weight;

	PipelinePhase(double offset, double weight) {
		this.offset = offset;
		this.weight = weight;
	}

	/**
	 * Maps progress within this phase to overall progress.
	 *
	 * @param phaseProgress value between 0 and 1
	 * @return overall progress between 0 and 1
	 */
	public double overall(double phaseProgress) {
		return this.offset + Math.max(0.0, Math.min(1.0, phaseProgress)) * this.weight;
	}
}
