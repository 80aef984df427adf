package io.evitadb.subtitler.pipeline;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Snapshot of pipeline progress passed to a {@link ProgressListener}.
 *
 * @param phase            current phase
 * @param phaseProgress    progress within the phase, 0 to 1
 * @param status           human readable status
 * @param entriesProcessed entries processed in the translation phase so far
 * @param totalEntries     entries in the document
 */
public record PipelineProgress(
	@Nonnull PipelinePhase phase,
	double phaseProgress,
	@Nonnull String status,
	int entriesProcessed,
	int totalEntries
) {

	public PipelineProgress {
		Objects.requireNonNull(phase, "phase must not be null");
		Objects.requireNonNull(status, "status must not be null");
	}

	/**
	 * Overall progress, analysis covering the first 10 %, translation the next 80 % and validation the rest.
	 *
	 * @return value between 0 and 1
	 */
	public double overallProgress() {
		return this.phase.overall(this.phaseProgress);
	}
}
