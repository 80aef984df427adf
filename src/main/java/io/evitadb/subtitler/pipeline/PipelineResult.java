package io.evitadb.subtitler.pipeline;

import io.evitadb.subtitler.quality.ConsistencyReport;
import io.evitadb.subtitler.quality.ErrorKind;
import io.evitadb.subtitler.quality.QualityScore;
import io.evitadb.subtitler.translation.TranslationStats;
import io.evitadb.subtitler.validation.ValidationReport;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Outcome of one pipeline run.
 *
 * @param analysis         analysis result, null when analysis did not run
 * @param translationStats translation counters
 * @param validation       final validation report, null when validation did not run
 * @param quality          multi-dimensional quality score, null when the run failed
 * @param consistency      document-wide consistency report, null when validation did not run
 * @param feedbackCorrected entries improved by corrective feedback rounds
 * @param duration         wall time of the run
 * @param success          whether the run finished
 * @param error            failure message, null on success
 * @param errorKind        failure kind, null on success
 */
public record PipelineResult(
	@Nullable AnalysisResult analysis,
	@Nonnull TranslationStats translationStats,
	@Nullable ValidationReport validation,
	@Nullable QualityScore quality,
	@Nullable ConsistencyReport consistency,
	int feedbackCorrected,
	@Nonnull Duration duration,
	boolean success,
	@Nullable String error,
	@Nullable ErrorKind errorKind
) {

	public PipelineResult {
		Objects.requireNonNull(translationStats, "translationStats must not be null");
		Objects.requireNonNull(duration, "duration must not be null");
	}

	@Nonnull
	public static PipelineResult success(
		@Nullable AnalysisResult analysis,
		@Nonnull TranslationStats translationStats,
		@Nullable ValidationReport validation,
		@Nonnull QualityScore quality,
		@Nullable ConsistencyReport consistency,
		int feedbackCorrected,
		@Nonnull Duration duration
	) {
		return new PipelineResult(
			analysis, translationStats, validation, quality, consistency, feedbackCorrected, duration, true, null, null
		);
	}

	@Nonnull
	public static PipelineResult failure(
		@Nullable AnalysisResult analysis,
		@Nonnull String error,
		@Nonnull ErrorKind errorKind,
		@Nonnull Duration duration
	) {
		return new PipelineResult(
			analysis, TranslationStats.empty(), null, null, null, 0, duration, false,
			Objects.requireNonNull(error, "error must not be null"),
			Objects.requireNonNull(errorKind, "errorKind must not be null")
		);
	}

	/**
	 * Returns the quality score of the validation report.
	 *
	 * @return score between 0 and 1, null when validation did not run
	 */
	@Nullable
	public Double qualityScore() {
		return this.validation == null ? null : this.validation.qualityScore();
	}

	/**
	 * One-line description of the run, parts joined by " | ".
	 *
	 * @return summary
	 */
	@Nonnull
	public String summary() {
		final List<String> parts = new ArrayList<>(7);
		parts.add(String.format(Locale.ROOT, "Duration: %.2fs", this.duration.toMillis() / 1000.0));
		if (this.analysis != null) {
			parts.add("Analysis: " + this.analysis.description());
		}
		parts.add(
			"Translation: " + this.translationStats.entriesTranslated() + " entries in "
				+ this.translationStats.totalBatches() + " batches"
		);
		if (this.validation != null) {
			parts.add(String.format(Locale.ROOT, "Validation: %.1f%% quality score", this.validation.qualityScore() * 100));
		}
		if (this.quality != null) {
			parts.add(this.quality.summary());
		}
		if (this.consistency != null) {
			parts.add(this.consistency.summary());
		}
		if (!this.success && this.error != null) {
			parts.add("Error: " + this.error);
		}
		return String.join(" | ", parts);
	}
}
