package io.evitadb.subtitler.model;

import io.evitadb.subtitler.pipeline.PipelineResult;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;

/**
 * Result of translating one job.
 *
 * @param job               the job
 * @param translatedEntries entries to write, renumbered from 1, null if failed
 * @param pipeline          pipeline outcome, null when the pipeline did not run
 * @param success           whether the translation can be written
 * @param errorMessage      failure message, null if successful
 * @param inputTokens       prompt tokens used
 * @param outputTokens      completion tokens used
 */
public record TranslationResult(
	@Nonnull TranslationJob job,
	@Nullable List<SubtitleEntry> translatedEntries,
	@Nullable PipelineResult pipeline,
	boolean success,
	@Nullable String errorMessage,
	long inputTokens,
	long outputTokens
) {

	@Nonnull
	public static TranslationResult success(
		@Nonnull TranslationJob job,
		@Nonnull List<SubtitleEntry> translatedEntries,
		@Nonnull PipelineResult pipeline
	) {
		return new TranslationResult(
			job, List.copyOf(translatedEntries), pipeline, true, null,
			pipeline.translationStats().inputTokens(), pipeline.translationStats().outputTokens()
		);
	}

	/**
	 * Creates a failed result, keeping the pipeline outcome when there is one.
	 */
	@Nonnull
	public static TranslationResult failure(
		@Nonnull TranslationJob job,
		@Nonnull String errorMessage,
		@Nullable PipelineResult pipeline
	) {
		final long input = pipeline == null ? 0 : pipeline.translationStats().inputTokens();
		final long output = pipeline == null ? 0 : pipeline.translationStats().outputTokens();
		return new TranslationResult(job, null, pipeline, false, errorMessage, input, output);
	}

	@Nonnull
	public static TranslationResult failure(@Nonnull TranslationJob job, @Nonnull String errorMessage) {
		return failure(job, errorMessage, null);
	}

	/**
	 * Returns true when the run stopped because translation was cancelled.
	 *
	 * @return true for cancelled runs
	 */
	public boolean isCancelled() {
		return this.pipeline != null && this.pipeline.translationStats().cancelled();
	}

	@Nonnull
	public String getType() {
		return this.job.getType();
	}
}
