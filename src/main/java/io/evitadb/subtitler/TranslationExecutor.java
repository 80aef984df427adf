package io.evitadb.subtitler;

import io.evitadb.subtitler.model.TranslationJob;
import io.evitadb.subtitler.model.TranslationResult;
import io.evitadb.subtitler.model.TranslationSummary;
import io.evitadb.subtitler.pipeline.PipelinePhase;
import io.evitadb.subtitler.pipeline.PipelineResult;
import io.evitadb.subtitler.session.SessionRepository;
import io.evitadb.subtitler.session.TranslationSession;
import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executes translation jobs in parallel on a thread pool.
 * Writes successful translations, records every run in the session repository and collects summary statistics.
 */
public final class TranslationExecutor {

	private static final long SHUTDOWN_TIMEOUT_SECONDS = 60;

	private final ExecutorService executor;
	private final Translator translator;
	private final Writer writer;
	private final SessionRepository sessions;
	private final Log log;
	private final Path sourceDir;

	/**
	 * @param executor   pool the translator runs its jobs on, shut down by {@link #shutdown()}
	 * @param translator the translator
	 * @param writer     the writer for output files
	 * @param sessions   repository recording each run
	 * @param log        Maven log for output
	 * @param sourceDir  the source root directory for relative path calculation
	 */
	public TranslationExecutor(
		@Nonnull ExecutorService executor,
		@Nonnull Translator translator,
		@Nonnull Writer writer,
		@Nonnull SessionRepository sessions,
		@Nonnull Log log,
		@Nonnull Path sourceDir
	) {
		this.executor = Objects.requireNonNull(executor, "executor must not be null");
		this.translator = Objects.requireNonNull(translator, "translator must not be null");
		this.writer = Objects.requireNonNull(writer, "writer must not be null");
		this.sessions = Objects.requireNonNull(sessions, "sessions must not be null");
		this.log = Objects.requireNonNull(log, "log must not be null");
		this.sourceDir = Objects.requireNonNull(sourceDir, "sourceDir must not be null").toAbsolutePath().normalize();
	}

	/**
	 * Executes all jobs and returns a summary. Individual failures do not stop other jobs.
	 *
	 * @param jobs the jobs to execute
	 * @return summary with success and failure counts and token usage
	 */
	@Nonnull
	public TranslationSummary executeAll(@Nonnull List<TranslationJob> jobs) {
		Objects.requireNonNull(jobs, "jobs must not be null");

		if (jobs.isEmpty()) {
			return TranslationSummary.empty();
		}

		final AtomicInteger finished = new AtomicInteger(0);
		final List<CompletableFuture<TranslationSummary>> futures = new ArrayList<>(jobs.size());
		for (final TranslationJob job : jobs) {
			final Path relativePath = relativize(job.sourceFile());
			final TranslationSession session = this.sessions.create(
				job.sessionKey(), relativePath.toString(), job.entries().size()
			);
			final CompletableFuture<TranslationSummary> future = this.translator
				.translate(job, progress -> {
					if (progress.phase() == PipelinePhase.TRANSLATION) {
						this.sessions.updateProgress(session.id(), progress.entriesProcessed());
					}
				})
				.toCompletableFuture()
				.thenApply(result -> {
					final TranslationSummary outcome = processResult(result, session);
					this.log.info("Progress: " + finished.incrementAndGet() + "/" + jobs.size() + " files");
					return outcome;
				});
			futures.add(future);
		}

		TranslationSummary summary = TranslationSummary.empty();
		for (final CompletableFuture<TranslationSummary> future : futures) {
			try {
				summary = summary.add(future.join());
			} catch (CompletionException e) {
				this.log.error("Failed to get translation result: " + e.getMessage(), e);
				summary = summary.withFailure();
			}
		}
		return summary;
	}

	/**
	 * Writes a successful translation, updates its session and returns the contribution to the summary.
	 */
	@Nonnull
	private TranslationSummary processResult(@Nonnull TranslationResult result, @Nonnull TranslationSession session) {
		final TranslationJob job = result.job();
		final Path relativePath = relativize(job.sourceFile());
		final String tag = "[" + job.getType() + "] ";

		if (result.success()) {
			try {
				this.writer.write(Objects.requireNonNull(result.translatedEntries()), job.targetFile());
			} catch (IOException e) {
				this.log.error(tag + "Failed to write " + job.targetFile() + ": " + e.getMessage(), e);
				this.sessions.markFailed(session.id(), "Write failed: " + e.getMessage());
				return TranslationSummary.empty().withFailure(result.inputTokens(), result.outputTokens());
			}
			this.sessions.markComplete(session.id());
			final PipelineResult pipeline = Objects.requireNonNull(result.pipeline());
			this.log.info(tag + "Translated: " + relativePath + " -> " + job.targetFile() + " (" + pipeline.summary() + ")");
			if (pipeline.validation() != null && !pipeline.validation().passed()) {
				this.log.warn(
					tag + relativePath + " has " + pipeline.validation().criticalIssues().size()
						+ " critical issues in " + job.getTargetLanguage()
				);
			}
			return TranslationSummary.empty().withSuccess(
				pipeline.translationStats().entriesTranslated(), result.inputTokens(), result.outputTokens()
			);
		}

		if (result.isCancelled()) {
			this.sessions.markPaused(session.id());
		} else {
			this.sessions.markFailed(session.id(), String.valueOf(result.errorMessage()));
		}
		this.log.error(tag + "Translation failed for " + relativePath + " (" + job.getTargetLanguage() + "): " + result.errorMessage());
		return TranslationSummary.empty().withFailure(result.inputTokens(), result.outputTokens());
	}

	@Nonnull
	private Path relativize(@Nonnull Path file) {
		return this.sourceDir.relativize(file.toAbsolutePath().normalize());
	}

	/**
	 * Shuts down the executor gracefully, waiting for pending tasks to complete.
	 */
	public void shutdown() {
		this.executor.shutdown();
		try {
			if (!this.executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
				this.log.warn("Executor did not terminate in time, forcing shutdown");
				this.executor.shutdownNow();
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			this.executor.shutdownNow();
		}
	}
}
