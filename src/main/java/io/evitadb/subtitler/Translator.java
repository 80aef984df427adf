package io.evitadb.subtitler;

import io.evitadb.subtitler.llm.LanguageModelClient;
import io.evitadb.subtitler.llm.PromptLoader;
import io.evitadb.subtitler.model.DocumentMetadata;
import io.evitadb.subtitler.model.SubtitleDocument;
import io.evitadb.subtitler.model.TranslationJob;
import io.evitadb.subtitler.model.TranslationResult;
import io.evitadb.subtitler.pipeline.PipelineConfig;
import io.evitadb.subtitler.pipeline.PipelineResult;
import io.evitadb.subtitler.pipeline.ProgressListener;
import io.evitadb.subtitler.pipeline.TranslationPipeline;
import io.evitadb.subtitler.quality.Sleeper;
import io.evitadb.subtitler.translation.TranslationCache;
import io.evitadb.subtitler.translation.TranslationPassConfig;
import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.function.BooleanSupplier;

/**
 * Translates subtitle jobs asynchronously through a {@link TranslationPipeline}.
 *
 * Each job gets its own pipeline, so jobs running in parallel share only the language model client and the
 * {@link TranslationCache}.
 * Instructions of the job are appended to the configured custom instructions. Translation of a job stops
 * between windows once the cancellation check returns true, e.g. after the client has seen a permanent failure.
 */
public class Translator {

	@Nonnull
	private final LanguageModelClient client;
	@Nonnull
	private final PipelineConfig config;
	@Nonnull
	private final PromptLoader promptLoader;
	@Nonnull
	private final Sleeper sleeper;
	@Nonnull
	private final TranslationCache cache;
	@Nonnull
	private final BooleanSupplier cancellation;
	@Nonnull
	private final Log log;
	@Nullable
	private final Executor executor;

	/**
	 * @param client       language model client shared by all jobs
	 * @param config       pipeline configuration
	 * @param cancellation checked between windows, translation stops when it returns true
	 * @param log          Maven log
	 * @param executor     executor for async work; null to use the common pool
	 */
	public Translator(
		@Nonnull LanguageModelClient client,
		@Nonnull PipelineConfig config,
		@Nonnull BooleanSupplier cancellation,
		@Nonnull Log log,
		@Nullable Executor executor
	) {
		this(client, config, new PromptLoader(), Sleeper.SYSTEM, cancellation, log, executor);
	}

	public Translator(
		@Nonnull LanguageModelClient client,
		@Nonnull PipelineConfig config,
		@Nonnull PromptLoader promptLoader,
		@Nonnull Sleeper sleeper,
		@Nonnull BooleanSupplier cancellation,
		@Nonnull Log log,
		@Nullable Executor executor
	) {
		this(client, config, promptLoader, sleeper, TranslationCache.disabled(), cancellation, log, executor);
	}

	public Translator(
		@Nonnull LanguageModelClient client,
		@Nonnull PipelineConfig config,
		@Nonnull PromptLoader promptLoader,
		@Nonnull Sleeper sleeper,
		@Nonnull TranslationCache cache,
		@Nonnull BooleanSupplier cancellation,
		@Nonnull Log log,
		@Nullable Executor executor
	) {
		this.client = Objects.requireNonNull(client, "client must not be null");
		this.config = Objects.requireNonNull(config, "config must not be null");
		this.promptLoader = Objects.requireNonNull(promptLoader, "promptLoader must not be null");
		this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
		this.cache = Objects.requireNonNull(cache, "cache must not be null");
		this.cancellation = Objects.requireNonNull(cancellation, "cancellation must not be null");
		this.log = Objects.requireNonNull(log, "log must not be null");
		this.executor = executor;
	}

	@Nonnull
	public LanguageModelClient getClient() {
		return this.client;
	}

	@Nonnull
	public TranslationCache getCache() {
		return this.cache;
	}

	@Nonnull
	public CompletionStage<TranslationResult> translate(@Nonnull TranslationJob job) {
		return translate(job, ProgressListener.NONE);
	}

	/**
	 * Translates the job. The returned stage always completes normally; failures are reported as failed results.
	 *
	 * @param job      the job
	 * @param listener pipeline progress listener
	 * @return stage with the result
	 */
	@Nonnull
	public CompletionStage<TranslationResult> translate(@Nonnull TranslationJob job, @Nonnull ProgressListener listener) {
		Objects.requireNonNull(job, "job must not be null");
		Objects.requireNonNull(listener, "listener must not be null");

		final Executor effectiveExecutor = this.executor != null ? this.executor : ForkJoinPool.commonPool();
		return CompletableFuture.supplyAsync(() -> {
			if (this.cancellation.getAsBoolean()) {
				return TranslationResult.failure(job, "Translation cancelled before start");
			}
			try {
				return translateJob(job, listener);
			} catch (RuntimeException e) {
				this.log.debug("Unexpected failure translating " + job.sourceFile(), e);
				return TranslationResult.failure(job, e.getClass().getSimpleName() + ": " + e.getMessage());
			}
		}, effectiveExecutor);
	}

	@Nonnull
	private TranslationResult translateJob(@Nonnull TranslationJob job, @Nonnull ProgressListener listener) {
		final SubtitleDocument document = SubtitleDocument.fromEntries(job.entries(), job.sourceLanguage());
		final DocumentMetadata metadata = document.getMetadata().withSourceFile(job.sourceFile());
		document.setMetadata(metadata);

		final TranslationPipeline pipeline = new TranslationPipeline(
			this.client, configFor(job), this.promptLoader, this.sleeper, this.cache, this.log
		);
		final PipelineResult result = pipeline.translate(document, job.getTargetLanguage(), listener, this.cancellation);
		if (!result.success()) {
			return TranslationResult.failure(job, "Translation failed (" + result.errorKind() + "): " + result.error(), result);
		}
		if (result.translationStats().cancelled()) {
			return TranslationResult.failure(job, "Translation cancelled", result);
		}
		return TranslationResult.success(job, document.toOutputEntries(), result);
	}

	@Nonnull
	private PipelineConfig configFor(@Nonnull TranslationJob job) {
		if (job.instructions() == null || job.instructions().isBlank()) {
			return this.config;
		}
		final TranslationPassConfig translation = this.config.translationConfig();
		final String base = translation.customInstructions();
		final String combined = base == null || base.isBlank()
			? job.instructions()
			: base + "\n\n" + job.instructions();
		return this.config.withTranslationConfig(translation.withInstructions(combined));
	}
}
