package io.evitadb.subtitler.pipeline;

import io.evitadb.subtitler.context.ContextWindow;
import io.evitadb.subtitler.context.ContextWindowBuilder;
import io.evitadb.subtitler.llm.LanguageModelClient;
import io.evitadb.subtitler.llm.PromptLoader;
import io.evitadb.subtitler.model.SubtitleDocument;
import io.evitadb.subtitler.quality.ConsistencyChecker;
import io.evitadb.subtitler.quality.ConsistencyReport;
import io.evitadb.subtitler.quality.QualityMetrics;
import io.evitadb.subtitler.quality.QualityScore;
import io.evitadb.subtitler.quality.Sleeper;
import io.evitadb.subtitler.quality.StyleIssue;
import io.evitadb.subtitler.quality.TranslationException;
import io.evitadb.subtitler.translation.BatchResult;
import io.evitadb.subtitler.translation.TranslationCache;
import io.evitadb.subtitler.translation.TranslationPass;
import io.evitadb.subtitler.translation.TranslationStats;
import io.evitadb.subtitler.validation.FeedbackInstruction;
import io.evitadb.subtitler.validation.ValidationIssue;
import io.evitadb.subtitler.validation.ValidationPass;
import io.evitadb.subtitler.validation.ValidationReport;
import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.BooleanSupplier;

/**
 * Runs the three translation phases over one document: analysis, windowed translation and validation with repair.
 *
 * When feedback rounds are configured, entries that still have issues after repair are translated once more,
 * one entry at a time, with corrective instructions derived from their issues. The run ends with a
 * {@link QualityScore} of the document and, when validation ran, a {@link ConsistencyReport} comparing its lines
 * with each other. A {@link TranslationException} that recovery could not handle ends
 * the run with a failed {@link PipelineResult} instead of propagating.
 */
public final class TranslationPipeline {

	@Nonnull
	private final PipelineConfig config;
	@Nonnull
	private final AnalysisPass analysisPass;
	@Nonnull
	private final TranslationPass translationPass;
	@Nonnull
	private final ValidationPass validationPass;
	@Nonnull
	private final QualityMetrics qualityMetrics;
	@Nonnull
	private final ConsistencyChecker consistencyChecker;
	@Nonnull
	private final Log log;

	public TranslationPipeline(@Nonnull LanguageModelClient client, @Nonnull PipelineConfig config, @Nonnull Log log) {
		this(client, config, new PromptLoader(), Sleeper.SYSTEM, log);
	}

	public TranslationPipeline(
		@Nonnull LanguageModelClient client,
		@Nonnull PipelineConfig config,
		@Nonnull PromptLoader promptLoader,
		@Nonnull Sleeper sleeper,
		@Nonnull Log log
	) {
		this(client, config, promptLoader, sleeper, TranslationCache.disabled(), log);
	}

	/**
	 * Creates a pipeline whose translation pass shares the given cache with other pipelines of the run.
	 */
	public TranslationPipeline(
		@Nonnull LanguageModelClient client,
		@Nonnull PipelineConfig config,
		@Nonnull PromptLoader promptLoader,
		@Nonnull Sleeper sleeper,
		@Nonnull TranslationCache cache,
		@Nonnull Log log
	) {
		this(config, new TranslationPass(client, config.translationConfig(), promptLoader, sleeper, cache, log),
			new ValidationPass(config.validationConfig()), log);
	}

	/**
	 * Creates a pipeline over already constructed passes, e.g. a validation pass with a semantic signal.
	 */
	public TranslationPipeline(
		@Nonnull PipelineConfig config,
		@Nonnull TranslationPass translationPass,
		@Nonnull ValidationPass validationPass,
		@Nonnull Log log
	) {
		this.config = Objects.requireNonNull(config, "config must not be null");
		this.translationPass = Objects.requireNonNull(translationPass, "translationPass must not be null");
		this.validationPass = Objects.requireNonNull(validationPass, "validationPass must not be null");
		this.log = Objects.requireNonNull(log, "log must not be null");
		this.analysisPass = new AnalysisPass(config.analysisConfig());
		this.qualityMetrics = new QualityMetrics(config.qualityThresholds());
		this.consistencyChecker = new ConsistencyChecker();
	}

	@Nonnull
	public PipelineConfig getConfig() {
		return this.config;
	}

	/**
	 * Translates the document in place.
	 *
	 * @param document       the document
	 * @param targetLanguage language to translate into
	 * @param listener       progress listener
	 * @param cancellation   checked between windows
	 * @return outcome of the run
	 */
	@Nonnull
	public PipelineResult translate(
		@Nonnull SubtitleDocument document,
		@Nonnull String targetLanguage,
		@Nonnull ProgressListener listener,
		@Nonnull BooleanSupplier cancellation
	) {
		Objects.requireNonNull(document, "document must not be null");
		Objects.requireNonNull(targetLanguage, "targetLanguage must not be null");
		Objects.requireNonNull(listener, "listener must not be null");
		Objects.requireNonNull(cancellation, "cancellation must not be null");

		final long start = System.nanoTime();
		final int total = document.size();
		document.setMetadata(document.getMetadata().withTargetLanguage(targetLanguage));

		AnalysisResult analysis = null;
		try {
			if (this.config.enableAnalysis()) {
				listener.onProgress(new PipelineProgress(PipelinePhase.ANALYSIS, 0.0, "Analyzing document...", 0, total));
				analysis = this.analysisPass.analyzeAndUpdate(document);
				this.log.info("[ANALYSIS] " + analysis.description());
				listener.onProgress(new PipelineProgress(PipelinePhase.ANALYSIS, 1.0, analysis.description(), 0, total));
			}

			listener.onProgress(new PipelineProgress(PipelinePhase.TRANSLATION, 0.0, "Translating...", 0, total));
			final TranslationStats stats = this.translationPass.translateDocument(
				document,
				(result, processed, all) -> listener.onProgress(new PipelineProgress(
					PipelinePhase.TRANSLATION, all == 0 ? 1.0 : (double) processed / all,
					"Translated " + processed + " of " + all + " entries", processed, all
				)),
				cancellation
			);
			this.log.info("[TRANSLATION] " + stats.summary());

			ValidationReport report = null;
			ConsistencyReport consistency = null;
			int corrected = 0;
			if (this.config.enableValidation() && !stats.cancelled()) {
				listener.onProgress(new PipelineProgress(PipelinePhase.VALIDATION, 0.0, "Validating translations...", total, total));
				report = this.validationPass.validateAndRepair(document);
				for (int round = 1; round <= this.config.feedbackRounds() && !report.issues().isEmpty(); round++) {
					if (cancellation.getAsBoolean()) {
						break;
					}
					final int improved = retranslateWithFeedback(document, report);
					this.log.info(
						"[FEEDBACK " + round + "/" + this.config.feedbackRounds() + "] " + improved + " entries retranslated"
					);
					if (improved == 0) {
						break;
					}
					corrected += improved;
					report = this.validationPass.validateAndRepair(document);
				}
				this.log.info("[VALIDATION] " + report.summary());
				consistency = this.consistencyChecker.check(document);
				this.log.info("[CONSISTENCY] " + consistency.summary());
				for (final StyleIssue issue : consistency.issuesBySeverity()) {
					this.log.debug("[CONSISTENCY] " + issue.description());
				}
				listener.onProgress(new PipelineProgress(PipelinePhase.VALIDATION, 1.0, report.summary(), total, total));
			}

			final QualityScore quality = this.qualityMetrics.evaluate(document);
			return PipelineResult.success(analysis, stats, report, quality, consistency, corrected, elapsed(start));
		} catch (TranslationException e) {
			this.log.error("Translation pipeline failed (" + e.getKind() + "): " + e.getMessage(), e);
			return PipelineResult.failure(analysis, e.getMessage(), e.getKind(), elapsed(start));
		}
	}

	/**
	 * Sends every entry with remaining issues back to the model with instructions built from those issues.
	 * A failed corrective request keeps the previous translation and leaves its issues in the report.
	 *
	 * @return number of entries that received a new translation
	 */
	private int retranslateWithFeedback(@Nonnull SubtitleDocument document, @Nonnull ValidationReport report) {
		final Map<Integer, List<String>> feedbackByEntry = new TreeMap<>();
		for (final ValidationIssue issue : report.issues()) {
			feedbackByEntry.computeIfAbsent(issue.entryId(), id -> new ArrayList<>())
				.add(FeedbackInstruction.from(issue).render());
		}

		final ContextWindowBuilder windowBuilder = new ContextWindowBuilder(this.config.translationConfig().window());
		int improved = 0;
		for (final Map.Entry<Integer, List<String>> entry : feedbackByEntry.entrySet()) {
			final int index = document.indexOf(entry.getKey());
			if (index < 0) {
				continue;
			}
			final ContextWindow window = windowBuilder.build(document, index, 1);
			final BatchResult result = retranslate(window, entry.getValue());
			if (result != null) {
				improved += this.translationPass.applyBatchResult(document, result);
			}
		}
		return improved;
	}

	@Nullable
	private BatchResult retranslate(@Nonnull ContextWindow window, @Nonnull List<String> feedback) {
		try {
			return this.translationPass.retranslateWithFeedback(window, feedback);
		} catch (TranslationException e) {
			if (e.getKind().isFatal()) {
				throw e;
			}
			this.log.warn("Corrective translation of entries " + window.batchIds() + " failed, keeping the previous translation: " + e.getMessage());
			return null;
		}
	}

	@Nonnull
	private static Duration elapsed(long startNanos) {
		return Duration.ofNanos(System.nanoTime() - startNanos);
	}
}
