package io.evitadb.subtitler;

import dev.langchain4j.model.chat.ChatModel;
import io.evitadb.subtitler.check.CheckError;
import io.evitadb.subtitler.check.CheckResult;
import io.evitadb.subtitler.check.SubtitleChecker;
import io.evitadb.subtitler.context.ContextWindowConfig;
import io.evitadb.subtitler.context.DynamicWindowConfig;
import io.evitadb.subtitler.llm.ChatModelFactory;
import io.evitadb.subtitler.llm.LlmClient;
import io.evitadb.subtitler.llm.PromptLoader;
import io.evitadb.subtitler.model.TranslationJob;
import io.evitadb.subtitler.model.TranslationSummary;
import io.evitadb.subtitler.pipeline.PipelineConfig;
import io.evitadb.subtitler.quality.RecoveryStrategy;
import io.evitadb.subtitler.quality.Sleeper;
import io.evitadb.subtitler.session.JsonFileSessionRepository;
import io.evitadb.subtitler.session.SessionRepository;
import io.evitadb.subtitler.translation.TranslationCache;
import io.evitadb.subtitler.translation.TranslationPassConfig;
import org.apache.maven.plugin.AbstractMojo;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.logging.Log;
import org.apache.maven.plugins.annotations.LifecyclePhase;
import org.apache.maven.plugins.annotations.Mojo;
import org.apache.maven.plugins.annotations.Parameter;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;

/**
 * Main Mojo for the subtitler plugin providing actions:
 * - show-config: prints current configuration
 * - translate: finds subtitle files and translates them into every target language
 * - check: verifies that source files parse and existing translations match their sources
 */
@Mojo(name = "run", defaultPhase = LifecyclePhase.NONE, threadSafe = true)
public class SubtitlerMojo extends AbstractMojo {

	static final String PROFILE_DEFAULT = "default";
	static final String PROFILE_FAST = "fast";
	static final String PROFILE_QUALITY = "quality";

	/** Which action to perform: "show-config", "translate" or "check". */
	@Parameter(property = "subtitler.action", defaultValue = "show-config")
	private String action;

	/** LLM provider: "openai", "anthropic" or "ollama". */
	@Parameter(property = "subtitler.llmProvider", defaultValue = "openai")
	private String llmProvider = "openai";

	/** LLM URL, the provider's public endpoint when not set. */
	@Parameter(property = "subtitler.llmUrl")
	private String llmUrl;

	/** LLM token (no default). */
	@Parameter(property = "subtitler.llmToken")
	private String llmToken;

	/** LLM model name, the provider's default model when not set. */
	@Parameter(property = "subtitler.llmModel")
	private String llmModel;

	/** Source directory path - relative to the project root (no default). */
	@Parameter(property = "subtitler.sourceDir")
	private String sourceDir;

	/** Regex to match all files to translate - default (?i).*\.srt (ignore case). */
	@Parameter(property = "subtitler.fileRegex", defaultValue = "(?i).*\\.srt")
	private String fileRegex = "(?i).*\\.srt";

	/** Regexes of directories and files that are never traversed. */
	@Parameter(property = "subtitler.excludedFileRegexes")
	private List<String> excludedFileRegexes;

	/** Language of the source subtitles. */
	@Parameter(property = "subtitler.sourceLanguage", defaultValue = "en")
	private String sourceLanguage = "en";

	/** Collection of target languages (no default). */
	@Parameter(property = "subtitler.targets")
	private List<Target> targets;

	/** Maximum number of files to be translated (default Integer.MAX_VALUE). */
	@Parameter(property = "subtitler.limit", defaultValue = "2147483647")
	private int limit = Integer.MAX_VALUE;

	/** When true, do not write any changes, only simulate. */
	@Parameter(property = "subtitler.dryRun", defaultValue = "true")
	private boolean dryRun = true;

	/** Number of files translated in parallel (default 4). */
	@Parameter(property = "subtitler.parallelism", defaultValue = "4")
	private int parallelism = 4;

	/** Maximum number of requests in flight to the model (default 4). */
	@Parameter(property = "subtitler.maxConcurrentRequests", defaultValue = "4")
	private int maxConcurrentRequests = LlmClient.DEFAULT_MAX_CONCURRENT_REQUESTS;

	/** Minimum delay between two dispatched requests in milliseconds (default 0). */
	@Parameter(property = "subtitler.dispatchDelayMillis", defaultValue = "0")
	private long dispatchDelayMillis = 0;

	/** Pipeline profile: "default", "fast" or "quality". */
	@Parameter(property = "subtitler.profile", defaultValue = "default")
	private String profile = PROFILE_DEFAULT;

	/** Entries translated per request, the profile's value when not set. */
	@Parameter(property = "subtitler.batchSize")
	private Integer batchSize;

	/** Already translated entries sent as context, the profile's value when not set. */
	@Parameter(property = "subtitler.recentCount")
	private Integer recentCount;

	/** Upcoming entries sent as context, the profile's value when not set. */
	@Parameter(property = "subtitler.lookaheadCount")
	private Integer lookaheadCount;

	/** Adapts the batch size to dialogue density and scene changes. */
	@Parameter(property = "subtitler.dynamicSizing", defaultValue = "false")
	private boolean dynamicSizing = false;

	/** Error recovery profile: "default", "aggressive" or "fast-fail", the profile's strategy when not set. */
	@Parameter(property = "subtitler.recoveryProfile")
	private String recoveryProfile;

	/** Additional instructions appended to every translation request. */
	@Parameter(property = "subtitler.instructions")
	private String instructions;

	/** Confidence below which a translation is reported as an issue, the profile's value when not set. */
	@Parameter(property = "subtitler.minConfidence")
	private Double minConfidence;

	/** Number of corrective retranslation rounds after validation, the profile's value when not set. */
	@Parameter(property = "subtitler.feedbackRounds")
	private Integer feedbackRounds;

	/** Lines kept in the translation cache shared by all files of the run, 0 disables the cache. */
	@Parameter(property = "subtitler.cacheMaxEntries", defaultValue = "10000")
	private int cacheMaxEntries = TranslationCache.DEFAULT_MAX_ENTRIES;

	/** Whether calibrated length ratios of known language pairs replace the profile's length bounds. */
	@Parameter(property = "subtitler.languagePairThresholds")
	private Boolean languagePairThresholds;

	/** JSON file recording translation sessions, default .subtitler/sessions.json in the source directory. */
	@Parameter(property = "subtitler.sessionFile")
	private String sessionFile;

	@Override
	public void execute() throws MojoExecutionException {
		if (this.action == null || this.action.isBlank()) {
			this.action = "show-config";
		}
		switch (this.action) {
			case "show-config":
				showConfig(getLog());
				break;
			case "translate":
				translate(getLog());
				break;
			case "check":
				check(getLog());
				break;
			default:
				throw new MojoExecutionException("Unknown action: " + this.action + ". Supported actions: show-config, translate, check");
		}
	}

	private void showConfig(@Nonnull final Log log) {
		log.info("Subtitler Plugin Configuration:");
		log.info(" - llmProvider: " + this.llmProvider);
		log.info(" - llmUrl: " + (isBlank(this.llmUrl) ? "<provider default>" : this.llmUrl));
		log.info(" - llmToken: " + (isBlank(this.llmToken) ? "<not set>" : mask(this.llmToken)));
		if (isBlank(this.llmToken) && !ChatModelFactory.PROVIDER_OLLAMA.equalsIgnoreCase(this.llmProvider)) {
			log.warn("LLM token is not set");
		}
		log.info(" - llmModel: " + (isBlank(this.llmModel) ? "<provider default>" : this.llmModel));
		log.info(" - sourceDir: " + (isBlank(this.sourceDir) ? "<not set>" : this.sourceDir));
		if (isBlank(this.sourceDir)) {
			log.warn("Source directory is not set");
		}
		log.info(" - fileRegex: " + this.fileRegex);
		if (this.excludedFileRegexes != null && !this.excludedFileRegexes.isEmpty()) {
			log.info(" - excludedFileRegexes: " + String.join(", ", this.excludedFileRegexes));
		}
		log.info(" - sourceLanguage: " + this.sourceLanguage);
		if (this.targets == null || this.targets.isEmpty()) {
			log.info(" - targets: <none>");
			log.warn("No target languages configured");
		} else {
			log.info(" - targets:");
			for (final Target t : this.targets) {
				final String locale = t == null ? null : t.getLocale();
				final String tDir = t == null ? null : t.getTargetDir();
				log.info("   - locale: " + (isBlank(locale) ? "<not set>" : locale) +
					", targetDir: " + (isBlank(tDir) ? "<not set>" : tDir));
				if (isBlank(locale)) {
					log.warn("Target locale is not set");
				}
				if (isBlank(tDir)) {
					log.warn("Target directory is not set for locale " + (locale == null ? "<unknown>" : locale));
				}
			}
		}
		log.info(" - limit: " + this.limit);
		log.info(" - dryRun: " + this.dryRun);
		log.info(" - parallelism: " + this.parallelism);
		log.info(" - maxConcurrentRequests: " + this.maxConcurrentRequests);
		log.info(" - dispatchDelayMillis: " + this.dispatchDelayMillis);
		log.info(" - profile: " + this.profile);
		log.info(" - batchSize: " + orProfileDefault(this.batchSize));
		log.info(" - recentCount: " + orProfileDefault(this.recentCount));
		log.info(" - lookaheadCount: " + orProfileDefault(this.lookaheadCount));
		log.info(" - dynamicSizing: " + this.dynamicSizing);
		log.info(" - recoveryProfile: " + orProfileDefault(this.recoveryProfile));
		log.info(" - minConfidence: " + orProfileDefault(this.minConfidence));
		log.info(" - feedbackRounds: " + orProfileDefault(this.feedbackRounds));
		log.info(" - languagePairThresholds: " + orProfileDefault(this.languagePairThresholds));
		log.info(" - cacheMaxEntries: " + (this.cacheMaxEntries == 0 ? "0 (disabled)" : this.cacheMaxEntries));
		log.info(" - sessionFile: " + (isBlank(this.sessionFile) ? "<sourceDir>/" + defaultSessionFile() : this.sessionFile));
	}

	@Nonnull
	private static String mask(@Nullable final String value) {
		if (value == null || value.length() <= 4) {
			return "****";
		}
		return "****" + value.substring(value.length() - 4);
	}

	@Nonnull
	private static String orProfileDefault(@Nullable final Object value) {
		return value == null ? "<profile default>" : value.toString();
	}

	private static boolean isBlank(@Nullable final String value) {
		return value == null || value.isBlank();
	}

	private void translate(@Nonnull final Log log) throws MojoExecutionException {
		// Validate required parameters
		if (isBlank(this.sourceDir)) {
			log.error("Source directory must be specified for translate action");
			return;
		}
		if (this.targets == null || this.targets.isEmpty()) {
			log.error("At least one target must be specified for translate action");
			return;
		}

		// configuration errors fail the build before any file is touched
		if (this.parallelism < 1 || this.maxConcurrentRequests < 1 || this.dispatchDelayMillis < 0 || this.cacheMaxEntries < 0) {
			throw new MojoExecutionException(
				"parallelism and maxConcurrentRequests must be at least 1, dispatchDelayMillis and cacheMaxEntries must not be negative"
			);
		}
		final PipelineConfig pipelineConfig = buildPipelineConfig();
		final String modelName;
		try {
			modelName = isBlank(this.llmModel) ? ChatModelFactory.defaultModel(this.llmProvider) : this.llmModel;
		} catch (IllegalArgumentException ex) {
			throw new MojoExecutionException(ex.getMessage(), ex);
		}

		TranslationExecutor executor = null;
		TranslationCache cache = TranslationCache.disabled();
		try {
			final Path root = Path.of(this.sourceDir).toAbsolutePath().normalize();
			if (!Files.exists(root) || !Files.isDirectory(root)) {
				log.error("Source directory does not exist or is not a directory: " + root);
				return;
			}
			final Pattern pattern = Pattern.compile(this.fileRegex);
			final List<Pattern> exclusions = compileExclusions();
			final SessionRepository sessions = new JsonFileSessionRepository(resolveSessionFile(root));

			// Create translator and executor only for non-dry-run
			LlmClient client = null;
			if (!this.dryRun) {
				final ChatModel chatModel = ChatModelFactory.create(
					this.llmProvider, this.llmUrl, this.llmToken, modelName
				);
				client = new LlmClient(
					chatModel, this.maxConcurrentRequests, Duration.ofMillis(this.dispatchDelayMillis), Sleeper.SYSTEM
				);
				final ExecutorService pool = Executors.newFixedThreadPool(this.parallelism);
				cache = this.cacheMaxEntries == 0 ? TranslationCache.disabled() : new TranslationCache(this.cacheMaxEntries);
				final Translator translator = new Translator(
					client, pipelineConfig, new PromptLoader(), Sleeper.SYSTEM, cache, client::hasPermanentFailure, log, pool
				);
				executor = new TranslationExecutor(pool, translator, new Writer(), sessions, log, root);
			}

			final TranslationOrchestrator orchestrator = new TranslationOrchestrator(
				sessions, root, this.llmProvider, modelName, log
			);
			final AtomicInteger processedCount = new AtomicInteger(0);

			// Process each target locale
			for (final Target target : this.targets) {
				if (target == null || target.getLocale() == null || target.getTargetDir() == null) {
					log.warn("Skipping incomplete target configuration");
					continue;
				}

				final Locale locale = Locale.forLanguageTag(target.getLocale());
				final Path targetDir = Path.of(target.getTargetDir()).toAbsolutePath().normalize();

				log.info("=== Processing target: " + locale.getDisplayName() + " (" + locale.toLanguageTag() + ") -> " + targetDir + " ===");

				// Phase 1: Collect jobs (respects limit)
				final List<TranslationJob> jobs = new ArrayList<>();
				final AtomicInteger newCount = new AtomicInteger(0);
				final AtomicInteger updateCount = new AtomicInteger(0);
				final AtomicInteger retryCount = new AtomicInteger(0);
				final AtomicInteger skippedCount = new AtomicInteger(0);

				final Visitor collectingVisitor = (file, content, fileInstructions) -> {
					if (processedCount.get() >= this.limit) {
						return; // Respect limit
					}

					final Optional<TranslationJob> jobOpt = orchestrator.createJob(
						file, content, targetDir, this.sourceLanguage, locale, fileInstructions
					);
					final Path relativePath = orchestrator.relativize(file);

					if (jobOpt.isPresent()) {
						final TranslationJob job = jobOpt.get();
						jobs.add(job);
						processedCount.incrementAndGet();

						if (this.dryRun) {
							orchestrator.reportJob(job, relativePath);
						}

						switch (job.type()) {
							case NEW -> newCount.incrementAndGet();
							case UPDATE -> updateCount.incrementAndGet();
							case RETRY -> retryCount.incrementAndGet();
						}
					} else {
						// up to date, malformed or empty
						skippedCount.incrementAndGet();
						if (this.dryRun) {
							orchestrator.reportUpToDate(relativePath);
						}
					}
				};

				final Traverser traverser = new Traverser(root, pattern, exclusions, collectingVisitor);
				traverser.traverse();

				// Phase 2: Execute or Report summary
				if (this.dryRun) {
					log.info("--- Dry-run Summary ---");
					log.info("New files: " + newCount.get());
					log.info("Files to update: " + updateCount.get());
					log.info("Files to retry: " + retryCount.get());
					log.info("Skipped: " + skippedCount.get());
				} else {
					log.info("Executing " + jobs.size() + " translations with parallelism " + this.parallelism + "...");
					final TranslationSummary summary = executor.executeAll(jobs);

					log.info("--- Translation Summary ---");
					log.info("Successful: " + summary.successCount());
					log.info("Failed: " + summary.failedCount());
					log.info("Skipped: " + (skippedCount.get() + summary.skippedCount()));
					log.info("Entries translated: " + summary.entriesTranslated());
					log.info("Input tokens: " + summary.inputTokens());
					log.info("Output tokens: " + summary.outputTokens());
					if (cache.isEnabled()) {
						log.info(cache.stats().summary());
					}

					if (client.hasPermanentFailure()) {
						final Exception cause = client.getFailureCause();
						log.error("Translation stopped after a permanent model failure"
							+ (cause == null ? "" : ": " + cause.getMessage()));
						break;
					}
				}
			}
		} catch (final IOException ex) {
			log.error("Failed to execute translate action: " + ex.getMessage(), ex);
		} finally {
			if (executor != null) {
				executor.shutdown();
			}
		}
	}

	/**
	 * Resolves the pipeline profile and applies the individually configured overrides.
	 *
	 * @return the pipeline configuration
	 * @throws MojoExecutionException when a profile is unknown or a value is out of range
	 */
	@Nonnull
	PipelineConfig buildPipelineConfig() throws MojoExecutionException {
		try {
			PipelineConfig config = switch (this.profile == null ? PROFILE_DEFAULT : this.profile.trim().toLowerCase(Locale.ROOT)) {
				case PROFILE_DEFAULT -> PipelineConfig.defaults();
				case PROFILE_FAST -> PipelineConfig.fast();
				case PROFILE_QUALITY -> PipelineConfig.quality();
				default -> throw new IllegalArgumentException(
					"Unknown profile: " + this.profile + ". Supported profiles: "
						+ PROFILE_DEFAULT + ", " + PROFILE_FAST + ", " + PROFILE_QUALITY
				);
			};

			ContextWindowConfig window = config.translationConfig().window();
			if (this.batchSize != null) {
				window = window.withBatchSize(this.batchSize);
			}
			if (this.recentCount != null) {
				window = window.withRecentCount(this.recentCount);
			}
			if (this.lookaheadCount != null) {
				window = window.withLookaheadCount(this.lookaheadCount);
			}

			TranslationPassConfig translation = config.translationConfig().withWindow(window);
			if (!isBlank(this.recoveryProfile)) {
				translation = translation.withRecoveryStrategy(RecoveryStrategy.forProfile(this.recoveryProfile));
			}
			if (this.dynamicSizing && translation.dynamicSizing() == null) {
				translation = translation.withDynamicSizing(DynamicWindowConfig.defaults());
			}
			if (!isBlank(this.instructions)) {
				translation = translation.withInstructions(this.instructions);
			}
			config = config.withTranslationConfig(translation);

			if (this.minConfidence != null) {
				config = config.withValidationConfig(config.validationConfig().withMinConfidence(this.minConfidence));
			}
			if (this.languagePairThresholds != null) {
				config = config.withValidationConfig(
					config.validationConfig().withLanguagePairThresholds(this.languagePairThresholds)
				);
			}
			if (this.feedbackRounds != null) {
				config = config.withFeedbackRounds(this.feedbackRounds);
			}
			return config;
		} catch (IllegalArgumentException ex) {
			throw new MojoExecutionException("Invalid translation configuration: " + ex.getMessage(), ex);
		}
	}

	/**
	 * Executes the check action.
	 * Checks that all matched source files parse and that existing translations match them entry by entry.
	 *
	 * @param log the Maven log
	 * @throws MojoExecutionException if validation fails with errors
	 */
	private void check(@Nonnull final Log log) throws MojoExecutionException {
		// Validate required parameters
		if (isBlank(this.sourceDir)) {
			log.error("Source directory must be specified for check action");
			throw new MojoExecutionException("Source directory not specified");
		}

		try {
			final Path root = Path.of(this.sourceDir).toAbsolutePath().normalize();
			if (!Files.exists(root) || !Files.isDirectory(root)) {
				log.error("Source directory does not exist or is not a directory: " + root);
				throw new MojoExecutionException("Invalid source directory: " + root);
			}
			final Pattern pattern = Pattern.compile(this.fileRegex);

			final List<Path> targetDirs = new ArrayList<>();
			if (this.targets != null) {
				for (final Target target : this.targets) {
					if (target != null && !isBlank(target.getTargetDir())) {
						targetDirs.add(Path.of(target.getTargetDir()).toAbsolutePath().normalize());
					}
				}
			}

			log.info("=== Checking files in: " + root + " ===");

			final SubtitleChecker checker = new SubtitleChecker(root, targetDirs);
			final AtomicInteger fileCount = new AtomicInteger(0);

			final Visitor checkingVisitor = (file, content, fileInstructions) -> {
				checker.checkFile(file, content);
				fileCount.incrementAndGet();
			};

			final Traverser traverser = new Traverser(root, pattern, compileExclusions(), checkingVisitor);
			traverser.traverse();

			final CheckResult result = checker.getResult();

			// Report results
			log.info("Checked " + fileCount.get() + " files");

			if (!result.missingTranslations().isEmpty()) {
				log.info("Missing translations: " + result.missingTranslations().size());
				for (final Path missing : result.missingTranslations()) {
					log.info("  " + missing);
				}
			}

			if (!result.errors().isEmpty()) {
				log.error("Subtitle errors: " + result.errors().size());
				for (final CheckError error : result.errors()) {
					log.error("  " + error.type() + ": " + error.file() + " (" + error.detail() + ")");
				}
			}

			if (!result.isSuccess()) {
				throw new MojoExecutionException(
					"Check failed with " + result.errorCount() + " error(s)"
				);
			}

			log.info("All checks passed!");

		} catch (final IOException ex) {
			throw new MojoExecutionException("Check action failed: " + ex.getMessage(), ex);
		}
	}

	@Nonnull
	private List<Pattern> compileExclusions() {
		if (this.excludedFileRegexes == null) {
			return List.of();
		}
		final List<Pattern> patterns = new ArrayList<>(this.excludedFileRegexes.size());
		for (final String regex : this.excludedFileRegexes) {
			if (!isBlank(regex)) {
				patterns.add(Pattern.compile(regex));
			}
		}
		return patterns;
	}

	@Nonnull
	private Path resolveSessionFile(@Nonnull final Path root) {
		return isBlank(this.sessionFile)
			? root.resolve(defaultSessionFile())
			: Path.of(this.sessionFile).toAbsolutePath().normalize();
	}

	@Nonnull
	private static String defaultSessionFile() {
		return ".subtitler/sessions.json";
	}

	// Setters to aid testing without Maven parameter injection
	void setAction(@Nullable final String action) { this.action = action; }
	void setLlmProvider(@Nullable final String llmProvider) { this.llmProvider = llmProvider; }
	void setLlmUrl(@Nullable final String llmUrl) { this.llmUrl = llmUrl; }
	void setLlmToken(@Nullable final String llmToken) { this.llmToken = llmToken; }
	void setLlmModel(@Nullable final String llmModel) { this.llmModel = llmModel; }
	void setSourceDir(@Nullable final String sourceDir) { this.sourceDir = sourceDir; }
	void setFileRegex(@Nonnull final String fileRegex) { this.fileRegex = fileRegex; }
	void setExcludedFileRegexes(@Nullable final List<String> excludedFileRegexes) { this.excludedFileRegexes = excludedFileRegexes; }
	void setSourceLanguage(@Nonnull final String sourceLanguage) { this.sourceLanguage = sourceLanguage; }
	void setTargets(@Nullable final List<Target> targets) { this.targets = targets; }
	void setLimit(final int limit) { this.limit = limit; }
	void setDryRun(final boolean dryRun) { this.dryRun = dryRun; }
	void setParallelism(final int parallelism) { this.parallelism = parallelism; }
	void setProfile(@Nullable final String profile) { this.profile = profile; }
	void setBatchSize(@Nullable final Integer batchSize) { this.batchSize = batchSize; }
	void setRecoveryProfile(@Nullable final String recoveryProfile) { this.recoveryProfile = recoveryProfile; }
	void setDynamicSizing(final boolean dynamicSizing) { this.dynamicSizing = dynamicSizing; }
	void setInstructions(@Nullable final String instructions) { this.instructions = instructions; }
	void setMinConfidence(@Nullable final Double minConfidence) { this.minConfidence = minConfidence; }
	void setFeedbackRounds(@Nullable final Integer feedbackRounds) { this.feedbackRounds = feedbackRounds; }
	void setSessionFile(@Nullable final String sessionFile) { this.sessionFile = sessionFile; }
	void setCacheMaxEntries(final int cacheMaxEntries) { this.cacheMaxEntries = cacheMaxEntries; }
	void setLanguagePairThresholds(@Nullable final Boolean languagePairThresholds) { this.languagePairThresholds = languagePairThresholds; }

	/** Target language configuration. */
	public static class Target {
		@Parameter
		private String locale;
		@Parameter
		private String targetDir;

		public Target() {}

		public Target(@Nullable final String locale, @Nullable final String targetDir) {
			this.locale = locale;
			this.targetDir = targetDir;
		}

		@Nullable
		public String getLocale() { return this.locale; }

		@Nullable
		public String getTargetDir() { return this.targetDir; }

		public void setLocale(@Nullable final String locale) { this.locale = locale; }

		public void setTargetDir(@Nullable final String targetDir) { this.targetDir = targetDir; }
	}
}
