package io.evitadb.subtitler.translation;

import io.evitadb.subtitler.context.ContextWindow;
import io.evitadb.subtitler.context.ContextWindowBuilder;
import io.evitadb.subtitler.context.DynamicWindowSizer;
import io.evitadb.subtitler.context.WindowEntry;
import io.evitadb.subtitler.llm.CompletionResult;
import io.evitadb.subtitler.llm.LanguageModelClient;
import io.evitadb.subtitler.llm.PromptLoader;
import io.evitadb.subtitler.model.DocumentEntry;
import io.evitadb.subtitler.model.Glossary;
import io.evitadb.subtitler.model.SubtitleDocument;
import io.evitadb.subtitler.quality.ErrorKind;
import io.evitadb.subtitler.quality.RecoveryAction;
import io.evitadb.subtitler.quality.RetryController;
import io.evitadb.subtitler.quality.Sleeper;
import io.evitadb.subtitler.quality.TranslationException;
import org.apache.maven.plugin.logging.Log;
import org.apache.maven.plugin.logging.SystemStreamLog;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.BooleanSupplier;

/**
 * Translates a document window by window.
 *
 * Windows are processed strictly in order: each window is built only after the previous batch has been applied,
 * so that its recent translations and glossary reflect everything translated so far. Every batch goes through a
 * {@link RetryController}; a batch that cannot be translated ends with empty placeholders, a skip or an abort,
 * as the recovery strategy decides. A batch reduced after failures covers only part of its window, the next window
 * starts right after it with the configured batch size.
 *
 * A window whose lines are all in the {@link TranslationCache} is answered from it without a model call; every
 * translation the model returns is stored in the cache.
 */
public final class TranslationPass {

	@Nonnull
	private final LanguageModelClient client;
	@Nonnull
	private final TranslationPassConfig config;
	@Nonnull
	private final TranslationPromptBuilder promptBuilder;
	@Nonnull
	private final ResponseExtractor extractor = new ResponseExtractor();
	@Nonnull
	private final Sleeper sleeper;
	@Nonnull
	private final TranslationCache cache;
	@Nonnull
	private final Log log;

	public TranslationPass(@Nonnull LanguageModelClient client, @Nonnull TranslationPassConfig config) {
		this(client, config, new PromptLoader(), Sleeper.SYSTEM, new SystemStreamLog());
	}

	public TranslationPass(
		@Nonnull LanguageModelClient client,
		@Nonnull TranslationPassConfig config,
		@Nonnull PromptLoader promptLoader,
		@Nonnull Sleeper sleeper,
		@Nonnull Log log
	) {
		this(client, config, promptLoader, sleeper, TranslationCache.disabled(), log);
	}

	public TranslationPass(
		@Nonnull LanguageModelClient client,
		@Nonnull TranslationPassConfig config,
		@Nonnull PromptLoader promptLoader,
		@Nonnull Sleeper sleeper,
		@Nonnull TranslationCache cache,
		@Nonnull Log log
	) {
		this.client = Objects.requireNonNull(client, "client must not be null");
		this.config = Objects.requireNonNull(config, "config must not be null");
		this.promptBuilder = new TranslationPromptBuilder(
			Objects.requireNonNull(promptLoader, "promptLoader must not be null"), config.maxLengthRatio()
		);
		this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
		this.cache = Objects.requireNonNull(cache, "cache must not be null");
		this.log = Objects.requireNonNull(log, "log must not be null");
	}

	@Nonnull
	public TranslationPassConfig getConfig() {
		return this.config;
	}

	@Nonnull
	public TranslationCache getCache() {
		return this.cache;
	}

	/**
	 * Translates the batch of one window, from the cache when it holds every line of the batch.
	 *
	 * @param window the window
	 * @return translations for the batch, possibly incomplete or placeholders
	 * @throws TranslationException when recovery decides to abort
	 */
	@Nonnull
	public BatchResult translateBatch(@Nonnull ContextWindow window) {
		Objects.requireNonNull(window, "window must not be null");
		final Optional<BatchResult> cached = fromCache(window);
		if (cached.isPresent()) {
			return cached.get();
		}
		return translate(window, List.of());
	}

	/**
	 * Translates the batch again, telling the model what was wrong with the previous attempt.
	 *
	 * @param window   the window
	 * @param feedback corrective instructions, at least one
	 * @return translations for the batch
	 * @throws TranslationException when recovery decides to abort
	 */
	@Nonnull
	public BatchResult retranslateWithFeedback(@Nonnull ContextWindow window, @Nonnull List<String> feedback) {
		Objects.requireNonNull(window, "window must not be null");
		Objects.requireNonNull(feedback, "feedback must not be null");
		if (feedback.isEmpty()) {
			throw new IllegalArgumentException("feedback must not be empty");
		}
		return translate(window, List.copyOf(feedback));
	}

	/**
	 * Writes the non-empty translations of the result into the document and merges its glossary updates.
	 *
	 * @param document the document
	 * @param result   the batch result
	 * @return number of entries updated
	 */
	public int applyBatchResult(@Nonnull SubtitleDocument document, @Nonnull BatchResult result) {
		Objects.requireNonNull(document, "document must not be null");
		Objects.requireNonNull(result, "result must not be null");
		int applied = 0;
		for (final TranslatedEntry translation : result.translations()) {
			if (translation.isEmpty()) {
				continue;
			}
			final Optional<DocumentEntry> entry = document.entry(translation.id());
			if (entry.isPresent()) {
				entry.get().setTranslation(translation.translated(), translation.confidence());
				applied++;
			}
		}
		if (!result.glossaryUpdates().isEmpty()) {
			document.mergeGlossary(result.glossaryUpdates());
		}
		return applied;
	}

	/**
	 * Translates the whole document.
	 *
	 * @param document     the document, its metadata must carry the target language
	 * @param listener     notified after each applied batch
	 * @param cancellation checked before each window, translation stops when it returns true
	 * @return counters of the run
	 * @throws TranslationException when recovery decides to abort
	 */
	@Nonnull
	public TranslationStats translateDocument(
		@Nonnull SubtitleDocument document,
		@Nonnull BatchListener listener,
		@Nonnull BooleanSupplier cancellation
	) {
		Objects.requireNonNull(document, "document must not be null");
		Objects.requireNonNull(listener, "listener must not be null");
		Objects.requireNonNull(cancellation, "cancellation must not be null");

		final ContextWindowBuilder windowBuilder = new ContextWindowBuilder(this.config.window());
		final DynamicWindowSizer sizer = this.config.dynamicSizing() == null
			? null : new DynamicWindowSizer(this.config.dynamicSizing());
		final int total = document.size();

		int position = 0;
		int batches = 0;
		int completed = 0;
		int translated = 0;
		int retries = 0;
		int fallbacks = 0;
		int cachedBatches = 0;
		long inputTokens = 0;
		long outputTokens = 0;
		boolean cancelled = false;

		while (position < total) {
			if (cancellation.getAsBoolean()) {
				this.log.warn("Translation cancelled at entry " + position + " of " + total);
				cancelled = true;
				break;
			}
			final ContextWindow window = windowBuilder.build(document, position, batchSize(sizer, document, position));
			if (window.isAtEnd()) {
				break;
			}

			final BatchResult result = translateBatch(window);
			translated += applyBatchResult(document, result);
			batches++;
			if (result.isComplete() && !result.usedFallback()) {
				completed++;
			} else if (!result.usedFallback()) {
				this.log.warn("Batch at entry " + position + " is missing ids " + result.missingIds());
			}
			if (result.usedFallback()) {
				fallbacks++;
			}
			if (result.fromCache()) {
				cachedBatches++;
			}
			retries += result.retriesUsed();
			inputTokens += result.inputTokens();
			outputTokens += result.outputTokens();

			position += result.entryIds().size();
			listener.onBatchApplied(result, position, total);
		}

		return new TranslationStats(
			batches, completed, translated, retries, fallbacks, inputTokens, outputTokens, cancelled, cachedBatches
		);
	}

	private int batchSize(@Nullable DynamicWindowSizer sizer, @Nonnull SubtitleDocument document, int position) {
		return sizer == null ? this.config.window().batchSize() : sizer.calculateOptimalSize(document, position);
	}

	@Nonnull
	private BatchResult translate(@Nonnull ContextWindow window, @Nonnull List<String> feedback) {
		if (window.isAtEnd()) {
			return BatchResult.of(List.of(), List.of());
		}

		final RetryController controller = new RetryController(this.config.recoveryStrategy(), this.sleeper);
		ContextWindow current = window;
		boolean strictJson = false;
		long inputTokens = 0;
		long outputTokens = 0;

		while (true) {
			final List<Integer> ids = current.batchIds();
			controller.beginAttempt();
			try {
				final CompletionResult completion = this.client.complete(
					this.promptBuilder.systemPrompt(current, feedback, strictJson),
					this.promptBuilder.payload(current, this.config.customInstructions(), feedback, strictJson)
				);
				inputTokens += completion.inputTokens();
				outputTokens += completion.outputTokens();

				final TranslationResponse response = this.extractor.parse(completion.text());
				final List<TranslatedEntry> accepted = acceptRequested(response.translations(), ids);
				if (accepted.isEmpty()) {
					throw new TranslationException(
						ErrorKind.INVALID_RESPONSE, "Model returned no translation for entries " + ids
					);
				}
				controller.recordSuccess();
				store(current, accepted);
				final Glossary updates = this.config.acceptGlossaryUpdates()
					? glossaryUpdates(response.glossaryUpdates(), current.glossary())
					: Glossary.empty();
				return new BatchResult(
					accepted, ids, updates, controller.getRetries(), false, response.warnings(), inputTokens, outputTokens,
					false
				);
			} catch (TranslationException e) {
				final RecoveryAction action = controller.recordFailure(e, ids);
				this.log.warn(
					"Batch " + ids.get(0) + "-" + ids.get(ids.size() - 1) + " failed (" + e.getKind() + "): "
						+ e.getMessage() + ", recovery: " + action.description()
				);

				if (action instanceof RecoveryAction.Retry retry) {
					strictJson |= retry.modifiedParams();
				} else if (action instanceof RecoveryAction.ReduceBatchSize reduce) {
					current = current.withBatchLimit(reduce.newSize());
				} else if (action instanceof RecoveryAction.Abort) {
					throw Objects.requireNonNull(controller.getLastError());
				} else if (action instanceof RecoveryAction.Skip || action instanceof RecoveryAction.ContinuePartial) {
					return BatchResult.skipped(ids, controller.getRetries(), action.description())
						.withTokens(inputTokens, outputTokens);
				} else {
					// UseFallback and SwitchProvider; a single client has no provider to switch to
					if (!this.config.useExtractiveFallback()) {
						throw Objects.requireNonNull(controller.getLastError());
					}
					return BatchResult.fallback(ids, controller.getRetries(), action.description())
						.withTokens(inputTokens, outputTokens);
				}
			}
		}
	}

	@Nonnull
	private Optional<BatchResult> fromCache(@Nonnull ContextWindow window) {
		if (!this.cache.isEnabled() || window.isAtEnd()) {
			return Optional.empty();
		}
		final List<TranslatedEntry> translations = new ArrayList<>(window.batch().size());
		for (final WindowEntry entry : window.batch()) {
			final Optional<TranslationCache.CachedTranslation> cached = this.cache.get(
				entry.text(), window.sourceLanguage(), window.targetLanguage()
			);
			if (cached.isEmpty()) {
				return Optional.empty();
			}
			translations.add(new TranslatedEntry(entry.id(), cached.get().translated(), cached.get().confidence()));
		}
		this.log.debug("Batch " + window.batchIds() + " answered from the translation cache");
		return Optional.of(BatchResult.cached(translations, window.batchIds()));
	}

	private void store(@Nonnull ContextWindow window, @Nonnull List<TranslatedEntry> accepted) {
		if (!this.cache.isEnabled()) {
			return;
		}
		final Map<Integer, String> originals = new HashMap<>();
		for (final WindowEntry entry : window.batch()) {
			originals.put(entry.id(), entry.text());
		}
		for (final TranslatedEntry translation : accepted) {
			final String original = originals.get(translation.id());
			if (original != null && !translation.isEmpty()) {
				this.cache.store(
					original, window.sourceLanguage(), window.targetLanguage(), translation.translated(), translation.confidence()
				);
			}
		}
	}

	/**
	 * Keeps the first translation of every requested id and drops everything else.
	 */
	@Nonnull
	private static List<TranslatedEntry> acceptRequested(@Nonnull List<TranslatedEntry> translations, @Nonnull List<Integer> ids) {
		final Set<Integer> requested = new HashSet<>(ids);
		final Map<Integer, TranslatedEntry> byId = new LinkedHashMap<>();
		for (final TranslatedEntry translation : translations) {
			if (requested.contains(translation.id())) {
				byId.putIfAbsent(translation.id(), translation);
			}
		}
		final List<TranslatedEntry> ordered = new ArrayList<>(byId.size());
		for (final Integer id : ids) {
			final TranslatedEntry translation = byId.get(id);
			if (translation != null) {
				ordered.add(translation);
			}
		}
		return ordered;
	}

	/**
	 * Converts suggested updates into a glossary, ignoring suggestions to translate character names.
	 */
	@Nonnull
	private static Glossary glossaryUpdates(@Nonnull Map<String, String> suggested, @Nonnull Glossary known) {
		final Glossary updates = Glossary.empty();
		suggested.forEach((source, target) -> {
			if (!known.getCharacterNames().contains(source)) {
				updates.addTerm(source, target, null);
			}
		});
		return updates;
	}
}
