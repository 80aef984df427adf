package io.evitadb.subtitler.context;

import io.evitadb.subtitler.model.Glossary;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable view of a document prepared for one translation request.
 *
 * Only the batch must be translated. Recent translations, lookahead, summary and glossary are context.
 * The glossary is a snapshot taken when the window was built.
 *
 * @param position       zero-based position of the first batch entry
 * @param totalEntries   number of entries in the document
 * @param recent         already translated entries directly before the batch
 * @param batch          entries to translate
 * @param lookahead      entries following the batch
 * @param historySummary optional summary of earlier dialogue
 * @param glossary       glossary snapshot
 * @param sourceLanguage source language
 * @param targetLanguage target language
 */
public record ContextWindow(
	int position,
	int totalEntries,
	@Nonnull List<TranslatedContext> recent,
	@Nonnull List<WindowEntry> batch,
	@Nonnull List<WindowEntry> lookahead,
	@Nullable String historySummary,
	@Nonnull Glossary glossary,
	@Nonnull String sourceLanguage,
	@Nonnull String targetLanguage
) {

	public ContextWindow {
		recent = List.copyOf(Objects.requireNonNull(recent, "recent must not be null"));
		batch = List.copyOf(Objects.requireNonNull(batch, "batch must not be null"));
		lookahead = List.copyOf(Objects.requireNonNull(lookahead, "lookahead must not be null"));
		Objects.requireNonNull(glossary, "glossary must not be null");
		Objects.requireNonNull(sourceLanguage, "sourceLanguage must not be null");
		Objects.requireNonNull(targetLanguage, "targetLanguage must not be null");
	}

	/**
	 * Returns true when there is nothing left to translate.
	 *
	 * @return true for an empty batch
	 */
	public boolean isAtEnd() {
		return this.batch.isEmpty();
	}

	/**
	 * Returns the ids of the entries to translate.
	 *
	 * @return batch ids in order
	 */
	@Nonnull
	public List<Integer> batchIds() {
		return this.batch.stream().map(WindowEntry::id).toList();
	}

	/**
	 * Returns how far into the document this window starts.
	 *
	 * @return value between 0 and 100
	 */
	public double progressPercent() {
		if (this.totalEntries == 0) {
			return 100.0;
		}
		return this.position * 100.0 / this.totalEntries;
	}

	/**
	 * Returns the number of entries from the start of this batch to the end of the document.
	 *
	 * @return remaining entries
	 */
	public int remainingEntries() {
		return Math.max(0, this.totalEntries - this.position);
	}

	/**
	 * Returns a copy whose batch keeps only the first {@code maxBatchSize} entries. The entries cut off the batch
	 * are moved to the front of the lookahead.
	 *
	 * @param maxBatchSize new upper bound of the batch, at least 1
	 * @return the shrunk window, or this window when the batch already fits
	 */
	@Nonnull
	public ContextWindow withBatchLimit(int maxBatchSize) {
		if (maxBatchSize < 1) {
			throw new IllegalArgumentException("maxBatchSize must be at least 1");
		}
		if (this.batch.size() <= maxBatchSize) {
			return this;
		}
		final List<WindowEntry> movedToLookahead = new ArrayList<>(this.batch.subList(maxBatchSize, this.batch.size()));
		movedToLookahead.addAll(this.lookahead);
		return new ContextWindow(
			this.position, this.totalEntries, this.recent,
			this.batch.subList(0, maxBatchSize), movedToLookahead,
			this.historySummary, this.glossary, this.sourceLanguage, this.targetLanguage
		);
	}

	/**
	 * Returns true when a history summary should be attached but is missing.
	 *
	 * @param config window configuration
	 * @return true when summarization is enabled, no summary is present and the threshold has been reached
	 */
	public boolean needsSummarization(@Nonnull ContextWindowConfig config) {
		return config.enableSummarization()
			&& this.historySummary == null
			&& this.position >= config.summarizationThreshold();
	}
}
