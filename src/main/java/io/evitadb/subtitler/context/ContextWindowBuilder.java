package io.evitadb.subtitler.context;

import io.evitadb.subtitler.analysis.HistorySummarizer;
import io.evitadb.subtitler.analysis.HistorySummary;
import io.evitadb.subtitler.model.DocumentEntry;
import io.evitadb.subtitler.model.SubtitleDocument;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds {@link ContextWindow}s over a document.
 *
 * For position `p` the batch is `[p, p + batchSize)`, the lookahead follows the batch and the recent region
 * holds the translated entries among the `recentCount` entries before `p`. All ranges are clipped to the
 * document. When the document has no summary and the position has reached the summarization threshold,
 * an extractive summary of the entries before the recent region is attached.
 */
public final class ContextWindowBuilder {

	@Nonnull
	private final ContextWindowConfig config;
	@Nonnull
	private final HistorySummarizer summarizer;

	public ContextWindowBuilder() {
		this(ContextWindowConfig.defaults());
	}

	public ContextWindowBuilder(@Nonnull ContextWindowConfig config) {
		this(config, new HistorySummarizer());
	}

	public ContextWindowBuilder(@Nonnull ContextWindowConfig config, @Nonnull HistorySummarizer summarizer) {
		this.config = Objects.requireNonNull(config, "config must not be null");
		this.summarizer = Objects.requireNonNull(summarizer, "summarizer must not be null");
	}

	@Nonnull
	public ContextWindowConfig getConfig() {
		return this.config;
	}

	/**
	 * Builds the window starting at the given position using the configured batch size.
	 *
	 * @param document document being translated; its target language must be set
	 * @param position zero-based position of the first batch entry
	 * @return the window
	 */
	@Nonnull
	public ContextWindow build(@Nonnull SubtitleDocument document, int position) {
		return build(document, position, this.config.batchSize());
	}

	/**
	 * Builds the window starting at the given position with an explicit batch size.
	 *
	 * @param document  document being translated; its target language must be set
	 * @param position  zero-based position of the first batch entry
	 * @param batchSize number of entries to translate, at least 1
	 * @return the window; its batch is empty when `position` is at or past the end
	 * @throws IllegalStateException when the document has no target language
	 */
	@Nonnull
	public ContextWindow build(@Nonnull SubtitleDocument document, int position, int batchSize) {
		Objects.requireNonNull(document, "document must not be null");
		if (position < 0) {
			throw new IllegalArgumentException("position must not be negative");
		}
		if (batchSize < 1) {
			throw new IllegalArgumentException("batchSize must be at least 1");
		}
		final String targetLanguage = document.getMetadata().targetLanguage();
		if (targetLanguage == null) {
			throw new IllegalStateException("Document target language must be set before building context windows");
		}

		final List<DocumentEntry> entries = document.getEntries();
		final int total = entries.size();
		final int start = Math.min(position, total);

		final int recentStart = Math.max(0, start - this.config.recentCount());
		final List<TranslatedContext> recent = new ArrayList<>();
		for (int i = recentStart; i < start; i++) {
			final DocumentEntry entry = entries.get(i);
			if (entry.isTranslated()) {
				recent.add(TranslatedContext.from(entry));
			}
		}

		final int batchEnd = Math.min(start + batchSize, total);
		final List<WindowEntry> batch = new ArrayList<>(batchEnd - start);
		for (int i = start; i < batchEnd; i++) {
			batch.add(WindowEntry.from(entries.get(i)));
		}

		final int lookaheadEnd = Math.min(batchEnd + this.config.lookaheadCount(), total);
		final List<WindowEntry> lookahead = new ArrayList<>(lookaheadEnd - batchEnd);
		for (int i = batchEnd; i < lookaheadEnd; i++) {
			lookahead.add(WindowEntry.from(entries.get(i)));
		}

		String summary = document.getContextSummary();
		if (summary == null && this.config.enableSummarization() && start >= this.config.summarizationThreshold()) {
			final HistorySummary history = this.summarizer.summarize(entries.subList(0, recentStart));
			summary = history.isEmpty() ? null : history.text();
		}

		return new ContextWindow(
			start,
			total,
			recent,
			batch,
			lookahead,
			summary,
			document.getGlossary().copy(),
			document.getMetadata().sourceLanguage(),
			targetLanguage
		);
	}
}
