package io.evitadb.subtitler.context;

import io.evitadb.subtitler.model.DocumentEntry;
import io.evitadb.subtitler.model.Scene;
import io.evitadb.subtitler.model.SubtitleDocument;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Chooses batch sizes from text length and scene structure.
 *
 * The complexity size packs entries until the estimated token budget is reached. When scenes are known the
 * batch is then aligned to the end of the current scene if that end is reasonably close. The result is always
 * within `[minBatchSize, maxBatchSize]` and never exceeds the number of remaining entries.
 */
public final class DynamicWindowSizer {

	private static final int CHARS_PER_TOKEN = 4;

	@Nonnull
	private final DynamicWindowConfig config;

	public DynamicWindowSizer() {
		this(DynamicWindowConfig.defaults());
	}

	public DynamicWindowSizer(@Nonnull DynamicWindowConfig config) {
		this.config = Objects.requireNonNull(config, "config must not be null");
	}

	@Nonnull
	public DynamicWindowConfig getConfig() {
		return this.config;
	}

	/**
	 * Rough token estimate: one token per four characters, rounded up.
	 *
	 * @param text text to measure
	 * @return estimated tokens
	 */
	public static int estimateTokens(@Nonnull String text) {
		final int chars = text.codePointCount(0, text.length());
		return (chars + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
	}

	/**
	 * Calculates the batch size for a window starting at the given position.
	 *
	 * @param document document being translated
	 * @param position zero-based start position
	 * @return batch size, 0 when the position is at or past the end
	 */
	public int calculateOptimalSize(@Nonnull SubtitleDocument document, int position) {
		Objects.requireNonNull(document, "document must not be null");
		final List<DocumentEntry> entries = document.getEntries();
		if (position >= entries.size()) {
			return 0;
		}
		final int remaining = entries.size() - position;
		int size = sizeByComplexity(entries, position);

		if (this.config.respectSceneBoundaries() && !document.getScenes().isEmpty()) {
			size = adjustForScenes(document, position, size, remaining);
		}

		return Math.min(Math.min(Math.max(size, this.config.minBatchSize()), this.config.maxBatchSize()), remaining);
	}

	private int sizeByComplexity(@Nonnull List<DocumentEntry> entries, int position) {
		int tokens = 0;
		int count = 0;
		final int limit = Math.min(entries.size(), position + this.config.maxBatchSize());
		for (int i = position; i < limit; i++) {
			final int entryTokens = estimateTokens(entries.get(i).getOriginalText());
			if (tokens + entryTokens > this.config.targetTokens() && count >= this.config.minBatchSize()) {
				break;
			}
			tokens += entryTokens;
			count++;
		}
		return Math.max(count, this.config.minBatchSize());
	}

	private int adjustForScenes(@Nonnull SubtitleDocument document, int position, int initialSize, int remaining) {
		final Optional<Scene> current = document.sceneForEntry(document.entryAt(position).getId());
		if (current.isEmpty()) {
			return initialSize;
		}
		final int sceneStart = document.indexOf(current.get().startEntryId());
		final int sceneEnd = document.indexOf(current.get().endEntryId());
		if (sceneStart < 0 || sceneEnd < 0) {
			return initialSize;
		}

		final int toSceneEnd = sceneEnd - position + 1;
		if (toSceneEnd >= this.config.minBatchSize() && toSceneEnd <= this.config.maxBatchSize()) {
			return Math.min(toSceneEnd, remaining);
		}

		// the complexity size would cut the scene; extend to its end when it is close enough
		final int endPosition = position + initialSize;
		if (endPosition > sceneStart && endPosition <= sceneEnd
			&& toSceneEnd <= (int) (this.config.maxBatchSize() * this.config.lookaheadFactor())) {
			return Math.min(Math.min(toSceneEnd, remaining), this.config.maxBatchSize());
		}
		return initialSize;
	}

	/**
	 * Calculates the lookahead size after a batch, extending up to the end of the scene the lookahead starts in
	 * but never beyond twice the base lookahead.
	 *
	 * @param document      document being translated
	 * @param batchEnd      position right after the batch
	 * @param baseLookahead configured lookahead
	 * @return lookahead size, 0 when nothing follows the batch
	 */
	public int calculateLookahead(@Nonnull SubtitleDocument document, int batchEnd, int baseLookahead) {
		Objects.requireNonNull(document, "document must not be null");
		if (batchEnd >= document.size()) {
			return 0;
		}
		final int remaining = document.size() - batchEnd;
		if (!this.config.respectSceneBoundaries()) {
			return Math.min(baseLookahead, remaining);
		}
		final Optional<Scene> scene = document.sceneForEntry(document.entryAt(batchEnd).getId());
		if (scene.isPresent()) {
			final int sceneEnd = document.indexOf(scene.get().endEntryId());
			final int toSceneEnd = sceneEnd - batchEnd + 1;
			return Math.min(Math.min(toSceneEnd, remaining), baseLookahead * 2);
		}
		return Math.min(baseLookahead, remaining);
	}
}
