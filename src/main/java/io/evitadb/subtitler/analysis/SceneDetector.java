package io.evitadb.subtitler.analysis;

import io.evitadb.subtitler.model.DocumentEntry;
import io.evitadb.subtitler.model.Scene;
import io.evitadb.subtitler.model.SubtitleDocument;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Partitions a document into scenes using timing gaps, a per-scene size cap and speaker changes.
 *
 * The result always covers every entry exactly once, in order. Detection does not modify the entries;
 * {@link #detectAndUpdate(SubtitleDocument)} additionally stores the scenes on the document.
 */
public final class SceneDetector {

	@Nonnull
	private final SceneDetectionConfig config;

	public SceneDetector() {
		this(SceneDetectionConfig.defaults());
	}

	public SceneDetector(@Nonnull SceneDetectionConfig config) {
		this.config = Objects.requireNonNull(config, "config must not be null");
	}

	@Nonnull
	public SceneDetectionConfig getConfig() {
		return this.config;
	}

	/**
	 * Detects scene boundaries.
	 *
	 * @param entries entries in display order
	 * @return contiguous scenes numbered from 1; empty for empty input
	 */
	@Nonnull
	public List<Scene> detectScenes(@Nonnull List<DocumentEntry> entries) {
		Objects.requireNonNull(entries, "entries must not be null");
		if (entries.isEmpty()) {
			return List.of();
		}

		final List<Scene> scenes = new ArrayList<>();
		int sceneStart = 0;
		int sceneId = 1;

		for (int i = 1; i < entries.size(); i++) {
			if (isBoundary(entries.get(i - 1), entries.get(i), i - sceneStart)) {
				scenes.add(Scene.of(sceneId++, entries.get(sceneStart).getId(), entries.get(i - 1).getId()));
				sceneStart = i;
			}
		}
		scenes.add(Scene.of(sceneId, entries.get(sceneStart).getId(), entries.get(entries.size() - 1).getId()));
		return scenes;
	}

	/**
	 * Detects scenes and stores them on the document, assigning scene ids to entries.
	 *
	 * @param document document to update
	 * @return the detected scenes
	 */
	@Nonnull
	public List<Scene> detectAndUpdate(@Nonnull SubtitleDocument document) {
		Objects.requireNonNull(document, "document must not be null");
		final List<Scene> scenes = detectScenes(document.getEntries());
		document.setScenes(scenes);
		return scenes;
	}

	private boolean isBoundary(@Nonnull DocumentEntry previous, @Nonnull DocumentEntry current, int currentSceneLength) {
		if (gapBetween(previous, current) >= this.config.minGapMs()) {
			return true;
		}
		if (currentSceneLength >= this.config.maxEntriesPerScene()) {
			return true;
		}
		if (this.config.detectSpeakerChanges()) {
			final String previousSpeaker = previous.getSpeaker();
			final String currentSpeaker = current.getSpeaker();
			return previousSpeaker != null && currentSpeaker != null && !previousSpeaker.equals(currentSpeaker);
		}
		return false;
	}

	/**
	 * Returns the silence between two consecutive entries; overlapping entries yield zero.
	 *
	 * @param previous earlier entry
	 * @param current  later entry
	 * @return gap in milliseconds, never negative
	 */
	public static long gapBetween(@Nonnull DocumentEntry previous, @Nonnull DocumentEntry current) {
		return Math.max(0, current.getTimecode().startMs() - previous.getTimecode().endMs());
	}

	/**
	 * Returns the positions of the largest silences, largest first.
	 *
	 * @param entries entries in display order
	 * @param count   maximum number of gaps to return, a negative count returns none
	 * @return gaps as (index of the entry after the gap, gap length)
	 */
	@Nonnull
	public static List<Gap> findLargestGaps(@Nonnull List<DocumentEntry> entries, int count) {
		final List<Gap> gaps = new ArrayList<>();
		for (int i = 1; i < entries.size(); i++) {
			gaps.add(new Gap(i, gapBetween(entries.get(i - 1), entries.get(i))));
		}
		gaps.sort(Comparator.comparingLong(Gap::lengthMs).reversed());
		return List.copyOf(gaps.subList(0, Math.max(0, Math.min(count, gaps.size()))));
	}

	/**
	 * Silence preceding the entry at the given position.
	 *
	 * @param index    position of the entry following the gap
	 * @param lengthMs gap length in milliseconds
	 */
	public record Gap(int index, long lengthMs) {
	}
}
