package io.evitadb.subtitler.analysis;

import io.evitadb.subtitler.model.DocumentEntry;
import io.evitadb.subtitler.model.Scene;
import io.evitadb.subtitler.model.SubtitleDocument;
import io.evitadb.subtitler.model.SubtitleEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SceneDetector should split documents at long silences, size caps and speaker changes")
public class SceneDetectorTest {

	@Test
	@DisplayName("shouldSplitAtLongGap")
	void shouldSplitAtLongGap() {
		final SubtitleDocument document = documentWithGaps(100, 100, 5000, 100);

		final List<Scene> scenes = new SceneDetector().detectAndUpdate(document);

		assertEquals(List.of(Scene.of(1, 1, 3), Scene.of(2, 4, 5)), scenes);
		assertEquals(Integer.valueOf(2), document.entryAt(3).getSceneId());
		assertEquals(scenes, document.getScenes());
	}

	@Test
	@DisplayName("shouldProduceSingleSceneWithoutGaps")
	void shouldProduceSingleSceneWithoutGaps() {
		final List<Scene> scenes = new SceneDetector().detectScenes(documentWithGaps(0, 200, 10).getEntries());

		assertEquals(List.of(Scene.of(1, 1, 4)), scenes);
	}

	@Test
	@DisplayName("shouldCapSceneLength")
	void shouldCapSceneLength() {
		final SceneDetector detector = new SceneDetector(SceneDetectionConfig.defaults().withMaxEntriesPerScene(2));

		final List<Scene> scenes = detector.detectScenes(documentWithGaps(10, 10, 10, 10).getEntries());

		assertEquals(3, scenes.size());
		assertEquals(Scene.of(3, 5, 5), scenes.get(2));
	}

	@Test
	@DisplayName("shouldSplitOnSpeakerChangeOnlyWhenEnabled")
	void shouldSplitOnSpeakerChangeOnlyWhenEnabled() {
		final SubtitleDocument document = documentWithGaps(10, 10);
		document.entryAt(0).setSpeaker("ANNA");
		document.entryAt(1).setSpeaker("ANNA");
		document.entryAt(2).setSpeaker("BORIS");

		assertEquals(2, new SceneDetector().detectScenes(document.getEntries()).size());
		assertEquals(1, new SceneDetector(SceneDetectionConfig.shortForm()).detectScenes(document.getEntries()).size());
	}

	@Test
	@DisplayName("shouldCoverEveryEntryExactlyOnce")
	void shouldCoverEveryEntryExactlyOnce() {
		final SubtitleDocument document = documentWithGaps(4000, 10, 3500, 3000, 10, 2999);

		final List<Scene> scenes = new SceneDetector().detectScenes(document.getEntries());

		int expectedStart = 1;
		for (final Scene scene : scenes) {
			assertEquals(expectedStart, scene.startEntryId());
			expectedStart = scene.endEntryId() + 1;
		}
		assertEquals(document.size() + 1, expectedStart);
		assertEquals(4, scenes.size());
	}

	@Test
	@DisplayName("shouldReturnNoScenesForEmptyInput")
	void shouldReturnNoScenesForEmptyInput() {
		assertTrue(new SceneDetector().detectScenes(List.of()).isEmpty());
	}

	@Test
	@DisplayName("shouldTreatOverlapAsNoGapAndRankLargestGaps")
	void shouldTreatOverlapAsNoGapAndRankLargestGaps() {
		final List<DocumentEntry> entries = SubtitleDocument.fromEntries(List.of(
			new SubtitleEntry(1, 0, 2_000, "A"),
			new SubtitleEntry(2, 1_500, 3_000, "B"),
			new SubtitleEntry(3, 4_000, 5_000, "C"),
			new SubtitleEntry(4, 9_000, 10_000, "D")
		), "en").getEntries();

		assertEquals(0, SceneDetector.gapBetween(entries.get(0), entries.get(1)));
		final List<SceneDetector.Gap> gaps = SceneDetector.findLargestGaps(entries, 2);
		assertEquals(new SceneDetector.Gap(3, 4_000), gaps.get(0));
		assertEquals(new SceneDetector.Gap(2, 1_000), gaps.get(1));
	}

	@Test
	@DisplayName("shouldReturnNoGapsForNonPositiveCount")
	void shouldReturnNoGapsForNonPositiveCount() {
		final List<DocumentEntry> entries = documentWithGaps(100, 5_000, 300).getEntries();

		assertTrue(SceneDetector.findLargestGaps(entries, 0).isEmpty());
		assertTrue(SceneDetector.findLargestGaps(entries, -1).isEmpty());
		assertEquals(3, SceneDetector.findLargestGaps(entries, 10).size());
	}

	@Test
	@DisplayName("shouldNeverFindMoreScenesWithHigherGapThreshold")
	void shouldNeverFindMoreScenesWithHigherGapThreshold() {
		final Random random = new Random(7);
		final long[] thresholds = {1, 250, 1_000, 2_000, 3_000, 4_500, 6_000, 60_000};
		for (int run = 0; run < 25; run++) {
			final long[] gaps = new long[5 + random.nextInt(40)];
			for (int i = 0; i < gaps.length; i++) {
				gaps[i] = random.nextInt(7_000);
			}
			final List<DocumentEntry> entries = documentWithGaps(gaps).getEntries();

			int previous = Integer.MAX_VALUE;
			for (final long threshold : thresholds) {
				final SceneDetectionConfig config = SceneDetectionConfig.defaults()
					.withMinGapMs(threshold)
					.withMaxEntriesPerScene(8);
				final int scenes = new SceneDetector(config).detectScenes(entries).size();
				assertTrue(scenes <= previous, "threshold " + threshold + " found " + scenes + " scenes after " + previous);
				previous = scenes;
			}
			assertEquals((gaps.length + 1 + 7) / 8, previous);
		}
	}

	/**
	 * Builds a document of one-second entries separated by the given silences.
	 */
	static SubtitleDocument documentWithGaps(long... gaps) {
		final List<SubtitleEntry> entries = new ArrayList<>();
		long start = 0;
		entries.add(new SubtitleEntry(1, start, start + 1_000, "Line 1"));
		for (int i = 0; i < gaps.length; i++) {
			start = start + 1_000 + gaps[i];
			entries.add(new SubtitleEntry(i + 2, start, start + 1_000, "Line " + (i + 2)));
		}
		return SubtitleDocument.fromEntries(entries, "en");
	}
}
