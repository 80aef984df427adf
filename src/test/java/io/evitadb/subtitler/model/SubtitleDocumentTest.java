package io.evitadb.subtitler.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SubtitleDocument should track entries, scenes and translations")
public class SubtitleDocumentTest {

	@Test
	@DisplayName("shouldUseSequenceNumbersAsIdsWhenIncreasing")
	void shouldUseSequenceNumbersAsIdsWhenIncreasing() {
		final SubtitleDocument document = SubtitleDocument.fromEntries(List.of(
			new SubtitleEntry(5, 0, 1_000, "One"),
			new SubtitleEntry(9, 1_000, 2_000, "Two")
		), "en");

		assertEquals(5, document.entryAt(0).getId());
		assertEquals(9, document.entryAt(1).getId());
		assertEquals(1, document.indexOf(9));
		assertEquals(-1, document.indexOf(6));
	}

	@Test
	@DisplayName("shouldNumberByPositionWhenSequenceNumbersRepeat")
	void shouldNumberByPositionWhenSequenceNumbersRepeat() {
		final SubtitleDocument document = SubtitleDocument.fromEntries(List.of(
			new SubtitleEntry(1, 0, 1_000, "One"),
			new SubtitleEntry(1, 1_000, 2_000, "Two"),
			new SubtitleEntry(2, 2_000, 3_000, "Three")
		), "en");

		assertEquals(List.of(1, 2, 3), document.getEntries().stream().map(DocumentEntry::getId).toList());
	}

	@Test
	@DisplayName("shouldRenumberOutputAndKeepTiming")
	void shouldRenumberOutputAndKeepTiming() {
		final SubtitleDocument document = SubtitleDocument.fromEntries(List.of(
			new SubtitleEntry(10, 0, 1_000, "Hello"),
			new SubtitleEntry(20, 1_500, 2_500, "World")
		), "en");
		document.entryAt(0).setTranslation("Ahoj", 0.9);

		final List<SubtitleEntry> output = document.toOutputEntries();

		assertEquals(new SubtitleEntry(1, 0, 1_000, "Ahoj"), output.get(0));
		assertEquals(new SubtitleEntry(2, 1_500, 2_500, "World"), output.get(1));
		assertEquals(50.0, document.translationProgress(), 0.001);
		assertFalse(document.isFullyTranslated());
	}

	@Test
	@DisplayName("shouldAssignSceneIdsToCoveredEntries")
	void shouldAssignSceneIdsToCoveredEntries() {
		final SubtitleDocument document = SubtitleDocument.fromEntries(List.of(
			new SubtitleEntry(1, 0, 1_000, "A"),
			new SubtitleEntry(2, 1_000, 2_000, "B"),
			new SubtitleEntry(3, 9_000, 10_000, "C")
		), "en");

		document.setScenes(List.of(Scene.of(1, 1, 2), Scene.of(2, 3, 3)));

		assertEquals(Integer.valueOf(1), document.entryAt(1).getSceneId());
		assertEquals(Integer.valueOf(2), document.entryAt(2).getSceneId());
		assertEquals(2, document.sceneForEntry(3).orElseThrow().id());
	}

	@Test
	@DisplayName("shouldRejectNonIncreasingIds")
	void shouldRejectNonIncreasingIds() {
		final Timecode timecode = new Timecode(0, 1_000);
		assertThrows(IllegalArgumentException.class, () -> new SubtitleDocument(
			DocumentMetadata.of("en"),
			List.of(new DocumentEntry(2, timecode, "A"), new DocumentEntry(2, timecode, "B"))
		));
	}

	@Test
	@DisplayName("shouldDetectSoundEffects")
	void shouldDetectSoundEffects() {
		assertTrue(DocumentEntry.isSoundEffect("[door slams]"));
		assertTrue(DocumentEntry.isSoundEffect(" (laughing) "));
		assertFalse(DocumentEntry.isSoundEffect("Hello (quietly)"));
	}
}
