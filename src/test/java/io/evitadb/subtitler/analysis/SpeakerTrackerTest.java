package io.evitadb.subtitler.analysis;

import io.evitadb.subtitler.model.DocumentEntry;
import io.evitadb.subtitler.model.SubtitleDocument;
import io.evitadb.subtitler.model.SubtitleEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SpeakerTracker should attribute dialogue to labelled speakers")
public class SpeakerTrackerTest {

	@Test
	@DisplayName("shouldAcceptRecurringLabelsOnly")
	void shouldAcceptRecurringLabelsOnly() {
		final List<DocumentEntry> entries = entries(
			"JOHN: Where were you?",
			"MARY: Out.",
			"JOHN: All night?",
			"Nobody answers.",
			"[door slams]"
		);

		final SpeakerStats stats = new SpeakerTracker().detectSpeakers(entries);

		assertEquals("JOHN", entries.get(0).getSpeaker());
		assertNull(entries.get(1).getSpeaker());
		assertEquals("JOHN", entries.get(2).getSpeaker());
		assertNull(entries.get(3).getSpeaker());
		assertEquals(new SpeakerStats(5, 2, 1, 1), stats);
	}

	@Test
	@DisplayName("shouldReadBracketedLabels")
	void shouldReadBracketedLabels() {
		assertEquals("Mary", SpeakerTracker.extractSpeaker("[Mary]: Hi"));
		assertEquals("Dr. Smith", SpeakerTracker.extractSpeaker("Dr. Smith: Sit down."));
		assertNull(SpeakerTracker.extractSpeaker("no label here"));
	}

	@Test
	@DisplayName("shouldNotReadLabelAcrossLineBreak")
	void shouldNotReadLabelAcrossLineBreak() {
		assertNull(SpeakerTracker.extractSpeaker("Wait\nFor me: please"));
		assertNull(SpeakerTracker.extractSpeaker("Hold\r\nOn: now"));
		assertEquals("JOHN", SpeakerTracker.extractSpeaker("JOHN:\tWhere were you?"));
		assertEquals("Mary Ann", SpeakerTracker.extractSpeaker("Mary Ann: Hi\nthere"));
	}

	@Test
	@DisplayName("shouldReplaceSpeakersOfEarlierRun")
	void shouldReplaceSpeakersOfEarlierRun() {
		final List<DocumentEntry> entries = entries("JOHN: Where were you?", "MARY: Out.", "JOHN: All night?");
		new SpeakerTracker(new SpeakerConfig(1, false, 2)).detectSpeakers(entries);
		assertEquals("MARY", entries.get(1).getSpeaker());

		final SpeakerStats stats = new SpeakerTracker().detectSpeakers(entries);

		assertEquals("JOHN", entries.get(0).getSpeaker());
		assertNull(entries.get(1).getSpeaker());
		assertEquals(2, stats.entriesWithSpeakers());
		assertEquals(List.of("JOHN"), new SpeakerTracker().speakers(entries).stream()
			.map(SpeakerTracker.DetectedSpeaker::name).toList());
	}

	@Test
	@DisplayName("shouldCarrySpeakerOverToFollowingDialogue")
	void shouldCarrySpeakerOverToFollowingDialogue() {
		final List<DocumentEntry> entries = entries(
			"ANNA: I know what you did.",
			"And I will tell everyone.",
			"BANG",
			"You can't stop me.",
			"Or can you?",
			"Silence follows."
		);

		final SpeakerStats stats = new SpeakerTracker(new SpeakerConfig(1, true, 2)).detectSpeakers(entries);

		assertEquals("ANNA", entries.get(1).getSpeaker());
		assertNull(entries.get(2).getSpeaker(), "shouted caption is not dialogue");
		assertNull(entries.get(3).getSpeaker(), "continuity gap exhausted");
		assertEquals(2, stats.entriesWithSpeakers());
	}

	@Test
	@DisplayName("shouldGroupEntriesBySpeaker")
	void shouldGroupEntriesBySpeaker() {
		final List<DocumentEntry> entries = entries("ANN: one", "BOB: two", "ANN: three", "BOB: four");
		final SpeakerTracker tracker = new SpeakerTracker();
		tracker.detectSpeakers(entries);

		final List<SpeakerTracker.DetectedSpeaker> speakers = tracker.speakers(entries);

		assertEquals(List.of("ANN", "BOB"), tracker.extractSpeakerNames(entries));
		assertEquals(List.of(1, 3), speakers.get(0).entryIds());
		assertEquals(2, speakers.get(1).occurrenceCount());
	}

	private static List<DocumentEntry> entries(String... texts) {
		final List<SubtitleEntry> raw = new ArrayList<>();
		for (int i = 0; i < texts.length; i++) {
			raw.add(new SubtitleEntry(i + 1, i * 2_000L, i * 2_000L + 1_500, texts[i]));
		}
		return SubtitleDocument.fromEntries(raw, "en").getEntries();
	}
}
