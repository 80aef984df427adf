package io.evitadb.subtitler.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Timecode should format and parse SRT timestamps")
public class TimecodeTest {

	@Test
	@DisplayName("shouldFormatTimingLine")
	void shouldFormatTimingLine() {
		final Timecode timecode = new Timecode(1_000, 4_500);

		assertEquals("00:00:01,000 --> 00:00:04,500", timecode.formatSrt());
		assertEquals(3_500, timecode.durationMs());
	}

	@Test
	@DisplayName("shouldFormatHoursMinutesAndMillis")
	void shouldFormatHoursMinutesAndMillis() {
		assertEquals("01:02:03,456", Timecode.formatTimestamp(3_723_456));
	}

	@Test
	@DisplayName("shouldParseFormattedTimestampBack")
	void shouldParseFormattedTimestampBack() {
		final long millis = 5_025_007;

		assertEquals(millis, Timecode.parseSrtTimestamp(Timecode.formatTimestamp(millis)));
	}

	@Test
	@DisplayName("shouldAcceptDotAsMillisecondSeparator")
	void shouldAcceptDotAsMillisecondSeparator() {
		assertEquals(61_250, Timecode.parseSrtTimestamp("00:01:01.250"));
	}

	@Test
	@DisplayName("shouldRejectMalformedTimestamp")
	void shouldRejectMalformedTimestamp() {
		assertThrows(IllegalArgumentException.class, () -> Timecode.parseSrtTimestamp("00:01"));
		assertThrows(IllegalArgumentException.class, () -> Timecode.parseSrtTimestamp("00:61:00,000"));
		assertThrows(IllegalArgumentException.class, () -> Timecode.parseSrtTimestamp("aa:00:00,000"));
	}

	@Test
	@DisplayName("shouldRejectEndNotAfterStart")
	void shouldRejectEndNotAfterStart() {
		assertThrows(IllegalArgumentException.class, () -> new Timecode(2_000, 2_000));
		assertThrows(IllegalArgumentException.class, () -> new Timecode(-1, 2_000));
	}
}
