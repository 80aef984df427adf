package io.evitadb.subtitler.model;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Immutable display interval of a subtitle entry expressed in milliseconds from the start of the media.
 *
 * @param startMs start of the interval, inclusive
 * @param endMs   end of the interval, exclusive; always greater than start
 */
public record Timecode(long startMs, long endMs) {

	private static final long MILLIS_PER_HOUR = 3_600_000L;
	private static final long MILLIS_PER_MINUTE = 60_000L;
	private static final long MILLIS_PER_SECOND = 1_000L;

	public Timecode {
		if (startMs < 0) {
			throw new IllegalArgumentException("startMs must not be negative: " + startMs);
		}
		if (endMs <= startMs) {
			throw new IllegalArgumentException("endMs (" + endMs + ") must be greater than startMs (" + startMs + ")");
		}
	}

	/**
	 * Returns the display duration in milliseconds.
	 *
	 * @return duration, always positive
	 */
	public long durationMs() {
		return this.endMs - this.startMs;
	}

	/**
	 * Formats the interval as a SubRip timing line, e.g. `00:00:01,000 --> 00:00:04,500`.
	 *
	 * @return the SRT timing line
	 */
	@Nonnull
	public String formatSrt() {
		return formatTimestamp(this.startMs) + " --> " + formatTimestamp(this.endMs);
	}

	/**
	 * Formats a single timestamp as `HH:MM:SS,mmm`.
	 *
	 * @param millis milliseconds from the start of the media
	 * @return formatted timestamp
	 */
	@Nonnull
	public static String formatTimestamp(long millis) {
		final long hours = millis / MILLIS_PER_HOUR;
		final long minutes = (millis % MILLIS_PER_HOUR) / MILLIS_PER_MINUTE;
		final long seconds = (millis % MILLIS_PER_MINUTE) / MILLIS_PER_SECOND;
		final long ms = millis % MILLIS_PER_SECOND;
		return String.format("%02d:%02d:%02d,%03d", hours, minutes, seconds, ms);
	}

	/**
	 * Parses a single SRT timestamp. Both `,` and `.` are accepted as the millisecond separator.
	 *
	 * @param timestamp timestamp such as `01:02:03,456`
	 * @return milliseconds from the start of the media
	 * @throws IllegalArgumentException when the timestamp is malformed
	 */
	public static long parseSrtTimestamp(@Nonnull String timestamp) {
		Objects.requireNonNull(timestamp, "timestamp must not be null");
		final String[] parts = timestamp.trim().split("[:,.]");
		if (parts.length != 4) {
			throw new IllegalArgumentException("Invalid SRT timestamp: " + timestamp);
		}
		try {
			final long hours = Long.parseLong(parts[0]);
			final long minutes = Long.parseLong(parts[1]);
			final long seconds = Long.parseLong(parts[2]);
			final long millis = Long.parseLong(parts[3]);
			if (minutes > 59 || seconds > 59 || millis > 999 || hours < 0 || minutes < 0 || seconds < 0 || millis < 0) {
				throw new IllegalArgumentException("Invalid SRT timestamp: " + timestamp);
			}
			return hours * MILLIS_PER_HOUR + minutes * MILLIS_PER_MINUTE + seconds * MILLIS_PER_SECOND + millis;
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid SRT timestamp: " + timestamp, e);
		}
	}

	@Override
	public String toString() {
		return formatSrt();
	}
}
