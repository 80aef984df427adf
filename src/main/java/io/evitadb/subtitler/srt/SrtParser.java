package io.evitadb.subtitler.srt;

import io.evitadb.subtitler.model.SubtitleEntry;
import io.evitadb.subtitler.model.Timecode;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Parses SubRip (`.srt`) content into raw subtitle entries.
 *
 * Blocks are separated by blank lines and consist of a sequence number, a timing line
 * `HH:MM:SS,mmm --> HH:MM:SS,mmm` and one or more text lines. A byte order mark and Windows line
 * endings are tolerated. Blocks without text lines are skipped.
 */
public final class SrtParser {

	private static final String TIMING_SEPARATOR = "-->";

	/**
	 * Parses the given content.
	 *
	 * @param content SubRip content
	 * @return entries in file order
	 * @throws SrtParseException when a block is malformed
	 */
	@Nonnull
	public List<SubtitleEntry> parse(@Nonnull String content) throws SrtParseException {
		Objects.requireNonNull(content, "content must not be null");

		String normalized = content.replace("\r\n", "\n").replace('\r', '\n');
		if (normalized.startsWith("\uFEFF")) {
			normalized = normalized.substring(1);
		}
		final String[] lines = normalized.split("\n", -1);
		final List<SubtitleEntry> result = new ArrayList<>();

		int i = 0;
		while (i < lines.length) {
			// skip blank separators
			while (i < lines.length && lines[i].isBlank()) {
				i++;
			}
			if (i >= lines.length) {
				break;
			}

			final int seqLine = i + 1;
			final int seqNum;
			try {
				seqNum = Integer.parseInt(lines[i].trim());
			} catch (NumberFormatException e) {
				throw new SrtParseException("Expected sequence number but found '" + lines[i].trim() + "'", seqLine, e);
			}
			i++;

			if (i >= lines.length) {
				throw new SrtParseException("Missing timing line for entry " + seqNum, seqLine);
			}
			final String timing = lines[i];
			final int timingLine = i + 1;
			final int separator = timing.indexOf(TIMING_SEPARATOR);
			if (separator < 0) {
				throw new SrtParseException("Invalid timing line '" + timing + "'", timingLine);
			}
			final long startMs;
			final long endMs;
			try {
				startMs = Timecode.parseSrtTimestamp(timing.substring(0, separator));
				// positional hints such as "X1:..." may follow the end timestamp
				final String endPart = timing.substring(separator + TIMING_SEPARATOR.length()).trim();
				final int space = endPart.indexOf(' ');
				endMs = Timecode.parseSrtTimestamp(space < 0 ? endPart : endPart.substring(0, space));
			} catch (IllegalArgumentException e) {
				throw new SrtParseException("Invalid timestamp in '" + timing + "'", timingLine, e);
			}
			if (endMs <= startMs) {
				throw new SrtParseException("Entry " + seqNum + " ends before it starts", timingLine);
			}
			i++;

			final StringBuilder text = new StringBuilder();
			while (i < lines.length && !lines[i].isBlank()) {
				if (text.length() > 0) {
					text.append('\n');
				}
				text.append(lines[i]);
				i++;
			}
			if (text.length() > 0) {
				result.add(new SubtitleEntry(seqNum, startMs, endMs, text.toString()));
			}
		}
		return result;
	}
}
