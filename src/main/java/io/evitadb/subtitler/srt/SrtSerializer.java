package io.evitadb.subtitler.srt;

import io.evitadb.subtitler.model.SubtitleEntry;
import io.evitadb.subtitler.model.Timecode;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * Serializes raw subtitle entries into SubRip content.
 */
public final class SrtSerializer {

	/**
	 * Renders entries as SubRip text. Each block ends with a blank line.
	 *
	 * @param entries entries in display order
	 * @return SubRip content using `\n` line endings
	 */
	@Nonnull
	public String serialize(@Nonnull List<SubtitleEntry> entries) {
		Objects.requireNonNull(entries, "entries must not be null");
		final StringBuilder sb = new StringBuilder();
		for (final SubtitleEntry entry : entries) {
			sb.append(entry.seqNum()).append('\n');
			sb.append(Timecode.formatTimestamp(entry.startMs()))
				.append(" --> ")
				.append(Timecode.formatTimestamp(entry.endMs()))
				.append('\n');
			sb.append(entry.text()).append('\n');
			sb.append('\n');
		}
		return sb.toString();
	}
}
