package io.evitadb.subtitler.model;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Raw subtitle entry as read from or written to a subtitle file.
 *
 * @param seqNum  sequence number of the entry in the file
 * @param startMs display start in milliseconds
 * @param endMs   display end in milliseconds
 * @param text    entry text, possibly multi-line and containing markup
 */
public record SubtitleEntry(
	int seqNum,
	long startMs,
	long endMs,
	@Nonnull String text
) {

	public SubtitleEntry {
		Objects.requireNonNull(text, "text must not be null");
	}

	/**
	 * Returns the display interval of this entry.
	 *
	 * @return the timecode
	 */
	@Nonnull
	public Timecode timecode() {
		return new Timecode(this.startMs, this.endMs);
	}

	/**
	 * Creates a copy of this entry with a different text.
	 *
	 * @param newText replacement text
	 * @return new entry with the same timing
	 */
	@Nonnull
	public SubtitleEntry withText(@Nonnull String newText) {
		return new SubtitleEntry(this.seqNum, this.startMs, this.endMs, newText);
	}

	/**
	 * Creates a copy of this entry with a different sequence number.
	 *
	 * @param newSeqNum replacement sequence number
	 * @return new entry with the same timing and text
	 */
	@Nonnull
	public SubtitleEntry withSeqNum(int newSeqNum) {
		return new SubtitleEntry(newSeqNum, this.startMs, this.endMs, this.text);
	}
}
