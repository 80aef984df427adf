package io.evitadb.subtitler.context;

import io.evitadb.subtitler.model.DocumentEntry;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Entry as presented to the model inside a context window.
 *
 * @param id          entry id
 * @param text        original text
 * @param timecode    SRT timing line
 * @param soundEffect whether the entry is a non-dialogue cue
 */
public record WindowEntry(
	int id,
	@Nonnull String text,
	@Nonnull String timecode,
	boolean soundEffect
) {

	public WindowEntry {
		Objects.requireNonNull(text, "text must not be null");
		Objects.requireNonNull(timecode, "timecode must not be null");
	}

	@Nonnull
	public static WindowEntry from(@Nonnull DocumentEntry entry) {
		return new WindowEntry(
			entry.getId(),
			entry.getOriginalText(),
			entry.getTimecode().formatSrt(),
			entry.isSoundEffect()
		);
	}
}
