package io.evitadb.subtitler.analysis;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Compressed description of a run of entries.
 *
 * @param text         summary text
 * @param startEntryId id of the first summarized entry, 0 for an empty summary
 * @param endEntryId   id of the last summarized entry, 0 for an empty summary
 * @param entryCount   number of summarized entries
 */
public record HistorySummary(
	@Nonnull String text,
	int startEntryId,
	int endEntryId,
	int entryCount
) {

	public HistorySummary {
		Objects.requireNonNull(text, "text must not be null");
	}

	@Nonnull
	public static HistorySummary empty() {
		return new HistorySummary("", 0, 0, 0);
	}

	public boolean isEmpty() {
		return this.entryCount == 0;
	}
}
