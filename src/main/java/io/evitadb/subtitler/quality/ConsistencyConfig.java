package io.evitadb.subtitler.quality;

import javax.annotation.Nonnull;

/**
 * Checks run by {@link ConsistencyChecker}.
 *
 * @param checkTerminology      flag glossary terms rendered in more than one way
 * @param checkStyle            flag lines whose register differs from the rest of the document
 * @param checkNames            flag character names missing from the translation
 * @param checkPunctuation      flag documents mixing more than two kinds of quotation marks
 * @param minOccurrencesForFlag occurrences a term needs before differing renderings are flagged
 * @param caseSensitive         whether term and name matching respects case
 */
public record ConsistencyConfig(
	boolean checkTerminology,
	boolean checkStyle,
	boolean checkNames,
	boolean checkPunctuation,
	int minOccurrencesForFlag,
	boolean caseSensitive
) {

	public ConsistencyConfig {
		if (minOccurrencesForFlag < 1) {
			throw new IllegalArgumentException("minOccurrencesForFlag must be at least 1");
		}
	}

	@Nonnull
	public static ConsistencyConfig defaults() {
		return new ConsistencyConfig(true, true, true, true, 2, false);
	}

	@Nonnull
	public static ConsistencyConfig strict() {
		return new ConsistencyConfig(true, true, true, true, 1, true);
	}

	@Nonnull
	public static ConsistencyConfig minimal() {
		return new ConsistencyConfig(true, false, true, false, 3, false);
	}
}
