package io.evitadb.subtitler.check;

import javax.annotation.Nonnull;
import java.nio.file.Path;
import java.util.Objects;

/**
 * A problem found by {@link SubtitleChecker}.
 *
 * @param file   the file with the problem
 * @param type   kind of problem
 * @param detail human readable detail
 */
public record CheckError(
	@Nonnull Path file,
	@Nonnull CheckErrorType type,
	@Nonnull String detail
) {

	public CheckError {
		Objects.requireNonNull(file, "file must not be null");
		Objects.requireNonNull(type, "type must not be null");
		Objects.requireNonNull(detail, "detail must not be null");
	}

	/**
	 * Kinds of problems detected by the check action.
	 */
	public enum CheckErrorType {
		/**
		 * Source file is not valid SubRip.
		 */
		MALFORMED_SOURCE,
		/**
		 * Source file contains no entries.
		 */
		EMPTY_SOURCE,
		/**
		 * Existing translation is not valid SubRip.
		 */
		MALFORMED_TRANSLATION,
		/**
		 * Translation has a different number of entries than its source.
		 */
		ENTRY_COUNT_MISMATCH,
		/**
		 * Translation entry is displayed at a different time than the source entry.
		 */
		TIMING_MISMATCH
	}
}
