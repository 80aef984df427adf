package io.evitadb.subtitler.srt;

import javax.annotation.Nonnull;

/**
 * Exception thrown when SubRip content cannot be parsed.
 */
public class SrtParseException extends Exception {

	private final int lineNumber;

	/**
	 * Creates a new parse exception.
	 *
	 * @param message    the error message
	 * @param lineNumber the 1-based line where parsing failed, or -1 if unknown
	 */
	public SrtParseException(@Nonnull String message, int lineNumber) {
		super(lineNumber > 0 ? message + " (at line " + lineNumber + ")" : message);
		this.lineNumber = lineNumber;
	}

	/**
	 * Creates a new parse exception with a cause.
	 *
	 * @param message    the error message
	 * @param lineNumber the 1-based line where parsing failed
	 * @param cause      the underlying cause
	 */
	public SrtParseException(@Nonnull String message, int lineNumber, @Nonnull Throwable cause) {
		super(lineNumber > 0 ? message + " (at line " + lineNumber + ")" : message, cause);
		this.lineNumber = lineNumber;
	}

	/**
	 * Returns the line number where parsing failed.
	 *
	 * @return the 1-based line number, or -1 if unknown
	 */
	public int getLineNumber() {
		return this.lineNumber;
	}
}
