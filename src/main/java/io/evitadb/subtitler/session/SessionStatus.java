package io.evitadb.subtitler.session;

import javax.annotation.Nonnull;

/**
 * Lifecycle state of a {@link TranslationSession}.
 */
public enum SessionStatus {

	IN_PROGRESS("In Progress"),
	PAUSED("Paused"),
	COMPLETED("Completed"),
	FAILED("Failed");

	@Nonnull
	private final String displayName;

	SessionStatus(@Nonnull String displayName) {
		this.displayName = displayName;
	}

	@Nonnull
	public String getDisplayName() {
		return this.displayName;
	}

	/**
	 * Returns true when translation of the session can be picked up again.
	 *
	 * @return true for sessions in progress or paused
	 */
	public boolean isResumable() {
		return this == IN_PROGRESS || this == PAUSED;
	}
}
