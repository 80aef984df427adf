package io.evitadb.subtitler.session;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Optional;

/**
 * Stores translation sessions so that finished translations of unchanged sources are not repeated and
 * interrupted ones can be recognised.
 */
public interface SessionRepository {

	/**
	 * Starts a new session in state {@link SessionStatus#IN_PROGRESS}.
	 *
	 * @param key          what is being translated
	 * @param sourceFile   relative path of the source file
	 * @param totalEntries entries in the source document
	 * @return the new session
	 */
	@Nonnull
	TranslationSession create(@Nonnull SessionKey key, @Nonnull String sourceFile, int totalEntries);

	/**
	 * Returns the most recently updated session for the key.
	 *
	 * @param key the key
	 * @return the session, empty when none exists
	 */
	@Nonnull
	Optional<TranslationSession> find(@Nonnull SessionKey key);

	@Nonnull
	Optional<TranslationSession> findById(@Nonnull String id);

	/**
	 * @throws IllegalArgumentException when no session has the id
	 */
	@Nonnull
	TranslationSession updateProgress(@Nonnull String id, int completedEntries);

	/**
	 * @throws IllegalArgumentException when no session has the id
	 */
	@Nonnull
	TranslationSession markComplete(@Nonnull String id);

	/**
	 * @throws IllegalArgumentException when no session has the id
	 */
	@Nonnull
	TranslationSession markFailed(@Nonnull String id, @Nonnull String error);

	/**
	 * @throws IllegalArgumentException when no session has the id
	 */
	@Nonnull
	TranslationSession markPaused(@Nonnull String id);

	@Nonnull
	List<TranslationSession> list();

	/**
	 * Returns true when the key has a completed session.
	 *
	 * @param key the key
	 * @return true when translation of this content can be skipped
	 */
	default boolean isCompleted(@Nonnull SessionKey key) {
		return find(key).map(session -> session.status() == SessionStatus.COMPLETED).orElse(false);
	}
}
