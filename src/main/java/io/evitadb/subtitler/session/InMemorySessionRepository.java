package io.evitadb.subtitler.session;

import javax.annotation.Nonnull;
import java.time.Clock;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Thread-safe session repository kept in memory. Subclasses may persist the sessions in {@link #onChange()}.
 */
public class InMemorySessionRepository implements SessionRepository {

	private final Map<String, TranslationSession> sessions = new LinkedHashMap<>();
	@Nonnull
	private final Clock clock;

	public InMemorySessionRepository() {
		this(Clock.systemUTC());
	}

	public InMemorySessionRepository(@Nonnull Clock clock) {
		this.clock = Objects.requireNonNull(clock, "clock must not be null");
	}

	@Nonnull
	@Override
	public synchronized TranslationSession create(@Nonnull SessionKey key, @Nonnull String sourceFile, int totalEntries) {
		Objects.requireNonNull(key, "key must not be null");
		Objects.requireNonNull(sourceFile, "sourceFile must not be null");
		final long now = this.clock.millis();
		final TranslationSession session = new TranslationSession(
			UUID.randomUUID().toString(), key, sourceFile, totalEntries, 0, SessionStatus.IN_PROGRESS, now, now, null, null
		);
		this.sessions.put(session.id(), session);
		onChange();
		return session;
	}

	@Nonnull
	@Override
	public synchronized Optional<TranslationSession> find(@Nonnull SessionKey key) {
		Objects.requireNonNull(key, "key must not be null");
		TranslationSession latest = null;
		for (final TranslationSession session : this.sessions.values()) {
			// later insertion wins ties
			if (session.key().equals(key) && (latest == null || session.updatedAt() >= latest.updatedAt())) {
				latest = session;
			}
		}
		return Optional.ofNullable(latest);
	}

	@Nonnull
	@Override
	public synchronized Optional<TranslationSession> findById(@Nonnull String id) {
		return Optional.ofNullable(this.sessions.get(Objects.requireNonNull(id, "id must not be null")));
	}

	@Nonnull
	@Override
	public TranslationSession updateProgress(@Nonnull String id, int completedEntries) {
		return update(id, session -> session.withProgress(completedEntries, this.clock.millis()));
	}

	@Nonnull
	@Override
	public TranslationSession markComplete(@Nonnull String id) {
		return update(id, session -> session.completed(this.clock.millis()));
	}

	@Nonnull
	@Override
	public TranslationSession markFailed(@Nonnull String id, @Nonnull String error) {
		Objects.requireNonNull(error, "error must not be null");
		return update(id, session -> session.failed(error, this.clock.millis()));
	}

	@Nonnull
	@Override
	public TranslationSession markPaused(@Nonnull String id) {
		return update(id, session -> session.paused(this.clock.millis()));
	}

	@Nonnull
	@Override
	public synchronized List<TranslationSession> list() {
		return List.copyOf(this.sessions.values());
	}

	/**
	 * Replaces all sessions, used when loading persisted state.
	 */
	protected synchronized void replaceAll(@Nonnull Collection<TranslationSession> loaded) {
		this.sessions.clear();
		for (final TranslationSession session : loaded) {
			this.sessions.put(session.id(), session);
		}
	}

	/**
	 * Called with the repository lock held after every modification.
	 */
	protected void onChange() {
		// nothing to persist
	}

	@Nonnull
	private synchronized TranslationSession update(@Nonnull String id, @Nonnull UnaryOperator<TranslationSession> change) {
		Objects.requireNonNull(id, "id must not be null");
		final TranslationSession current = this.sessions.get(id);
		if (current == null) {
			throw new IllegalArgumentException("Unknown session: " + id);
		}
		final TranslationSession updated = change.apply(current);
		this.sessions.put(id, updated);
		onChange();
		return updated;
	}
}
