package io.evitadb.subtitler.quality;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Typed translation failure.
 *
 * Carries the {@link ErrorKind}, the ids of the entries that could not be translated and how many times the
 * failed operation has already been retried. Instances are immutable; {@link #withEntries(List)} and
 * {@link #withRetries(int)} return copies.
 */
public class TranslationException extends RuntimeException {

	@Nonnull
	private final ErrorKind kind;
	@Nonnull
	private final List<Integer> affectedEntries;
	private final int retryCount;

	/**
	 * Creates a new exception.
	 *
	 * @param kind    failure kind
	 * @param message description of the failure
	 */
	public TranslationException(@Nonnull ErrorKind kind, @Nonnull String message) {
		this(kind, message, null, List.of(), 0);
	}

	/**
	 * Creates a new exception with a cause.
	 *
	 * @param kind    failure kind
	 * @param message description of the failure
	 * @param cause   underlying exception
	 */
	public TranslationException(@Nonnull ErrorKind kind, @Nonnull String message, @Nullable Throwable cause) {
		this(kind, message, cause, List.of(), 0);
	}

	private TranslationException(
		@Nonnull ErrorKind kind,
		@Nonnull String message,
		@Nullable Throwable cause,
		@Nonnull List<Integer> affectedEntries,
		int retryCount
	) {
		super(message, cause);
		this.kind = Objects.requireNonNull(kind, "kind must not be null");
		this.affectedEntries = List.copyOf(affectedEntries);
		this.retryCount = retryCount;
	}

	@Nonnull
	public ErrorKind getKind() {
		return this.kind;
	}

	/**
	 * Returns the ids of entries affected by this failure.
	 *
	 * @return unmodifiable list of entry ids
	 */
	@Nonnull
	public List<Integer> getAffectedEntries() {
		return this.affectedEntries;
	}

	public int getRetryCount() {
		return this.retryCount;
	}

	/**
	 * Returns a copy carrying the given affected entry ids.
	 *
	 * @param entries affected entry ids
	 * @return new exception instance
	 */
	@Nonnull
	public TranslationException withEntries(@Nonnull List<Integer> entries) {
		return new TranslationException(this.kind, getMessage(), getCause(), entries, this.retryCount);
	}

	/**
	 * Returns a copy carrying the given retry count.
	 *
	 * @param count number of retries already performed
	 * @return new exception instance
	 */
	@Nonnull
	public TranslationException withRetries(int count) {
		return new TranslationException(this.kind, getMessage(), getCause(), this.affectedEntries, count);
	}

	/**
	 * Returns true when the kind is retryable and its retry limit has not been reached.
	 *
	 * @return true if another attempt is allowed
	 */
	public boolean shouldRetry() {
		return this.kind.isRetryable() && this.retryCount < this.kind.maxRetries();
	}

	/**
	 * Exponential backoff: base delay of the kind multiplied by 2 to the power of the retry count.
	 *
	 * @return delay before the next attempt
	 */
	@Nonnull
	public Duration retryDelay() {
		return this.kind.baseDelay().multipliedBy(1L << Math.min(this.retryCount, 20));
	}

	@Nonnull
	public String userMessage() {
		return this.kind.userMessage(String.valueOf(getMessage()));
	}

	@Override
	public String toString() {
		final String base = this.kind + ": " + getMessage();
		return getCause() != null ? base + " (caused by: " + getCause().getMessage() + ")" : base;
	}
}
