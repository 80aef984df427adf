package io.evitadb.subtitler.quality;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Explicit retry state machine for one operation.
 *
 * <pre>
 * READY --failure/Retry|ReduceBatchSize--> WAITING --backoff elapsed--> READY
 * READY --failure/other action-----------> EXHAUSTED
 * READY --failure/Abort------------------> ABORTED
 * READY --success------------------------> SUCCEEDED
 * </pre>
 *
 * Each failure is stamped with the number of earlier failures of the same kind so that consecutive failures
 * back off exponentially, then handed to {@link ErrorRecovery}. The summed backoff is bounded by the safety limit
 * {@link RecoveryStrategy#maxRetryDuration()}; a retry that would exceed it turns into the final action.
 */
public final class RetryController {

	/**
	 * Lifecycle of a controlled operation.
	 */
	public enum State {
		READY,
		WAITING,
		SUCCEEDED,
		EXHAUSTED,
		ABORTED
	}

	@Nonnull
	private final ErrorRecovery recovery;
	@Nonnull
	private final Sleeper sleeper;
	@Nonnull
	private final Map<ErrorKind, Integer> failuresByKind = new EnumMap<>(ErrorKind.class);
	@Nonnull
	private State state = State.READY;
	@Nonnull
	private Duration totalBackoff = Duration.ZERO;
	@Nullable
	private TranslationException lastError;
	private int attempts;

	public RetryController(@Nonnull RecoveryStrategy strategy, @Nonnull Sleeper sleeper) {
		this.recovery = new ErrorRecovery(Objects.requireNonNull(strategy, "strategy must not be null"));
		this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
	}

	/**
	 * Marks the start of an attempt.
	 *
	 * @throws IllegalStateException when the controller is not ready
	 */
	public void beginAttempt() {
		if (this.state != State.READY) {
			throw new IllegalStateException("Cannot start an attempt in state " + this.state);
		}
		this.attempts++;
	}

	/**
	 * Marks the current attempt as successful.
	 */
	public void recordSuccess() {
		this.state = State.SUCCEEDED;
	}

	/**
	 * Handles a failed attempt: decides the recovery action and, for retries, waits out the backoff.
	 *
	 * @param error           the failure
	 * @param affectedEntries ids of entries the failed attempt covered
	 * @return the action; after {@link RecoveryAction.Retry} and {@link RecoveryAction.ReduceBatchSize}
	 * the controller is READY again, after any other action it is terminal
	 */
	@Nonnull
	public RecoveryAction recordFailure(@Nonnull TranslationException error, @Nonnull List<Integer> affectedEntries) {
		Objects.requireNonNull(error, "error must not be null");
		Objects.requireNonNull(affectedEntries, "affectedEntries must not be null");

		final int previousOfKind = this.failuresByKind.getOrDefault(error.getKind(), 0);
		this.failuresByKind.put(error.getKind(), previousOfKind + 1);
		final TranslationException stamped = error.withEntries(affectedEntries).withRetries(previousOfKind);
		this.lastError = stamped;

		RecoveryAction action = this.recovery.handle(stamped);
		if (action instanceof RecoveryAction.Retry retry) {
			final Duration next = this.totalBackoff.plus(retry.delay());
			if (next.compareTo(this.recovery.getStrategy().maxRetryDuration()) > 0) {
				action = this.recovery.finalAction(stamped);
			} else {
				this.state = State.WAITING;
				try {
					this.sleeper.sleep(retry.delay());
				} catch (InterruptedException e) {
					Thread.currentThread().interrupt();
					this.state = State.ABORTED;
					return new RecoveryAction.Abort("Interrupted while waiting to retry");
				}
				this.totalBackoff = next;
				this.state = State.READY;
				return action;
			}
		}

		if (action instanceof RecoveryAction.ReduceBatchSize) {
			this.state = State.READY;
		} else if (action instanceof RecoveryAction.Abort) {
			this.state = State.ABORTED;
		} else {
			this.state = State.EXHAUSTED;
		}
		return action;
	}

	@Nonnull
	public State getState() {
		return this.state;
	}

	public boolean isTerminal() {
		return this.state == State.SUCCEEDED || this.state == State.EXHAUSTED || this.state == State.ABORTED;
	}

	public int getAttempts() {
		return this.attempts;
	}

	/**
	 * Returns the number of retries granted so far.
	 *
	 * @return retry count
	 */
	public int getRetries() {
		return this.recovery.retryCount();
	}

	@Nullable
	public TranslationException getLastError() {
		return this.lastError;
	}

	@Nonnull
	public Duration getTotalBackoff() {
		return this.totalBackoff;
	}

	@Nonnull
	public String errorSummary() {
		return this.recovery.errorSummary();
	}
}
