package io.evitadb.subtitler.quality;

import javax.annotation.Nonnull;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * What to do after a translation failure, as decided by {@link ErrorRecovery}.
 */
public sealed interface RecoveryAction
	permits RecoveryAction.Retry, RecoveryAction.Skip, RecoveryAction.UseFallback, RecoveryAction.ReduceBatchSize,
	RecoveryAction.SwitchProvider, RecoveryAction.Abort, RecoveryAction.ContinuePartial {

	/**
	 * Returns true unless processing must stop.
	 *
	 * @return false only for {@link Abort}
	 */
	default boolean allowsContinuation() {
		return !(this instanceof Abort);
	}

	@Nonnull
	String description();

	/**
	 * Try again after a delay.
	 *
	 * @param delay          backoff before the next attempt
	 * @param modifiedParams whether the request should be altered (e.g. stricter output instructions)
	 */
	record Retry(@Nonnull Duration delay, boolean modifiedParams) implements RecoveryAction {
		public Retry {
			Objects.requireNonNull(delay, "delay must not be null");
		}

		@Nonnull
		@Override
		public String description() {
			return modifiedParams
				? "Retry with modified parameters after " + delay.toMillis() + "ms"
				: "Retry after " + delay.toMillis() + "ms";
		}
	}

	/**
	 * Leave the entries untranslated and move on.
	 *
	 * @param entries skipped entry ids
	 */
	record Skip(@Nonnull List<Integer> entries) implements RecoveryAction {
		public Skip {
			entries = List.copyOf(entries);
		}

		@Nonnull
		@Override
		public String description() {
			return "Skip " + entries.size() + " entries";
		}
	}

	/**
	 * Use placeholder results for the entries so that the original text is published.
	 *
	 * @param entries entry ids receiving placeholders
	 */
	record UseFallback(@Nonnull List<Integer> entries) implements RecoveryAction {
		public UseFallback {
			entries = List.copyOf(entries);
		}

		@Nonnull
		@Override
		public String description() {
			return "Use original text for " + entries.size() + " entries";
		}
	}

	/**
	 * Retry with a smaller batch.
	 *
	 * @param newSize batch size for the next attempt
	 */
	record ReduceBatchSize(int newSize) implements RecoveryAction {
		public ReduceBatchSize {
			if (newSize < 1) {
				throw new IllegalArgumentException("newSize must be at least 1");
			}
		}

		@Nonnull
		@Override
		public String description() {
			return "Reduce batch size to " + newSize;
		}
	}

	/**
	 * Continue with another provider.
	 *
	 * @param reason why the current provider is abandoned
	 */
	record SwitchProvider(@Nonnull String reason) implements RecoveryAction {
		@Nonnull
		@Override
		public String description() {
			return "Switch provider: " + reason;
		}
	}

	/**
	 * Stop processing.
	 *
	 * @param reason why processing stops
	 */
	record Abort(@Nonnull String reason) implements RecoveryAction {
		@Nonnull
		@Override
		public String description() {
			return "Abort: " + reason;
		}
	}

	/**
	 * Keep completed entries and report the failed ones.
	 *
	 * @param completed ids of completed entries
	 * @param failed    ids of failed entries
	 */
	record ContinuePartial(@Nonnull List<Integer> completed, @Nonnull List<Integer> failed) implements RecoveryAction {
		public ContinuePartial {
			completed = List.copyOf(completed);
			failed = List.copyOf(failed);
		}

		@Nonnull
		@Override
		public String description() {
			return "Continue with " + completed.size() + " completed, " + failed.size() + " failed";
		}
	}
}
