package io.evitadb.subtitler.quality;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Decides how to react to translation failures.
 *
 * An instance tracks the retries spent on one operation (typically one batch) and the errors seen so far.
 * Configuration and resource errors always abort. Once the strategy's retry budget is spent, the final action
 * is a fallback (when allowed and entries are known), a skip (when partial results are allowed) or an abort.
 * Not thread-safe; use one instance per sequential operation.
 */
public final class ErrorRecovery {

	@Nonnull
	private final RecoveryStrategy strategy;
	@Nonnull
	private final List<TranslationException> errorsSeen = new ArrayList<>();
	private int totalRetries;

	public ErrorRecovery() {
		this(RecoveryStrategy.defaults());
	}

	public ErrorRecovery(@Nonnull RecoveryStrategy strategy) {
		this.strategy = Objects.requireNonNull(strategy, "strategy must not be null");
	}

	@Nonnull
	public RecoveryStrategy getStrategy() {
		return this.strategy;
	}

	/**
	 * Records the error and chooses the next action.
	 *
	 * @param error the failure
	 * @return the recovery action
	 */
	@Nonnull
	public RecoveryAction handle(@Nonnull TranslationException error) {
		Objects.requireNonNull(error, "error must not be null");
		this.errorsSeen.add(error);

		if (error.getKind() == ErrorKind.CONFIG_ERROR) {
			return new RecoveryAction.Abort("Configuration error: " + error.getMessage());
		}
		if (error.getKind() == ErrorKind.RESOURCE_EXHAUSTED) {
			return new RecoveryAction.Abort("System resources exhausted");
		}
		if (this.totalRetries >= this.strategy.maxRetries()) {
			return finalAction(error);
		}

		switch (error.getKind()) {
			case RATE_LIMIT:
				return retry(error, false);

			case NETWORK:
			case TIMEOUT:
				if (error.shouldRetry()) {
					return retry(error, false);
				}
				if (this.strategy.useFallback()) {
					return new RecoveryAction.UseFallback(error.getAffectedEntries());
				}
				return new RecoveryAction.Abort(String.valueOf(error.getMessage()));

			case INVALID_RESPONSE:
			case PARSE_ERROR: {
				final int affected = error.getAffectedEntries().size();
				if (this.strategy.minBatchSize() < affected) {
					this.totalRetries++;
					return new RecoveryAction.ReduceBatchSize(Math.max(affected / 2, this.strategy.minBatchSize()));
				}
				if (error.shouldRetry()) {
					return retry(error, true);
				}
				return finalAction(error);
			}

			case VALIDATION_FAILED:
				if (this.strategy.allowPartial() && !error.getAffectedEntries().isEmpty()) {
					return new RecoveryAction.ContinuePartial(List.of(), error.getAffectedEntries());
				}
				if (this.strategy.useFallback()) {
					return new RecoveryAction.UseFallback(error.getAffectedEntries());
				}
				return new RecoveryAction.Abort(String.valueOf(error.getMessage()));

			case PROVIDER_ERROR:
				if (this.strategy.allowProviderSwitch()) {
					return new RecoveryAction.SwitchProvider(String.valueOf(error.getMessage()));
				}
				if (error.shouldRetry()) {
					return retry(error, false);
				}
				return finalAction(error);

			default:
				if (error.shouldRetry()) {
					return retry(error, false);
				}
				return finalAction(error);
		}
	}

	@Nonnull
	private RecoveryAction retry(@Nonnull TranslationException error, boolean modifiedParams) {
		this.totalRetries++;
		return new RecoveryAction.Retry(error.retryDelay(), modifiedParams);
	}

	/**
	 * Returns the action taken once retrying is no longer an option: a fallback when allowed and the affected
	 * entries are known, a skip when partial results are allowed, an abort otherwise.
	 *
	 * @param error the last failure
	 * @return the terminal action
	 */
	@Nonnull
	public RecoveryAction finalAction(@Nonnull TranslationException error) {
		if (this.strategy.useFallback() && !error.getAffectedEntries().isEmpty()) {
			return new RecoveryAction.UseFallback(error.getAffectedEntries());
		}
		if (this.strategy.allowPartial()) {
			return new RecoveryAction.Skip(error.getAffectedEntries());
		}
		return new RecoveryAction.Abort("Max retries exceeded: " + error.getMessage());
	}

	/**
	 * Clears retry counters and recorded errors so that the instance can serve the next operation.
	 */
	public void reset() {
		this.totalRetries = 0;
		this.errorsSeen.clear();
	}

	@Nonnull
	public List<TranslationException> errors() {
		return Collections.unmodifiableList(this.errorsSeen);
	}

	public int retryCount() {
		return this.totalRetries;
	}

	public boolean hasErrors() {
		return !this.errorsSeen.isEmpty();
	}

	/**
	 * Summarizes recorded errors, e.g. `3 errors (2 retries): RATE_LIMIT: 2, PARSE_ERROR: 1`.
	 *
	 * @return summary line
	 */
	@Nonnull
	public String errorSummary() {
		if (this.errorsSeen.isEmpty()) {
			return "No errors";
		}
		final Map<ErrorKind, Integer> byKind = new EnumMap<>(ErrorKind.class);
		for (final TranslationException error : this.errorsSeen) {
			byKind.merge(error.getKind(), 1, Integer::sum);
		}
		return this.errorsSeen.size() + " errors (" + this.totalRetries + " retries): " +
			byKind.entrySet().stream()
				.map(e -> e.getKey() + ": " + e.getValue())
				.collect(Collectors.joining(", "));
	}
}
