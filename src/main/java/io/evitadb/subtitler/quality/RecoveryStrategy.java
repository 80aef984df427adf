package io.evitadb.subtitler.quality;

import javax.annotation.Nonnull;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Limits and permissions used by {@link ErrorRecovery}.
 *
 * @param maxRetries          total retries allowed for one operation across all error kinds
 * @param maxRetryDuration    safety limit on the summed backoff of one operation, set above what the retry
 *                            schedule of {@code maxRetries} rate-limit failures needs
 * @param useFallback         whether placeholders may be produced for failed entries
 * @param allowPartial        whether processing may continue with some entries failed
 * @param minBatchSize        batch size below which batches are no longer split
 * @param allowProviderSwitch whether switching to another provider is allowed
 */
public record RecoveryStrategy(
	int maxRetries,
	@Nonnull Duration maxRetryDuration,
	boolean useFallback,
	boolean allowPartial,
	int minBatchSize,
	boolean allowProviderSwitch
) {

	public static final String PROFILE_DEFAULT = "default";
	public static final String PROFILE_AGGRESSIVE = "aggressive";
	public static final String PROFILE_FAST_FAIL = "fast-fail";

	public RecoveryStrategy {
		Objects.requireNonNull(maxRetryDuration, "maxRetryDuration must not be null");
		if (maxRetries < 0) {
			throw new IllegalArgumentException("maxRetries must not be negative");
		}
		if (minBatchSize < 1) {
			throw new IllegalArgumentException("minBatchSize must be at least 1");
		}
	}

	@Nonnull
	public static RecoveryStrategy defaults() {
		return new RecoveryStrategy(3, Duration.ofMinutes(10), true, true, 1, false);
	}

	@Nonnull
	public static RecoveryStrategy aggressive() {
		return new RecoveryStrategy(5, Duration.ofMinutes(35), true, true, 1, true);
	}

	@Nonnull
	public static RecoveryStrategy fastFail() {
		return new RecoveryStrategy(1, Duration.ofSeconds(30), false, false, 10, false);
	}

	@Nonnull
	public RecoveryStrategy withMaxRetries(int newMaxRetries) {
		return new RecoveryStrategy(
			newMaxRetries, this.maxRetryDuration, this.useFallback, this.allowPartial, this.minBatchSize, this.allowProviderSwitch
		);
	}

	/**
	 * Resolves a named profile.
	 *
	 * @param name "default", "aggressive" or "fast-fail" (case-insensitive, `_` accepted for `-`)
	 * @return the strategy
	 * @throws IllegalArgumentException for unknown names
	 */
	@Nonnull
	public static RecoveryStrategy forProfile(@Nonnull String name) {
		Objects.requireNonNull(name, "name must not be null");
		return switch (name.trim().toLowerCase(Locale.ROOT).replace('_', '-')) {
			case PROFILE_DEFAULT -> defaults();
			case PROFILE_AGGRESSIVE -> aggressive();
			case PROFILE_FAST_FAIL -> fastFail();
			default -> throw new IllegalArgumentException(
				"Unknown recovery profile: " + name + ". Supported profiles: " +
					PROFILE_DEFAULT + ", " + PROFILE_AGGRESSIVE + ", " + PROFILE_FAST_FAIL
			);
		};
	}
}
