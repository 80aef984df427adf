package io.evitadb.subtitler.quality;

import javax.annotation.Nonnull;
import java.time.Duration;

/**
 * Taxonomy of translation failures. Each kind carries its retry policy: whether it is retryable at all,
 * the base backoff delay and the maximum number of retries.
 */
public enum ErrorKind {

	NETWORK(true, Duration.ofSeconds(10), 3),
	RATE_LIMIT(true, Duration.ofSeconds(60), 5),
	TIMEOUT(true, Duration.ofSeconds(5), 3),
	INVALID_RESPONSE(true, Duration.ofSeconds(2), 2),
	PARSE_ERROR(false, Duration.ofSeconds(1), 1),
	VALIDATION_FAILED(false, Duration.ofSeconds(1), 1),
	PROVIDER_ERROR(false, Duration.ofSeconds(1), 1),
	CONFIG_ERROR(false, Duration.ofSeconds(1), 1),
	RESOURCE_EXHAUSTED(false, Duration.ofSeconds(1), 1),
	UNKNOWN(false, Duration.ofSeconds(1), 1);

	private final boolean retryable;
	@Nonnull
	private final Duration baseDelay;
	private final int maxRetries;

	ErrorKind(boolean retryable, @Nonnull Duration baseDelay, int maxRetries) {
		this.retryable = retryable;
		this.baseDelay = baseDelay;
		this.maxRetries = maxRetries;
	}

	public boolean isRetryable() {
		return this.retryable;
	}

	/**
	 * Returns the delay before the first retry; later retries double it.
	 *
	 * @return base delay
	 */
	@Nonnull
	public Duration baseDelay() {
		return this.baseDelay;
	}

	public int maxRetries() {
		return this.maxRetries;
	}

	/**
	 * Returns true for failures that no amount of retrying or degrading can fix.
	 *
	 * @return true for configuration and resource exhaustion errors
	 */
	public boolean isFatal() {
		return this == CONFIG_ERROR || this == RESOURCE_EXHAUSTED;
	}

	/**
	 * Renders a message suitable for end users.
	 *
	 * @param detail technical detail of the failure
	 * @return human readable message
	 */
	@Nonnull
	public String userMessage(@Nonnull String detail) {
		return switch (this) {
			case NETWORK -> "Network connection error. Please check your internet connection.";
			case RATE_LIMIT -> "API rate limit reached. Please wait before retrying.";
			case TIMEOUT -> "Request timed out. The server may be overloaded.";
			case INVALID_RESPONSE -> "Received invalid response from translation service.";
			case PARSE_ERROR -> "Failed to parse translation response.";
			case VALIDATION_FAILED -> "Translation validation failed: " + detail;
			case PROVIDER_ERROR -> "Translation provider error: " + detail;
			case CONFIG_ERROR -> "Configuration error: " + detail;
			case RESOURCE_EXHAUSTED -> "System resources exhausted. Please free up memory or disk space.";
			case UNKNOWN -> "Unexpected error: " + detail;
		};
	}
}
