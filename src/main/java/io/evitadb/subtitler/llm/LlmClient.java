package io.evitadb.subtitler.llm;

import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.NonRetriableException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;
import io.evitadb.subtitler.quality.ErrorClassifier;
import io.evitadb.subtitler.quality.ErrorKind;
import io.evitadb.subtitler.quality.Sleeper;
import io.evitadb.subtitler.quality.TranslationException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Wraps a ChatModel with request throttling and permanent failure detection for coordinated shutdown.
 *
 * This client adds:
 * - A cap on in-flight requests shared by all jobs using the client
 * - A minimum delay between two consecutive dispatches
 * - Detection of permanent failures (authentication, invalid request, etc.)
 * - Fast-fail for subsequent calls after permanent failure
 *
 * Every failure leaves as a {@link TranslationException} classified by {@link ErrorClassifier}, so that the
 * translation pass can decide about retries on its own.
 */
public final class LlmClient implements LanguageModelClient {

	/**
	 * Default number of requests allowed in flight at once.
	 */
	public static final int DEFAULT_MAX_CONCURRENT_REQUESTS = 4;

	@Nonnull
	private final ChatModel model;
	@Nonnull
	private final Semaphore permits;
	@Nonnull
	private final Duration dispatchDelay;
	@Nonnull
	private final Sleeper sleeper;
	@Nonnull
	private final AtomicBoolean permanentFailure = new AtomicBoolean(false);
	@Nonnull
	private final AtomicReference<NonRetriableException> failureCause = new AtomicReference<>();
	@Nonnull
	private final Object dispatchLock = new Object();
	private long lastDispatchNanos;
	private boolean dispatched;

	/**
	 * Creates a client with default throttling and no dispatch delay.
	 *
	 * @param model the underlying chat model
	 */
	public LlmClient(@Nonnull ChatModel model) {
		this(model, DEFAULT_MAX_CONCURRENT_REQUESTS, Duration.ZERO, Sleeper.SYSTEM);
	}

	/**
	 * Creates a client.
	 *
	 * @param model                 the underlying chat model
	 * @param maxConcurrentRequests maximum number of requests in flight
	 * @param dispatchDelay         minimum spacing between two dispatches
	 * @param sleeper               used to wait out the dispatch delay
	 */
	public LlmClient(
		@Nonnull ChatModel model,
		int maxConcurrentRequests,
		@Nonnull Duration dispatchDelay,
		@Nonnull Sleeper sleeper
	) {
		this.model = Objects.requireNonNull(model, "model must not be null");
		if (maxConcurrentRequests < 1) {
			throw new IllegalArgumentException("maxConcurrentRequests must be at least 1");
		}
		this.dispatchDelay = Objects.requireNonNull(dispatchDelay, "dispatchDelay must not be null");
		if (dispatchDelay.isNegative()) {
			throw new IllegalArgumentException("dispatchDelay must not be negative");
		}
		this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
		this.permits = new Semaphore(maxConcurrentRequests, true);
	}

	/**
	 * Sends the system prompt and payload to the model.
	 *
	 * - Fast-fails if shutdown flag is set (another thread hit permanent failure)
	 * - On {@link NonRetriableException}: sets shutdown flag and rethrows it classified
	 * - Other exceptions: rethrown classified, the caller decides about retries
	 *
	 * @param systemPrompt task instructions
	 * @param payload      request body
	 * @return the model output and token usage
	 * @throws TranslationException on any failure
	 */
	@Nonnull
	@Override
	public CompletionResult complete(@Nonnull String systemPrompt, @Nonnull String payload) {
		Objects.requireNonNull(systemPrompt, "systemPrompt must not be null");
		Objects.requireNonNull(payload, "payload must not be null");
		return send(List.of(SystemMessage.from(systemPrompt), UserMessage.from(payload)));
	}

	@Nonnull
	private CompletionResult send(@Nonnull List<ChatMessage> messages) {
		// Fast-fail if permanent failure already occurred
		if (this.permanentFailure.get()) {
			final NonRetriableException cause = this.failureCause.get();
			throw new TranslationException(
				ErrorKind.PROVIDER_ERROR,
				"LLM client shutdown due to previous permanent failure" +
					(cause != null ? ": " + cause.getMessage() : ""),
				cause
			);
		}

		try {
			this.permits.acquire();
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new TranslationException(ErrorKind.RESOURCE_EXHAUSTED, "Interrupted while waiting for a request slot", e);
		}
		try {
			awaitDispatchSlot();
			final ChatResponse response = this.model.chat(messages);
			return toResult(response);
		} catch (NonRetriableException e) {
			this.failureCause.set(e);
			this.permanentFailure.set(true);
			throw ErrorClassifier.toTranslationException(e);
		} catch (TranslationException e) {
			throw e;
		} catch (RuntimeException e) {
			throw ErrorClassifier.toTranslationException(e);
		} finally {
			this.permits.release();
		}
	}

	private void awaitDispatchSlot() {
		if (this.dispatchDelay.isZero()) {
			return;
		}
		synchronized (this.dispatchLock) {
			if (this.dispatched) {
				final long elapsed = System.nanoTime() - this.lastDispatchNanos;
				final long remaining = this.dispatchDelay.toNanos() - elapsed;
				if (remaining > 0) {
					try {
						this.sleeper.sleep(Duration.ofNanos(remaining));
					} catch (InterruptedException e) {
						Thread.currentThread().interrupt();
						throw new TranslationException(ErrorKind.RESOURCE_EXHAUSTED, "Interrupted while waiting to dispatch", e);
					}
				}
			}
			this.lastDispatchNanos = System.nanoTime();
			this.dispatched = true;
		}
	}

	@Nonnull
	private static CompletionResult toResult(@Nullable ChatResponse response) {
		if (response == null || response.aiMessage() == null || response.aiMessage().text() == null) {
			throw new TranslationException(ErrorKind.INVALID_RESPONSE, "Model returned no text");
		}
		final TokenUsage usage = response.tokenUsage();
		final int input = usage != null && usage.inputTokenCount() != null ? usage.inputTokenCount() : 0;
		final int output = usage != null && usage.outputTokenCount() != null ? usage.outputTokenCount() : 0;
		return new CompletionResult(response.aiMessage().text(), input, output);
	}

	/**
	 * Checks if a permanent failure has occurred.
	 * When true, all subsequent calls to {@link #complete(String, String)} will fail immediately.
	 *
	 * @return true if permanent failure, false otherwise
	 */
	public boolean hasPermanentFailure() {
		return this.permanentFailure.get();
	}

	/**
	 * Returns the cause of the permanent failure, if any.
	 *
	 * @return the permanent failure exception or null
	 */
	@Nullable
	public NonRetriableException getFailureCause() {
		return this.failureCause.get();
	}

	/**
	 * Returns the number of request slots currently free.
	 *
	 * @return available permits
	 */
	public int availableSlots() {
		return this.permits.availablePermits();
	}

	/**
	 * Signals shutdown to abort pending operations.
	 * Called by TranslationExecutor when it detects a permanent failure.
	 */
	public void signalShutdown() {
		this.permanentFailure.set(true);
	}

	/**
	 * Signals shutdown with a specific cause.
	 *
	 * @param cause the permanent failure that triggered shutdown
	 */
	public void signalShutdown(@Nonnull NonRetriableException cause) {
		this.failureCause.set(cause);
		this.permanentFailure.set(true);
	}
}
