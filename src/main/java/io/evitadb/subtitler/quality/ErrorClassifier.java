package io.evitadb.subtitler.quality;

import com.fasterxml.jackson.core.JsonProcessingException;
import dev.langchain4j.exception.AuthenticationException;
import dev.langchain4j.exception.InternalServerException;
import dev.langchain4j.exception.InvalidRequestException;
import dev.langchain4j.exception.ModelNotFoundException;
import dev.langchain4j.exception.NonRetriableException;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.exception.RetriableException;
import dev.langchain4j.exception.TimeoutException;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.Objects;

/**
 * Maps exceptions thrown by the model client stack onto the {@link ErrorKind} taxonomy.
 */
public final class ErrorClassifier {

	private static final int MAX_CAUSE_DEPTH = 10;

	private ErrorClassifier() {
		// Utility class - prevent instantiation
	}

	/**
	 * Classifies the throwable, looking through wrapping exceptions.
	 *
	 * @param throwable the failure
	 * @return the best matching kind, {@link ErrorKind#UNKNOWN} when nothing matches
	 */
	@Nonnull
	public static ErrorKind classify(@Nonnull Throwable throwable) {
		Objects.requireNonNull(throwable, "throwable must not be null");
		Throwable current = throwable;
		for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
			final ErrorKind kind = classifyDirect(current);
			if (kind != ErrorKind.UNKNOWN) {
				return kind;
			}
			current = current.getCause();
		}
		return ErrorKind.UNKNOWN;
	}

	/**
	 * Wraps the throwable in a {@link TranslationException} unless it already is one.
	 *
	 * @param throwable the failure
	 * @return typed translation exception
	 */
	@Nonnull
	public static TranslationException toTranslationException(@Nonnull Throwable throwable) {
		if (throwable instanceof TranslationException translationException) {
			return translationException;
		}
		final String message = throwable.getMessage() != null ? throwable.getMessage() : throwable.getClass().getSimpleName();
		return new TranslationException(classify(throwable), message, throwable);
	}

	@Nonnull
	private static ErrorKind classifyDirect(@Nonnull Throwable throwable) {
		if (throwable instanceof TranslationException translationException) {
			return translationException.getKind();
		}
		if (throwable instanceof RateLimitException) {
			return ErrorKind.RATE_LIMIT;
		}
		if (throwable instanceof TimeoutException
			|| throwable instanceof SocketTimeoutException
			|| throwable instanceof HttpTimeoutException) {
			return ErrorKind.TIMEOUT;
		}
		if (throwable instanceof AuthenticationException
			|| throwable instanceof ModelNotFoundException
			|| throwable instanceof InvalidRequestException) {
			return ErrorKind.CONFIG_ERROR;
		}
		if (throwable instanceof InternalServerException) {
			return ErrorKind.PROVIDER_ERROR;
		}
		if (throwable instanceof NonRetriableException) {
			return ErrorKind.PROVIDER_ERROR;
		}
		if (throwable instanceof JsonProcessingException) {
			return ErrorKind.PARSE_ERROR;
		}
		if (throwable instanceof IOException) {
			return ErrorKind.NETWORK;
		}
		if (throwable instanceof RetriableException) {
			return ErrorKind.NETWORK;
		}
		if (throwable instanceof OutOfMemoryError) {
			return ErrorKind.RESOURCE_EXHAUSTED;
		}
		return ErrorKind.UNKNOWN;
	}
}
