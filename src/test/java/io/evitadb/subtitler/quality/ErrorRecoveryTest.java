package io.evitadb.subtitler.quality;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ErrorRecovery should choose recovery actions by error kind and budget")
public class ErrorRecoveryTest {

	@Test
	@DisplayName("shouldAlwaysAbortOnConfigurationAndResourceErrors")
	void shouldAlwaysAbortOnConfigurationAndResourceErrors() {
		final ErrorRecovery recovery = new ErrorRecovery(RecoveryStrategy.aggressive());

		assertInstanceOf(RecoveryAction.Abort.class, recovery.handle(error(ErrorKind.CONFIG_ERROR, 1)));
		assertInstanceOf(RecoveryAction.Abort.class, recovery.handle(error(ErrorKind.RESOURCE_EXHAUSTED, 1)));
		assertFalse(recovery.handle(error(ErrorKind.CONFIG_ERROR, 0)).allowsContinuation());
		assertEquals(0, recovery.retryCount());
	}

	@Test
	@DisplayName("shouldBackOffExponentiallyOnRateLimit")
	void shouldBackOffExponentiallyOnRateLimit() {
		final ErrorRecovery recovery = new ErrorRecovery();

		assertEquals(new RecoveryAction.Retry(Duration.ofSeconds(60), false), recovery.handle(error(ErrorKind.RATE_LIMIT, 1)));
		assertEquals(new RecoveryAction.Retry(Duration.ofSeconds(120), false), recovery.handle(error(ErrorKind.RATE_LIMIT, 1).withRetries(1)));
		assertEquals(new RecoveryAction.Retry(Duration.ofSeconds(240), false), recovery.handle(error(ErrorKind.RATE_LIMIT, 1).withRetries(2)));
		assertEquals(3, recovery.retryCount());
	}

	@Test
	@DisplayName("shouldHalveBatchOnUnparseableResponse")
	void shouldHalveBatchOnUnparseableResponse() {
		final ErrorRecovery recovery = new ErrorRecovery();

		assertEquals(new RecoveryAction.ReduceBatchSize(5), recovery.handle(error(ErrorKind.PARSE_ERROR, 10)));
		assertEquals(new RecoveryAction.Retry(Duration.ofSeconds(2), true), recovery.handle(error(ErrorKind.INVALID_RESPONSE, 1)));
		assertEquals(new RecoveryAction.UseFallback(List.of(1)), recovery.handle(error(ErrorKind.PARSE_ERROR, 1)));
	}

	@Test
	@DisplayName("shouldNotShrinkBelowMinimumBatchSize")
	void shouldNotShrinkBelowMinimumBatchSize() {
		final ErrorRecovery recovery = new ErrorRecovery(RecoveryStrategy.fastFail());

		final RecoveryAction action = recovery.handle(error(ErrorKind.PARSE_ERROR, 15));

		assertEquals(new RecoveryAction.ReduceBatchSize(10), action);
	}

	@Test
	@DisplayName("shouldUseFinalActionOnceRetryBudgetIsSpent")
	void shouldUseFinalActionOnceRetryBudgetIsSpent() {
		final ErrorRecovery recovery = new ErrorRecovery(RecoveryStrategy.defaults().withMaxRetries(1));
		recovery.handle(error(ErrorKind.NETWORK, 2));

		assertEquals(new RecoveryAction.UseFallback(List.of(1, 2)), recovery.handle(error(ErrorKind.NETWORK, 2)));

		final ErrorRecovery noFallback = new ErrorRecovery(new RecoveryStrategy(0, Duration.ofMinutes(1), false, true, 1, false));
		assertEquals(new RecoveryAction.Skip(List.of(1)), noFallback.handle(error(ErrorKind.TIMEOUT, 1)));

		final ErrorRecovery strict = new ErrorRecovery(RecoveryStrategy.fastFail().withMaxRetries(0));
		assertInstanceOf(RecoveryAction.Abort.class, strict.handle(error(ErrorKind.TIMEOUT, 1)));
	}

	@Test
	@DisplayName("shouldContinuePartiallyOnValidationFailure")
	void shouldContinuePartiallyOnValidationFailure() {
		final RecoveryAction action = new ErrorRecovery().handle(error(ErrorKind.VALIDATION_FAILED, 2));

		assertEquals(new RecoveryAction.ContinuePartial(List.of(), List.of(1, 2)), action);
	}

	@Test
	@DisplayName("shouldSwitchProviderOnlyWhenAllowed")
	void shouldSwitchProviderOnlyWhenAllowed() {
		assertInstanceOf(
			RecoveryAction.SwitchProvider.class,
			new ErrorRecovery(RecoveryStrategy.aggressive()).handle(error(ErrorKind.PROVIDER_ERROR, 1))
		);
		assertInstanceOf(
			RecoveryAction.UseFallback.class,
			new ErrorRecovery().handle(error(ErrorKind.PROVIDER_ERROR, 1))
		);
	}

	@Test
	@DisplayName("shouldSummarizeAndResetErrors")
	void shouldSummarizeAndResetErrors() {
		final ErrorRecovery recovery = new ErrorRecovery();
		assertEquals("No errors", recovery.errorSummary());

		recovery.handle(error(ErrorKind.RATE_LIMIT, 1));
		recovery.handle(error(ErrorKind.RATE_LIMIT, 1));
		recovery.handle(error(ErrorKind.CONFIG_ERROR, 1));

		assertEquals("3 errors (2 retries): RATE_LIMIT: 2, CONFIG_ERROR: 1", recovery.errorSummary());
		recovery.reset();
		assertFalse(recovery.hasErrors());
		assertEquals(0, recovery.retryCount());
	}

	@Test
	@DisplayName("shouldResolveProfilesByName")
	void shouldResolveProfilesByName() {
		assertEquals(RecoveryStrategy.fastFail(), RecoveryStrategy.forProfile("FAST_FAIL"));
		assertEquals(RecoveryStrategy.aggressive(), RecoveryStrategy.forProfile(" aggressive "));
		assertThrows(IllegalArgumentException.class, () -> RecoveryStrategy.forProfile("reckless"));
	}

	private static TranslationException error(ErrorKind kind, int affected) {
		final List<Integer> ids = new ArrayList<>();
		for (int i = 1; i <= affected; i++) {
			ids.add(i);
		}
		return new TranslationException(kind, kind.name().toLowerCase(Locale.ROOT)).withEntries(ids);
	}
}
