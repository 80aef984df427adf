package io.evitadb.subtitler.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TranslationSummary should track translation statistics")
public class TranslationSummaryTest {

	@Test
	@DisplayName("shouldCreateEmptySummary")
	void shouldCreateEmptySummary() {
		final TranslationSummary summary = TranslationSummary.empty();

		assertEquals(0, summary.successCount());
		assertEquals(0, summary.failedCount());
		assertEquals(0, summary.skippedCount());
		assertEquals(0, summary.entriesTranslated());
		assertEquals(0, summary.getTotalCount());
		assertTrue(summary.isAllSuccessful());
	}

	@Test
	@DisplayName("shouldTrackMultipleSuccesses")
	void shouldTrackMultipleSuccesses() {
		final TranslationSummary summary = TranslationSummary.empty()
			.withSuccess(10, 100, 50)
			.withSuccess(20, 200, 100);

		assertEquals(2, summary.successCount());
		assertEquals(30, summary.entriesTranslated());
		assertEquals(300, summary.inputTokens());
		assertEquals(150, summary.outputTokens());
	}

	@Test
	@DisplayName("shouldKeepTokensOfFailedAttempt")
	void shouldKeepTokensOfFailedAttempt() {
		final TranslationSummary summary = TranslationSummary.empty()
			.withFailure(40, 10)
			.withFailure();

		assertEquals(2, summary.failedCount());
		assertEquals(40, summary.inputTokens());
		assertTrue(summary.hasFailures());
		assertFalse(summary.isAllSuccessful());
	}

	@Test
	@DisplayName("shouldAddSummaries")
	void shouldAddSummaries() {
		final TranslationSummary first = TranslationSummary.empty().withSuccess(5, 10, 5).withSkipped();
		final TranslationSummary second = TranslationSummary.empty().withFailure(1, 1);

		final TranslationSummary total = first.add(second);

		assertEquals(1, total.successCount());
		assertEquals(1, total.failedCount());
		assertEquals(1, total.skippedCount());
		assertEquals(3, total.getTotalCount());
		assertEquals(11, total.inputTokens());
		assertTrue(total.toString().contains("entries=5"));
	}
}
