package io.evitadb.subtitler;

import io.evitadb.subtitler.llm.CompletionResult;
import io.evitadb.subtitler.llm.LanguageModelClient;
import io.evitadb.subtitler.llm.PromptLoader;
import io.evitadb.subtitler.model.SubtitleEntry;
import io.evitadb.subtitler.model.TranslationJob;
import io.evitadb.subtitler.model.TranslationResult;
import io.evitadb.subtitler.pipeline.PipelineConfig;
import io.evitadb.subtitler.quality.ErrorKind;
import io.evitadb.subtitler.quality.TranslationException;
import io.evitadb.subtitler.session.ContentHasher;
import io.evitadb.subtitler.session.SessionKey;
import org.apache.maven.plugin.logging.Log;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Translator should translate subtitle jobs through the pipeline")
public class TranslatorTest {

	private static final PipelineConfig CONFIG = PipelineConfig.defaults().withAnalysis(false);

	private ScriptedClient client;

	@BeforeEach
	void setUp() {
		client = new ScriptedClient();
	}

	@Test
	@DisplayName("shouldTranslateJobSuccessfully")
	void shouldTranslateJobSuccessfully() {
		client.respond("{\"translations\":["
			+ "{\"id\":3,\"translated\":\"Ahoj.\",\"confidence\":0.9},"
			+ "{\"id\":5,\"translated\":\"Tak zatím.\",\"confidence\":0.9}]}");

		final TranslationResult result = translator(CONFIG, () -> false)
			.translate(job(null)).toCompletableFuture().join();

		assertTrue(result.success());
		assertNull(result.errorMessage());
		assertEquals(
			List.of(
				new SubtitleEntry(1, 1_000, 2_000, "Ahoj."),
				new SubtitleEntry(2, 3_000, 4_000, "Tak zatím.")
			),
			result.translatedEntries()
		);
		assertEquals(10, result.inputTokens());
		assertEquals(5, result.outputTokens());
		assertEquals("NEW", result.getType());
	}

	@Test
	@DisplayName("shouldReturnFailureResultOnConfigurationError")
	void shouldReturnFailureResultOnConfigurationError() {
		client.fail(new TranslationException(ErrorKind.CONFIG_ERROR, "Invalid API key"));

		final TranslationResult result = translator(CONFIG, () -> false)
			.translate(job(null)).toCompletableFuture().join();

		assertFalse(result.success());
		assertNull(result.translatedEntries());
		assertEquals("Translation failed (CONFIG_ERROR): Invalid API key", result.errorMessage());
		assertNotNull(result.pipeline());
		assertFalse(result.isCancelled());
	}

	@Test
	@DisplayName("shouldReturnFailureResultOnUnexpectedException")
	void shouldReturnFailureResultOnUnexpectedException() {
		final TranslationResult result = translator(CONFIG, () -> false)
			.translate(job(null)).toCompletableFuture().join();

		assertFalse(result.success());
		assertEquals("IllegalStateException: No scripted answer left", result.errorMessage());
	}

	@Test
	@DisplayName("shouldNotStartWhenAlreadyCancelled")
	void shouldNotStartWhenAlreadyCancelled() {
		final TranslationResult result = translator(CONFIG, () -> true)
			.translate(job(null)).toCompletableFuture().join();

		assertFalse(result.success());
		assertEquals("Translation cancelled before start", result.errorMessage());
		assertTrue(client.payloads.isEmpty());
	}

	@Test
	@DisplayName("shouldAppendJobInstructionsToConfiguredInstructions")
	void shouldAppendJobInstructionsToConfiguredInstructions() {
		client.respond("{\"translations\":["
			+ "{\"id\":3,\"translated\":\"Ahoj.\"},{\"id\":5,\"translated\":\"Tak zatím.\"}]}");
		final PipelineConfig config = CONFIG.withTranslationConfig(
			CONFIG.translationConfig().withInstructions("Use informal address.")
		);

		translator(config, () -> false).translate(job("Keep the names.")).toCompletableFuture().join();

		assertTrue(client.payloads.get(0).contains("Use informal address.\\n\\nKeep the names."));
	}

	private Translator translator(PipelineConfig config, BooleanSupplier cancellation) {
		return new Translator(client, config, new PromptLoader(), delay -> {}, cancellation, new TestLog(), Runnable::run);
	}

	private static TranslationJob job(String instructions) {
		final List<SubtitleEntry> entries = List.of(
			new SubtitleEntry(3, 1_000, 2_000, "Hello."),
			new SubtitleEntry(5, 3_000, 4_000, "Bye now.")
		);
		return new TranslationJob(
			TranslationJob.Type.NEW, Path.of("src/en/e01.srt"), Path.of("target/cs/e01.srt"), "en",
			Locale.forLanguageTag("cs"), entries,
			new SessionKey(ContentHasher.sha256("e01"), "en", "cs", "openai", "gpt-4o"),
			instructions
		);
	}

	/**
	 * Replays queued answers and records the payloads it received.
	 */
	private static class ScriptedClient implements LanguageModelClient {
		private final Deque<Object> answers = new ArrayDeque<>();
		private final List<String> payloads = new ArrayList<>();

		void respond(String text) {
			answers.add(text);
		}

		void fail(RuntimeException exception) {
			answers.add(exception);
		}

		@Override
		public CompletionResult complete(String systemPrompt, String payload) {
			payloads.add(payload);
			final Object answer = answers.poll();
			if (answer == null) {
				throw new IllegalStateException("No scripted answer left");
			}
			if (answer instanceof RuntimeException exception) {
				throw exception;
			}
			return new CompletionResult((String) answer, 10, 5);
		}
	}

	private static class TestLog implements Log {
		@Override public boolean isDebugEnabled() { return false; }
		@Override public void debug(CharSequence content) {}
		@Override public void debug(CharSequence content, Throwable error) {}
		@Override public void debug(Throwable error) {}
		@Override public boolean isInfoEnabled() { return true; }
		@Override public void info(CharSequence content) {}
		@Override public void info(CharSequence content, Throwable error) {}
		@Override public void info(Throwable error) {}
		@Override public boolean isWarnEnabled() { return true; }
		@Override public void warn(CharSequence content) {}
		@Override public void warn(CharSequence content, Throwable error) {}
		@Override public void warn(Throwable error) {}
		@Override public boolean isErrorEnabled() { return true; }
		@Override public void error(CharSequence content) {}
		@Override public void error(CharSequence content, Throwable error) {}
		@Override public void error(Throwable error) {}
	}
}
