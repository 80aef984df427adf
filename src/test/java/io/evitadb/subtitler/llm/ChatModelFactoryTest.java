package io.evitadb.subtitler.llm;

import com.sun.net.httpserver.HttpServer;
import dev.langchain4j.model.chat.ChatModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ChatModelFactory should create ChatModel instances for different providers")
public class ChatModelFactoryTest {

	@Test
	@DisplayName("shouldCreateOpenAiModelWithUrl")
	void shouldCreateOpenAiModelWithUrl() {
		final ChatModel model = ChatModelFactory.create("openai", "https://api.openai.com/v1", "test-api-key", "gpt-4o");

		assertNotNull(model);
	}

	@Test
	@DisplayName("shouldCreateAnthropicModelWithUrl")
	void shouldCreateAnthropicModelWithUrl() {
		final ChatModel model = ChatModelFactory.create(
			"anthropic", "https://api.anthropic.com/v1", "test-api-key", "claude-sonnet-4-20250514"
		);

		assertNotNull(model);
	}

	@Test
	@DisplayName("shouldCreateOllamaModelWithoutToken")
	void shouldCreateOllamaModelWithoutToken() {
		assertNotNull(ChatModelFactory.create("ollama", null, null, null));
	}

	@Test
	@DisplayName("shouldFallBackToPublicEndpointWhenUrlIsMissing")
	void shouldFallBackToPublicEndpointWhenUrlIsMissing() {
		assertNotNull(ChatModelFactory.create("openai", null, "key", null));
		assertNotNull(ChatModelFactory.create("anthropic", "   ", "key", null));
		assertEquals(ChatModelFactory.DEFAULT_ANTHROPIC_URL, ChatModelFactory.defaultUrl("anthropic"));
	}

	@Test
	@DisplayName("shouldThrowOnInvalidProvider")
	void shouldThrowOnInvalidProvider() {
		final Exception exception = assertThrows(IllegalArgumentException.class, () ->
			ChatModelFactory.create("unknown", "https://example.com", "key", null)
		);

		assertTrue(exception.getMessage().contains("Unknown provider"));
		assertTrue(exception.getMessage().contains("openai"));
		assertTrue(exception.getMessage().contains("anthropic"));
	}

	@Test
	@DisplayName("shouldResolveDefaultModelPerProvider")
	void shouldResolveDefaultModelPerProvider() {
		assertEquals("gpt-4o-mini", ChatModelFactory.defaultModel("openai"));
		assertEquals("claude-3-5-haiku-latest", ChatModelFactory.defaultModel(" Anthropic "));
		assertEquals("llama3.1", ChatModelFactory.defaultModel("OLLAMA"));
		assertThrows(IllegalArgumentException.class, () -> ChatModelFactory.defaultModel("gemini"));
	}

	@Test
	@DisplayName("shouldHandleBlankToken")
	void shouldHandleBlankToken() {
		// blank token is allowed for local endpoints
		final ChatModel model = ChatModelFactory.create("openai", "http://localhost:11434/v1", "   ", null);

		assertNotNull(model);
	}

	@Test
	@DisplayName("shouldNormalizeUrlTrailingSlash")
	void shouldNormalizeUrlTrailingSlash() {
		final ChatModel model = ChatModelFactory.create("openai", "https://api.openai.com/v1///", "key", null);

		assertNotNull(model);
	}

	@Test
	@DisplayName("shouldAcceptCaseInsensitiveProvider")
	void shouldAcceptCaseInsensitiveProvider() {
		assertNotNull(ChatModelFactory.create("OPENAI", "https://api.openai.com/v1", "key", null));
		assertNotNull(ChatModelFactory.create("  Anthropic  ", "https://api.anthropic.com/v1", "key", "   "));
	}

	@Test
	@DisplayName("shouldThrowOnNullProvider")
	void shouldThrowOnNullProvider() {
		assertThrows(NullPointerException.class, () ->
			ChatModelFactory.create(null, "https://example.com", "key", null)
		);
	}

	@Test
	@DisplayName("shouldSendRateLimitedOpenAiRequestOnlyOnce")
	void shouldSendRateLimitedOpenAiRequestOnlyOnce() throws IOException {
		assertEquals(1, requestsUntilFailure("openai"));
	}

	@Test
	@DisplayName("shouldSendRateLimitedAnthropicRequestOnlyOnce")
	void shouldSendRateLimitedAnthropicRequestOnlyOnce() throws IOException {
		assertEquals(1, requestsUntilFailure("anthropic"));
	}

	/**
	 * Points the model at a local endpoint that answers every request with 429 and counts the requests.
	 */
	private static int requestsUntilFailure(String provider) throws IOException {
		final AtomicInteger requests = new AtomicInteger();
		final HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
		server.createContext("/", exchange -> {
			requests.incrementAndGet();
			exchange.getRequestBody().readAllBytes();
			final byte[] body = "{\"error\":{\"message\":\"Rate limit reached\",\"type\":\"rate_limit_error\"}}"
				.getBytes(StandardCharsets.UTF_8);
			exchange.getResponseHeaders().add("Content-Type", "application/json");
			exchange.sendResponseHeaders(429, body.length);
			try (OutputStream out = exchange.getResponseBody()) {
				out.write(body);
			}
		});
		server.start();
		try {
			final ChatModel model = ChatModelFactory.create(
				provider, "http://127.0.0.1:" + server.getAddress().getPort() + "/v1", "key", null, Duration.ofSeconds(10)
			);
			assertThrows(RuntimeException.class, () -> model.chat("Hello"));
			return requests.get();
		} finally {
			server.stop(0);
		}
	}
}
