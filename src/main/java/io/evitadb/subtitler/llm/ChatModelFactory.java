package io.evitadb.subtitler.llm;

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Factory for creating LangChain4j ChatModel instances for subtitle translation.
 * Supports OpenAI-compatible endpoints (OpenAI, Groq, DeepSeek, etc.), local Ollama and Anthropic.
 */
public final class ChatModelFactory {

	public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(3);
	/**
	 * Retries are driven by the translation pass, the models send every request once.
	 */
	static final int MODEL_MAX_RETRIES = 0;
	/**
	 * Low temperature keeps terminology stable across batches.
	 */
	private static final double DEFAULT_TEMPERATURE = 0.2;
	private static final String DEFAULT_OPENAI_MODEL = "gpt-4o-mini";
	private static final String DEFAULT_ANTHROPIC_MODEL = "claude-3-5-haiku-latest";
	private static final String DEFAULT_OLLAMA_MODEL = "llama3.1";

	public static final String PROVIDER_OPENAI = "openai";
	public static final String PROVIDER_ANTHROPIC = "anthropic";
	public static final String PROVIDER_OLLAMA = "ollama";

	public static final String DEFAULT_OPENAI_URL = "https://api.openai.com/v1";
	public static final String DEFAULT_ANTHROPIC_URL = "https://api.anthropic.com/v1";
	public static final String DEFAULT_OLLAMA_URL = "http://localhost:11434/v1";

	private ChatModelFactory() {
		// Utility class - prevent instantiation
	}

	/**
	 * Creates a ChatModel with the default timeout.
	 *
	 * @see #create(String, String, String, String, Duration)
	 */
	@Nonnull
	public static ChatModel create(
		@Nonnull String provider,
		@Nullable String llmUrl,
		@Nullable String llmToken,
		@Nullable String modelName
	) {
		return create(provider, llmUrl, llmToken, modelName, DEFAULT_TIMEOUT);
	}

	/**
	 * Creates a ChatModel for the given provider, endpoint URL, and API token.
	 *
	 * @param provider  the provider name ("openai", "anthropic" or "ollama")
	 * @param llmUrl    the base URL of the endpoint, null or blank selects the provider's public endpoint
	 * @param llmToken  the API token/key (can be null for local endpoints)
	 * @param modelName the model name to use (can be null for defaults)
	 * @param timeout   request timeout
	 * @return configured ChatModel instance
	 * @throws IllegalArgumentException if provider is unknown
	 */
	@Nonnull
	public static ChatModel create(
		@Nonnull String provider,
		@Nullable String llmUrl,
		@Nullable String llmToken,
		@Nullable String modelName,
		@Nonnull Duration timeout
	) {
		Objects.requireNonNull(provider, "provider must not be null");
		Objects.requireNonNull(timeout, "timeout must not be null");

		final String normalizedProvider = provider.toLowerCase(Locale.ROOT).trim();
		final String url = llmUrl == null || llmUrl.isBlank() ? defaultUrl(normalizedProvider) : normalizeUrl(llmUrl);

		final String model = orDefault(modelName, defaultModel(normalizedProvider));

		return switch (normalizedProvider) {
			case PROVIDER_OPENAI, PROVIDER_OLLAMA -> createOpenAiModel(url, llmToken, model, timeout);
			case PROVIDER_ANTHROPIC -> createAnthropicModel(url, llmToken, model, timeout);
			default -> throw new IllegalArgumentException("Unknown provider: " + provider);
		};
	}

	/**
	 * Returns the model used when none is configured.
	 *
	 * @param provider provider name, case-insensitive
	 * @return default model name
	 * @throws IllegalArgumentException if provider is unknown
	 */
	@Nonnull
	public static String defaultModel(@Nonnull String provider) {
		return switch (provider.toLowerCase(Locale.ROOT).trim()) {
			case PROVIDER_OPENAI -> DEFAULT_OPENAI_MODEL;
			case PROVIDER_ANTHROPIC -> DEFAULT_ANTHROPIC_MODEL;
			case PROVIDER_OLLAMA -> DEFAULT_OLLAMA_MODEL;
			default -> throw new IllegalArgumentException(
				"Unknown provider: " + provider + ". Supported providers: "
					+ PROVIDER_OPENAI + ", " + PROVIDER_ANTHROPIC + ", " + PROVIDER_OLLAMA
			);
		};
	}

	/**
	 * Returns the public endpoint of the provider.
	 *
	 * @param provider normalized provider name
	 * @return base URL
	 * @throws IllegalArgumentException if provider is unknown
	 */
	@Nonnull
	public static String defaultUrl(@Nonnull String provider) {
		return switch (provider) {
			case PROVIDER_OPENAI -> DEFAULT_OPENAI_URL;
			case PROVIDER_ANTHROPIC -> DEFAULT_ANTHROPIC_URL;
			case PROVIDER_OLLAMA -> DEFAULT_OLLAMA_URL;
			default -> throw new IllegalArgumentException("Unknown provider: " + provider);
		};
	}

	@Nonnull
	private static ChatModel createOpenAiModel(
		@Nonnull String baseUrl,
		@Nullable String apiKey,
		@Nonnull String modelName,
		@Nonnull Duration timeout
	) {
		final OpenAiChatModel.OpenAiChatModelBuilder builder = OpenAiChatModel.builder()
			.baseUrl(baseUrl)
			.modelName(modelName)
			.timeout(timeout)
			.maxRetries(MODEL_MAX_RETRIES)
			.temperature(DEFAULT_TEMPERATURE)
			.logRequests(false)
			.logResponses(false);

		// Token is optional for local endpoints like Ollama, but the client requires some value
		builder.apiKey(apiKey != null && !apiKey.isBlank() ? apiKey : "none");

		return builder.build();
	}

	@Nonnull
	private static ChatModel createAnthropicModel(
		@Nonnull String baseUrl,
		@Nullable String apiKey,
		@Nonnull String modelName,
		@Nonnull Duration timeout
	) {
		final AnthropicChatModel.AnthropicChatModelBuilder builder = AnthropicChatModel.builder()
			.baseUrl(baseUrl)
			.modelName(modelName)
			.timeout(timeout)
			.maxRetries(MODEL_MAX_RETRIES)
			.temperature(DEFAULT_TEMPERATURE)
			.logRequests(false)
			.logResponses(false);

		if (apiKey != null && !apiKey.isBlank()) {
			builder.apiKey(apiKey);
		}

		return builder.build();
	}

	@Nonnull
	private static String orDefault(@Nullable String modelName, @Nonnull String defaultName) {
		return modelName != null && !modelName.isBlank() ? modelName : defaultName;
	}

	/**
	 * Normalizes the URL by removing trailing slashes.
	 */
	@Nonnull
	private static String normalizeUrl(@Nonnull String url) {
		String normalized = url.trim();
		while (normalized.endsWith("/")) {
			normalized = normalized.substring(0, normalized.length() - 1);
		}
		return normalized;
	}
}
