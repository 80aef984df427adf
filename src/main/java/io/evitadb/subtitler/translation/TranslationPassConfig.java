package io.evitadb.subtitler.translation;

import io.evitadb.subtitler.context.ContextWindowConfig;
import io.evitadb.subtitler.context.DynamicWindowConfig;
import io.evitadb.subtitler.quality.RecoveryStrategy;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Settings of the {@link TranslationPass}.
 *
 * @param window                window shape
 * @param acceptGlossaryUpdates whether glossary updates suggested by the model are merged into the document
 * @param useExtractiveFallback whether a batch that cannot be translated yields empty placeholders instead of failing
 * @param customInstructions    extra instructions passed to the model, may be null
 * @param recoveryStrategy      retry and fallback policy
 * @param dynamicSizing         batch sizing by content, null for the fixed window batch size
 * @param maxLengthRatio        length ratio the model is asked to respect
 */
public record TranslationPassConfig(
	@Nonnull ContextWindowConfig window,
	boolean acceptGlossaryUpdates,
	boolean useExtractiveFallback,
	@Nullable String customInstructions,
	@Nonnull RecoveryStrategy recoveryStrategy,
	@Nullable DynamicWindowConfig dynamicSizing,
	double maxLengthRatio
) {

	public static final double DEFAULT_MAX_LENGTH_RATIO = 1.2;

	public TranslationPassConfig {
		Objects.requireNonNull(window, "window must not be null");
		Objects.requireNonNull(recoveryStrategy, "recoveryStrategy must not be null");
		if (maxLengthRatio <= 0) {
			throw new IllegalArgumentException("maxLengthRatio must be positive");
		}
	}

	@Nonnull
	public static TranslationPassConfig defaults() {
		return new TranslationPassConfig(
			ContextWindowConfig.defaults(), true, true, null, RecoveryStrategy.defaults(), null, DEFAULT_MAX_LENGTH_RATIO
		);
	}

	/**
	 * Small windows, a single retry and no glossary learning.
	 */
	@Nonnull
	public static TranslationPassConfig fast() {
		return new TranslationPassConfig(
			ContextWindowConfig.minimal(), false, true, null, RecoveryStrategy.defaults().withMaxRetries(1), null,
			DEFAULT_MAX_LENGTH_RATIO
		);
	}

	/**
	 * Large context and content-based batch sizing.
	 */
	@Nonnull
	public static TranslationPassConfig quality() {
		return new TranslationPassConfig(
			ContextWindowConfig.largeContext(), true, true, null, RecoveryStrategy.defaults(), DynamicWindowConfig.quality(),
			DEFAULT_MAX_LENGTH_RATIO
		);
	}

	/**
	 * Returns the retry cap of the recovery strategy.
	 *
	 * @return maximum retries per batch
	 */
	public int maxRetries() {
		return this.recoveryStrategy.maxRetries();
	}

	@Nonnull
	public TranslationPassConfig withMaxRetries(int maxRetries) {
		return withRecoveryStrategy(this.recoveryStrategy.withMaxRetries(maxRetries));
	}

	@Nonnull
	public TranslationPassConfig withInstructions(@Nullable String instructions) {
		return new TranslationPassConfig(
			this.window, this.acceptGlossaryUpdates, this.useExtractiveFallback, instructions,
			this.recoveryStrategy, this.dynamicSizing, this.maxLengthRatio
		);
	}

	@Nonnull
	public TranslationPassConfig withWindow(@Nonnull ContextWindowConfig newWindow) {
		return new TranslationPassConfig(
			newWindow, this.acceptGlossaryUpdates, this.useExtractiveFallback, this.customInstructions,
			this.recoveryStrategy, this.dynamicSizing, this.maxLengthRatio
		);
	}

	@Nonnull
	public TranslationPassConfig withRecoveryStrategy(@Nonnull RecoveryStrategy strategy) {
		return new TranslationPassConfig(
			this.window, this.acceptGlossaryUpdates, this.useExtractiveFallback, this.customInstructions,
			strategy, this.dynamicSizing, this.maxLengthRatio
		);
	}

	@Nonnull
	public TranslationPassConfig withDynamicSizing(@Nullable DynamicWindowConfig sizing) {
		return new TranslationPassConfig(
			this.window, this.acceptGlossaryUpdates, this.useExtractiveFallback, this.customInstructions,
			this.recoveryStrategy, sizing, this.maxLengthRatio
		);
	}

	@Nonnull
	public TranslationPassConfig withFallback(boolean enabled) {
		return new TranslationPassConfig(
			this.window, this.acceptGlossaryUpdates, enabled, this.customInstructions,
			this.recoveryStrategy, this.dynamicSizing, this.maxLengthRatio
		);
	}

	@Nonnull
	public TranslationPassConfig withGlossaryUpdates(boolean accept) {
		return new TranslationPassConfig(
			this.window, accept, this.useExtractiveFallback, this.customInstructions,
			this.recoveryStrategy, this.dynamicSizing, this.maxLengthRatio
		);
	}
}
