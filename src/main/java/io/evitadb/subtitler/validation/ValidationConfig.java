package io.evitadb.subtitler.validation;

import io.evitadb.subtitler.quality.LanguagePairThresholds;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Settings of the {@link ValidationPass}.
 *
 * @param maxLengthRatio           longest acceptable translation relative to the original
 * @param minLengthRatio           shortest acceptable translation relative to the original
 * @param checkFormatting          whether formatting tags must survive
 * @param checkGlossaryConsistency whether names and glossary terms are checked
 * @param enableAutoRepair         whether {@link ValidationPass#validateAndRepair} repairs what it can
 * @param minConfidence            translations reported below this confidence are flagged
 * @param languagePairThresholds   whether calibrated length bounds of the document's language pair replace
 *                                 the ratio bounds above, see {@link LanguagePairThresholds}
 */
public record ValidationConfig(
	double maxLengthRatio,
	double minLengthRatio,
	boolean checkFormatting,
	boolean checkGlossaryConsistency,
	boolean enableAutoRepair,
	double minConfidence,
	boolean languagePairThresholds
) {

	public ValidationConfig {
		if (minLengthRatio < 0 || maxLengthRatio <= minLengthRatio) {
			throw new IllegalArgumentException("Length ratio bounds must satisfy 0 <= min < max");
		}
		if (minConfidence < 0 || minConfidence > 1) {
			throw new IllegalArgumentException("minConfidence must be between 0 and 1");
		}
	}

	@Nonnull
	public static ValidationConfig defaults() {
		return new ValidationConfig(1.5, 0.3, true, true, true, 0.5, true);
	}

	@Nonnull
	public static ValidationConfig strict() {
		return new ValidationConfig(1.2, 0.5, true, true, true, 0.7, true);
	}

	/**
	 * Wide fixed length bounds and no glossary checks.
	 */
	@Nonnull
	public static ValidationConfig lenient() {
		return new ValidationConfig(2.0, 0.2, true, false, true, 0.3, false);
	}

	@Nonnull
	public ValidationConfig withAutoRepair(boolean enabled) {
		return new ValidationConfig(
			this.maxLengthRatio, this.minLengthRatio, this.checkFormatting, this.checkGlossaryConsistency, enabled,
			this.minConfidence, this.languagePairThresholds
		);
	}

	@Nonnull
	public ValidationConfig withMinConfidence(double threshold) {
		return new ValidationConfig(
			this.maxLengthRatio, this.minLengthRatio, this.checkFormatting, this.checkGlossaryConsistency,
			this.enableAutoRepair, threshold, this.languagePairThresholds
		);
	}

	/**
	 * Sets fixed length bounds; calibrated language pair bounds are no longer applied.
	 */
	@Nonnull
	public ValidationConfig withLengthBounds(double min, double max) {
		return new ValidationConfig(
			max, min, this.checkFormatting, this.checkGlossaryConsistency, this.enableAutoRepair, this.minConfidence,
			false
		);
	}

	@Nonnull
	public ValidationConfig withLanguagePairThresholds(boolean enabled) {
		return new ValidationConfig(
			this.maxLengthRatio, this.minLengthRatio, this.checkFormatting, this.checkGlossaryConsistency,
			this.enableAutoRepair, this.minConfidence, enabled
		);
	}

	/**
	 * Resolves the length bounds applied to a document.
	 *
	 * @param sourceLanguage language of the original
	 * @param targetLanguage language of the translation, may be null
	 * @return calibrated bounds of the pair when enabled and known, the configured bounds otherwise
	 */
	@Nonnull
	public LanguagePairThresholds lengthBounds(@Nonnull String sourceLanguage, @Nullable String targetLanguage) {
		final LanguagePairThresholds configured = new LanguagePairThresholds(
			this.minLengthRatio, this.maxLengthRatio, Math.min(Math.max(1.0, this.minLengthRatio), this.maxLengthRatio)
		);
		if (!this.languagePairThresholds) {
			return configured;
		}
		return LanguagePairThresholds.calibrated(sourceLanguage, targetLanguage).orElse(configured);
	}
}
