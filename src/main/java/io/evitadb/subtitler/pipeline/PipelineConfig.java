package io.evitadb.subtitler.pipeline;

import io.evitadb.subtitler.quality.QualityThresholds;
import io.evitadb.subtitler.translation.TranslationPassConfig;
import io.evitadb.subtitler.validation.ValidationConfig;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Settings of the whole {@link TranslationPipeline}.
 *
 * @param enableAnalysis    whether the analysis phase runs
 * @param enableValidation  whether the validation and repair phase runs
 * @param analysisConfig    analysis settings
 * @param translationConfig translation settings
 * @param validationConfig  validation settings
 * @param qualityThresholds thresholds of the quality metrics computed at the end
 * @param feedbackRounds    how many times entries with unresolved issues are sent back with corrective feedback
 */
public record PipelineConfig(
	boolean enableAnalysis,
	boolean enableValidation,
	@Nonnull AnalysisConfig analysisConfig,
	@Nonnull TranslationPassConfig translationConfig,
	@Nonnull ValidationConfig validationConfig,
	@Nonnull QualityThresholds qualityThresholds,
	int feedbackRounds
) {

	public PipelineConfig {
		Objects.requireNonNull(analysisConfig, "analysisConfig must not be null");
		Objects.requireNonNull(translationConfig, "translationConfig must not be null");
		Objects.requireNonNull(validationConfig, "validationConfig must not be null");
		Objects.requireNonNull(qualityThresholds, "qualityThresholds must not be null");
		if (feedbackRounds < 0) {
			throw new IllegalArgumentException("feedbackRounds must not be negative");
		}
	}

	@Nonnull
	public static PipelineConfig defaults() {
		return new PipelineConfig(
			true, true, AnalysisConfig.defaults(), TranslationPassConfig.defaults(), ValidationConfig.defaults(),
			QualityThresholds.defaults(), 0
		);
	}

	/**
	 * Minimal analysis, fast translation and no validation.
	 */
	@Nonnull
	public static PipelineConfig fast() {
		return new PipelineConfig(
			true, false, AnalysisConfig.minimal(), TranslationPassConfig.fast(), ValidationConfig.defaults(),
			QualityThresholds.lenient(), 0
		);
	}

	/**
	 * Thorough analysis, large context, strict validation and one round of corrective feedback.
	 */
	@Nonnull
	public static PipelineConfig quality() {
		return new PipelineConfig(
			true, true, AnalysisConfig.thorough(), TranslationPassConfig.quality(), ValidationConfig.strict(),
			QualityThresholds.strict(), 1
		);
	}

	@Nonnull
	public PipelineConfig withAnalysis(boolean enabled) {
		return new PipelineConfig(
			enabled, this.enableValidation, this.analysisConfig, this.translationConfig, this.validationConfig,
			this.qualityThresholds, this.feedbackRounds
		);
	}

	@Nonnull
	public PipelineConfig withValidation(boolean enabled) {
		return new PipelineConfig(
			this.enableAnalysis, enabled, this.analysisConfig, this.translationConfig, this.validationConfig,
			this.qualityThresholds, this.feedbackRounds
		);
	}

	@Nonnull
	public PipelineConfig withAnalysisConfig(@Nonnull AnalysisConfig config) {
		return new PipelineConfig(
			this.enableAnalysis, this.enableValidation, config, this.translationConfig, this.validationConfig,
			this.qualityThresholds, this.feedbackRounds
		);
	}

	@Nonnull
	public PipelineConfig withTranslationConfig(@Nonnull TranslationPassConfig config) {
		return new PipelineConfig(
			this.enableAnalysis, this.enableValidation, this.analysisConfig, config, this.validationConfig,
			this.qualityThresholds, this.feedbackRounds
		);
	}

	@Nonnull
	public PipelineConfig withValidationConfig(@Nonnull ValidationConfig config) {
		return new PipelineConfig(
			this.enableAnalysis, this.enableValidation, this.analysisConfig, this.translationConfig, config,
			this.qualityThresholds, this.feedbackRounds
		);
	}

	@Nonnull
	public PipelineConfig withFeedbackRounds(int rounds) {
		return new PipelineConfig(
			this.enableAnalysis, this.enableValidation, this.analysisConfig, this.translationConfig, this.validationConfig,
			this.qualityThresholds, rounds
		);
	}
}
