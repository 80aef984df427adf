package io.evitadb.subtitler.pipeline;

import io.evitadb.subtitler.analysis.ExtractionConfig;
import io.evitadb.subtitler.analysis.SceneDetectionConfig;
import io.evitadb.subtitler.analysis.SpeakerConfig;
import io.evitadb.subtitler.analysis.SummarizationConfig;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Selects which analyses run before translation and how they are tuned.
 *
 * @param extractionConfig    glossary extraction settings
 * @param sceneConfig         scene detection settings
 * @param speakerConfig       speaker detection settings
 * @param summarizationConfig document summary settings
 * @param extractGlossary     whether to extract character names and terms
 * @param detectSpeakers      whether to detect speaker labels
 * @param detectScenes        whether to split the document into scenes
 * @param generateSummary     whether to attach an extractive summary to the document
 */
public record AnalysisConfig(
	@Nonnull ExtractionConfig extractionConfig,
	@Nonnull SceneDetectionConfig sceneConfig,
	@Nonnull SpeakerConfig speakerConfig,
	@Nonnull SummarizationConfig summarizationConfig,
	boolean extractGlossary,
	boolean detectSpeakers,
	boolean detectScenes,
	boolean generateSummary
) {

	public AnalysisConfig {
		Objects.requireNonNull(extractionConfig, "extractionConfig must not be null");
		Objects.requireNonNull(sceneConfig, "sceneConfig must not be null");
		Objects.requireNonNull(speakerConfig, "speakerConfig must not be null");
		Objects.requireNonNull(summarizationConfig, "summarizationConfig must not be null");
	}

	@Nonnull
	public static AnalysisConfig defaults() {
		return new AnalysisConfig(
			ExtractionConfig.defaults(), SceneDetectionConfig.defaults(), SpeakerConfig.defaults(),
			SummarizationConfig.defaults(), true, true, true, true
		);
	}

	/**
	 * Glossary extraction only, with the minimal extraction preset.
	 */
	@Nonnull
	public static AnalysisConfig minimal() {
		return new AnalysisConfig(
			ExtractionConfig.minimal(), SceneDetectionConfig.defaults(), SpeakerConfig.defaults(),
			SummarizationConfig.defaults(), true, false, false, false
		);
	}

	/**
	 * Everything enabled, with aggressive extraction and detailed scene detection.
	 */
	@Nonnull
	public static AnalysisConfig thorough() {
		return new AnalysisConfig(
			ExtractionConfig.aggressive(), SceneDetectionConfig.detailed(), SpeakerConfig.defaults(),
			SummarizationConfig.defaults(), true, true, true, true
		);
	}

	@Nonnull
	public AnalysisConfig withGlossaryExtraction(boolean enabled) {
		return new AnalysisConfig(
			this.extractionConfig, this.sceneConfig, this.speakerConfig, this.summarizationConfig,
			enabled, this.detectSpeakers, this.detectScenes, this.generateSummary
		);
	}

	@Nonnull
	public AnalysisConfig withSpeakerDetection(boolean enabled) {
		return new AnalysisConfig(
			this.extractionConfig, this.sceneConfig, this.speakerConfig, this.summarizationConfig,
			this.extractGlossary, enabled, this.detectScenes, this.generateSummary
		);
	}

	@Nonnull
	public AnalysisConfig withSceneDetection(boolean enabled) {
		return new AnalysisConfig(
			this.extractionConfig, this.sceneConfig, this.speakerConfig, this.summarizationConfig,
			this.extractGlossary, this.detectSpeakers, enabled, this.generateSummary
		);
	}

	@Nonnull
	public AnalysisConfig withSceneConfig(@Nonnull SceneDetectionConfig newSceneConfig) {
		return new AnalysisConfig(
			this.extractionConfig, newSceneConfig, this.speakerConfig, this.summarizationConfig,
			this.extractGlossary, this.detectSpeakers, this.detectScenes, this.generateSummary
		);
	}

	@Nonnull
	public AnalysisConfig withSummaryGeneration(boolean enabled) {
		return new AnalysisConfig(
			this.extractionConfig, this.sceneConfig, this.speakerConfig, this.summarizationConfig,
			this.extractGlossary, this.detectSpeakers, this.detectScenes, enabled
		);
	}
}
