package io.evitadb.subtitler.pipeline;

import io.evitadb.subtitler.analysis.GlossaryExtractor;
import io.evitadb.subtitler.analysis.HistorySummarizer;
import io.evitadb.subtitler.analysis.HistorySummary;
import io.evitadb.subtitler.analysis.SceneDetector;
import io.evitadb.subtitler.analysis.SpeakerStats;
import io.evitadb.subtitler.analysis.SpeakerTracker;
import io.evitadb.subtitler.model.Glossary;
import io.evitadb.subtitler.model.Scene;
import io.evitadb.subtitler.model.SubtitleDocument;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * Runs the configured analyses over a document before translation.
 */
public final class AnalysisPass {

	@Nonnull
	private final AnalysisConfig config;
	@Nonnull
	private final GlossaryExtractor glossaryExtractor;
	@Nonnull
	private final SceneDetector sceneDetector;
	@Nonnull
	private final SpeakerTracker speakerTracker;
	@Nonnull
	private final HistorySummarizer summarizer;

	public AnalysisPass() {
		this(AnalysisConfig.defaults());
	}

	public AnalysisPass(@Nonnull AnalysisConfig config) {
		this.config = Objects.requireNonNull(config, "config must not be null");
		this.glossaryExtractor = new GlossaryExtractor(config.extractionConfig());
		this.sceneDetector = new SceneDetector(config.sceneConfig());
		this.speakerTracker = new SpeakerTracker(config.speakerConfig());
		this.summarizer = new HistorySummarizer(config.summarizationConfig());
	}

	@Nonnull
	public AnalysisConfig getConfig() {
		return this.config;
	}

	/**
	 * Analyses the document and stores the results on it: speakers on entries, scenes with their ids, the
	 * glossary merged into the document glossary, character names and the summary.
	 *
	 * Speakers are detected first so that scene detection can break on speaker changes.
	 *
	 * @param document the document, updated in place
	 * @return what was found
	 */
	@Nonnull
	public AnalysisResult analyzeAndUpdate(@Nonnull SubtitleDocument document) {
		Objects.requireNonNull(document, "document must not be null");

		final SpeakerStats speakerStats = this.config.detectSpeakers()
			? this.speakerTracker.detectSpeakers(document.getEntries()) : null;

		Glossary glossary = Glossary.empty();
		if (this.config.extractGlossary()) {
			glossary = this.glossaryExtractor.extractAndUpdate(document);
		}

		List<Scene> scenes = List.of();
		if (this.config.detectScenes()) {
			scenes = this.sceneDetector.detectAndUpdate(document);
		}

		String summary = null;
		if (this.config.generateSummary() && !document.isEmpty()) {
			final HistorySummary history = this.summarizer.summarize(document.getEntries());
			if (!history.text().isEmpty()) {
				summary = history.text();
				document.setContextSummary(summary);
			}
		}

		return new AnalysisResult(glossary, scenes, speakerStats, summary);
	}
}
