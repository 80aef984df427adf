package io.evitadb.subtitler.pipeline;

import io.evitadb.subtitler.analysis.SpeakerStats;
import io.evitadb.subtitler.model.Glossary;
import io.evitadb.subtitler.model.Scene;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * What the analysis phase learned about a document.
 *
 * @param glossary     extracted glossary
 * @param scenes       detected scenes
 * @param speakerStats speaker detection counters, null when speaker detection did not run
 * @param summary      extractive summary, null when not generated
 */
public record AnalysisResult(
	@Nonnull Glossary glossary,
	@Nonnull List<Scene> scenes,
	@Nullable SpeakerStats speakerStats,
	@Nullable String summary
) {

	public AnalysisResult {
		Objects.requireNonNull(glossary, "glossary must not be null");
		scenes = List.copyOf(Objects.requireNonNull(scenes, "scenes must not be null"));
	}

	@Nonnull
	public static AnalysisResult empty() {
		return new AnalysisResult(Glossary.empty(), List.of(), null, null);
	}

	public int characterCount() {
		return this.glossary.getCharacterNames().size();
	}

	public int termCount() {
		return this.glossary.getTerms().size() + this.glossary.getTechnicalTerms().size();
	}

	public int sceneCount() {
		return this.scenes.size();
	}

	public int speakerCount() {
		return this.speakerStats == null ? 0 : this.speakerStats.uniqueSpeakers();
	}

	public boolean hasData() {
		return !this.glossary.isEmpty() || !this.scenes.isEmpty() || speakerCount() > 0 || this.summary != null;
	}

	/**
	 * Short human readable description, e.g. "3 characters, 5 terms, 2 scenes".
	 *
	 * @return description, "no analysis data" when nothing was found
	 */
	@Nonnull
	public String description() {
		final List<String> parts = new ArrayList<>(5);
		if (characterCount() > 0) {
			parts.add(characterCount() + " characters");
		}
		if (termCount() > 0) {
			parts.add(termCount() + " terms");
		}
		if (speakerCount() > 0) {
			parts.add(speakerCount() + " speakers");
		}
		if (sceneCount() > 0) {
			parts.add(sceneCount() + " scenes");
		}
		if (this.summary != null) {
			parts.add("summary generated");
		}
		return parts.isEmpty() ? "no analysis data" : String.join(", ", parts);
	}
}
