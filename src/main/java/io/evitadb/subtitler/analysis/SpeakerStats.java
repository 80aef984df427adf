package io.evitadb.subtitler.analysis;

/**
 * Outcome of a speaker detection run.
 *
 * @param entriesAnalyzed     number of entries inspected
 * @param entriesWithSpeakers number of entries that received a speaker
 * @param uniqueSpeakers      number of accepted speaker labels
 * @param soundEffectsFound   number of non-dialogue cues encountered
 */
public record SpeakerStats(
	int entriesAnalyzed,
	int entriesWithSpeakers,
	int uniqueSpeakers,
	int soundEffectsFound
) {
}
