package io.evitadb.subtitler.analysis;

import io.evitadb.subtitler.model.DocumentEntry;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects speaker labels such as `JOHN: Hello` or `[Mary]: Hi` and assigns speakers to entries.
 *
 * A label is accepted only once it has been seen {@link SpeakerConfig#minOccurrences()} times. Entries whose
 * whole text is a bracketed or parenthesized cue are treated as non-dialogue and never receive a speaker.
 */
public final class SpeakerTracker {

	private static final Pattern SPEAKER_PATTERN = Pattern.compile("^(?:\\[)?([A-Z][A-Za-z \t.]+?)(?:])?:[ \t]*");
	private static final Pattern SOUND_EFFECT_PATTERN = Pattern.compile("^\\[.+]$|^\\(.+\\)$", Pattern.DOTALL);
	private static final int SHOUTED_WORD_MAX_LENGTH = 20;

	@Nonnull
	private final SpeakerConfig config;

	public SpeakerTracker() {
		this(SpeakerConfig.defaults());
	}

	public SpeakerTracker(@Nonnull SpeakerConfig config) {
		this.config = Objects.requireNonNull(config, "config must not be null");
	}

	@Nonnull
	public SpeakerConfig getConfig() {
		return this.config;
	}

	/**
	 * Detects speakers and stores them on the entries, replacing speakers stored by an earlier run.
	 *
	 * @param entries entries in display order
	 * @return detection statistics
	 */
	@Nonnull
	public SpeakerStats detectSpeakers(@Nonnull List<DocumentEntry> entries) {
		Objects.requireNonNull(entries, "entries must not be null");
		for (final DocumentEntry entry : entries) {
			entry.setSpeaker(null);
		}

		int soundEffects = 0;
		final Map<String, Integer> counts = new LinkedHashMap<>();
		for (final DocumentEntry entry : entries) {
			if (isSoundEffect(entry.getOriginalText())) {
				soundEffects++;
				continue;
			}
			final String speaker = extractSpeaker(entry.getOriginalText());
			if (speaker != null) {
				counts.merge(speaker, 1, Integer::sum);
			}
		}
		counts.values().removeIf(count -> count < this.config.minOccurrences());

		int withSpeakers = 0;
		for (final DocumentEntry entry : entries) {
			if (isSoundEffect(entry.getOriginalText())) {
				continue;
			}
			final String speaker = extractSpeaker(entry.getOriginalText());
			if (speaker != null && counts.containsKey(speaker)) {
				entry.setSpeaker(speaker);
				withSpeakers++;
			}
		}

		if (this.config.detectImplicitChanges()) {
			withSpeakers += propagateSpeakers(entries);
		}

		return new SpeakerStats(entries.size(), withSpeakers, counts.size(), soundEffects);
	}

	/**
	 * Carries the last seen speaker over to following unlabeled dialogue entries, at most
	 * {@link SpeakerConfig#continuityGap()} entries after the last label.
	 *
	 * @return number of entries that received a propagated speaker
	 */
	private int propagateSpeakers(@Nonnull List<DocumentEntry> entries) {
		String lastSpeaker = null;
		int gapCount = 0;
		int assigned = 0;
		for (final DocumentEntry entry : entries) {
			if (entry.getSpeaker() != null) {
				lastSpeaker = entry.getSpeaker();
				gapCount = 0;
			} else if (lastSpeaker != null && gapCount < this.config.continuityGap()) {
				if (looksLikeDialogue(entry.getOriginalText())) {
					entry.setSpeaker(lastSpeaker);
					assigned++;
				}
				gapCount++;
			} else {
				lastSpeaker = null;
				gapCount = 0;
			}
		}
		return assigned;
	}

	/**
	 * Groups entries by their assigned speaker.
	 *
	 * @param entries entries in display order
	 * @return one record per speaker in order of first appearance
	 */
	@Nonnull
	public List<DetectedSpeaker> speakers(@Nonnull List<DocumentEntry> entries) {
		final Map<String, List<Integer>> byName = new LinkedHashMap<>();
		for (final DocumentEntry entry : entries) {
			if (entry.getSpeaker() != null) {
				byName.computeIfAbsent(entry.getSpeaker(), k -> new ArrayList<>()).add(entry.getId());
			}
		}
		final List<DetectedSpeaker> result = new ArrayList<>(byName.size());
		byName.forEach((name, ids) -> result.add(new DetectedSpeaker(name, ids)));
		return result;
	}

	/**
	 * Returns the labels appearing at least {@link SpeakerConfig#minOccurrences()} times, without modifying entries.
	 *
	 * @param entries entries to inspect
	 * @return speaker names in order of first appearance
	 */
	@Nonnull
	public List<String> extractSpeakerNames(@Nonnull List<DocumentEntry> entries) {
		final Map<String, Integer> counts = new LinkedHashMap<>();
		for (final DocumentEntry entry : entries) {
			final String speaker = extractSpeaker(entry.getOriginalText());
			if (speaker != null) {
				counts.merge(speaker, 1, Integer::sum);
			}
		}
		return counts.entrySet().stream()
			.filter(e -> e.getValue() >= this.config.minOccurrences())
			.map(Map.Entry::getKey)
			.toList();
	}

	/**
	 * Extracts a leading speaker label from the text.
	 *
	 * @param text entry text
	 * @return the trimmed label or null
	 */
	@Nullable
	static String extractSpeaker(@Nonnull String text) {
		final Matcher matcher = SPEAKER_PATTERN.matcher(text);
		if (matcher.find()) {
			return matcher.group(1).trim();
		}
		return null;
	}

	static boolean isSoundEffect(@Nonnull String text) {
		return SOUND_EFFECT_PATTERN.matcher(text.trim()).matches();
	}

	static boolean looksLikeDialogue(@Nonnull String text) {
		final String trimmed = text.trim();
		if (trimmed.isEmpty() || isSoundEffect(trimmed)) {
			return false;
		}
		// a single shouted word like "BANG" is a caption, not dialogue
		return !(trimmed.length() < SHOUTED_WORD_MAX_LENGTH
			&& trimmed.equals(trimmed.toUpperCase())
			&& !trimmed.contains(" "));
	}

	/**
	 * Speaker together with the entries attributed to them.
	 *
	 * @param name     speaker label
	 * @param entryIds ids of entries spoken by them
	 */
	public record DetectedSpeaker(@Nonnull String name, @Nonnull List<Integer> entryIds) {

		public DetectedSpeaker {
			Objects.requireNonNull(name, "name must not be null");
			entryIds = List.copyOf(entryIds);
		}

		public int occurrenceCount() {
			return this.entryIds.size();
		}
	}
}
