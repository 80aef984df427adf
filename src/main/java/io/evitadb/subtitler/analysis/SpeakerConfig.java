package io.evitadb.subtitler.analysis;

import javax.annotation.Nonnull;

/**
 * Settings of the {@link SpeakerTracker}.
 *
 * @param minOccurrences        how many times a label must appear before it is accepted as a speaker
 * @param detectImplicitChanges whether a speaker is carried over to following unlabeled dialogue
 * @param continuityGap         maximum number of unlabeled entries a speaker is carried over to
 */
public record SpeakerConfig(
	int minOccurrences,
	boolean detectImplicitChanges,
	int continuityGap
) {

	public SpeakerConfig {
		if (minOccurrences < 1) {
			throw new IllegalArgumentException("minOccurrences must be at least 1");
		}
		if (continuityGap < 0) {
			throw new IllegalArgumentException("continuityGap must not be negative");
		}
	}

	@Nonnull
	public static SpeakerConfig defaults() {
		return new SpeakerConfig(2, false, 3);
	}

	@Nonnull
	public static SpeakerConfig strict() {
		return new SpeakerConfig(3, false, 1);
	}

	@Nonnull
	public static SpeakerConfig lenient() {
		return new SpeakerConfig(1, true, 5);
	}
}
