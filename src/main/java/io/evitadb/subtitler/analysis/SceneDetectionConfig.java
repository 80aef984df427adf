package io.evitadb.subtitler.analysis;

import javax.annotation.Nonnull;

/**
 * Settings of the {@link SceneDetector}.
 *
 * @param minGapMs             silence between entries (ms) that starts a new scene
 * @param maxEntriesPerScene   hard cap on entries per scene
 * @param detectSpeakerChanges whether a change between two known speakers starts a new scene
 */
public record SceneDetectionConfig(
	long minGapMs,
	int maxEntriesPerScene,
	boolean detectSpeakerChanges
) {

	public SceneDetectionConfig {
		if (minGapMs < 0) {
			throw new IllegalArgumentException("minGapMs must not be negative");
		}
		if (maxEntriesPerScene < 1) {
			throw new IllegalArgumentException("maxEntriesPerScene must be at least 1");
		}
	}

	@Nonnull
	public static SceneDetectionConfig defaults() {
		return new SceneDetectionConfig(3000, 50, true);
	}

	/**
	 * Fewer scene breaks, suited to short clips.
	 */
	@Nonnull
	public static SceneDetectionConfig shortForm() {
		return new SceneDetectionConfig(5000, 100, false);
	}

	/**
	 * Finer-grained scenes.
	 */
	@Nonnull
	public static SceneDetectionConfig detailed() {
		return new SceneDetectionConfig(2000, 30, true);
	}

	@Nonnull
	public SceneDetectionConfig withMinGapMs(long newMinGapMs) {
		return new SceneDetectionConfig(newMinGapMs, this.maxEntriesPerScene, this.detectSpeakerChanges);
	}

	@Nonnull
	public SceneDetectionConfig withMaxEntriesPerScene(int newMax) {
		return new SceneDetectionConfig(this.minGapMs, newMax, this.detectSpeakerChanges);
	}

	@Nonnull
	public SceneDetectionConfig withDetectSpeakerChanges(boolean detect) {
		return new SceneDetectionConfig(this.minGapMs, this.maxEntriesPerScene, detect);
	}
}
