package io.evitadb.subtitler.model;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Contiguous run of entries forming one scene. Entry ids are inclusive on both ends.
 *
 * @param id           scene number, starting at 1
 * @param startEntryId id of the first entry in the scene
 * @param endEntryId   id of the last entry in the scene
 * @param description  optional free-form description
 * @param tone         optional tone hint such as "tense" or "comedic"
 */
public record Scene(
	int id,
	int startEntryId,
	int endEntryId,
	@Nullable String description,
	@Nullable String tone
) {

	public Scene {
		if (endEntryId < startEntryId) {
			throw new IllegalArgumentException(
				"endEntryId (" + endEntryId + ") must not precede startEntryId (" + startEntryId + ")"
			);
		}
	}

	/**
	 * Creates a scene without description and tone.
	 *
	 * @param id           scene number
	 * @param startEntryId first entry id
	 * @param endEntryId   last entry id
	 * @return the scene
	 */
	@Nonnull
	public static Scene of(int id, int startEntryId, int endEntryId) {
		return new Scene(id, startEntryId, endEntryId, null, null);
	}

	/**
	 * Returns true if the given entry id falls within this scene.
	 *
	 * @param entryId entry id to test
	 * @return true when contained
	 */
	public boolean contains(int entryId) {
		return entryId >= this.startEntryId && entryId <= this.endEntryId;
	}

	/**
	 * Returns a copy of this scene with the given description.
	 *
	 * @param newDescription the description
	 * @return new scene instance
	 */
	@Nonnull
	public Scene withDescription(@Nullable String newDescription) {
		return new Scene(this.id, this.startEntryId, this.endEntryId, newDescription, this.tone);
	}

	/**
	 * Returns a copy of this scene with the given tone.
	 *
	 * @param newTone the tone
	 * @return new scene instance
	 */
	@Nonnull
	public Scene withTone(@Nullable String newTone) {
		return new Scene(this.id, this.startEntryId, this.endEntryId, this.description, newTone);
	}
}
