package io.evitadb.subtitler.model;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A subtitle document being translated: the ordered entries plus everything the analysis phase learns about them.
 *
 * The entry list is fixed at construction; entries are never added, removed or reordered. Entries reference
 * scenes by id and the document keeps an id-to-index map for lookups.
 */
public final class SubtitleDocument {

	@Nonnull
	private DocumentMetadata metadata;
	@Nonnull
	private final List<DocumentEntry> entries;
	@Nonnull
	private final Map<Integer, Integer> indexById;
	@Nonnull
	private List<Scene> scenes = List.of();
	@Nonnull
	private final Glossary glossary = Glossary.empty();
	@Nonnull
	private final Set<String> characters = new LinkedHashSet<>();
	@Nullable
	private String contextSummary;

	/**
	 * Creates a document from already constructed entries.
	 *
	 * @param metadata document metadata
	 * @param entries  entries in display order with strictly increasing ids
	 * @throws IllegalArgumentException when ids are not strictly increasing
	 */
	public SubtitleDocument(@Nonnull DocumentMetadata metadata, @Nonnull List<DocumentEntry> entries) {
		this.metadata = Objects.requireNonNull(metadata, "metadata must not be null");
		Objects.requireNonNull(entries, "entries must not be null");
		this.entries = List.copyOf(entries);
		this.indexById = new HashMap<>(this.entries.size() * 2);
		int previousId = Integer.MIN_VALUE;
		for (int i = 0; i < this.entries.size(); i++) {
			final int id = this.entries.get(i).getId();
			if (id <= previousId) {
				throw new IllegalArgumentException("Entry ids must be strictly increasing, found " + id + " after " + previousId);
			}
			this.indexById.put(id, i);
			previousId = id;
		}
	}

	/**
	 * Builds a document from raw entries. Sequence numbers become entry ids when they are strictly increasing,
	 * otherwise entries are numbered by position starting at 1.
	 *
	 * @param rawEntries     entries in display order
	 * @param sourceLanguage the source language
	 * @return the new document
	 */
	@Nonnull
	public static SubtitleDocument fromEntries(@Nonnull List<SubtitleEntry> rawEntries, @Nonnull String sourceLanguage) {
		Objects.requireNonNull(rawEntries, "rawEntries must not be null");
		final boolean useSeqNums = hasIncreasingSeqNums(rawEntries);
		final List<DocumentEntry> entries = new ArrayList<>(rawEntries.size());
		for (int i = 0; i < rawEntries.size(); i++) {
			final SubtitleEntry raw = rawEntries.get(i);
			entries.add(DocumentEntry.of(useSeqNums ? raw.seqNum() : i + 1, raw));
		}
		return new SubtitleDocument(DocumentMetadata.of(sourceLanguage), entries);
	}

	private static boolean hasIncreasingSeqNums(@Nonnull List<SubtitleEntry> rawEntries) {
		int previous = Integer.MIN_VALUE;
		for (final SubtitleEntry entry : rawEntries) {
			if (entry.seqNum() <= previous) {
				return false;
			}
			previous = entry.seqNum();
		}
		return true;
	}

	@Nonnull
	public DocumentMetadata getMetadata() {
		return this.metadata;
	}

	public void setMetadata(@Nonnull DocumentMetadata metadata) {
		this.metadata = Objects.requireNonNull(metadata, "metadata must not be null");
	}

	/**
	 * Returns the entries in display order.
	 *
	 * @return unmodifiable entry list
	 */
	@Nonnull
	public List<DocumentEntry> getEntries() {
		return this.entries;
	}

	public int size() {
		return this.entries.size();
	}

	public boolean isEmpty() {
		return this.entries.isEmpty();
	}

	/**
	 * Returns the entry at the given position.
	 *
	 * @param index zero-based position
	 * @return the entry
	 */
	@Nonnull
	public DocumentEntry entryAt(int index) {
		return this.entries.get(index);
	}

	/**
	 * Looks up an entry by id.
	 *
	 * @param id entry id
	 * @return the entry if present
	 */
	@Nonnull
	public Optional<DocumentEntry> entry(int id) {
		final Integer index = this.indexById.get(id);
		return index == null ? Optional.empty() : Optional.of(this.entries.get(index));
	}

	/**
	 * Returns the zero-based position of the entry with the given id, or -1 when absent.
	 *
	 * @param id entry id
	 * @return position or -1
	 */
	public int indexOf(int id) {
		final Integer index = this.indexById.get(id);
		return index == null ? -1 : index;
	}

	@Nonnull
	public List<Scene> getScenes() {
		return this.scenes;
	}

	/**
	 * Replaces the scene list and updates scene ids of all covered entries.
	 *
	 * @param newScenes scenes in order
	 */
	public void setScenes(@Nonnull List<Scene> newScenes) {
		this.scenes = List.copyOf(Objects.requireNonNull(newScenes, "newScenes must not be null"));
		for (final DocumentEntry entry : this.entries) {
			entry.setSceneId(null);
		}
		for (final Scene scene : this.scenes) {
			for (final DocumentEntry entry : this.entries) {
				if (scene.contains(entry.getId())) {
					entry.setSceneId(scene.id());
				}
			}
		}
	}

	/**
	 * Finds the scene containing the given entry id.
	 *
	 * @param entryId entry id
	 * @return the scene if any
	 */
	@Nonnull
	public Optional<Scene> sceneForEntry(int entryId) {
		for (final Scene scene : this.scenes) {
			if (scene.contains(entryId)) {
				return Optional.of(scene);
			}
		}
		return Optional.empty();
	}

	@Nonnull
	public Glossary getGlossary() {
		return this.glossary;
	}

	/**
	 * Merges new terms into the document glossary.
	 *
	 * @param updates glossary to merge; its definitions win on conflict
	 */
	public void mergeGlossary(@Nonnull Glossary updates) {
		this.glossary.merge(updates);
	}

	@Nonnull
	public Set<String> getCharacters() {
		return Collections.unmodifiableSet(this.characters);
	}

	public void addCharacter(@Nonnull String name) {
		this.characters.add(Objects.requireNonNull(name, "name must not be null"));
	}

	@Nullable
	public String getContextSummary() {
		return this.contextSummary;
	}

	public void setContextSummary(@Nullable String contextSummary) {
		this.contextSummary = contextSummary;
	}

	@Nonnull
	public List<DocumentEntry> translatedEntries() {
		return this.entries.stream().filter(DocumentEntry::isTranslated).toList();
	}

	@Nonnull
	public List<DocumentEntry> pendingEntries() {
		return this.entries.stream().filter(e -> !e.isTranslated()).toList();
	}

	public boolean isFullyTranslated() {
		return this.entries.stream().allMatch(DocumentEntry::isTranslated);
	}

	/**
	 * Returns the share of translated entries as a percentage. An empty document counts as complete.
	 *
	 * @return value between 0 and 100
	 */
	public double translationProgress() {
		if (this.entries.isEmpty()) {
			return 100.0;
		}
		return translatedEntries().size() * 100.0 / this.entries.size();
	}

	/**
	 * Returns raw entries carrying the translated text where present and the original text otherwise.
	 * Ids, order and timing are preserved.
	 *
	 * @return one raw entry per document entry
	 */
	@Nonnull
	public List<SubtitleEntry> toSubtitleEntries() {
		return this.entries.stream().map(DocumentEntry::toSubtitleEntry).toList();
	}

	/**
	 * Returns the final output: like {@link #toSubtitleEntries()} but with sequence numbers renumbered 1..N.
	 *
	 * @return renumbered raw entries
	 */
	@Nonnull
	public List<SubtitleEntry> toOutputEntries() {
		final List<SubtitleEntry> result = new ArrayList<>(this.entries.size());
		for (int i = 0; i < this.entries.size(); i++) {
			result.add(this.entries.get(i).toSubtitleEntry().withSeqNum(i + 1));
		}
		return result;
	}
}
