package io.evitadb.subtitler.translation;

import io.evitadb.subtitler.model.Glossary;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Outcome of translating one batch.
 *
 * @param translations    translations returned for requested ids
 * @param entryIds        ids that were requested, in order
 * @param glossaryUpdates glossary updates to merge into the document
 * @param retriesUsed     retries spent on the batch
 * @param usedFallback    whether the translations are empty placeholders
 * @param warnings        notes reported by the model or by response parsing
 * @param inputTokens     prompt tokens spent on all attempts
 * @param outputTokens    completion tokens spent on all attempts
 * @param fromCache       whether every translation came from the {@link TranslationCache} without a model call
 */
public record BatchResult(
	@Nonnull List<TranslatedEntry> translations,
	@Nonnull List<Integer> entryIds,
	@Nonnull Glossary glossaryUpdates,
	int retriesUsed,
	boolean usedFallback,
	@Nonnull List<String> warnings,
	long inputTokens,
	long outputTokens,
	boolean fromCache
) {

	public BatchResult {
		translations = List.copyOf(Objects.requireNonNull(translations, "translations must not be null"));
		entryIds = List.copyOf(Objects.requireNonNull(entryIds, "entryIds must not be null"));
		Objects.requireNonNull(glossaryUpdates, "glossaryUpdates must not be null");
		warnings = List.copyOf(Objects.requireNonNull(warnings, "warnings must not be null"));
	}

	@Nonnull
	public static BatchResult of(@Nonnull List<TranslatedEntry> translations, @Nonnull List<Integer> entryIds) {
		return new BatchResult(translations, entryIds, Glossary.empty(), 0, false, List.of(), 0, 0, false);
	}

	/**
	 * Creates a result carrying an empty, zero-confidence placeholder for every id.
	 *
	 * @param entryIds    requested ids
	 * @param retriesUsed retries spent before giving up
	 * @param reason      why the batch fell back
	 * @return fallback result
	 */
	@Nonnull
	public static BatchResult fallback(@Nonnull List<Integer> entryIds, int retriesUsed, @Nonnull String reason) {
		return new BatchResult(
			entryIds.stream().map(TranslatedEntry::placeholder).toList(),
			entryIds, Glossary.empty(), retriesUsed, true, List.of(reason), 0, 0, false
		);
	}

	/**
	 * Creates a result without translations; the entries stay untranslated.
	 */
	@Nonnull
	public static BatchResult skipped(@Nonnull List<Integer> entryIds, int retriesUsed, @Nonnull String reason) {
		return new BatchResult(List.of(), entryIds, Glossary.empty(), retriesUsed, false, List.of(reason), 0, 0, false);
	}

	/**
	 * Returns a copy carrying the given token usage.
	 */
	@Nonnull
	public BatchResult withTokens(long input, long output) {
		return new BatchResult(
			this.translations, this.entryIds, this.glossaryUpdates, this.retriesUsed, this.usedFallback, this.warnings,
			input, output, this.fromCache
		);
	}

	/**
	 * Creates a complete result answered from the cache.
	 */
	@Nonnull
	public static BatchResult cached(@Nonnull List<TranslatedEntry> translations, @Nonnull List<Integer> entryIds) {
		return new BatchResult(translations, entryIds, Glossary.empty(), 0, false, List.of(), 0, 0, true);
	}

	@Nonnull
	public Optional<TranslatedEntry> translationFor(int entryId) {
		return this.translations.stream().filter(t -> t.id() == entryId).findFirst();
	}

	/**
	 * Returns true when every requested id has a translation.
	 *
	 * @return true for a complete batch
	 */
	public boolean isComplete() {
		return missingIds().isEmpty();
	}

	/**
	 * Returns requested ids without a translation, in request order.
	 *
	 * @return missing ids
	 */
	@Nonnull
	public List<Integer> missingIds() {
		final Set<Integer> present = this.translations.stream().map(TranslatedEntry::id).collect(Collectors.toSet());
		return this.entryIds.stream().filter(id -> !present.contains(id)).toList();
	}

	/**
	 * Number of non-empty translations.
	 */
	public int translatedCount() {
		return (int) this.translations.stream().filter(t -> !t.isEmpty()).count();
	}
}
