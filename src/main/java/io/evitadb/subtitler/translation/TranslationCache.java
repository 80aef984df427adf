package io.evitadb.subtitler.translation;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * In-memory cache of line translations keyed by source text and language pair.
 *
 * Subtitles repeat short lines ("Yes.", "What?", a catchphrase) within a file and across the episodes of a series.
 * One instance is shared by all workers of a run, so repeated lines are sent to the model once. The cache holds at
 * most {@code maxEntries} lines and evicts the least recently used one. Thread-safe.
 */
public final class TranslationCache {

	public static final int DEFAULT_MAX_ENTRIES = 10_000;

	private static final TranslationCache DISABLED = new TranslationCache(0);

	private final int maxEntries;
	@Nonnull
	private final Map<Key, CachedTranslation> entries;
	private long hits;
	private long misses;

	public TranslationCache() {
		this(DEFAULT_MAX_ENTRIES);
	}

	/**
	 * @param maxEntries capacity, 0 disables the cache
	 */
	public TranslationCache(int maxEntries) {
		if (maxEntries < 0) {
			throw new IllegalArgumentException("maxEntries must not be negative");
		}
		this.maxEntries = maxEntries;
		this.entries = new LinkedHashMap<>(16, 0.75f, true) {
			@Override
			protected boolean removeEldestEntry(Map.Entry<Key, CachedTranslation> eldest) {
				return size() > TranslationCache.this.maxEntries;
			}
		};
	}

	/**
	 * Returns a cache that never stores anything.
	 *
	 * @return shared disabled instance
	 */
	@Nonnull
	public static TranslationCache disabled() {
		return DISABLED;
	}

	public boolean isEnabled() {
		return this.maxEntries > 0;
	}

	/**
	 * Looks up the translation of a line.
	 *
	 * @param sourceText     original line
	 * @param sourceLanguage language of the original
	 * @param targetLanguage language of the translation
	 * @return the cached translation, empty on a miss
	 */
	@Nonnull
	public synchronized Optional<CachedTranslation> get(
		@Nonnull String sourceText,
		@Nonnull String sourceLanguage,
		@Nonnull String targetLanguage
	) {
		if (!isEnabled()) {
			return Optional.empty();
		}
		final CachedTranslation cached = this.entries.get(new Key(sourceText, sourceLanguage, targetLanguage));
		if (cached == null) {
			this.misses++;
			return Optional.empty();
		}
		this.hits++;
		return Optional.of(cached);
	}

	/**
	 * Stores the translation of a line, replacing an earlier one. Blank translations are not stored.
	 *
	 * @param sourceText     original line
	 * @param sourceLanguage language of the original
	 * @param targetLanguage language of the translation
	 * @param translated     the translation
	 * @param confidence     confidence reported by the model, may be null
	 */
	public synchronized void store(
		@Nonnull String sourceText,
		@Nonnull String sourceLanguage,
		@Nonnull String targetLanguage,
		@Nonnull String translated,
		@Nullable Double confidence
	) {
		Objects.requireNonNull(translated, "translated must not be null");
		if (!isEnabled() || translated.isBlank()) {
			return;
		}
		this.entries.put(new Key(sourceText, sourceLanguage, targetLanguage), new CachedTranslation(translated, confidence));
	}

	public synchronized void clear() {
		this.entries.clear();
		this.hits = 0;
		this.misses = 0;
	}

	@Nonnull
	public synchronized Stats stats() {
		return new Stats(this.hits, this.misses, this.entries.size());
	}

	/**
	 * A stored translation.
	 *
	 * @param translated translated line
	 * @param confidence model confidence, may be null
	 */
	public record CachedTranslation(@Nonnull String translated, @Nullable Double confidence) {

		public CachedTranslation {
			Objects.requireNonNull(translated, "translated must not be null");
		}
	}

	/**
	 * Lookup counters.
	 *
	 * @param hits    lookups answered from the cache
	 * @param misses  lookups not found
	 * @param entries lines currently stored
	 */
	public record Stats(long hits, long misses, int entries) {

		/**
		 * @return percentage of lookups answered from the cache, 0 without lookups
		 */
		public double hitRate() {
			final long lookups = this.hits + this.misses;
			return lookups == 0 ? 0.0 : this.hits * 100.0 / lookups;
		}

		@Nonnull
		public String summary() {
			return String.format(
				Locale.ROOT, "Cache: %d/%d hits (%.1f%%), %d entries", this.hits, this.hits + this.misses, hitRate(), this.entries
			);
		}
	}

	private record Key(@Nonnull String sourceText, @Nonnull String sourceLanguage, @Nonnull String targetLanguage) {

		private Key {
			Objects.requireNonNull(sourceText, "sourceText must not be null");
			sourceLanguage = Objects.requireNonNull(sourceLanguage, "sourceLanguage must not be null").toLowerCase(Locale.ROOT);
			targetLanguage = Objects.requireNonNull(targetLanguage, "targetLanguage must not be null").toLowerCase(Locale.ROOT);
		}
	}
}
