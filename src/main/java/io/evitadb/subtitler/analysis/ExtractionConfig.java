package io.evitadb.subtitler.analysis;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Settings of the {@link GlossaryExtractor}.
 *
 * @param minOccurrences how often a candidate must appear before it enters the glossary
 * @param extractNames   whether capitalized word runs are collected as character names
 * @param extractQuoted  whether quoted phrases are collected as terms
 * @param customPatterns additional regular expressions; group 1 (or the whole match) becomes a term
 * @param excludeWords   words never treated as names
 */
public record ExtractionConfig(
	int minOccurrences,
	boolean extractNames,
	boolean extractQuoted,
	@Nonnull List<String> customPatterns,
	@Nonnull Set<String> excludeWords
) {

	/**
	 * Capitalized words that are sentence starters, pronouns or interjections rather than names.
	 */
	public static final Set<String> DEFAULT_EXCLUDED_WORDS = Set.of(
		"I", "The", "A", "An", "This", "That", "These", "Those", "It", "He", "She", "They",
		"We", "You", "My", "Your", "His", "Her", "Our", "Their", "What", "Who", "Where",
		"When", "Why", "How", "Yes", "No", "Oh", "Ah", "Hey", "Well", "Now", "Then", "Here",
		"There", "Please", "Thank", "Thanks", "Sorry", "Hello", "Hi", "Goodbye", "Bye",
		"Mr", "Mrs", "Ms", "Dr", "Sir", "Ma'am", "OK", "Okay"
	);

	public ExtractionConfig {
		if (minOccurrences < 1) {
			throw new IllegalArgumentException("minOccurrences must be at least 1");
		}
		customPatterns = List.copyOf(Objects.requireNonNull(customPatterns, "customPatterns must not be null"));
		excludeWords = Set.copyOf(Objects.requireNonNull(excludeWords, "excludeWords must not be null"));
	}

	@Nonnull
	public static ExtractionConfig defaults() {
		return new ExtractionConfig(2, true, true, List.of(), DEFAULT_EXCLUDED_WORDS);
	}

	/**
	 * Conservative profile: higher occurrence threshold and no quoted phrases.
	 */
	@Nonnull
	public static ExtractionConfig minimal() {
		return new ExtractionConfig(3, true, false, List.of(), DEFAULT_EXCLUDED_WORDS);
	}

	/**
	 * Collects every candidate seen at least once and excludes nothing.
	 */
	@Nonnull
	public static ExtractionConfig aggressive() {
		return new ExtractionConfig(1, true, true, List.of(), Set.of());
	}

	@Nonnull
	public ExtractionConfig withMinOccurrences(int newMinOccurrences) {
		return new ExtractionConfig(newMinOccurrences, this.extractNames, this.extractQuoted, this.customPatterns, this.excludeWords);
	}

	@Nonnull
	public ExtractionConfig withExtractNames(boolean extract) {
		return new ExtractionConfig(this.minOccurrences, extract, this.extractQuoted, this.customPatterns, this.excludeWords);
	}

	@Nonnull
	public ExtractionConfig withExtractQuoted(boolean extract) {
		return new ExtractionConfig(this.minOccurrences, this.extractNames, extract, this.customPatterns, this.excludeWords);
	}

	@Nonnull
	public ExtractionConfig exclude(@Nonnull String word) {
		final Set<String> words = new HashSet<>(this.excludeWords);
		words.add(word);
		return new ExtractionConfig(this.minOccurrences, this.extractNames, this.extractQuoted, this.customPatterns, words);
	}

	@Nonnull
	public ExtractionConfig withPattern(@Nonnull String pattern) {
		final List<String> patterns = new ArrayList<>(this.customPatterns);
		patterns.add(pattern);
		return new ExtractionConfig(this.minOccurrences, this.extractNames, this.extractQuoted, patterns, this.excludeWords);
	}
}
