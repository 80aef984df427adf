package io.evitadb.subtitler.quality;

import io.evitadb.subtitler.model.DocumentEntry;
import io.evitadb.subtitler.model.SubtitleDocument;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Checks a translated document as a whole for terminology, name, register and punctuation consistency.
 *
 * Validation looks at one line at a time; this checker compares lines with each other. Every occurrence of a
 * glossary term is classified by how the translation renders it: with the recorded target, left in the source
 * language, or in some other way. A term is flagged when its occurrences use more than one of these renderings.
 */
public final class ConsistencyChecker {

	static final String OTHER_RENDERING = "(other)";

	private static final Set<Character> QUOTES = Set.of('"', '„', '“', '”', '«', '»', '‘', '’');

	@Nonnull
	private final ConsistencyConfig config;

	public ConsistencyChecker() {
		this(ConsistencyConfig.defaults());
	}

	public ConsistencyChecker(@Nonnull ConsistencyConfig config) {
		this.config = Objects.requireNonNull(config, "config must not be null");
	}

	@Nonnull
	public ConsistencyConfig getConfig() {
		return this.config;
	}

	/**
	 * Runs the configured checks over the translated entries of the document.
	 *
	 * @param document the translated document
	 * @return report with all problems found
	 */
	@Nonnull
	public ConsistencyReport check(@Nonnull SubtitleDocument document) {
		Objects.requireNonNull(document, "document must not be null");
		final List<StyleIssue> issues = new ArrayList<>();
		int termsChecked = 0;
		int namesChecked = 0;
		if (this.config.checkTerminology()) {
			termsChecked = checkTerminology(document, issues);
		}
		if (this.config.checkNames()) {
			namesChecked = checkNames(document, issues);
		}
		if (this.config.checkStyle()) {
			checkFormality(document, issues);
		}
		if (this.config.checkPunctuation()) {
			checkQuotes(document, issues);
		}
		return new ConsistencyReport(issues, termsChecked, namesChecked, document.size());
	}

	private int checkTerminology(@Nonnull SubtitleDocument document, @Nonnull List<StyleIssue> issues) {
		int termsChecked = 0;
		for (final Map.Entry<String, String> term : document.getGlossary().allTranslations().entrySet()) {
			final Map<String, List<Integer>> renderings = new LinkedHashMap<>();
			int occurrences = 0;
			for (final DocumentEntry entry : document.getEntries()) {
				final String translation = entry.getTranslatedText();
				if (translation == null || translation.isBlank() || !contains(entry.getOriginalText(), term.getKey())) {
					continue;
				}
				occurrences++;
				renderings.computeIfAbsent(rendering(translation, term.getKey(), term.getValue()), k -> new ArrayList<>())
					.add(entry.getId());
			}
			if (occurrences == 0) {
				continue;
			}
			termsChecked++;
			if (occurrences >= this.config.minOccurrencesForFlag() && renderings.size() > 1) {
				final List<Integer> entryIds = renderings.values().stream()
					.flatMap(List::stream)
					.sorted()
					.toList();
				issues.add(new StyleIssue.InconsistentTerm(term.getKey(), List.copyOf(renderings.keySet()), entryIds));
			}
		}
		return termsChecked;
	}

	@Nonnull
	private String rendering(@Nonnull String translation, @Nonnull String source, @Nonnull String target) {
		if (contains(translation, target)) {
			return target;
		} else if (contains(translation, source)) {
			return source;
		}
		return OTHER_RENDERING;
	}

	private int checkNames(@Nonnull SubtitleDocument document, @Nonnull List<StyleIssue> issues) {
		final Set<String> names = document.getGlossary().getCharacterNames();
		for (final String name : names) {
			for (final DocumentEntry entry : document.getEntries()) {
				final String translation = entry.getTranslatedText();
				if (translation == null || translation.isBlank() || !contains(entry.getOriginalText(), name)) {
					continue;
				}
				if (!contains(translation, name)) {
					issues.add(new StyleIssue.NameNotPreserved(name, entry.getId(), findSimilarName(name, translation)));
				}
			}
		}
		return names.size();
	}

	/**
	 * Finds a capitalized word whose length is within a third of the name length.
	 */
	@Nullable
	static String findSimilarName(@Nonnull String name, @Nonnull String text) {
		final int tolerance = Math.max(name.length() / 3, 1);
		for (final String word : text.split("\\s+")) {
			final String clean = stripNonLetters(word);
			if (!clean.isEmpty() && Character.isUpperCase(clean.codePointAt(0))
				&& Math.abs(clean.length() - name.length()) <= tolerance) {
				return clean;
			}
		}
		return null;
	}

	@Nonnull
	private static String stripNonLetters(@Nonnull String word) {
		int start = 0;
		int end = word.length();
		while (start < end && !Character.isLetter(word.charAt(start))) {
			start++;
		}
		while (end > start && !Character.isLetter(word.charAt(end - 1))) {
			end--;
		}
		return word.substring(start, end);
	}

	private void checkFormality(@Nonnull SubtitleDocument document, @Nonnull List<StyleIssue> issues) {
		final Map<Integer, FormalityLevel> levels = new LinkedHashMap<>();
		final Map<FormalityLevel, Integer> counts = new EnumMap<>(FormalityLevel.class);
		for (final DocumentEntry entry : document.getEntries()) {
			final String translation = entry.getTranslatedText();
			if (translation == null || translation.isBlank()) {
				continue;
			}
			final FormalityLevel level = FormalityLevel.detect(translation);
			levels.put(entry.getId(), level);
			counts.merge(level, 1, Integer::sum);
		}

		FormalityLevel dominant = FormalityLevel.NEUTRAL;
		for (final Map.Entry<FormalityLevel, Integer> count : counts.entrySet()) {
			if (count.getValue() > counts.getOrDefault(dominant, 0)) {
				dominant = count.getKey();
			}
		}
		for (final Map.Entry<Integer, FormalityLevel> level : levels.entrySet()) {
			if (level.getValue() != dominant && level.getValue() != FormalityLevel.NEUTRAL) {
				issues.add(new StyleIssue.InconsistentFormality(level.getKey(), dominant, level.getValue()));
			}
		}
	}

	private void checkQuotes(@Nonnull SubtitleDocument document, @Nonnull List<StyleIssue> issues) {
		final Set<Character> kinds = new TreeSet<>();
		final Set<Integer> entryIds = new TreeSet<>();
		for (final DocumentEntry entry : document.getEntries()) {
			final String translation = entry.getTranslatedText();
			if (translation == null) {
				continue;
			}
			for (int i = 0; i < translation.length(); i++) {
				final char c = translation.charAt(i);
				if (QUOTES.contains(c)) {
					kinds.add(c);
					entryIds.add(entry.getId());
				}
			}
		}
		if (kinds.size() > 2) {
			issues.add(new StyleIssue.MixedQuoteStyles(List.copyOf(entryIds)));
		}
	}

	private boolean contains(@Nonnull String text, @Nonnull String fragment) {
		if (this.config.caseSensitive()) {
			return text.contains(fragment);
		}
		return text.toLowerCase(Locale.ROOT).contains(fragment.toLowerCase(Locale.ROOT));
	}
}
