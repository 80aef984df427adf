package io.evitadb.subtitler.analysis;

import io.evitadb.subtitler.model.DocumentEntry;
import io.evitadb.subtitler.model.Glossary;
import io.evitadb.subtitler.model.SubtitleDocument;

import javax.annotation.Nonnull;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds a consistency glossary from source text: recurring capitalized names become character names,
 * recurring quoted phrases and custom pattern matches become terms that map to themselves.
 */
public final class GlossaryExtractor {

	private static final Pattern NAME_PATTERN = Pattern.compile("\\b([A-Z][a-z]+(?:\\s+[A-Z][a-z]+)?)\\b");
	private static final Pattern QUOTED_PATTERN = Pattern.compile("\"([^\"]+)\"");
	private static final Set<String> COMMON_ADVERBS = Set.of(
		"just", "really", "actually", "probably", "definitely", "certainly", "maybe",
		"perhaps", "finally", "suddenly", "quickly", "slowly"
	);
	private static final String QUOTED_CONTEXT = "quoted phrase";
	private static final String PATTERN_CONTEXT = "custom pattern";

	@Nonnull
	private final ExtractionConfig config;
	@Nonnull
	private final List<Pattern> customPatterns;

	public GlossaryExtractor() {
		this(ExtractionConfig.defaults());
	}

	/**
	 * Creates an extractor.
	 *
	 * @param config extraction settings
	 * @throws java.util.regex.PatternSyntaxException when a custom pattern is invalid
	 */
	public GlossaryExtractor(@Nonnull ExtractionConfig config) {
		this.config = Objects.requireNonNull(config, "config must not be null");
		this.customPatterns = config.customPatterns().stream().map(Pattern::compile).toList();
	}

	@Nonnull
	public ExtractionConfig getConfig() {
		return this.config;
	}

	/**
	 * Extracts a glossary from the given entries.
	 *
	 * @param entries entries to scan
	 * @return new glossary
	 */
	@Nonnull
	public Glossary extract(@Nonnull List<DocumentEntry> entries) {
		Objects.requireNonNull(entries, "entries must not be null");

		final Map<String, Integer> nameCounts = new LinkedHashMap<>();
		final Map<String, Integer> quotedCounts = new LinkedHashMap<>();
		final Map<String, Integer> patternCounts = new LinkedHashMap<>();

		for (final DocumentEntry entry : entries) {
			final String text = entry.getOriginalText();

			if (this.config.extractNames()) {
				final Matcher matcher = NAME_PATTERN.matcher(text);
				while (matcher.find()) {
					final String name = matcher.group(1);
					if (!this.config.excludeWords().contains(name) && !isCommonWord(name)) {
						nameCounts.merge(name, 1, Integer::sum);
					}
				}
			}

			if (this.config.extractQuoted()) {
				final Matcher matcher = QUOTED_PATTERN.matcher(text);
				while (matcher.find()) {
					final String phrase = matcher.group(1);
					if (phrase.length() >= 2) {
						quotedCounts.merge(phrase, 1, Integer::sum);
					}
				}
			}

			for (final Pattern pattern : this.customPatterns) {
				final Matcher matcher = pattern.matcher(text);
				while (matcher.find()) {
					final String match = matcher.groupCount() >= 1 && matcher.group(1) != null
						? matcher.group(1) : matcher.group();
					if (!match.isBlank()) {
						patternCounts.merge(match, 1, Integer::sum);
					}
				}
			}
		}

		final Glossary glossary = Glossary.empty();
		nameCounts.forEach((name, count) -> {
			if (count >= this.config.minOccurrences()) {
				glossary.addCharacter(name);
			}
		});
		quotedCounts.forEach((phrase, count) -> {
			if (count >= this.config.minOccurrences()) {
				glossary.addTerm(phrase, phrase, QUOTED_CONTEXT);
			}
		});
		patternCounts.forEach((term, count) -> {
			if (count >= this.config.minOccurrences()) {
				glossary.addTerm(term, term, PATTERN_CONTEXT);
			}
		});
		return glossary;
	}

	/**
	 * Extracts a glossary from the document entries and merges it into the document glossary.
	 *
	 * @param document document to update
	 * @return the extracted glossary
	 */
	@Nonnull
	public Glossary extractAndUpdate(@Nonnull SubtitleDocument document) {
		Objects.requireNonNull(document, "document must not be null");
		final Glossary extracted = extract(document.getEntries());
		document.mergeGlossary(extracted);
		extracted.getCharacterNames().forEach(document::addCharacter);
		return extracted;
	}

	/**
	 * Returns a copy of `existing` with the extracted glossary merged in.
	 *
	 * @param entries  entries to scan
	 * @param existing glossary to start from; not modified
	 * @return merged glossary
	 */
	@Nonnull
	public Glossary extractAndMerge(@Nonnull List<DocumentEntry> entries, @Nonnull Glossary existing) {
		return existing.copy().merge(extract(entries));
	}

	private static boolean isCommonWord(@Nonnull String word) {
		return word.length() <= 2 || COMMON_ADVERBS.contains(word.toLowerCase(Locale.ROOT));
	}
}
