package io.evitadb.subtitler.analysis;

import io.evitadb.subtitler.model.DocumentEntry;
import io.evitadb.subtitler.model.SubtitleDocument;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Produces short extractive summaries of already processed dialogue so that long documents can be translated
 * without sending the full history to the model.
 *
 * A summary lists up to five recurring names, quotes three evenly spaced lines and states the number of lines.
 * No model call is involved.
 */
public final class HistorySummarizer {

	private static final Pattern NAME_PATTERN = Pattern.compile("\\b([A-Z][a-z]+)\\b");
	private static final Set<String> EXCLUDED_NAMES = Set.of(
		"The", "This", "That", "What", "Where", "When", "Why", "How", "Yes", "No", "Oh", "Hey",
		"Well", "Now", "Here", "Please", "Thank", "Hello", "Sorry", "Just", "Really"
	);
	private static final int MAX_NAMES = 5;
	private static final int MIN_NAME_OCCURRENCES = 2;
	private static final int SNIPPET_COUNT = 3;
	private static final int MAX_SNIPPET_LENGTH = 50;

	@Nonnull
	private final SummarizationConfig config;

	public HistorySummarizer() {
		this(SummarizationConfig.defaults());
	}

	public HistorySummarizer(@Nonnull SummarizationConfig config) {
		this.config = Objects.requireNonNull(config, "config must not be null");
	}

	@Nonnull
	public SummarizationConfig getConfig() {
		return this.config;
	}

	/**
	 * Summarizes the given entries.
	 *
	 * @param entries entries in display order
	 * @return the summary; empty when there are no entries
	 */
	@Nonnull
	public HistorySummary summarize(@Nonnull List<DocumentEntry> entries) {
		Objects.requireNonNull(entries, "entries must not be null");
		if (entries.isEmpty()) {
			return HistorySummary.empty();
		}

		final List<String> parts = new ArrayList<>(3);
		if (this.config.includeCharacterNames()) {
			final List<String> names = likelyNames(entries);
			if (!names.isEmpty()) {
				parts.add("Characters: " + String.join(", ", names));
			}
		}
		if (this.config.includeDialogueSnippets()) {
			parts.add("Key dialogue: " + String.join(" ... ", keySnippets(entries)));
		}
		parts.add("[" + entries.size() + " lines of dialogue]");

		return new HistorySummary(
			truncate(String.join(". ", parts)),
			entries.get(0).getId(),
			entries.get(entries.size() - 1).getId(),
			entries.size()
		);
	}

	/**
	 * Summarizes all entries of the document before the given position.
	 *
	 * @param document   document to summarize
	 * @param upToIndex  exclusive end position
	 * @return the summary
	 */
	@Nonnull
	public HistorySummary summarizeHistory(@Nonnull SubtitleDocument document, int upToIndex) {
		final int end = Math.max(0, Math.min(upToIndex, document.size()));
		return summarize(document.getEntries().subList(0, end));
	}

	/**
	 * Joins several summaries into one, re-applying the length limit.
	 *
	 * @param summaries summaries in document order
	 * @return combined summary
	 */
	@Nonnull
	public HistorySummary combine(@Nonnull List<HistorySummary> summaries) {
		Objects.requireNonNull(summaries, "summaries must not be null");
		if (summaries.isEmpty()) {
			return HistorySummary.empty();
		}
		final String text = String.join(" ", summaries.stream().map(HistorySummary::text).toList());
		final int total = summaries.stream().mapToInt(HistorySummary::entryCount).sum();
		return new HistorySummary(
			truncate(text),
			summaries.get(0).startEntryId(),
			summaries.get(summaries.size() - 1).endEntryId(),
			total
		);
	}

	@Nonnull
	private static List<String> likelyNames(@Nonnull List<DocumentEntry> entries) {
		final Map<String, Integer> counts = new LinkedHashMap<>();
		for (final DocumentEntry entry : entries) {
			final Matcher matcher = NAME_PATTERN.matcher(entry.getOriginalText());
			while (matcher.find()) {
				final String name = matcher.group(1);
				if (!EXCLUDED_NAMES.contains(name)) {
					counts.merge(name, 1, Integer::sum);
				}
			}
		}
		return counts.entrySet().stream()
			.filter(e -> e.getValue() >= MIN_NAME_OCCURRENCES)
			.sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
			.limit(MAX_NAMES)
			.map(Map.Entry::getKey)
			.toList();
	}

	@Nonnull
	private static List<String> keySnippets(@Nonnull List<DocumentEntry> entries) {
		final int len = entries.size();
		final List<String> snippets = new ArrayList<>(SNIPPET_COUNT);
		final int step = len <= SNIPPET_COUNT ? 1 : len / SNIPPET_COUNT;
		for (int i = 0; i < Math.min(len, SNIPPET_COUNT); i++) {
			final String text = entries.get(i * step).getOriginalText();
			snippets.add(
				text.codePointCount(0, text.length()) > MAX_SNIPPET_LENGTH
					? prefix(text, MAX_SNIPPET_LENGTH - 3) + "..."
					: text
			);
		}
		return snippets;
	}

	/**
	 * Cuts the text to the configured number of code points, preferring a sentence boundary and then a word boundary.
	 */
	@Nonnull
	String truncate(@Nonnull String text) {
		if (text.codePointCount(0, text.length()) <= this.config.maxSummaryChars()) {
			return text;
		}
		final String cut = prefix(text, this.config.maxSummaryChars() - 3);
		final int lastSentence = cut.lastIndexOf(". ");
		if (lastSentence >= 0) {
			return cut.substring(0, lastSentence) + ".";
		}
		final int lastSpace = cut.lastIndexOf(' ');
		if (lastSpace >= 0) {
			return cut.substring(0, lastSpace) + "...";
		}
		return cut + "...";
	}

	/**
	 * Returns the first code points of the text, never splitting a surrogate pair.
	 */
	@Nonnull
	private static String prefix(@Nonnull String text, int codePoints) {
		return text.substring(0, text.offsetByCodePoints(0, codePoints));
	}
}
