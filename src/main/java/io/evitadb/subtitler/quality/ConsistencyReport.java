package io.evitadb.subtitler.quality;

import javax.annotation.Nonnull;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Outcome of a {@link ConsistencyChecker} run.
 *
 * @param issues          problems found
 * @param termsChecked    glossary terms that occur in the document
 * @param namesChecked    character names in the glossary
 * @param entriesAnalyzed entries of the document
 */
public record ConsistencyReport(
	@Nonnull List<StyleIssue> issues,
	int termsChecked,
	int namesChecked,
	int entriesAnalyzed
) {

	public ConsistencyReport {
		issues = List.copyOf(issues);
	}

	/**
	 * Score in [0, 1]: one minus the summed severity of all issues per analyzed entry.
	 *
	 * @return 1 without issues
	 */
	public double score() {
		if (this.issues.isEmpty()) {
			return 1.0;
		}
		final double severity = this.issues.stream().mapToDouble(StyleIssue::severity).sum();
		return Math.max(0.0, 1.0 - severity / Math.max(this.entriesAnalyzed, 1));
	}

	public boolean isAcceptable(double threshold) {
		return score() >= threshold;
	}

	/**
	 * @return issues ordered from the most to the least severe
	 */
	@Nonnull
	public List<StyleIssue> issuesBySeverity() {
		return this.issues.stream()
			.sorted(Comparator.comparingDouble(StyleIssue::severity).reversed())
			.toList();
	}

	@Nonnull
	public String summary() {
		return String.format(
			Locale.ROOT, "Consistency: %.1f%% (%d issues, %d terms, %d names checked)",
			score() * 100, this.issues.size(), this.termsChecked, this.namesChecked
		);
	}
}
