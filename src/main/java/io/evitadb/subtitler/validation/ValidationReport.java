package io.evitadb.subtitler.validation;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Outcome of validating a document.
 *
 * @param issues           issues present after repair (all issues when no repair ran)
 * @param rawIssues        issues found before repair
 * @param entriesValidated number of entries checked
 * @param repairActions    actions taken by auto-repair
 * @param unresolved       raw issues auto-repair could not fix
 */
public record ValidationReport(
	@Nonnull List<ValidationIssue> issues,
	@Nonnull List<ValidationIssue> rawIssues,
	int entriesValidated,
	@Nonnull List<RepairAction> repairActions,
	@Nonnull List<ValidationIssue> unresolved
) {

	public ValidationReport {
		issues = List.copyOf(Objects.requireNonNull(issues, "issues must not be null"));
		rawIssues = List.copyOf(Objects.requireNonNull(rawIssues, "rawIssues must not be null"));
		repairActions = List.copyOf(Objects.requireNonNull(repairActions, "repairActions must not be null"));
		unresolved = List.copyOf(Objects.requireNonNull(unresolved, "unresolved must not be null"));
	}

	/**
	 * Creates a report without repair.
	 */
	@Nonnull
	public static ValidationReport of(@Nonnull List<ValidationIssue> issues, int entriesValidated) {
		return new ValidationReport(issues, issues, entriesValidated, List.of(), List.of());
	}

	/**
	 * Computes max(0, 1 - sum of severities / entries validated).
	 *
	 * @return score in [0, 1], 1 when nothing was validated
	 */
	public double qualityScore() {
		if (this.entriesValidated == 0) {
			return 1.0;
		}
		final double totalSeverity = this.issues.stream().mapToDouble(ValidationIssue::severity).sum();
		return Math.max(0.0, 1.0 - totalSeverity / this.entriesValidated);
	}

	/**
	 * Returns true when no remaining issue is critical.
	 *
	 * @return true when the document passed
	 */
	public boolean passed() {
		return criticalIssues().isEmpty();
	}

	@Nonnull
	public List<ValidationIssue> criticalIssues() {
		return this.issues.stream().filter(ValidationIssue::isCritical).toList();
	}

	@Nonnull
	public Set<Integer> entriesWithIssues() {
		final Set<Integer> ids = new TreeSet<>();
		for (final ValidationIssue issue : this.issues) {
			ids.add(issue.entryId());
		}
		return ids;
	}

	@Nonnull
	public List<ValidationIssue> issuesFor(int entryId) {
		return this.issues.stream().filter(issue -> issue.entryId() == entryId).toList();
	}

	public boolean wasRepaired() {
		return this.repairActions.stream().anyMatch(action -> !(action instanceof RepairAction.NoRepairPossible));
	}

	@Nonnull
	public String summary() {
		return String.format(
			Locale.ROOT,
			"Validated %d entries: %d issues found, %d entries affected, quality score: %.2f%%",
			this.entriesValidated, this.issues.size(), entriesWithIssues().size(), qualityScore() * 100.0
		);
	}
}
