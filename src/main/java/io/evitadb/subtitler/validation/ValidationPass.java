package io.evitadb.subtitler.validation;

import io.evitadb.subtitler.model.DocumentEntry;
import io.evitadb.subtitler.model.FormattingTag;
import io.evitadb.subtitler.model.SubtitleDocument;
import io.evitadb.subtitler.quality.LanguagePairThresholds;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Checks every translated entry and repairs formatting and glossary problems that do not need the model.
 */
public final class ValidationPass {

	private static final Pattern LEADING_POSITION = Pattern.compile("^\\{\\\\an\\d}");
	private static final Pattern POSITION = Pattern.compile("\\{\\\\an\\d}");

	@Nonnull
	private final ValidationConfig config;
	@Nonnull
	private final SemanticSignal semanticSignal;

	public ValidationPass() {
		this(ValidationConfig.defaults(), SemanticSignal.NONE);
	}

	public ValidationPass(@Nonnull ValidationConfig config) {
		this(config, SemanticSignal.NONE);
	}

	public ValidationPass(@Nonnull ValidationConfig config, @Nonnull SemanticSignal semanticSignal) {
		this.config = Objects.requireNonNull(config, "config must not be null");
		this.semanticSignal = Objects.requireNonNull(semanticSignal, "semanticSignal must not be null");
	}

	@Nonnull
	public ValidationConfig getConfig() {
		return this.config;
	}

	/**
	 * Validates the document without changing it.
	 *
	 * @param document the document
	 * @return report of all issues
	 */
	@Nonnull
	public ValidationReport validate(@Nonnull SubtitleDocument document) {
		Objects.requireNonNull(document, "document must not be null");
		final GlossaryEnforcer enforcer = new GlossaryEnforcer(document.getGlossary());
		final LanguagePairThresholds bounds = this.config.lengthBounds(
			document.getMetadata().sourceLanguage(), document.getMetadata().targetLanguage()
		);
		final List<ValidationIssue> issues = new ArrayList<>();
		for (final DocumentEntry entry : document.getEntries()) {
			validateEntry(entry, enforcer, bounds, issues);
		}
		return ValidationReport.of(issues, document.size());
	}

	/**
	 * Validates, repairs what can be repaired and validates again.
	 *
	 * @param document the document, repaired in place
	 * @return report with the remaining issues, the raw issues and the repair actions
	 */
	@Nonnull
	public ValidationReport validateAndRepair(@Nonnull SubtitleDocument document) {
		final ValidationReport initial = validate(document);
		if (!this.config.enableAutoRepair() || initial.issues().isEmpty()) {
			return initial;
		}

		final GlossaryEnforcer enforcer = new GlossaryEnforcer(document.getGlossary());
		final List<RepairAction> actions = new ArrayList<>();
		final List<ValidationIssue> unresolved = new ArrayList<>();
		for (final ValidationIssue issue : initial.issues()) {
			if (!issue.isRepairable()) {
				unresolved.add(issue);
				continue;
			}
			final Optional<DocumentEntry> entry = document.entry(issue.entryId());
			if (entry.isEmpty() || entry.get().getTranslatedText() == null) {
				unresolved.add(issue);
				continue;
			}
			if (issue instanceof ValidationIssue.MissingFormatting formatting) {
				repairFormatting(entry.get(), formatting, actions, unresolved);
			} else if (issue instanceof ValidationIssue.GlossaryInconsistency glossary) {
				repairGlossary(entry.get(), glossary, enforcer, actions, unresolved);
			}
		}

		final ValidationReport after = validate(document);
		return new ValidationReport(after.issues(), initial.issues(), document.size(), actions, unresolved);
	}

	private void validateEntry(
		@Nonnull DocumentEntry entry,
		@Nonnull GlossaryEnforcer enforcer,
		@Nonnull LanguagePairThresholds bounds,
		@Nonnull List<ValidationIssue> issues
	) {
		final String translated = entry.getTranslatedText();
		final String original = entry.getOriginalText();
		if (translated == null) {
			issues.add(new ValidationIssue.MissingTranslation(entry.getId()));
			return;
		}
		if (translated.isBlank() && !original.isBlank()) {
			issues.add(new ValidationIssue.EmptyTranslation(entry.getId()));
			return;
		}

		if (!original.isEmpty()) {
			final double ratio = (double) translated.length() / original.length();
			if (ratio > bounds.maxLengthRatio()) {
				issues.add(new ValidationIssue.LengthTooLong(
					entry.getId(), original.length(), translated.length(), ratio, bounds.maxLengthRatio()
				));
			} else if (ratio < bounds.minLengthRatio()) {
				issues.add(new ValidationIssue.LengthTooShort(
					entry.getId(), original.length(), translated.length(), ratio, bounds.minLengthRatio()
				));
			}
		}

		if (this.config.checkFormatting()) {
			for (final FormattingTag tag : FormattingTag.values()) {
				if (entry.getFormatting().contains(tag) && !tag.isPresentIn(translated)) {
					issues.add(new ValidationIssue.MissingFormatting(entry.getId(), tag));
				}
			}
		}

		if (this.config.checkGlossaryConsistency()) {
			for (final ConsistencyIssue issue : enforcer.checkConsistency(original, translated)) {
				issues.add(new ValidationIssue.GlossaryInconsistency(entry.getId(), issue));
			}
		}

		final Double confidence = entry.getConfidence();
		if (confidence != null && confidence < this.config.minConfidence()) {
			issues.add(new ValidationIssue.LowConfidence(entry.getId(), confidence));
		}

		this.semanticSignal.assess(entry).ifPresent(
			divergence -> issues.add(new ValidationIssue.SemanticDivergence(
				entry.getId(), divergence.kind(), divergence.score(), divergence.detail()
			))
		);
	}

	private static void repairFormatting(
		@Nonnull DocumentEntry entry,
		@Nonnull ValidationIssue.MissingFormatting issue,
		@Nonnull List<RepairAction> actions,
		@Nonnull List<ValidationIssue> unresolved
	) {
		final String translated = Objects.requireNonNull(entry.getTranslatedText());
		if (issue.tag().isPresentIn(translated)) {
			// fixed by an earlier repair of the same entry
			return;
		}
		final String repaired = repairFormatting(translated, issue.tag(), entry.getOriginalText());
		if (repaired.equals(translated)) {
			actions.add(new RepairAction.NoRepairPossible(entry.getId(), "Could not determine " + issue.tag() + " placement"));
			unresolved.add(issue);
		} else {
			entry.replaceTranslation(repaired);
			actions.add(new RepairAction.AddedFormatting(entry.getId(), issue.tag()));
		}
	}

	private static void repairGlossary(
		@Nonnull DocumentEntry entry,
		@Nonnull ValidationIssue.GlossaryInconsistency issue,
		@Nonnull GlossaryEnforcer enforcer,
		@Nonnull List<RepairAction> actions,
		@Nonnull List<ValidationIssue> unresolved
	) {
		final String before = Objects.requireNonNull(entry.getTranslatedText());
		if (!enforcer.checkConsistency(entry.getOriginalText(), before).contains(issue.issue())) {
			return;
		}
		final String after = enforcer.enforce(entry.getOriginalText(), before);
		if (!after.equals(before)) {
			entry.replaceTranslation(after);
			actions.add(new RepairAction.AppliedGlossaryCorrection(entry.getId(), before, after));
		}
		if (enforcer.checkConsistency(entry.getOriginalText(), after).contains(issue.issue())) {
			actions.add(new RepairAction.NoRepairPossible(entry.getId(), issue.issue().description()));
			unresolved.add(issue);
		}
	}

	/**
	 * Restores a formatting tag. Emphasis tags are re-wrapped only when the whole original is wrapped in them,
	 * a position tag is copied from the original, colours are never repaired.
	 *
	 * @param translated current translation
	 * @param tag        the missing tag
	 * @param original   original text
	 * @return repaired text, or the input when no safe repair exists
	 */
	@Nonnull
	static String repairFormatting(@Nonnull String translated, @Nonnull FormattingTag tag, @Nonnull String original) {
		return switch (tag) {
			case ITALIC -> rewrap(translated, original, "<i>", "</i>");
			case BOLD -> rewrap(translated, original, "<b>", "</b>");
			case UNDERLINE -> rewrap(translated, original, "<u>", "</u>");
			case POSITION -> {
				final Matcher matcher = POSITION.matcher(original);
				yield matcher.find() ? matcher.group() + translated : translated;
			}
			case COLOR -> translated;
		};
	}

	@Nonnull
	private static String rewrap(@Nonnull String translated, @Nonnull String original, @Nonnull String open, @Nonnull String close) {
		final String originalBody = LEADING_POSITION.matcher(original).replaceFirst("");
		if (!originalBody.startsWith(open) || !originalBody.endsWith(close)) {
			return translated;
		}
		final Matcher position = LEADING_POSITION.matcher(translated);
		if (position.find()) {
			return position.group() + open + translated.substring(position.end()) + close;
		}
		return open + translated + close;
	}
}
