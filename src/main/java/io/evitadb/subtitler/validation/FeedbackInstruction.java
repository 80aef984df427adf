package io.evitadb.subtitler.validation;

import javax.annotation.Nonnull;
import java.util.Locale;
import java.util.Objects;

/**
 * Corrective instruction for the model derived from a validation issue.
 *
 * @param entryId     entry the instruction is about
 * @param instruction what the model should change
 */
public record FeedbackInstruction(int entryId, @Nonnull String instruction) {

	public FeedbackInstruction {
		Objects.requireNonNull(instruction, "instruction must not be null");
	}

	/**
	 * Converts an issue into an instruction.
	 *
	 * @param issue the issue
	 * @return the instruction
	 */
	@Nonnull
	public static FeedbackInstruction from(@Nonnull ValidationIssue issue) {
		Objects.requireNonNull(issue, "issue must not be null");
		final String text;
		if (issue instanceof ValidationIssue.MissingTranslation) {
			text = "the translation is missing; translate this line";
		} else if (issue instanceof ValidationIssue.EmptyTranslation) {
			text = "the translation is empty; translate the full line";
		} else if (issue instanceof ValidationIssue.LengthTooLong tooLong) {
			text = String.format(
				Locale.ROOT,
				"translation is %d%% longer than original; shorten it under %d%%",
				percentOver(tooLong.ratio()), percentOver(tooLong.maxRatio())
			);
		} else if (issue instanceof ValidationIssue.LengthTooShort tooShort) {
			text = String.format(
				Locale.ROOT,
				"translation is only %d%% of the original length; keep all of its meaning, at least %d%%",
				Math.round(tooShort.ratio() * 100), Math.round(tooShort.minRatio() * 100)
			);
		} else if (issue instanceof ValidationIssue.MissingFormatting formatting) {
			text = "keep the " + formatting.tag().getOpenMarker() + " formatting of the original";
		} else if (issue instanceof ValidationIssue.GlossaryInconsistency glossary) {
			if (glossary.issue() instanceof ConsistencyIssue.MissingName missingName) {
				text = "keep the name '" + missingName.name() + "' unchanged";
			} else {
				final ConsistencyIssue.InconsistentTerm term = (ConsistencyIssue.InconsistentTerm) glossary.issue();
				text = "translate '" + term.source() + "' as '" + term.expected() + "'";
			}
		} else if (issue instanceof ValidationIssue.LowConfidence lowConfidence) {
			text = String.format(
				Locale.ROOT,
				"the previous translation was uncertain (confidence %.2f); check the meaning carefully",
				lowConfidence.confidence()
			);
		} else {
			final ValidationIssue.SemanticDivergence divergence = (ValidationIssue.SemanticDivergence) issue;
			text = "the meaning drifted (" + divergence.kind().name().toLowerCase(Locale.ROOT).replace('_', ' ')
				+ ": " + divergence.detail() + "); stay closer to the original";
		}
		return new FeedbackInstruction(issue.entryId(), text);
	}

	private static long percentOver(double ratio) {
		return Math.round((ratio - 1.0) * 100);
	}

	/**
	 * Renders the instruction for the prompt.
	 *
	 * @return "Entry N: instruction"
	 */
	@Nonnull
	public String render() {
		return "Entry " + this.entryId + ": " + this.instruction;
	}
}
