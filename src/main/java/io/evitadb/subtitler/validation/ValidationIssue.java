package io.evitadb.subtitler.validation;

import io.evitadb.subtitler.model.FormattingTag;

import javax.annotation.Nonnull;
import java.util.Locale;
import java.util.Objects;

/**
 * Defect found in one translated entry. Severity lies in [0, 1] and is derived from the issue's own data only.
 */
public sealed interface ValidationIssue permits ValidationIssue.MissingTranslation, ValidationIssue.EmptyTranslation,
	ValidationIssue.LengthTooLong, ValidationIssue.LengthTooShort, ValidationIssue.MissingFormatting,
	ValidationIssue.GlossaryInconsistency, ValidationIssue.LowConfidence, ValidationIssue.SemanticDivergence {

	/**
	 * Issues at or above this severity fail the document.
	 */
	double CRITICAL_SEVERITY = 0.8;

	int entryId();

	double severity();

	@Nonnull
	String description();

	/**
	 * Only formatting and glossary issues can be fixed without another model call.
	 *
	 * @return true when auto-repair may fix the issue
	 */
	default boolean isRepairable() {
		return false;
	}

	default boolean isCritical() {
		return severity() >= CRITICAL_SEVERITY;
	}

	private static double clampSeverity(double value) {
		return Math.max(0.3, Math.min(1.0, value));
	}

	record MissingTranslation(int entryId) implements ValidationIssue {
		@Override
		public double severity() {
			return 1.0;
		}

		@Nonnull
		@Override
		public String description() {
			return "Entry " + this.entryId + " is missing translation";
		}
	}

	record EmptyTranslation(int entryId) implements ValidationIssue {
		@Override
		public double severity() {
			return 1.0;
		}

		@Nonnull
		@Override
		public String description() {
			return "Entry " + this.entryId + " has empty translation";
		}
	}

	/**
	 * @param ratio    translated length divided by original length
	 * @param maxRatio the bound that was exceeded
	 */
	record LengthTooLong(int entryId, int originalLength, int translatedLength, double ratio, double maxRatio)
		implements ValidationIssue {

		@Override
		public double severity() {
			return clampSeverity(this.ratio - this.maxRatio);
		}

		@Nonnull
		@Override
		public String description() {
			return String.format(Locale.ROOT, "Entry %d translation too long (ratio: %.2f)", this.entryId, this.ratio);
		}
	}

	/**
	 * @param ratio    translated length divided by original length
	 * @param minRatio the bound that was undercut
	 */
	record LengthTooShort(int entryId, int originalLength, int translatedLength, double ratio, double minRatio)
		implements ValidationIssue {

		@Override
		public double severity() {
			return clampSeverity(this.minRatio - this.ratio);
		}

		@Nonnull
		@Override
		public String description() {
			return String.format(Locale.ROOT, "Entry %d translation too short (ratio: %.2f)", this.entryId, this.ratio);
		}
	}

	record MissingFormatting(int entryId, @Nonnull FormattingTag tag) implements ValidationIssue {
		public MissingFormatting {
			Objects.requireNonNull(tag, "tag must not be null");
		}

		@Override
		public double severity() {
			return 0.5;
		}

		@Nonnull
		@Override
		public String description() {
			return "Entry " + this.entryId + " missing " + this.tag + " formatting";
		}

		@Override
		public boolean isRepairable() {
			return true;
		}
	}

	record GlossaryInconsistency(int entryId, @Nonnull ConsistencyIssue issue) implements ValidationIssue {
		public GlossaryInconsistency {
			Objects.requireNonNull(issue, "issue must not be null");
		}

		@Override
		public double severity() {
			return 0.4;
		}

		@Nonnull
		@Override
		public String description() {
			return "Entry " + this.entryId + ": " + this.issue.description();
		}

		@Override
		public boolean isRepairable() {
			return true;
		}
	}

	record LowConfidence(int entryId, double confidence) implements ValidationIssue {
		@Override
		public double severity() {
			return 1.0 - this.confidence;
		}

		@Nonnull
		@Override
		public String description() {
			return String.format(Locale.ROOT, "Entry %d has low confidence (%.2f)", this.entryId, this.confidence);
		}
	}

	/**
	 * Divergence reported by a {@link SemanticSignal}; always critical.
	 */
	record SemanticDivergence(int entryId, @Nonnull DivergenceKind kind, double score, @Nonnull String detail)
		implements ValidationIssue {

		public SemanticDivergence {
			Objects.requireNonNull(kind, "kind must not be null");
			Objects.requireNonNull(detail, "detail must not be null");
		}

		@Override
		public double severity() {
			return Math.max(CRITICAL_SEVERITY, this.score);
		}

		@Nonnull
		@Override
		public String description() {
			return "Entry " + this.entryId + " diverges from the original (" + this.kind + "): " + this.detail;
		}
	}
}
