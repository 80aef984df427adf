package io.evitadb.subtitler.validation;

import io.evitadb.subtitler.model.FormattingTag;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Change made (or refused) by auto-repair.
 */
public sealed interface RepairAction permits RepairAction.AddedFormatting, RepairAction.AppliedGlossaryCorrection,
	RepairAction.NoRepairPossible {

	int entryId();

	@Nonnull
	String description();

	record AddedFormatting(int entryId, @Nonnull FormattingTag tag) implements RepairAction {
		public AddedFormatting {
			Objects.requireNonNull(tag, "tag must not be null");
		}

		@Nonnull
		@Override
		public String description() {
			return "Added " + this.tag + " formatting to entry " + this.entryId;
		}
	}

	record AppliedGlossaryCorrection(int entryId, @Nonnull String before, @Nonnull String after) implements RepairAction {
		public AppliedGlossaryCorrection {
			Objects.requireNonNull(before, "before must not be null");
			Objects.requireNonNull(after, "after must not be null");
		}

		@Nonnull
		@Override
		public String description() {
			return "Entry " + this.entryId + ": '" + this.before + "' -> '" + this.after + "'";
		}
	}

	record NoRepairPossible(int entryId, @Nonnull String reason) implements RepairAction {
		public NoRepairPossible {
			Objects.requireNonNull(reason, "reason must not be null");
		}

		@Nonnull
		@Override
		public String description() {
			return "Entry " + this.entryId + ": " + this.reason;
		}
	}
}
