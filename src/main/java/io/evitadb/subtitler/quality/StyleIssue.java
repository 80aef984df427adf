package io.evitadb.subtitler.quality;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

/**
 * Document-wide consistency problem found by {@link ConsistencyChecker}.
 */
public sealed interface StyleIssue permits StyleIssue.InconsistentTerm, StyleIssue.NameNotPreserved,
	StyleIssue.InconsistentFormality, StyleIssue.MixedQuoteStyles {

	/**
	 * @return weight of the problem in [0, 1]
	 */
	double severity();

	@Nonnull
	String description();

	/**
	 * A glossary term is rendered in more than one way across the document.
	 *
	 * @param term       source term
	 * @param renderings distinct renderings found
	 * @param entryIds   entries containing the term
	 */
	record InconsistentTerm(
		@Nonnull String term,
		@Nonnull List<String> renderings,
		@Nonnull List<Integer> entryIds
	) implements StyleIssue {

		public InconsistentTerm {
			Objects.requireNonNull(term, "term must not be null");
			renderings = List.copyOf(renderings);
			entryIds = List.copyOf(entryIds);
		}

		@Override
		public double severity() {
			return Math.min(this.renderings.size() / 5.0, 1.0);
		}

		@Nonnull
		@Override
		public String description() {
			return "Term '" + this.term + "' translated inconsistently: " + String.join(", ", this.renderings);
		}
	}

	/**
	 * A character name of the original is missing from the translation.
	 *
	 * @param name    the name
	 * @param entryId entry id
	 * @param foundAs capitalized word of similar length that may be a changed form of the name, null if none
	 */
	record NameNotPreserved(@Nonnull String name, int entryId, @Nullable String foundAs) implements StyleIssue {

		public NameNotPreserved {
			Objects.requireNonNull(name, "name must not be null");
		}

		@Override
		public double severity() {
			return 0.8;
		}

		@Nonnull
		@Override
		public String description() {
			return this.foundAs == null
				? "Name '" + this.name + "' missing in entry " + this.entryId
				: "Name '" + this.name + "' changed to '" + this.foundAs + "' in entry " + this.entryId;
		}
	}

	/**
	 * A line is written in a different register than most of the document.
	 */
	record InconsistentFormality(
		int entryId,
		@Nonnull FormalityLevel expected,
		@Nonnull FormalityLevel found
	) implements StyleIssue {

		public InconsistentFormality {
			Objects.requireNonNull(expected, "expected must not be null");
			Objects.requireNonNull(found, "found must not be null");
		}

		@Override
		public double severity() {
			return 0.5;
		}

		@Nonnull
		@Override
		public String description() {
			return "Entry " + this.entryId + ": expected " + this.expected + " formality, found " + this.found;
		}
	}

	/**
	 * The translation mixes more than two kinds of quotation marks.
	 *
	 * @param entryIds entries containing quotation marks
	 */
	record MixedQuoteStyles(@Nonnull List<Integer> entryIds) implements StyleIssue {

		public MixedQuoteStyles {
			entryIds = List.copyOf(entryIds);
		}

		@Override
		public double severity() {
			return 0.2;
		}

		@Nonnull
		@Override
		public String description() {
			return "Mixed quote styles in " + this.entryIds.size() + " entries";
		}
	}
}
