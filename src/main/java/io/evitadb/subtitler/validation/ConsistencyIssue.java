package io.evitadb.subtitler.validation;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Terminology problem found by {@link GlossaryEnforcer}.
 */
public sealed interface ConsistencyIssue permits ConsistencyIssue.MissingName, ConsistencyIssue.InconsistentTerm {

	@Nonnull
	String description();

	/**
	 * A character name of the original does not appear in the translation.
	 */
	record MissingName(@Nonnull String name) implements ConsistencyIssue {
		public MissingName {
			Objects.requireNonNull(name, "name must not be null");
		}

		@Nonnull
		@Override
		public String description() {
			return "Character name '" + this.name + "' is missing from translation";
		}
	}

	/**
	 * A glossary term of the original is not rendered with its recorded translation.
	 */
	record InconsistentTerm(@Nonnull String source, @Nonnull String expected) implements ConsistencyIssue {
		public InconsistentTerm {
			Objects.requireNonNull(source, "source must not be null");
			Objects.requireNonNull(expected, "expected must not be null");
		}

		@Nonnull
		@Override
		public String description() {
			return "Term '" + this.source + "' should be translated as '" + this.expected + "' for consistency";
		}
	}
}
