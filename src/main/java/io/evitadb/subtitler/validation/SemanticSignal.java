package io.evitadb.subtitler.validation;

import io.evitadb.subtitler.model.DocumentEntry;

import javax.annotation.Nonnull;
import java.util.Objects;
import java.util.Optional;

/**
 * External source of semantic divergence judgements, e.g. a second model or a human review export.
 * The validation pass only consumes the signal and never computes it.
 */
@FunctionalInterface
public interface SemanticSignal {

	/**
	 * Signal that never reports a divergence.
	 */
	SemanticSignal NONE = entry -> Optional.empty();

	/**
	 * Assesses one translated entry.
	 *
	 * @param entry entry with a translation
	 * @return the divergence, empty when the translation keeps the meaning
	 */
	@Nonnull
	Optional<Divergence> assess(@Nonnull DocumentEntry entry);

	/**
	 * Reported divergence.
	 *
	 * @param kind   kind of divergence
	 * @param score  strength in [0, 1]
	 * @param detail human-readable explanation
	 */
	record Divergence(@Nonnull DivergenceKind kind, double score, @Nonnull String detail) {
		public Divergence {
			Objects.requireNonNull(kind, "kind must not be null");
			Objects.requireNonNull(detail, "detail must not be null");
			score = Math.max(0.0, Math.min(1.0, score));
		}

		/**
		 * Creates a divergence scored with the base severity of its kind.
		 */
		@Nonnull
		public static Divergence of(@Nonnull DivergenceKind kind, @Nonnull String detail) {
			return new Divergence(kind, kind.getSeverity(), detail);
		}
	}
}
