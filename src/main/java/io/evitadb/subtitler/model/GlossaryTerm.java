package io.evitadb.subtitler.model;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Required translation of a source-language term.
 *
 * @param source  term as it appears in the source text
 * @param target  mandated translation
 * @param context optional note on where the term came from
 */
public record GlossaryTerm(
	@Nonnull String source,
	@Nonnull String target,
	@Nullable String context
) {

	public GlossaryTerm {
		Objects.requireNonNull(source, "source must not be null");
		Objects.requireNonNull(target, "target must not be null");
	}
}
