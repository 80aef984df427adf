package io.evitadb.subtitler.context;

import io.evitadb.subtitler.model.DocumentEntry;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Already translated entry shown to the model as preceding context.
 *
 * @param id         entry id
 * @param original   original text
 * @param translated translated text
 */
public record TranslatedContext(
	int id,
	@Nonnull String original,
	@Nonnull String translated
) {

	public TranslatedContext {
		Objects.requireNonNull(original, "original must not be null");
		Objects.requireNonNull(translated, "translated must not be null");
	}

	/**
	 * Creates a context item from a translated entry.
	 *
	 * @param entry entry with a translation
	 * @return the context item
	 * @throws IllegalArgumentException when the entry is not translated
	 */
	@Nonnull
	public static TranslatedContext from(@Nonnull DocumentEntry entry) {
		final String translated = entry.getTranslatedText();
		if (translated == null) {
			throw new IllegalArgumentException("Entry " + entry.getId() + " has no translation");
		}
		return new TranslatedContext(entry.getId(), entry.getOriginalText(), translated);
	}
}
