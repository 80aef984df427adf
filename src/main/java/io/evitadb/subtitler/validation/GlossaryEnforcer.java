package io.evitadb.subtitler.validation;

import io.evitadb.subtitler.model.Glossary;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Checks and corrects the use of glossary names and terms in one translated line.
 */
public final class GlossaryEnforcer {

	@Nonnull
	private final Glossary glossary;

	public GlossaryEnforcer(@Nonnull Glossary glossary) {
		this.glossary = Objects.requireNonNull(glossary, "glossary must not be null");
	}

	/**
	 * Lists names missing from the translation and terms not rendered with their recorded translation.
	 *
	 * @param original   original line
	 * @param translated translated line
	 * @return problems found, empty when consistent
	 */
	@Nonnull
	public List<ConsistencyIssue> checkConsistency(@Nonnull String original, @Nonnull String translated) {
		final List<ConsistencyIssue> issues = new ArrayList<>();
		for (final String name : this.glossary.getCharacterNames()) {
			if (original.contains(name) && !translated.contains(name)) {
				issues.add(new ConsistencyIssue.MissingName(name));
			}
		}
		for (final Map.Entry<String, String> term : this.glossary.allTranslations().entrySet()) {
			if (original.contains(term.getKey()) && !translated.contains(term.getValue())) {
				issues.add(new ConsistencyIssue.InconsistentTerm(term.getKey(), term.getValue()));
			}
		}
		return issues;
	}

	/**
	 * Replaces source terms left untranslated in the translation by their recorded target. Missing names are not
	 * restored because their position in the sentence cannot be known.
	 *
	 * @param original   original line
	 * @param translated translated line
	 * @return corrected translation, equal to the input when nothing applied
	 */
	@Nonnull
	public String enforce(@Nonnull String original, @Nonnull String translated) {
		String result = translated;
		for (final Map.Entry<String, String> term : this.glossary.allTranslations().entrySet()) {
			final String source = term.getKey();
			if (original.contains(source) && result.contains(source) && !source.equals(term.getValue())) {
				result = result.replace(source, term.getValue());
			}
		}
		return result;
	}
}
