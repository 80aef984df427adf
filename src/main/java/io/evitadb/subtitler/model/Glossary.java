package io.evitadb.subtitler.model;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Consistency glossary of a document: character names that must never be translated, terms with mandated
 * translations and technical terms.
 *
 * Instances are mutable and owned by a single document. Context windows receive a {@link #copy()} so that
 * concurrent readers never observe later merges.
 */
public final class Glossary {

	@Nonnull
	private final Set<String> characterNames = new LinkedHashSet<>();
	@Nonnull
	private final Map<String, GlossaryTerm> terms = new LinkedHashMap<>();
	@Nonnull
	private final Map<String, String> technicalTerms = new LinkedHashMap<>();

	/**
	 * Creates an empty glossary.
	 *
	 * @return new empty glossary
	 */
	@Nonnull
	public static Glossary empty() {
		return new Glossary();
	}

	/**
	 * Adds a character name.
	 *
	 * @param name name to add
	 * @return this glossary for chaining
	 */
	@Nonnull
	public Glossary addCharacter(@Nonnull String name) {
		this.characterNames.add(Objects.requireNonNull(name, "name must not be null"));
		return this;
	}

	/**
	 * Adds or replaces a term with its mandated translation.
	 *
	 * @param source  source term
	 * @param target  mandated translation
	 * @param context optional context note
	 * @return this glossary for chaining
	 */
	@Nonnull
	public Glossary addTerm(@Nonnull String source, @Nonnull String target, @Nullable String context) {
		final GlossaryTerm term = new GlossaryTerm(source, target, context);
		this.terms.put(term.source(), term);
		return this;
	}

	/**
	 * Adds or replaces a technical term.
	 *
	 * @param source source term
	 * @param target translation
	 * @return this glossary for chaining
	 */
	@Nonnull
	public Glossary addTechnicalTerm(@Nonnull String source, @Nonnull String target) {
		this.technicalTerms.put(
			Objects.requireNonNull(source, "source must not be null"),
			Objects.requireNonNull(target, "target must not be null")
		);
		return this;
	}

	/**
	 * Merges another glossary into this one. The result is the union of both; where both define the same
	 * term, the definition from `other` wins.
	 *
	 * @param other glossary to merge in
	 * @return this glossary for chaining
	 */
	@Nonnull
	public Glossary merge(@Nonnull Glossary other) {
		Objects.requireNonNull(other, "other must not be null");
		this.characterNames.addAll(other.characterNames);
		this.terms.putAll(other.terms);
		this.technicalTerms.putAll(other.technicalTerms);
		return this;
	}

	/**
	 * Returns an independent snapshot of this glossary.
	 *
	 * @return deep copy
	 */
	@Nonnull
	public Glossary copy() {
		return new Glossary().merge(this);
	}

	/**
	 * Looks up the mandated translation for a term. Regular terms take precedence over technical terms.
	 *
	 * @param source source term
	 * @return the translation if known
	 */
	@Nonnull
	public Optional<String> translationOf(@Nonnull String source) {
		final GlossaryTerm term = this.terms.get(source);
		if (term != null) {
			return Optional.of(term.target());
		}
		return Optional.ofNullable(this.technicalTerms.get(source));
	}

	/**
	 * Returns true when the text is a known name or term.
	 *
	 * @param source text to look up
	 * @return true if present in any section
	 */
	public boolean hasTerm(@Nonnull String source) {
		return this.characterNames.contains(source)
			|| this.terms.containsKey(source)
			|| this.technicalTerms.containsKey(source);
	}

	@Nonnull
	public Set<String> getCharacterNames() {
		return Collections.unmodifiableSet(this.characterNames);
	}

	@Nonnull
	public Map<String, GlossaryTerm> getTerms() {
		return Collections.unmodifiableMap(this.terms);
	}

	@Nonnull
	public Map<String, String> getTechnicalTerms() {
		return Collections.unmodifiableMap(this.technicalTerms);
	}

	/**
	 * Returns all term translations, technical terms first so that regular terms override them.
	 *
	 * @return map of source term to translation
	 */
	@Nonnull
	public Map<String, String> allTranslations() {
		final Map<String, String> result = new LinkedHashMap<>(this.technicalTerms);
		for (final GlossaryTerm term : this.terms.values()) {
			result.put(term.source(), term.target());
		}
		return result;
	}

	public boolean isEmpty() {
		return this.characterNames.isEmpty() && this.terms.isEmpty() && this.technicalTerms.isEmpty();
	}

	/**
	 * Returns the total number of names and terms.
	 *
	 * @return entry count across all sections
	 */
	public int size() {
		return this.characterNames.size() + this.terms.size() + this.technicalTerms.size();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Glossary other)) {
			return false;
		}
		return this.characterNames.equals(other.characterNames)
			&& this.terms.equals(other.terms)
			&& this.technicalTerms.equals(other.technicalTerms);
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.characterNames, this.terms, this.technicalTerms);
	}

	@Override
	public String toString() {
		return "Glossary[names=" + this.characterNames.size() + ", terms=" + this.terms.size() +
			", technical=" + this.technicalTerms.size() + "]";
	}
}
