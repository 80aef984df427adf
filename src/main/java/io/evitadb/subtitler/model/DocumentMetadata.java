package io.evitadb.subtitler.model;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Descriptive information about a subtitle document.
 *
 * @param sourceFile     file the document was read from, null for in-memory documents
 * @param sourceLanguage language of the original text
 * @param targetLanguage language to translate into, null until known
 * @param title          optional title used in prompts
 */
public record DocumentMetadata(
	@Nullable Path sourceFile,
	@Nonnull String sourceLanguage,
	@Nullable String targetLanguage,
	@Nullable String title
) {

	public DocumentMetadata {
		Objects.requireNonNull(sourceLanguage, "sourceLanguage must not be null");
	}

	/**
	 * Creates metadata carrying only the source language.
	 *
	 * @param sourceLanguage the source language
	 * @return the metadata
	 */
	@Nonnull
	public static DocumentMetadata of(@Nonnull String sourceLanguage) {
		return new DocumentMetadata(null, sourceLanguage, null, null);
	}

	@Nonnull
	public DocumentMetadata withTargetLanguage(@Nullable String newTargetLanguage) {
		return new DocumentMetadata(this.sourceFile, this.sourceLanguage, newTargetLanguage, this.title);
	}

	@Nonnull
	public DocumentMetadata withSourceFile(@Nullable Path newSourceFile) {
		return new DocumentMetadata(newSourceFile, this.sourceLanguage, this.targetLanguage, this.title);
	}

	@Nonnull
	public DocumentMetadata withTitle(@Nullable String newTitle) {
		return new DocumentMetadata(this.sourceFile, this.sourceLanguage, this.targetLanguage, newTitle);
	}
}
