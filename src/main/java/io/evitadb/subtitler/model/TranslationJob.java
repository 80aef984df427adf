package io.evitadb.subtitler.model;

import io.evitadb.subtitler.session.SessionKey;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Translation of one subtitle file into one target language.
 *
 * @param type           why the file is translated
 * @param sourceFile     the source subtitle file
 * @param targetFile     where the translation is written
 * @param sourceLanguage language of the source file
 * @param locale         target locale
 * @param entries        parsed source entries
 * @param sessionKey     key under which the run is recorded
 * @param instructions   accumulated custom instructions, may be null
 */
public record TranslationJob(
	@Nonnull Type type,
	@Nonnull Path sourceFile,
	@Nonnull Path targetFile,
	@Nonnull String sourceLanguage,
	@Nonnull Locale locale,
	@Nonnull List<SubtitleEntry> entries,
	@Nonnull SessionKey sessionKey,
	@Nullable String instructions
) {

	public TranslationJob {
		Objects.requireNonNull(type, "type must not be null");
		Objects.requireNonNull(sourceFile, "sourceFile must not be null");
		Objects.requireNonNull(targetFile, "targetFile must not be null");
		Objects.requireNonNull(sourceLanguage, "sourceLanguage must not be null");
		Objects.requireNonNull(locale, "locale must not be null");
		entries = List.copyOf(Objects.requireNonNull(entries, "entries must not be null"));
		Objects.requireNonNull(sessionKey, "sessionKey must not be null");
	}

	/**
	 * Returns the type tag used in log output.
	 *
	 * @return "NEW", "UPDATE" or "RETRY"
	 */
	@Nonnull
	public String getType() {
		return this.type.name();
	}

	@Nonnull
	public String getTargetLanguage() {
		return this.locale.toLanguageTag();
	}

	/**
	 * Reason for translating a file.
	 */
	public enum Type {
		/**
		 * No translation exists yet.
		 */
		NEW,
		/**
		 * A translation exists but the source content changed since it was made.
		 */
		UPDATE,
		/**
		 * The last run for the same content failed or was interrupted.
		 */
		RETRY
	}
}
