package io.evitadb.subtitler.check;

import io.evitadb.subtitler.model.SubtitleEntry;
import io.evitadb.subtitler.srt.SrtParseException;
import io.evitadb.subtitler.srt.SrtParser;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Validates source subtitle files and their existing translations.
 * Collects all errors for reporting at the end.
 *
 * A translation must parse, have as many entries as its source and keep the timing of every entry.
 */
public final class SubtitleChecker {

	@Nonnull
	private final Path sourceDir;
	@Nonnull
	private final List<Path> targetDirs;
	@Nonnull
	private final SrtParser parser = new SrtParser();
	@Nonnull
	private final List<CheckError> errors = new ArrayList<>();
	@Nonnull
	private final List<Path> missingTranslations = new ArrayList<>();

	/**
	 * @param sourceDir  the source directory, used to locate translations by relative path
	 * @param targetDirs translation directories, one per target language
	 */
	public SubtitleChecker(@Nonnull Path sourceDir, @Nonnull List<Path> targetDirs) {
		this.sourceDir = Objects.requireNonNull(sourceDir, "sourceDir must not be null").toAbsolutePath().normalize();
		this.targetDirs = List.copyOf(Objects.requireNonNull(targetDirs, "targetDirs must not be null"));
	}

	/**
	 * Checks a source file and every existing translation of it.
	 *
	 * @param file    the source file
	 * @param content the source content
	 * @throws IOException when a translation exists but cannot be read
	 */
	public void checkFile(@Nonnull Path file, @Nonnull String content) throws IOException {
		Objects.requireNonNull(file, "file must not be null");
		Objects.requireNonNull(content, "content must not be null");

		final Path normalized = file.toAbsolutePath().normalize();
		final List<SubtitleEntry> source;
		try {
			source = this.parser.parse(content);
		} catch (SrtParseException e) {
			this.errors.add(new CheckError(normalized, CheckError.CheckErrorType.MALFORMED_SOURCE, e.getMessage()));
			return;
		}
		if (source.isEmpty()) {
			this.errors.add(new CheckError(normalized, CheckError.CheckErrorType.EMPTY_SOURCE, "no subtitle entries"));
			return;
		}

		final Path relativePath = this.sourceDir.relativize(normalized);
		for (final Path targetDir : this.targetDirs) {
			final Path translation = targetDir.toAbsolutePath().normalize().resolve(relativePath);
			if (Files.exists(translation)) {
				checkTranslation(source, translation);
			} else {
				this.missingTranslations.add(translation);
			}
		}
	}

	private void checkTranslation(@Nonnull List<SubtitleEntry> source, @Nonnull Path translationFile) throws IOException {
		final List<SubtitleEntry> translated;
		try {
			translated = this.parser.parse(Files.readString(translationFile, StandardCharsets.UTF_8));
		} catch (SrtParseException e) {
			this.errors.add(new CheckError(translationFile, CheckError.CheckErrorType.MALFORMED_TRANSLATION, e.getMessage()));
			return;
		}
		if (translated.size() != source.size()) {
			this.errors.add(new CheckError(
				translationFile, CheckError.CheckErrorType.ENTRY_COUNT_MISMATCH,
				"expected " + source.size() + " entries, found " + translated.size()
			));
			return;
		}
		for (int i = 0; i < source.size(); i++) {
			if (!source.get(i).timecode().equals(translated.get(i).timecode())) {
				this.errors.add(new CheckError(
					translationFile, CheckError.CheckErrorType.TIMING_MISMATCH,
					"entry " + (i + 1) + " is " + translated.get(i).timecode().formatSrt()
						+ " instead of " + source.get(i).timecode().formatSrt()
				));
				return;
			}
		}
	}

	@Nonnull
	public CheckResult getResult() {
		return new CheckResult(this.errors, this.missingTranslations);
	}
}
