package io.evitadb.subtitler;

import io.evitadb.subtitler.model.SubtitleEntry;
import io.evitadb.subtitler.model.TranslationJob;
import io.evitadb.subtitler.session.ContentHasher;
import io.evitadb.subtitler.session.SessionKey;
import io.evitadb.subtitler.session.SessionRepository;
import io.evitadb.subtitler.session.SessionStatus;
import io.evitadb.subtitler.session.TranslationSession;
import io.evitadb.subtitler.srt.SrtParseException;
import io.evitadb.subtitler.srt.SrtParser;
import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Plans the translation workflow: parses source files, consults the session repository and creates
 * a translation job for every file and target language that needs one. Also reports dry-run results.
 *
 * A file is up to date when its translation exists and the repository has a completed session for the
 * same source content, languages, provider and model.
 */
public final class TranslationOrchestrator {

	@Nonnull
	private final SessionRepository sessions;
	@Nonnull
	private final Path sourceDir;
	@Nonnull
	private final String provider;
	@Nonnull
	private final String model;
	@Nonnull
	private final Log log;
	@Nonnull
	private final SrtParser parser = new SrtParser();

	/**
	 * @param sessions  repository of earlier runs
	 * @param sourceDir the source root directory for relative path calculation
	 * @param provider  model provider, part of the session key
	 * @param model     model name, part of the session key
	 * @param log       Maven log for output
	 */
	public TranslationOrchestrator(
		@Nonnull SessionRepository sessions,
		@Nonnull Path sourceDir,
		@Nonnull String provider,
		@Nonnull String model,
		@Nonnull Log log
	) {
		this.sessions = Objects.requireNonNull(sessions, "sessions must not be null");
		this.sourceDir = Objects.requireNonNull(sourceDir, "sourceDir must not be null").toAbsolutePath().normalize();
		this.provider = Objects.requireNonNull(provider, "provider must not be null");
		this.model = Objects.requireNonNull(model, "model must not be null");
		this.log = Objects.requireNonNull(log, "log must not be null");
	}

	/**
	 * Creates a translation job for a file, or returns empty if the file should be skipped.
	 *
	 * @param sourceFile     the source subtitle file
	 * @param sourceContent  the content of the source file
	 * @param targetDir      the target directory for translations
	 * @param sourceLanguage language of the source file
	 * @param locale         the target locale
	 * @param instructions   accumulated instructions from `.subtitler-instructions` files, may be null
	 * @return the job, or empty if the file is up to date, malformed or empty
	 */
	@Nonnull
	public Optional<TranslationJob> createJob(
		@Nonnull Path sourceFile,
		@Nonnull String sourceContent,
		@Nonnull Path targetDir,
		@Nonnull String sourceLanguage,
		@Nonnull Locale locale,
		@Nullable String instructions
	) {
		Objects.requireNonNull(sourceFile, "sourceFile must not be null");
		Objects.requireNonNull(sourceContent, "sourceContent must not be null");
		Objects.requireNonNull(targetDir, "targetDir must not be null");
		Objects.requireNonNull(sourceLanguage, "sourceLanguage must not be null");
		Objects.requireNonNull(locale, "locale must not be null");

		final Path relativePath = relativize(sourceFile);

		final List<SubtitleEntry> entries;
		try {
			entries = this.parser.parse(sourceContent);
		} catch (SrtParseException e) {
			this.log.error("[ERROR] Skipping malformed subtitle file " + relativePath + ": " + e.getMessage());
			return Optional.empty();
		}
		if (entries.isEmpty()) {
			this.log.warn("[WARN] Skipping subtitle file without entries: " + relativePath);
			return Optional.empty();
		}

		final SessionKey key = new SessionKey(
			ContentHasher.sha256(sourceContent), sourceLanguage, locale.toLanguageTag(), this.provider, this.model
		);
		final Path targetFile = targetDir.resolve(relativePath);
		final boolean targetExists = Files.exists(targetFile);
		final Optional<TranslationSession> previous = this.sessions.find(key);

		if (targetExists && previous.isPresent() && previous.get().status() == SessionStatus.COMPLETED) {
			return Optional.empty();
		}

		final TranslationJob.Type type;
		if (previous.isPresent()) {
			type = TranslationJob.Type.RETRY;
		} else if (targetExists) {
			type = TranslationJob.Type.UPDATE;
		} else {
			type = TranslationJob.Type.NEW;
		}
		return Optional.of(new TranslationJob(
			type, sourceFile, targetFile, sourceLanguage, locale, entries, key, instructions
		));
	}

	/**
	 * Reports a translation job for dry-run output.
	 *
	 * @param job          the job to report
	 * @param relativePath the relative path for display
	 */
	public void reportJob(@Nonnull TranslationJob job, @Nonnull Path relativePath) {
		Objects.requireNonNull(job, "job must not be null");
		Objects.requireNonNull(relativePath, "relativePath must not be null");

		switch (job.type()) {
			case NEW -> this.log.info("[NEW] " + relativePath + " (" + job.entries().size() + " entries)");
			case UPDATE -> this.log.info(
				"[UPDATE] " + relativePath + ": source changed since last translation (" + job.entries().size() + " entries)"
			);
			case RETRY -> this.log.info(String.format(
				"[RETRY] %s: previous run %s",
				relativePath,
				this.sessions.find(job.sessionKey()).map(TranslationSession::toString).orElse("unknown")
			));
		}
	}

	/**
	 * Reports that a file was skipped because it's up to date.
	 *
	 * @param relativePath the relative path for display
	 */
	public void reportUpToDate(@Nonnull Path relativePath) {
		this.log.info("[SKIP] " + relativePath + " (up to date)");
	}

	@Nonnull
	Path relativize(@Nonnull Path file) {
		return this.sourceDir.relativize(file.toAbsolutePath().normalize());
	}
}
