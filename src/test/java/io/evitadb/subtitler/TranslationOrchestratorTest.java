package io.evitadb.subtitler;

import io.evitadb.subtitler.model.SubtitleEntry;
import io.evitadb.subtitler.model.TranslationJob;
import io.evitadb.subtitler.session.ContentHasher;
import io.evitadb.subtitler.session.InMemorySessionRepository;
import io.evitadb.subtitler.session.SessionKey;
import io.evitadb.subtitler.session.TranslationSession;
import org.apache.maven.plugin.logging.Log;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TranslationOrchestrator should plan translation jobs")
public class TranslationOrchestratorTest {

	private static final Locale CZECH = Locale.forLanguageTag("cs");
	private static final String CONTENT = """
		1
		00:00:01,000 --> 00:00:02,000
		Hello.

		2
		00:00:03,000 --> 00:00:04,000
		Bye now.
		""";

	private Path tempDir;
	private Path sourceDir;
	private Path targetDir;
	private InMemorySessionRepository sessions;
	private TestLog testLog;
	private TranslationOrchestrator orchestrator;

	@BeforeEach
	void setUp() throws IOException {
		tempDir = Files.createTempDirectory("orchestrator-test-");
		sourceDir = Files.createDirectories(tempDir.resolve("en"));
		targetDir = tempDir.resolve("cs");
		sessions = new InMemorySessionRepository();
		testLog = new TestLog();
		orchestrator = new TranslationOrchestrator(sessions, sourceDir, "openai", "gpt-4o", testLog);
	}

	@AfterEach
	void tearDown() throws IOException {
		try (Stream<Path> paths = Files.walk(tempDir)) {
			for (final Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
				Files.deleteIfExists(path);
			}
		}
	}

	@Test
	@DisplayName("shouldCreateNewJobWhenNoTargetExists")
	void shouldCreateNewJobWhenNoTargetExists() {
		final Path source = sourceDir.resolve("show/e01.srt");

		final TranslationJob job = orchestrator.createJob(source, CONTENT, targetDir, "en", CZECH, "Be brief.").orElseThrow();

		assertEquals(TranslationJob.Type.NEW, job.type());
		assertEquals(targetDir.resolve("show/e01.srt"), job.targetFile());
		assertEquals(2, job.entries().size());
		assertEquals(new SubtitleEntry(2, 3_000, 4_000, "Bye now."), job.entries().get(1));
		assertEquals(new SessionKey(ContentHasher.sha256(CONTENT), "en", "cs", "openai", "gpt-4o"), job.sessionKey());
		assertEquals("Be brief.", job.instructions());
		assertEquals("cs", job.getTargetLanguage());
	}

	@Test
	@DisplayName("shouldCreateUpdateJobWhenTargetExistsWithoutSession")
	void shouldCreateUpdateJobWhenTargetExistsWithoutSession() throws IOException {
		writeTarget("e01.srt");

		final Optional<TranslationJob> job = orchestrator.createJob(
			sourceDir.resolve("e01.srt"), CONTENT, targetDir, "en", CZECH, null
		);

		assertEquals(TranslationJob.Type.UPDATE, job.orElseThrow().type());
	}

	@Test
	@DisplayName("shouldSkipWhenTargetIsUpToDate")
	void shouldSkipWhenTargetIsUpToDate() throws IOException {
		writeTarget("e01.srt");
		final TranslationSession session = sessions.create(key(), "e01.srt", 2);
		sessions.markComplete(session.id());

		assertTrue(orchestrator.createJob(sourceDir.resolve("e01.srt"), CONTENT, targetDir, "en", CZECH, null).isEmpty());
	}

	@Test
	@DisplayName("shouldRetryAfterFailedSession")
	void shouldRetryAfterFailedSession() throws IOException {
		writeTarget("e01.srt");
		final TranslationSession session = sessions.create(key(), "e01.srt", 2);
		sessions.markFailed(session.id(), "Rate limit exceeded");

		final TranslationJob job = orchestrator.createJob(
			sourceDir.resolve("e01.srt"), CONTENT, targetDir, "en", CZECH, null
		).orElseThrow();

		assertEquals(TranslationJob.Type.RETRY, job.type());
		orchestrator.reportJob(job, Path.of("e01.srt"));
		assertTrue(testLog.infos.get(0).startsWith("[RETRY] e01.srt: previous run "));
	}

	@Test
	@DisplayName("shouldTranslateAgainWhenCompletedTargetWasDeleted")
	void shouldTranslateAgainWhenCompletedTargetWasDeleted() {
		final TranslationSession session = sessions.create(key(), "e01.srt", 2);
		sessions.markComplete(session.id());

		final TranslationJob job = orchestrator.createJob(
			sourceDir.resolve("e01.srt"), CONTENT, targetDir, "en", CZECH, null
		).orElseThrow();

		assertEquals(TranslationJob.Type.RETRY, job.type());
	}

	@Test
	@DisplayName("shouldTreatDifferentModelAsNewContent")
	void shouldTreatDifferentModelAsNewContent() throws IOException {
		writeTarget("e01.srt");
		final TranslationSession session = sessions.create(key(), "e01.srt", 2);
		sessions.markComplete(session.id());
		final TranslationOrchestrator otherModel = new TranslationOrchestrator(
			sessions, sourceDir, "anthropic", "claude-sonnet-4-20250514", testLog
		);

		assertEquals(
			TranslationJob.Type.UPDATE,
			otherModel.createJob(sourceDir.resolve("e01.srt"), CONTENT, targetDir, "en", CZECH, null).orElseThrow().type()
		);
	}

	@Test
	@DisplayName("shouldSkipMalformedAndEmptyFiles")
	void shouldSkipMalformedAndEmptyFiles() {
		assertTrue(orchestrator.createJob(
			sourceDir.resolve("broken.srt"), "Hello\n00:00:01,000 --> 00:00:02,000\n", targetDir, "en", CZECH, null
		).isEmpty());
		assertTrue(orchestrator.createJob(sourceDir.resolve("empty.srt"), "\n", targetDir, "en", CZECH, null).isEmpty());

		assertTrue(testLog.errors.get(0).startsWith("[ERROR] Skipping malformed subtitle file broken.srt"));
		assertEquals("[WARN] Skipping subtitle file without entries: empty.srt", testLog.warnings.get(0));
	}

	@Test
	@DisplayName("shouldReportNewJobAndUpToDateFile")
	void shouldReportNewJobAndUpToDateFile() {
		final TranslationJob job = orchestrator.createJob(
			sourceDir.resolve("e01.srt"), CONTENT, targetDir, "en", CZECH, null
		).orElseThrow();

		orchestrator.reportJob(job, Path.of("e01.srt"));
		orchestrator.reportUpToDate(Path.of("e02.srt"));

		assertEquals(List.of("[NEW] e01.srt (2 entries)", "[SKIP] e02.srt (up to date)"), testLog.infos);
	}

	private SessionKey key() {
		return new SessionKey(ContentHasher.sha256(CONTENT), "en", "cs", "openai", "gpt-4o");
	}

	private void writeTarget(String relativePath) throws IOException {
		final Path file = targetDir.resolve(relativePath);
		Files.createDirectories(file.getParent());
		Files.writeString(file, "1\n00:00:01,000 --> 00:00:02,000\nAhoj.\n", StandardCharsets.UTF_8);
	}

	private static class TestLog implements Log {
		private final List<String> infos = new ArrayList<>();
		private final List<String> warnings = new ArrayList<>();
		private final List<String> errors = new ArrayList<>();

		@Override public boolean isDebugEnabled() { return false; }
		@Override public void debug(CharSequence content) {}
		@Override public void debug(CharSequence content, Throwable error) {}
		@Override public void debug(Throwable error) {}
		@Override public boolean isInfoEnabled() { return true; }
		@Override public void info(CharSequence content) { infos.add(content.toString()); }
		@Override public void info(CharSequence content, Throwable error) { infos.add(content.toString()); }
		@Override public void info(Throwable error) {}
		@Override public boolean isWarnEnabled() { return true; }
		@Override public void warn(CharSequence content) { warnings.add(content.toString()); }
		@Override public void warn(CharSequence content, Throwable error) { warnings.add(content.toString()); }
		@Override public void warn(Throwable error) {}
		@Override public boolean isErrorEnabled() { return true; }
		@Override public void error(CharSequence content) { errors.add(content.toString()); }
		@Override public void error(CharSequence content, Throwable error) { errors.add(content.toString()); }
		@Override public void error(Throwable error) {}
	}
}
