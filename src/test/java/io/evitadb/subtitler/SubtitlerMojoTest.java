package io.evitadb.subtitler;

import io.evitadb.subtitler.context.DynamicWindowConfig;
import io.evitadb.subtitler.pipeline.PipelineConfig;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.logging.Log;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SubtitlerMojo should configure and run the plugin actions")
public class SubtitlerMojoTest {

	private static final String SOURCE = "1\n00:00:01,000 --> 00:00:02,000\nHello.\n";

	private Path tempDir;
	private StringBuilder out;
	private SubtitlerMojo mojo;

	@BeforeEach
	void setUp() throws IOException {
		tempDir = Files.createTempDirectory("mojo-test-");
		out = new StringBuilder();
		mojo = new SubtitlerMojo();
		mojo.setLog(new CapturingLog(out));
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
	@DisplayName("shouldShowDefaultsAndWarnAboutMissingSettings")
	void shouldShowDefaultsAndWarnAboutMissingSettings() throws MojoExecutionException {
		mojo.setAction("show-config");
		mojo.setLlmToken("sk-secret-1234");

		mojo.execute();

		final String log = out.toString();
		assertTrue(log.contains("Subtitler Plugin Configuration:"));
		assertTrue(log.contains(" - fileRegex: (?i).*\\.srt"));
		assertTrue(log.contains(" - llmToken: ****1234"));
		assertTrue(log.contains(" - limit: 2147483647"));
		assertTrue(log.contains(" - dryRun: true"));
		assertTrue(log.contains(" - batchSize: <profile default>"));
		assertTrue(log.contains("Source directory is not set"));
		assertTrue(log.contains("No target languages configured"));
		assertFalse(log.contains("LLM token is not set"));
	}

	@Test
	@DisplayName("shouldRejectUnknownAction")
	void shouldRejectUnknownAction() {
		mojo.setAction("publish");

		final MojoExecutionException thrown = assertThrows(MojoExecutionException.class, mojo::execute);
		assertTrue(thrown.getMessage().startsWith("Unknown action: publish"));
	}

	@Test
	@DisplayName("shouldApplyOverridesOnTopOfProfile")
	void shouldApplyOverridesOnTopOfProfile() throws MojoExecutionException {
		mojo.setProfile("fast");
		mojo.setBatchSize(7);
		mojo.setMinConfidence(0.8);
		mojo.setFeedbackRounds(2);
		mojo.setInstructions("Use informal address.");

		final PipelineConfig config = mojo.buildPipelineConfig();

		assertFalse(config.enableValidation());
		assertEquals(7, config.translationConfig().window().batchSize());
		assertEquals(1, config.translationConfig().maxRetries());
		assertEquals(0.8, config.validationConfig().minConfidence(), 0.0001);
		assertEquals(2, config.feedbackRounds());
		assertEquals("Use informal address.", config.translationConfig().customInstructions());
	}

	@Test
	@DisplayName("shouldEnableDynamicSizingAndRecoveryProfile")
	void shouldEnableDynamicSizingAndRecoveryProfile() throws MojoExecutionException {
		mojo.setDynamicSizing(true);
		mojo.setRecoveryProfile("aggressive");

		final PipelineConfig config = mojo.buildPipelineConfig();

		assertEquals(DynamicWindowConfig.defaults(), config.translationConfig().dynamicSizing());
		assertEquals(5, config.translationConfig().maxRetries());
	}

	@Test
	@DisplayName("shouldTurnOffLanguagePairThresholds")
	void shouldTurnOffLanguagePairThresholds() throws MojoExecutionException {
		assertTrue(mojo.buildPipelineConfig().validationConfig().languagePairThresholds());

		mojo.setLanguagePairThresholds(false);

		assertFalse(mojo.buildPipelineConfig().validationConfig().languagePairThresholds());
	}

	@Test
	@DisplayName("shouldShowCacheSize")
	void shouldShowCacheSize() throws MojoExecutionException {
		mojo.setAction("show-config");
		mojo.setCacheMaxEntries(0);

		mojo.execute();

		assertTrue(out.toString().contains(" - cacheMaxEntries: 0 (disabled)"));
		assertTrue(out.toString().contains(" - languagePairThresholds: <profile default>"));
	}

	@Test
	@DisplayName("shouldRejectUnknownProfile")
	void shouldRejectUnknownProfile() {
		mojo.setProfile("turbo");

		final MojoExecutionException thrown = assertThrows(MojoExecutionException.class, mojo::buildPipelineConfig);
		assertTrue(thrown.getMessage().contains("Unknown profile: turbo"));
	}

	@Test
	@DisplayName("shouldLimitJobsInDryRun")
	void shouldLimitJobsInDryRun() throws Exception {
		final Path source = Files.createDirectories(tempDir.resolve("en"));
		Files.writeString(source.resolve("a.srt"), SOURCE, StandardCharsets.UTF_8);
		Files.writeString(source.resolve("b.srt"), SOURCE, StandardCharsets.UTF_8);
		mojo.setAction("translate");
		mojo.setSourceDir(source.toString());
		mojo.setDryRun(true);
		mojo.setLimit(1);
		mojo.setTargets(List.of(new SubtitlerMojo.Target("cs", tempDir.resolve("cs").toString())));

		mojo.execute();

		final String log = out.toString();
		assertTrue(log.contains("[NEW] a.srt (1 entries)"), log);
		assertTrue(log.contains("New files: 1"), log);
		assertFalse(log.contains("b.srt"), log);
		assertFalse(Files.exists(tempDir.resolve("cs")));
	}

	@Test
	@DisplayName("shouldRejectInvalidParallelism")
	void shouldRejectInvalidParallelism() throws IOException {
		mojo.setAction("translate");
		mojo.setSourceDir(Files.createDirectories(tempDir.resolve("en")).toString());
		mojo.setTargets(List.of(new SubtitlerMojo.Target("cs", tempDir.resolve("cs").toString())));
		mojo.setParallelism(0);

		assertThrows(MojoExecutionException.class, mojo::execute);
	}

	@Test
	@DisplayName("shouldPassCheckForMatchingTranslation")
	void shouldPassCheckForMatchingTranslation() throws Exception {
		final Path source = Files.createDirectories(tempDir.resolve("en"));
		final Path target = Files.createDirectories(tempDir.resolve("cs"));
		Files.writeString(source.resolve("a.srt"), SOURCE, StandardCharsets.UTF_8);
		Files.writeString(target.resolve("a.srt"), SOURCE.replace("Hello.", "Ahoj."), StandardCharsets.UTF_8);
		Files.writeString(source.resolve("b.srt"), SOURCE, StandardCharsets.UTF_8);
		mojo.setAction("check");
		mojo.setSourceDir(source.toString());
		mojo.setTargets(List.of(new SubtitlerMojo.Target("cs", target.toString())));

		mojo.execute();

		final String log = out.toString();
		assertTrue(log.contains("Checked 2 files"));
		assertTrue(log.contains("Missing translations: 1"));
		assertTrue(log.contains("All checks passed!"));
	}

	@Test
	@DisplayName("shouldFailCheckForShiftedTranslation")
	void shouldFailCheckForShiftedTranslation() throws Exception {
		final Path source = Files.createDirectories(tempDir.resolve("en"));
		final Path target = Files.createDirectories(tempDir.resolve("cs"));
		Files.writeString(source.resolve("a.srt"), SOURCE, StandardCharsets.UTF_8);
		Files.writeString(target.resolve("a.srt"), SOURCE.replace("00:00:02,000", "00:00:02,500"), StandardCharsets.UTF_8);
		mojo.setAction("check");
		mojo.setSourceDir(source.toString());
		mojo.setTargets(List.of(new SubtitlerMojo.Target("cs", target.toString())));

		final MojoExecutionException thrown = assertThrows(MojoExecutionException.class, mojo::execute);

		assertEquals("Check failed with 1 error(s)", thrown.getMessage());
		assertTrue(out.toString().contains("TIMING_MISMATCH"));
	}

	private static class CapturingLog implements Log {
		private final StringBuilder out;

		CapturingLog(StringBuilder out) {
			this.out = out;
		}

		@Override public boolean isDebugEnabled() { return true; }
		@Override public void debug(CharSequence content) { out.append(content).append('\n'); }
		@Override public void debug(CharSequence content, Throwable error) { out.append(content).append('\n'); }
		@Override public void debug(Throwable error) { out.append(error).append('\n'); }
		@Override public boolean isInfoEnabled() { return true; }
		@Override public void info(CharSequence content) { out.append(content).append('\n'); }
		@Override public void info(CharSequence content, Throwable error) { out.append(content).append('\n'); }
		@Override public void info(Throwable error) { out.append(error).append('\n'); }
		@Override public boolean isWarnEnabled() { return true; }
		@Override public void warn(CharSequence content) { out.append(content).append('\n'); }
		@Override public void warn(CharSequence content, Throwable error) { out.append(content).append('\n'); }
		@Override public void warn(Throwable error) { out.append(error).append('\n'); }
		@Override public boolean isErrorEnabled() { return true; }
		@Override public void error(CharSequence content) { out.append(content).append('\n'); }
		@Override public void error(CharSequence content, Throwable error) { out.append(content).append('\n'); }
		@Override public void error(Throwable error) { out.append(error).append('\n'); }
	}
}
