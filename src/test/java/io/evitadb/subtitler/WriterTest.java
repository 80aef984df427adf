package io.evitadb.subtitler;

import io.evitadb.subtitler.model.SubtitleEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("Writer should write SubRip files")
public class WriterTest {

	@Test
	@DisplayName("shouldWriteToFileAndCreateParents")
	public void shouldWriteToFileAndCreateParents() throws IOException {
		final Path tempDir = Files.createTempDirectory("writer-out-");
		final Path target = tempDir.resolve("a/b/c.srt");

		new Writer().write(List.of(new SubtitleEntry(1, 1_000, 2_500, "Ahoj, světe.")), target);

		assertEquals(
			"1\n00:00:01,000 --> 00:00:02,500\nAhoj, světe.\n\n",
			Files.readString(target, StandardCharsets.UTF_8)
		);
	}

	@Test
	@DisplayName("shouldOverwriteExistingFileWhenPresent")
	public void shouldOverwriteExistingFileWhenPresent() throws IOException {
		final Path tempDir = Files.createTempDirectory("writer-over-");
		final Path target = tempDir.resolve("x/y.srt");
		Files.createDirectories(target.getParent());
		Files.writeString(target, "OLD", StandardCharsets.UTF_8);

		new Writer().write(List.of(new SubtitleEntry(7, 0, 900, "<i>Nové</i>")), target);

		assertEquals("7\n00:00:00,000 --> 00:00:00,900\n<i>Nové</i>\n\n", Files.readString(target, StandardCharsets.UTF_8));
	}
}
