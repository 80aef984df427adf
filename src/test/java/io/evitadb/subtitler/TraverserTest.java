package io.evitadb.subtitler;

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
import java.util.regex.Pattern;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Traverser should visit subtitle files in deterministic order with their instructions")
public class TraverserTest {

	private static final Pattern SRT = Pattern.compile("(?i).*\\.srt");

	private Path root;
	private final List<Path> visited = new ArrayList<>();
	private final List<String> contents = new ArrayList<>();
	private final List<String> instructions = new ArrayList<>();

	@BeforeEach
	void setUp() throws IOException {
		this.root = Files.createTempDirectory("traverser-test-");
	}

	@AfterEach
	void tearDown() throws IOException {
		try (Stream<Path> paths = Files.walk(this.root)) {
			for (final Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
				Files.deleteIfExists(path);
			}
		}
	}

	@Test
	@DisplayName("shouldVisitMatchingFilesInLexicographicalOrder")
	void shouldVisitMatchingFilesInLexicographicalOrder() throws IOException {
		final Path first = write("season1/e01.srt", "ONE");
		write("season1/e01.txt", "ignored");
		final Path second = write("season1/extras/e02.SRT", "TWO");
		final Path third = write("trailer.srt", "THREE");

		traverse(null);

		assertEquals(List.of(first, second, third), this.visited);
		assertEquals(List.of("ONE", "TWO", "THREE"), this.contents);
		assertTrue(this.instructions.stream().allMatch(value -> value == null));
	}

	@Test
	@DisplayName("shouldAccumulateInstructionsFromParentDirectories")
	void shouldAccumulateInstructionsFromParentDirectories() throws IOException {
		write(Traverser.INSTRUCTIONS_FILE, "Use informal address.");
		write("show/" + Traverser.INSTRUCTIONS_FILE, "Keep chemistry terms precise.");
		write("show/s01/" + Traverser.INSTRUCTIONS_FILE, "  ");
		write("show/s01/e01.srt", "E01");
		write("show/pilot.srt", "PILOT");

		traverse(null);

		assertEquals("Use informal address.\n\nKeep chemistry terms precise.", this.instructions.get(0));
		assertEquals("Use informal address.\n\nKeep chemistry terms precise.", this.instructions.get(1));
	}

	@Test
	@DisplayName("shouldRestartInstructionsAtReplaceFile")
	void shouldRestartInstructionsAtReplaceFile() throws IOException {
		write(Traverser.INSTRUCTIONS_FILE, "ROOT");
		write("kids/" + Traverser.INSTRUCTIONS_REPLACE_FILE, "REPLACED");
		write("kids/" + Traverser.INSTRUCTIONS_FILE, "KIDS");
		write("kids/cartoon/" + Traverser.INSTRUCTIONS_FILE, "CARTOON");
		write("kids/cartoon/e01.srt", "E01");
		write("kids/movie.srt", "MOVIE");

		traverse(null);

		assertEquals("REPLACED\n\nKIDS\n\nCARTOON", this.instructions.get(0));
		assertEquals("REPLACED\n\nKIDS", this.instructions.get(1));
	}

	@Test
	@DisplayName("shouldSkipExcludedDirectoriesAndFiles")
	void shouldSkipExcludedDirectoriesAndFiles() throws IOException {
		final Path kept = write("movies/film.srt", "FILM");
		write("movies/_draft.srt", "DRAFT");
		write("archive/old.srt", "OLD");
		final Path other = write("other.srt", "OTHER");

		traverse(List.of(Pattern.compile(".*/archive/.*"), Pattern.compile(".*/_.*\\.srt")));

		assertEquals(List.of(kept, other), this.visited);
	}

	@Test
	@DisplayName("shouldFailForMissingSourceDirectory")
	void shouldFailForMissingSourceDirectory() {
		final Traverser traverser = new Traverser(this.root.resolve("missing"), SRT, (file, content, instr) -> {});

		final IOException thrown = assertThrows(IOException.class, traverser::traverse);
		assertTrue(thrown.getMessage().startsWith("Source directory does not exist"));
	}

	private void traverse(List<Pattern> exclusions) throws IOException {
		new Traverser(this.root, SRT, exclusions, (file, content, instr) -> {
			this.visited.add(file);
			this.contents.add(content);
			this.instructions.add(instr);
		}).traverse();
	}

	private Path write(String relativePath, String content) throws IOException {
		final Path file = this.root.resolve(relativePath);
		Files.createDirectories(file.getParent());
		Files.writeString(file, content, StandardCharsets.UTF_8);
		return file;
	}
}
