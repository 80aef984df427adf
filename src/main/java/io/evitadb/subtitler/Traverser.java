package io.evitadb.subtitler;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Traverses a source directory recursively, finds subtitle files matching a regex pattern and
 * invokes a visitor with the full file contents and accumulated instructions.
 *
 * - Files are visited in lexicographical order of their paths.
 * - Contents are read as UTF-8.
 * - Instructions are accumulated from files named ".subtitler-instructions" in directories from the root
 *   to the file's parent. A ".subtitler-instructions.replace" file discards the instructions of parent
 *   directories and restarts accumulation at its level.
 */
public final class Traverser {

	@Nonnull
	static final String INSTRUCTIONS_FILE = ".subtitler-instructions";
	@Nonnull
	static final String INSTRUCTIONS_REPLACE_FILE = ".subtitler-instructions.replace";

	@Nonnull
	private final Path sourceDir;
	@Nonnull
	private final Pattern filePattern;
	@Nonnull
	private final List<Pattern> exclusionPatterns;
	@Nonnull
	private final Visitor visitor;

	/**
	 * @param sourceDir   root directory to traverse
	 * @param filePattern regex matched against the full path (Path.toString())
	 * @param visitor     callback to process file contents
	 */
	public Traverser(@Nonnull Path sourceDir, @Nonnull Pattern filePattern, @Nonnull Visitor visitor) {
		this(sourceDir, filePattern, null, visitor);
	}

	/**
	 * @param sourceDir         root directory to traverse
	 * @param filePattern       regex matched against the full path (Path.toString())
	 * @param exclusionPatterns regex patterns of excluded directories and files, may be null
	 * @param visitor           callback to process file contents
	 */
	public Traverser(
		@Nonnull Path sourceDir,
		@Nonnull Pattern filePattern,
		@Nullable List<Pattern> exclusionPatterns,
		@Nonnull Visitor visitor
	) {
		this.sourceDir = sourceDir;
		this.filePattern = filePattern;
		this.exclusionPatterns = exclusionPatterns != null ? List.copyOf(exclusionPatterns) : List.of();
		this.visitor = visitor;
	}

	/**
	 * Performs the traversal and notifies the visitor for each matched file.
	 *
	 * @throws IOException when the directory or a file cannot be read
	 */
	public void traverse() throws IOException {
		if (!Files.exists(this.sourceDir)) {
			throw new IOException("Source directory does not exist: " + this.sourceDir);
		}
		if (!Files.isDirectory(this.sourceDir)) {
			throw new IOException("Source path is not a directory: " + this.sourceDir);
		}

		final List<Path> files = new ArrayList<>();
		collectFiles(this.sourceDir, files);
		files.sort(Comparator.comparing(Path::toString));

		final Map<Path, String> dirInstructionsCache = new HashMap<>();
		for (final Path file : files) {
			final String p = file.toString();
			if (!this.filePattern.matcher(p).matches() || isExcluded(p)) {
				continue;
			}
			final String content = Files.readString(file, StandardCharsets.UTF_8);
			final Path parent = file.getParent();
			final String instructions = parent == null ? null : computeInstructions(parent, dirInstructionsCache);
			this.visitor.visit(file, content, instructions);
		}
	}

	private void collectFiles(@Nonnull Path dir, @Nonnull List<Path> out) throws IOException {
		final List<Path> children = new ArrayList<>();
		try (var stream = Files.list(dir)) {
			stream.forEach(children::add);
		}
		children.sort(Comparator.comparing(Path::toString));
		for (final Path child : children) {
			final BasicFileAttributes attrs = Files.readAttributes(child, BasicFileAttributes.class);
			if (attrs.isDirectory()) {
				final String dirPath = child.toString();
				if (!isExcluded(dirPath) && !isExcluded(dirPath + "/")) {
					collectFiles(child, out);
				}
			} else if (attrs.isRegularFile()) {
				out.add(child);
			}
			// symlinks are not followed
		}
	}

	private boolean isExcluded(@Nonnull String path) {
		for (final Pattern pattern : this.exclusionPatterns) {
			if (pattern.matcher(path).matches()) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Computes the instructions of a directory from its own instruction files and those of its parents.
	 *
	 * @return accumulated instructions or null if none found
	 */
	@Nullable
	private String computeInstructions(@Nonnull Path dir, @Nonnull Map<Path, String> cache) throws IOException {
		if (cache.containsKey(dir)) {
			return cache.get(dir);
		}

		final Path replacePath = dir.resolve(INSTRUCTIONS_REPLACE_FILE);
		final boolean replaceHere = Files.exists(replacePath);
		final StringBuilder result = new StringBuilder();

		// parents above the source root do not contribute
		final Path parent = dir.getParent();
		if (!replaceHere && parent != null && !dir.equals(this.sourceDir)) {
			final String parentInstructions = computeInstructions(parent, cache);
			if (parentInstructions != null) {
				result.append(parentInstructions);
			}
		}
		if (replaceHere) {
			appendInstructionContent(replacePath, result);
		}
		final Path instructionsPath = dir.resolve(INSTRUCTIONS_FILE);
		if (Files.exists(instructionsPath)) {
			appendInstructionContent(instructionsPath, result);
		}

		final String instructions = result.length() > 0 ? result.toString() : null;
		cache.put(dir, instructions);
		return instructions;
	}

	private static void appendInstructionContent(@Nonnull Path instructionFile, @Nonnull StringBuilder result) throws IOException {
		final String content = Files.readString(instructionFile, StandardCharsets.UTF_8).trim();
		if (!content.isEmpty()) {
			if (result.length() > 0) {
				result.append("\n\n");
			}
			result.append(content);
		}
	}
}
