package io.evitadb.subtitler;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Visitor that processes a matched subtitle file.
 *
 * Receives the file contents and the instructions accumulated from `.subtitler-instructions` files
 * in the directory hierarchy.
 */
@FunctionalInterface
public interface Visitor {
	/**
	 * Called for each file that matches the configured pattern.
	 *
	 * @param file         path to the file that matched
	 * @param content      full textual contents of the file
	 * @param instructions accumulated instructions, may be null
	 * @throws IOException when the visitor fails to read related files
	 */
	void visit(@Nonnull Path file, @Nonnull String content, @Nullable String instructions) throws IOException;
}
