package io.evitadb.subtitler;

import io.evitadb.subtitler.model.SubtitleEntry;
import io.evitadb.subtitler.srt.SrtSerializer;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Writes translated subtitle entries to a target file in SubRip format.
 */
public final class Writer {

	@Nonnull
	private final SrtSerializer serializer = new SrtSerializer();

	/**
	 * Writes the entries to the target file, creating parent directories as needed.
	 *
	 * @param entries    entries in output order
	 * @param targetFile the file to write, overwritten when it exists
	 * @throws IOException if directories cannot be created or the file cannot be written
	 */
	public void write(@Nonnull List<SubtitleEntry> entries, @Nonnull Path targetFile) throws IOException {
		Objects.requireNonNull(entries, "entries must not be null");
		Objects.requireNonNull(targetFile, "targetFile must not be null");

		final Path absolute = targetFile.toAbsolutePath().normalize();
		final Path parent = absolute.getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}
		Files.writeString(absolute, this.serializer.serialize(entries), StandardCharsets.UTF_8);
	}
}
