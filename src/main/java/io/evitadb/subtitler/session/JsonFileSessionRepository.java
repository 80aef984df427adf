package io.evitadb.subtitler.session;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * Session repository persisted as a JSON array in a single file. The file is rewritten after every change
 * through a temporary sibling file and an atomic move.
 */
public final class JsonFileSessionRepository extends InMemorySessionRepository {

	private static final TypeReference<List<TranslationSession>> SESSION_LIST = new TypeReference<>() {
	};

	@Nonnull
	private final Path file;
	@Nonnull
	private final ObjectMapper objectMapper = new ObjectMapper()
		.enable(SerializationFeature.INDENT_OUTPUT)
		.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

	/**
	 * Opens the repository, loading existing sessions when the file exists.
	 *
	 * @param file the JSON file
	 * @throws IOException when an existing file cannot be read or parsed
	 */
	public JsonFileSessionRepository(@Nonnull Path file) throws IOException {
		this(file, Clock.systemUTC());
	}

	public JsonFileSessionRepository(@Nonnull Path file, @Nonnull Clock clock) throws IOException {
		super(clock);
		this.file = Objects.requireNonNull(file, "file must not be null");
		if (Files.exists(file)) {
			replaceAll(this.objectMapper.readValue(file.toFile(), SESSION_LIST));
		}
	}

	@Nonnull
	public Path getFile() {
		return this.file;
	}

	@Override
	protected void onChange() {
		try {
			final Path parent = this.file.toAbsolutePath().getParent();
			if (parent != null) {
				Files.createDirectories(parent);
			}
			final Path temp = this.file.resolveSibling(this.file.getFileName() + ".tmp");
			this.objectMapper.writeValue(temp.toFile(), list());
			Files.move(temp, this.file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
		} catch (IOException e) {
			throw new UncheckedIOException("Failed to write session file " + this.file, e);
		}
	}
}
