package io.evitadb.subtitler.session;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * SHA-256 hashes of source content, used as part of {@link SessionKey}.
 */
public final class ContentHasher {

	private ContentHasher() {
	}

	/**
	 * @param content text to hash, encoded as UTF-8
	 * @return lowercase hex digest
	 */
	@Nonnull
	public static String sha256(@Nonnull String content) {
		Objects.requireNonNull(content, "content must not be null");
		return sha256(content.getBytes(StandardCharsets.UTF_8));
	}

	/**
	 * @param file file to hash
	 * @return lowercase hex digest of the file bytes
	 * @throws IOException when the file cannot be read
	 */
	@Nonnull
	public static String sha256(@Nonnull Path file) throws IOException {
		Objects.requireNonNull(file, "file must not be null");
		return sha256(Files.readAllBytes(file));
	}

	@Nonnull
	private static String sha256(@Nonnull byte[] bytes) {
		try {
			return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(bytes));
		} catch (NoSuchAlgorithmException e) {
			// every JRE is required to provide SHA-256
			throw new IllegalStateException("SHA-256 is not available", e);
		}
	}
}
