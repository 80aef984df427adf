package io.evitadb.subtitler.check;

import javax.annotation.Nonnull;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Result of the check action.
 *
 * @param errors              problems that fail the check
 * @param missingTranslations target files that do not exist yet; reported, not an error
 */
public record CheckResult(
	@Nonnull List<CheckError> errors,
	@Nonnull List<Path> missingTranslations
) {

	public CheckResult {
		errors = List.copyOf(Objects.requireNonNull(errors, "errors must not be null"));
		missingTranslations = List.copyOf(Objects.requireNonNull(missingTranslations, "missingTranslations must not be null"));
	}

	public boolean isSuccess() {
		return this.errors.isEmpty();
	}

	public int errorCount() {
		return this.errors.size();
	}

	@Nonnull
	public static CheckResult success() {
		return new CheckResult(List.of(), List.of());
	}
}
