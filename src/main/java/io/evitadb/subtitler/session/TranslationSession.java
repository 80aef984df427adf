package io.evitadb.subtitler.session;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Locale;
import java.util.Objects;

/**
 * Bookkeeping record of one translation run. Timestamps are epoch milliseconds.
 *
 * @param id               unique session id
 * @param key              what is being translated
 * @param sourceFile       relative path of the source file, informative only
 * @param totalEntries     entries in the source document
 * @param completedEntries entries translated so far
 * @param status           lifecycle state
 * @param createdAt        creation time
 * @param updatedAt        time of the last change
 * @param completedAt      time of completion or failure, null while running
 * @param error            failure message, null unless failed
 */
public record TranslationSession(
	@JsonProperty("id") @Nonnull String id,
	@JsonProperty("key") @Nonnull SessionKey key,
	@JsonProperty("sourceFile") @Nonnull String sourceFile,
	@JsonProperty("totalEntries") int totalEntries,
	@JsonProperty("completedEntries") int completedEntries,
	@JsonProperty("status") @Nonnull SessionStatus status,
	@JsonProperty("createdAt") long createdAt,
	@JsonProperty("updatedAt") long updatedAt,
	@JsonProperty("completedAt") @Nullable Long completedAt,
	@JsonProperty("error") @Nullable String error
) {

	public TranslationSession {
		Objects.requireNonNull(id, "id must not be null");
		Objects.requireNonNull(key, "key must not be null");
		Objects.requireNonNull(sourceFile, "sourceFile must not be null");
		Objects.requireNonNull(status, "status must not be null");
		if (totalEntries < 0 || completedEntries < 0) {
			throw new IllegalArgumentException("Entry counts must not be negative");
		}
	}

	/**
	 * Share of completed entries.
	 *
	 * @return percentage, 0 for an empty document
	 */
	@JsonIgnore
	public double completionPercentage() {
		if (this.totalEntries == 0) {
			return 0.0;
		}
		return this.completedEntries * 100.0 / this.totalEntries;
	}

	@JsonIgnore
	public boolean isResumable() {
		return this.status.isResumable();
	}

	@Nonnull
	TranslationSession withProgress(int newCompletedEntries, long now) {
		return new TranslationSession(
			this.id, this.key, this.sourceFile, this.totalEntries, Math.min(newCompletedEntries, this.totalEntries),
			this.status, this.createdAt, now, this.completedAt, this.error
		);
	}

	@Nonnull
	TranslationSession completed(long now) {
		return new TranslationSession(
			this.id, this.key, this.sourceFile, this.totalEntries, this.totalEntries,
			SessionStatus.COMPLETED, this.createdAt, now, now, null
		);
	}

	@Nonnull
	TranslationSession failed(@Nonnull String message, long now) {
		return new TranslationSession(
			this.id, this.key, this.sourceFile, this.totalEntries, this.completedEntries,
			SessionStatus.FAILED, this.createdAt, now, now, message
		);
	}

	@Nonnull
	TranslationSession paused(long now) {
		return new TranslationSession(
			this.id, this.key, this.sourceFile, this.totalEntries, this.completedEntries,
			SessionStatus.PAUSED, this.createdAt, now, null, null
		);
	}

	@Override
	public String toString() {
		return String.format(
			Locale.ROOT, "[%s] %s -> %s (%.1f%% complete, %s)",
			this.id.length() > 8 ? this.id.substring(0, 8) : this.id,
			this.key.sourceLanguage(), this.key.targetLanguage(), completionPercentage(), this.status.getDisplayName()
		);
	}
}
