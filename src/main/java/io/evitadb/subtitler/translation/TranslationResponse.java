package io.evitadb.subtitler.translation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * JSON answer expected from the model.
 *
 * @param translations translated lines
 * @param notes        optional translator notes
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TranslationResponse(
	@JsonProperty("translations") @Nonnull List<TranslatedEntry> translations,
	@JsonProperty("notes") @Nullable Notes notes
) {

	public TranslationResponse {
		translations = translations == null
			? List.of()
			: translations.stream().filter(Objects::nonNull).toList();
	}

	/**
	 * Returns the suggested glossary updates, empty when there are no notes.
	 *
	 * @return source term to translation
	 */
	@Nonnull
	public Map<String, String> glossaryUpdates() {
		return this.notes == null ? Map.of() : this.notes.glossaryUpdates();
	}

	@Nonnull
	public List<String> warnings() {
		return this.notes == null ? List.of() : this.notes.warnings();
	}

	@JsonIgnoreProperties(ignoreUnknown = true)
	public record Notes(
		@JsonProperty("glossary_updates") @Nullable Map<String, String> glossaryUpdates,
		@JsonProperty("warnings") @Nullable List<String> warnings,
		@JsonProperty("scene_context") @Nullable String sceneContext
	) {

		public Notes {
			final Map<String, String> updates = new LinkedHashMap<>();
			if (glossaryUpdates != null) {
				glossaryUpdates.forEach((source, target) -> {
					if (source != null && target != null && !source.isBlank() && !target.isBlank()) {
						updates.put(source, target);
					}
				});
			}
			glossaryUpdates = Collections.unmodifiableMap(updates);
			warnings = warnings == null ? List.of() : warnings.stream().filter(Objects::nonNull).toList();
		}
	}
}
