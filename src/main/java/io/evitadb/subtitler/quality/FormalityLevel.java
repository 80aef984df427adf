package io.evitadb.subtitler.quality;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Locale;

/**
 * Register of a translated line as far as it can be told from marker words.
 */
public enum FormalityLevel {

	INFORMAL,
	NEUTRAL,
	FORMAL;

	private static final List<String> INFORMAL_MARKERS = List.of(
		"gonna", "wanna", "gotta", "ain't", "y'all", "kinda", "sorta"
	);
	private static final List<String> FORMAL_MARKERS = List.of(
		"therefore", "furthermore", "nevertheless", "consequently", "accordingly"
	);

	/**
	 * Classifies a line by counting the informal and formal markers it contains.
	 *
	 * @param text translated line
	 * @return the level with more markers, neutral on a tie
	 */
	@Nonnull
	public static FormalityLevel detect(@Nonnull String text) {
		final String lower = text.toLowerCase(Locale.ROOT);
		final long informal = INFORMAL_MARKERS.stream().filter(lower::contains).count();
		final long formal = FORMAL_MARKERS.stream().filter(lower::contains).count();
		if (informal > formal) {
			return INFORMAL;
		} else if (formal > informal) {
			return FORMAL;
		}
		return NEUTRAL;
	}
}
