package io.evitadb.subtitler.model;

import javax.annotation.Nonnull;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Inline markup kinds that can appear in subtitle text and must survive translation.
 */
public enum FormattingTag {

	ITALIC("<i>", "</i>"),
	BOLD("<b>", "</b>"),
	UNDERLINE("<u>", "</u>"),
	POSITION("{\\an", null),
	COLOR("<font", "</font>");

	@Nonnull
	private final String openMarker;
	private final String closeMarker;

	FormattingTag(@Nonnull String openMarker, String closeMarker) {
		this.openMarker = openMarker;
		this.closeMarker = closeMarker;
	}

	/**
	 * Returns the opening marker used to detect this tag.
	 *
	 * @return the opening marker
	 */
	@Nonnull
	public String getOpenMarker() {
		return this.openMarker;
	}

	/**
	 * Returns true when the text contains this tag.
	 *
	 * @param text text to inspect
	 * @return true when the opening or closing marker is present
	 */
	public boolean isPresentIn(@Nonnull String text) {
		return text.contains(this.openMarker) || (this.closeMarker != null && text.contains(this.closeMarker));
	}

	/**
	 * Detects all formatting tags present in the text.
	 *
	 * @param text text to inspect
	 * @return the detected tags in declaration order
	 */
	@Nonnull
	public static Set<FormattingTag> detect(@Nonnull String text) {
		Objects.requireNonNull(text, "text must not be null");
		final EnumSet<FormattingTag> result = EnumSet.noneOf(FormattingTag.class);
		for (final FormattingTag tag : values()) {
			if (tag.isPresentIn(text)) {
				result.add(tag);
			}
		}
		return result;
	}
}
