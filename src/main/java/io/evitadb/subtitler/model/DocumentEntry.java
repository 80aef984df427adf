package io.evitadb.subtitler.model;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;
import java.util.Set;

/**
 * A single subtitle entry inside a {@link SubtitleDocument} together with its translation state.
 *
 * Identity, timing, original text and detected formatting never change after construction. Only the
 * translation, its confidence, the speaker and the scene assignment are filled in as the pipeline progresses.
 */
public final class DocumentEntry {

	private final int id;
	@Nonnull
	private final Timecode timecode;
	@Nonnull
	private final String originalText;
	@Nonnull
	private final Set<FormattingTag> formatting;
	@Nullable
	private String translatedText;
	@Nullable
	private Double confidence;
	@Nullable
	private String speaker;
	@Nullable
	private Integer sceneId;

	/**
	 * Creates an untranslated entry.
	 *
	 * @param id           stable identifier, unique within the document
	 * @param timecode     display interval
	 * @param originalText source-language text
	 */
	public DocumentEntry(int id, @Nonnull Timecode timecode, @Nonnull String originalText) {
		this.id = id;
		this.timecode = Objects.requireNonNull(timecode, "timecode must not be null");
		this.originalText = Objects.requireNonNull(originalText, "originalText must not be null");
		this.formatting = Set.copyOf(FormattingTag.detect(originalText));
	}

	/**
	 * Creates an entry from a raw subtitle entry using the given id.
	 *
	 * @param id    identifier to assign
	 * @param entry raw entry
	 * @return the document entry
	 */
	@Nonnull
	public static DocumentEntry of(int id, @Nonnull SubtitleEntry entry) {
		Objects.requireNonNull(entry, "entry must not be null");
		return new DocumentEntry(id, entry.timecode(), entry.text());
	}

	public int getId() {
		return this.id;
	}

	@Nonnull
	public Timecode getTimecode() {
		return this.timecode;
	}

	@Nonnull
	public String getOriginalText() {
		return this.originalText;
	}

	/**
	 * Returns the formatting tags detected in the original text.
	 *
	 * @return unmodifiable set of tags
	 */
	@Nonnull
	public Set<FormattingTag> getFormatting() {
		return this.formatting;
	}

	@Nullable
	public String getTranslatedText() {
		return this.translatedText;
	}

	@Nullable
	public Double getConfidence() {
		return this.confidence;
	}

	@Nullable
	public String getSpeaker() {
		return this.speaker;
	}

	@Nullable
	public Integer getSceneId() {
		return this.sceneId;
	}

	/**
	 * Returns true when a translation has been recorded for this entry.
	 *
	 * @return true if translated
	 */
	public boolean isTranslated() {
		return this.translatedText != null;
	}

	/**
	 * Records the translation produced by the model.
	 *
	 * @param text       translated text
	 * @param confidence model-reported confidence in [0, 1], may be null when unknown
	 */
	public void setTranslation(@Nonnull String text, @Nullable Double confidence) {
		this.translatedText = Objects.requireNonNull(text, "text must not be null");
		this.confidence = confidence;
	}

	/**
	 * Replaces the translated text during repair, keeping the recorded confidence.
	 *
	 * @param text repaired text
	 */
	public void replaceTranslation(@Nonnull String text) {
		this.translatedText = Objects.requireNonNull(text, "text must not be null");
	}

	public void setSpeaker(@Nullable String speaker) {
		this.speaker = speaker;
	}

	public void setSceneId(@Nullable Integer sceneId) {
		this.sceneId = sceneId;
	}

	/**
	 * Returns the text to publish: the translation when present, otherwise the original.
	 *
	 * @return the effective text
	 */
	@Nonnull
	public String getEffectiveText() {
		return this.translatedText != null ? this.translatedText : this.originalText;
	}

	/**
	 * Returns true for non-dialogue entries such as `[door slams]` or `(laughing)`.
	 *
	 * @return true when the whole text is a bracketed or parenthesized cue
	 */
	public boolean isSoundEffect() {
		return isSoundEffect(this.originalText);
	}

	/**
	 * Returns true when the trimmed text is wholly enclosed in brackets or parentheses.
	 *
	 * @param text text to inspect
	 * @return true for sound effect cues
	 */
	public static boolean isSoundEffect(@Nonnull String text) {
		final String trimmed = text.trim();
		return (trimmed.startsWith("[") && trimmed.endsWith("]"))
			|| (trimmed.startsWith("(") && trimmed.endsWith(")"));
	}

	/**
	 * Converts this entry back into a raw entry carrying the effective text.
	 *
	 * @return the raw subtitle entry
	 */
	@Nonnull
	public SubtitleEntry toSubtitleEntry() {
		return new SubtitleEntry(this.id, this.timecode.startMs(), this.timecode.endMs(), getEffectiveText());
	}

	@Override
	public String toString() {
		return "DocumentEntry[id=" + this.id + ", " + this.timecode + ", translated=" + isTranslated() + "]";
	}
}
