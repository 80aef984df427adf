package io.evitadb.subtitler.quality;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Expected length ratio (translated / original) of a language pair.
 *
 * Languages differ in how much text they need for the same meaning: German runs longer than English, Japanese
 * and Chinese much shorter. Calibrated bounds exist for common pairs; any other pair gets wide defaults.
 *
 * @param minLengthRatio shortest acceptable ratio
 * @param maxLengthRatio longest acceptable ratio
 * @param expectedRatio  typical ratio of the pair
 */
public record LanguagePairThresholds(
	double minLengthRatio,
	double maxLengthRatio,
	double expectedRatio
) {

	private static final LanguagePairThresholds DEFAULT = new LanguagePairThresholds(0.3, 3.0, 1.0);

	private static final Map<String, LanguagePairThresholds> CALIBRATED = Map.ofEntries(
		Map.entry("en_de", new LanguagePairThresholds(0.9, 1.4, 1.15)),
		Map.entry("en_fr", new LanguagePairThresholds(0.9, 1.3, 1.1)),
		Map.entry("en_es", new LanguagePairThresholds(0.9, 1.3, 1.1)),
		Map.entry("en_it", new LanguagePairThresholds(0.9, 1.3, 1.1)),
		Map.entry("en_pt", new LanguagePairThresholds(0.9, 1.3, 1.1)),
		Map.entry("en_nl", new LanguagePairThresholds(0.9, 1.3, 1.05)),
		Map.entry("en_ru", new LanguagePairThresholds(0.8, 1.3, 1.0)),
		Map.entry("en_ja", new LanguagePairThresholds(0.4, 0.9, 0.6)),
		Map.entry("en_zh", new LanguagePairThresholds(0.4, 0.8, 0.55)),
		Map.entry("en_ko", new LanguagePairThresholds(0.5, 1.0, 0.7)),
		Map.entry("en_ar", new LanguagePairThresholds(0.8, 1.4, 1.1)),
		Map.entry("en_hi", new LanguagePairThresholds(0.9, 1.5, 1.2)),
		Map.entry("en_pl", new LanguagePairThresholds(0.9, 1.4, 1.15)),
		Map.entry("en_tr", new LanguagePairThresholds(0.9, 1.4, 1.1)),
		Map.entry("en_vi", new LanguagePairThresholds(0.9, 1.5, 1.2)),
		Map.entry("ja_en", new LanguagePairThresholds(1.3, 2.5, 1.8)),
		Map.entry("ja_zh", new LanguagePairThresholds(0.7, 1.3, 0.95)),
		Map.entry("ja_ko", new LanguagePairThresholds(0.8, 1.4, 1.1)),
		Map.entry("zh_en", new LanguagePairThresholds(1.5, 3.0, 2.0)),
		Map.entry("zh_ja", new LanguagePairThresholds(0.9, 1.4, 1.1)),
		Map.entry("de_en", new LanguagePairThresholds(0.7, 1.1, 0.85)),
		Map.entry("de_fr", new LanguagePairThresholds(0.85, 1.2, 1.0)),
		Map.entry("fr_en", new LanguagePairThresholds(0.75, 1.1, 0.9)),
		Map.entry("es_en", new LanguagePairThresholds(0.75, 1.1, 0.9)),
		Map.entry("ko_en", new LanguagePairThresholds(1.2, 2.0, 1.5))
	);

	public LanguagePairThresholds {
		if (minLengthRatio < 0 || maxLengthRatio <= minLengthRatio) {
			throw new IllegalArgumentException("Length ratio bounds must satisfy 0 <= min < max");
		}
		if (expectedRatio < minLengthRatio || expectedRatio > maxLengthRatio) {
			throw new IllegalArgumentException("expectedRatio must lie within the bounds");
		}
	}

	/**
	 * Returns the bounds used for pairs without calibration.
	 *
	 * @return default thresholds
	 */
	@Nonnull
	public static LanguagePairThresholds defaults() {
		return DEFAULT;
	}

	/**
	 * Looks up the calibrated thresholds of a pair. Codes are case-insensitive and only the primary subtag counts,
	 * so `en-US` and `pt_BR` resolve like `en` and `pt`.
	 *
	 * @param sourceLanguage language of the original
	 * @param targetLanguage language of the translation, may be null
	 * @return calibrated thresholds, empty for unknown pairs
	 */
	@Nonnull
	public static Optional<LanguagePairThresholds> calibrated(@Nonnull String sourceLanguage, @Nullable String targetLanguage) {
		Objects.requireNonNull(sourceLanguage, "sourceLanguage must not be null");
		if (targetLanguage == null) {
			return Optional.empty();
		}
		return Optional.ofNullable(CALIBRATED.get(primary(sourceLanguage) + "_" + primary(targetLanguage)));
	}

	/**
	 * Returns the calibrated thresholds of the pair, or the defaults.
	 *
	 * @param sourceLanguage language of the original
	 * @param targetLanguage language of the translation, may be null
	 * @return thresholds, never null
	 */
	@Nonnull
	public static LanguagePairThresholds forPair(@Nonnull String sourceLanguage, @Nullable String targetLanguage) {
		return calibrated(sourceLanguage, targetLanguage).orElse(DEFAULT);
	}

	public boolean isRatioAcceptable(double ratio) {
		return ratio >= this.minLengthRatio && ratio <= this.maxLengthRatio;
	}

	/**
	 * Distance of the ratio from the expected one: 0 at the expected ratio, 1 at a bound or beyond.
	 *
	 * @param ratio translated / original length
	 * @return deviation between 0 and 1
	 */
	public double deviationFromExpected(double ratio) {
		if (ratio < this.expectedRatio) {
			final double range = this.expectedRatio - this.minLengthRatio;
			return range > 0 ? Math.min((this.expectedRatio - ratio) / range, 1.0) : 0.0;
		}
		final double range = this.maxLengthRatio - this.expectedRatio;
		return range > 0 ? Math.min((ratio - this.expectedRatio) / range, 1.0) : 0.0;
	}

	@Nonnull
	private static String primary(@Nonnull String language) {
		final String normalized = language.trim().toLowerCase(Locale.ROOT);
		final int separator = indexOfSeparator(normalized);
		return separator < 0 ? normalized : normalized.substring(0, separator);
	}

	private static int indexOfSeparator(@Nonnull String language) {
		final int dash = language.indexOf('-');
		final int underscore = language.indexOf('_');
		if (dash < 0) {
			return underscore;
		}
		return underscore < 0 ? dash : Math.min(dash, underscore);
	}
}
