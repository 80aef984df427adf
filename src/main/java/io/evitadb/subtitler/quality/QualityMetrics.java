package io.evitadb.subtitler.quality;

import io.evitadb.subtitler.model.DocumentEntry;
import io.evitadb.subtitler.model.FormattingTag;
import io.evitadb.subtitler.model.Glossary;
import io.evitadb.subtitler.model.SubtitleDocument;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Computes a {@link QualityScore} for a translated document.
 *
 * Dimensions and weights: completeness 0.3, accuracy 0.25, consistency 0.2, formatting 0.15, readability 0.1.
 */
public final class QualityMetrics {

	static final double COMPLETENESS_WEIGHT = 0.3;
	static final double ACCURACY_WEIGHT = 0.25;
	static final double CONSISTENCY_WEIGHT = 0.2;
	static final double FORMATTING_WEIGHT = 0.15;
	static final double READABILITY_WEIGHT = 0.1;

	private static final Pattern MARKUP = Pattern.compile("<[^>]+>|\\{\\\\an\\d}");

	@Nonnull
	private final QualityThresholds thresholds;

	public QualityMetrics() {
		this(QualityThresholds.defaults());
	}

	public QualityMetrics(@Nonnull QualityThresholds thresholds) {
		this.thresholds = Objects.requireNonNull(thresholds, "thresholds must not be null");
	}

	@Nonnull
	public QualityThresholds getThresholds() {
		return this.thresholds;
	}

	/**
	 * Evaluates every entry of the document.
	 *
	 * @param document the translated document
	 * @return the combined score
	 */
	@Nonnull
	public QualityScore evaluate(@Nonnull SubtitleDocument document) {
		Objects.requireNonNull(document, "document must not be null");
		final Glossary glossary = document.getGlossary();

		int translated = 0;
		int empty = 0;
		int withIssues = 0;
		int totalTerms = 0;
		int inconsistentTerms = 0;
		int totalTags = 0;
		int missingTags = 0;
		final List<Double> ratios = new ArrayList<>();
		final List<Double> cpsValues = new ArrayList<>();
		final List<Integer> lineLengths = new ArrayList<>();

		for (final DocumentEntry entry : document.getEntries()) {
			final String translation = entry.getTranslatedText();
			boolean hasIssue = false;
			if (translation == null) {
				withIssues++;
				continue;
			}
			translated++;
			if (translation.isBlank()) {
				empty++;
				withIssues++;
				continue;
			}

			final String plainOriginal = stripMarkup(entry.getOriginalText());
			final String plainTranslation = stripMarkup(translation);
			if (!plainOriginal.isEmpty()) {
				final double ratio = (double) plainTranslation.length() / plainOriginal.length();
				ratios.add(ratio);
				hasIssue |= ratio > this.thresholds.maxLengthRatio() || ratio < this.thresholds.minLengthRatio();
			}

			final double seconds = entry.getTimecode().durationMs() / 1000.0;
			final double cps = plainTranslation.replace("\n", "").length() / seconds;
			cpsValues.add(cps);
			hasIssue |= cps > this.thresholds.maxCharsPerSecond();
			for (final String line : plainTranslation.split("\n")) {
				lineLengths.add(line.length());
				hasIssue |= line.length() > this.thresholds.maxCharsPerLine();
			}

			for (final FormattingTag tag : entry.getFormatting()) {
				totalTags++;
				if (!tag.isPresentIn(translation)) {
					missingTags++;
					hasIssue = true;
				}
			}

			final String originalLower = entry.getOriginalText().toLowerCase(Locale.ROOT);
			final String translationLower = translation.toLowerCase(Locale.ROOT);
			for (final Map.Entry<String, String> term : glossary.allTranslations().entrySet()) {
				if (originalLower.contains(term.getKey().toLowerCase(Locale.ROOT))) {
					totalTerms++;
					if (!translationLower.contains(term.getValue().toLowerCase(Locale.ROOT))) {
						inconsistentTerms++;
						hasIssue = true;
					}
				}
			}
			for (final String name : glossary.getCharacterNames()) {
				if (entry.getOriginalText().contains(name)) {
					totalTerms++;
					if (!translation.contains(name)) {
						inconsistentTerms++;
						hasIssue = true;
					}
				}
			}

			if (hasIssue) {
				withIssues++;
			}
		}

		return QualityScore.fromDimensions(
			completeness(document.size(), translated, empty),
			accuracy(ratios),
			consistency(totalTerms, inconsistentTerms),
			formatting(totalTags, missingTags),
			readability(cpsValues, lineLengths),
			document.size(),
			withIssues
		);
	}

	/**
	 * Share of entries with a non-empty translation.
	 */
	@Nonnull
	public DimensionScore completeness(int total, int translated, int empty) {
		if (total == 0) {
			return DimensionScore.perfect(COMPLETENESS_WEIGHT);
		}
		final int missing = Math.max(0, total - translated);
		final int successful = Math.max(0, translated - empty);
		return new DimensionScore((double) successful / total, COMPLETENESS_WEIGHT, missing + empty);
	}

	/**
	 * Penalizes length ratios outside the bounds, proportionally to how far they fall outside.
	 */
	@Nonnull
	public DimensionScore accuracy(@Nonnull List<Double> ratios) {
		if (ratios.isEmpty()) {
			return DimensionScore.perfect(ACCURACY_WEIGHT);
		}
		int issues = 0;
		double penalty = 0.0;
		final double max = this.thresholds.maxLengthRatio();
		final double min = this.thresholds.minLengthRatio();
		for (final double ratio : ratios) {
			if (ratio > max) {
				issues++;
				penalty += Math.min((ratio - max) / max, 1.0);
			} else if (ratio < min) {
				issues++;
				penalty += Math.min((min - ratio) / min, 1.0);
			}
		}
		return new DimensionScore(Math.max(0.0, 1.0 - penalty / ratios.size()), ACCURACY_WEIGHT, issues);
	}

	@Nonnull
	public DimensionScore consistency(int totalTerms, int inconsistentTerms) {
		if (totalTerms == 0) {
			return DimensionScore.perfect(CONSISTENCY_WEIGHT);
		}
		final double score = (double) Math.max(0, totalTerms - inconsistentTerms) / totalTerms;
		return new DimensionScore(score, CONSISTENCY_WEIGHT, inconsistentTerms);
	}

	@Nonnull
	public DimensionScore formatting(int totalTags, int missingTags) {
		if (totalTags == 0) {
			return DimensionScore.perfect(FORMATTING_WEIGHT);
		}
		final double score = (double) Math.max(0, totalTags - missingTags) / totalTags;
		return new DimensionScore(score, FORMATTING_WEIGHT, missingTags);
	}

	/**
	 * Reading speed and line length; each violation costs at most half a check.
	 */
	@Nonnull
	public DimensionScore readability(@Nonnull List<Double> cpsValues, @Nonnull List<Integer> lineLengths) {
		int issues = 0;
		double penalty = 0.0;
		final double maxCps = this.thresholds.maxCharsPerSecond();
		for (final double cps : cpsValues) {
			if (cps > maxCps) {
				issues++;
				penalty += Math.min((cps - maxCps) / maxCps, 1.0) * 0.5;
			}
		}
		final int maxLine = this.thresholds.maxCharsPerLine();
		for (final int length : lineLengths) {
			if (length > maxLine) {
				issues++;
				penalty += Math.min((double) (length - maxLine) / maxLine, 1.0) * 0.5;
			}
		}
		final int checks = cpsValues.size() + lineLengths.size();
		final double score = checks > 0 ? Math.max(0.0, 1.0 - penalty / checks) : 1.0;
		return new DimensionScore(score, READABILITY_WEIGHT, issues);
	}

	@Nonnull
	static String stripMarkup(@Nonnull String text) {
		return MARKUP.matcher(text).replaceAll("").trim();
	}
}
