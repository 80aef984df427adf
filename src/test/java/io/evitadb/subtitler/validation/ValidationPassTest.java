package io.evitadb.subtitler.validation;

import io.evitadb.subtitler.model.FormattingTag;
import io.evitadb.subtitler.model.SubtitleDocument;
import io.evitadb.subtitler.model.SubtitleEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ValidationPass should find and repair translation defects")
public class ValidationPassTest {

	@Test
	@DisplayName("shouldRewrapItalicsWhenWholeOriginalIsItalic")
	void shouldRewrapItalicsWhenWholeOriginalIsItalic() {
		assertEquals("<i>Ahoj</i>", ValidationPass.repairFormatting("Ahoj", FormattingTag.ITALIC, "<i>Hello</i>"));
		assertEquals(
			"{\\an8}<i>Ahoj</i>",
			ValidationPass.repairFormatting("{\\an8}Ahoj", FormattingTag.ITALIC, "{\\an8}<i>Hi</i>")
		);
	}

	@Test
	@DisplayName("shouldNotGuessPlacementOfPartialFormatting")
	void shouldNotGuessPlacementOfPartialFormatting() {
		assertEquals("Řekl ahoj", ValidationPass.repairFormatting("Řekl ahoj", FormattingTag.ITALIC, "He said <i>hello</i>"));
		assertEquals(
			"Červená",
			ValidationPass.repairFormatting("Červená", FormattingTag.COLOR, "<font color=\"red\">Red</font>")
		);
	}

	@Test
	@DisplayName("shouldCopyPositionTagFromOriginal")
	void shouldCopyPositionTagFromOriginal() {
		assertEquals("{\\an8}Nahoře", ValidationPass.repairFormatting("Nahoře", FormattingTag.POSITION, "{\\an8}Up top"));
	}

	@Test
	@DisplayName("shouldRepairMissingItalicsInDocument")
	void shouldRepairMissingItalicsInDocument() {
		final SubtitleDocument document = document("<i>Hello there</i>");
		document.entryAt(0).setTranslation("Ahoj tam", 0.9);

		final ValidationReport report = new ValidationPass().validateAndRepair(document);

		assertEquals("<i>Ahoj tam</i>", document.entryAt(0).getTranslatedText());
		assertTrue(report.issues().isEmpty());
		assertEquals(1, report.rawIssues().size());
		assertEquals(List.of(new RepairAction.AddedFormatting(1, FormattingTag.ITALIC)), report.repairActions());
		assertTrue(report.wasRepaired());
		assertTrue(report.passed());
	}

	@Test
	@DisplayName("shouldRecordColourAsUnresolved")
	void shouldRecordColourAsUnresolved() {
		final SubtitleDocument document = document("<font color=\"red\">Red alert</font>");
		document.entryAt(0).setTranslation("Červený poplach", 0.9);

		final ValidationReport report = new ValidationPass().validateAndRepair(document);

		assertEquals("Červený poplach", document.entryAt(0).getTranslatedText());
		assertEquals(1, report.unresolved().size());
		assertInstanceOf(RepairAction.NoRepairPossible.class, report.repairActions().get(0));
		assertFalse(report.wasRepaired());
		assertInstanceOf(ValidationIssue.MissingFormatting.class, report.issues().get(0));
	}

	@Test
	@DisplayName("shouldApplyGlossaryTermLeftUntranslated")
	void shouldApplyGlossaryTermLeftUntranslated() {
		final SubtitleDocument document = document("He cooks meth daily");
		document.getGlossary().addTerm("meth", "pervitin", null);
		document.entryAt(0).setTranslation("Vaří meth denně", 0.9);

		final ValidationReport report = new ValidationPass().validateAndRepair(document);

		assertEquals("Vaří pervitin denně", document.entryAt(0).getTranslatedText());
		assertEquals(
			List.of(new RepairAction.AppliedGlossaryCorrection(1, "Vaří meth denně", "Vaří pervitin denně")),
			report.repairActions()
		);
		assertTrue(report.issues().isEmpty());
	}

	@Test
	@DisplayName("shouldLeaveMissingNameUnresolved")
	void shouldLeaveMissingNameUnresolved() {
		final SubtitleDocument document = document("Walter, stop");
		document.getGlossary().addCharacter("Walter");
		document.entryAt(0).setTranslation("Stůj", 0.9);

		final ValidationReport report = new ValidationPass().validateAndRepair(document);

		assertEquals("Stůj", document.entryAt(0).getTranslatedText());
		assertEquals(1, report.unresolved().size());
		final ValidationIssue.GlossaryInconsistency issue = (ValidationIssue.GlossaryInconsistency) report.issues().get(0);
		assertEquals(new ConsistencyIssue.MissingName("Walter"), issue.issue());
		assertFalse(issue.isCritical());
		assertTrue(report.passed());
	}

	@Test
	@DisplayName("shouldFlagLengthOutsideBounds")
	void shouldFlagLengthOutsideBounds() {
		final SubtitleDocument document = document("Hi", "Good morning to all of you");
		document.entryAt(0).setTranslation("Ahoj vy všichni tam", 0.9);
		document.entryAt(1).setTranslation("Ahoj", 0.9);

		final ValidationReport report = new ValidationPass().validate(document);

		final ValidationIssue.LengthTooLong tooLong = (ValidationIssue.LengthTooLong) report.issuesFor(1).get(0);
		assertEquals(1.5, tooLong.maxRatio(), 0.0001);
		assertTrue(tooLong.isCritical());
		assertInstanceOf(ValidationIssue.LengthTooShort.class, report.issuesFor(2).get(0));
		assertFalse(report.passed());
	}

	@Test
	@DisplayName("shouldUseCalibratedBoundsOfKnownLanguagePair")
	void shouldUseCalibratedBoundsOfKnownLanguagePair() {
		final SubtitleDocument document = document("Good morning");
		document.setMetadata(document.getMetadata().withTargetLanguage("de-DE"));
		document.entryAt(0).setTranslation("Guten Morgen euch", 0.9);

		final ValidationReport calibrated = new ValidationPass().validate(document);
		final ValidationReport configured = new ValidationPass(ValidationConfig.defaults().withLanguagePairThresholds(false))
			.validate(document);

		final ValidationIssue.LengthTooLong tooLong = (ValidationIssue.LengthTooLong) calibrated.issuesFor(1).get(0);
		assertEquals(1.4, tooLong.maxRatio(), 0.0001);
		assertTrue(configured.issues().isEmpty());
	}

	@Test
	@DisplayName("shouldFlagMissingEmptyAndUncertainTranslations")
	void shouldFlagMissingEmptyAndUncertainTranslations() {
		final SubtitleDocument document = document("Hello", "World", "Friend");
		document.entryAt(1).setTranslation("  ", 0.9);
		document.entryAt(2).setTranslation("Příteli", 0.2);

		final ValidationReport report = new ValidationPass().validate(document);

		assertEquals(List.of(new ValidationIssue.MissingTranslation(1)), report.issuesFor(1));
		assertEquals(List.of(new ValidationIssue.EmptyTranslation(2)), report.issuesFor(2));
		final ValidationIssue.LowConfidence lowConfidence = (ValidationIssue.LowConfidence) report.issuesFor(3).get(0);
		assertEquals(0.8, lowConfidence.severity(), 0.0001);
		assertEquals(3, report.criticalIssues().size());
		assertEquals(1.0 - 2.8 / 3, report.qualityScore(), 0.0001);
	}

	@Test
	@DisplayName("shouldReportSemanticDivergenceAsCritical")
	void shouldReportSemanticDivergenceAsCritical() {
		final SubtitleDocument document = document("I love you");
		document.entryAt(0).setTranslation("Nenávidím tě", 0.9);
		final SemanticSignal signal = entry -> Optional.of(
			SemanticSignal.Divergence.of(DivergenceKind.TONE_CHANGED, "love turned into hate")
		);

		final ValidationReport report = new ValidationPass(ValidationConfig.defaults(), signal).validate(document);

		final ValidationIssue.SemanticDivergence divergence = (ValidationIssue.SemanticDivergence) report.issues().get(0);
		assertEquals(DivergenceKind.TONE_CHANGED, divergence.kind());
		assertEquals(ValidationIssue.CRITICAL_SEVERITY, divergence.severity(), 0.0001);
		assertFalse(report.passed());
	}

	@Test
	@DisplayName("shouldNotChangeTextWhenRepairIsDisabled")
	void shouldNotChangeTextWhenRepairIsDisabled() {
		final SubtitleDocument document = document("<i>Hello there</i>");
		document.entryAt(0).setTranslation("Ahoj tam", 0.9);

		final ValidationReport report = new ValidationPass(ValidationConfig.defaults().withAutoRepair(false))
			.validateAndRepair(document);

		assertEquals("Ahoj tam", document.entryAt(0).getTranslatedText());
		assertTrue(report.repairActions().isEmpty());
		assertEquals(1, report.issues().size());
	}

	@Test
	@DisplayName("shouldSummarizeReport")
	void shouldSummarizeReport() {
		final SubtitleDocument document = document("Hello", "World");
		document.entryAt(0).setTranslation("Ahoj", 0.9);
		document.entryAt(1).setTranslation("Světe", 0.9);

		final ValidationReport report = new ValidationPass().validate(document);

		assertEquals(
			"Validated 2 entries: 0 issues found, 0 entries affected, quality score: 100.00%",
			report.summary()
		);
	}

	static SubtitleDocument document(String... lines) {
		final List<SubtitleEntry> raw = new ArrayList<>(lines.length);
		for (int i = 0; i < lines.length; i++) {
			raw.add(new SubtitleEntry(i + 1, i * 3_000L, i * 3_000L + 2_000, lines[i]));
		}
		final SubtitleDocument document = SubtitleDocument.fromEntries(raw, "en");
		document.setMetadata(document.getMetadata().withTargetLanguage("cs"));
		return document;
	}
}
