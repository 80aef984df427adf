package io.evitadb.subtitler.analysis;

import io.evitadb.subtitler.model.DocumentEntry;
import io.evitadb.subtitler.model.Glossary;
import io.evitadb.subtitler.model.SubtitleDocument;
import io.evitadb.subtitler.model.SubtitleEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GlossaryExtractor should collect recurring names and phrases")
public class GlossaryExtractorTest {

	@Test
	@DisplayName("shouldCollectRecurringNamesOnly")
	void shouldCollectRecurringNamesOnly() {
		final Glossary glossary = new GlossaryExtractor().extract(entries(
			"Walter is late.",
			"I saw Walter today.",
			"Jesse left.",
			"Where is everyone?",
			"Where did they go?"
		));

		assertEquals(Set.of("Walter"), glossary.getCharacterNames());
	}

	@Test
	@DisplayName("shouldCollectRecurringQuotedPhrasesAsIdentityTerms")
	void shouldCollectRecurringQuotedPhrasesAsIdentityTerms() {
		final Glossary glossary = new GlossaryExtractor().extract(entries(
			"he said \"blue sky\" again",
			"it is \"blue sky\" all the way",
			"a \"one-off\" remark"
		));

		assertEquals(Optional.of("blue sky"), glossary.translationOf("blue sky"));
		assertEquals("quoted phrase", glossary.getTerms().get("blue sky").context());
		assertFalse(glossary.hasTerm("one-off"));
	}

	@Test
	@DisplayName("shouldHonourExclusionsAndDisabledSources")
	void shouldHonourExclusionsAndDisabledSources() {
		final List<DocumentEntry> entries = entries("Walter \"runs\"", "Walter \"runs\"");

		final Glossary withoutWalter = new GlossaryExtractor(ExtractionConfig.defaults().exclude("Walter")).extract(entries);
		assertTrue(withoutWalter.getCharacterNames().isEmpty());
		assertTrue(withoutWalter.hasTerm("runs"));

		final Glossary namesOnly = new GlossaryExtractor(ExtractionConfig.defaults().withExtractQuoted(false)).extract(entries);
		assertEquals(1, namesOnly.size());
	}

	@Test
	@DisplayName("shouldUseFirstGroupOfCustomPattern")
	void shouldUseFirstGroupOfCustomPattern() {
		final ExtractionConfig config = ExtractionConfig.defaults()
			.withExtractNames(false)
			.withPattern("code ([A-Z]\\d+)");

		final Glossary glossary = new GlossaryExtractor(config).extract(entries("enter code X42", "code X42 again"));

		assertEquals("custom pattern", glossary.getTerms().get("X42").context());
	}

	@Test
	@DisplayName("shouldMergeIntoDocumentAndRegisterCharacters")
	void shouldMergeIntoDocumentAndRegisterCharacters() {
		final SubtitleDocument document = document("Skyler waits.", "Thank you, Skyler.");
		document.mergeGlossary(Glossary.empty().addTerm("meth", "pervitin", null));

		new GlossaryExtractor().extractAndUpdate(document);

		assertTrue(document.getGlossary().getCharacterNames().contains("Skyler"));
		assertTrue(document.getCharacters().contains("Skyler"));
		assertEquals(Optional.of("pervitin"), document.getGlossary().translationOf("meth"));
	}

	@Test
	@DisplayName("shouldNotModifyExistingGlossaryWhenMerging")
	void shouldNotModifyExistingGlossaryWhenMerging() {
		final Glossary existing = Glossary.empty().addCharacter("Hank");

		final Glossary merged = new GlossaryExtractor(ExtractionConfig.aggressive())
			.extractAndMerge(entries("Marie smiles."), existing);

		assertEquals(Set.of("Hank"), existing.getCharacterNames());
		assertTrue(merged.getCharacterNames().containsAll(Set.of("Hank", "Marie")));
	}

	private static List<DocumentEntry> entries(String... texts) {
		return document(texts).getEntries();
	}

	private static SubtitleDocument document(String... texts) {
		final List<SubtitleEntry> raw = new ArrayList<>();
		for (int i = 0; i < texts.length; i++) {
			raw.add(new SubtitleEntry(i + 1, i * 2_000L, i * 2_000L + 1_500, texts[i]));
		}
		return SubtitleDocument.fromEntries(raw, "en");
	}
}
