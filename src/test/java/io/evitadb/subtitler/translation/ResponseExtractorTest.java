package io.evitadb.subtitler.translation;

import io.evitadb.subtitler.quality.ErrorKind;
import io.evitadb.subtitler.quality.TranslationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ResponseExtractor should read translations from model output")
public class ResponseExtractorTest {

	private static final String JSON = "{\"translations\":[{\"id\":1,\"translated\":\"Ahoj\",\"confidence\":0.9}]}";

	private final ResponseExtractor extractor = new ResponseExtractor();

	@Test
	@DisplayName("shouldLocateJsonInsideFencesAndProse")
	void shouldLocateJsonInsideFencesAndProse() {
		assertEquals(Optional.of(JSON), ResponseExtractor.extractJson("  " + JSON + "\n"));
		assertEquals(Optional.of(JSON), ResponseExtractor.extractJson("Here you go:\n```json\n" + JSON + "\n```\nEnjoy."));
		assertEquals(Optional.of(JSON), ResponseExtractor.extractJson("```\n" + JSON + "\n```"));
		assertEquals(Optional.of(JSON), ResponseExtractor.extractJson("Sure! " + JSON + " Hope that helps."));
		assertEquals(Optional.empty(), ResponseExtractor.extractJson("I cannot translate this."));
	}

	@Test
	@DisplayName("shouldParseTranslationsAndNotes")
	void shouldParseTranslationsAndNotes() {
		final TranslationResponse response = this.extractor.parse("""
			{
			  "translations": [
			    {"id": 1, "translated": "Ahoj", "confidence": 0.9},
			    {"id": 2, "translated": "<i>Běž!</i>"}
			  ],
			  "notes": {
			    "glossary_updates": {"meth": "pervitin", "blank": " "},
			    "warnings": ["idiom in line 2"],
			    "mood": "tense"
			  }
			}
			""");

		assertEquals(List.of(new TranslatedEntry(1, "Ahoj", 0.9), new TranslatedEntry(2, "<i>Běž!</i>", null)), response.translations());
		assertEquals(Map.of("meth", "pervitin"), response.glossaryUpdates());
		assertEquals(List.of("idiom in line 2"), response.warnings());
	}

	@Test
	@DisplayName("shouldSkipUnreadableItemsWithWarning")
	void shouldSkipUnreadableItemsWithWarning() {
		final TranslationResponse response = this.extractor.parse(
			"{\"translations\":[{\"translated\":\"no id\"},{\"id\":\"x\",\"translated\":\"bad id\"},{\"id\":3,\"translated\":\"Tři\"}]}"
		);

		assertEquals(1, response.translations().size());
		assertEquals(3, response.translations().get(0).id());
		assertEquals(2, response.warnings().size());
		assertTrue(response.glossaryUpdates().isEmpty());
	}

	@Test
	@DisplayName("shouldClampConfidenceAndDefaultMissingText")
	void shouldClampConfidenceAndDefaultMissingText() {
		final TranslationResponse response = this.extractor.parse(
			"{\"translations\":[{\"id\":1,\"translated\":\"A\",\"confidence\":1.7},{\"id\":2,\"confidence\":-1}]}"
		);

		assertEquals(1.0, response.translations().get(0).confidence());
		assertEquals(0.0, response.translations().get(1).confidence());
		assertTrue(response.translations().get(1).isEmpty());
	}

	@Test
	@DisplayName("shouldRejectOutputWithoutTranslations")
	void shouldRejectOutputWithoutTranslations() {
		assertEquals(ErrorKind.INVALID_RESPONSE, kindOf("I am sorry, I cannot help with that."));
		assertEquals(ErrorKind.INVALID_RESPONSE, kindOf("{\"result\": []}"));
		assertEquals(ErrorKind.INVALID_RESPONSE, kindOf("{\"translations\": \"Ahoj\"}"));
	}

	@Test
	@DisplayName("shouldReportMalformedJsonAsParseError")
	void shouldReportMalformedJsonAsParseError() {
		assertEquals(ErrorKind.PARSE_ERROR, kindOf("{\"translations\": [{\"id\": 1,"));
	}

	private ErrorKind kindOf(String output) {
		return assertThrows(TranslationException.class, () -> this.extractor.parse(output)).getKind();
	}
}
