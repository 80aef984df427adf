package io.evitadb.subtitler.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Glossary should hold names and mandated term translations")
public class GlossaryTest {

	@Test
	@DisplayName("shouldMergeGlossariesWithDisjointKeysInAnyOrder")
	void shouldMergeGlossariesWithDisjointKeysInAnyOrder() {
		final Random random = new Random(11);
		for (int run = 0; run < 50; run++) {
			final Glossary first = Glossary.empty();
			final Glossary second = Glossary.empty();
			final int keys = random.nextInt(12);
			for (int key = 0; key < keys; key++) {
				final Glossary owner = random.nextBoolean() ? first : second;
				switch (random.nextInt(3)) {
					case 0 -> owner.addCharacter("Name" + key);
					case 1 -> owner.addTerm("term" + key, "termín" + key, random.nextBoolean() ? null : "scene " + key);
					default -> owner.addTechnicalTerm("tech" + key, "technika" + key);
				}
			}

			final Glossary firstThenSecond = first.copy().merge(second);
			final Glossary secondThenFirst = second.copy().merge(first);

			assertEquals(firstThenSecond, secondThenFirst);
			assertEquals(firstThenSecond.allTranslations(), secondThenFirst.allTranslations());
			assertEquals(first.size() + second.size(), firstThenSecond.size());
		}
	}

	@Test
	@DisplayName("shouldLetMergedDefinitionWin")
	void shouldLetMergedDefinitionWin() {
		final Glossary base = Glossary.empty()
			.addCharacter("Walter")
			.addTerm("meth", "pervitin", null)
			.addTerm("cook", "vařič", null);
		final Glossary updates = Glossary.empty()
			.addCharacter("Jesse")
			.addTerm("cook", "kuchař", "scene 3");

		base.merge(updates);

		assertEquals(Optional.of("kuchař"), base.translationOf("cook"));
		assertEquals(Optional.of("pervitin"), base.translationOf("meth"));
		assertTrue(base.getCharacterNames().contains("Walter"));
		assertTrue(base.getCharacterNames().contains("Jesse"));
		assertEquals(4, base.size());
	}

	@Test
	@DisplayName("shouldPreferRegularTermOverTechnicalTerm")
	void shouldPreferRegularTermOverTechnicalTerm() {
		final Glossary glossary = Glossary.empty()
			.addTechnicalTerm("FBI", "Federální úřad")
			.addTerm("FBI", "FBI", null);

		assertEquals(Optional.of("FBI"), glossary.translationOf("FBI"));
		assertEquals("FBI", glossary.allTranslations().get("FBI"));
	}

	@Test
	@DisplayName("shouldCopyIndependently")
	void shouldCopyIndependently() {
		final Glossary original = Glossary.empty().addCharacter("Anna");
		final Glossary copy = original.copy();

		original.addCharacter("Boris");

		assertEquals(1, copy.size());
		assertFalse(copy.hasTerm("Boris"));
		assertNotEquals(original, copy);
	}

	@Test
	@DisplayName("shouldReportEmptiness")
	void shouldReportEmptiness() {
		assertTrue(Glossary.empty().isEmpty());
		assertFalse(Glossary.empty().addTechnicalTerm("GPS", "GPS").isEmpty());
	}
}
