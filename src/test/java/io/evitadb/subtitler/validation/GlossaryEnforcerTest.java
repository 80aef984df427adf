package io.evitadb.subtitler.validation;

import io.evitadb.subtitler.model.Glossary;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GlossaryEnforcer should keep names and terms consistent")
public class GlossaryEnforcerTest {

	private final GlossaryEnforcer enforcer = new GlossaryEnforcer(
		Glossary.empty()
			.addCharacter("Jesse")
			.addTerm("meth", "pervitin", "drug slang")
			.addTechnicalTerm("RV", "obytňák")
	);

	@Test
	@DisplayName("shouldAcceptConsistentTranslation")
	void shouldAcceptConsistentTranslation() {
		assertTrue(enforcer.checkConsistency("Jesse, the RV is ready", "Jesse, obytňák je připravený").isEmpty());
	}

	@Test
	@DisplayName("shouldReportMissingNameAndInconsistentTerms")
	void shouldReportMissingNameAndInconsistentTerms() {
		final List<ConsistencyIssue> issues = enforcer.checkConsistency("Jesse, cook the meth in the RV", "Uvař to v autě");

		assertEquals(
			List.of(
				new ConsistencyIssue.MissingName("Jesse"),
				new ConsistencyIssue.InconsistentTerm("RV", "obytňák"),
				new ConsistencyIssue.InconsistentTerm("meth", "pervitin")
			),
			issues
		);
	}

	@Test
	@DisplayName("shouldIgnoreTermsAbsentFromOriginal")
	void shouldIgnoreTermsAbsentFromOriginal() {
		assertTrue(enforcer.checkConsistency("Good morning", "Dobré ráno").isEmpty());
	}

	@Test
	@DisplayName("shouldReplaceSourceTermsLeftInTranslation")
	void shouldReplaceSourceTermsLeftInTranslation() {
		assertEquals("Uvař pervitin v obytňák", enforcer.enforce("Cook meth in the RV", "Uvař meth v RV"));
	}

	@Test
	@DisplayName("shouldNotInsertMissingNames")
	void shouldNotInsertMissingNames() {
		assertEquals("Pojď sem", enforcer.enforce("Jesse, come here", "Pojď sem"));
	}

	@Test
	@DisplayName("shouldRenderFeedbackForGlossaryIssues")
	void shouldRenderFeedbackForGlossaryIssues() {
		assertEquals(
			"Entry 4: translate 'meth' as 'pervitin'",
			FeedbackInstruction.from(
				new ValidationIssue.GlossaryInconsistency(4, new ConsistencyIssue.InconsistentTerm("meth", "pervitin"))
			).render()
		);
		assertEquals(
			"Entry 5: keep the name 'Jesse' unchanged",
			FeedbackInstruction.from(
				new ValidationIssue.GlossaryInconsistency(5, new ConsistencyIssue.MissingName("Jesse"))
			).render()
		);
	}
}
