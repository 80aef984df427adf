package io.evitadb.subtitler.validation;

/**
 * Ways a translation can drift from the meaning of the original, with their base severity.
 */
public enum DivergenceKind {

	MEANING_CHANGED(1.0),
	INFORMATION_OMITTED(0.8),
	ENTITY_ERROR(0.7),
	INFORMATION_ADDED(0.6),
	TONE_CHANGED(0.4);

	private final double severity;

	DivergenceKind(double severity) {
		this.severity = severity;
	}

	public double getSeverity() {
		return this.severity;
	}
}
