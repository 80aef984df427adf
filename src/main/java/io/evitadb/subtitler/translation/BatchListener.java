package io.evitadb.subtitler.translation;

import javax.annotation.Nonnull;

/**
 * Receives a callback after each batch has been applied to the document.
 */
@FunctionalInterface
public interface BatchListener {

	BatchListener NONE = (result, processed, total) -> {
	};

	/**
	 * @param result    the applied batch
	 * @param processed entries processed so far
	 * @param total     entries in the document
	 */
	void onBatchApplied(@Nonnull BatchResult result, int processed, int total);
}
