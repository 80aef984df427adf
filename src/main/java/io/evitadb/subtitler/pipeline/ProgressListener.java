package io.evitadb.subtitler.pipeline;

import javax.annotation.Nonnull;

/**
 * Receives pipeline progress updates.
 */
@FunctionalInterface
public interface ProgressListener {

	ProgressListener NONE = progress -> {
	};

	void onProgress(@Nonnull PipelineProgress progress);
}
