package io.evitadb.subtitler.quality;

import javax.annotation.Nonnull;
import java.time.Duration;

/**
 * Blocks the calling thread for a backoff delay. Tests substitute a recording implementation.
 */
@FunctionalInterface
public interface Sleeper {

	/**
	 * Sleeper backed by {@link Thread#sleep(long)}.
	 */
	Sleeper SYSTEM = delay -> Thread.sleep(delay.toMillis());

	/**
	 * Waits for the given delay.
	 *
	 * @param delay how long to wait
	 * @throws InterruptedException when the thread is interrupted while waiting
	 */
	void sleep(@Nonnull Duration delay) throws InterruptedException;
}
