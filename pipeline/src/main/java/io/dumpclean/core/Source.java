package io.dumpclean.core;

import java.io.Closeable;
import java.io.IOException;
import java.util.Optional;

/**
 * A Source produces records. It is only ever driven by the pipeline's single source thread,
 * so implementations may keep unsynchronized state.
 */
public interface Source<T> extends Closeable {
    /**
     * Fetch the next record. Return empty when temporarily no data; return empty consistently
     * and rely on {@link #isFinished()} to indicate completion for finite sources.
     * Any exception is fatal for the run.
     */
    Optional<Record<T>> poll() throws Exception;

    /**
     * Whether the source has reached a terminal state and will produce no more records.
     */
    boolean isFinished();

    @Override
    default void close() throws IOException {}
}
