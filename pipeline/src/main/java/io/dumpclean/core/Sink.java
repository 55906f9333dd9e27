package io.dumpclean.core;

import java.io.Closeable;
import java.io.IOException;

/**
 * Sink consumes records. Only the pipeline's single sink thread calls it, in the order
 * {@link #open()}, {@link #accept(Record)}*, then either {@link #close()} after the last record
 * or {@link #abort()} when the run fails or is cancelled.
 */
public interface Sink<T> extends Closeable {
    default void open() throws IOException {}

    void accept(Record<T> record) throws Exception;

    /** Completes the output. */
    @Override
    default void close() throws IOException {}

    /** Releases resources without completing the output. */
    default void abort() throws IOException { close(); }
}
