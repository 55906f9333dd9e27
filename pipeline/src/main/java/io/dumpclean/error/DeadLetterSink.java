package io.dumpclean.error;

import io.dumpclean.core.Record;

/**
 * Receives records the pipeline dropped. Called concurrently from worker threads.
 */
public interface DeadLetterSink<T> extends AutoCloseable {
    void acceptFailure(String stage, Record<T> record, Exception e);
    @Override default void close() {}
}
