package io.dumpclean.core;

import io.dumpclean.error.RecordRejectedException;

/**
 * Transform converts one input record into exactly one output record.
 * Implementations must keep the input's seq on the output and must be safe to call from
 * several worker threads at once.
 */
public interface Transform<I, O> {
    /**
     * @throws RecordRejectedException to drop this record only; the run continues
     * @throws Exception anything else aborts the run
     */
    Record<O> apply(Record<I> input) throws Exception;
}
