package io.dumpclean.error;

/**
 * Raised by a transform when a single record cannot be processed. The pipeline drops the record,
 * reports it and keeps going.
 */
public class RecordRejectedException extends Exception {
    private final String key;

    public RecordRejectedException(String key, String message, Throwable cause) {
        super(message, cause);
        this.key = key;
    }

    public RecordRejectedException(String key, String message) {
        this(key, message, null);
    }

    /** Identifier of the rejected record, for diagnostics. */
    public String key() { return key; }
}
