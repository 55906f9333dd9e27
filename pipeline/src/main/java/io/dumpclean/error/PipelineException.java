package io.dumpclean.error;

/**
 * A failure that ends the whole run: unreadable input, unwritable output, or anything a stage
 * did not expect.
 */
public class PipelineException extends RuntimeException {
    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }

    public PipelineException(String message) {
        super(message);
    }
}
