package io.dumpclean.wikidump;

public class TextCleanerException extends Exception {
    public static final int NO_EXIT_CODE = -1;

    private final int exitCode;
    private final String output;

    public TextCleanerException(String message, Throwable cause) {
        super(message, cause);
        this.exitCode = NO_EXIT_CODE;
        this.output = null;
    }

    public TextCleanerException(String message, int exitCode, String output) {
        super(message);
        this.exitCode = exitCode;
        this.output = output;
    }

    /** Exit status of the cleaner process or HTTP status, {@link #NO_EXIT_CODE} when there was none. */
    public int exitCode() { return exitCode; }

    /** Whatever the cleaner produced before failing, may be null. */
    public String output() { return output; }
}
