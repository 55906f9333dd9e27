package io.dumpclean.wikidump;

/**
 * Cleans the wikitext body of one page. Called concurrently from every pipeline worker, one call
 * per worker at a time, so implementations must be thread-safe and keep no per-call state.
 */
@FunctionalInterface
public interface TextCleaner {
    /**
     * @throws TextCleanerException when this text could not be cleaned; only the current page is dropped
     */
    String clean(String text) throws TextCleanerException, InterruptedException;
}
