package io.dumpclean.wikidump;

/**
 * Author of a revision. Registered users carry {@code username} and {@code id}, anonymous edits
 * carry {@code ip}; absent fields are null.
 */
public record Contributor(String username, String id, String ip) {
}
