package io.dumpclean.wikidump;

/**
 * The {@code <text>} element of a revision: the wikitext body plus its {@code bytes} and
 * {@code xml:space} attributes, which are copied through as read.
 */
public record PageText(String value, String bytes, String space) {
    public PageText {
        value = value == null ? "" : value;
    }

    public PageText withValue(String newValue) {
        return new PageText(newValue, bytes, space);
    }
}
