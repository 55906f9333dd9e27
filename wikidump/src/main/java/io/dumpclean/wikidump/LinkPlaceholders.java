package io.dumpclean.wikidump;

/**
 * Hides wiki link brackets from the cleaner, which would otherwise treat them as its own markup.
 * Text that already contains a placeholder literally comes back with brackets in its place.
 */
public final class LinkPlaceholders {
    public static final String LINK_OPEN = "[[";
    public static final String LINK_CLOSE = "]]";
    public static final String OPEN_PLACEHOLDER = "<SPEC_START>";
    public static final String CLOSE_PLACEHOLDER = "<SPEC_END>";

    private LinkPlaceholders() {
    }

    public static String protect(String text) {
        return text.replace(LINK_OPEN, OPEN_PLACEHOLDER).replace(LINK_CLOSE, CLOSE_PLACEHOLDER);
    }

    public static String restore(String text) {
        return text.replace(OPEN_PLACEHOLDER, LINK_OPEN).replace(CLOSE_PLACEHOLDER, LINK_CLOSE);
    }
}
