package io.dumpclean.wikidump;

import java.util.Objects;

/**
 * One {@code <page>} of a MediaWiki export. The title is the identity used for de-duplication.
 * <p>
 * Only the body is ever rewritten, through {@link #withBody(String)}. The revision's
 * {@code sha1} is carried over unchanged, so after cleaning it describes the original body,
 * not the written one.
 */
public record Page(
        String title,
        String ns,
        String id,
        String redirect,
        Revision revision
) {
    public Page {
        Objects.requireNonNull(title, "title");
    }

    public String body() {
        return revision == null ? "" : revision.text().value();
    }

    public Page withBody(String newBody) {
        Revision rev = revision == null
                ? new Revision(null, null, null, null, null, null, null, new PageText(newBody, null, null), null)
                : revision.withText(revision.text().withValue(newBody));
        return new Page(title, ns, id, redirect, rev);
    }
}
