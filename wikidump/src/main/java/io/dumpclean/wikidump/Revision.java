package io.dumpclean.wikidump;

/**
 * The single revision carried by a page in a current-revisions dump. All fields except
 * {@code text} are opaque and may be null when absent from the input.
 */
public record Revision(
        String id,
        String parentId,
        String timestamp,
        Contributor contributor,
        String comment,
        String model,
        String format,
        PageText text,
        String sha1
) {
    public Revision {
        text = text == null ? new PageText("", null, null) : text;
    }

    public Revision withText(PageText newText) {
        return new Revision(id, parentId, timestamp, contributor, comment, model, format, newText, sha1);
    }
}
