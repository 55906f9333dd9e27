package io.dumpclean.wikidump;

import io.dumpclean.core.Record;
import io.dumpclean.error.PipelineException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class PageDumpSourceTest {

    static List<Page> readAll(PageDumpSource source) {
        List<Page> pages = new ArrayList<>();
        Optional<Record<Page>> next;
        while ((next = source.poll()).isPresent()) {
            pages.add(next.get().payload());
        }
        return pages;
    }

    private static PageDumpSource fromString(String xml) throws IOException {
        return new PageDumpSource(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)), "inline");
    }

    @Test
    void reads_every_page_and_skips_siteinfo() throws Exception {
        try (InputStream in = getClass().getResourceAsStream("/sample-dump.xml");
             PageDumpSource source = new PageDumpSource(in, "sample-dump.xml")) {
            List<Page> pages = readAll(source);

            assertEquals(List.of("Dog", "Cat", "Dog", "World", "Markup", "Broken"), pages.stream().map(Page::title).toList());
            assertTrue(source.isFinished());
            assertEquals(6, source.pagesRead());
        }
    }

    @Test
    void decodes_page_revision_and_contributor_fields() throws Exception {
        List<Page> pages;
        try (InputStream in = getClass().getResourceAsStream("/sample-dump.xml");
             PageDumpSource source = new PageDumpSource(in, "sample-dump.xml")) {
            pages = readAll(source);
        }

        Page dog = pages.get(0);
        assertEquals("0", dog.ns());
        assertEquals("10", dog.id());
        assertNull(dog.redirect());
        Revision rev = dog.revision();
        assertEquals("1001", rev.id());
        assertEquals("1000", rev.parentId());
        assertEquals("2020-04-01T12:00:00Z", rev.timestamp());
        assertEquals(new Contributor("Walker", "77", null), rev.contributor());
        assertEquals("tidy & expand", rev.comment());
        assertEquals("wikitext", rev.model());
        assertEquals("text/x-wiki", rev.format());
        assertEquals(new PageText("Animal.", "7", "preserve"), rev.text());
        assertEquals("abc123", rev.sha1());

        Page cat = pages.get(1);
        assertEquals("Felis", cat.redirect());
        assertEquals("10.0.0.1", cat.revision().contributor().ip());
        assertEquals("#REDIRECT [[Felis]]", cat.body());

        assertEquals("Hello [[World]].", pages.get(3).body());
        assertEquals("Some <b>bold</b> & [[Link|text]].\nSecond line.", pages.get(4).body());
    }

    @Test
    void sequence_numbers_follow_document_order() throws Exception {
        try (PageDumpSource source = fromString("<mediawiki><page><title>A</title></page><page><title>B</title></page></mediawiki>")) {
            assertEquals(0, source.poll().orElseThrow().seq());
            assertEquals(1, source.poll().orElseThrow().seq());
            assertTrue(source.poll().isEmpty());
            assertTrue(source.poll().isEmpty());
        }
    }

    @Test
    void page_without_revision_has_empty_body() throws Exception {
        try (PageDumpSource source = fromString("<mediawiki><page><title>Bare</title><unknown><x/></unknown></page></mediawiki>")) {
            Page page = source.poll().orElseThrow().payload();
            assertEquals("Bare", page.title());
            assertNull(page.revision());
            assertEquals("", page.body());
        }
    }

    @Test
    void truncated_input_is_fatal() throws Exception {
        try (PageDumpSource source = fromString("<mediawiki><page><title>A</title><revision><text>cut")) {
            PipelineException e = assertThrows(PipelineException.class, source::poll);
            assertTrue(e.getMessage().startsWith("Malformed dump inline"), e.getMessage());
        }
    }

    @Test
    void page_without_title_is_fatal() throws Exception {
        try (PageDumpSource source = fromString("<mediawiki><page><id>1</id></page></mediawiki>")) {
            assertThrows(PipelineException.class, source::poll);
        }
    }

    @Test
    void missing_file_fails_on_open(@TempDir Path dir) {
        assertThrows(IOException.class, () -> new PageDumpSource(dir.resolve("nope.xml")));
    }
}
