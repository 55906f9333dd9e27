package io.dumpclean.wikidump;

import io.dumpclean.core.Record;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class DumpFileSinkTest {

    @Test
    void wraps_pages_in_header_and_trailer(@TempDir Path dir) throws Exception {
        Path out = dir.resolve("nested/out.xml");
        DumpFileSink sink = new DumpFileSink(out, "<mediawiki>");
        sink.open();
        sink.accept(new Record<>(0, "  <page>a</page>"));
        sink.accept(new Record<>(1, "  <page>b&#xA;c</page>"));
        sink.close();

        assertEquals("<mediawiki>\n  <page>a</page>\n  <page>bc</page>\n</mediawiki>\n", Files.readString(out));
        assertEquals(2, sink.pagesWritten());
    }

    @Test
    void empty_run_still_produces_a_complete_document(@TempDir Path dir) throws Exception {
        Path out = dir.resolve("out.xml");
        DumpFileSink sink = new DumpFileSink(out, "<mediawiki>");
        sink.open();
        sink.close();

        assertEquals("<mediawiki>\n</mediawiki>\n", Files.readString(out));
    }

    @Test
    void abort_leaves_the_trailer_off(@TempDir Path dir) throws Exception {
        Path out = dir.resolve("out.xml");
        DumpFileSink sink = new DumpFileSink(out, "<mediawiki>");
        sink.open();
        sink.accept(new Record<>(0, "  <page>a</page>"));
        sink.abort();

        assertEquals("<mediawiki>\n  <page>a</page>", Files.readString(out));
    }

    @Test
    void existing_output_is_truncated(@TempDir Path dir) throws Exception {
        Path out = dir.resolve("out.xml");
        Files.writeString(out, "x".repeat(1000));
        DumpFileSink sink = new DumpFileSink(out, "<mediawiki>");
        sink.open();
        sink.close();

        assertEquals("<mediawiki>\n</mediawiki>\n", Files.readString(out));
    }

    @Test
    void bundled_header_opens_the_document_with_siteinfo() {
        String header = DumpFileSink.defaultHeader();
        assertTrue(header.startsWith("<mediawiki "));
        assertTrue(header.contains("<siteinfo>"));
        assertTrue(header.endsWith("</siteinfo>"));
    }
}
