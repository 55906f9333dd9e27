package io.dumpclean.wikidump;

import io.dumpclean.core.Record;
import io.dumpclean.core.Sink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Writes serialized pages into one dump file: the fixed header on open, each page on its own
 * line(s) after a newline, and the closing {@code </mediawiki>} on close.
 * <p>
 * The input file's header is not preserved; every output carries the header bundled as
 * {@code dump-header.xml}.
 */
public class DumpFileSink implements Sink<String> {
    private static final Logger log = LoggerFactory.getLogger(DumpFileSink.class);

    public static final String HEADER_RESOURCE = "/dump-header.xml";
    public static final String TRAILER = "</mediawiki>";
    /** Encoded newline left behind by re-marshaling; dropped before writing. */
    public static final String NEWLINE_ARTIFACT = "&#xA;";

    private final Path file;
    private final String header;
    private BufferedWriter out;
    private long pages = 0;

    public DumpFileSink(Path file) {
        this(file, defaultHeader());
    }

    public DumpFileSink(Path file, String header) {
        this.file = file;
        this.header = header;
    }

    public static String defaultHeader() {
        try (InputStream in = DumpFileSink.class.getResourceAsStream(HEADER_RESOURCE)) {
            if (in == null) throw new IllegalStateException("Missing classpath resource " + HEADER_RESOURCE);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8).stripTrailing();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot load " + HEADER_RESOURCE, e);
        }
    }

    @Override
    public void open() throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        out = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        out.write(header);
        log.info("Writing dump {}", file);
    }

    @Override
    public void accept(Record<String> record) throws IOException {
        if (out == null) throw new IllegalStateException("sink not open");
        out.write('\n');
        out.write(record.payload().replace(NEWLINE_ARTIFACT, ""));
        pages++;
    }

    @Override
    public void close() throws IOException {
        if (out == null) return;
        try {
            out.write('\n');
            out.write(TRAILER);
            out.write('\n');
        } finally {
            out.close();
            out = null;
        }
        log.info("Writer done, {} page(s) written to {}", pages, file);
    }

    @Override
    public void abort() throws IOException {
        if (out == null) return;
        try {
            out.close();
        } finally {
            out = null;
            log.warn("Output {} left incomplete after {} page(s)", file, pages);
        }
    }

    public long pagesWritten() { return pages; }
}
