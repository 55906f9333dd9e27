package io.dumpclean.wikidump;

import io.dumpclean.core.Record;
import io.dumpclean.core.Source;
import io.dumpclean.error.PipelineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.xml.stream.Location;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Streams {@code <page>} elements out of a MediaWiki XML export one at a time, without ever holding
 * more than the current page in memory. Elements are matched by local name, so any export schema
 * version is accepted. Everything outside {@code <page>} (siteinfo, namespaces) is skipped, as are
 * page children this model does not carry.
 */
public class PageDumpSource implements Source<Page> {
    private static final Logger log = LoggerFactory.getLogger(PageDumpSource.class);

    // JDK StAX caps accumulated entity expansion at 50M chars by default, which full dumps exceed.
    private static final String TOTAL_ENTITY_SIZE_LIMIT = "http://www.oracle.com/xml/jaxp/properties/totalEntitySizeLimit";

    private static final XMLInputFactory FACTORY = newFactory();

    private final String name;
    private final InputStream in;
    private final XMLStreamReader reader;
    private long seq = 0;
    private boolean finished = false;

    public PageDumpSource(Path file) throws IOException {
        this(new BufferedInputStream(Files.newInputStream(file), 1 << 16), file.toString());
    }

    public PageDumpSource(InputStream in, String name) throws IOException {
        this.name = name;
        this.in = in;
        try {
            this.reader = FACTORY.createXMLStreamReader(in);
        } catch (XMLStreamException e) {
            in.close();
            throw new IOException("Cannot read dump " + name, e);
        }
        log.info("Reading dump {}", name);
    }

    private static XMLInputFactory newFactory() {
        XMLInputFactory f = XMLInputFactory.newFactory();
        f.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        f.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        f.setProperty(XMLInputFactory.IS_COALESCING, true);
        try {
            f.setProperty(TOTAL_ENTITY_SIZE_LIMIT, 0);
        } catch (IllegalArgumentException unsupported) {
            log.debug("StAX implementation {} has no entity size limit property", f.getClass().getName());
        }
        return f;
    }

    @Override
    public Optional<Record<Page>> poll() {
        if (finished) return Optional.empty();
        try {
            while (reader.hasNext()) {
                int event = reader.next();
                if (event == XMLStreamConstants.START_ELEMENT && "page".equals(reader.getLocalName())) {
                    Page page = readPage();
                    return Optional.of(new Record<>(seq++, page));
                }
            }
            finished = true;
            log.info("Reader done, {} page(s) read from {}", seq, name);
            return Optional.empty();
        } catch (XMLStreamException e) {
            throw new PipelineException("Malformed dump " + name + " " + where(e.getLocation()), e);
        }
    }

    @Override
    public boolean isFinished() {
        return finished;
    }

    public long pagesRead() { return seq; }

    private Page readPage() throws XMLStreamException {
        Location start = reader.getLocation();
        String title = null;
        String ns = null;
        String id = null;
        String redirect = null;
        Revision revision = null;
        while (nextChild()) {
            switch (reader.getLocalName()) {
                case "title" -> title = reader.getElementText();
                case "ns" -> ns = reader.getElementText();
                case "id" -> id = reader.getElementText();
                case "redirect" -> {
                    redirect = attribute("title");
                    skipElement();
                }
                case "revision" -> revision = readRevision();
                default -> skipElement();
            }
        }
        if (title == null) {
            throw new XMLStreamException("page without title", start);
        }
        return new Page(title, ns, id, redirect, revision);
    }

    private Revision readRevision() throws XMLStreamException {
        String id = null;
        String parentId = null;
        String timestamp = null;
        Contributor contributor = null;
        String comment = null;
        String model = null;
        String format = null;
        PageText text = null;
        String sha1 = null;
        while (nextChild()) {
            switch (reader.getLocalName()) {
                case "id" -> id = reader.getElementText();
                case "parentid" -> parentId = reader.getElementText();
                case "timestamp" -> timestamp = reader.getElementText();
                case "contributor" -> contributor = readContributor();
                case "comment" -> comment = reader.getElementText();
                case "model" -> model = reader.getElementText();
                case "format" -> format = reader.getElementText();
                case "text" -> {
                    String bytes = attribute("bytes");
                    String space = attribute("space");
                    text = new PageText(reader.getElementText(), bytes, space);
                }
                case "sha1" -> sha1 = reader.getElementText();
                default -> skipElement();
            }
        }
        return new Revision(id, parentId, timestamp, contributor, comment, model, format, text, sha1);
    }

    private Contributor readContributor() throws XMLStreamException {
        String username = null;
        String id = null;
        String ip = null;
        while (nextChild()) {
            switch (reader.getLocalName()) {
                case "username" -> username = reader.getElementText();
                case "id" -> id = reader.getElementText();
                case "ip" -> ip = reader.getElementText();
                default -> skipElement();
            }
        }
        return new Contributor(username, id, ip);
    }

    /**
     * Moves to the next child element of the current element. Returns false once the current
     * element's end tag is reached.
     */
    private boolean nextChild() throws XMLStreamException {
        while (true) {
            int event = reader.next();
            if (event == XMLStreamConstants.START_ELEMENT) return true;
            if (event == XMLStreamConstants.END_ELEMENT) return false;
            if (event == XMLStreamConstants.END_DOCUMENT) {
                throw new XMLStreamException("unexpected end of dump inside a page", reader.getLocation());
            }
        }
    }

    private void skipElement() throws XMLStreamException {
        int depth = 1;
        while (depth > 0) {
            int event = reader.next();
            if (event == XMLStreamConstants.START_ELEMENT) depth++;
            else if (event == XMLStreamConstants.END_ELEMENT) depth--;
        }
    }

    private String attribute(String localName) {
        for (int i = 0; i < reader.getAttributeCount(); i++) {
            if (localName.equals(reader.getAttributeLocalName(i))) return reader.getAttributeValue(i);
        }
        return null;
    }

    private static String where(Location location) {
        return location == null ? "" : "at line " + location.getLineNumber() + ", column " + location.getColumnNumber();
    }

    @Override
    public void close() throws IOException {
        try {
            reader.close();
        } catch (XMLStreamException e) {
            throw new IOException("Cannot close dump " + name, e);
        } finally {
            in.close();
        }
    }
}
