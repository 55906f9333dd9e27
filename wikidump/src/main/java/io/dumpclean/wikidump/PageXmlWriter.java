package io.dumpclean.wikidump;

import javax.xml.XMLConstants;
import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import java.io.StringWriter;

/**
 * Serializes one {@link Page} to an indented {@code <page>} fragment. The first line is indented by
 * two spaces and every nesting level adds four more, matching the layout of MediaWiki export dumps.
 * Absent (null) fields are left out rather than written as empty elements.
 * <p>
 * Stateless and safe to share between worker threads.
 */
public class PageXmlWriter {
    static final String PREFIX = "  ";
    static final String INDENT = "    ";

    private static final XMLOutputFactory FACTORY = XMLOutputFactory.newFactory();

    public String write(Page page) throws XMLStreamException {
        StringWriter buffer = new StringWriter(page.body().length() + 512);
        XMLStreamWriter xml = FACTORY.createXMLStreamWriter(buffer);
        try {
            xml.writeCharacters(PREFIX);
            xml.writeStartElement("page");
            element(xml, 1, "title", page.title());
            element(xml, 1, "ns", page.ns());
            element(xml, 1, "id", page.id());
            if (page.redirect() != null) {
                indent(xml, 1);
                xml.writeEmptyElement("redirect");
                xml.writeAttribute("title", page.redirect());
            }
            if (page.revision() != null) {
                writeRevision(xml, page.revision());
            }
            indent(xml, 0);
            xml.writeEndElement();
            xml.flush();
        } finally {
            xml.close();
        }
        return buffer.toString();
    }

    private static void writeRevision(XMLStreamWriter xml, Revision rev) throws XMLStreamException {
        indent(xml, 1);
        xml.writeStartElement("revision");
        element(xml, 2, "id", rev.id());
        element(xml, 2, "parentid", rev.parentId());
        element(xml, 2, "timestamp", rev.timestamp());
        Contributor c = rev.contributor();
        if (c != null) {
            indent(xml, 2);
            xml.writeStartElement("contributor");
            element(xml, 3, "username", c.username());
            element(xml, 3, "id", c.id());
            element(xml, 3, "ip", c.ip());
            indent(xml, 2);
            xml.writeEndElement();
        }
        element(xml, 2, "comment", rev.comment());
        element(xml, 2, "model", rev.model());
        element(xml, 2, "format", rev.format());

        PageText text = rev.text();
        indent(xml, 2);
        xml.writeStartElement("text");
        if (text.bytes() != null) xml.writeAttribute("bytes", text.bytes());
        if (text.space() != null) xml.writeAttribute("xml", XMLConstants.XML_NS_URI, "space", text.space());
        characters(xml, text.value());
        xml.writeEndElement();

        element(xml, 2, "sha1", rev.sha1());
        indent(xml, 1);
        xml.writeEndElement();
    }

    private static void element(XMLStreamWriter xml, int depth, String name, String value) throws XMLStreamException {
        if (value == null) return;
        indent(xml, depth);
        xml.writeStartElement(name);
        characters(xml, value);
        xml.writeEndElement();
    }

    // A raw CR would be normalized to LF by the next reader, so it goes out as a character reference.
    private static void characters(XMLStreamWriter xml, String value) throws XMLStreamException {
        int from = 0;
        int cr;
        while ((cr = value.indexOf('\r', from)) >= 0) {
            xml.writeCharacters(value.substring(from, cr));
            xml.writeEntityRef("#13");
            from = cr + 1;
        }
        xml.writeCharacters(value.substring(from));
    }

    private static void indent(XMLStreamWriter xml, int depth) throws XMLStreamException {
        xml.writeCharacters("\n" + PREFIX + INDENT.repeat(depth));
    }
}
