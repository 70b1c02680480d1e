package com.newsrelay.feeds.fetch;

import com.newsrelay.core.model.RawEntry;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

public final class FeedParser {
    private FeedParser() {
    }

    public static List<RawEntry> parse(byte[] xml) throws MalformedFeedException {
        int offset = xml == null ? 0 : leadingWhitespace(xml);
        if (xml == null || offset == xml.length) {
            throw new MalformedFeedException("Empty feed document", null);
        }
        return parse(new InputSource(new ByteArrayInputStream(xml, offset, xml.length - offset)));
    }

    public static List<RawEntry> parse(String xml) throws MalformedFeedException {
        if (xml == null || xml.isBlank()) {
            throw new MalformedFeedException("Empty feed document", null);
        }
        return parse(new InputSource(new StringReader(xml.strip())));
    }

    private static List<RawEntry> parse(InputSource input) throws MalformedFeedException {
        Document document;
        try {
            document = newBuilder().parse(input);
        } catch (SAXException | IOException | ParserConfigurationException e) {
            throw new MalformedFeedException("Invalid RSS/Atom XML: " + e.getMessage(), e);
        }
        Element root = document.getDocumentElement();
        if (root == null) {
            return List.of();
        }
        String rootName = localName(root.getTagName());
        if ("rss".equals(rootName) || "rdf".equals(rootName)) {
            return parseRss(document);
        }
        if ("feed".equals(rootName)) {
            return parseAtom(document);
        }
        return List.of();
    }

    // a prolog is only legal at offset 0, and some servers emit blank lines before it
    private static int leadingWhitespace(byte[] xml) {
        int offset = 0;
        while (offset < xml.length && (xml[offset] == ' ' || xml[offset] == '\t' || xml[offset] == '\r' || xml[offset] == '\n')) {
            offset++;
        }
        return offset;
    }

    private static DocumentBuilder newBuilder() throws ParserConfigurationException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
        factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        factory.setExpandEntityReferences(false);

        DocumentBuilder builder = factory.newDocumentBuilder();
        builder.setErrorHandler(new ErrorHandler() {
            @Override
            public void warning(SAXParseException exception) {
                // warnings do not invalidate a feed
            }

            @Override
            public void error(SAXParseException exception) throws SAXParseException {
                throw exception;
            }

            @Override
            public void fatalError(SAXParseException exception) throws SAXParseException {
                throw exception;
            }
        });
        return builder;
    }

    private static List<RawEntry> parseRss(Document document) {
        NodeList items = document.getElementsByTagName("item");
        List<RawEntry> entries = new ArrayList<>();
        for (int i = 0; i < items.getLength(); i++) {
            Node item = items.item(i);
            entries.add(new RawEntry(
                    childText(item, "title").orElse(null),
                    childText(item, "link").orElseGet(() -> childText(item, "guid").orElse(null)),
                    childText(item, "description").orElseGet(() -> childText(item, "content:encoded").orElse(null)),
                    childText(item, "pubDate").orElseGet(() -> childText(item, "dc:date").orElse(null))
            ));
        }
        return entries;
    }

    private static List<RawEntry> parseAtom(Document document) {
        NodeList items = document.getElementsByTagName("entry");
        List<RawEntry> entries = new ArrayList<>();
        for (int i = 0; i < items.getLength(); i++) {
            Node entry = items.item(i);
            entries.add(new RawEntry(
                    childText(entry, "title").orElse(null),
                    alternateLink(entry).orElse(null),
                    childText(entry, "summary").orElseGet(() -> childText(entry, "content").orElse(null)),
                    childText(entry, "published").orElseGet(() -> childText(entry, "updated").orElse(null))
            ));
        }
        return entries;
    }

    private static Optional<String> childText(Node parent, String tagName) {
        if (!(parent instanceof Element element)) {
            return Optional.empty();
        }
        NodeList children = element.getElementsByTagName(tagName);
        if (children.getLength() == 0) {
            return Optional.empty();
        }
        String text = children.item(0).getTextContent();
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(text.trim());
    }

    private static Optional<String> alternateLink(Node parent) {
        if (!(parent instanceof Element element)) {
            return Optional.empty();
        }
        NodeList links = element.getElementsByTagName("link");
        String fallback = null;
        for (int i = 0; i < links.getLength(); i++) {
            if (!(links.item(i) instanceof Element link)) {
                continue;
            }
            String href = link.getAttribute("href").trim();
            if (href.isEmpty()) {
                continue;
            }
            String rel = link.getAttribute("rel");
            if (rel.isEmpty() || "alternate".equals(rel)) {
                return Optional.of(href);
            }
            if (fallback == null) {
                fallback = href;
            }
        }
        return Optional.ofNullable(fallback);
    }

    private static String localName(String tagName) {
        int colon = tagName.indexOf(':');
        String local = colon >= 0 ? tagName.substring(colon + 1) : tagName;
        return local.toLowerCase(Locale.ROOT);
    }
}
