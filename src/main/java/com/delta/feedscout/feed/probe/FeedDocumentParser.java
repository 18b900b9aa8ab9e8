package com.delta.feedscout.feed.probe;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.jsoup.select.Elements;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads entry titles out of RSS 0.9x/2.0, RSS 1.0 (RDF) and Atom documents.
 */
public final class FeedDocumentParser {

    private FeedDocumentParser() {
    }

    /**
     * @param charsetName charset declared by the response, or {@code null} to detect it from the document
     * @return raw entry titles in document order, blank ones included
     * @throws FeedParseException when the payload is not a recognised feed document
     */
    public static List<String> parseEntryTitles(byte[] payload, String charsetName, String baseUri)
        throws FeedParseException {
        if (payload == null || payload.length == 0) {
            throw new FeedParseException("empty feed payload");
        }
        Document xml;
        try {
            xml = Jsoup.parse(new ByteArrayInputStream(payload), charsetName, baseUri == null ? "" : baseUri, Parser.xmlParser());
        } catch (IOException | RuntimeException e) {
            throw new FeedParseException("unreadable feed payload: " + e.getMessage(), e);
        }

        Element root = xml.children().first();
        if (root == null) {
            throw new FeedParseException("document has no root element");
        }
        String rootName = root.normalName().toLowerCase(Locale.ROOT);
        Elements entries = switch (rootName) {
            case "rss", "rdf:rdf", "rdf" -> root.getElementsByTag("item");
            case "feed" -> root.getElementsByTag("entry");
            default -> throw new FeedParseException("unsupported root element <" + root.tagName() + ">");
        };

        List<String> titles = new ArrayList<>();
        for (Element entry : entries) {
            Element title = firstChild(entry, "title");
            titles.add(title == null ? null : title.text());
        }
        return titles;
    }

    private static Element firstChild(Element parent, String tagName) {
        for (Element child : parent.children()) {
            if (tagName.equalsIgnoreCase(child.normalName())) {
                return child;
            }
        }
        return null;
    }
}
