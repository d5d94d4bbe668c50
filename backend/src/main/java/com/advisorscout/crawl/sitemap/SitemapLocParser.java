package com.advisorscout.crawl.sitemap;

import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Strict sitemap reader. Collects the text of the sitemap protocol's {@code loc} elements in
 * document order. Un-namespaced {@code loc} elements are read only when the document has no
 * namespaced ones; {@code loc} elements of extension namespaces (images, video) are ignored.
 * The encoding comes from the byte order mark or the XML declaration, UTF-8 otherwise.
 */
@Component
public class SitemapLocParser {
    static final String SITEMAP_NS = "http://www.sitemaps.org/schemas/sitemap/0.9";

    public ParseOutcome parse(byte[] xml) {
        int start = xml == null ? 0 : preambleLength(xml);
        if (xml == null || start == xml.length) {
            return ParseOutcome.malformed("empty document");
        }
        try {
            DocumentBuilder builder = newDocumentBuilder();
            Document document = builder.parse(new InputSource(
                new ByteArrayInputStream(xml, start, xml.length - start)
            ));
            NodeList locNodes = document.getElementsByTagNameNS(SITEMAP_NS, "loc");
            if (locNodes.getLength() == 0) {
                locNodes = document.getElementsByTagNameNS(null, "loc");
            }
            return ParseOutcome.parsed(locTexts(locNodes));
        } catch (SAXException | IOException e) {
            return ParseOutcome.malformed(e.getMessage());
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser is not available", e);
        }
    }

    private DocumentBuilder newDocumentBuilder() throws ParserConfigurationException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
        factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
        factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        factory.setExpandEntityReferences(false);

        DocumentBuilder builder = factory.newDocumentBuilder();
        builder.setErrorHandler(new ErrorHandler() {
            @Override
            public void warning(SAXParseException exception) {
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

    private List<String> locTexts(NodeList locNodes) {
        List<String> locations = new ArrayList<>(locNodes.getLength());
        for (int i = 0; i < locNodes.getLength(); i++) {
            String text = locNodes.item(i).getTextContent();
            if (text != null && !text.isBlank()) {
                locations.add(text.trim());
            }
        }
        return locations;
    }

    // Whitespace before the XML declaration is a fatal error for the parser. Only a UTF-8 BOM and
    // ASCII whitespace are skipped; other byte order marks are left for the parser to detect.
    static int preambleLength(byte[] xml) {
        int start = 0;
        if (xml.length >= 3 && (xml[0] & 0xFF) == 0xEF && (xml[1] & 0xFF) == 0xBB && (xml[2] & 0xFF) == 0xBF) {
            start = 3;
        }
        while (start < xml.length && (xml[start] == ' ' || xml[start] == '\t' || xml[start] == '\n' || xml[start] == '\r')) {
            start++;
        }
        return start;
    }

    public record ParseOutcome(List<String> locations, String error) {
        static ParseOutcome parsed(List<String> locations) {
            return new ParseOutcome(List.copyOf(locations), null);
        }

        static ParseOutcome malformed(String error) {
            return new ParseOutcome(List.of(), error == null ? "malformed XML" : error);
        }

        public boolean isMalformed() {
            return error != null;
        }
    }
}
