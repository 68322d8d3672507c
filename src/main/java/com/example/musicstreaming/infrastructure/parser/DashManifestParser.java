package com.example.musicstreaming.infrastructure.parser;

import java.io.IOException;
import java.io.StringReader;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

/**
 * Counts segment timeline entries per representation of a DASH manifest.
 * <p>
 * Stateless. A {@code <S>} entry stands for {@code r + 1} segments; a missing or negative {@code r}
 * counts as one. A representation without its own {@code SegmentTemplate} inherits the one declared on
 * its adaptation set. Representations without a timeline map to zero.
 */
public final class DashManifestParser {

    private DashManifestParser() {
    }

    /**
     * @param manifestXml           manifest document
     * @param representationFilter  ids to report; {@code null} reports every representation
     * @return representation id to declared segment count, in document order
     * @throws ManifestParseException when the document is not well-formed XML
     */
    public static Map<String, Integer> countTimelineSegments(String manifestXml,
                                                             Collection<String> representationFilter) {
        Document document = parse(manifestXml);
        Map<String, Integer> counts = new LinkedHashMap<>();
        NodeList representations = document.getElementsByTagNameNS("*", "Representation");
        for (int i = 0; i < representations.getLength(); i++) {
            Element representation = (Element) representations.item(i);
            String id = representation.getAttribute("id");
            if (id.isEmpty()) {
                id = String.valueOf(i);
            }
            if (representationFilter != null && !representationFilter.contains(id)) {
                continue;
            }
            Element template = firstChild(representation, "SegmentTemplate");
            if (template == null && representation.getParentNode() instanceof Element) {
                template = firstChild((Element) representation.getParentNode(), "SegmentTemplate");
            }
            counts.put(id, countEntries(template));
        }
        return counts;
    }

    private static int countEntries(Element template) {
        if (template == null) {
            return 0;
        }
        Element timeline = firstChild(template, "SegmentTimeline");
        if (timeline == null) {
            return 0;
        }
        int count = 0;
        NodeList children = timeline.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node child = children.item(i);
            if (child instanceof Element && "S".equals(localName(child))) {
                count += repeatCount((Element) child) + 1;
            }
        }
        return count;
    }

    private static int repeatCount(Element entry) {
        String raw = entry.getAttribute("r");
        if (raw.isEmpty()) {
            return 0;
        }
        try {
            return Math.max(0, Integer.parseInt(raw.trim()));
        } catch (NumberFormatException ignored) {
            return 0;
        }
    }

    private static Element firstChild(Element parent, String name) {
        NodeList children = parent.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node child = children.item(i);
            if (child instanceof Element && name.equals(localName(child))) {
                return (Element) child;
            }
        }
        return null;
    }

    private static String localName(Node node) {
        return node.getLocalName() != null ? node.getLocalName() : node.getNodeName();
    }

    private static Document parse(String manifestXml) {
        if (manifestXml == null || manifestXml.trim().isEmpty()) {
            throw new ManifestParseException("Manifest is empty", null);
        }
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setExpandEntityReferences(false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new DefaultHandler());
            return builder.parse(new InputSource(new StringReader(manifestXml)));
        } catch (ParserConfigurationException | SAXException | IOException e) {
            throw new ManifestParseException("Manifest is not well-formed: " + e.getMessage(), e);
        }
    }

    public static class ManifestParseException extends RuntimeException {

        public ManifestParseException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
