package com.resurrector.soap;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

/**
 * Small DOM navigation helpers that match elements by local name, ignoring prefixes.
 */
final class XmlElements {

    private XmlElements() {
    }

    static String localName(Node node) {
        String local = node.getLocalName();
        if (local != null) {
            return local;
        }
        String name = node.getNodeName();
        int colon = name.indexOf(':');
        return colon >= 0 ? name.substring(colon + 1) : name;
    }

    /**
     * Strips the prefix of a QName-valued attribute: {@code tns:Customer -> Customer}.
     */
    static String stripPrefix(String qualifiedName) {
        if (qualifiedName == null) {
            return null;
        }
        int colon = qualifiedName.indexOf(':');
        return colon >= 0 ? qualifiedName.substring(colon + 1) : qualifiedName;
    }

    static List<Element> children(Element parent) {
        List<Element> children = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            if (nodes.item(i) instanceof Element element) {
                children.add(element);
            }
        }
        return children;
    }

    static List<Element> children(Element parent, String localName) {
        return children(parent).stream().filter(child -> localName.equals(localName(child))).toList();
    }

    static Optional<Element> firstChild(Element parent, String localName) {
        return children(parent).stream().filter(child -> localName.equals(localName(child))).findFirst();
    }

    /**
     * All descendants with the given local name, in document order.
     */
    static List<Element> descendants(Element root, String localName) {
        List<Element> found = new ArrayList<>();
        NodeList nodes = root.getElementsByTagNameNS("*", localName);
        for (int i = 0; i < nodes.getLength(); i++) {
            found.add((Element) nodes.item(i));
        }
        if (found.isEmpty()) {
            nodes = root.getElementsByTagName(localName);
            for (int i = 0; i < nodes.getLength(); i++) {
                found.add((Element) nodes.item(i));
            }
        }
        return found;
    }

    static String attribute(Element element, String name) {
        String value = element.getAttribute(name);
        return value == null || value.isBlank() ? null : value.trim();
    }

    static String text(Element element) {
        String text = element.getTextContent();
        return text == null ? "" : text.strip();
    }
}
