package com.resurrector.soap;

import static com.resurrector.soap.XmlElements.attribute;
import static com.resurrector.soap.XmlElements.children;
import static com.resurrector.soap.XmlElements.descendants;
import static com.resurrector.soap.XmlElements.localName;
import static com.resurrector.soap.XmlElements.stripPrefix;

import com.resurrector.exception.FormatException;
import com.resurrector.inference.TypeInferencer;
import com.resurrector.model.FieldType;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Extracts types, operations and the service address from a parsed WSDL 1.1 document.
 */
@Slf4j
public final class WsdlReader {

    static final String XSD_NAMESPACE = "http://www.w3.org/2001/XMLSchema";
    static final String DEFAULT_ENDPOINT = "/service";

    private static final Set<String> FIELD_CONTAINERS =
            Set.of("sequence", "all", "choice", "complexContent", "simpleContent", "extension", "restriction");

    private WsdlReader() {
    }

    /**
     * @throws FormatException if the root element is not {@code definitions}.
     */
    public static WsdlDescription read(Document document) {
        Element root = document.getDocumentElement();
        if (!"definitions".equals(localName(root))) {
            throw new FormatException("expected a WSDL <definitions> root element, found <" + localName(root) + ">");
        }
        String serviceName = attribute(root, "name");
        List<WsdlDescription.ComplexType> types = readTypes(root);
        List<WsdlDescription.Operation> operations = readOperations(root);
        String endpoint = readEndpoint(root);
        log.debug("WSDL {}: {} types, {} operations, endpoint {}",
                serviceName, types.size(), operations.size(), endpoint);
        return new WsdlDescription(serviceName == null ? "Service" : serviceName,
                attribute(root, "targetNamespace"), types, operations, endpoint);
    }

    private static List<WsdlDescription.ComplexType> readTypes(Element root) {
        Map<String, WsdlDescription.ComplexType> types = new LinkedHashMap<>();
        for (Element complexType : descendants(root, "complexType")) {
            String name = attribute(complexType, "name");
            if (name != null) {
                collectType(name, complexType, types);
            }
        }
        for (Element element : descendants(root, "element")) {
            String name = attribute(element, "name");
            if (name == null || !XSD_NAMESPACE.equals(element.getNamespaceURI())) {
                continue;
            }
            children(element, "complexType").stream().findFirst()
                    .ifPresent(inline -> collectType(name, inline, types));
        }
        return new ArrayList<>(types.values());
    }

    private static void collectType(String name, Element complexType, Map<String, WsdlDescription.ComplexType> types) {
        Map<String, FieldType> fields = new LinkedHashMap<>();
        Set<String> referenced = new LinkedHashSet<>();
        collectFields(complexType, fields, referenced);
        if (!fields.isEmpty()) {
            types.put(name, new WsdlDescription.ComplexType(name, fields, List.copyOf(referenced)));
        }
    }

    private static void collectFields(Element container, Map<String, FieldType> fields, Set<String> referenced) {
        for (Element child : children(container)) {
            String local = localName(child);
            if (FIELD_CONTAINERS.contains(local)) {
                collectFields(child, fields, referenced);
            } else if ("element".equals(local) || "attribute".equals(local)) {
                String fieldName = attribute(child, "name");
                if (fieldName == null) {
                    fieldName = stripPrefix(attribute(child, "ref"));
                }
                if (fieldName == null) {
                    continue;
                }
                String type = attribute(child, "type");
                if (type != null && !isXsdType(child, type)) {
                    referenced.add(stripPrefix(type));
                }
                fields.putIfAbsent(fieldName, TypeInferencer.fromXsdType(type));
            }
        }
    }

    private static boolean isXsdType(Element context, String qualifiedName) {
        int colon = qualifiedName.indexOf(':');
        if (colon < 0) {
            return XSD_NAMESPACE.equals(context.lookupNamespaceURI(null));
        }
        return XSD_NAMESPACE.equals(context.lookupNamespaceURI(qualifiedName.substring(0, colon)));
    }

    private static List<WsdlDescription.Operation> readOperations(Element root) {
        Map<String, List<String>> messages = readMessages(root);
        List<Element> owners = children(root, "portType");
        if (owners.isEmpty()) {
            owners = children(root, "binding");
        }
        Map<String, WsdlDescription.Operation> operations = new LinkedHashMap<>();
        for (Element owner : owners) {
            for (Element operation : children(owner, "operation")) {
                String name = attribute(operation, "name");
                if (name == null || operations.containsKey(name)) {
                    continue;
                }
                Set<String> carried = new LinkedHashSet<>();
                for (Element io : children(operation)) {
                    String message = stripPrefix(attribute(io, "message"));
                    if (message != null) {
                        carried.addAll(messages.getOrDefault(message, List.of()));
                    }
                }
                operations.put(name, new WsdlDescription.Operation(name, List.copyOf(carried)));
            }
        }
        return new ArrayList<>(operations.values());
    }

    private static Map<String, List<String>> readMessages(Element root) {
        Map<String, List<String>> messages = new LinkedHashMap<>();
        for (Element message : children(root, "message")) {
            String name = attribute(message, "name");
            if (name == null) {
                continue;
            }
            List<String> parts = new ArrayList<>();
            for (Element part : children(message, "part")) {
                String element = attribute(part, "element");
                String type = attribute(part, "type");
                if (element != null) {
                    parts.add(stripPrefix(element));
                } else if (type != null) {
                    parts.add(stripPrefix(type));
                }
            }
            messages.put(name, parts);
        }
        return messages;
    }

    private static String readEndpoint(Element root) {
        for (Element address : descendants(root, "address")) {
            String location = attribute(address, "location");
            if (location == null) {
                continue;
            }
            if (!location.contains("://")) {
                return location;
            }
            try {
                String path = new URI(location).getPath();
                return path == null || path.isEmpty() ? DEFAULT_ENDPOINT : path;
            } catch (URISyntaxException e) {
                log.warn("Ignoring unparseable soap:address location '{}'", location);
            }
        }
        return DEFAULT_ENDPOINT;
    }
}
