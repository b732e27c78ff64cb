package com.resurrector.soap;

import static com.resurrector.soap.XmlElements.children;
import static com.resurrector.soap.XmlElements.descendants;
import static com.resurrector.soap.XmlElements.firstChild;
import static com.resurrector.soap.XmlElements.localName;
import static com.resurrector.soap.XmlElements.text;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.resurrector.inference.TypeInferencer;
import java.io.StringWriter;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Builds SOAP 1.1 request envelopes and reads SOAP 1.1/1.2 response bodies.
 */
public final class SoapEnvelopes {

    public static final String SOAP11_NAMESPACE = "http://schemas.xmlsoap.org/soap/envelope/";
    public static final String SOAP12_NAMESPACE = "http://www.w3.org/2003/05/soap-envelope";

    static final String WSSE_NAMESPACE =
            "http://docs.oasis-open.org/wss/2004/01/oasis-200401-wss-wssecurity-secext-1.0.xsd";
    static final String WSU_NAMESPACE =
            "http://docs.oasis-open.org/wss/2004/01/oasis-200401-wss-wssecurity-utility-1.0.xsd";
    static final String PASSWORD_TEXT =
            "http://docs.oasis-open.org/wss/2004/01/oasis-200401-wss-username-token-profile-1.0#PasswordText";
    static final String BASE64_BINARY =
            "http://docs.oasis-open.org/wss/2004/01/oasis-200401-wss-soap-message-security-1.0#Base64Binary";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
    private static final Pattern ELEMENT_NAME = Pattern.compile("[\\p{L}_][\\p{L}\\p{N}._-]*");

    private SoapEnvelopes() {
    }

    /**
     * The operation part of a SOAPAction, after its last {@code /}, {@code #} or {@code :}:
     * {@code "http://example.com/svc/GetCustomers" -> GetCustomers}, {@code "urn:example:GetCustomers" -> GetCustomers}.
     */
    public static String operationFromAction(String soapAction) {
        String action = unquote(soapAction);
        return action.substring(lastSeparator(action) + 1);
    }

    /**
     * The namespace part of a SOAPAction: {@code "http://example.com/svc/GetCustomers" -> http://example.com/svc}.
     * Empty when the action is a bare operation name.
     */
    public static String namespaceFromAction(String soapAction) {
        String action = unquote(soapAction);
        int separator = lastSeparator(action);
        return separator >= 0 ? action.substring(0, separator) : "";
    }

    /**
     * Whether the name can be used as an unprefixed XML element name.
     */
    public static boolean isElementName(String name) {
        return name != null && ELEMENT_NAME.matcher(name).matches();
    }

    private static int lastSeparator(String action) {
        return Math.max(action.lastIndexOf('/'), Math.max(action.lastIndexOf('#'), action.lastIndexOf(':')));
    }

    /**
     * Builds an empty-argument request for one operation, optionally carrying a WS-Security
     * UsernameToken with a plain-text password, a nonce and a creation timestamp.
     *
     * @param operation    The operation element name.
     * @param namespace    The operation namespace.
     * @param wsseUsername The WS-Security user, or null for no security header.
     * @param wssePassword The WS-Security password.
     * @return the serialized envelope.
     */
    public static String request(String operation, String namespace, String wsseUsername, String wssePassword) {
        if (!isElementName(operation)) {
            throw new IllegalArgumentException("'" + operation + "' is not a valid operation element name");
        }
        Document document = newDocument();
        Element envelope = document.createElementNS(SOAP11_NAMESPACE, "soap:Envelope");
        document.appendChild(envelope);
        Element header = document.createElementNS(SOAP11_NAMESPACE, "soap:Header");
        envelope.appendChild(header);
        if (wsseUsername != null) {
            header.appendChild(usernameToken(document, wsseUsername, wssePassword));
        }
        Element body = document.createElementNS(SOAP11_NAMESPACE, "soap:Body");
        envelope.appendChild(body);
        body.appendChild(document.createElementNS(namespace == null || namespace.isBlank() ? null : namespace,
                operation));
        return serialize(document);
    }

    private static Element usernameToken(Document document, String username, String password) {
        Element security = document.createElementNS(WSSE_NAMESPACE, "wsse:Security");
        security.setAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI, "xmlns:wsu", WSU_NAMESPACE);
        Element token = document.createElementNS(WSSE_NAMESPACE, "wsse:UsernameToken");
        security.appendChild(token);

        Element user = document.createElementNS(WSSE_NAMESPACE, "wsse:Username");
        user.setTextContent(username);
        token.appendChild(user);

        Element secret = document.createElementNS(WSSE_NAMESPACE, "wsse:Password");
        secret.setAttribute("Type", PASSWORD_TEXT);
        secret.setTextContent(password == null ? "" : password);
        token.appendChild(secret);

        Element nonce = document.createElementNS(WSSE_NAMESPACE, "wsse:Nonce");
        nonce.setAttribute("EncodingType", BASE64_BINARY);
        nonce.setTextContent(Base64.getEncoder().encodeToString(
                UUID.randomUUID().toString().getBytes(StandardCharsets.UTF_8)));
        token.appendChild(nonce);

        Element created = document.createElementNS(WSU_NAMESPACE, "wsu:Created");
        created.setTextContent(Instant.now().truncatedTo(ChronoUnit.SECONDS).toString());
        token.appendChild(created);
        return security;
    }

    /**
     * Locates the SOAP {@code Body}. Documents that are not envelopes are treated as the body themselves.
     */
    public static Element body(Document document) {
        Element root = document.getDocumentElement();
        for (String namespace : List.of(SOAP11_NAMESPACE, SOAP12_NAMESPACE)) {
            var bodies = root.getElementsByTagNameNS(namespace, "Body");
            if (bodies.getLength() > 0) {
                return (Element) bodies.item(0);
            }
        }
        List<Element> unqualified = descendants(root, "Body");
        return unqualified.isEmpty() ? root : unqualified.get(0);
    }

    public static Optional<SoapFault> fault(Element body) {
        Optional<Element> fault = firstChild(body, "Fault");
        if (fault.isEmpty()) {
            return Optional.empty();
        }
        Element element = fault.get();
        String code = firstChild(element, "faultcode").map(XmlElements::text).orElse(null);
        String reason = firstChild(element, "faultstring").map(XmlElements::text).orElse(null);
        if (code == null) {
            code = descendants(element, "Value").stream().findFirst().map(XmlElements::text).orElse("Unknown");
        }
        if (reason == null) {
            reason = descendants(element, "Text").stream().findFirst().map(XmlElements::text).orElse("Unknown error");
        }
        return Optional.of(new SoapFault(code, reason));
    }

    /**
     * Converts the payload of a SOAP body into a JSON tree ready for the response unwrapper.
     * <p>
     * The {@code <operation>Response} element (or the operation element itself) is used when present,
     * otherwise the whole body. Single-child wrapper objects are then peeled until the tree is a
     * record, a list of records, or an object holding one list.
     */
    public static JsonNode payload(Element body, String operationName) {
        Element source = body;
        if (operationName != null) {
            String responseName = operationName + "Response";
            for (Element child : children(body)) {
                String local = localName(child);
                if (local.equals(responseName) || local.equals(operationName)) {
                    source = child;
                    break;
                }
            }
        }
        if (source == body) {
            List<Element> content = children(body);
            if (content.size() == 1) {
                source = content.get(0);
            }
        }
        return peel(toJson(source));
    }

    /**
     * Converts an element into a JSON tree: repeated sibling names become arrays, leaf text is
     * typed lexically (booleans, numbers, otherwise strings) and empty leaves become null.
     * Attributes are not carried over.
     */
    public static JsonNode toJson(Element element) {
        List<Element> children = children(element);
        if (children.isEmpty()) {
            return leaf(text(element));
        }
        Map<String, ArrayNode> grouped = new LinkedHashMap<>();
        for (Element child : children) {
            grouped.computeIfAbsent(localName(child), name -> NODES.arrayNode()).add(toJson(child));
        }
        ObjectNode object = NODES.objectNode();
        grouped.forEach((name, values) -> object.set(name, values.size() == 1 ? values.get(0) : values));
        return object;
    }

    static JsonNode peel(JsonNode node) {
        JsonNode current = node;
        while (current.isObject() && current.size() == 1) {
            JsonNode only = current.elements().next();
            if (!only.isObject()) {
                break;
            }
            current = only;
        }
        return current;
    }

    private static JsonNode leaf(String text) {
        if (text.isEmpty()) {
            return NODES.nullNode();
        }
        return switch (TypeInferencer.fromLexical(text)) {
            case BOOLEAN -> NODES.booleanNode(Boolean.parseBoolean(text));
            case NUMBER -> NODES.numberNode(new BigDecimal(text));
            default -> NODES.textNode(text);
        };
    }

    private static String unquote(String value) {
        String trimmed = value == null ? "" : value.trim();
        if (trimmed.length() >= 2 && trimmed.startsWith("\"") && trimmed.endsWith("\"")) {
            return trimmed.substring(1, trimmed.length() - 1);
        }
        return trimmed;
    }

    private static Document newDocument() {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            return factory.newDocumentBuilder().newDocument();
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("Cannot create an XML document builder", e);
        }
    }

    private static String serialize(Document document) {
        try {
            TransformerFactory factory = TransformerFactory.newInstance();
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_STYLESHEET, "");
            Transformer transformer = factory.newTransformer();
            transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
            transformer.setOutputProperty(OutputKeys.INDENT, "yes");
            StringWriter writer = new StringWriter();
            transformer.transform(new DOMSource(document), new StreamResult(writer));
            return writer.toString();
        } catch (TransformerException e) {
            throw new IllegalStateException("Cannot serialize SOAP envelope", e);
        }
    }
}
