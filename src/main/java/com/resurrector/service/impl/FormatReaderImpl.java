package com.resurrector.service.impl;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.resurrector.exception.FormatException;
import com.resurrector.service.api.FormatReader;
import java.io.IOException;
import java.io.StringReader;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.w3c.dom.Document;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

/**
 * Jackson-backed JSON/YAML decoding and a hardened JAXP DOM parser for XML.
 */
@Service
@Slf4j
public class FormatReaderImpl implements FormatReader {

    private final ObjectMapper jsonMapper = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    private final YAMLMapper yamlMapper = new YAMLMapper();

    @Override
    public JsonNode readTree(String text, Hint hint) {
        if (text == null || text.isBlank()) {
            throw new FormatException("document is empty");
        }
        switch (hint) {
            case JSON:
                return readJson(text);
            case YAML:
                return readYaml(text);
            default:
                try {
                    return readJson(text);
                } catch (FormatException jsonFailure) {
                    log.debug("Input is not JSON ({}), trying YAML", jsonFailure.getMessage());
                    return readYaml(text);
                }
        }
    }

    private JsonNode readJson(String text) {
        try {
            JsonNode tree = jsonMapper.readTree(text);
            if (tree == null || tree.isMissingNode()) {
                throw new FormatException("JSON document is empty");
            }
            return tree;
        } catch (JsonProcessingException e) {
            throw new FormatException("malformed JSON" + location(e) + ": " + e.getOriginalMessage(), e);
        }
    }

    private JsonNode readYaml(String text) {
        try {
            JsonNode tree = yamlMapper.readTree(text);
            if (tree == null || tree.isMissingNode() || tree.isNull()) {
                throw new FormatException("YAML document is empty");
            }
            if (!tree.isContainerNode()) {
                throw new FormatException("YAML input is a bare scalar, not a document");
            }
            return tree;
        } catch (JsonProcessingException e) {
            throw new FormatException("malformed YAML" + location(e) + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new FormatException("unreadable YAML: " + e.getMessage(), e);
        }
    }

    @Override
    public Document readXml(String text) {
        if (text == null || text.isBlank()) {
            throw new FormatException("XML document is empty");
        }
        try {
            DocumentBuilder builder = newDocumentBuilder();
            builder.setErrorHandler(null);
            return builder.parse(new InputSource(new StringReader(text.strip())));
        } catch (SAXParseException e) {
            throw new FormatException("malformed XML at line " + e.getLineNumber() + ", column "
                    + e.getColumnNumber() + ": " + e.getMessage(), e);
        } catch (SAXException | IOException e) {
            throw new FormatException("malformed XML: " + e.getMessage(), e);
        }
    }

    private DocumentBuilder newDocumentBuilder() {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setXIncludeAware(false);
            factory.setExpandEntityReferences(false);
            return factory.newDocumentBuilder();
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser cannot be configured securely", e);
        }
    }

    private static String location(JsonProcessingException e) {
        JsonLocation location = e.getLocation();
        if (location == null || location.getLineNr() < 0) {
            return "";
        }
        return " at line " + location.getLineNr() + ", column " + location.getColumnNr();
    }
}
