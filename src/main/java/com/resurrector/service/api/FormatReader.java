package com.resurrector.service.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.resurrector.exception.FormatException;
import org.w3c.dom.Document;

public interface FormatReader {

    /**
     * Format hint for {@link #readTree(String, Hint)}.
     */
    enum Hint { JSON, YAML, UNKNOWN }

    /**
     * Decodes JSON or YAML text into a generic tree.
     * With {@link Hint#UNKNOWN}, JSON is attempted first and YAML second.
     *
     * @param text The raw document text.
     * @param hint The expected format.
     * @return The decoded tree; never null, never a missing node.
     * @throws FormatException if the text is not a well-formed document of the expected format,
     *                         with the parser's line and column where available.
     */
    JsonNode readTree(String text, Hint hint);

    /**
     * Decodes XML (WSDL, SOAP envelopes) into a namespace-aware DOM document.
     *
     * @param text The raw XML text.
     * @return The parsed document.
     * @throws FormatException if the text is not well-formed XML.
     */
    Document readXml(String text);
}
