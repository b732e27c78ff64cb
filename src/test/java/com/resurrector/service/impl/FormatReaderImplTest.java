package com.resurrector.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.resurrector.exception.FormatException;
import com.resurrector.service.api.FormatReader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FormatReaderImplTest {

    private FormatReaderImpl formatReader;

    @BeforeEach
    void setUp() {
        formatReader = new FormatReaderImpl();
    }

    @Test
    void readTree_shouldDecodeJsonAndYamlIntoTheSameTree() {
        JsonNode fromJson = formatReader.readTree("{\"name\":\"Ada\",\"tags\":[\"a\",\"b\"],\"age\":36}", FormatReader.Hint.JSON);
        JsonNode fromYaml = formatReader.readTree("name: Ada\ntags:\n  - a\n  - b\nage: 36\n", FormatReader.Hint.YAML);

        assertThat(fromYaml).isEqualTo(fromJson);
    }

    @Test
    void readTree_shouldFallBackToYamlWhenFormatIsUnknown() {
        JsonNode tree = formatReader.readTree("openapi: 3.0.0\ninfo:\n  title: x\n", FormatReader.Hint.UNKNOWN);

        assertThat(tree.path("info").path("title").asText()).isEqualTo("x");
    }

    @Test
    void readTree_shouldReportLineAndColumnOfMalformedJson() {
        assertThatThrownBy(() -> formatReader.readTree("{\n  \"a\": 1,\n  \"b\": }", FormatReader.Hint.JSON))
                .isInstanceOf(FormatException.class)
                .hasMessageStartingWith("malformed JSON at line 3");
    }

    @Test
    void readTree_shouldRejectTrailingJsonContent() {
        assertThatThrownBy(() -> formatReader.readTree("{\"a\":1} {\"b\":2}", FormatReader.Hint.JSON))
                .isInstanceOf(FormatException.class);
    }

    @Test
    void readTree_shouldRejectMalformedYaml() {
        assertThatThrownBy(() -> formatReader.readTree("openapi: 3.0.0\npaths:\n  /users: [unclosed\n",
                FormatReader.Hint.UNKNOWN))
                .isInstanceOf(FormatException.class)
                .hasMessageContaining("malformed YAML");
    }

    @Test
    void readTree_shouldRejectEmptyInputAndBareYamlScalars() {
        assertThatThrownBy(() -> formatReader.readTree("   ", FormatReader.Hint.UNKNOWN))
                .isInstanceOf(FormatException.class)
                .hasMessage("document is empty");
        assertThatThrownBy(() -> formatReader.readTree("just some words", FormatReader.Hint.YAML))
                .isInstanceOf(FormatException.class)
                .hasMessageContaining("bare scalar");
    }

    @Test
    void readXml_shouldParseNamespacedDocuments() {
        Document document = formatReader.readXml("<a:root xmlns:a=\"urn:test\"><a:child>1</a:child></a:root>");

        assertThat(document.getDocumentElement().getLocalName()).isEqualTo("root");
        assertThat(document.getDocumentElement().getNamespaceURI()).isEqualTo("urn:test");
    }

    @Test
    void readXml_shouldRejectDoctypeDeclarations() {
        String xxe = "<?xml version=\"1.0\"?>\n"
                + "<!DOCTYPE foo [<!ENTITY xxe SYSTEM \"file:///etc/passwd\">]>\n"
                + "<foo>&xxe;</foo>";

        assertThatThrownBy(() -> formatReader.readXml(xxe))
                .isInstanceOf(FormatException.class)
                .hasMessageStartingWith("malformed XML");
    }

    @Test
    void readXml_shouldReportLocationOfMalformedXml() {
        assertThatThrownBy(() -> formatReader.readXml("<root>\n  <open>\n</root>"))
                .isInstanceOf(FormatException.class)
                .hasMessageStartingWith("malformed XML at line 3");
    }
}
