package com.resurrector.soap;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.resurrector.service.impl.FormatReaderImpl;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SoapEnvelopesTest {

    private FormatReaderImpl formatReader;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @BeforeEach
    void setUp() {
        formatReader = new FormatReaderImpl();
    }

    private Document fixture(String name) throws Exception {
        URL resource = getClass().getClassLoader().getResource(name);
        assertThat(resource).isNotNull();
        return formatReader.readXml(Files.readString(Paths.get(resource.toURI())));
    }

    @Test
    void action_shouldSplitIntoNamespaceAndOperation() {
        assertThat(SoapEnvelopes.operationFromAction("\"http://example.com/customers/GetCustomers\""))
                .isEqualTo("GetCustomers");
        assertThat(SoapEnvelopes.namespaceFromAction("http://example.com/customers/GetCustomers"))
                .isEqualTo("http://example.com/customers");
        assertThat(SoapEnvelopes.operationFromAction("Ping")).isEqualTo("Ping");
    }

    @Test
    void operationFromAction_shouldSplitUrnAndFragmentActions() {
        assertThat(SoapEnvelopes.operationFromAction("urn:example:GetCustomers")).isEqualTo("GetCustomers");
        assertThat(SoapEnvelopes.namespaceFromAction("urn:example:GetCustomers")).isEqualTo("urn:example");
        assertThat(SoapEnvelopes.operationFromAction("http://example.com/svc#ListOrders")).isEqualTo("ListOrders");
        assertThat(SoapEnvelopes.namespaceFromAction("Ping")).isEmpty();
        assertThat(SoapEnvelopes.operationFromAction("http://tempuri.org/")).isEmpty();
    }

    @Test
    void request_shouldRejectOperationThatIsNotAnElementName() {
        assertThat(SoapEnvelopes.isElementName("GetCustomers")).isTrue();
        assertThat(SoapEnvelopes.isElementName("")).isFalse();
        assertThat(SoapEnvelopes.isElementName("a:b")).isFalse();
        assertThatThrownBy(() -> SoapEnvelopes.request("", "urn:example", null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void request_shouldWrapOperationInSoap11Body() {
        Document envelope = formatReader.readXml(
                SoapEnvelopes.request("GetCustomers", "http://example.com/customers", null, null));

        Element root = envelope.getDocumentElement();
        assertThat(root.getLocalName()).isEqualTo("Envelope");
        assertThat(root.getNamespaceURI()).isEqualTo(SoapEnvelopes.SOAP11_NAMESPACE);
        Element operation = XmlElements.children(SoapEnvelopes.body(envelope)).get(0);
        assertThat(operation.getLocalName()).isEqualTo("GetCustomers");
        assertThat(operation.getNamespaceURI()).isEqualTo("http://example.com/customers");
        assertThat(envelope.getElementsByTagNameNS(SoapEnvelopes.WSSE_NAMESPACE, "Security").getLength()).isZero();
    }

    @Test
    void request_shouldCarryUsernameTokenWhenCredentialsGiven() {
        Document envelope = formatReader.readXml(
                SoapEnvelopes.request("GetCustomers", "http://example.com/customers", "svc-user", "pa55"));

        Element password = (Element) envelope.getElementsByTagNameNS(SoapEnvelopes.WSSE_NAMESPACE, "Password").item(0);
        assertThat(envelope.getElementsByTagNameNS(SoapEnvelopes.WSSE_NAMESPACE, "Username").item(0).getTextContent())
                .isEqualTo("svc-user");
        assertThat(password.getTextContent()).isEqualTo("pa55");
        assertThat(password.getAttribute("Type")).isEqualTo(SoapEnvelopes.PASSWORD_TEXT);
        assertThat(envelope.getElementsByTagNameNS(SoapEnvelopes.WSSE_NAMESPACE, "Nonce").item(0).getTextContent())
                .isNotBlank();
        assertThat(envelope.getElementsByTagNameNS(SoapEnvelopes.WSU_NAMESPACE, "Created").getLength()).isEqualTo(1);
    }

    @Test
    void fault_shouldReadSoap11AndSoap12Faults() throws Exception {
        Optional<SoapFault> soap11 = SoapEnvelopes.fault(SoapEnvelopes.body(fixture("soap/customer-not-found-fault.xml")));
        Optional<SoapFault> soap12 = SoapEnvelopes.fault(SoapEnvelopes.body(fixture("soap/soap12-fault.xml")));

        assertThat(soap11).contains(new SoapFault("soap:Client", "Customer not found"));
        assertThat(soap12).contains(new SoapFault("env:Receiver", "Backend unavailable"));
        assertThat(soap11.get().toString()).isEqualTo("[soap:Client] Customer not found");
    }

    @Test
    void fault_shouldBeEmptyForRegularResponses() throws Exception {
        assertThat(SoapEnvelopes.fault(SoapEnvelopes.body(fixture("soap/get-customers-response.xml")))).isEmpty();
    }

    @Test
    void payload_shouldPeelResultWrapperDownToRepeatedRecords() throws Exception {
        JsonNode payload = SoapEnvelopes.payload(SoapEnvelopes.body(fixture("soap/get-customers-response.xml")),
                "GetCustomers");

        JsonNode customers = payload.get("Customer");
        assertThat(customers.isArray()).isTrue();
        assertThat(customers.size()).isEqualTo(2);
        JsonNode first = customers.get(0);
        assertThat(first.get("CustomerId").isNumber()).isTrue();
        assertThat(first.get("Active").isBoolean()).isTrue();
        assertThat(first.get("Name").asText()).isEqualTo("Ada Lovelace");
        assertThat(first.get("Notes").isNull()).isTrue();
    }

    @Test
    void toJson_shouldKeepSingleChildrenAsObjects() {
        Document document = formatReader.readXml(
                "<Order><Id>7</Id><Address><City>Paris</City></Address><Line>a</Line><Line>b</Line></Order>");

        JsonNode json = SoapEnvelopes.toJson(document.getDocumentElement());

        assertThat(json.get("Address").get("City").asText()).isEqualTo("Paris");
        assertThat(json.get("Line").isArray()).isTrue();
        assertThat(json.get("Id").asInt()).isEqualTo(7);
    }

    @Test
    void peel_shouldStopAtRecordsAndLists() throws Exception {
        JsonNode nested = objectMapper.readTree("{\"a\":{\"b\":{\"id\":1,\"name\":\"x\"}}}");
        JsonNode listHolder = objectMapper.readTree("{\"items\":[{\"id\":1}]}");

        assertThat(SoapEnvelopes.peel(nested)).isEqualTo(objectMapper.readTree("{\"id\":1,\"name\":\"x\"}"));
        assertThat(SoapEnvelopes.peel(listHolder)).isEqualTo(listHolder);
    }
}
