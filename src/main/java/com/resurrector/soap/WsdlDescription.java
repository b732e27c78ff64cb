package com.resurrector.soap;

import com.resurrector.model.FieldType;
import java.util.List;
import java.util.Map;

/**
 * The parts of a WSDL 1.1 document that resource inference needs.
 *
 * @param serviceName     The {@code definitions/@name}, or {@code Service}.
 * @param targetNamespace The {@code definitions/@targetNamespace}, may be null.
 * @param types           Named complex types and elements with inline complex types, in document order.
 * @param operations      Operations from the port types, or from the bindings when there is no port type.
 * @param endpointPath    The path of the first {@code soap:address/@location}, or {@code /service}.
 */
public record WsdlDescription(
        String serviceName,
        String targetNamespace,
        List<ComplexType> types,
        List<Operation> operations,
        String endpointPath
) {

    public WsdlDescription {
        types = List.copyOf(types);
        operations = List.copyOf(operations);
    }

    /**
     * @param name            The type or element name.
     * @param fields          Field name to type, in declaration order.
     * @param referencedTypes Local names of non-XSD types used by the fields.
     */
    public record ComplexType(String name, Map<String, FieldType> fields, List<String> referencedTypes) {
    }

    /**
     * @param name          The operation name.
     * @param messageTypes  Local names of the elements and types carried by its input and output messages.
     */
    public record Operation(String name, List<String> messageTypes) {
    }
}
