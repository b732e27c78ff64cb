package com.resurrector.soap;

/**
 * A fault reported inside a SOAP body.
 *
 * @param code   The SOAP 1.1 {@code faultcode} or SOAP 1.2 {@code Code/Value}.
 * @param reason The SOAP 1.1 {@code faultstring} or SOAP 1.2 {@code Reason/Text}.
 */
public record SoapFault(String code, String reason) {

    @Override
    public String toString() {
        return "[" + code + "] " + reason;
    }
}
