package com.al.hl7siu.exception;

/**
 * Malformed HL7 wire format: empty input, missing MSH header, or a header too
 * short to declare its field separator.
 */
public class Hl7ParseException extends Hl7ProcessingException {

    public static final String ERROR_KIND = "HL7ParseError";

    public Hl7ParseException(String message) {
        super(message);
    }

    @Override
    public String getErrorKind() {
        return ERROR_KIND;
    }
}
