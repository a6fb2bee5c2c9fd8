package com.al.hl7siu.exception;

import lombok.Getter;

/**
 * MSH-9 does not identify a message type this application can extract.
 */
@Getter
public class UnsupportedMessageTypeException extends Hl7ProcessingException {

    public static final String ERROR_KIND = "UnsupportedMessageType";

    private final String messageType;

    public UnsupportedMessageTypeException(String messageType) {
        super(String.format("Unsupported message type in MSH-9: '%s'", messageType));
        this.messageType = messageType;
    }

    @Override
    public String getErrorKind() {
        return ERROR_KIND;
    }
}
