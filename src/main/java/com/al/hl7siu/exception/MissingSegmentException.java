package com.al.hl7siu.exception;

import lombok.Getter;

/**
 * A segment the target message structure requires is absent.
 */
@Getter
public class MissingSegmentException extends Hl7ProcessingException {

    public static final String ERROR_KIND = "MissingSegment";

    private final String segment;

    public MissingSegmentException(String segment, String message) {
        super(message);
        this.segment = segment;
    }

    @Override
    public String getErrorKind() {
        return ERROR_KIND;
    }
}
