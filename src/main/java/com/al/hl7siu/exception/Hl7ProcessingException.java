package com.al.hl7siu.exception;

/**
 * Base class for errors that make a single HL7 message unusable.
 *
 * <p>
 * These are fatal to the message being processed, never to a batch. Each
 * subclass reports a stable error kind that batch and command-line output use
 * to classify the failure.
 */
public abstract class Hl7ProcessingException extends RuntimeException {

    protected Hl7ProcessingException(String message) {
        super(message);
    }

    protected Hl7ProcessingException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Error kind reported in batch results, e.g. {@code HL7ParseError}.
     */
    public abstract String getErrorKind();
}
