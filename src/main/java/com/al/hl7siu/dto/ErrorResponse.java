package com.al.hl7siu.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Body returned by the HTTP API when a message cannot be converted.
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class ErrorResponse {
    private LocalDateTime timestamp;

    /**
     * HTTP status code: 400 for malformed HL7, 422 for a message that parses
     * but is not a usable SIU^S12.
     */
    private int status;

    /**
     * Error kind, e.g. {@code HL7ParseError}, {@code UnsupportedMessageType}
     * or {@code MissingSegment}.
     */
    private String error;

    /**
     * Human readable reason, e.g. "Missing SCH segment (required for
     * appointment)."
     */
    private String details;

    private String path;
}
