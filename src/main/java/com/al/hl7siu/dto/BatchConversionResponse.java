package com.al.hl7siu.dto;

import com.al.hl7siu.model.AppointmentRecord;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Response DTO for batch conversion of a multi-message HL7 input.
 *
 * <p>
 * Successful and failed messages are reported independently; a failure never
 * hides the records extracted from the other messages.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BatchConversionResponse {

    /**
     * Number of messages (MSH segments) found in the input.
     */
    private int totalMessages;

    private int successCount;

    private int failureCount;

    /**
     * Extracted appointments, in input order.
     */
    private List<ConversionResult> results = new ArrayList<>();

    /**
     * Per-message errors, in input order.
     */
    private List<ConversionError> errors = new ArrayList<>();

    /**
     * Total processing time in milliseconds.
     */
    private long processingTimeMs;

    public boolean hasErrors() {
        return failureCount > 0;
    }

    /**
     * Individual conversion result.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ConversionResult {
        /**
         * Position of the message in the input (1-based).
         */
        private int messageIndex;

        private AppointmentRecord appointment;

        private long processingTimeMs;
    }

    /**
     * Conversion error details.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ConversionError {
        /**
         * Position of the message in the input (1-based).
         */
        private int messageIndex;

        /**
         * Error kind, e.g. UnsupportedMessageType.
         */
        private String error;

        private String detail;

        /**
         * Original message text (truncated if too long).
         */
        private String input;
    }
}
