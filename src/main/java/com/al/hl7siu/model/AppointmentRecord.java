package com.al.hl7siu.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

/**
 * Normalized appointment extracted from an SIU^S12 message.
 *
 * <p>
 * Every leaf is a non-null string; data missing from the message is an empty
 * string, so the JSON shape is the same for every record:
 *
 * <pre>
 * {appointment_id, appointment_datetime,
 *  patient: {id, first_name, last_name, dob, gender},
 *  provider: {id, name},
 *  location, reason}
 * </pre>
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonPropertyOrder({ "appointment_id", "appointment_datetime", "patient", "provider", "location", "reason" })
public class AppointmentRecord {

    /**
     * Placer or filler appointment ID (SCH-1 / SCH-2).
     */
    @Builder.Default
    String appointmentId = "";

    /**
     * Start time as ISO-8601 UTC (e.g. 2025-05-02T07:00:00Z), or empty.
     */
    @Builder.Default
    String appointmentDatetime = "";

    @Builder.Default
    Patient patient = Patient.builder().build();

    @Builder.Default
    Provider provider = Provider.builder().build();

    /**
     * Facility, point of care, room and bed separated by spaces.
     */
    @Builder.Default
    String location = "";

    @Builder.Default
    String reason = "";

    @Value
    @Builder
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonPropertyOrder({ "id", "first_name", "last_name", "dob", "gender" })
    public static class Patient {
        @Builder.Default
        String id = "";
        @Builder.Default
        String firstName = "";
        @Builder.Default
        String lastName = "";
        /**
         * Date of birth as yyyy-MM-dd, or empty.
         */
        @Builder.Default
        String dob = "";
        @Builder.Default
        String gender = "";
    }

    @Value
    @Builder
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonPropertyOrder({ "id", "name" })
    public static class Provider {
        @Builder.Default
        String id = "";
        /**
         * Prefix, given and family name separated by spaces.
         */
        @Builder.Default
        String name = "";
    }
}
