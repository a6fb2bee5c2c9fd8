package com.al.hl7siu.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AppointmentRecordTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    public void testJsonShape() throws Exception {
        AppointmentRecord record = AppointmentRecord.builder()
                .appointmentId("123456")
                .appointmentDatetime("2025-05-02T07:00:00Z")
                .patient(AppointmentRecord.Patient.builder()
                        .id("P12345").firstName("John").lastName("Doe").dob("1985-02-10").gender("M").build())
                .provider(AppointmentRecord.Provider.builder().id("D67890").name("Dr Jane Smith").build())
                .location("MainFacility ClinicA 203")
                .reason("General Consultation")
                .build();

        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(record));

        assertEquals(List.of("appointment_id", "appointment_datetime", "patient", "provider", "location", "reason"),
                fieldNames(json));
        assertEquals(List.of("id", "first_name", "last_name", "dob", "gender"), fieldNames(json.get("patient")));
        assertEquals(List.of("id", "name"), fieldNames(json.get("provider")));
        assertEquals("John", json.get("patient").get("first_name").asText());
        assertEquals("Dr Jane Smith", json.get("provider").get("name").asText());
    }

    @Test
    public void testEmptyRecordHasNoNulls() throws Exception {
        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(AppointmentRecord.builder().build()));

        assertEquals("", json.get("appointment_id").asText());
        assertTrue(json.get("patient").get("dob").isTextual());
        assertEquals("", json.get("provider").get("name").asText());
        assertFalse(json.toString().contains("null"));
    }

    private static List<String> fieldNames(JsonNode node) {
        List<String> names = new ArrayList<>();
        node.fieldNames().forEachRemaining(names::add);
        return names;
    }
}
