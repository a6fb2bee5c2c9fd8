package com.al.hl7siu.controller;

import com.al.hl7siu.dto.BatchConversionResponse;
import com.al.hl7siu.exception.Hl7ParseException;
import com.al.hl7siu.model.AppointmentRecord;
import com.al.hl7siu.service.BatchConversionService;
import com.al.hl7siu.service.SiuAppointmentService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/siu")
@Slf4j
@Tag(name = "SIU Appointments", description = "HL7 v2 SIU^S12 to appointment JSON extraction")
public class AppointmentController {

    private final SiuAppointmentService appointmentService;
    private final BatchConversionService batchConversionService;

    @Autowired
    public AppointmentController(SiuAppointmentService appointmentService,
            BatchConversionService batchConversionService) {
        this.appointmentService = appointmentService;
        this.batchConversionService = batchConversionService;
    }

    @Operation(summary = "Extract appointment", description = "Extracts the appointment from a single SIU^S12 message.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Appointment extracted"),
            @ApiResponse(responseCode = "400", description = "Malformed HL7 message"),
            @ApiResponse(responseCode = "422", description = "Not an SIU^S12 message, or SCH segment missing")
    })
    @PostMapping(value = "/appointment", consumes = MediaType.TEXT_PLAIN_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<AppointmentRecord> extractAppointment(
            @Parameter(description = "HL7 v2 SIU^S12 message in pipe-delimited format") @RequestBody(required = false) String hl7Message) {
        return ResponseEntity.ok(appointmentService.convert(hl7Message));
    }

    @Operation(summary = "Extract appointments (batch)", description = "Splits the body on MSH segments and extracts every appointment. Failed messages are reported next to the successful ones.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Batch processed (individual messages may have failed)"),
            @ApiResponse(responseCode = "400", description = "No MSH segment in the body")
    })
    @PostMapping(value = "/batch", consumes = MediaType.TEXT_PLAIN_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<BatchConversionResponse> extractBatch(
            @Parameter(description = "One or more HL7 v2 messages") @RequestBody(required = false) String hl7Messages) {
        BatchConversionResponse response = batchConversionService.convertBatch(hl7Messages);
        if (response.getTotalMessages() == 0) {
            throw new Hl7ParseException("No HL7 messages found (no MSH segments).");
        }
        log.info("Batch request processed: {}/{} appointments extracted",
                response.getSuccessCount(), response.getTotalMessages());
        return ResponseEntity.ok(response);
    }
}
