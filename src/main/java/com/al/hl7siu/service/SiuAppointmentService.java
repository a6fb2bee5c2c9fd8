package com.al.hl7siu.service;

import com.al.hl7siu.exception.Hl7ProcessingException;
import com.al.hl7siu.model.AppointmentRecord;
import com.al.hl7siu.model.hl7.Hl7Message;
import com.al.hl7siu.parser.Hl7MessageParser;
import com.al.hl7siu.service.converter.SiuS12AppointmentExtractor;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Converts one SIU^S12 message to an {@link AppointmentRecord}.
 *
 * <p>
 * While a message is processed its MSH-10 control ID is available to log
 * statements under the MDC key {@value #MDC_CONTROL_ID}.
 */
@Service
@Slf4j
public class SiuAppointmentService {

    public static final String MDC_CONTROL_ID = "messageControlId";

    private final Hl7MessageParser parser;
    private final SiuS12AppointmentExtractor extractor;
    private final MeterRegistry meterRegistry;

    @Autowired
    public SiuAppointmentService(Hl7MessageParser parser,
            SiuS12AppointmentExtractor extractor,
            MeterRegistry meterRegistry) {
        this.parser = parser;
        this.extractor = extractor;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Parse and extract a single message.
     *
     * @param hl7Message one HL7 message in pipe-delimited format
     * @return the extracted appointment
     * @throws Hl7ProcessingException if the message is malformed, is not
     *                                SIU^S12, or lacks an SCH segment
     */
    public AppointmentRecord convert(String hl7Message) {
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            Hl7Message message = parser.parse(hl7Message);
            MDC.put(MDC_CONTROL_ID, message.getField("MSH", 10));
            log.debug("Parsed message with segments {}", message.getSegmentNames());

            AppointmentRecord appointment = extractor.extract(message);

            meterRegistry.counter("siu.conversion.count", "status", "success", "error", "none").increment();
            log.info("Extracted appointment {}", appointment.getAppointmentId());
            return appointment;
        } catch (Hl7ProcessingException e) {
            meterRegistry.counter("siu.conversion.count", "status", "error", "error", e.getErrorKind()).increment();
            log.warn("SIU conversion failed ({}): {}", e.getErrorKind(), e.getMessage());
            throw e;
        } finally {
            sample.stop(meterRegistry.timer("siu.conversion.time"));
            MDC.remove(MDC_CONTROL_ID);
        }
    }
}
