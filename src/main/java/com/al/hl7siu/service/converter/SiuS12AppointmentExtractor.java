package com.al.hl7siu.service.converter;

import com.al.hl7siu.exception.MissingSegmentException;
import com.al.hl7siu.exception.UnsupportedMessageTypeException;
import com.al.hl7siu.model.AppointmentRecord;
import com.al.hl7siu.model.hl7.Hl7Message;
import com.al.hl7siu.util.DateTimeUtil;
import com.al.hl7siu.util.FirstNonEmpty;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Maps an SIU^S12 (notification of new appointment booking) message to an
 * {@link AppointmentRecord}.
 *
 * <p>
 * Only SCH is mandatory. PID and PV1 are optional, and when one is missing the
 * part of the record it feeds is left empty. Most values are read through an
 * ordered list of candidate positions because senders disagree on where they
 * put placer IDs, start times, attending providers and reasons.
 */
@Component
@Slf4j
public class SiuS12AppointmentExtractor {

    static final String MSH = "MSH";
    static final String SCH = "SCH";
    static final String PID = "PID";
    static final String PV1 = "PV1";

    private static final String MESSAGE_CODE = "SIU";
    private static final String TRIGGER_EVENT = "S12";

    // PV1-7 attending, PV1-6, PV1-8 referring, PV1-9 consulting
    private static final int[] PROVIDER_FIELDS = { 7, 6, 8, 9 };

    // SCH-7 appointment reason, SCH-8 appointment type, SCH-6 event reason
    private static final int[] REASON_FIELDS = { 7, 8, 6 };

    /**
     * Check that MSH-9 is SIU^S12.
     *
     * @throws UnsupportedMessageTypeException for any other message type
     */
    public void validate(Hl7Message message) {
        String code = message.getComponent(MSH, 9, 1);
        String trigger = message.getComponent(MSH, 9, 2);
        if (!MESSAGE_CODE.equals(code) || !TRIGGER_EVENT.equals(trigger)) {
            throw new UnsupportedMessageTypeException(message.getField(MSH, 9));
        }
    }

    /**
     * Validate the message and build the appointment record.
     *
     * @throws UnsupportedMessageTypeException if MSH-9 is not SIU^S12
     * @throws MissingSegmentException         if there is no SCH segment
     */
    public AppointmentRecord extract(Hl7Message message) {
        validate(message);
        if (!message.hasSegment(SCH)) {
            throw new MissingSegmentException(SCH, "Missing SCH segment (required for appointment).");
        }

        String appointmentId = FirstNonEmpty.of(
                () -> message.getComponent(SCH, 1, 1),
                () -> message.getComponent(SCH, 2, 1),
                () -> message.getField(SCH, 1),
                () -> message.getField(SCH, 2));

        // SCH-11 is TQ; component 4 is the start date/time
        String start = FirstNonEmpty.of(
                () -> message.getComponent(SCH, 11, 4),
                () -> message.getComponent(SCH, 11, 1),
                () -> message.getField(SCH, 11));

        return AppointmentRecord.builder()
                .appointmentId(appointmentId)
                .appointmentDatetime(DateTimeUtil.hl7DateTimeToIsoUtc(start))
                .patient(extractPatient(message))
                .provider(extractProvider(message))
                .location(extractLocation(message))
                .reason(extractReason(message))
                .build();
    }

    private AppointmentRecord.Patient extractPatient(Hl7Message message) {
        if (!message.hasSegment(PID)) {
            log.debug("No PID segment, patient left empty");
            return AppointmentRecord.Patient.builder().build();
        }

        String patientId = FirstNonEmpty.of(
                () -> message.getComponent(PID, 3, 1),
                () -> message.getComponent(PID, 2, 1),
                () -> message.getField(PID, 3));

        return AppointmentRecord.Patient.builder()
                .id(patientId)
                .lastName(message.getComponent(PID, 5, 1))
                .firstName(message.getComponent(PID, 5, 2))
                .dob(DateTimeUtil.hl7DateToIso(message.getField(PID, 7)))
                .gender(message.getField(PID, 8))
                .build();
    }

    private AppointmentRecord.Provider extractProvider(Hl7Message message) {
        if (!message.hasSegment(PV1)) {
            return AppointmentRecord.Provider.builder().build();
        }

        for (int field : PROVIDER_FIELDS) {
            if (message.getField(PV1, field).isEmpty()) {
                continue;
            }
            // XCN: 1 id, 2 family, 3 given, 6 prefix
            String prefix = message.getComponent(PV1, field, 6);
            String given = message.getComponent(PV1, field, 3);
            String family = message.getComponent(PV1, field, 2);
            return AppointmentRecord.Provider.builder()
                    .id(message.getComponent(PV1, field, 1))
                    .name(FirstNonEmpty.joinNonEmpty(prefix, given, family))
                    .build();
        }
        return AppointmentRecord.Provider.builder().build();
    }

    private String extractLocation(Hl7Message message) {
        if (!message.hasSegment(PV1)) {
            return "";
        }
        // PL: 1 point of care, 2 room, 3 bed, 4 facility
        String pointOfCare = message.getComponent(PV1, 3, 1);
        String room = message.getComponent(PV1, 3, 2);
        String bed = message.getComponent(PV1, 3, 3);
        String facility = message.getComponent(PV1, 3, 4);
        return FirstNonEmpty.joinNonEmpty(facility, pointOfCare, room, bed).strip();
    }

    private String extractReason(Hl7Message message) {
        for (int field : REASON_FIELDS) {
            // CE: text (component 2) is preferred over the code
            String reason = FirstNonEmpty.of(
                    () -> message.getComponent(SCH, field, 2),
                    () -> message.getComponent(SCH, field, 1),
                    () -> message.getField(SCH, field));
            if (!reason.isEmpty()) {
                return reason;
            }
        }
        return "";
    }
}
