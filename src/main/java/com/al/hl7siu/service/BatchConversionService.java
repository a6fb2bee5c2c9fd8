package com.al.hl7siu.service;

import com.al.hl7siu.config.BatchProperties;
import com.al.hl7siu.dto.BatchConversionResponse;
import com.al.hl7siu.dto.BatchConversionResponse.ConversionError;
import com.al.hl7siu.dto.BatchConversionResponse.ConversionResult;
import com.al.hl7siu.exception.Hl7ProcessingException;
import com.al.hl7siu.model.AppointmentRecord;
import com.al.hl7siu.parser.Hl7MessageSplitter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Service for batch conversion of inputs holding several SIU messages.
 *
 * <p>
 * The input is split on MSH boundaries and every message is converted on the
 * batch thread pool. A message that fails is reported in the error list and
 * the others are still converted. Results and errors keep input order.
 *
 * @author HL7 SIU Parser Team
 * @since 1.0.0
 */
@Service
@Slf4j
public class BatchConversionService {

    /**
     * Error kind for failures outside the HL7 error hierarchy.
     */
    public static final String INTERNAL_ERROR = "InternalError";

    private final Hl7MessageSplitter splitter;
    private final SiuAppointmentService appointmentService;
    private final ExecutorService executorService;
    private final BatchProperties batchProperties;

    @Autowired
    public BatchConversionService(Hl7MessageSplitter splitter,
            SiuAppointmentService appointmentService,
            @Qualifier("batchExecutor") ExecutorService batchExecutor,
            BatchProperties batchProperties) {
        this.splitter = splitter;
        this.appointmentService = appointmentService;
        this.executorService = batchExecutor;
        this.batchProperties = batchProperties;
    }

    /**
     * Split and convert a blob of concatenated HL7 messages.
     *
     * @param rawInput one or more HL7 messages
     * @return per-message results and errors; {@code totalMessages == 0} when
     *         the input holds no MSH segment
     */
    public BatchConversionResponse convertBatch(String rawInput) {
        return convertMessages(splitter.split(rawInput));
    }

    /**
     * Convert already split messages.
     *
     * @param hl7Messages message texts, each starting with MSH
     */
    public BatchConversionResponse convertMessages(List<String> hl7Messages) {
        long startTime = System.currentTimeMillis();
        log.info("Starting batch SIU conversion: {} messages", hl7Messages.size());

        BatchConversionResponse response = new BatchConversionResponse();
        response.setTotalMessages(hl7Messages.size());

        List<CompletableFuture<Outcome>> futures = new ArrayList<>();
        for (int i = 0; i < hl7Messages.size(); i++) {
            final int messageIndex = i + 1;
            final String hl7Message = hl7Messages.get(i);
            futures.add(CompletableFuture.supplyAsync(() -> convertOne(messageIndex, hl7Message), executorService));
        }

        // convertOne never completes exceptionally
        for (CompletableFuture<Outcome> future : futures) {
            Outcome outcome = future.join();
            if (outcome.result != null) {
                response.getResults().add(outcome.result);
                response.setSuccessCount(response.getSuccessCount() + 1);
            } else {
                response.getErrors().add(outcome.error);
                response.setFailureCount(response.getFailureCount() + 1);
            }
        }

        response.setProcessingTimeMs(System.currentTimeMillis() - startTime);
        log.info("Batch SIU conversion completed: {} success, {} failures, {}ms total",
                response.getSuccessCount(), response.getFailureCount(), response.getProcessingTimeMs());
        return response;
    }

    private Outcome convertOne(int messageIndex, String hl7Message) {
        long msgStartTime = System.currentTimeMillis();
        try {
            AppointmentRecord appointment = appointmentService.convert(hl7Message);
            return Outcome.success(new ConversionResult(
                    messageIndex,
                    appointment,
                    System.currentTimeMillis() - msgStartTime));
        } catch (Hl7ProcessingException e) {
            return Outcome.failure(new ConversionError(
                    messageIndex,
                    e.getErrorKind(),
                    e.getMessage(),
                    truncate(hl7Message, batchProperties.getErrorInputMaxLength())));
        } catch (RuntimeException e) {
            log.error("Unexpected failure converting message {}", messageIndex, e);
            return Outcome.failure(new ConversionError(
                    messageIndex,
                    INTERNAL_ERROR,
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(),
                    truncate(hl7Message, batchProperties.getErrorInputMaxLength())));
        }
    }

    /**
     * Truncate string to specified length.
     */
    private String truncate(String str, int maxLength) {
        if (str == null)
            return null;
        if (str.length() <= maxLength)
            return str;
        return str.substring(0, maxLength) + "...";
    }

    private static final class Outcome {
        private final ConversionResult result;
        private final ConversionError error;

        private Outcome(ConversionResult result, ConversionError error) {
            this.result = result;
            this.error = error;
        }

        static Outcome success(ConversionResult result) {
            return new Outcome(result, null);
        }

        static Outcome failure(ConversionError error) {
            return new Outcome(null, error);
        }
    }
}
