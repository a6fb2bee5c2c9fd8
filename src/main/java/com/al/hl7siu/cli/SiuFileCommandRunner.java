package com.al.hl7siu.cli;

import com.al.hl7siu.dto.BatchConversionResponse;
import com.al.hl7siu.dto.BatchConversionResponse.ConversionError;
import com.al.hl7siu.dto.BatchConversionResponse.ConversionResult;
import com.al.hl7siu.service.BatchConversionService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Command-line driver: converts every message in an HL7 file and writes one
 * JSON line per appointment to stdout and one JSON line per failed message to
 * stderr.
 *
 * <p>
 * Exit codes:
 * <ul>
 * <li>0 - every message converted</li>
 * <li>1 - at least one message failed, or the file holds no MSH segment</li>
 * <li>2 - the file could not be read</li>
 * </ul>
 */
@Component
@ConditionalOnProperty(prefix = "app.cli", name = "input")
@Slf4j
public class SiuFileCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    public static final int EXIT_OK = 0;
    public static final int EXIT_MESSAGE_ERRORS = 1;
    public static final int EXIT_USAGE = 2;

    private final BatchConversionService batchConversionService;
    private final ObjectMapper objectMapper;
    private final String input;
    private final PrintStream out;
    private final PrintStream err;

    private int exitCode = EXIT_OK;

    @Autowired
    public SiuFileCommandRunner(BatchConversionService batchConversionService,
            ObjectMapper objectMapper,
            @Value("${app.cli.input}") String input) {
        this(batchConversionService, objectMapper, input, utf8(System.out), utf8(System.err));
    }

    SiuFileCommandRunner(BatchConversionService batchConversionService,
            ObjectMapper objectMapper,
            String input,
            PrintStream out,
            PrintStream err) {
        this.batchConversionService = batchConversionService;
        this.objectMapper = objectMapper;
        this.input = input;
        this.out = out;
        this.err = err;
    }

    @Override
    public void run(ApplicationArguments args) {
        exitCode = convertFile(input);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Resolve {@code file} and convert it.
     *
     * @return the process exit code, {@link #EXIT_USAGE} when the name is not a
     *         usable path
     */
    public int convertFile(String file) {
        Path path;
        try {
            path = Path.of(file);
        } catch (InvalidPathException e) {
            log.error("Invalid input path '{}'", file, e);
            err.println("Cannot read input file: " + file);
            return EXIT_USAGE;
        }
        return convertFile(path);
    }

    /**
     * Convert all messages of the given file.
     *
     * @return the process exit code
     */
    public int convertFile(Path path) {
        String raw;
        try {
            // malformed UTF-8 sequences are replaced, not rejected
            raw = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Cannot read input file {}", path, e);
            err.println("Cannot read input file: " + path);
            return EXIT_USAGE;
        }

        BatchConversionResponse response = batchConversionService.convertBatch(raw);
        if (response.getTotalMessages() == 0) {
            err.println("No HL7 messages found (no MSH segments).");
            return EXIT_MESSAGE_ERRORS;
        }

        Map<Integer, ConversionResult> results = new HashMap<>();
        response.getResults().forEach(r -> results.put(r.getMessageIndex(), r));
        Map<Integer, ConversionError> errors = new HashMap<>();
        response.getErrors().forEach(e -> errors.put(e.getMessageIndex(), e));

        for (int i = 1; i <= response.getTotalMessages(); i++) {
            if (results.containsKey(i)) {
                out.println(toJson(results.get(i).getAppointment()));
            } else if (errors.containsKey(i)) {
                ConversionError error = errors.get(i);
                Map<String, Object> errorObject = new LinkedHashMap<>();
                errorObject.put("message_index", error.getMessageIndex());
                errorObject.put("error", error.getError());
                errorObject.put("detail", error.getDetail());
                err.println(toJson(errorObject));
            }
        }
        out.flush();
        err.flush();

        return response.hasErrors() ? EXIT_MESSAGE_ERRORS : EXIT_OK;
    }

    // JSON output is UTF-8 whatever the platform charset
    private static PrintStream utf8(PrintStream target) {
        return new PrintStream(target, true, StandardCharsets.UTF_8);
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot render JSON output", e);
        }
    }
}
