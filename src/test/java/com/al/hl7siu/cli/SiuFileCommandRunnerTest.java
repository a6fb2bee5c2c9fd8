package com.al.hl7siu.cli;

import com.al.hl7siu.Hl7TestMessages;
import com.al.hl7siu.config.BatchProperties;
import com.al.hl7siu.parser.Hl7MessageParser;
import com.al.hl7siu.parser.Hl7MessageSplitter;
import com.al.hl7siu.service.BatchConversionService;
import com.al.hl7siu.service.SiuAppointmentService;
import com.al.hl7siu.service.converter.SiuS12AppointmentExtractor;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

public class SiuFileCommandRunnerTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private ExecutorService executorService;
    private SiuFileCommandRunner runner;

    @BeforeEach
    public void setup() {
        executorService = Executors.newFixedThreadPool(2);
        runner = new SiuFileCommandRunner(newBatchService(), objectMapper, "unused",
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private BatchConversionService newBatchService() {
        SiuAppointmentService appointmentService = new SiuAppointmentService(
                new Hl7MessageParser(), new SiuS12AppointmentExtractor(), new SimpleMeterRegistry());
        return new BatchConversionService(
                new Hl7MessageSplitter(), appointmentService, executorService, new BatchProperties());
    }

    @AfterEach
    public void tearDown() {
        executorService.shutdownNow();
    }

    @Test
    public void testAllMessagesConverted() throws Exception {
        Path file = write(Hl7TestMessages.VALID_SIU.replace("\r", "\n") + Hl7TestMessages.NO_PV1);

        assertEquals(SiuFileCommandRunner.EXIT_OK, runner.convertFile(file));

        String[] lines = stdout().split("\\R");
        assertEquals(2, lines.length);
        JsonNode first = objectMapper.readTree(lines[0]);
        assertEquals("123456", first.get("appointment_id").asText());
        assertEquals("2025-05-02T07:00:00Z", first.get("appointment_datetime").asText());
        assertEquals("Dr Jane Smith", first.path("provider").get("name").asText());
        assertEquals("", stderr());
    }

    @Test
    public void testFailedMessageGoesToStderr() throws Exception {
        Path file = write(Hl7TestMessages.VALID_SIU + Hl7TestMessages.WRONG_TYPE);

        assertEquals(SiuFileCommandRunner.EXIT_MESSAGE_ERRORS, runner.convertFile(file));

        assertEquals(1, stdout().split("\\R").length);
        JsonNode error = objectMapper.readTree(stderr().trim());
        assertEquals(2, error.get("message_index").asInt());
        assertEquals("UnsupportedMessageType", error.get("error").asText());
        assertTrue(error.get("detail").asText().contains("ADT^A01"));
    }

    @Test
    public void testNoMessagesInFile() throws Exception {
        Path file = write("this is not HL7\n");

        assertEquals(SiuFileCommandRunner.EXIT_MESSAGE_ERRORS, runner.convertFile(file));

        assertEquals("", stdout());
        assertTrue(stderr().contains("No HL7 messages found"));
    }

    @Test
    public void testMissingFile() {
        assertEquals(SiuFileCommandRunner.EXIT_USAGE, runner.convertFile(tempDir.resolve("missing.hl7")));
        assertTrue(stderr().contains("Cannot read input file"));
    }

    @Test
    public void testInvalidPathName() {
        assertEquals(SiuFileCommandRunner.EXIT_USAGE, runner.convertFile("bad\u0000name.hl7"));
        assertTrue(stderr().contains("Cannot read input file"));
    }

    @Test
    public void testConsoleOutputIsUtf8() throws Exception {
        Path file = write("MSH|^~\\&|SEND|FAC|RECV|FAC|20250101||SIU^S12|MSG1|P|2.5\r"
                + "SCH|A1\r"
                + "PID|1||P1||Mu\u00f1oz^Jos\u00e9||19850210|M\r");
        ByteArrayOutputStream console = new ByteArrayOutputStream();
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        int exitCode;
        try {
            System.setOut(new PrintStream(console, true, StandardCharsets.US_ASCII));
            System.setErr(new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.US_ASCII));
            SiuFileCommandRunner consoleRunner = new SiuFileCommandRunner(
                    newBatchService(), objectMapper, file.toString());
            exitCode = consoleRunner.convertFile(file.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }

        assertEquals(SiuFileCommandRunner.EXIT_OK, exitCode);
        // log lines may share the console, the record is the JSON line
        String jsonLine = console.toString(StandardCharsets.UTF_8).lines()
                .filter(line -> line.startsWith("{"))
                .findFirst()
                .orElseThrow();
        JsonNode record = objectMapper.readTree(jsonLine);
        assertEquals("Jos\u00e9", record.path("patient").get("first_name").asText());
        assertEquals("Mu\u00f1oz", record.path("patient").get("last_name").asText());
    }

    private Path write(String content) throws Exception {
        Path file = tempDir.resolve("input.hl7");
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }
}
