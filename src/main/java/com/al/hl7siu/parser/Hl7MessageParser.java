package com.al.hl7siu.parser;

import com.al.hl7siu.exception.Hl7ParseException;
import com.al.hl7siu.model.hl7.Hl7Message;
import com.al.hl7siu.model.hl7.Hl7Separators;
import com.al.hl7siu.util.Hl7TextUtil;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * HL7 v2 pipe-delimited (ER7) parser.
 *
 * <p>
 * The separators are read from the message itself: MSH-1 is the character
 * right after {@code MSH}, MSH-2 lists the component, repetition, escape and
 * subcomponent characters. Every segment line is then split on the field
 * separator into a list aligned with HL7 field numbers.
 *
 * <pre>
 * MSH|^~\&amp;|SEND|FAC|...   -&gt;  [MSH, |, ^~\&amp;, SEND, FAC, ...]
 * PID|1||P12345            -&gt;  [PID, 1, , P12345]
 * </pre>
 *
 * No segment-order or cardinality rules are applied.
 */
@Component
public class Hl7MessageParser {

    private static final int MIN_HEADER_LENGTH = 4;
    private static final int SEGMENT_NAME_LENGTH = 3;

    /**
     * Parse a single message.
     *
     * @param messageText one message, typically produced by
     *                    {@link Hl7MessageSplitter}
     * @return the structured message
     * @throws Hl7ParseException if the text does not start with a usable MSH
     *                           segment
     */
    public Hl7Message parse(String messageText) {
        List<String> lines = Hl7TextUtil.segmentLines(messageText);
        if (lines.isEmpty() || !lines.get(0).startsWith(Hl7MessageSplitter.HEADER_SEGMENT)) {
            throw new Hl7ParseException("Message does not start with MSH segment.");
        }

        String header = lines.get(0);
        if (header.length() < MIN_HEADER_LENGTH) {
            throw new Hl7ParseException("MSH segment too short to contain field separator.");
        }
        char fieldSeparator = header.charAt(3);

        List<String> headerParts = Hl7TextUtil.split(header, fieldSeparator);
        String encodingCharacters = headerParts.size() > 1 ? headerParts.get(1) : null;
        Hl7Separators separators = Hl7Separators.of(fieldSeparator, encodingCharacters);

        Map<String, List<List<String>>> segments = new LinkedHashMap<>();
        for (String line : lines) {
            if (line.length() < SEGMENT_NAME_LENGTH) {
                continue;
            }
            String name = line.substring(0, SEGMENT_NAME_LENGTH);
            List<String> parts = Hl7TextUtil.split(line, fieldSeparator);

            List<String> fields;
            if (Hl7MessageSplitter.HEADER_SEGMENT.equals(name)) {
                // MSH-1 is the separator itself, so shift everything after the name by one
                fields = new ArrayList<>(parts.size() + 1);
                fields.add(name);
                fields.add(String.valueOf(fieldSeparator));
                fields.addAll(parts.subList(1, parts.size()));
            } else {
                fields = parts;
            }
            segments.computeIfAbsent(name, k -> new ArrayList<>()).add(fields);
        }

        return new Hl7Message(separators, segments);
    }
}
