package com.al.hl7siu.model.hl7;

import com.al.hl7siu.util.Hl7EscapeUtil;
import com.al.hl7siu.util.Hl7TextUtil;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parsed HL7 v2 message.
 *
 * <p>
 * Segments are stored by name, each name mapping to its occurrences in message
 * order. An occurrence is the list of field values aligned with HL7 field
 * numbering:
 * <ul>
 * <li>for regular segments {@code fields[0]} is the segment name and
 * {@code fields[1]} is SEG-1</li>
 * <li>for MSH {@code fields[1]} is MSH-1 (the field separator itself) and
 * {@code fields[2]} is MSH-2 (the encoding characters)</li>
 * </ul>
 *
 * <p>
 * Lookups never throw. A missing segment, occurrence, field, repetition or
 * component, as well as an empty value, resolves to the caller supplied
 * default.
 */
public final class Hl7Message {

    private final Hl7Separators separators;
    private final Map<String, List<List<String>>> segments;

    public Hl7Message(Hl7Separators separators, Map<String, List<List<String>>> segments) {
        this.separators = separators;
        Map<String, List<List<String>>> copy = new LinkedHashMap<>();
        segments.forEach((name, occurrences) -> {
            List<List<String>> occCopy = new ArrayList<>(occurrences.size());
            for (List<String> fields : occurrences) {
                occCopy.add(List.copyOf(fields));
            }
            copy.put(name, Collections.unmodifiableList(occCopy));
        });
        this.segments = Collections.unmodifiableMap(copy);
    }

    public Hl7Separators getSeparators() {
        return separators;
    }

    public boolean hasSegment(String segment) {
        return segments.containsKey(segment);
    }

    public int getSegmentCount(String segment) {
        List<List<String>> occurrences = segments.get(segment);
        return occurrences == null ? 0 : occurrences.size();
    }

    /**
     * Segment names in order of first appearance.
     */
    public Set<String> getSegmentNames() {
        return segments.keySet();
    }

    // ==================== Field ====================

    public String getField(String segment, int field) {
        return getField(segment, field, 0, "");
    }

    /**
     * Raw (not unescaped) value of {@code SEG-field}.
     *
     * @param segment    three letter segment name
     * @param field      HL7 field number
     * @param occurrence zero based index among repeated segments of this name
     * @param defaultValue returned when the value is absent or empty
     */
    public String getField(String segment, int field, int occurrence, String defaultValue) {
        List<List<String>> occurrences = segments.get(segment);
        if (occurrences == null || occurrence < 0 || occurrence >= occurrences.size()) {
            return defaultValue;
        }
        List<String> fields = occurrences.get(occurrence);
        if (field < 0 || field >= fields.size()) {
            return defaultValue;
        }
        String value = fields.get(field);
        return value == null || value.isEmpty() ? defaultValue : value;
    }

    public int getRepetitionCount(String segment, int field) {
        return getRepetitionCount(segment, field, 0);
    }

    public int getRepetitionCount(String segment, int field, int occurrence) {
        String raw = getField(segment, field, occurrence, "");
        if (raw.isEmpty()) {
            return 0;
        }
        return Hl7TextUtil.split(raw, separators.getRepetitionSeparator()).size();
    }

    // ==================== Component ====================

    public String getComponent(String segment, int field, int component) {
        return getComponent(segment, field, component, 0, 0, "");
    }

    /**
     * Unescaped value of {@code SEG-field.component} within one repetition.
     *
     * @param component  one based component number
     * @param occurrence zero based segment occurrence
     * @param repetition zero based field repetition
     */
    public String getComponent(String segment, int field, int component, int occurrence, int repetition,
            String defaultValue) {
        String raw = rawComponent(segment, field, component, occurrence, repetition);
        if (raw == null) {
            return defaultValue;
        }
        String decoded = Hl7EscapeUtil.unescape(raw, separators);
        return decoded == null || decoded.isEmpty() ? defaultValue : decoded;
    }

    // ==================== Subcomponent ====================

    public String getSubcomponent(String segment, int field, int component, int subcomponent) {
        return getSubcomponent(segment, field, component, subcomponent, 0, 0, "");
    }

    /**
     * Unescaped value of {@code SEG-field.component.subcomponent}.
     */
    public String getSubcomponent(String segment, int field, int component, int subcomponent, int occurrence,
            int repetition, String defaultValue) {
        String raw = rawComponent(segment, field, component, occurrence, repetition);
        if (raw == null || subcomponent <= 0) {
            return defaultValue;
        }
        String selected = pick(Hl7TextUtil.split(raw, separators.getSubcomponentSeparator()), subcomponent - 1);
        if (selected == null) {
            return defaultValue;
        }
        String decoded = Hl7EscapeUtil.unescape(selected, separators);
        return decoded == null || decoded.isEmpty() ? defaultValue : decoded;
    }

    /**
     * Still-escaped component text, or null when any coordinate misses.
     */
    private String rawComponent(String segment, int field, int component, int occurrence, int repetition) {
        String raw = getField(segment, field, occurrence, "");
        if (raw.isEmpty() || component <= 0) {
            return null;
        }
        String repValue = pick(Hl7TextUtil.split(raw, separators.getRepetitionSeparator()), repetition);
        if (repValue == null) {
            return null;
        }
        return pick(Hl7TextUtil.split(repValue, separators.getComponentSeparator()), component - 1);
    }

    private static String pick(List<String> values, int index) {
        return index >= 0 && index < values.size() ? values.get(index) : null;
    }

    @Override
    public String toString() {
        return "Hl7Message{" +
                "segments=" + segments.keySet() +
                ", separators=" + separators +
                '}';
    }
}
