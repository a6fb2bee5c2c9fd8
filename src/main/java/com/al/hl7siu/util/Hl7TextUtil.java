package com.al.hl7siu.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Low level text helpers shared by the splitter, the parser and the message
 * model.
 */
public final class Hl7TextUtil {

    public static final char SEGMENT_DELIMITER = '\r';

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private Hl7TextUtil() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    /**
     * Unify {@code \r\n} and {@code \n} line endings into the HL7 segment
     * delimiter {@code \r} and drop a leading byte-order mark.
     *
     * @param raw raw message text, may be null
     * @return normalized text, never null
     */
    public static String normalizeLineEndings(String raw) {
        if (raw == null || raw.isEmpty()) {
            return "";
        }
        String normalized = raw.replace("\r\n", "\r").replace('\n', SEGMENT_DELIMITER);
        int start = 0;
        while (start < normalized.length() && normalized.charAt(start) == BYTE_ORDER_MARK) {
            start++;
        }
        return normalized.substring(start);
    }

    /**
     * Split on a literal character, keeping empty tokens (including trailing
     * ones). Unlike {@link String#split(String)} no regex is involved, which
     * matters because HL7 delimiters such as {@code |} and {@code ^} are regex
     * metacharacters.
     */
    public static List<String> split(String value, char delimiter) {
        List<String> parts = new ArrayList<>();
        int start = 0;
        int idx;
        while ((idx = value.indexOf(delimiter, start)) >= 0) {
            parts.add(value.substring(start, idx));
            start = idx + 1;
        }
        parts.add(value.substring(start));
        return parts;
    }

    /**
     * Normalize and split into non-blank segment lines.
     */
    public static List<String> segmentLines(String raw) {
        List<String> lines = new ArrayList<>();
        for (String line : split(normalizeLineEndings(raw), SEGMENT_DELIMITER)) {
            if (!line.isBlank()) {
                lines.add(line);
            }
        }
        return lines;
    }
}
