package com.al.hl7siu.util;

import com.al.hl7siu.model.hl7.Hl7Separators;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Minimal HL7 v2 escape sequence decoder.
 *
 * <p>
 * Only the five delimiter escapes are understood:
 * <ul>
 * <li>{@code \F\} - field separator</li>
 * <li>{@code \S\} - component separator</li>
 * <li>{@code \R\} - repetition separator</li>
 * <li>{@code \E\} - escape character</li>
 * <li>{@code \T\} - subcomponent separator</li>
 * </ul>
 * Any other escape sequence (hex data, highlighting, character set switches)
 * is left in the value untouched.
 */
public final class Hl7EscapeUtil {

    private static final Map<Character, Pattern> PATTERNS = new ConcurrentHashMap<>();

    private Hl7EscapeUtil() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    /**
     * Decode delimiter escapes using the separators declared by the message.
     *
     * @param value      raw component value, may be null
     * @param separators separators of the message the value came from
     * @return decoded value; the input itself when it holds no escape character
     */
    public static String unescape(String value, Hl7Separators separators) {
        char escape = separators.getEscapeCharacter();
        if (value == null || value.isEmpty() || value.indexOf(escape) < 0) {
            return value;
        }

        Pattern pattern = PATTERNS.computeIfAbsent(escape, Hl7EscapeUtil::compile);
        Matcher matcher = pattern.matcher(value);
        return matcher.replaceAll(match -> Matcher.quoteReplacement(decode(match.group(1), match.group(), separators)));
    }

    private static String decode(String code, String original, Hl7Separators separators) {
        switch (code) {
            case "F":
                return String.valueOf(separators.getFieldSeparator());
            case "S":
                return String.valueOf(separators.getComponentSeparator());
            case "R":
                return String.valueOf(separators.getRepetitionSeparator());
            case "E":
                return String.valueOf(separators.getEscapeCharacter());
            case "T":
                return String.valueOf(separators.getSubcomponentSeparator());
            default:
                return original;
        }
    }

    private static Pattern compile(Character escape) {
        String esc = Pattern.quote(String.valueOf(escape));
        return Pattern.compile(esc + "(.+?)" + esc, Pattern.DOTALL);
    }
}
