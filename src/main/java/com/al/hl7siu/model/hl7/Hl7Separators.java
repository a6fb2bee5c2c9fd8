package com.al.hl7siu.model.hl7;

import lombok.Value;

/**
 * The five delimiter characters an HL7 v2 message declares in its MSH segment.
 *
 * <p>
 * MSH-1 carries the field separator and MSH-2 the encoding characters in the
 * order component, repetition, escape, subcomponent. Each position that is
 * missing falls back to the standard {@code ^~\&} character.
 */
@Value
public class Hl7Separators {

    public static final String DEFAULT_ENCODING_CHARACTERS = "^~\\&";

    public static final char DEFAULT_FIELD_SEPARATOR = '|';

    char fieldSeparator;
    char componentSeparator;
    char repetitionSeparator;
    char escapeCharacter;
    char subcomponentSeparator;

    /**
     * Derive the separator set from the header's field separator and its raw
     * encoding-characters string (MSH-2).
     *
     * @param fieldSeparator     the fourth character of the MSH line
     * @param encodingCharacters MSH-2, may be null or shorter than four characters
     */
    public static Hl7Separators of(char fieldSeparator, String encodingCharacters) {
        String enc = encodingCharacters == null || encodingCharacters.isEmpty()
                ? DEFAULT_ENCODING_CHARACTERS
                : encodingCharacters;
        return new Hl7Separators(
                fieldSeparator,
                charAt(enc, 0),
                charAt(enc, 1),
                charAt(enc, 2),
                charAt(enc, 3));
    }

    public static Hl7Separators defaults() {
        return of(DEFAULT_FIELD_SEPARATOR, DEFAULT_ENCODING_CHARACTERS);
    }

    private static char charAt(String enc, int position) {
        return enc.length() > position ? enc.charAt(position) : DEFAULT_ENCODING_CHARACTERS.charAt(position);
    }
}
