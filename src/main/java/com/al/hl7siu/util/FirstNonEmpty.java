package com.al.hl7siu.util;

import java.util.function.Supplier;

/**
 * Ordered fallback over candidate values: the first candidate producing a
 * non-empty string wins, later candidates are not evaluated.
 *
 * <pre>
 * String id = FirstNonEmpty.of(
 *         () -&gt; msg.getComponent("SCH", 1, 1),
 *         () -&gt; msg.getField("SCH", 1));
 * </pre>
 */
public final class FirstNonEmpty {

    private FirstNonEmpty() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    /**
     * @return the first non-empty candidate value, or "" when all are empty
     */
    @SafeVarargs
    public static String of(Supplier<String>... candidates) {
        for (Supplier<String> candidate : candidates) {
            String value = candidate.get();
            if (value != null && !value.isEmpty()) {
                return value;
            }
        }
        return "";
    }

    /**
     * Join the non-empty parts with single spaces, keeping their order.
     */
    public static String joinNonEmpty(String... parts) {
        StringBuilder sb = new StringBuilder();
        for (String part : parts) {
            if (part == null || part.isEmpty()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(part);
        }
        return sb.toString();
    }
}
