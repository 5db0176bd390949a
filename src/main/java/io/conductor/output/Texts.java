package io.conductor.output;

/**
 * Length bounding for text that ends up in the ledger or on a terminal.
 */
public final class Texts {
    private static final String ELLIPSIS = "...";

    private Texts() {
    }

    /**
     * Returns {@code value} cut to at most {@code maxChars} characters, ending in "..." when cut.
     */
    public static String truncate(String value, int maxChars) {
        if (value == null) {
            return null;
        }
        if (value.length() <= maxChars) {
            return value;
        }
        if (maxChars <= ELLIPSIS.length()) {
            return value.substring(0, Math.max(0, maxChars));
        }
        return value.substring(0, maxChars - ELLIPSIS.length()) + ELLIPSIS;
    }

    /**
     * Keeps the last {@code maxChars} characters, prefixed with "..." when cut.
     */
    public static String tail(String value, int maxChars) {
        if (value == null) {
            return null;
        }
        if (value.length() <= maxChars) {
            return value;
        }
        if (maxChars <= ELLIPSIS.length()) {
            return value.substring(value.length() - Math.max(0, maxChars));
        }
        return ELLIPSIS + value.substring(value.length() - (maxChars - ELLIPSIS.length()));
    }

    public static String oneLine(String value) {
        if (value == null) {
            return "";
        }
        return value.replace('\r', ' ').replace('\n', ' ').strip();
    }
}
