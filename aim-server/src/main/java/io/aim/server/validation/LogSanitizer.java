package io.aim.server.validation;

/// Makes client-supplied values safe to embed in a single log line.
///
/// Every control character (including tab, CR and LF), Unicode line and
/// paragraph separator (`U+2028`, `U+2029`) and next-line (`U+0085`) is
/// replaced with `?`. Values longer than {@link #MAX_LENGTH} characters are
/// cut and marked with a trailing `...`.
///
/// ```
/// LOG.infov("Evaluating session {0}", LogSanitizer.sanitize(sessionId));
/// ```
public final class LogSanitizer {

    static final int MAX_LENGTH = 256;
    private static final char REPLACEMENT = '?';

    private LogSanitizer() {}

    /// @param value client-supplied text, may be null
    /// @return single-line text, or `"null"` for null input
    public static String sanitize(String value) {
        if (value == null) {
            return "null";
        }
        int length = Math.min(value.length(), MAX_LENGTH);
        StringBuilder out = new StringBuilder(length + 3);
        for (int i = 0; i < length; i++) {
            char c = value.charAt(i);
            out.append(breaksLine(c) ? REPLACEMENT : c);
        }
        if (value.length() > MAX_LENGTH) {
            out.append("...");
        }
        return out.toString();
    }

    private static boolean breaksLine(char c) {
        int type = Character.getType(c);
        return type == Character.CONTROL
                || type == Character.LINE_SEPARATOR
                || type == Character.PARAGRAPH_SEPARATOR;
    }
}
