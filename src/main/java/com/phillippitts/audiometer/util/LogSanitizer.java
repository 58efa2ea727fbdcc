package com.phillippitts.audiometer.util;

import java.nio.charset.StandardCharsets;

/** Makes client-supplied text safe to log or to echo back in a close frame. */
public final class LogSanitizer {

    /** Largest close reason a WebSocket close frame can carry, in UTF-8 bytes. */
    public static final int MAX_CLOSE_REASON_BYTES = 123;

    private LogSanitizer() {}

    /**
     * Single-line preview of a client control frame. Control characters become spaces so a
     * frame cannot forge log lines; text longer than {@code maxChars} is cut and marked.
     *
     * @param text     raw frame text, may be null
     * @param maxChars characters kept before the cut marker
     * @return sanitized preview, "" for null or a non-positive limit
     */
    public static String preview(String text, int maxChars) {
        if (text == null || maxChars <= 0) {
            return "";
        }
        int end = Math.min(text.length(), maxChars);
        if (end < text.length() && Character.isHighSurrogate(text.charAt(end - 1))) {
            end--;
        }
        StringBuilder out = new StringBuilder(end + 16);
        for (int i = 0; i < end; i++) {
            char c = text.charAt(i);
            out.append(Character.isISOControl(c) ? ' ' : c);
        }
        if (end < text.length()) {
            out.append("...(+").append(text.length() - end).append(" chars)");
        }
        return out.toString();
    }

    /**
     * Cuts a close reason to what a close frame can carry without splitting a character.
     *
     * @param reason close reason, may be null
     * @return reason of at most {@link #MAX_CLOSE_REASON_BYTES} UTF-8 bytes, "" for null
     */
    public static String closeReason(String reason) {
        if (reason == null) {
            return "";
        }
        int bytes = 0;
        int i = 0;
        while (i < reason.length()) {
            int cp = reason.codePointAt(i);
            int width = new String(Character.toChars(cp)).getBytes(StandardCharsets.UTF_8).length;
            if (bytes + width > MAX_CLOSE_REASON_BYTES) {
                break;
            }
            bytes += width;
            i += Character.charCount(cp);
        }
        return reason.substring(0, i);
    }
}
