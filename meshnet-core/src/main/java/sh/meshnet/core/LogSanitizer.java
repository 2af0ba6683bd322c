// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.meshnet.core;

import java.util.regex.Pattern;

/**
 * Utility that removes key material from debug log payloads.
 *
 * <p>
 * Performs two sanitization operations:
 * <ul>
 * <li>Redacts {@code secret}, {@code psk}, {@code psk_base64} and {@code key_bytes} JSON values</li>
 * <li>Truncates excessively long logs</li>
 * </ul>
 */
public final class LogSanitizer {

    private static final int MAX_LOG_LENGTH = 2000;

    private static final String TRUNCATION_SUFFIX = "...(truncated)";

    /** Matches "secret":"...", "psk":"...", "psk_base64":"..." and "key_bytes":"..." string values. */
    private static final Pattern KEY_MATERIAL_PATTERN =
            Pattern.compile("\"(secret|psk|psk_base64|key_bytes)\"\\s*:\\s*\"[^\"]*\"");

    private static final String KEY_MATERIAL_REPLACEMENT = "\"$1\":\"***[REDACTED]***\"";

    private LogSanitizer() {}

    public static String sanitize(final String input) {
        if (input == null) {
            return "null";
        }

        String sanitized = input;

        if (sanitized.contains("\"secret\"") || sanitized.contains("\"psk") || sanitized.contains("\"key_bytes\"")) {
            sanitized = KEY_MATERIAL_PATTERN.matcher(sanitized).replaceAll(KEY_MATERIAL_REPLACEMENT);
        }

        if (sanitized.length() > MAX_LOG_LENGTH) {
            int truncateAt = Math.max(0, MAX_LOG_LENGTH - TRUNCATION_SUFFIX.length());
            sanitized = sanitized.substring(0, truncateAt) + TRUNCATION_SUFFIX;
        }

        return sanitized;
    }
}
