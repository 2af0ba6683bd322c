// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.meshnet.core;

import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Centralized opt-in debug logger, enabled through {@link MeshnetDebug}.
 */
public final class DebugLogger {

    private static final Logger LOG = LoggerFactory.getLogger("sh.meshnet.debug");

    private DebugLogger() {
    }

    public static void logRotation(final String message, final Object... args) {
        if (!MeshnetDebug.isRotationLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    public static void logSubmission(final String message, final Object... args) {
        if (!MeshnetDebug.isSubmissionLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    // Always sanitized: debug payloads may carry key material.
    private static void logDirect(final String message, final Object... args) {
        final String formatted = (args == null || args.length == 0)
                ? message
                : String.format(Locale.ROOT, message, args);
        LOG.info(LogSanitizer.sanitize(formatted));
    }
}
