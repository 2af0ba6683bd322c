// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.meshnet.core;

/**
 * Global toggle for verbose debug logging of rotations and submissions.
 *
 * <p>Thread safety: the flags are volatile and independent; {@link #setEnabled(boolean)}
 * writes them one after the other.
 */
public final class MeshnetDebug {

    private static volatile boolean rotationLogging = false;
    private static volatile boolean submissionLogging = false;

    private MeshnetDebug() {
    }

    public static void setEnabled(final boolean enabled) {
        rotationLogging = enabled;
        submissionLogging = enabled;
    }

    public static void setRotationLogging(final boolean enabled) {
        rotationLogging = enabled;
    }

    public static boolean isRotationLoggingEnabled() {
        return rotationLogging;
    }

    public static void setSubmissionLogging(final boolean enabled) {
        submissionLogging = enabled;
    }

    public static boolean isSubmissionLoggingEnabled() {
        return submissionLogging;
    }
}
