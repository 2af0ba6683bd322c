// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.meshnet.core.score;

import sh.meshnet.core.error.ValidationException;
import sh.meshnet.core.model.Submission;

/**
 * Checks the authenticity of a submission before it reaches the score store.
 *
 * <p>
 * The default {@link #acceptAll()} accepts unsigned and signed submissions
 * alike without looking at the signature. A verifying implementation (for
 * example Ed25519 against a per-participant public key) replaces it.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface SubmissionVerifier {

    /**
     * @param submission the submission to check
     * @throws ValidationException if the submission must be rejected
     */
    void verify(Submission submission);

    static SubmissionVerifier acceptAll() {
        return submission -> { };
    }

    /**
     * Rejects unsigned submissions and delegates signed ones to {@code signatureCheck}.
     *
     * @param signatureCheck check for the signed variant
     * @return a verifier requiring signatures
     */
    static SubmissionVerifier requireSignature(final SubmissionVerifier signatureCheck) {
        return submission -> {
            if (submission instanceof Submission.Unsigned) {
                throw new ValidationException("signature", "is required");
            }
            signatureCheck.verify(submission);
        };
    }
}
