// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.meshnet.core.model;

/**
 * Outcome of a membership evaluation.
 *
 * @since 0.1.0
 */
public enum MembershipStatus {
    /** Participant receives key material for the epoch. */
    ALLOWED,
    /** Participant receives no key material for the epoch. */
    DENIED
}
