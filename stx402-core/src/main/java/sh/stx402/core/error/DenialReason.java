// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.core.error;

/**
 * Why an authorization request was denied.
 *
 * @since 0.1.0
 */
public enum DenialReason {
    NO_PROOF("no proof supplied", ErrorCode.NO_PROOF),
    SIGNATURE_INVALID("signature invalid", ErrorCode.SIGNATURE_INVALID),
    ADDRESS_MISMATCH("address mismatch", ErrorCode.ADDRESS_MISMATCH),
    TIMESTAMP_EXPIRED("timestamp expired", ErrorCode.TIMESTAMP_EXPIRED),
    CHALLENGE_INVALID_OR_CONSUMED("challenge invalid or consumed", ErrorCode.CHALLENGE_INVALID_OR_CONSUMED);

    private final String description;
    private final ErrorCode errorCode;

    DenialReason(final String description, final ErrorCode errorCode) {
        this.description = description;
        this.errorCode = errorCode;
    }

    public String description() {
        return description;
    }

    public ErrorCode errorCode() {
        return errorCode;
    }
}
