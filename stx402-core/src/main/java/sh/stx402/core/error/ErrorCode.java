// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.core.error;

/**
 * Domain error codes with the HTTP status a routing layer should answer with.
 *
 * @since 0.1.0
 */
public enum ErrorCode {
    INVALID_ADDRESS(400),
    INVALID_INPUT(400),
    SIGNATURE_INVALID(401),
    ADDRESS_MISMATCH(403),
    NO_PROOF(401),
    TIMESTAMP_EXPIRED(401),
    CHALLENGE_INVALID_OR_CONSUMED(401),
    ALREADY_REGISTERED(409),
    ENTRY_NOT_FOUND(404),
    PROBE_TIMEOUT(504),
    PROBE_UNREACHABLE(502),
    STORAGE_CONFLICT(409);

    private final int httpStatus;

    ErrorCode(final int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int httpStatus() {
        return httpStatus;
    }
}
