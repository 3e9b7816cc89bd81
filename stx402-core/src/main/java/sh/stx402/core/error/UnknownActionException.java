// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.core.error;

/**
 * Thrown when a signed action cannot be built: unknown tag or a required field is missing.
 *
 * @since 0.1.0
 */
public final class UnknownActionException extends Stx402Exception {

    public UnknownActionException(final String message) {
        super(message);
    }

    @Override
    public ErrorCode errorCode() {
        return ErrorCode.INVALID_INPUT;
    }
}
