// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.core.error;

/**
 * Thrown when a string is not a well-formed Stacks address.
 *
 * @since 0.1.0
 */
public final class InvalidAddressException extends Stx402Exception {

    private final String input;

    public InvalidAddressException(final String input, final String message) {
        super("Invalid address '" + input + "': " + message);
        this.input = input;
    }

    public InvalidAddressException(final String input, final String message, final Throwable cause) {
        super("Invalid address '" + input + "': " + message, cause);
        this.input = input;
    }

    public String input() {
        return input;
    }

    @Override
    public ErrorCode errorCode() {
        return ErrorCode.INVALID_ADDRESS;
    }
}
