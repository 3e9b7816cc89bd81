// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.core.error;

/**
 * Base runtime exception for all stx402 failures.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * Stx402Exception
 * ├── {@link InvalidAddressException} - malformed Stacks address
 * ├── {@link UnknownActionException} - signed message missing a required field
 * ├── {@link AuthorizationException} - ownership proof denied, carries a {@link DenialReason}
 * └── {@link RegistryException} - registry store failures, carries an {@link ErrorCode}
 * </pre>
 *
 * <p>
 * Parsing and signature verification never throw; they return results with a reason.
 * Exceptions are reserved for operations that must not proceed.
 *
 * <pre>{@code
 * try {
 *     registry.delete(request);
 * } catch (AuthorizationException e) {
 *     respond(e.errorCode().httpStatus(), e.reason().description());
 * } catch (RegistryException e) {
 *     respond(e.errorCode().httpStatus(), e.getMessage());
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public sealed class Stx402Exception extends RuntimeException
        permits InvalidAddressException,
        UnknownActionException,
        AuthorizationException,
        RegistryException {

    public Stx402Exception(final String message) {
        super(message);
    }

    public Stx402Exception(final String message, final Throwable cause) {
        super(message, cause);
    }

    /**
     * @return the taxonomy code the routing layer maps to a response status
     */
    public ErrorCode errorCode() {
        return ErrorCode.INVALID_INPUT;
    }
}
