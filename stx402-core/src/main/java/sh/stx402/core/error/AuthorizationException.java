// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.core.error;

import java.util.Objects;

/**
 * Thrown by the registry façade when ownership could not be proven.
 *
 * <p>
 * Always carries the specific {@link DenialReason}; callers never see a bare "unauthorized".
 *
 * @since 0.1.0
 */
public final class AuthorizationException extends Stx402Exception {

    private final DenialReason reason;
    private final String operation;

    public AuthorizationException(final String operation, final DenialReason reason) {
        super(operation + " denied: " + Objects.requireNonNull(reason, "reason").description());
        this.reason = reason;
        this.operation = operation;
    }

    public DenialReason reason() {
        return reason;
    }

    public String operation() {
        return operation;
    }

    @Override
    public ErrorCode errorCode() {
        return reason.errorCode();
    }

    @Override
    public String toString() {
        return "AuthorizationException{operation=" + operation + ", reason=" + reason + "}";
    }
}
