// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.registry.auth;

import java.util.Objects;

import sh.stx402.core.error.AuthorizationException;
import sh.stx402.core.error.DenialReason;

/**
 * Outcome of {@link AuthorizationEngine#decide}.
 */
public sealed interface AuthorizationDecision permits AuthorizationDecision.Authorized, AuthorizationDecision.Denied {

    boolean isAuthorized();

    /**
     * @throws AuthorizationException if this is a denial
     */
    default AuthMethod orThrow(final Operation operation) {
        if (this instanceof Denied denied) {
            throw new AuthorizationException(operation.label(), denied.reason());
        }
        return ((Authorized) this).method();
    }

    record Authorized(AuthMethod method) implements AuthorizationDecision {
        public Authorized {
            Objects.requireNonNull(method, "method");
        }

        @Override
        public boolean isAuthorized() {
            return true;
        }
    }

    record Denied(DenialReason reason) implements AuthorizationDecision {
        public Denied {
            Objects.requireNonNull(reason, "reason");
        }

        @Override
        public boolean isAuthorized() {
            return false;
        }
    }

    static AuthorizationDecision authorized(final AuthMethod method) {
        return new Authorized(method);
    }

    static AuthorizationDecision denied(final DenialReason reason) {
        return new Denied(reason);
    }
}
