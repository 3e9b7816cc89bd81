// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.registry.auth;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.stx402.core.error.AuthorizationException;
import sh.stx402.core.error.DenialReason;
import sh.stx402.core.types.AddressCodec;

/**
 * Gate for administrative listing and status changes.
 *
 * <p>
 * The caller is the administrator iff its address shares the configured admin
 * address's fingerprint. No signature is checked here; the surrounding system
 * authenticates the caller. With no admin configured nobody is admin.
 */
public final class AdminPolicy {

    private static final Logger log = LoggerFactory.getLogger(AdminPolicy.class);

    private final @Nullable String adminAddress;

    public AdminPolicy(final @Nullable String adminAddress) {
        this.adminAddress = adminAddress;
        if (adminAddress != null && AddressCodec.tryParse(adminAddress).isEmpty()) {
            log.warn("Configured admin address {} is not a valid Stacks address; admin operations are disabled",
                    adminAddress);
        }
    }

    public boolean isAdmin(final @Nullable String caller) {
        return adminAddress != null && AddressCodec.equivalent(adminAddress, caller);
    }

    /**
     * @throws AuthorizationException with {@code ADDRESS_MISMATCH} for anyone but the admin
     */
    public void require(final @Nullable String caller, final String operation) {
        if (!isAdmin(caller)) {
            throw new AuthorizationException(operation, DenialReason.ADDRESS_MISMATCH);
        }
    }
}
