// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.registry.auth;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import sh.stx402.core.error.AuthorizationException;
import sh.stx402.core.error.DenialReason;
import sh.stx402.registry.TestKeys;

class AdminPolicyTest {

    @Test
    void adminMatchesAcrossNetworks() {
        AdminPolicy policy = new AdminPolicy(TestKeys.OWNER);

        assertTrue(policy.isAdmin(TestKeys.OWNER));
        assertTrue(policy.isAdmin(TestKeys.OWNER_TESTNET));
        assertFalse(policy.isAdmin(TestKeys.OTHER));
        assertFalse(policy.isAdmin(null));
    }

    @Test
    void nobodyIsAdminWithoutConfiguration() {
        AdminPolicy policy = new AdminPolicy(null);

        assertFalse(policy.isAdmin(TestKeys.OWNER));
    }

    @Test
    void invalidConfiguredAddressDisablesAdmin() {
        AdminPolicy policy = new AdminPolicy("not-an-address");

        assertFalse(policy.isAdmin("not-an-address"));
    }

    @Test
    void requireRejectsOthers() {
        AdminPolicy policy = new AdminPolicy(TestKeys.OWNER);

        assertDoesNotThrow(() -> policy.require(TestKeys.OWNER, "admin-verify"));
        AuthorizationException e =
                assertThrows(AuthorizationException.class, () -> policy.require(TestKeys.OTHER, "admin-verify"));
        assertEquals(DenialReason.ADDRESS_MISMATCH, e.reason());
        assertEquals("admin-verify", e.operation());
    }
}
