// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.core.crypto.sip018;

import org.jspecify.annotations.Nullable;

/**
 * Field values a signed action may carry; which are required depends on the action.
 *
 * @param owner    the owner address as the client typed it
 * @param url      endpoint URL
 * @param newOwner transfer recipient
 * @param nonce    challenge nonce
 * @since 0.1.0
 */
public record ActionFields(String owner, @Nullable String url, @Nullable String newOwner, @Nullable String nonce) {

    public static ActionFields owner(final String owner) {
        return new ActionFields(owner, null, null, null);
    }

    public ActionFields withUrl(final String url) {
        return new ActionFields(owner, url, newOwner, nonce);
    }

    public ActionFields withNewOwner(final String newOwner) {
        return new ActionFields(owner, url, newOwner, nonce);
    }

    public ActionFields withNonce(final String nonce) {
        return new ActionFields(owner, url, newOwner, nonce);
    }
}
