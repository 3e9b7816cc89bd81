// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.registry.store;

/**
 * Key layout of the registry in the key-value store.
 */
public final class RegistryKeys {

    public static final String ENTRY_PREFIX = "registry:entry:";
    public static final String URL_HASH_PREFIX = "registry:url-hash:";
    public static final String CHALLENGE_PREFIX = "registry:challenge:";

    private RegistryKeys() {
    }

    public static String entry(final String owner, final String id) {
        return ENTRY_PREFIX + owner + ":" + id;
    }

    public static String ownerEntries(final String owner) {
        return ENTRY_PREFIX + owner + ":";
    }

    public static String urlPointer(final String normalizedUrl) {
        return URL_HASH_PREFIX + UrlNormalizer.urlHash(normalizedUrl);
    }

    public static String challenge(final String owner, final String challengeId) {
        return CHALLENGE_PREFIX + owner + ":" + challengeId;
    }

    public static String ownerChallenges(final String owner) {
        return CHALLENGE_PREFIX + owner + ":";
    }
}
