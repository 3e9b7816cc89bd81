// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.registry.challenge;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.stx402.core.crypto.sip018.SignedAction;
import sh.stx402.core.types.AddressCodec;
import sh.stx402.core.types.StacksAddress;
import sh.stx402.primitives.Hex;
import sh.stx402.registry.kv.KeyValueStore;
import sh.stx402.registry.kv.KvJson;
import sh.stx402.registry.store.RegistryKeys;

/**
 * Issues and consumes single-use challenges for delete and transfer.
 *
 * <p>
 * Consumption is one conditional delete, so of any number of concurrent attempts
 * exactly one observes {@code true}. Expired records stay readable until purged:
 * {@link #find} returns them so the caller can report an expired timestamp rather
 * than an unknown challenge.
 */
public final class ChallengeGuard {

    private static final Logger log = LoggerFactory.getLogger(ChallengeGuard.class);

    private static final int NONCE_BYTES = 16;

    private final KeyValueStore kv;
    private final Clock clock;
    private final Duration ttl;
    private final SecureRandom random;

    public ChallengeGuard(final KeyValueStore kv, final Clock clock, final Duration ttl) {
        this(kv, clock, ttl, new SecureRandom());
    }

    ChallengeGuard(final KeyValueStore kv, final Clock clock, final Duration ttl, final SecureRandom random) {
        this.kv = Objects.requireNonNull(kv, "kv");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.ttl = Objects.requireNonNull(ttl, "ttl");
        this.random = Objects.requireNonNull(random, "random");
    }

    public Challenge issue(
            final String owner,
            final SignedAction action,
            final @Nullable String url,
            final @Nullable String newOwner) {
        Objects.requireNonNull(action, "action");
        if (action != SignedAction.DELETE_ENDPOINT && action != SignedAction.TRANSFER_OWNERSHIP) {
            throw new IllegalArgumentException("Challenges guard delete and transfer only, not " + action.tag());
        }
        final String canonicalOwner = AddressCodec.canonicalize(owner);
        final byte[] nonce = new byte[NONCE_BYTES];
        random.nextBytes(nonce);
        final long issuedAt = clock.millis();
        final Challenge challenge = new Challenge(
                UUID.randomUUID().toString(),
                canonicalOwner,
                action,
                Hex.encodeNoPrefix(nonce),
                url,
                newOwner,
                issuedAt,
                issuedAt + ttl.toMillis());
        kv.put(RegistryKeys.challenge(canonicalOwner, challenge.challengeId()), KvJson.write(challenge));
        log.debug("Issued {} challenge {} for {}", action.tag(), challenge.challengeId(), canonicalOwner);
        return challenge;
    }

    /**
     * Finds a challenge issued to any encoding of {@code owner}, expired or not.
     */
    public Optional<Challenge> find(final String owner, final String challengeId) {
        if (challengeId == null || challengeId.isBlank()) {
            return Optional.empty();
        }
        final Optional<StacksAddress> parsed = AddressCodec.tryParse(owner);
        if (parsed.isEmpty()) {
            return Optional.empty();
        }
        final StacksAddress address = parsed.get();
        for (String form : List.of(address.value(), address.mainnet().value(), address.testnet().value())) {
            final String key = RegistryKeys.challenge(form, challengeId);
            final Optional<String> json = kv.get(key);
            if (json.isPresent()) {
                return Optional.of(KvJson.read(key, json.get(), Challenge.class));
            }
        }
        return Optional.empty();
    }

    /**
     * Atomically removes the challenge.
     *
     * @return true iff this call consumed it
     */
    public boolean consume(final Challenge challenge) {
        final String key = RegistryKeys.challenge(challenge.owner(), challenge.challengeId());
        final boolean consumed = kv.deleteIfEquals(key, KvJson.write(challenge));
        if (!consumed) {
            log.debug("Challenge {} already consumed", challenge.challengeId());
        }
        return consumed;
    }

    /**
     * Puts back a consumed challenge whose guarded mutation failed.
     */
    public void restore(final Challenge challenge) {
        final String key = RegistryKeys.challenge(challenge.owner(), challenge.challengeId());
        if (kv.putIfAbsent(key, KvJson.write(challenge))) {
            log.info("Restored challenge {} after failed {}", challenge.challengeId(), challenge.action().tag());
        }
    }

    /**
     * Deletes the owner's expired challenges.
     *
     * @return number removed
     */
    public int purgeExpired(final String owner) {
        final String prefix = RegistryKeys.ownerChallenges(AddressCodec.canonicalize(owner));
        int removed = 0;
        for (String key : kv.listKeys(prefix)) {
            final Optional<String> json = kv.get(key);
            if (json.isEmpty()) {
                continue;
            }
            final Challenge challenge = KvJson.read(key, json.get(), Challenge.class);
            if (challenge.isExpired(clock.instant()) && kv.deleteIfEquals(key, json.get())) {
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Purged {} expired challenges under {}", removed, prefix);
        }
        return removed;
    }
}
