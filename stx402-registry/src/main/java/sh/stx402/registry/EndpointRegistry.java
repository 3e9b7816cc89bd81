// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.registry;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.stx402.core.crypto.sip018.ActionFields;
import sh.stx402.core.crypto.sip018.SignedAction;
import sh.stx402.core.crypto.sip018.StructuredMessage;
import sh.stx402.core.error.AuthorizationException;
import sh.stx402.core.error.DenialReason;
import sh.stx402.core.error.ErrorCode;
import sh.stx402.core.error.RegistryException;
import sh.stx402.core.payment.PaymentOrigin;
import sh.stx402.core.payment.SettlementOutcome;
import sh.stx402.core.payment.StacksTransactionReader;
import sh.stx402.core.types.AddressCodec;
import sh.stx402.core.types.StacksAddress;
import sh.stx402.registry.auth.AdminPolicy;
import sh.stx402.registry.auth.AuthMethod;
import sh.stx402.registry.auth.AuthorizationEngine;
import sh.stx402.registry.auth.AuthorizationRequest;
import sh.stx402.registry.auth.Operation;
import sh.stx402.registry.auth.SignatureProof;
import sh.stx402.registry.challenge.Challenge;
import sh.stx402.registry.challenge.ChallengeGuard;
import sh.stx402.registry.challenge.ReplayWindow;
import sh.stx402.registry.challenge.SignatureRequest;
import sh.stx402.registry.config.RegistryConfig;
import sh.stx402.registry.kv.KeyValueStore;
import sh.stx402.registry.probe.EndpointProber;
import sh.stx402.registry.probe.ProbeResult;
import sh.stx402.registry.store.EntryMetadata;
import sh.stx402.registry.store.EntryPage;
import sh.stx402.registry.store.EntryPatch;
import sh.stx402.registry.store.EntryStatus;
import sh.stx402.registry.store.ListQuery;
import sh.stx402.registry.store.RegistryEntry;
import sh.stx402.registry.store.RegistryEntryStore;
import sh.stx402.registry.store.UrlNormalizer;

/**
 * Entry point of the endpoint registry.
 *
 * <p>
 * Validates input, asks the {@link AuthorizationEngine} for a decision, and only
 * then touches the {@link RegistryEntryStore}. Denials surface as
 * {@link AuthorizationException} carrying the reason; store failures as
 * {@link RegistryException}.
 *
 * <p>
 * Delete and transfer are two-step: {@code requestDelete}/{@code requestTransfer}
 * issue a challenge and return what to sign; {@code delete}/{@code transfer}
 * take the signed answer. The challenge is consumed before the entry is touched
 * and put back if the mutation fails.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * EndpointRegistry registry = EndpointRegistry.create(RegistryConfig.defaults(), kv, prober);
 * Registration reg = registry.register(url, owner, EntryMetadata.of("Weather", "Forecasts"), payment);
 *
 * SignatureRequest request = registry.requestDelete(url, owner);
 * String signature = wallet.signStructured(request.domain(), request.message());
 * registry.delete(url, owner, new ChallengeAnswer(request.challengeId(), signature));
 * }</pre>
 */
public final class EndpointRegistry {

    private static final Logger log = LoggerFactory.getLogger(EndpointRegistry.class);

    private final RegistryConfig config;
    private final RegistryEntryStore store;
    private final ChallengeGuard challenges;
    private final AuthorizationEngine engine;
    private final AdminPolicy adminPolicy;
    private final EndpointProber prober;
    private final Clock clock;

    public EndpointRegistry(
            final RegistryConfig config,
            final KeyValueStore kv,
            final EndpointProber prober,
            final Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.prober = Objects.requireNonNull(prober, "prober");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.store = new RegistryEntryStore(kv, clock);
        this.challenges = new ChallengeGuard(kv, clock, config.challengeTtl());
        this.engine = new AuthorizationEngine(
                config.network().domain(),
                new ReplayWindow(config.replayWindow(), config.futureSkew()),
                clock);
        this.adminPolicy = new AdminPolicy(config.adminAddress());
    }

    public static EndpointRegistry create(
            final RegistryConfig config, final KeyValueStore kv, final EndpointProber prober) {
        return new EndpointRegistry(config, kv, prober, Clock.systemUTC());
    }

    /**
     * Probes and registers an endpoint.
     *
     * @param owner   owner address, or null to use the payer
     * @param payment payment that funded the call; its payer is recorded as {@code registeredBy}
     * @throws RegistryException {@code ALREADY_REGISTERED}, or the probe's error code when it did not complete
     */
    public Registration register(
            final String url,
            final @Nullable String owner,
            final EntryMetadata metadata,
            final PaymentOrigin payment) {
        validateMetadata(metadata);
        final String normalizedUrl = UrlNormalizer.normalize(url);
        final Optional<String> payer = payerAddress(payment);
        final String resolvedOwner;
        if (owner != null && !owner.isBlank()) {
            resolvedOwner = AddressCodec.canonicalize(owner);
        } else {
            resolvedOwner = payer.orElseThrow(
                    () -> RegistryException.invalidInput("owner is required when the payer cannot be determined"));
        }
        engine.decide(AuthorizationRequest.builder(Operation.REGISTER, resolvedOwner).url(normalizedUrl).build())
                .orThrow(Operation.REGISTER);

        if (store.findByUrl(normalizedUrl).isPresent()) {
            throw RegistryException.alreadyRegistered(normalizedUrl);
        }
        final ProbeResult probe = prober.probe(normalizedUrl, config.probeTimeout());
        if (!probe.success()) {
            throw new RegistryException(
                    probe.errorCode() != null ? probe.errorCode() : ErrorCode.PROBE_UNREACHABLE,
                    "Failed to probe endpoint: " + probe.error());
        }
        final RegistryEntry entry = store.register(normalizedUrl, metadata, resolvedOwner,
                payer.orElse(resolvedOwner), probe.data());
        return new Registration(entry, probe);
    }

    /**
     * Applies a patch to an entry after the owner proved ownership by signature or payment.
     *
     * @param reprobe re-probe the URL and store the fresh result when it completes
     */
    public RegistryEntry update(
            final String url,
            final String owner,
            final EntryPatch patch,
            final OwnerProof proof,
            final boolean reprobe) {
        Objects.requireNonNull(patch, "patch");
        validatePatch(patch);
        final String claimed = AddressCodec.canonicalize(owner);
        final RegistryEntry entry = store.findByUrl(url)
                .orElseThrow(() -> RegistryException.notFound(url));
        final AuthMethod method = authorizeOwner(Operation.UPDATE, claimed, entry, proof);

        RegistryEntry updated = store.update(entry.id(), entry.owner(), patch);
        if (reprobe) {
            final ProbeResult probe = prober.probe(entry.url(), config.probeTimeout());
            if (probe.success() && probe.data() != null) {
                updated = store.attachProbe(entry.id(), entry.owner(), probe.data());
            } else {
                log.info("Re-probe of {} did not yield payment data: {}", entry.url(), probe.error());
            }
        }
        log.info("Updated entry {} via {}", entry.id(), method.label());
        return updated;
    }

    /**
     * Lists the caller's entries after it proved ownership of {@code owner}.
     */
    public List<RegistryEntry> listMine(final String owner, final OwnerProof proof) {
        final String claimed = AddressCodec.canonicalize(owner);
        authorizeOwner(Operation.LIST_MINE, claimed, null, proof);
        return store.listByOwner(claimed);
    }

    /**
     * What to sign to authenticate an update or list-mine call by signature.
     */
    public SignatureRequest ownerSignatureRequest(
            final Operation operation, final String owner, final @Nullable String url) {
        if (operation != Operation.UPDATE && operation != Operation.LIST_MINE) {
            throw new IllegalArgumentException("Owner signature requests cover update and list-mine only");
        }
        final String claimed = AddressCodec.canonicalize(owner);
        ActionFields fields = ActionFields.owner(claimed);
        if (operation == Operation.UPDATE) {
            fields = fields.withUrl(UrlNormalizer.normalize(url));
        }
        final long now = clock.millis();
        final StructuredMessage message = StructuredMessage.build(operation.action(), fields, now);
        return SignatureRequest.forMessage(message, engine.domain(), now + config.replayWindow().toMillis());
    }

    /**
     * The text to sign for a simple-mode update or list-mine proof made at {@code timestamp}.
     */
    public String simpleSignatureText(
            final Operation operation, final String owner, final @Nullable String url, final long timestamp) {
        if (operation != Operation.UPDATE && operation != Operation.LIST_MINE) {
            throw new IllegalArgumentException("Owner signature requests cover update and list-mine only");
        }
        final String normalizedUrl = operation == Operation.UPDATE ? UrlNormalizer.normalize(url) : null;
        return SignatureProof.simpleText(
                engine.domain(), operation, AddressCodec.canonicalize(owner), normalizedUrl, timestamp);
    }

    /**
     * Issues a delete challenge for the owner's entry.
     */
    public SignatureRequest requestDelete(final String url, final String owner) {
        final String claimed = AddressCodec.canonicalize(owner);
        final RegistryEntry entry = requireOwnedEntry(url, claimed, Operation.DELETE);
        final Challenge challenge = challenges.issue(claimed, SignedAction.DELETE_ENDPOINT, entry.url(), null);
        return SignatureRequest.forChallenge(challenge, engine.domain());
    }

    /**
     * Deletes an entry with a signed challenge.
     *
     * @return the removed entry
     */
    public RegistryEntry delete(final String url, final String owner, final ChallengeAnswer answer) {
        final String claimed = AddressCodec.canonicalize(owner);
        final String normalizedUrl = UrlNormalizer.normalize(url);
        final Optional<RegistryEntry> entry = store.findByUrl(normalizedUrl);
        final Challenge challenge = authorizeChallenged(
                Operation.DELETE, claimed, entry.orElse(null), normalizedUrl, null, answer);
        try {
            final RegistryEntry target = entry.orElseThrow(() -> RegistryException.notFound(normalizedUrl));
            return store.delete(target.id(), target.owner());
        } catch (RuntimeException e) {
            challenges.restore(challenge);
            throw e;
        }
    }

    /**
     * Issues a transfer challenge for the owner's entry.
     *
     * @throws RegistryException {@code INVALID_INPUT} when {@code newOwner} is the same identity
     */
    public SignatureRequest requestTransfer(final String url, final String owner, final String newOwner) {
        final String claimed = AddressCodec.canonicalize(owner);
        final String target = validateNewOwner(claimed, newOwner);
        final RegistryEntry entry = requireOwnedEntry(url, claimed, Operation.TRANSFER);
        final Challenge challenge = challenges.issue(claimed, SignedAction.TRANSFER_OWNERSHIP, entry.url(), target);
        return SignatureRequest.forChallenge(challenge, engine.domain());
    }

    /**
     * Transfers an entry with a signed challenge.
     *
     * @return the entry under its new owner
     */
    public RegistryEntry transfer(
            final String url, final String owner, final String newOwner, final ChallengeAnswer answer) {
        final String claimed = AddressCodec.canonicalize(owner);
        final String target = validateNewOwner(claimed, newOwner);
        final String normalizedUrl = UrlNormalizer.normalize(url);
        final Optional<RegistryEntry> entry = store.findByUrl(normalizedUrl);
        final Challenge challenge = authorizeChallenged(
                Operation.TRANSFER, claimed, entry.orElse(null), normalizedUrl, target, answer);
        try {
            final RegistryEntry current = entry.orElseThrow(() -> RegistryException.notFound(normalizedUrl));
            return store.transfer(current.id(), current.owner(), target);
        } catch (RuntimeException e) {
            challenges.restore(challenge);
            throw e;
        }
    }

    /**
     * Looks an entry up by URL, optionally probing it live.
     */
    public EntryDetails details(final String url, final boolean liveProbe) {
        final RegistryEntry entry = store.findByUrl(url).orElseThrow(() -> RegistryException.notFound(url));
        return withLiveProbe(entry, liveProbe);
    }

    /**
     * Looks an entry up by owner and id, optionally probing it live.
     */
    public EntryDetails details(final String owner, final String id, final boolean liveProbe) {
        final RegistryEntry entry = store.findById(owner, id).orElseThrow(() -> RegistryException.notFound(id));
        return withLiveProbe(entry, liveProbe);
    }

    public EntryPage list(final ListQuery query) {
        return store.listAll(query);
    }

    /**
     * Entries awaiting review. Administrator only.
     */
    public List<RegistryEntry> adminPending(final String caller) {
        adminPolicy.require(caller, "admin-pending");
        return store.listByStatus(EntryStatus.UNVERIFIED);
    }

    /**
     * Verifies or rejects an entry. Administrator only.
     */
    public RegistryEntry adminVerify(final String caller, final String url, final AdminDecision decision) {
        Objects.requireNonNull(decision, "decision");
        adminPolicy.require(caller, "admin-verify");
        final RegistryEntry entry = store.findByUrl(url).orElseThrow(() -> RegistryException.notFound(url));
        return store.setStatus(entry.id(), decision.status());
    }

    /**
     * Drops the owner's expired challenges.
     */
    public int purgeExpiredChallenges(final String owner) {
        return challenges.purgeExpired(owner);
    }

    private EntryDetails withLiveProbe(final RegistryEntry entry, final boolean liveProbe) {
        if (!liveProbe) {
            return new EntryDetails(entry, null);
        }
        return new EntryDetails(entry, prober.probe(entry.url(), config.probeTimeout()));
    }

    private AuthMethod authorizeOwner(
            final Operation operation,
            final String claimed,
            final @Nullable RegistryEntry entry,
            final OwnerProof proof) {
        final OwnerProof offered = proof == null ? OwnerProof.NONE : proof;
        final AuthorizationRequest.Builder request = AuthorizationRequest.builder(operation, claimed)
                .payment(offered.payment());
        if (entry != null) {
            request.entryOwner(entry.owner()).url(entry.url());
        }
        if (offered.hasSignature()) {
            if (offered.timestamp() == null) {
                throw RegistryException.invalidInput("timestamp is required when providing signature");
            }
            if (offered.simpleMessage() != null) {
                request.proof(SignatureProof.simple(offered.simpleMessage(), offered.timestamp(), offered.signature()));
            } else {
                ActionFields fields = ActionFields.owner(claimed);
                if (entry != null) {
                    fields = fields.withUrl(entry.url());
                }
                final StructuredMessage message = StructuredMessage.build(operation.action(), fields, offered.timestamp());
                request.proof(SignatureProof.structured(message, offered.signature()));
            }
        }
        return engine.decide(request.build()).orThrow(operation);
    }

    private Challenge authorizeChallenged(
            final Operation operation,
            final String claimed,
            final @Nullable RegistryEntry entry,
            final String normalizedUrl,
            final @Nullable String newOwner,
            final ChallengeAnswer answer) {
        final Challenge challenge = answer == null
                ? null
                : challenges.find(claimed, answer.challengeId()).orElse(null);
        final AuthorizationRequest.Builder request = AuthorizationRequest.builder(operation, claimed)
                .url(normalizedUrl)
                .newOwner(newOwner)
                .challenge(challenge);
        if (entry != null) {
            request.entryOwner(entry.owner());
        }
        if (answer != null) {
            request.proof(SignatureProof.challengeResponse(answer.signature()));
        }
        engine.decide(request.build()).orThrow(operation);
        if (!challenges.consume(challenge)) {
            throw new AuthorizationException(operation.label(), DenialReason.CHALLENGE_INVALID_OR_CONSUMED);
        }
        return challenge;
    }

    private RegistryEntry requireOwnedEntry(final String url, final String claimed, final Operation operation) {
        final RegistryEntry entry = store.findByUrl(url).orElseThrow(() -> RegistryException.notFound(url));
        if (!AddressCodec.equivalent(entry.owner(), claimed)) {
            throw new AuthorizationException(operation.label(), DenialReason.ADDRESS_MISMATCH);
        }
        return entry;
    }

    private String validateNewOwner(final String claimed, final String newOwner) {
        if (newOwner == null || newOwner.isBlank()) {
            throw RegistryException.invalidInput("newOwner is required");
        }
        final String target = AddressCodec.canonicalize(newOwner);
        if (AddressCodec.equivalent(claimed, target)) {
            throw RegistryException.invalidInput("Cannot transfer to the same address");
        }
        return target;
    }

    private void validateMetadata(final EntryMetadata metadata) {
        Objects.requireNonNull(metadata, "metadata");
        validateName(metadata.name());
        validateDescription(metadata.description());
    }

    private void validatePatch(final EntryPatch patch) {
        if (patch.name() != null) {
            validateName(patch.name().trim());
        }
        if (patch.description() != null) {
            validateDescription(patch.description().trim());
        }
    }

    private void validateName(final String name) {
        if (name.isEmpty()) {
            throw RegistryException.invalidInput("name cannot be empty");
        }
        if (name.length() > config.maxNameLength()) {
            throw RegistryException.invalidInput("name must be " + config.maxNameLength() + " characters or less");
        }
    }

    private void validateDescription(final String description) {
        if (description.isEmpty()) {
            throw RegistryException.invalidInput("description cannot be empty");
        }
        if (description.length() > config.maxDescriptionLength()) {
            throw RegistryException.invalidInput(
                    "description must be " + config.maxDescriptionLength() + " characters or less");
        }
    }

    /**
     * Address of whoever paid, from the settlement report or else the signed transaction.
     */
    static Optional<String> payerAddress(final PaymentOrigin payment) {
        if (payment == null || payment.isEmpty()) {
            return Optional.empty();
        }
        final SettlementOutcome settlement = payment.settlement();
        if (settlement != null && settlement.hasSender()) {
            final Optional<String> sender = AddressCodec.tryParse(settlement.sender()).map(StacksAddress::value);
            if (sender.isPresent()) {
                return sender;
            }
        }
        if (payment.signedTxHex() == null || payment.signedTxHex().isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(StacksTransactionReader.read(payment.signedTxHex()).signerAddress().value());
        } catch (IllegalArgumentException e) {
            log.warn("Could not read payer from signed transaction: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
