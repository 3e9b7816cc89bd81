// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.registry.store;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.stx402.core.DebugLogger;
import sh.stx402.core.LogFormatter;
import sh.stx402.core.error.RegistryException;
import sh.stx402.core.types.AddressCodec;
import sh.stx402.registry.kv.KeyValueStore;
import sh.stx402.registry.kv.KvJson;

/**
 * Persistent registry of endpoints on top of a {@link KeyValueStore}.
 *
 * <p>
 * Uniqueness of a normalized URL is anchored on one conditional write to its
 * {@code registry:url-hash:*} pointer. Every mutation is a conditional write on a
 * single key; a lost race surfaces as a {@code STORAGE_CONFLICT} which is retried
 * once after re-reading, then rethrown.
 *
 * <p>
 * Owners are stored under their canonical address. Lookups accept any address with
 * the same fingerprint, trying the mainnet and testnet encodings.
 *
 * <p>
 * This class performs no authorization. Callers decide first.
 */
public final class RegistryEntryStore {

    private static final Logger log = LoggerFactory.getLogger(RegistryEntryStore.class);

    static final int MAX_ATTEMPTS = 2;

    private final KeyValueStore kv;
    private final Clock clock;

    public RegistryEntryStore(final KeyValueStore kv, final Clock clock) {
        this.kv = Objects.requireNonNull(kv, "kv");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Creates an entry for a URL no live entry holds.
     *
     * @param url          endpoint URL, normalized here
     * @param metadata     descriptive fields
     * @param owner        owner address
     * @param registeredBy payer that funded the registration, may be null
     * @param probeData    probe outcome to store with the entry, may be null
     * @return the stored entry
     * @throws RegistryException {@code ALREADY_REGISTERED} if a live entry holds the URL
     */
    public RegistryEntry register(
            final String url,
            final EntryMetadata metadata,
            final String owner,
            final @Nullable String registeredBy,
            final @Nullable ProbeData probeData) {
        Objects.requireNonNull(metadata, "metadata");
        final String normalizedUrl = UrlNormalizer.normalize(url);
        final String canonicalOwner = canonicalOwner(owner);
        final String id = UrlNormalizer.entryId(normalizedUrl);
        final String now = clock.instant().toString();
        final RegistryEntry entry = new RegistryEntry(id, normalizedUrl, canonicalOwner,
                metadata.name(), metadata.description(), metadata.category(), metadata.tags(),
                EntryStatus.UNVERIFIED, probeData, now, now, registeredBy);

        final RegistryEntry stored = withRetry("register", RegistryKeys.urlPointer(normalizedUrl),
                () -> tryRegister(entry));
        log.info("Registered endpoint {} as {} for {}", normalizedUrl, id, canonicalOwner);
        DebugLogger.logRegistry(LogFormatter.formatRegistry("register", id, canonicalOwner));
        return stored;
    }

    private RegistryEntry tryRegister(final RegistryEntry entry) {
        final String pointerKey = RegistryKeys.urlPointer(entry.url());
        final String entryKey = RegistryKeys.entry(entry.owner(), entry.id());
        final UrlPointer pointer = new UrlPointer(entry.owner(), entry.id());
        final String pointerJson = KvJson.write(pointer);
        final String entryJson = KvJson.write(entry);

        final Optional<String> existingPointer = kv.get(pointerKey);
        if (existingPointer.isPresent() && pointsAtLiveEntry(pointerKey, existingPointer.get())) {
            throw RegistryException.alreadyRegistered(entry.url());
        }

        // Entry first, pointer second: a pointer never names an entry that was not written.
        // An existing record under this owner and id means the owner holds, or is creating, this URL.
        if (!kv.putIfAbsent(entryKey, entryJson)) {
            throw RegistryException.alreadyRegistered(entry.url());
        }

        if (kv.putIfAbsent(pointerKey, pointerJson)) {
            return entry;
        }
        final String current = kv.get(pointerKey).orElse(null);
        if (pointerJson.equals(current)) {
            return entry;
        }
        if (current != null && pointsAtLiveEntry(pointerKey, current)) {
            kv.deleteIfEquals(entryKey, entryJson);
            throw RegistryException.alreadyRegistered(entry.url());
        }
        final boolean replaced = current == null
                ? kv.putIfAbsent(pointerKey, pointerJson)
                : kv.compareAndSet(pointerKey, current, pointerJson);
        if (!replaced) {
            kv.deleteIfEquals(entryKey, entryJson);
            throw RegistryException.storageConflict(pointerKey);
        }
        log.warn("Replaced dangling URL pointer {} for {}", pointerKey, entry.url());
        return entry;
    }

    /**
     * Applies a partial update to the owner's entry.
     *
     * @throws RegistryException {@code ENTRY_NOT_FOUND} if the owner holds no such entry
     */
    public RegistryEntry update(final String id, final String owner, final EntryPatch patch) {
        Objects.requireNonNull(patch, "patch");
        final RegistryEntry updated = mutate("update", id, owner, e -> e.apply(patch, clock.instant()));
        DebugLogger.logRegistry(LogFormatter.formatRegistry("update", id, updated.owner()));
        return updated;
    }

    /**
     * Stores a fresh probe outcome. Status is left alone.
     */
    public RegistryEntry attachProbe(final String id, final String owner, final ProbeData probeData) {
        Objects.requireNonNull(probeData, "probeData");
        return mutate("probe", id, owner, e -> e.withProbeData(probeData, clock.instant()));
    }

    /**
     * Sets the status of an entry, whoever owns it.
     *
     * @throws RegistryException {@code ENTRY_NOT_FOUND} if no entry has the id
     */
    public RegistryEntry setStatus(final String id, final EntryStatus status) {
        Objects.requireNonNull(status, "status");
        final RegistryEntry current = findAnyById(id).orElseThrow(() -> RegistryException.notFound(id));
        final RegistryEntry updated = mutate("status", id, current.owner(), e -> e.withStatus(status, clock.instant()));
        log.info("Entry {} status set to {}", id, status.value());
        DebugLogger.logRegistry(LogFormatter.formatRegistry("status:" + status.value(), id, updated.owner()));
        return updated;
    }

    /**
     * Moves an entry to a new owner.
     *
     * <p>
     * Writes the entry under the new owner, swings the URL pointer with a
     * compare-and-set, then removes the old record with a conditional delete. A
     * failed swing removes the new record again, so the URL never has two live entries.
     */
    public RegistryEntry transfer(final String id, final String owner, final String newOwner) {
        final String canonicalNewOwner = canonicalOwner(newOwner);
        final RegistryEntry moved = withRetry("transfer", RegistryKeys.ENTRY_PREFIX + id, () -> {
            final Stored stored = requireEntry(id, owner);
            final RegistryEntry next = stored.entry().withOwner(canonicalNewOwner, clock.instant());
            final String newKey = RegistryKeys.entry(canonicalNewOwner, id);
            final String newJson = KvJson.write(next);
            if (newKey.equals(stored.key())) {
                if (!kv.compareAndSet(newKey, stored.json(), newJson)) {
                    throw RegistryException.storageConflict(newKey);
                }
                return next;
            }
            if (!kv.putIfAbsent(newKey, newJson)) {
                throw RegistryException.storageConflict(newKey);
            }
            final String pointerKey = RegistryKeys.urlPointer(stored.entry().url());
            final String oldPointer = KvJson.write(new UrlPointer(stored.entry().owner(), id));
            final String newPointer = KvJson.write(new UrlPointer(canonicalNewOwner, id));
            if (!kv.compareAndSet(pointerKey, oldPointer, newPointer)) {
                kv.deleteIfEquals(newKey, newJson);
                throw RegistryException.storageConflict(pointerKey);
            }
            return retireOldRecord(stored, newKey, newJson, next, canonicalNewOwner);
        });
        log.info("Transferred entry {} from {} to {}", id, owner, canonicalNewOwner);
        DebugLogger.logRegistry(LogFormatter.formatRegistry("transfer", id, canonicalNewOwner));
        return moved;
    }

    /**
     * Removes the pre-transfer record. A write that landed on it after the copy is
     * carried over to the new record before the old one goes away.
     */
    private RegistryEntry retireOldRecord(
            final Stored stored,
            final String newKey,
            final String newJson,
            final RegistryEntry next,
            final String newOwner) {
        String oldJson = stored.json();
        String currentJson = newJson;
        RegistryEntry current = next;
        while (!kv.deleteIfEquals(stored.key(), oldJson)) {
            final Optional<String> latest = kv.get(stored.key());
            if (latest.isEmpty()) {
                log.warn("Record {} vanished during transfer to {}", stored.key(), newOwner);
                return current;
            }
            final RegistryEntry merged = KvJson.read(stored.key(), latest.get(), RegistryEntry.class)
                    .withOwner(newOwner, clock.instant());
            final String mergedJson = KvJson.write(merged);
            if (!kv.compareAndSet(newKey, currentJson, mergedJson)) {
                throw RegistryException.storageConflict(newKey);
            }
            log.debug("Carried concurrent write on {} over to {}", stored.key(), newKey);
            oldJson = latest.get();
            currentJson = mergedJson;
            current = merged;
        }
        return current;
    }

    /**
     * Removes the owner's entry and releases its URL.
     *
     * @return the entry as it was before deletion
     */
    public RegistryEntry delete(final String id, final String owner) {
        final RegistryEntry removed = withRetry("delete", RegistryKeys.ENTRY_PREFIX + id, () -> {
            final Stored stored = requireEntry(id, owner);
            if (!kv.deleteIfEquals(stored.key(), stored.json())) {
                throw RegistryException.storageConflict(stored.key());
            }
            final String pointerKey = RegistryKeys.urlPointer(stored.entry().url());
            kv.deleteIfEquals(pointerKey, KvJson.write(new UrlPointer(stored.entry().owner(), id)));
            return stored.entry();
        });
        log.info("Deleted entry {} ({}) owned by {}", id, removed.url(), removed.owner());
        DebugLogger.logRegistry(LogFormatter.formatRegistry("delete", id, removed.owner()));
        return removed;
    }

    public Optional<RegistryEntry> findById(final String owner, final String id) {
        return findStored(owner, id).map(Stored::entry);
    }

    public Optional<RegistryEntry> findByUrl(final String url) {
        final String normalizedUrl = UrlNormalizer.normalize(url);
        final String pointerKey = RegistryKeys.urlPointer(normalizedUrl);
        return kv.get(pointerKey)
                .map(json -> KvJson.read(pointerKey, json, UrlPointer.class))
                .flatMap(p -> kv.get(p.entryKey()).map(json -> KvJson.read(p.entryKey(), json, RegistryEntry.class)));
    }

    /**
     * Looks an entry up by id alone, scanning all owners.
     */
    public Optional<RegistryEntry> findAnyById(final String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        final String suffix = ":" + id;
        return kv.listKeys(RegistryKeys.ENTRY_PREFIX).stream()
                .filter(k -> k.endsWith(suffix))
                .findFirst()
                .flatMap(k -> kv.get(k).map(json -> KvJson.read(k, json, RegistryEntry.class)));
    }

    public List<RegistryEntry> listByOwner(final String owner) {
        final List<RegistryEntry> result = new ArrayList<>();
        for (String form : ownerForms(owner)) {
            for (String key : kv.listKeys(RegistryKeys.ownerEntries(form))) {
                kv.get(key).ifPresent(json -> result.add(KvJson.read(key, json, RegistryEntry.class)));
            }
        }
        result.sort(Comparator.comparing(RegistryEntry::registeredInstant).thenComparing(RegistryEntry::id));
        return result;
    }

    public List<RegistryEntry> listByStatus(final EntryStatus status) {
        Objects.requireNonNull(status, "status");
        return loadAll().stream().filter(e -> e.status() == status).toList();
    }

    public EntryPage listAll(final ListQuery query) {
        final ListQuery q = query == null ? ListQuery.ALL : query;
        final List<RegistryEntry> matching = loadAll().stream().filter(q::matches).toList();
        final int from = Math.min(q.offset(), matching.size());
        final int to = Math.min(from + q.limit(), matching.size());
        return new EntryPage(matching.subList(from, to), matching.size(), q.offset(), q.limit());
    }

    private List<RegistryEntry> loadAll() {
        final List<RegistryEntry> all = new ArrayList<>();
        for (String key : kv.listKeys(RegistryKeys.ENTRY_PREFIX)) {
            kv.get(key).ifPresent(json -> all.add(KvJson.read(key, json, RegistryEntry.class)));
        }
        all.sort(Comparator.comparing(RegistryEntry::registeredInstant).reversed().thenComparing(RegistryEntry::id));
        return all;
    }

    private RegistryEntry mutate(
            final String operation,
            final String id,
            final String owner,
            final UnaryOperator<RegistryEntry> change) {
        return withRetry(operation, RegistryKeys.ENTRY_PREFIX + id, () -> {
            final Stored stored = requireEntry(id, owner);
            final RegistryEntry next = change.apply(stored.entry());
            if (!kv.compareAndSet(stored.key(), stored.json(), KvJson.write(next))) {
                throw RegistryException.storageConflict(stored.key());
            }
            return next;
        });
    }

    private <T> T withRetry(final String operation, final String key, final Supplier<T> attempt) {
        for (int i = 1; ; i++) {
            try {
                return attempt.get();
            } catch (RegistryException e) {
                if (!e.isStorageConflict() || i >= MAX_ATTEMPTS) {
                    throw e;
                }
                log.warn("Storage conflict during {} on {}, retrying", operation, key);
                DebugLogger.logRegistry(LogFormatter.formatConflict(operation, key, i));
            }
        }
    }

    private Stored requireEntry(final String id, final String owner) {
        return findStored(owner, id).orElseThrow(() -> RegistryException.notFound(id));
    }

    private Optional<Stored> findStored(final String owner, final String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        for (String form : ownerForms(owner)) {
            final String key = RegistryKeys.entry(form, id);
            final Optional<String> json = kv.get(key);
            if (json.isPresent()) {
                return Optional.of(new Stored(key, json.get(), KvJson.read(key, json.get(), RegistryEntry.class)));
            }
        }
        return Optional.empty();
    }

    private boolean pointsAtLiveEntry(final String pointerKey, final String pointerJson) {
        final UrlPointer pointer = KvJson.read(pointerKey, pointerJson, UrlPointer.class);
        return kv.get(pointer.entryKey()).isPresent();
    }

    private static String canonicalOwner(final String owner) {
        return AddressCodec.canonicalize(owner);
    }

    /**
     * Canonical, mainnet and testnet encodings of an owner, deduplicated.
     * An unparseable owner yields no forms.
     */
    static Set<String> ownerForms(final String owner) {
        final Set<String> forms = new LinkedHashSet<>();
        AddressCodec.tryParse(owner).ifPresent(a -> {
            forms.add(a.value());
            forms.add(a.mainnet().value());
            forms.add(a.testnet().value());
        });
        return forms;
    }

    private record Stored(String key, String json, RegistryEntry entry) {
    }
}
