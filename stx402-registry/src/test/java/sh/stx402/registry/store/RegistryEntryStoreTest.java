// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.registry.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doCallRealMethod;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import sh.stx402.core.error.ErrorCode;
import sh.stx402.core.error.InvalidAddressException;
import sh.stx402.core.error.RegistryException;
import sh.stx402.registry.MutableClock;
import sh.stx402.registry.TestKeys;
import sh.stx402.registry.kv.InMemoryKeyValueStore;
import sh.stx402.registry.kv.KvJson;

class RegistryEntryStoreTest {

    private static final String URL = "https://api.example.com/x";
    private static final EntryMetadata META = new EntryMetadata("Weather", "Forecasts", " Data ", List.of(" AI ", "Weather"));

    private final MutableClock clock = MutableClock.at(1_700_000_000_000L);
    private final InMemoryKeyValueStore kv = new InMemoryKeyValueStore();
    private final RegistryEntryStore store = new RegistryEntryStore(kv, clock);

    @Test
    void registerCreatesUnverifiedEntryAndPointer() {
        RegistryEntry entry = store.register(URL, META, TestKeys.OWNER, TestKeys.OTHER, null);

        assertEquals(UrlNormalizer.entryId(URL), entry.id());
        assertEquals(TestKeys.OWNER, entry.owner());
        assertEquals(TestKeys.OTHER, entry.registeredBy());
        assertEquals(EntryStatus.UNVERIFIED, entry.status());
        assertEquals("data", entry.category());
        assertEquals(List.of("ai", "weather"), entry.tags());
        assertEquals(entry.registeredAt(), entry.updatedAt());
        assertTrue(kv.get(RegistryKeys.entry(TestKeys.OWNER, entry.id())).isPresent());
        assertEquals("{\"owner\":\"" + TestKeys.OWNER + "\",\"id\":\"" + entry.id() + "\"}",
                kv.get(RegistryKeys.urlPointer(URL)).orElseThrow());
    }

    @Test
    void registerStoresCanonicalOwner() {
        RegistryEntry entry = store.register(URL, META, TestKeys.OWNER.toLowerCase(), null, null);

        assertEquals(TestKeys.OWNER, entry.owner());
        assertNull(entry.registeredBy());
    }

    @Test
    void registerRejectsInvalidOwner() {
        assertThrows(InvalidAddressException.class, () -> store.register(URL, META, "SPnotanaddress", null, null));
        assertEquals(0, kv.size());
    }

    @Test
    void secondRegistrationOfSameUrlFails() {
        store.register(URL, META, TestKeys.OWNER, null, null);

        RegistryException e = assertThrows(RegistryException.class,
                () -> store.register("HTTPS://api.example.com/x/", META, TestKeys.OTHER, null, null));
        assertTrue(e.isAlreadyRegistered());
        assertEquals(1, store.listAll(ListQuery.ALL).total());
        assertTrue(store.listByOwner(TestKeys.OTHER).isEmpty());
    }

    @Test
    void sameOwnerCannotRegisterTwice() {
        store.register(URL, META, TestKeys.OWNER, null, null);

        RegistryException e = assertThrows(RegistryException.class,
                () -> store.register(URL, META, TestKeys.OWNER_TESTNET, null, null));
        assertTrue(e.isAlreadyRegistered());
        assertEquals(2, kv.size());
    }

    @Test
    void concurrentRegistrationsYieldExactlyOneEntry() throws Exception {
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger alreadyRegistered = new AtomicInteger();
        List<Future<RegistryEntry>> futures = new ArrayList<>();
        String[] owners = {TestKeys.OWNER, TestKeys.OTHER, TestKeys.STRANGER};
        try {
            for (int i = 0; i < threads; i++) {
                String owner = owners[i % owners.length];
                futures.add(pool.submit(() -> {
                    start.await();
                    try {
                        return store.register(URL, META, owner, null, null);
                    } catch (RegistryException e) {
                        if (e.isAlreadyRegistered()) {
                            alreadyRegistered.incrementAndGet();
                            return null;
                        }
                        throw e;
                    }
                }));
            }
            start.countDown();
            int created = 0;
            for (Future<RegistryEntry> f : futures) {
                if (f.get(10, TimeUnit.SECONDS) != null) {
                    created++;
                }
            }
            assertEquals(1, created);
            assertEquals(threads - 1, alreadyRegistered.get());
        } finally {
            pool.shutdownNow();
        }
        assertEquals(1, kv.listKeys(RegistryKeys.ENTRY_PREFIX).size());
        RegistryEntry winner = store.findByUrl(URL).orElseThrow();
        assertTrue(store.findById(winner.owner(), winner.id()).isPresent());
    }

    @Test
    void danglingPointerIsReplaced() {
        kv.put(RegistryKeys.urlPointer(URL), KvJson.write(new UrlPointer(TestKeys.OTHER, "deadbeefdeadbeef")));

        RegistryEntry entry = store.register(URL, META, TestKeys.OWNER, null, null);

        assertEquals(entry, store.findByUrl(URL).orElseThrow());
    }

    @Test
    void updateAppliesOnlyProvidedFields() {
        RegistryEntry entry = store.register(URL, META, TestKeys.OWNER, null, null);
        clock.advance(Duration.ofMinutes(1));

        RegistryEntry updated = store.update(entry.id(), TestKeys.OWNER_TESTNET,
                EntryPatch.EMPTY.withDescription("  Hourly forecasts ").withTags(List.of("Rain")));

        assertEquals("Hourly forecasts", updated.description());
        assertEquals("Weather", updated.name());
        assertEquals("data", updated.category());
        assertEquals(List.of("rain"), updated.tags());
        assertTrue(updated.updatedInstant().isAfter(entry.updatedInstant()));
        assertEquals(entry.registeredAt(), updated.registeredAt());
        assertEquals(updated, store.findById(TestKeys.OWNER, entry.id()).orElseThrow());
    }

    @Test
    void updateOfUnknownEntryIsNotFound() {
        RegistryException e = assertThrows(RegistryException.class,
                () -> store.update("0000000000000000", TestKeys.OWNER, EntryPatch.EMPTY));
        assertEquals(ErrorCode.ENTRY_NOT_FOUND, e.errorCode());
    }

    @Test
    void updateByNonOwnerIsNotFound() {
        RegistryEntry entry = store.register(URL, META, TestKeys.OWNER, null, null);

        RegistryException e = assertThrows(RegistryException.class,
                () -> store.update(entry.id(), TestKeys.OTHER, EntryPatch.EMPTY.withName("Mine")));
        assertTrue(e.isNotFound());
    }

    @Test
    void transferMovesEntryAndPointer() {
        RegistryEntry entry = store.register(URL, META, TestKeys.OWNER, null, null);
        clock.advance(Duration.ofSeconds(5));

        RegistryEntry moved = store.transfer(entry.id(), TestKeys.OWNER, TestKeys.OTHER);

        assertEquals(TestKeys.OTHER, moved.owner());
        assertTrue(store.findById(TestKeys.OWNER, entry.id()).isEmpty());
        assertEquals(moved, store.findById(TestKeys.OTHER, entry.id()).orElseThrow());
        assertEquals(moved, store.findByUrl(URL).orElseThrow());
        assertEquals(1, kv.listKeys(RegistryKeys.ENTRY_PREFIX).size());
    }

    @Test
    void deleteRemovesEntryAndPointer() {
        RegistryEntry entry = store.register(URL, META, TestKeys.OWNER, null, null);

        RegistryEntry removed = store.delete(entry.id(), TestKeys.OWNER);

        assertEquals(entry, removed);
        assertEquals(0, kv.size());
        assertThrows(RegistryException.class, () -> store.delete(entry.id(), TestKeys.OWNER));
        // the URL is free again
        store.register(URL, META, TestKeys.OTHER, null, null);
    }

    @Test
    void attachProbeKeepsStatus() {
        RegistryEntry entry = store.register(URL, META, TestKeys.OWNER, null, null);
        store.setStatus(entry.id(), EntryStatus.VERIFIED);
        ProbeData data = new ProbeData("SP000000000000000000002Q6VF78", List.of("STX"), Map.of("STX", "1000"),
                42, List.of("POST"), null, clock.instant().toString());

        RegistryEntry probed = store.attachProbe(entry.id(), TestKeys.OWNER, data);

        assertEquals(EntryStatus.VERIFIED, probed.status());
        assertEquals(data, probed.probeData());
    }

    @Test
    void setStatusFindsEntryWithoutOwner() {
        RegistryEntry entry = store.register(URL, META, TestKeys.OWNER, null, null);

        store.setStatus(entry.id(), EntryStatus.REJECTED);

        assertEquals(EntryStatus.REJECTED, store.findByUrl(URL).orElseThrow().status());
        assertTrue(store.listByStatus(EntryStatus.UNVERIFIED).isEmpty());
        assertEquals(1, store.listByStatus(EntryStatus.REJECTED).size());
        assertThrows(RegistryException.class, () -> store.setStatus("ffffffffffffffff", EntryStatus.VERIFIED));
    }

    @Test
    void listByOwnerMatchesAnyNetworkEncoding() {
        store.register(URL, META, TestKeys.OWNER, null, null);
        clock.advance(Duration.ofSeconds(1));
        store.register("https://api.example.com/y", META, TestKeys.OWNER_TESTNET, null, null);
        store.register("https://api.example.com/z", META, TestKeys.OTHER, null, null);

        List<RegistryEntry> mine = store.listByOwner(TestKeys.OWNER);

        assertEquals(2, mine.size());
        assertEquals(URL, mine.get(0).url());
        assertTrue(store.listByOwner("not-an-address").isEmpty());
    }

    @Test
    void listAllFiltersAndPages() {
        for (int i = 0; i < 5; i++) {
            clock.advance(Duration.ofSeconds(1));
            EntryMetadata meta = new EntryMetadata("n" + i, "d", i % 2 == 0 ? "data" : "ai", List.of());
            store.register("https://api.example.com/e" + i, meta, TestKeys.OWNER, null, null);
        }

        EntryPage data = store.listAll(ListQuery.byCategory("DATA"));
        assertEquals(3, data.total());

        EntryPage page = store.listAll(ListQuery.ALL.page(1, 2));
        assertEquals(5, page.total());
        assertEquals(2, page.entries().size());
        assertEquals("n3", page.entries().get(0).name());
        assertTrue(page.hasMore());

        EntryPage tail = store.listAll(ListQuery.ALL.page(10, 2));
        assertTrue(tail.entries().isEmpty());
        assertFalse(tail.hasMore());
    }

    @Test
    void lostRaceIsRetriedOnce() {
        InMemoryKeyValueStore backing = spy(new InMemoryKeyValueStore());
        RegistryEntryStore flaky = new RegistryEntryStore(backing, clock);
        RegistryEntry entry = flaky.register(URL, META, TestKeys.OWNER, null, null);
        doReturn(false).doCallRealMethod().when(backing).compareAndSet(anyString(), anyString(), anyString());

        RegistryEntry updated = flaky.update(entry.id(), TestKeys.OWNER, EntryPatch.EMPTY.withName("Renamed"));

        assertEquals("Renamed", updated.name());
        verify(backing, times(2)).compareAndSet(anyString(), anyString(), anyString());
    }

    @Test
    void persistentConflictSurfaces() {
        InMemoryKeyValueStore backing = spy(new InMemoryKeyValueStore());
        RegistryEntryStore flaky = new RegistryEntryStore(backing, clock);
        RegistryEntry entry = flaky.register(URL, META, TestKeys.OWNER, null, null);
        doReturn(false).when(backing).compareAndSet(anyString(), anyString(), anyString());

        RegistryException e = assertThrows(RegistryException.class,
                () -> flaky.update(entry.id(), TestKeys.OWNER, EntryPatch.EMPTY.withName("Renamed")));

        assertTrue(e.isStorageConflict());
        verify(backing, times(RegistryEntryStore.MAX_ATTEMPTS)).compareAndSet(anyString(), anyString(), anyString());
        assertEquals("Weather", flaky.findByUrl(URL).orElseThrow().name());
    }

    @Test
    void updateLandingOnOldRecordDuringTransferIsKept() {
        InMemoryKeyValueStore backing = spy(new InMemoryKeyValueStore());
        RegistryEntryStore racing = new RegistryEntryStore(backing, clock);
        RegistryEntry entry = racing.register(URL, META, TestKeys.OWNER, null, null);
        String oldKey = RegistryKeys.entry(TestKeys.OWNER, entry.id());
        AtomicBoolean raced = new AtomicBoolean();
        doAnswer(invocation -> {
            if (raced.compareAndSet(false, true)) {
                racing.update(entry.id(), TestKeys.OWNER, EntryPatch.EMPTY.withDescription("Written mid-transfer"));
            }
            return invocation.callRealMethod();
        }).when(backing).deleteIfEquals(eq(oldKey), anyString());

        RegistryEntry moved = racing.transfer(entry.id(), TestKeys.OWNER, TestKeys.OTHER);

        assertTrue(raced.get());
        assertEquals(TestKeys.OTHER, moved.owner());
        assertEquals("Written mid-transfer", moved.description());
        assertTrue(backing.get(oldKey).isEmpty());
        RegistryEntry stored = racing.findById(TestKeys.OTHER, entry.id()).orElseThrow();
        assertEquals("Written mid-transfer", stored.description());
        assertEquals(TestKeys.OTHER, racing.findByUrl(URL).orElseThrow().owner());
    }
}
