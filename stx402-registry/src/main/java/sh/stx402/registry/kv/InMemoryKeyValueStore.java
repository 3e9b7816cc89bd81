// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.registry.kv;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Thread-safe in-memory {@link KeyValueStore} for tests and embedded use.
 */
public final class InMemoryKeyValueStore implements KeyValueStore {

    private final ConcurrentSkipListMap<String, String> data = new ConcurrentSkipListMap<>();

    @Override
    public Optional<String> get(final String key) {
        return Optional.ofNullable(data.get(Objects.requireNonNull(key, "key")));
    }

    @Override
    public void put(final String key, final String value) {
        data.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
    }

    @Override
    public boolean putIfAbsent(final String key, final String value) {
        return data.putIfAbsent(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value")) == null;
    }

    @Override
    public boolean compareAndSet(final String key, final String expected, final String value) {
        return data.replace(Objects.requireNonNull(key, "key"),
                Objects.requireNonNull(expected, "expected"),
                Objects.requireNonNull(value, "value"));
    }

    @Override
    public boolean delete(final String key) {
        return data.remove(Objects.requireNonNull(key, "key")) != null;
    }

    @Override
    public boolean deleteIfEquals(final String key, final String expected) {
        return data.remove(Objects.requireNonNull(key, "key"), Objects.requireNonNull(expected, "expected"));
    }

    @Override
    public List<String> listKeys(final String prefix) {
        Objects.requireNonNull(prefix, "prefix");
        return List.copyOf(data.tailMap(prefix, true).keySet().stream()
                .takeWhile(k -> k.startsWith(prefix))
                .toList());
    }

    public int size() {
        return data.size();
    }
}
