// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.registry.kv;

import java.util.List;
import java.util.Optional;

/**
 * The key-value collaborator the registry persists to.
 *
 * <p>
 * Implementations must give read-after-write consistency per key and atomic
 * per-key conditional writes. No multi-key transactions are assumed: every
 * invariant the registry keeps is anchored on a single conditional write.
 *
 * <p>
 * A backend may throw {@link sh.stx402.core.error.RegistryException} with
 * {@code STORAGE_CONFLICT} when a conditional write could not be decided; callers
 * treat it like a lost race.
 */
public interface KeyValueStore {

    Optional<String> get(String key);

    void put(String key, String value);

    /**
     * @return true if the key was absent and is now set
     */
    boolean putIfAbsent(String key, String value);

    /**
     * @return true if the key held {@code expected} and now holds {@code value}
     */
    boolean compareAndSet(String key, String expected, String value);

    /**
     * @return true if the key existed
     */
    boolean delete(String key);

    /**
     * Deletes the key only if it still holds {@code expected}.
     *
     * @return true if this call removed it
     */
    boolean deleteIfEquals(String key, String expected);

    /**
     * @return keys starting with {@code prefix}, in ascending order
     */
    List<String> listKeys(String prefix);
}
