// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.registry.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Value of a {@code registry:url-hash:*} key: which entry currently owns the URL.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"owner", "id"})
record UrlPointer(String owner, String id) {

    String entryKey() {
        return RegistryKeys.entry(owner, id);
    }
}
