// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.registry.store;

import java.util.List;

import org.jspecify.annotations.Nullable;

/**
 * Partial update of an entry's descriptive fields. Null components are left unchanged.
 */
public record EntryPatch(
        @Nullable String name,
        @Nullable String description,
        @Nullable String category,
        @Nullable List<String> tags) {

    public static final EntryPatch EMPTY = new EntryPatch(null, null, null, null);

    public boolean isEmpty() {
        return name == null && description == null && category == null && tags == null;
    }

    public EntryPatch withName(final String name) {
        return new EntryPatch(name, description, category, tags);
    }

    public EntryPatch withDescription(final String description) {
        return new EntryPatch(name, description, category, tags);
    }

    public EntryPatch withCategory(final String category) {
        return new EntryPatch(name, description, category, tags);
    }

    public EntryPatch withTags(final List<String> tags) {
        return new EntryPatch(name, description, category, tags);
    }
}
