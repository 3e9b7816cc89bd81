// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.registry.store;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

/**
 * Descriptive fields supplied at registration.
 *
 * <p>
 * Category and tags are lower-cased and trimmed on construction; a blank
 * category becomes null.
 */
public record EntryMetadata(String name, String description, @Nullable String category, List<String> tags) {

    public EntryMetadata {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(description, "description");
        name = name.trim();
        description = description.trim();
        category = normalizeCategory(category);
        tags = normalizeTags(tags);
    }

    public static EntryMetadata of(final String name, final String description) {
        return new EntryMetadata(name, description, null, List.of());
    }

    static @Nullable String normalizeCategory(final @Nullable String category) {
        if (category == null) {
            return null;
        }
        final String normalized = category.trim().toLowerCase(Locale.ROOT);
        return normalized.isEmpty() ? null : normalized;
    }

    static List<String> normalizeTags(final @Nullable List<String> tags) {
        if (tags == null) {
            return List.of();
        }
        return tags.stream()
                .filter(Objects::nonNull)
                .map(t -> t.trim().toLowerCase(Locale.ROOT))
                .filter(t -> !t.isEmpty())
                .toList();
    }
}
