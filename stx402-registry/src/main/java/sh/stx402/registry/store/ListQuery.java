// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.registry.store;

import java.util.Locale;

import org.jspecify.annotations.Nullable;

/**
 * Filter and page for {@link RegistryEntryStore#listAll(ListQuery)}.
 */
public record ListQuery(@Nullable String category, @Nullable EntryStatus status, int offset, int limit) {

    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 200;

    public static final ListQuery ALL = new ListQuery(null, null, 0, DEFAULT_LIMIT);

    public ListQuery {
        category = category == null || category.isBlank() ? null : category.trim().toLowerCase(Locale.ROOT);
        offset = Math.max(0, offset);
        limit = limit <= 0 ? DEFAULT_LIMIT : Math.min(limit, MAX_LIMIT);
    }

    public static ListQuery byStatus(final EntryStatus status) {
        return new ListQuery(null, status, 0, DEFAULT_LIMIT);
    }

    public static ListQuery byCategory(final String category) {
        return new ListQuery(category, null, 0, DEFAULT_LIMIT);
    }

    public ListQuery page(final int newOffset, final int newLimit) {
        return new ListQuery(category, status, newOffset, newLimit);
    }

    boolean matches(final RegistryEntry entry) {
        if (status != null && entry.status() != status) {
            return false;
        }
        return category == null || category.equals(entry.category());
    }
}
