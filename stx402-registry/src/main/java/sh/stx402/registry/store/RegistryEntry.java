// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.registry.store;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import org.jspecify.annotations.Nullable;

/**
 * A registered x402 endpoint as persisted in the key-value store.
 *
 * <p>
 * Timestamps are ISO-8601 instants, the same text the registry has always
 * served. {@code registeredBy} is the payer that funded registration and may
 * differ from {@code owner}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RegistryEntry(
        String id,
        String url,
        String owner,
        String name,
        String description,
        @Nullable String category,
        List<String> tags,
        EntryStatus status,
        @Nullable ProbeData probeData,
        String registeredAt,
        String updatedAt,
        @Nullable String registeredBy) {

    public RegistryEntry {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(registeredAt, "registeredAt");
        Objects.requireNonNull(updatedAt, "updatedAt");
        tags = tags == null ? List.of() : List.copyOf(tags);
        status = status == null ? EntryStatus.UNVERIFIED : status;
    }

    public Instant registeredInstant() {
        return Instant.parse(registeredAt);
    }

    public Instant updatedInstant() {
        return Instant.parse(updatedAt);
    }

    RegistryEntry withOwner(final String newOwner, final Instant now) {
        return new RegistryEntry(id, url, newOwner, name, description, category, tags, status, probeData,
                registeredAt, now.toString(), registeredBy);
    }

    RegistryEntry withStatus(final EntryStatus newStatus, final Instant now) {
        return new RegistryEntry(id, url, owner, name, description, category, tags, newStatus, probeData,
                registeredAt, now.toString(), registeredBy);
    }

    RegistryEntry withProbeData(final ProbeData newProbeData, final Instant now) {
        return new RegistryEntry(id, url, owner, name, description, category, tags, status, newProbeData,
                registeredAt, now.toString(), registeredBy);
    }

    RegistryEntry apply(final EntryPatch patch, final Instant now) {
        return new RegistryEntry(
                id,
                url,
                owner,
                patch.name() != null ? patch.name().trim() : name,
                patch.description() != null ? patch.description().trim() : description,
                patch.category() != null ? EntryMetadata.normalizeCategory(patch.category()) : category,
                patch.tags() != null ? EntryMetadata.normalizeTags(patch.tags()) : tags,
                status,
                probeData,
                registeredAt,
                now.toString(),
                registeredBy);
    }
}
