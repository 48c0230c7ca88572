package com.ivamare.exchange.store;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A stored entity as returned by an {@link EntityStore}.
 *
 * @param id Store-assigned id
 * @param tenantId Owning tenant
 * @param externalId Id in the source system
 * @param canonicalType Normalised entity type
 * @param source Source system name
 * @param contentHash Hash of the entity content
 * @param version Entity version
 * @param data Entity attributes
 * @param createdAt Creation time
 * @param updatedAt Last update time
 */
public record EntityRecord(
    String id,
    String tenantId,
    String externalId,
    String canonicalType,
    String source,
    String contentHash,
    int version,
    Map<String, Object> data,
    Instant createdAt,
    Instant updatedAt
) {
    public EntityRecord {
        data = data != null ? Collections.unmodifiableMap(new LinkedHashMap<>(data)) : Map.of();
    }
}
