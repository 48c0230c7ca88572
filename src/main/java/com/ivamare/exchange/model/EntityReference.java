package com.ivamare.exchange.model;

import com.ivamare.exchange.util.PathNavigable;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Identifies the business entity a message is about.
 *
 * @param id Internal entity id, null until the entity is stored
 * @param externalId Id assigned by the source system
 * @param canonicalType Normalised entity type, e.g. "order"
 * @param source Name of the source system
 * @param tenantId Owning tenant
 * @param version Entity version, null when unknown
 */
public record EntityReference(
    String id,
    String externalId,
    String canonicalType,
    String source,
    String tenantId,
    Integer version
) implements PathNavigable {

    public static EntityReference of(String externalId, String canonicalType, String source, String tenantId) {
        return new EntityReference(null, externalId, canonicalType, source, tenantId, 1);
    }

    @Override
    public Optional<Object> attribute(String name) {
        Object value = switch (name) {
            case "id" -> id;
            case "external_id", "externalId" -> externalId;
            case "canonical_type", "canonicalType" -> canonicalType;
            case "source" -> source;
            case "tenant_id", "tenantId" -> tenantId;
            case "version" -> version;
            default -> null;
        };
        return Optional.ofNullable(value);
    }

    /**
     * Wire representation with snake_case keys.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", id);
        map.put("external_id", externalId);
        map.put("canonical_type", canonicalType);
        map.put("source", source);
        map.put("tenant_id", tenantId);
        map.put("version", version);
        return map;
    }
}
