package com.ivamare.exchange.store;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Tenant-scoped entity persistence consumed by processors.
 *
 * <p>Every operation takes the tenant explicitly; implementations must never
 * return or modify records of another tenant.
 */
public interface EntityStore {

    /**
     * Records matching all filter entries, e.g. {@code content_hash} and {@code canonical_type}.
     */
    List<EntityRecord> getByFilter(Map<String, Object> filters, String tenantId);

    Optional<EntityRecord> get(String id, String tenantId);

    /**
     * @return the id of the created record
     */
    String create(Map<String, Object> data, String tenantId);

    void update(String id, Map<String, Object> data, String tenantId);

    void delete(String id, String tenantId);

    List<EntityRecord> list(Map<String, Object> filters, String tenantId, Pagination pagination);
}
