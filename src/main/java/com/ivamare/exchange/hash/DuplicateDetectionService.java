package com.ivamare.exchange.hash;

import com.ivamare.exchange.exception.ExchangeException;
import com.ivamare.exchange.store.EntityRecord;
import com.ivamare.exchange.store.EntityStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Detects entities whose content was already seen.
 *
 * <p>Content is hashed with a {@link ContentHasher} and looked up in the
 * entity store by hash and canonical type. Same-source matches with the same
 * external id are new versions of a known entity; other matches are
 * duplicates flagged for review.
 */
public class DuplicateDetectionService {

    private static final Logger log = LoggerFactory.getLogger(DuplicateDetectionService.class);

    static final int HIGH_CONFIDENCE = 90;
    static final int MEDIUM_CONFIDENCE = 50;

    private final EntityStore entityStore;
    private final ContentHasher contentHasher;

    public DuplicateDetectionService(EntityStore entityStore, ContentHasher contentHasher) {
        this.entityStore = entityStore;
        this.contentHasher = contentHasher;
    }

    public DuplicateDetectionResult detect(Map<String, Object> content, String canonicalType, String source,
                                           String externalId, String tenantId) {
        return detect(content, canonicalType, source, externalId, HashConfig.defaultConfig(), null, tenantId);
    }

    /**
     * Check content against stored entities of the same type.
     *
     * @param content entity content to check
     * @param canonicalType entity type
     * @param source source system of the content
     * @param externalId external id of the content, may be null
     * @param hashConfig fields to hash
     * @param excludeEntityId entity to leave out of the matches, may be null
     * @param tenantId tenant to search in
     * @throws ExchangeException if the store cannot be queried
     */
    public DuplicateDetectionResult detect(Map<String, Object> content, String canonicalType, String source,
                                           String externalId, HashConfig hashConfig, String excludeEntityId,
                                           String tenantId) {
        String contentHash = contentHasher.computeHash(content, hashConfig);

        List<EntityRecord> matches;
        try {
            Map<String, Object> filters = new LinkedHashMap<>();
            filters.put("content_hash", contentHash);
            filters.put("canonical_type", canonicalType);
            matches = entityStore.getByFilter(filters, tenantId).stream()
                .filter(e -> excludeEntityId == null || !excludeEntityId.equals(e.id()))
                .toList();
        } catch (RuntimeException e) {
            log.error("Duplicate detection failed for {} from {} (external id {})",
                canonicalType, source, externalId, e);
            throw new ExchangeException("Duplicate detection failed: " + e.getMessage(), e);
        }

        DuplicateDetectionResult result = analyze(matches, contentHash, source, externalId);
        log.debug("Duplicate detection for {} {}: {} (confidence {})",
            canonicalType, externalId, result.reason(), result.confidence());
        return result;
    }

    DuplicateDetectionResult analyze(List<EntityRecord> matches, String contentHash,
                                     String source, String externalId) {
        if (matches.isEmpty()) {
            return DuplicateDetectionResult.notDuplicate(contentHash);
        }

        List<String> ids = matches.stream().map(EntityRecord::id).toList();
        List<String> externalIds = matches.stream().map(EntityRecord::externalId).toList();
        List<EntityRecord> sameSource = matches.stream().filter(e -> Objects.equals(source, e.source())).toList();

        int confidence;
        String reason;
        boolean suspicious;
        if (!sameSource.isEmpty()) {
            confidence = HIGH_CONFIDENCE;
            if (externalId != null && sameSource.stream().anyMatch(e -> externalId.equals(e.externalId()))) {
                reason = DuplicateDetectionResult.NEW_VERSION;
                suspicious = false;
            } else {
                reason = DuplicateDetectionResult.SAME_SOURCE_CONTENT_MATCH;
                suspicious = true;
            }
        } else {
            confidence = MEDIUM_CONFIDENCE;
            reason = DuplicateDetectionResult.CROSS_SOURCE_CONTENT_MATCH;
            suspicious = true;
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("same_source_matches", sameSource.size());
        metadata.put("total_matches", matches.size());
        metadata.put("source", source);

        return new DuplicateDetectionResult(
            true, confidence, reason, ids, externalIds, contentHash, Instant.now(), suspicious, metadata);
    }
}
