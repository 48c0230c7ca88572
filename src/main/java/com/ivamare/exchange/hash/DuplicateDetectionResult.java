package com.ivamare.exchange.hash;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a duplicate check.
 *
 * @param duplicate Whether matching content was found
 * @param confidence Confidence in the verdict, 0 to 100
 * @param reason One of {@code NEW}, {@code NEW_VERSION},
 *               {@code SAME_SOURCE_CONTENT_MATCH}, {@code CROSS_SOURCE_CONTENT_MATCH}
 * @param similarEntityIds Ids of the matching entities
 * @param similarEntityExternalIds External ids of the matching entities
 * @param contentHash Hash the check was based on
 * @param detectedAt When the check ran
 * @param suspicious Whether the result should be reviewed by a person
 * @param metadata Match counts and source
 */
public record DuplicateDetectionResult(
    boolean duplicate,
    int confidence,
    String reason,
    List<String> similarEntityIds,
    List<String> similarEntityExternalIds,
    String contentHash,
    Instant detectedAt,
    boolean suspicious,
    Map<String, Object> metadata
) {
    public static final String NEW = "NEW";
    public static final String NEW_VERSION = "NEW_VERSION";
    public static final String SAME_SOURCE_CONTENT_MATCH = "SAME_SOURCE_CONTENT_MATCH";
    public static final String CROSS_SOURCE_CONTENT_MATCH = "CROSS_SOURCE_CONTENT_MATCH";

    public DuplicateDetectionResult {
        if (confidence < 0 || confidence > 100) {
            throw new IllegalArgumentException("confidence must be between 0 and 100");
        }
        similarEntityIds = similarEntityIds != null ? List.copyOf(similarEntityIds) : List.of();
        similarEntityExternalIds = similarEntityExternalIds != null
            ? Collections.unmodifiableList(new ArrayList<>(similarEntityExternalIds)) : List.of();
        detectedAt = detectedAt != null ? detectedAt : Instant.now();
        metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
    }

    public static DuplicateDetectionResult notDuplicate(String contentHash) {
        return new DuplicateDetectionResult(false, 100, NEW, List.of(), List.of(), contentHash,
            Instant.now(), false, Map.of());
    }

    /**
     * Combine two results. The one with higher confidence wins; entity lists
     * are united and the suspicious flag is kept if either result set it.
     */
    public DuplicateDetectionResult mergeWith(DuplicateDetectionResult other) {
        DuplicateDetectionResult base = other.confidence > confidence ? other : this;
        DuplicateDetectionResult secondary = base == this ? other : this;

        LinkedHashSet<String> ids = new LinkedHashSet<>(base.similarEntityIds);
        ids.addAll(secondary.similarEntityIds);
        LinkedHashSet<String> externalIds = new LinkedHashSet<>(base.similarEntityExternalIds);
        externalIds.addAll(secondary.similarEntityExternalIds);
        Map<String, Object> mergedMetadata = new LinkedHashMap<>(secondary.metadata);
        mergedMetadata.putAll(base.metadata);

        return new DuplicateDetectionResult(
            base.duplicate, base.confidence, base.reason,
            new ArrayList<>(ids), new ArrayList<>(externalIds),
            base.contentHash, base.detectedAt,
            base.suspicious || secondary.suspicious, mergedMetadata);
    }
}
