package com.ivamare.exchange.hash;

import com.ivamare.exchange.exception.ErrorCodes;
import com.ivamare.exchange.exception.ValidationException;
import com.ivamare.exchange.util.FieldPaths;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Deterministic content hashing and field-level comparison of entity data.
 *
 * <p>The hash is the lowercase hex SHA-256 of the canonical JSON form of the
 * projected fields. With sorted keys the result does not depend on map
 * iteration order, so equal content always hashes equally.
 */
public class ContentHasher {

    private static final Logger log = LoggerFactory.getLogger(ContentHasher.class);

    private final ObjectWriter sortedWriter;
    private final ObjectWriter plainWriter;
    private final HashConfig defaultConfig;

    public ContentHasher(ObjectMapper objectMapper) {
        this(objectMapper, HashConfig.defaultConfig());
    }

    public ContentHasher(ObjectMapper objectMapper, HashConfig defaultConfig) {
        this.sortedWriter = objectMapper.writer().with(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        this.plainWriter = objectMapper.writer().without(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        this.defaultConfig = defaultConfig;
    }

    public String computeHash(Map<String, Object> data) {
        return computeHash(data, defaultConfig);
    }

    public String computeHash(Map<String, Object> data, HashConfig config) {
        return computeHash(data, config.keyFields(), config.ignoreFields(), config.sortKeys());
    }

    /**
     * Hash the projected fields of {@code data}.
     *
     * @param data entity data, must not be null
     * @param keyFields fields to include; when empty all fields not ignored are used
     * @param ignoreFields top-level fields to exclude; null for the default set
     * @param sortKeys whether to sort map keys before serialization
     * @return lowercase hex SHA-256 digest
     * @throws ValidationException with code {@code TYPE_MISMATCH} when data is null
     */
    public String computeHash(Map<String, Object> data, List<String> keyFields,
                              Set<String> ignoreFields, boolean sortKeys) {
        if (data == null) {
            throw new ValidationException(ErrorCodes.TYPE_MISMATCH, "Cannot calculate hash for null data", "data");
        }

        Set<String> ignored = ignoreFields != null ? ignoreFields : HashConfig.DEFAULT_IGNORE_FIELDS;
        Map<String, Object> projected = sortKeys ? new TreeMap<>() : new LinkedHashMap<>();

        if (keyFields != null && !keyFields.isEmpty()) {
            for (String field : keyFields) {
                if (field.contains(".")) {
                    FieldPaths.resolve(data, field).ifPresent(value -> projected.put(field, value));
                } else if (data.containsKey(field)) {
                    projected.put(field, data.get(field));
                }
            }
        } else {
            data.forEach((key, value) -> {
                if (!ignored.contains(key)) {
                    projected.put(key, value);
                }
            });
        }

        String serialized;
        try {
            serialized = (sortKeys ? sortedWriter : plainWriter).writeValueAsString(projected);
        } catch (JsonProcessingException e) {
            log.error("Error serializing entity data for hashing, falling back to string form: {}", e.getMessage());
            serialized = String.valueOf(projected);
        }
        return sha256(serialized);
    }

    /**
     * Only the given fields of {@code data}; dot paths are kept as flat keys.
     * Fields that do not resolve to a value are left out.
     */
    public Map<String, Object> extractKeyFields(Map<String, Object> data, List<String> keyFields) {
        if (keyFields == null || keyFields.isEmpty()) {
            return data;
        }
        Map<String, Object> extracted = new LinkedHashMap<>();
        for (String field : keyFields) {
            FieldPaths.resolve(data, field).ifPresent(value -> extracted.put(field, value));
        }
        return extracted;
    }

    public Map<String, FieldChange> compareEntities(Map<String, Object> existing, Map<String, Object> incoming) {
        return compareEntities(existing, incoming, defaultConfig.keyFields(), defaultConfig.ignoreFields());
    }

    /**
     * Fields whose values differ between two versions of an entity.
     *
     * <p>Compares the key fields when given, otherwise the union of both
     * key sets. Ignored fields are never reported. A field present on one
     * side only is reported with null on the other.
     *
     * @return changed fields in name order, mapped to their old and new values
     */
    public Map<String, FieldChange> compareEntities(Map<String, Object> existing, Map<String, Object> incoming,
                                                    List<String> keyFields, Set<String> ignoreFields) {
        Set<String> ignored = ignoreFields != null ? ignoreFields : HashConfig.DEFAULT_IGNORE_FIELDS;
        Map<String, Object> left = existing != null ? existing : Map.of();
        Map<String, Object> right = incoming != null ? incoming : Map.of();

        Set<String> fields = new TreeSet<>();
        if (keyFields != null && !keyFields.isEmpty()) {
            fields.addAll(keyFields);
        } else {
            fields.addAll(left.keySet());
            fields.addAll(right.keySet());
        }

        Map<String, FieldChange> changes = new LinkedHashMap<>();
        for (String field : fields) {
            if (ignored.contains(field)) {
                continue;
            }
            Object oldValue = FieldPaths.resolve(left, field).orElse(null);
            Object newValue = FieldPaths.resolve(right, field).orElse(null);
            if (!Objects.equals(oldValue, newValue)) {
                changes.put(field, new FieldChange(oldValue, newValue));
            }
        }
        return changes;
    }

    static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
