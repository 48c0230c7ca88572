package com.ivamare.exchange.hash;

import com.ivamare.exchange.exception.ErrorCodes;
import com.ivamare.exchange.exception.ValidationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ContentHasher")
class ContentHasherTest {

    private final ContentHasher hasher = new ContentHasher(new ObjectMapper().findAndRegisterModules());

    private static Map<String, Object> order(String createdAt) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("order_id", "ORD-1");
        data.put("amount", 1500);
        data.put("customer", Map.of("id", "C-9", "tier", "gold"));
        data.put("created_at", createdAt);
        return data;
    }

    @Nested
    @DisplayName("computeHash")
    class ComputeHash {

        @Test
        @DisplayName("should produce lowercase hex SHA-256")
        void shouldProduceHexDigest() {
            String hash = hasher.computeHash(order("2024-01-01T00:00:00Z"));

            assertEquals(64, hash.length());
            assertTrue(hash.matches("[0-9a-f]{64}"));
        }

        @Test
        @DisplayName("should be deterministic")
        void shouldBeDeterministic() {
            Map<String, Object> data = order("2024-01-01T00:00:00Z");

            assertEquals(hasher.computeHash(data), hasher.computeHash(data));
        }

        @Test
        @DisplayName("should ignore timestamps and other volatile fields")
        void shouldIgnoreVolatileFields() {
            Map<String, Object> later = order("2024-06-30T12:00:00Z");
            later.put("version", 7);
            later.put("metadata", Map.of("ingested_by", "batch"));

            assertEquals(hasher.computeHash(order("2024-01-01T00:00:00Z")), hasher.computeHash(later));
        }

        @Test
        @DisplayName("should not depend on key order")
        void shouldNotDependOnKeyOrder() {
            Map<String, Object> reversed = new LinkedHashMap<>();
            reversed.put("customer", Map.of("tier", "gold", "id", "C-9"));
            reversed.put("amount", 1500);
            reversed.put("order_id", "ORD-1");

            assertEquals(hasher.computeHash(order("x")), hasher.computeHash(reversed));
        }

        @Test
        @DisplayName("should change when content changes")
        void shouldChangeWithContent() {
            Map<String, Object> changed = order("2024-01-01T00:00:00Z");
            changed.put("amount", 1501);

            assertNotEquals(hasher.computeHash(order("2024-01-01T00:00:00Z")), hasher.computeHash(changed));
        }

        @Test
        @DisplayName("should hash only key fields when given")
        void shouldHashOnlyKeyFields() {
            HashConfig keys = HashConfig.ofKeyFields(List.of("order_id", "customer.id"));
            Map<String, Object> other = order("x");
            other.put("amount", 99);
            other.put("customer", Map.of("id", "C-9", "tier", "silver"));

            assertEquals(hasher.computeHash(order("x"), keys), hasher.computeHash(other, keys));
        }

        @Test
        @DisplayName("should honour custom ignore fields")
        void shouldHonourCustomIgnoreFields() {
            Map<String, Object> a = order("x");
            Map<String, Object> b = order("x");
            b.put("amount", 2);

            String hashA = hasher.computeHash(a, List.of(), Set.of("amount", "created_at"), true);
            String hashB = hasher.computeHash(b, List.of(), Set.of("amount", "created_at"), true);

            assertEquals(hashA, hashB);
        }

        @Test
        @DisplayName("should hash the string form when content cannot be serialized")
        void shouldFallBackToStringForm() {
            Object opaque = new Object();
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("id", 7);
            data.put("blob", opaque);
            data.put("created_at", "2024-01-01");

            String hash = hasher.computeHash(data);

            Map<String, Object> projected = new TreeMap<>();
            projected.put("blob", opaque);
            projected.put("id", 7);
            assertEquals(ContentHasher.sha256(String.valueOf(projected)), hash);
        }

        @Test
        @DisplayName("should reject null data")
        void shouldRejectNullData() {
            ValidationException ex = assertThrows(ValidationException.class, () -> hasher.computeHash(null));

            assertEquals(ErrorCodes.TYPE_MISMATCH, ex.getCode());
            assertEquals("data", ex.getField());
        }
    }

    @Test
    @DisplayName("should extract key fields including dot paths")
    void shouldExtractKeyFields() {
        Map<String, Object> extracted = hasher.extractKeyFields(order("x"), List.of("order_id", "customer.tier", "nope"));

        assertEquals(Map.of("order_id", "ORD-1", "customer.tier", "gold"), extracted);
    }

    @Nested
    @DisplayName("compareEntities")
    class CompareEntities {

        @Test
        @DisplayName("should report nothing for identical entities")
        void shouldReportNothingForIdentical() {
            Map<String, Object> data = order("x");

            assertTrue(hasher.compareEntities(data, data).isEmpty());
        }

        @Test
        @DisplayName("should report changed, added and removed fields in name order")
        void shouldReportChanges() {
            Map<String, Object> existing = order("2024-01-01");
            Map<String, Object> incoming = new HashMap<>(order("2024-02-01"));
            incoming.put("amount", 2000);
            incoming.put("status", "shipped");
            incoming.remove("order_id");

            Map<String, FieldChange> changes = hasher.compareEntities(existing, incoming);

            assertEquals(List.of("amount", "order_id", "status"), List.copyOf(changes.keySet()));
            assertEquals(new FieldChange(1500, 2000), changes.get("amount"));
            assertEquals(new FieldChange("ORD-1", null), changes.get("order_id"));
            assertEquals(new FieldChange(null, "shipped"), changes.get("status"));
        }

        @Test
        @DisplayName("should compare only key fields when given")
        void shouldCompareKeyFields() {
            Map<String, Object> incoming = order("x");
            incoming.put("amount", 1);
            incoming.put("customer", Map.of("id", "C-10", "tier", "gold"));

            Map<String, FieldChange> changes = hasher.compareEntities(
                order("x"), incoming, List.of("customer.id"), null);

            assertEquals(Map.of("customer.id", new FieldChange("C-9", "C-10")), changes);
        }
    }
}
