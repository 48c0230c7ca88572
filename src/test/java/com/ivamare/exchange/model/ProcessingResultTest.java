package com.ivamare.exchange.model;

import com.ivamare.exchange.exception.ErrorCodes;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ProcessingResult")
class ProcessingResultTest {

    @Nested
    @DisplayName("factories")
    class Factories {

        @Test
        @DisplayName("should create success with entities")
        void shouldCreateSuccessWithEntities() {
            ProcessingResult result = ProcessingResult.createSuccess(List.of("e1"), List.of("e2", "e3"));

            assertEquals(ProcessingStatus.SUCCESS, result.getStatus());
            assertTrue(result.isSuccess());
            assertEquals(List.of("e1"), result.getEntitiesCreated());
            assertEquals(List.of("e2", "e3"), result.getEntitiesUpdated());
            assertNotNull(result.getCompletedAt());
        }

        @Test
        @DisplayName("should use error status for retryable failure")
        void shouldUseErrorStatusForRetryableFailure() {
            ProcessingResult result = ProcessingResult.createFailure(
                "Timeout", "TIMEOUT", true, 30, Map.of("attempt", 1));

            assertEquals(ProcessingStatus.ERROR, result.getStatus());
            assertFalse(result.isSuccess());
            assertTrue(result.isCanRetry());
            assertEquals(30, result.getRetryAfterSeconds());
            assertEquals(1, result.getErrorDetails().get("attempt"));
        }

        @Test
        @DisplayName("should use failed status for terminal failure")
        void shouldUseFailedStatusForTerminalFailure() {
            ProcessingResult result = ProcessingResult.createFailure("Bad data", "INVALID", false);

            assertEquals(ProcessingStatus.FAILED, result.getStatus());
            assertTrue(result.getStatus().isFailure());
            assertEquals("Bad data", result.getErrorMessage());
            assertEquals("INVALID", result.getErrorCode());
        }

        @Test
        @DisplayName("should record skip reason")
        void shouldRecordSkipReason() {
            ProcessingResult result = ProcessingResult.createSkipped("Already processed");

            assertEquals(ProcessingStatus.SKIPPED, result.getStatus());
            assertTrue(result.isSuccess());
            assertEquals("Already processed", result.getProcessingMetadata().get("skip_reason"));
        }
    }

    @Nested
    @DisplayName("transitions")
    class Transitions {

        @Test
        @DisplayName("should dead-letter failed results")
        void shouldDeadLetterFailedResults() {
            ProcessingResult result = ProcessingResult.createFailure("Bad data", "INVALID", false);

            result.markDeadLettered();

            assertEquals(ProcessingStatus.DEAD_LETTERED, result.getStatus());
            assertEquals("INVALID", result.getErrorCode());
        }

        @Test
        @DisplayName("should refuse to dead-letter successful results")
        void shouldRefuseToDeadLetterSuccess() {
            ProcessingResult result = ProcessingResult.createSuccess();

            assertThrows(IllegalStateException.class, result::markDeadLettered);
        }

        @Test
        @DisplayName("should turn success into retryable delivery failure")
        void shouldTurnSuccessIntoRetryableDeliveryFailure() {
            ProcessingResult result = ProcessingResult.createSuccess();

            result.markDeliveryFailure("1 of 2 output handlers failed", ErrorCodes.OUTPUT_DELIVERY_FAILED, true, 4);

            assertEquals(ProcessingStatus.ERROR, result.getStatus());
            assertFalse(result.isSuccess());
            assertTrue(result.getStatus().isFailure());
            assertTrue(result.isCanRetry());
            assertEquals(4, result.getRetryAfterSeconds());
        }

        @Test
        @DisplayName("should turn success into terminal delivery failure")
        void shouldTurnSuccessIntoTerminalDeliveryFailure() {
            ProcessingResult result = ProcessingResult.createSuccess();

            result.markDeliveryFailure("1 of 1 output handlers failed", ErrorCodes.OUTPUT_DELIVERY_FAILED, false, null);

            assertEquals(ProcessingStatus.FAILED, result.getStatus());
            assertEquals(!result.isSuccess(), result.getStatus().isFailure());
            result.markDeadLettered();
            assertEquals(ProcessingStatus.DEAD_LETTERED, result.getStatus());
        }
    }

    @Test
    @DisplayName("should summarize failure fields only for failures")
    void shouldSummarize() {
        ProcessingResult success = ProcessingResult.createSuccess(List.of("e1"), List.of());
        success.setProcessingDurationMs(12);
        ProcessingResult failure = ProcessingResult.createFailure("Bad", "INVALID", false);

        Map<String, Object> successSummary = success.getSummary();
        Map<String, Object> failureSummary = failure.getSummary();

        assertEquals("success", successSummary.get("status"));
        assertEquals(1, successSummary.get("entities_created"));
        assertEquals(12L, successSummary.get("processing_duration_ms"));
        assertFalse(successSummary.containsKey("error_code"));
        assertEquals("failed", failureSummary.get("status"));
        assertEquals("INVALID", failureSummary.get("error_code"));
        assertEquals(false, failureSummary.get("can_retry"));
    }

    @Test
    @DisplayName("should expose read-only collections")
    void shouldExposeReadOnlyCollections() {
        ProcessingResult result = ProcessingResult.createSuccess();
        result.addEntityCreated("e1").addMetadata("k", "v");

        assertThrows(UnsupportedOperationException.class, () -> result.getEntitiesCreated().add("x"));
        assertThrows(UnsupportedOperationException.class, () -> result.getProcessingMetadata().put("x", 1));
        assertThrows(UnsupportedOperationException.class, () -> result.getOutputHandlers().clear());
    }
}
