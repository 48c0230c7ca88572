package com.ivamare.exchange.processor;

import com.ivamare.exchange.hash.ContentHasher;
import com.ivamare.exchange.hash.DuplicateDetectionService;
import com.ivamare.exchange.output.OutputHandlerFactory;
import com.ivamare.exchange.store.EntityStore;

/**
 * Everything a processor may use during one execution.
 *
 * @param tenantId Tenant the message is processed for
 * @param entityStore Entity persistence, may be null when not configured
 * @param contentHasher Content hashing and entity comparison
 * @param duplicateDetection Duplicate detection, null without an entity store
 * @param outputHandlerFactory Creates output handlers to attach to results
 */
public record ProcessorContext(
    String tenantId,
    EntityStore entityStore,
    ContentHasher contentHasher,
    DuplicateDetectionService duplicateDetection,
    OutputHandlerFactory outputHandlerFactory
) {
    public ProcessorContext {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId is required");
        }
    }
}
