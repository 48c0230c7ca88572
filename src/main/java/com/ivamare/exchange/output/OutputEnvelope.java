package com.ivamare.exchange.output;

import com.ivamare.exchange.model.EntityReference;
import com.ivamare.exchange.model.Message;
import com.ivamare.exchange.model.ProcessingResult;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the wire envelope shared by all transport-backed output handlers.
 *
 * <pre>
 * {
 *   "message_metadata":  {message_id, correlation_id, message_type, retry_count, max_retries},
 *   "entity_reference":  {id, external_id, canonical_type, source, tenant_id, version},
 *   "payload":           {...},
 *   "processing_result": {status, success, entities_created, entities_updated,
 *                         processing_metadata, processor_info},
 *   "routing_metadata":  {source_handler, target_queue | target_destination, destination_type}
 * }
 * </pre>
 *
 * <p>Field names and nesting are a compatibility contract with downstream consumers.
 */
public final class OutputEnvelope {

    private OutputEnvelope() {
    }

    public static Map<String, Object> build(Message message, ProcessingResult result,
                                            Map<String, Object> routingMetadata) {
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("message_metadata", messageMetadata(message));
        envelope.put("entity_reference", entityReference(message.getEntityReference()));
        envelope.put("payload", message.getPayload());
        envelope.put("processing_result", processingResult(result));
        envelope.put("routing_metadata", routingMetadata);
        return envelope;
    }

    static Map<String, Object> messageMetadata(Message message) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("message_id", message.getMessageId());
        metadata.put("correlation_id", message.getCorrelationId());
        metadata.put("message_type", message.getMessageType().getValue());
        metadata.put("retry_count", message.getRetryCount());
        metadata.put("max_retries", message.getMaxRetries());
        return metadata;
    }

    static Map<String, Object> entityReference(EntityReference reference) {
        return reference != null ? reference.toMap() : null;
    }

    static Map<String, Object> processingResult(ProcessingResult result) {
        Map<String, Object> section = new LinkedHashMap<>();
        section.put("status", result.getStatus().getValue());
        section.put("success", result.isSuccess());
        section.put("entities_created", result.getEntitiesCreated());
        section.put("entities_updated", result.getEntitiesUpdated());
        section.put("processing_metadata", result.getProcessingMetadata());
        section.put("processor_info", result.getProcessorInfo() != null ? result.getProcessorInfo().toMap() : null);
        return section;
    }
}
