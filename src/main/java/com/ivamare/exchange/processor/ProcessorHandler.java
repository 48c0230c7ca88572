package com.ivamare.exchange.processor;

import com.ivamare.exchange.deadletter.DeadLetterSink;
import com.ivamare.exchange.exception.ErrorCodes;
import com.ivamare.exchange.hash.ContentHasher;
import com.ivamare.exchange.hash.DuplicateDetectionService;
import com.ivamare.exchange.model.Message;
import com.ivamare.exchange.model.ProcessingResult;
import com.ivamare.exchange.output.DeliveryReport;
import com.ivamare.exchange.output.OutputDispatcher;
import com.ivamare.exchange.output.OutputHandlerFactory;
import com.ivamare.exchange.output.OutputHandlerResult;
import com.ivamare.exchange.store.EntityStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs one {@link MessageProcessor} invocation with the surrounding infrastructure.
 *
 * <p>For each message:
 * <ol>
 *   <li>resolve the tenant, failing with {@code MISSING_TENANT_ID} when there is none</li>
 *   <li>validate the message, failing with {@code INVALID_MESSAGE} without processing it</li>
 *   <li>invoke the processor and record duration and processor info</li>
 *   <li>on success, run the attached output handlers in order</li>
 *   <li>on a non-retryable failure, forward the message to the dead-letter sink</li>
 * </ol>
 *
 * <p>Processor exceptions never escape {@link #execute}; the processor's
 * {@link MessageProcessor#canRetry} decides whether they are retryable.
 */
public class ProcessorHandler {

    private static final Logger log = LoggerFactory.getLogger(ProcessorHandler.class);

    private final MessageProcessor processor;
    private final TenantResolver tenantResolver;
    private final DeadLetterSink deadLetterSink;
    private final OutputDispatcher outputDispatcher;
    private final ObjectMapper objectMapper;
    private final DeliveryMode deliveryMode;
    private final EntityStore entityStore;
    private final ContentHasher contentHasher;
    private final DuplicateDetectionService duplicateDetection;
    private final OutputHandlerFactory outputHandlerFactory;

    private ProcessorHandler(Builder builder) {
        this.processor = Objects.requireNonNull(builder.processor, "processor");
        this.tenantResolver = Objects.requireNonNull(builder.tenantResolver, "tenantResolver");
        this.objectMapper = Objects.requireNonNull(builder.objectMapper, "objectMapper");
        this.deadLetterSink = builder.deadLetterSink;
        this.outputDispatcher = builder.outputDispatcher != null ? builder.outputDispatcher : new OutputDispatcher();
        this.deliveryMode = builder.deliveryMode != null ? builder.deliveryMode : DeliveryMode.BEST_EFFORT;
        this.entityStore = builder.entityStore;
        this.contentHasher = builder.contentHasher != null ? builder.contentHasher : new ContentHasher(objectMapper);
        this.duplicateDetection = builder.duplicateDetection != null || entityStore == null
            ? builder.duplicateDetection
            : new DuplicateDetectionService(entityStore, contentHasher);
        this.outputHandlerFactory = builder.outputHandlerFactory;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Process a message. Never throws for processor failures.
     */
    public ProcessingResult execute(Message message) {
        long start = System.nanoTime();
        String processorName = processor.getClass().getSimpleName();

        Optional<String> tenantId = tenantResolver.resolve(message);
        if (tenantId.isEmpty()) {
            log.warn("No tenant for message {}, rejecting", message.getMessageId());
            return rejected("Tenant id is required but none is configured or referenced by the message",
                ErrorCodes.MISSING_TENANT_ID, start);
        }

        log.info("Starting {} for message {} (tenant {}, external id {})",
            processorName, message.getMessageId(), tenantId.get(), externalId(message));

        ProcessingResult result;
        try {
            if (!processor.validateMessage(message)) {
                log.warn("Message {} failed validation in {}", message.getMessageId(), processorName);
                return rejected("Message validation failed", ErrorCodes.INVALID_MESSAGE, start);
            }

            ProcessorContext context = new ProcessorContext(
                tenantId.get(), entityStore, contentHasher, duplicateDetection, outputHandlerFactory);
            result = processor.process(message, context);
            if (result == null) {
                throw new IllegalStateException(processorName + " returned no result");
            }
            result.setProcessingDurationMs(elapsedMs(start));
            result.setProcessorInfo(processor.getProcessorInfo());
        } catch (Exception e) {
            boolean canRetry = processor.canRetry(e);
            log.error("Unexpected error in {} for message {} (can retry: {})",
                processorName, message.getMessageId(), canRetry, e);

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("exception_type", e.getClass().getName());
            result = ProcessingResult.createFailure(
                "Unexpected error: " + e.getMessage(), ErrorCodes.UNEXPECTED_ERROR, canRetry, null, details);
            result.setProcessingDurationMs(elapsedMs(start));
            result.setProcessorInfo(processor.getProcessorInfo());
            deadLetterIfTerminal(message, result);
            return result;
        }

        if (result.isSuccess()) {
            DeliveryReport report = outputDispatcher.dispatch(message, result);
            message.markProcessed();
            if (deliveryMode == DeliveryMode.ALL_REQUIRED && !report.allSucceeded()) {
                requireAllDelivered(result, report);
                deadLetterIfTerminal(message, result);
            }
            log.info("{} completed message {}: status={}, outputs={}/{} delivered, {}ms",
                processorName, message.getMessageId(), result.getStatus().getValue(),
                report.successful(), report.total(), result.getProcessingDurationMs());
        } else {
            log.warn("{} failed message {}: [{}] {} (can retry: {})",
                processorName, message.getMessageId(), result.getErrorCode(),
                result.getErrorMessage(), result.isCanRetry());
            deadLetterIfTerminal(message, result);
        }
        return result;
    }

    private ProcessingResult rejected(String errorMessage, String errorCode, long start) {
        ProcessingResult result = ProcessingResult.createFailure(errorMessage, errorCode, false);
        result.setProcessingDurationMs(elapsedMs(start));
        result.setProcessorInfo(processor.getProcessorInfo());
        return result;
    }

    private void requireAllDelivered(ProcessingResult result, DeliveryReport report) {
        List<OutputHandlerResult> failures = report.failures();
        boolean canRetry = failures.stream().allMatch(OutputHandlerResult::canRetry);
        Integer retryAfter = canRetry
            ? failures.stream()
                .map(OutputHandlerResult::retryAfterSeconds)
                .filter(Objects::nonNull)
                .max(Integer::compare)
                .orElse(null)
            : null;
        result.markDeliveryFailure(
            failures.size() + " of " + report.total() + " output handlers failed",
            ErrorCodes.OUTPUT_DELIVERY_FAILED, canRetry, retryAfter);
    }

    private void deadLetterIfTerminal(Message message, ProcessingResult result) {
        if (result.isCanRetry() || deadLetterSink == null) {
            return;
        }
        try {
            deadLetterSink.send(objectMapper.writeValueAsString(deadLetterEnvelope(message, result)));
            result.markDeadLettered();
            log.info("Message {} routed to dead letter queue", message.getMessageId());
        } catch (JsonProcessingException | RuntimeException e) {
            log.error("Failed to send message {} to dead letter queue", message.getMessageId(), e);
        }
    }

    Map<String, Object> deadLetterEnvelope(Message message, ProcessingResult result) {
        Map<String, Object> original = new LinkedHashMap<>();
        original.put("message_id", message.getMessageId());
        original.put("external_id", externalId(message));
        original.put("payload", message.getPayload());

        Map<String, Object> failure = new LinkedHashMap<>();
        failure.put("error_code", result.getErrorCode());
        failure.put("error_message", result.getErrorMessage());
        failure.put("processor", processor.getClass().getSimpleName());
        failure.put("failed_at", Instant.now().toString());

        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("original_message", original);
        envelope.put("failure_info", failure);
        return envelope;
    }

    private static String externalId(Message message) {
        if (message.getEntityReference() == null || message.getEntityReference().externalId() == null) {
            return "unknown";
        }
        return message.getEntityReference().externalId();
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }

    public MessageProcessor getProcessor() {
        return processor;
    }

    public DeliveryMode getDeliveryMode() {
        return deliveryMode;
    }

    public static final class Builder {
        private MessageProcessor processor;
        private TenantResolver tenantResolver;
        private DeadLetterSink deadLetterSink;
        private OutputDispatcher outputDispatcher;
        private ObjectMapper objectMapper;
        private DeliveryMode deliveryMode;
        private EntityStore entityStore;
        private ContentHasher contentHasher;
        private DuplicateDetectionService duplicateDetection;
        private OutputHandlerFactory outputHandlerFactory;

        private Builder() {
        }

        public Builder processor(MessageProcessor processor) {
            this.processor = processor;
            return this;
        }

        public Builder tenantResolver(TenantResolver tenantResolver) {
            this.tenantResolver = tenantResolver;
            return this;
        }

        public Builder deadLetterSink(DeadLetterSink deadLetterSink) {
            this.deadLetterSink = deadLetterSink;
            return this;
        }

        public Builder outputDispatcher(OutputDispatcher outputDispatcher) {
            this.outputDispatcher = outputDispatcher;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public Builder deliveryMode(DeliveryMode deliveryMode) {
            this.deliveryMode = deliveryMode;
            return this;
        }

        public Builder entityStore(EntityStore entityStore) {
            this.entityStore = entityStore;
            return this;
        }

        public Builder contentHasher(ContentHasher contentHasher) {
            this.contentHasher = contentHasher;
            return this;
        }

        public Builder duplicateDetection(DuplicateDetectionService duplicateDetection) {
            this.duplicateDetection = duplicateDetection;
            return this;
        }

        public Builder outputHandlerFactory(OutputHandlerFactory outputHandlerFactory) {
            this.outputHandlerFactory = outputHandlerFactory;
            return this;
        }

        public ProcessorHandler build() {
            return new ProcessorHandler(this);
        }
    }
}
