package com.ivamare.exchange.processor;

import com.ivamare.exchange.deadletter.DeadLetterSink;
import com.ivamare.exchange.hash.ContentHasher;
import com.ivamare.exchange.hash.DuplicateDetectionService;
import com.ivamare.exchange.output.OutputDispatcher;
import com.ivamare.exchange.output.OutputHandlerFactory;
import com.ivamare.exchange.store.EntityStore;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Wraps processors in {@link ProcessorHandler}s sharing the same infrastructure.
 *
 * <pre>
 * ProcessorHandler handler = processorHandlerFactory.create(new GatewayRouter(config, outputs));
 * ProcessingResult result = handler.execute(message);
 * </pre>
 */
public class ProcessorHandlerFactory {

    private final TenantResolver tenantResolver;
    private final DeadLetterSink deadLetterSink;
    private final OutputDispatcher outputDispatcher;
    private final ObjectMapper objectMapper;
    private final DeliveryMode deliveryMode;
    private final EntityStore entityStore;
    private final ContentHasher contentHasher;
    private final DuplicateDetectionService duplicateDetection;
    private final OutputHandlerFactory outputHandlerFactory;

    public ProcessorHandlerFactory(
            TenantResolver tenantResolver,
            DeadLetterSink deadLetterSink,
            OutputDispatcher outputDispatcher,
            ObjectMapper objectMapper,
            DeliveryMode deliveryMode,
            EntityStore entityStore,
            ContentHasher contentHasher,
            DuplicateDetectionService duplicateDetection,
            OutputHandlerFactory outputHandlerFactory) {
        this.tenantResolver = tenantResolver;
        this.deadLetterSink = deadLetterSink;
        this.outputDispatcher = outputDispatcher;
        this.objectMapper = objectMapper;
        this.deliveryMode = deliveryMode;
        this.entityStore = entityStore;
        this.contentHasher = contentHasher;
        this.duplicateDetection = duplicateDetection;
        this.outputHandlerFactory = outputHandlerFactory;
    }

    public ProcessorHandler create(MessageProcessor processor) {
        return create(processor, deliveryMode);
    }

    public ProcessorHandler create(MessageProcessor processor, DeliveryMode mode) {
        return ProcessorHandler.builder()
            .processor(processor)
            .tenantResolver(tenantResolver)
            .deadLetterSink(deadLetterSink)
            .outputDispatcher(outputDispatcher)
            .objectMapper(objectMapper)
            .deliveryMode(mode)
            .entityStore(entityStore)
            .contentHasher(contentHasher)
            .duplicateDetection(duplicateDetection)
            .outputHandlerFactory(outputHandlerFactory)
            .build();
    }
}
