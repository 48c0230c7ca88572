package com.ivamare.exchange.output;

import com.ivamare.exchange.policy.BackoffPolicy;
import com.ivamare.exchange.transport.BusClient;
import com.ivamare.exchange.transport.QueueClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

@DisplayName("OutputHandlerFactory")
class OutputHandlerFactoryTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final QueueClient queueClient = mock(QueueClient.class);
    private final BusClient busClient = mock(BusClient.class);

    private final OutputHandlerFactory factory = new OutputHandlerFactory(
        () -> queueClient, () -> busClient, objectMapper, BackoffPolicy.defaultPolicy(),
        Map.of("auto_create_queue", false, "message_ttl_seconds", 60),
        Map.of("destination_type", "topic"));

    @Test
    @DisplayName("should create each handler type")
    void shouldCreateEachHandlerType() {
        assertInstanceOf(QueueOutputHandler.class, factory.create("queue", "orders", null));
        assertInstanceOf(BusOutputHandler.class, factory.create("service_bus", "orders", null));
        assertInstanceOf(BusOutputHandler.class, factory.create("BUS", "orders", null));
        assertInstanceOf(NoOpOutputHandler.class, factory.create("noop", null, null));
        assertInstanceOf(FileOutputHandler.class, factory.create("file", "/tmp/out", Map.of()));
    }

    @Test
    @DisplayName("should apply defaults under explicit configuration")
    void shouldApplyDefaults() {
        OutputHandler handler = factory.create("queue", "orders", Map.of("message_ttl_seconds", 120));

        Map<String, Object> info = handler.getHandlerInfo();

        assertEquals(false, info.get("auto_create_queue"));
        assertEquals(List.of("auto_create_queue", "message_ttl_seconds"), info.get("config_keys"));
        assertEquals(120, ((QueueOutputHandler) handler).messageTtlSeconds());
    }

    @Test
    @DisplayName("should apply bus defaults")
    void shouldApplyBusDefaults() {
        OutputHandler handler = factory.create("service_bus", "orders", null);

        assertEquals("topic", handler.getHandlerInfo().get("destination_type"));
    }

    @Test
    @DisplayName("should create queue handler by destination")
    void shouldCreateQueueHandlerByDestination() {
        OutputHandler handler = factory.queue("high-value-queue");

        assertEquals("high-value-queue", handler.getDestination());
        assertEquals("QueueOutputHandler", handler.getHandlerName());
    }

    @Test
    @DisplayName("should reject unknown or missing type")
    void shouldRejectUnknownType() {
        assertThrows(IllegalArgumentException.class, () -> factory.create("webhook", "x", null));
        assertThrows(IllegalArgumentException.class, () -> factory.create(null, "x", null));
    }

    @Test
    @DisplayName("should fail when transport is not configured")
    void shouldFailWhenTransportMissing() {
        OutputHandlerFactory queueOnly = new OutputHandlerFactory(
            () -> queueClient, null, objectMapper, BackoffPolicy.defaultPolicy());
        OutputHandlerFactory busOnly = new OutputHandlerFactory(
            null, () -> busClient, objectMapper, BackoffPolicy.defaultPolicy());

        assertThrows(IllegalStateException.class, () -> queueOnly.create("bus", "orders", null));
        assertThrows(IllegalStateException.class, () -> busOnly.create("queue", "orders", null));
    }
}
