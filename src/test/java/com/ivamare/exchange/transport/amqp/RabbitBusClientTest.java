package com.ivamare.exchange.transport.amqp;

import com.ivamare.exchange.transport.BusMessage;
import com.ivamare.exchange.transport.DestinationType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageDeliveryMode;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.rabbit.core.RabbitTemplate;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RabbitBusClientTest {

    @Mock
    private RabbitTemplate rabbitTemplate;

    private RabbitBusClient client;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-03-15T10:00:00Z"), ZoneOffset.UTC);
        client = new RabbitBusClient(rabbitTemplate, clock);
    }

    private BusMessage busMessage(DestinationType type, String messageId) {
        return new BusMessage("orders", type, messageId, "corr-1", "{\"a\":1}", null,
            "session-1", 60, Instant.parse("2024-03-15T10:00:30Z"), Map.of("tenant_id", "acme"));
    }

    @Test
    void shouldSendToQueueThroughDefaultExchange() {
        String id = client.send(busMessage(DestinationType.QUEUE, "msg-1"));

        assertEquals("msg-1", id);
        verify(rabbitTemplate).send(eq(""), eq("orders"), any(Message.class));
    }

    @Test
    void shouldPublishTopicToExchange() {
        client.send(busMessage(DestinationType.TOPIC, "msg-1"));

        verify(rabbitTemplate).send(eq("orders"), eq(""), any(Message.class));
    }

    @Test
    void shouldMapMessageProperties() {
        Message message = client.toAmqpMessage(busMessage(DestinationType.QUEUE, "msg-1"));
        MessageProperties properties = message.getMessageProperties();

        assertEquals("{\"a\":1}", new String(message.getBody(), StandardCharsets.UTF_8));
        assertEquals(MessageProperties.CONTENT_TYPE_JSON, properties.getContentType());
        assertEquals("UTF-8", properties.getContentEncoding());
        assertEquals(MessageDeliveryMode.PERSISTENT, properties.getDeliveryMode());
        assertEquals("msg-1", properties.getMessageId());
        assertEquals("corr-1", properties.getCorrelationId());
        assertEquals("60000", properties.getExpiration());
        assertEquals("session-1", properties.getHeader(RabbitBusClient.SESSION_ID_HEADER));
        assertEquals(30000L, (Long) properties.getHeader(RabbitBusClient.DELAY_HEADER));
        assertEquals("acme", properties.getHeader("tenant_id"));
    }

    @Test
    void shouldGenerateMessageIdWhenMissing() {
        ArgumentCaptor<Message> captor = ArgumentCaptor.forClass(Message.class);

        String id = client.send(new BusMessage("orders", DestinationType.QUEUE, null, null, "{}", null,
            null, null, Instant.parse("2024-03-15T09:00:00Z"), Map.of()));

        verify(rabbitTemplate).send(eq(""), eq("orders"), captor.capture());
        MessageProperties properties = captor.getValue().getMessageProperties();
        assertNotNull(id);
        assertEquals(id, properties.getMessageId());
        assertNull(properties.getExpiration());
        assertEquals(0L, (Long) properties.getHeader(RabbitBusClient.DELAY_HEADER));
    }
}
