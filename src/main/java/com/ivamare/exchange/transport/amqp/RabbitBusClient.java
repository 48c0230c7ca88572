package com.ivamare.exchange.transport.amqp;

import com.ivamare.exchange.transport.BusClient;
import com.ivamare.exchange.transport.BusMessage;
import com.ivamare.exchange.transport.DestinationType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageDeliveryMode;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.rabbit.core.RabbitTemplate;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.UUID;

/**
 * Bus transport over RabbitMQ.
 *
 * <p>Queues are addressed through the default exchange with the queue name as
 * routing key. Topics map to an exchange of the same name and are published
 * with an empty routing key, so every bound subscription receives a copy.
 * Scheduled delivery relies on the delayed message exchange plugin
 * ({@code x-delay} header).
 */
public class RabbitBusClient implements BusClient {

    private static final Logger log = LoggerFactory.getLogger(RabbitBusClient.class);

    static final String SESSION_ID_HEADER = "x-session-id";
    static final String DELAY_HEADER = "x-delay";

    private final RabbitTemplate rabbitTemplate;
    private final Clock clock;

    public RabbitBusClient(RabbitTemplate rabbitTemplate) {
        this(rabbitTemplate, Clock.systemUTC());
    }

    public RabbitBusClient(RabbitTemplate rabbitTemplate, Clock clock) {
        this.rabbitTemplate = rabbitTemplate;
        this.clock = clock;
    }

    @Override
    public String send(BusMessage busMessage) {
        Message message = toAmqpMessage(busMessage);
        String messageId = message.getMessageProperties().getMessageId();

        if (busMessage.destinationType() == DestinationType.TOPIC) {
            rabbitTemplate.send(busMessage.destination(), "", message);
        } else {
            rabbitTemplate.send("", busMessage.destination(), message);
        }

        log.debug("Published message {} to {} {}",
            messageId, busMessage.destinationType().getValue(), busMessage.destination());
        return messageId;
    }

    Message toAmqpMessage(BusMessage busMessage) {
        byte[] body = busMessage.body().getBytes(StandardCharsets.UTF_8);

        MessageProperties properties = new MessageProperties();
        properties.setContentType(busMessage.contentType() != null
            ? busMessage.contentType() : MessageProperties.CONTENT_TYPE_JSON);
        properties.setContentEncoding(StandardCharsets.UTF_8.name());
        properties.setContentLength(body.length);
        properties.setDeliveryMode(MessageDeliveryMode.PERSISTENT);
        properties.setMessageId(busMessage.messageId() != null
            ? busMessage.messageId() : UUID.randomUUID().toString());

        if (busMessage.correlationId() != null) {
            properties.setCorrelationId(busMessage.correlationId());
        }
        if (busMessage.sessionId() != null) {
            properties.setHeader(SESSION_ID_HEADER, busMessage.sessionId());
        }
        if (busMessage.timeToLiveSeconds() != null && busMessage.timeToLiveSeconds() > 0) {
            properties.setExpiration(String.valueOf(busMessage.timeToLiveSeconds() * 1000L));
        }
        if (busMessage.scheduledEnqueueTime() != null) {
            long delayMs = Duration.between(clock.instant(), busMessage.scheduledEnqueueTime()).toMillis();
            properties.setHeader(DELAY_HEADER, Math.max(0L, delayMs));
        }
        busMessage.applicationProperties().forEach(properties::setHeader);

        return new Message(body, properties);
    }
}
