package com.ivamare.exchange.transport;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A message ready to be published on a bus.
 *
 * @param destination queue or topic name
 * @param destinationType whether the destination is a queue or a topic
 * @param messageId message id, also used for duplicate detection by the broker
 * @param correlationId correlation id, may be null
 * @param body serialized message body
 * @param contentType MIME type of the body
 * @param sessionId session for ordered delivery, may be null
 * @param timeToLiveSeconds message lifetime, null for no expiry
 * @param scheduledEnqueueTime earliest delivery time, null for immediate delivery
 * @param applicationProperties custom properties carried with the message
 */
public record BusMessage(
    String destination,
    DestinationType destinationType,
    String messageId,
    String correlationId,
    String body,
    String contentType,
    String sessionId,
    Integer timeToLiveSeconds,
    Instant scheduledEnqueueTime,
    Map<String, Object> applicationProperties
) {
    public BusMessage {
        if (destination == null || destination.isBlank()) {
            throw new IllegalArgumentException("destination is required");
        }
        if (destinationType == null) {
            throw new IllegalArgumentException("destinationType is required");
        }
        applicationProperties = applicationProperties != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(applicationProperties))
            : Map.of();
    }
}
