package com.ivamare.exchange.output;

import com.ivamare.exchange.exception.ErrorCodes;
import com.ivamare.exchange.exception.OutputDeliveryException;
import com.ivamare.exchange.exception.TransportExceptionClassifier;
import com.ivamare.exchange.model.EntityReference;
import com.ivamare.exchange.model.Message;
import com.ivamare.exchange.model.ProcessingResult;
import com.ivamare.exchange.policy.BackoffPolicy;
import com.ivamare.exchange.transport.BusClient;
import com.ivamare.exchange.transport.BusClientFactory;
import com.ivamare.exchange.transport.BusMessage;
import com.ivamare.exchange.transport.DestinationType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Delivers results to a bus queue or topic.
 *
 * <p>Configuration:
 * <ul>
 *   <li>{@code destination_type} - {@code queue} (default) or {@code topic}</li>
 *   <li>{@code session_id} - session for ordered delivery</li>
 *   <li>{@code time_to_live_seconds} - message lifetime, none by default</li>
 *   <li>{@code scheduled_enqueue_time} - ISO-8601 instant for delayed delivery</li>
 *   <li>{@code message_properties} - custom application properties</li>
 * </ul>
 *
 * <p>Every message also carries {@code source_processor},
 * {@code entity_external_id}, {@code entity_canonical_type},
 * {@code processing_status} and {@code tenant_id} as application properties.
 */
public class BusOutputHandler extends AbstractOutputHandler {

    private static final Logger log = LoggerFactory.getLogger(BusOutputHandler.class);

    static final int SERVICE_ERROR_BASE_DELAY = 5;
    static final int SEND_FAILURE_BASE_DELAY = 2;

    private static final Pattern ENTITY_NAME = Pattern.compile("^[A-Za-z0-9._/-]{1,260}$");

    private final BusClientFactory clientFactory;
    private final ObjectMapper objectMapper;
    private BusClient client;

    public BusOutputHandler(String destination, Map<String, Object> config,
                            BusClientFactory clientFactory, ObjectMapper objectMapper,
                            BackoffPolicy backoffPolicy) {
        super(destination, config, backoffPolicy);
        this.clientFactory = clientFactory;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean validateConfiguration() {
        if (!isValidEntityName(getDestination())) {
            log.error("Invalid bus entity name: {}", getDestination());
            return false;
        }
        try {
            DestinationType.fromValue(configString("destination_type", DestinationType.QUEUE.getValue()));
            Integer ttl = timeToLiveSeconds();
            if (ttl != null && ttl <= 0) {
                return false;
            }
            scheduledEnqueueTime();
            return true;
        } catch (IllegalArgumentException | DateTimeParseException e) {
            log.error("Invalid bus handler configuration for {}: {}", getDestination(), e.getMessage());
            return false;
        }
    }

    /**
     * 1-260 characters of letters, digits, '.', '-', '_' and '/', with no
     * leading or trailing '/' and no empty path segment.
     */
    static boolean isValidEntityName(String name) {
        return name != null
            && ENTITY_NAME.matcher(name).matches()
            && !name.startsWith("/")
            && !name.endsWith("/")
            && !name.contains("//");
    }

    @Override
    protected Map<String, Object> deliver(Message message, ProcessingResult result) {
        DestinationType destinationType = destinationType();
        BusMessage busMessage = prepareMessage(message, result, destinationType);
        BusClient busClient = getClient();

        String busMessageId;
        try {
            busMessageId = busClient.send(busMessage);
        } catch (RuntimeException e) {
            throw classifySendFailure(e, destinationType);
        }

        log.info("Message {} sent to {} {} (bus message id {})",
            message.getMessageId(), destinationType.getValue(), getDestination(), busMessageId);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("service_bus_message_id", busMessageId);
        metadata.put("destination", getDestination());
        metadata.put("destination_type", destinationType.getValue());
        metadata.put("session_id", busMessage.sessionId());
        metadata.put("content_length", busMessage.body().getBytes(StandardCharsets.UTF_8).length);
        metadata.put("time_to_live_seconds", busMessage.timeToLiveSeconds());
        metadata.put("application_properties_count", busMessage.applicationProperties().size());
        return metadata;
    }

    private DestinationType destinationType() {
        String value = configString("destination_type", DestinationType.QUEUE.getValue());
        try {
            return DestinationType.fromValue(value);
        } catch (IllegalArgumentException e) {
            Map<String, Object> details = new HashMap<>();
            details.put("destination_type", value);
            throw new OutputDeliveryException(
                "Unsupported destination type: " + value,
                ErrorCodes.UNSUPPORTED_DESTINATION_TYPE, false, null, details, e);
        }
    }

    private BusMessage prepareMessage(Message message, ProcessingResult result, DestinationType destinationType) {
        try {
            Map<String, Object> routing = new LinkedHashMap<>();
            routing.put("source_handler", getHandlerName());
            routing.put("target_destination", getDestination());
            routing.put("destination_type", destinationType.getValue());
            String body = objectMapper.writeValueAsString(OutputEnvelope.build(message, result, routing));

            return new BusMessage(
                getDestination(),
                destinationType,
                message.getMessageId(),
                message.getCorrelationId(),
                body,
                "application/json",
                configString("session_id", null),
                timeToLiveSeconds(),
                scheduledEnqueueTime(),
                applicationProperties(message, result)
            );
        } catch (JsonProcessingException | RuntimeException e) {
            Map<String, Object> details = new HashMap<>();
            details.put("message_id", message.getMessageId());
            details.put("exception_type", e.getClass().getName());
            throw new OutputDeliveryException(
                "Failed to prepare bus message for " + getDestination() + ": " + e.getMessage(),
                ErrorCodes.MESSAGE_PREPARATION_FAILED, false, null, details, e);
        }
    }

    private Map<String, Object> applicationProperties(Message message, ProcessingResult result) {
        Map<String, Object> properties = new LinkedHashMap<>(configMap("message_properties"));

        properties.put("source_processor", result.getProcessorInfo() != null
            ? result.getProcessorInfo().name() : "unknown");
        EntityReference reference = message.getEntityReference();
        if (reference != null) {
            putIfNotNull(properties, "entity_external_id", reference.externalId());
            putIfNotNull(properties, "entity_canonical_type", reference.canonicalType());
            putIfNotNull(properties, "tenant_id", reference.tenantId());
        }
        properties.put("processing_status", result.getStatus().getValue());
        return properties;
    }

    private static void putIfNotNull(Map<String, Object> map, String key, Object value) {
        if (value != null) {
            map.put(key, value);
        }
    }

    private OutputDeliveryException classifySendFailure(RuntimeException e, DestinationType destinationType) {
        Map<String, Object> details = new HashMap<>();
        details.put("destination", getDestination());
        details.put("destination_type", destinationType.getValue());
        details.put("exception_type", e.getClass().getName());

        if (TransportExceptionClassifier.isServiceError(e)) {
            details.put("reason", TransportExceptionClassifier.getServiceErrorReason(e));
            return new OutputDeliveryException(
                "Bus service error when sending to " + getDestination() + ": " + e.getMessage(),
                ErrorCodes.SERVICE_BUS_SERVICE_ERROR, true, SERVICE_ERROR_BASE_DELAY, details, e);
        }
        return new OutputDeliveryException(
            "Failed to send message to " + getDestination() + ": " + e.getMessage(),
            ErrorCodes.SERVICE_BUS_SEND_FAILED, true, SEND_FAILURE_BASE_DELAY, details, e);
    }

    private synchronized BusClient getClient() {
        if (client == null) {
            try {
                client = clientFactory.create();
            } catch (RuntimeException e) {
                Map<String, Object> details = new HashMap<>();
                details.put("destination", getDestination());
                details.put("exception_type", e.getClass().getName());
                throw new OutputDeliveryException(
                    "Failed to create bus client for " + getDestination(),
                    ErrorCodes.SERVICE_BUS_CLIENT_CREATION_FAILED, false, null, details, e);
            }
        }
        return client;
    }

    Integer timeToLiveSeconds() {
        Integer ttl = configInteger("time_to_live_seconds", null);
        return ttl != null ? ttl : configInteger("message_time_to_live", null);
    }

    Instant scheduledEnqueueTime() {
        Object value = getConfig().get("scheduled_enqueue_time");
        if (value == null) {
            return null;
        }
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof OffsetDateTime offsetDateTime) {
            return offsetDateTime.toInstant();
        }
        return OffsetDateTime.parse(value.toString()).toInstant();
    }

    @Override
    public Map<String, Object> getHandlerInfo() {
        Map<String, Object> info = super.getHandlerInfo();
        info.put("handler_type", "service_bus");
        info.put("destination_type", configString("destination_type", DestinationType.QUEUE.getValue()));
        info.put("time_to_live_seconds", getConfig().get("time_to_live_seconds"));
        return info;
    }
}
