package com.ivamare.exchange.output;

import com.ivamare.exchange.exception.ErrorCodes;
import com.ivamare.exchange.exception.OutputDeliveryException;
import com.ivamare.exchange.exception.TransportExceptionClassifier;
import com.ivamare.exchange.model.Message;
import com.ivamare.exchange.model.ProcessingResult;
import com.ivamare.exchange.policy.BackoffPolicy;
import com.ivamare.exchange.transport.DestinationNotFoundException;
import com.ivamare.exchange.transport.QueueClient;
import com.ivamare.exchange.transport.QueueClientFactory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Delivers results to a point-to-point queue.
 *
 * <p>Configuration:
 * <ul>
 *   <li>{@code auto_create_queue} - create a missing queue on first send (default true)</li>
 *   <li>{@code message_ttl_seconds} - message lifetime (default 604800, 7 days)</li>
 *   <li>{@code visibility_timeout_seconds} - advertised to consumers (default 30);
 *       never applied on send, where it would hide the message</li>
 * </ul>
 */
public class QueueOutputHandler extends AbstractOutputHandler {

    private static final Logger log = LoggerFactory.getLogger(QueueOutputHandler.class);

    public static final int DEFAULT_MESSAGE_TTL_SECONDS = 604800;
    public static final int DEFAULT_VISIBILITY_TIMEOUT_SECONDS = 30;

    static final int SERVICE_ERROR_BASE_DELAY = 5;
    static final int SEND_FAILURE_BASE_DELAY = 2;

    private static final Pattern QUEUE_NAME = Pattern.compile("^[a-z0-9](?:[a-z0-9-]{1,61})[a-z0-9]$");

    private final QueueClientFactory clientFactory;
    private final ObjectMapper objectMapper;
    private QueueClient client;

    public QueueOutputHandler(String destination, Map<String, Object> config,
                              QueueClientFactory clientFactory, ObjectMapper objectMapper,
                              BackoffPolicy backoffPolicy) {
        super(destination, config, backoffPolicy);
        this.clientFactory = clientFactory;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean validateConfiguration() {
        if (!isValidQueueName(getDestination())) {
            log.error("Invalid queue name: {}", getDestination());
            return false;
        }
        try {
            Integer ttl = messageTtlSeconds();
            Integer visibility = visibilityTimeoutSeconds();
            return ttl > 0 && visibility >= 0;
        } catch (IllegalArgumentException e) {
            log.error("Invalid queue handler configuration for {}: {}", getDestination(), e.getMessage());
            return false;
        }
    }

    /**
     * 3-63 characters of lower-case letters, digits and hyphens, starting and
     * ending with a letter or digit, without consecutive hyphens.
     */
    static boolean isValidQueueName(String name) {
        return name != null && QUEUE_NAME.matcher(name).matches() && !name.contains("--");
    }

    @Override
    protected Map<String, Object> deliver(Message message, ProcessingResult result) {
        String content = serialize(message, result);
        QueueClient queueClient = getClient();

        String queueMessageId;
        try {
            queueMessageId = sendWithAutoCreate(queueClient, content);
        } catch (OutputDeliveryException e) {
            throw e;
        } catch (RuntimeException e) {
            throw classifySendFailure(e);
        }

        log.info("Message {} sent to queue {} (queue message id {})",
            message.getMessageId(), getDestination(), queueMessageId);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("queue_message_id", queueMessageId);
        metadata.put("content_length", content.getBytes(StandardCharsets.UTF_8).length);
        metadata.put("queue_name", getDestination());
        return metadata;
    }

    private String sendWithAutoCreate(QueueClient queueClient, String content) {
        Integer ttl = messageTtlSeconds();
        try {
            return queueClient.send(getDestination(), content, ttl);
        } catch (DestinationNotFoundException e) {
            if (!autoCreateQueue()) {
                Map<String, Object> details = new HashMap<>();
                details.put("queue_name", getDestination());
                details.put("auto_create_queue", false);
                throw new OutputDeliveryException(
                    "Queue " + getDestination() + " does not exist and auto_create_queue is disabled",
                    ErrorCodes.QUEUE_NOT_FOUND, false, null, details, e);
            }
            createQueue(queueClient);
            return queueClient.send(getDestination(), content, ttl);
        }
    }

    private void createQueue(QueueClient queueClient) {
        try {
            queueClient.ensureExists(getDestination());
            log.info("Created queue: {}", getDestination());
        } catch (RuntimeException e) {
            Map<String, Object> details = new HashMap<>();
            details.put("queue_name", getDestination());
            details.put("original_error", e.getMessage());
            throw new OutputDeliveryException(
                "Failed to create queue " + getDestination(),
                ErrorCodes.QUEUE_CREATION_FAILED, true, SEND_FAILURE_BASE_DELAY, details, e);
        }
    }

    private OutputDeliveryException classifySendFailure(RuntimeException e) {
        Map<String, Object> details = new HashMap<>();
        details.put("queue_name", getDestination());
        details.put("exception_type", e.getClass().getName());

        if (TransportExceptionClassifier.isServiceError(e)) {
            details.put("reason", TransportExceptionClassifier.getServiceErrorReason(e));
            return new OutputDeliveryException(
                "Queue service error when sending to " + getDestination() + ": " + e.getMessage(),
                ErrorCodes.QUEUE_SERVICE_ERROR, true, SERVICE_ERROR_BASE_DELAY, details, e);
        }
        return new OutputDeliveryException(
            "Failed to send message to queue " + getDestination() + ": " + e.getMessage(),
            ErrorCodes.QUEUE_SEND_FAILED, true, SEND_FAILURE_BASE_DELAY, details, e);
    }

    private synchronized QueueClient getClient() {
        if (client == null) {
            try {
                client = clientFactory.create();
            } catch (RuntimeException e) {
                Map<String, Object> details = new HashMap<>();
                details.put("queue_name", getDestination());
                details.put("exception_type", e.getClass().getName());
                throw new OutputDeliveryException(
                    "Failed to create queue client for " + getDestination(),
                    ErrorCodes.QUEUE_CLIENT_CREATION_FAILED, false, null, details, e);
            }
        }
        return client;
    }

    private String serialize(Message message, ProcessingResult result) {
        Map<String, Object> routing = new LinkedHashMap<>();
        routing.put("source_handler", getHandlerName());
        routing.put("target_queue", getDestination());
        routing.put("destination_type", "queue");
        try {
            return objectMapper.writeValueAsString(OutputEnvelope.build(message, result, routing));
        } catch (JsonProcessingException e) {
            Map<String, Object> details = new HashMap<>();
            details.put("message_id", message.getMessageId());
            throw new OutputDeliveryException(
                "Failed to serialize message for queue delivery",
                ErrorCodes.MESSAGE_SERIALIZATION_FAILED, false, null, details, e);
        }
    }

    @Override
    public Map<String, Object> getHandlerInfo() {
        Map<String, Object> info = super.getHandlerInfo();
        info.put("handler_type", "queue");
        info.put("auto_create_queue", autoCreateQueue());
        return info;
    }

    boolean autoCreateQueue() {
        return configBoolean("auto_create_queue", true);
    }

    Integer messageTtlSeconds() {
        return configInteger("message_ttl_seconds", DEFAULT_MESSAGE_TTL_SECONDS);
    }

    Integer visibilityTimeoutSeconds() {
        return configInteger("visibility_timeout_seconds", DEFAULT_VISIBILITY_TIMEOUT_SECONDS);
    }
}
