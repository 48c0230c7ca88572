package com.ivamare.exchange.model;

import com.ivamare.exchange.util.PathNavigable;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * A unit of work flowing through the exchange.
 *
 * <p>Identity, payload and entity reference are fixed at construction.
 * Processing state changes only through {@link #incrementRetry()} and
 * {@link #markProcessed()}; the retry count never decreases.
 * Metadata and routing info are open maps that processors may annotate.
 */
public class Message implements PathNavigable {

    public static final int DEFAULT_MAX_RETRIES = 3;

    private final String messageId;
    private final String correlationId;
    private final MessageType messageType;
    private final EntityReference entityReference;
    private final Map<String, Object> payload;
    private final Map<String, Object> metadata;
    private final Map<String, Object> routingInfo;
    private final Instant createdAt;
    private final int maxRetries;
    private Instant processedAt;
    private int retryCount;

    private Message(Builder builder) {
        this.messageId = builder.messageId != null ? builder.messageId : UUID.randomUUID().toString();
        this.correlationId = builder.correlationId;
        this.messageType = builder.messageType != null ? builder.messageType : MessageType.ENTITY_PROCESSING;
        this.entityReference = builder.entityReference;
        this.payload = builder.payload != null ? new LinkedHashMap<>(builder.payload) : new LinkedHashMap<>();
        this.metadata = builder.metadata != null ? new LinkedHashMap<>(builder.metadata) : new LinkedHashMap<>();
        this.routingInfo = builder.routingInfo != null ? new LinkedHashMap<>(builder.routingInfo) : new LinkedHashMap<>();
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.processedAt = builder.processedAt;
        if (builder.retryCount < 0) {
            throw new IllegalArgumentException("retryCount must be >= 0");
        }
        if (builder.maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        this.retryCount = builder.retryCount;
        this.maxRetries = builder.maxRetries;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getMessageId() {
        return messageId;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public MessageType getMessageType() {
        return messageType;
    }

    public EntityReference getEntityReference() {
        return entityReference;
    }

    public Map<String, Object> getPayload() {
        return payload;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public Map<String, Object> getRoutingInfo() {
        return routingInfo;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getProcessedAt() {
        return processedAt;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    /**
     * Tenant of the referenced entity, if any.
     */
    public Optional<String> getTenantId() {
        return entityReference != null ? Optional.ofNullable(entityReference.tenantId()) : Optional.empty();
    }

    public boolean canRetry() {
        return retryCount < maxRetries;
    }

    public void incrementRetry() {
        retryCount++;
    }

    public void markProcessed() {
        processedAt = Instant.now();
    }

    @Override
    public Optional<Object> attribute(String name) {
        Object value = switch (name) {
            case "message_id", "messageId" -> messageId;
            case "correlation_id", "correlationId" -> correlationId;
            case "message_type", "messageType" -> messageType.getValue();
            case "entity_reference", "entityReference" -> entityReference;
            case "payload" -> payload;
            case "metadata" -> metadata;
            case "routing_info", "routingInfo" -> routingInfo;
            case "created_at", "createdAt" -> createdAt;
            case "processed_at", "processedAt" -> processedAt;
            case "retry_count", "retryCount" -> retryCount;
            case "max_retries", "maxRetries" -> maxRetries;
            default -> null;
        };
        return Optional.ofNullable(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Message other)) return false;
        return messageId.equals(other.messageId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(messageId);
    }

    @Override
    public String toString() {
        return "Message{messageId=" + messageId
            + ", correlationId=" + correlationId
            + ", type=" + messageType.getValue()
            + ", retryCount=" + retryCount + "/" + maxRetries + "}";
    }

    public static final class Builder {
        private String messageId;
        private String correlationId;
        private MessageType messageType;
        private EntityReference entityReference;
        private Map<String, Object> payload;
        private Map<String, Object> metadata;
        private Map<String, Object> routingInfo;
        private Instant createdAt;
        private Instant processedAt;
        private int retryCount;
        private int maxRetries = DEFAULT_MAX_RETRIES;

        private Builder() {
        }

        public Builder messageId(String messageId) {
            this.messageId = messageId;
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder messageType(MessageType messageType) {
            this.messageType = messageType;
            return this;
        }

        public Builder entityReference(EntityReference entityReference) {
            this.entityReference = entityReference;
            return this;
        }

        public Builder payload(Map<String, Object> payload) {
            this.payload = payload;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder routingInfo(Map<String, Object> routingInfo) {
            this.routingInfo = routingInfo;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder processedAt(Instant processedAt) {
            this.processedAt = processedAt;
            return this;
        }

        public Builder retryCount(int retryCount) {
            this.retryCount = retryCount;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Message build() {
            return new Message(this);
        }
    }
}
