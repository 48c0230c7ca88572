package com.ivamare.exchange;

import com.ivamare.exchange.hash.HashConfig;
import com.ivamare.exchange.processor.DeliveryMode;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Configuration properties for the message exchange.
 *
 * <p>Example configuration:
 * <pre>
 * exchange:
 *   enabled: true
 *   tenant-id: acme
 *   dead-letter-queue: dead-letter-queue
 *   backoff:
 *     base-delay-seconds: 1
 *     max-delay-seconds: 300
 *     multiplier: 2.0
 *     jitter: true
 *   queue:
 *     auto-create-queue: true
 *     message-ttl-seconds: 604800
 *     visibility-timeout-seconds: 30
 *   bus:
 *     destination-type: queue
 *     time-to-live-seconds: 3600
 *   processing:
 *     delivery-mode: best_effort
 *   hash:
 *     ignore-fields: [created_at, updated_at, metadata]
 * </pre>
 */
@ConfigurationProperties(prefix = "exchange")
public class ExchangeProperties {

    /**
     * Enable/disable message exchange auto-configuration.
     */
    private boolean enabled = true;

    /**
     * Tenant every message is processed for. When unset the tenant of the
     * message's entity reference is used.
     */
    private String tenantId;

    /**
     * Queue receiving messages that failed permanently. Blank disables dead-lettering.
     */
    private String deadLetterQueue = "dead-letter-queue";

    private BackoffProperties backoff = new BackoffProperties();

    private QueueProperties queue = new QueueProperties();

    private BusProperties bus = new BusProperties();

    private ProcessingProperties processing = new ProcessingProperties();

    private HashProperties hash = new HashProperties();

    // Getters and setters

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getTenantId() {
        return tenantId;
    }

    public void setTenantId(String tenantId) {
        this.tenantId = tenantId;
    }

    public String getDeadLetterQueue() {
        return deadLetterQueue;
    }

    public void setDeadLetterQueue(String deadLetterQueue) {
        this.deadLetterQueue = deadLetterQueue;
    }

    public BackoffProperties getBackoff() {
        return backoff;
    }

    public void setBackoff(BackoffProperties backoff) {
        this.backoff = backoff;
    }

    public QueueProperties getQueue() {
        return queue;
    }

    public void setQueue(QueueProperties queue) {
        this.queue = queue;
    }

    public BusProperties getBus() {
        return bus;
    }

    public void setBus(BusProperties bus) {
        this.bus = bus;
    }

    public ProcessingProperties getProcessing() {
        return processing;
    }

    public void setProcessing(ProcessingProperties processing) {
        this.processing = processing;
    }

    public HashProperties getHash() {
        return hash;
    }

    public void setHash(HashProperties hash) {
        this.hash = hash;
    }

    /**
     * Retry backoff for output delivery.
     */
    public static class BackoffProperties {

        private int baseDelaySeconds = 1;

        private int maxDelaySeconds = 300;

        private double multiplier = 2.0;

        /**
         * Spread retries by up to 25% in either direction.
         */
        private boolean jitter = true;

        // Getters and setters

        public int getBaseDelaySeconds() {
            return baseDelaySeconds;
        }

        public void setBaseDelaySeconds(int baseDelaySeconds) {
            this.baseDelaySeconds = baseDelaySeconds;
        }

        public int getMaxDelaySeconds() {
            return maxDelaySeconds;
        }

        public void setMaxDelaySeconds(int maxDelaySeconds) {
            this.maxDelaySeconds = maxDelaySeconds;
        }

        public double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }

        public boolean isJitter() {
            return jitter;
        }

        public void setJitter(boolean jitter) {
            this.jitter = jitter;
        }
    }

    /**
     * Defaults for queue output handlers.
     */
    public static class QueueProperties {

        /**
         * Create a missing queue on first send.
         */
        private boolean autoCreateQueue = true;

        private int messageTtlSeconds = 604800;

        private int visibilityTimeoutSeconds = 30;

        // Getters and setters

        public boolean isAutoCreateQueue() {
            return autoCreateQueue;
        }

        public void setAutoCreateQueue(boolean autoCreateQueue) {
            this.autoCreateQueue = autoCreateQueue;
        }

        public int getMessageTtlSeconds() {
            return messageTtlSeconds;
        }

        public void setMessageTtlSeconds(int messageTtlSeconds) {
            this.messageTtlSeconds = messageTtlSeconds;
        }

        public int getVisibilityTimeoutSeconds() {
            return visibilityTimeoutSeconds;
        }

        public void setVisibilityTimeoutSeconds(int visibilityTimeoutSeconds) {
            this.visibilityTimeoutSeconds = visibilityTimeoutSeconds;
        }

        Map<String, Object> toHandlerDefaults() {
            Map<String, Object> defaults = new LinkedHashMap<>();
            defaults.put("auto_create_queue", autoCreateQueue);
            defaults.put("message_ttl_seconds", messageTtlSeconds);
            defaults.put("visibility_timeout_seconds", visibilityTimeoutSeconds);
            return defaults;
        }
    }

    /**
     * Defaults for bus output handlers.
     */
    public static class BusProperties {

        /**
         * queue or topic.
         */
        private String destinationType = "queue";

        private Integer timeToLiveSeconds;

        // Getters and setters

        public String getDestinationType() {
            return destinationType;
        }

        public void setDestinationType(String destinationType) {
            this.destinationType = destinationType;
        }

        public Integer getTimeToLiveSeconds() {
            return timeToLiveSeconds;
        }

        public void setTimeToLiveSeconds(Integer timeToLiveSeconds) {
            this.timeToLiveSeconds = timeToLiveSeconds;
        }

        Map<String, Object> toHandlerDefaults() {
            Map<String, Object> defaults = new LinkedHashMap<>();
            defaults.put("destination_type", destinationType);
            if (timeToLiveSeconds != null) {
                defaults.put("time_to_live_seconds", timeToLiveSeconds);
            }
            return defaults;
        }
    }

    public static class ProcessingProperties {

        /**
         * Whether a failed output delivery fails the whole message.
         */
        private DeliveryMode deliveryMode = DeliveryMode.BEST_EFFORT;

        // Getters and setters

        public DeliveryMode getDeliveryMode() {
            return deliveryMode;
        }

        public void setDeliveryMode(DeliveryMode deliveryMode) {
            this.deliveryMode = deliveryMode;
        }
    }

    public static class HashProperties {

        /**
         * Top-level fields left out of content hashes.
         */
        private Set<String> ignoreFields = new TreeSet<>(HashConfig.DEFAULT_IGNORE_FIELDS);

        // Getters and setters

        public Set<String> getIgnoreFields() {
            return ignoreFields;
        }

        public void setIgnoreFields(Set<String> ignoreFields) {
            this.ignoreFields = ignoreFields;
        }
    }
}
