package com.ivamare.exchange.output;

import com.ivamare.exchange.policy.BackoffPolicy;
import com.ivamare.exchange.transport.BusClientFactory;
import com.ivamare.exchange.transport.QueueClientFactory;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Creates output handlers by type name.
 *
 * <p>Supported types: {@code queue}, {@code service_bus} (alias {@code bus}),
 * {@code noop} and {@code file}. Per-type defaults are applied underneath
 * the configuration given at creation time.
 */
public class OutputHandlerFactory {

    private final QueueClientFactory queueClientFactory;
    private final BusClientFactory busClientFactory;
    private final ObjectMapper objectMapper;
    private final BackoffPolicy backoffPolicy;
    private final Map<String, Object> queueDefaults;
    private final Map<String, Object> busDefaults;

    public OutputHandlerFactory(QueueClientFactory queueClientFactory, BusClientFactory busClientFactory,
                                ObjectMapper objectMapper, BackoffPolicy backoffPolicy) {
        this(queueClientFactory, busClientFactory, objectMapper, backoffPolicy, Map.of(), Map.of());
    }

    public OutputHandlerFactory(QueueClientFactory queueClientFactory, BusClientFactory busClientFactory,
                                ObjectMapper objectMapper, BackoffPolicy backoffPolicy,
                                Map<String, Object> queueDefaults, Map<String, Object> busDefaults) {
        this.queueClientFactory = queueClientFactory;
        this.busClientFactory = busClientFactory;
        this.objectMapper = objectMapper;
        this.backoffPolicy = backoffPolicy;
        this.queueDefaults = queueDefaults != null ? Map.copyOf(queueDefaults) : Map.of();
        this.busDefaults = busDefaults != null ? Map.copyOf(busDefaults) : Map.of();
    }

    /**
     * Create a handler.
     *
     * @param type handler type name
     * @param destination logical destination
     * @param config handler configuration, may be null
     * @throws IllegalArgumentException for an unknown type
     * @throws IllegalStateException when the transport for the type is not available
     */
    public OutputHandler create(String type, String destination, Map<String, Object> config) {
        if (type == null) {
            throw new IllegalArgumentException("Output handler type is required");
        }
        Map<String, Object> settings = config != null ? config : Map.of();

        switch (type.toLowerCase(Locale.ROOT)) {
            case "queue":
                if (queueClientFactory == null) {
                    throw new IllegalStateException("No queue transport configured");
                }
                return new QueueOutputHandler(destination, merge(queueDefaults, settings),
                    queueClientFactory, objectMapper, backoffPolicy);
            case "service_bus":
            case "bus":
                if (busClientFactory == null) {
                    throw new IllegalStateException("No bus transport configured");
                }
                return new BusOutputHandler(destination, merge(busDefaults, settings),
                    busClientFactory, objectMapper, backoffPolicy);
            case "noop":
                return new NoOpOutputHandler(destination, settings);
            case "file":
                return new FileOutputHandler(destination, settings, objectMapper, backoffPolicy);
            default:
                throw new IllegalArgumentException("Unknown output handler type: " + type);
        }
    }

    public OutputHandler queue(String destination) {
        return create("queue", destination, Map.of());
    }

    private static Map<String, Object> merge(Map<String, Object> defaults, Map<String, Object> config) {
        Map<String, Object> merged = new HashMap<>(defaults);
        merged.putAll(config);
        return merged;
    }
}
