package com.ivamare.exchange.output;

import com.ivamare.exchange.model.Message;
import com.ivamare.exchange.model.ProcessingResult;
import com.ivamare.exchange.policy.BackoffPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Output handler for terminal processors that intentionally produce no output.
 *
 * <p>Always succeeds. Configuration keys: {@code reason} (default
 * "No output required") and {@code metadata}, merged into the result metadata.
 */
public class NoOpOutputHandler extends AbstractOutputHandler {

    private static final Logger log = LoggerFactory.getLogger(NoOpOutputHandler.class);

    public static final String DEFAULT_DESTINATION = "noop";
    public static final String DEFAULT_REASON = "No output required";

    public NoOpOutputHandler() {
        this(DEFAULT_DESTINATION, Map.of());
    }

    public NoOpOutputHandler(String destination, Map<String, Object> config) {
        super(destination != null ? destination : DEFAULT_DESTINATION, config, BackoffPolicy.defaultPolicy());
    }

    @Override
    public boolean validateConfiguration() {
        return true;
    }

    @Override
    public boolean supportsRetry() {
        return false;
    }

    @Override
    protected Map<String, Object> deliver(Message message, ProcessingResult result) {
        log.debug("No output for message {}: {}", message.getMessageId(), reason());

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("reason", reason());
        metadata.put("no_output_produced", true);
        metadata.put("processing_completed", true);
        metadata.put("message_id", message.getMessageId());
        metadata.put("correlation_id", message.getCorrelationId());
        metadata.put("entities_affected",
            result.getEntitiesCreated().size() + result.getEntitiesUpdated().size());
        metadata.putAll(configMap("metadata"));
        return metadata;
    }

    @Override
    public Map<String, Object> getHandlerInfo() {
        Map<String, Object> info = super.getHandlerInfo();
        info.put("handler_type", "no_operation");
        info.put("reason", reason());
        info.put("produces_output", false);
        info.put("side_effects", false);
        info.put("always_succeeds", true);
        info.put("metadata_keys", new ArrayList<>(configMap("metadata").keySet()));
        return info;
    }

    String reason() {
        return configString("reason", DEFAULT_REASON);
    }
}
