package com.ivamare.exchange.routing;

import com.ivamare.exchange.model.Message;
import com.ivamare.exchange.model.ProcessingResult;
import com.ivamare.exchange.model.ProcessorInfo;
import com.ivamare.exchange.output.OutputHandler;
import com.ivamare.exchange.output.OutputHandlerFactory;
import com.ivamare.exchange.processor.MessageProcessor;
import com.ivamare.exchange.processor.ProcessorContext;
import com.ivamare.exchange.util.FieldPaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Routes messages to queues according to declarative rules.
 *
 * <p>Rules are evaluated in order. Each matching rule contributes its
 * destination; a destination reached by several rules is delivered to once.
 * A rule with {@code stop_on_match} ends the evaluation. When nothing matches
 * the default destination is used, if configured; otherwise the message is
 * intentionally not forwarded.
 *
 * <p>Example:
 * <pre>
 * RoutingConfig config = RoutingConfig.of(List.of(
 *     RoutingRule.of("high_value",
 *         RoutingCondition.of("payload.amount", RoutingOperator.GT, 1000),
 *         "high-value-queue")),
 *     "standard-queue");
 * GatewayRouter router = new GatewayRouter(config, outputHandlerFactory);
 * </pre>
 */
public class GatewayRouter implements MessageProcessor {

    private static final Logger log = LoggerFactory.getLogger(GatewayRouter.class);

    public static final String ROUTING_METADATA_KEY = "routing";

    private final RoutingConfig config;
    private final OutputHandlerFactory outputHandlerFactory;

    public GatewayRouter(RoutingConfig config, OutputHandlerFactory outputHandlerFactory) {
        this.config = config;
        this.outputHandlerFactory = outputHandlerFactory;
    }

    @Override
    public ProcessingResult process(Message message, ProcessorContext context) {
        long start = System.nanoTime();

        RoutingDecision decision = route(message);

        ProcessingResult result = ProcessingResult.createSuccess();
        OutputHandlerFactory factory = outputHandlerFactory != null
            ? outputHandlerFactory : context.outputHandlerFactory();
        for (String destination : decision.destinations()) {
            OutputHandler handler = factory.create("queue", destination, config.queueConfig());
            result.addOutputHandler(handler);
        }

        result.addMetadata(ROUTING_METADATA_KEY, decision.toMetadata());
        result.addMetadata("processing_time_ms", (System.nanoTime() - start) / 1_000_000.0);

        log.info("Gateway routing completed for message {}: {} destination(s) {}",
            message.getMessageId(), decision.destinations().size(), decision.destinations());
        return result;
    }

    /**
     * Evaluate the rules against a message without creating any handler.
     */
    public RoutingDecision route(Message message) {
        List<String> evaluated = new ArrayList<>();
        List<String> matched = new ArrayList<>();
        Set<String> destinations = new LinkedHashSet<>();

        for (RoutingRule rule : config.rules()) {
            evaluated.add(rule.name());
            if (!evaluate(message, rule)) {
                continue;
            }
            matched.add(rule.name());
            destinations.add(rule.destination());
            log.debug("Rule '{}' matched message {}, routing to {}",
                rule.name(), message.getMessageId(), rule.destination());
            if (rule.stopOnMatch()) {
                break;
            }
        }

        boolean defaultUsed = false;
        if (matched.isEmpty() && config.defaultDestination() != null) {
            destinations.add(config.defaultDestination());
            defaultUsed = true;
            log.debug("No rules matched message {}, using default destination {}",
                message.getMessageId(), config.defaultDestination());
        }

        return new RoutingDecision(evaluated, matched, new ArrayList<>(destinations), defaultUsed);
    }

    private boolean evaluate(Message message, RoutingRule rule) {
        RoutingCondition condition = rule.condition();
        if (condition.isEmpty()) {
            return true;
        }

        Optional<RoutingOperator> operator = RoutingOperator.fromSymbol(condition.operator());
        if (operator.isEmpty()) {
            log.warn("Unknown operator '{}' in rule '{}'", condition.operator(), rule.name());
            return false;
        }

        Object actual = FieldPaths.resolve(message, condition.field()).orElse(null);
        try {
            return operator.get().apply(actual, condition.value());
        } catch (RuntimeException e) {
            log.debug("Condition of rule '{}' failed: {} {} {} ({})",
                rule.name(), condition.field(), condition.operator(), condition.value(), e.getMessage());
            return false;
        }
    }

    @Override
    public boolean validateMessage(Message message) {
        return true;
    }

    @Override
    public boolean canRetry(Exception error) {
        return false;
    }

    @Override
    public ProcessorInfo getProcessorInfo() {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("type", "gateway");
        attributes.put("rule_count", config.rules().size());
        attributes.put("default_destination", config.defaultDestination());
        attributes.put("has_queue_config", !config.queueConfig().isEmpty());
        return new ProcessorInfo(getClass().getSimpleName(), "1.0.0", attributes);
    }

    public RoutingConfig getConfig() {
        return config;
    }
}
