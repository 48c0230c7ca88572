package com.ivamare.exchange.routing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable routing configuration.
 *
 * <p>Map form, as read from JSON or YAML:
 * <pre>
 * {
 *   "rules": [
 *     {"name": "high_value",
 *      "condition": {"field": "payload.amount", "operator": "&gt;", "value": 1000},
 *      "destination": "high-value-queue",
 *      "stop_on_match": true}
 *   ],
 *   "default_destination": "standard-queue",
 *   "queue_config": {"auto_create_queue": true}
 * }
 * </pre>
 *
 * @param rules Rules in evaluation order
 * @param defaultDestination Destination used when no rule matches, may be null
 * @param queueConfig Configuration for the queue handlers created by the router
 */
public record RoutingConfig(
    List<RoutingRule> rules,
    String defaultDestination,
    Map<String, Object> queueConfig
) {
    public RoutingConfig {
        rules = rules != null ? List.copyOf(rules) : List.of();
        queueConfig = queueConfig != null ? Collections.unmodifiableMap(new HashMap<>(queueConfig)) : Map.of();
    }

    public static RoutingConfig of(List<RoutingRule> rules, String defaultDestination) {
        return new RoutingConfig(rules, defaultDestination, Map.of());
    }

    @SuppressWarnings("unchecked")
    public static RoutingConfig fromMap(Map<String, Object> map) {
        List<RoutingRule> rules = new ArrayList<>();
        Object rawRules = map.get("rules");
        if (rawRules instanceof List<?> list) {
            for (Object rawRule : list) {
                if (!(rawRule instanceof Map<?, ?> ruleMap)) {
                    throw new IllegalArgumentException("Routing rule must be an object: " + rawRule);
                }
                rules.add(RoutingRule.fromMap(ruleMap));
            }
        }
        Object defaultDestination = map.get("default_destination");
        Object queueConfig = map.get("queue_config");
        return new RoutingConfig(
            rules,
            defaultDestination != null ? defaultDestination.toString() : null,
            queueConfig instanceof Map<?, ?> q ? (Map<String, Object>) q : Map.of());
    }
}
