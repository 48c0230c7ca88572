package com.ivamare.exchange.routing;

import java.util.Map;

/**
 * A named routing rule.
 *
 * @param name Rule name reported in routing metadata
 * @param condition Condition to evaluate
 * @param destination Queue to route to when the condition matches
 * @param stopOnMatch Whether to skip the remaining rules after a match
 */
public record RoutingRule(
    String name,
    RoutingCondition condition,
    String destination,
    boolean stopOnMatch
) {
    public RoutingRule {
        if (destination == null || destination.isBlank()) {
            throw new IllegalArgumentException("Routing rule '" + name + "' has no destination");
        }
        name = name != null ? name : "unnamed";
        condition = condition != null ? condition : RoutingCondition.empty();
    }

    public static RoutingRule of(String name, RoutingCondition condition, String destination) {
        return new RoutingRule(name, condition, destination, false);
    }

    static RoutingRule fromMap(Map<?, ?> map) {
        Object name = map.get("name");
        Object destination = map.get("destination");
        Object condition = map.get("condition");
        Object stopOnMatch = map.get("stop_on_match");
        return new RoutingRule(
            name != null ? name.toString() : null,
            condition instanceof Map<?, ?> c ? RoutingCondition.fromMap(c) : RoutingCondition.empty(),
            destination != null ? destination.toString() : null,
            Boolean.parseBoolean(String.valueOf(stopOnMatch)));
    }
}
