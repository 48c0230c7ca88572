package com.ivamare.exchange.routing;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of evaluating the routing rules for one message.
 *
 * @param evaluatedRules names of the rules evaluated, in order
 * @param matchedRules names of the rules that matched, in order
 * @param destinations distinct destinations, in first-match order
 * @param defaultUsed whether the default destination was chosen
 */
public record RoutingDecision(
    List<String> evaluatedRules,
    List<String> matchedRules,
    List<String> destinations,
    boolean defaultUsed
) {
    public RoutingDecision {
        evaluatedRules = List.copyOf(evaluatedRules);
        matchedRules = List.copyOf(matchedRules);
        destinations = List.copyOf(destinations);
    }

    public Map<String, Object> toMetadata() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("evaluated_rules", evaluatedRules);
        metadata.put("matched_rules", matchedRules);
        metadata.put("destinations", destinations);
        metadata.put("default_used", defaultUsed);
        return metadata;
    }
}
