package com.ivamare.exchange.routing;

import java.util.Map;

/**
 * Condition of a routing rule: {@code <field> <operator> <value>}.
 *
 * <p>The operator is kept as written so that an unknown operator surfaces
 * when the rule is evaluated, as a non-matching rule, rather than failing
 * the whole configuration.
 *
 * @param field Dot path into the message, e.g. {@code payload.amount}
 * @param operator Operator symbol, see {@link RoutingOperator}
 * @param value Value to compare against
 */
public record RoutingCondition(String field, String operator, Object value) {

    private static final RoutingCondition EMPTY = new RoutingCondition(null, null, null);

    public static RoutingCondition empty() {
        return EMPTY;
    }

    public static RoutingCondition of(String field, RoutingOperator operator, Object value) {
        return new RoutingCondition(field, operator.getSymbol(), value);
    }

    /**
     * An empty condition matches every message.
     */
    public boolean isEmpty() {
        return (field == null || field.isEmpty()) && operator == null && value == null;
    }

    static RoutingCondition fromMap(Map<?, ?> map) {
        if (map == null || map.isEmpty()) {
            return EMPTY;
        }
        Object field = map.get("field");
        Object operator = map.get("operator");
        return new RoutingCondition(
            field != null ? field.toString() : "",
            operator != null ? operator.toString() : RoutingOperator.EQ.getSymbol(),
            map.get("value"));
    }
}
