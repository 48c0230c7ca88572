package com.ivamare.exchange.routing;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Comparison operators available in routing conditions.
 *
 * <p>{@link #apply} throws {@link IllegalArgumentException} when the operands
 * do not support the operator; the router treats that as "no match".
 */
public enum RoutingOperator {
    EQ("=="),
    NE("!="),
    GT(">"),
    LT("<"),
    GE(">="),
    LE("<="),
    IN("in"),
    NOT_IN("not_in"),
    CONTAINS("contains"),
    MATCHES("matches");

    private final String symbol;

    RoutingOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public static Optional<RoutingOperator> fromSymbol(String symbol) {
        for (RoutingOperator operator : values()) {
            if (operator.symbol.equals(symbol)) {
                return Optional.of(operator);
            }
        }
        return Optional.empty();
    }

    /**
     * Evaluate {@code actual <operator> expected}.
     *
     * @param actual value resolved from the message, null when the path is missing
     * @param expected value from the rule
     */
    public boolean apply(Object actual, Object expected) {
        switch (this) {
            case EQ:
                return valuesEqual(actual, expected);
            case NE:
                return !valuesEqual(actual, expected);
            case GT:
                return compare(actual, expected) > 0;
            case LT:
                return compare(actual, expected) < 0;
            case GE:
                return compare(actual, expected) >= 0;
            case LE:
                return compare(actual, expected) <= 0;
            case IN:
                return isMember(actual, expected);
            case NOT_IN:
                return !isMember(actual, expected);
            case CONTAINS:
                return contains(actual, expected);
            case MATCHES:
                return matches(actual, expected);
            default:
                throw new IllegalStateException("Unhandled operator: " + this);
        }
    }

    static boolean valuesEqual(Object a, Object b) {
        if (a instanceof Number x && b instanceof Number y) {
            return toDecimal(x).compareTo(toDecimal(y)) == 0;
        }
        return Objects.equals(a, b);
    }

    private static int compare(Object a, Object b) {
        if (a instanceof Number x && b instanceof Number y) {
            return toDecimal(x).compareTo(toDecimal(y));
        }
        if (a instanceof String x && b instanceof String y) {
            return x.compareTo(y);
        }
        if (a instanceof Boolean x && b instanceof Boolean y) {
            return Boolean.compare(x, y);
        }
        throw new IllegalArgumentException("Cannot compare " + typeName(a) + " with " + typeName(b));
    }

    private static boolean isMember(Object value, Object container) {
        if (container instanceof Collection<?> collection) {
            return collection.stream().anyMatch(item -> valuesEqual(value, item));
        }
        if (container instanceof Map<?, ?> map) {
            return map.containsKey(value);
        }
        if (container instanceof String text && value instanceof String part) {
            return text.contains(part);
        }
        throw new IllegalArgumentException("Cannot test membership of " + typeName(value) + " in " + typeName(container));
    }

    private static boolean contains(Object container, Object value) {
        if (container instanceof String text) {
            if (!(value instanceof String part)) {
                throw new IllegalArgumentException("String containment requires a string operand");
            }
            return text.contains(part);
        }
        if (container instanceof Collection<?> || container instanceof Map<?, ?>) {
            return isMember(value, container);
        }
        return false;
    }

    private static boolean matches(Object value, Object pattern) {
        if (value == null || pattern == null) {
            throw new IllegalArgumentException("matches requires a value and a pattern");
        }
        return Pattern.compile(pattern.toString()).matcher(value.toString()).lookingAt();
    }

    private static BigDecimal toDecimal(Number number) {
        if (number instanceof BigDecimal decimal) {
            return decimal;
        }
        if (number instanceof Double || number instanceof Float) {
            return BigDecimal.valueOf(number.doubleValue());
        }
        return new BigDecimal(number.toString());
    }

    private static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
