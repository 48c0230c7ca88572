package com.ivamare.exchange.util;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves dot-separated field paths such as {@code payload.items.0.sku}.
 *
 * <p>Each segment is looked up in the current value: a key for maps, a
 * zero-based index for lists, an attribute for {@link PathNavigable}
 * objects. Any segment that cannot be resolved yields an empty result.
 */
public final class FieldPaths {

    private FieldPaths() {
    }

    public static Optional<Object> resolve(Object root, String path) {
        if (root == null || path == null || path.isEmpty()) {
            return Optional.empty();
        }

        Object current = root;
        for (String segment : path.split("\\.", -1)) {
            Optional<Object> next = step(current, segment);
            if (next.isEmpty()) {
                return Optional.empty();
            }
            current = next.get();
        }
        return Optional.of(current);
    }

    /**
     * Whether the path resolves to a non-null value.
     */
    public static boolean exists(Object root, String path) {
        return resolve(root, path).isPresent();
    }

    private static Optional<Object> step(Object current, String segment) {
        if (segment.isEmpty()) {
            return Optional.empty();
        }
        if (current instanceof Map<?, ?> map) {
            return Optional.ofNullable(map.get(segment));
        }
        if (current instanceof List<?> list) {
            int index;
            try {
                index = Integer.parseInt(segment);
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
            if (index < 0 || index >= list.size()) {
                return Optional.empty();
            }
            return Optional.ofNullable(list.get(index));
        }
        if (current instanceof PathNavigable navigable) {
            return navigable.attribute(segment);
        }
        return Optional.empty();
    }
}
