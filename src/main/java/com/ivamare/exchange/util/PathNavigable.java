package com.ivamare.exchange.util;

import java.util.Optional;

/**
 * A domain object whose attributes can be reached by name from a dot path.
 *
 * @see FieldPaths
 */
public interface PathNavigable {

    /**
     * Look up an attribute by name.
     *
     * @param name attribute name, snake_case or camelCase
     * @return the attribute value, or empty when absent or null
     */
    Optional<Object> attribute(String name);
}
