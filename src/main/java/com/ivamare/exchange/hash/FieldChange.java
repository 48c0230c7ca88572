package com.ivamare.exchange.hash;

/**
 * A field whose value differs between two versions of an entity.
 *
 * @param oldValue value in the existing entity, null when absent
 * @param newValue value in the incoming entity, null when absent
 */
public record FieldChange(Object oldValue, Object newValue) {
}
