package com.ivamare.exchange.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Identifies the processor that produced a result.
 *
 * @param name Processor name, usually the class name
 * @param version Processor version
 * @param attributes Additional processor-specific details
 */
public record ProcessorInfo(
    String name,
    String version,
    Map<String, Object> attributes
) {
    public ProcessorInfo {
        attributes = attributes != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes))
            : Map.of();
    }

    public static ProcessorInfo of(String name, String version) {
        return new ProcessorInfo(name, version, Map.of());
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", name);
        map.put("version", version);
        map.putAll(attributes);
        return map;
    }
}
