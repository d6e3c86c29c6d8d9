package com.visualcompiler.core.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Payload of an IF node.
 *
 * @param condition condition text, emitted verbatim
 */
public record IfProperties(String condition) implements NodeProperties {

    public static final String CONDITION = "condition";

    public IfProperties {
        condition = condition == null ? "" : condition;
    }

    @Override
    public List<String> validate() {
        if (condition.isBlank()) {
            return List.of("If statement must have a condition");
        }
        return List.of();
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(CONDITION, condition);
        return map;
    }
}
