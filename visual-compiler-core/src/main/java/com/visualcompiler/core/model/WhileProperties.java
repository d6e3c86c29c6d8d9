package com.visualcompiler.core.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Payload of a WHILE node.
 *
 * @param condition loop condition, emitted verbatim
 */
public record WhileProperties(String condition) implements NodeProperties {

    public static final String CONDITION = "condition";

    public WhileProperties {
        condition = condition == null ? "" : condition;
    }

    @Override
    public List<String> validate() {
        if (condition.isBlank()) {
            return List.of("While loop must have a condition");
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
