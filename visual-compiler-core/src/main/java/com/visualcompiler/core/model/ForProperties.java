package com.visualcompiler.core.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Payload of a FOR node: a C-style initialization/condition/increment triple.
 *
 * @param init initialization clause, e.g. {@code i = 0}
 * @param condition loop condition, e.g. {@code i < 10}
 * @param increment increment clause, e.g. {@code i++}
 */
public record ForProperties(
    String init,
    String condition,
    String increment
) implements NodeProperties {

    public static final String INIT = "init";
    public static final String CONDITION = "condition";
    public static final String INCREMENT = "increment";

    public ForProperties {
        init = init == null ? "" : init;
        condition = condition == null ? "" : condition;
        increment = increment == null ? "" : increment;
    }

    @Override
    public List<String> validate() {
        if (init.isBlank() || condition.isBlank() || increment.isBlank()) {
            return List.of("For loop must have initialization, condition, and increment");
        }
        return List.of();
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(INIT, init);
        map.put(CONDITION, condition);
        map.put(INCREMENT, increment);
        return map;
    }
}
