package com.visualcompiler.core.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Payload of an INPUT node.
 *
 * @param prompt optional prompt printed before reading, empty when absent
 * @param variable variable receiving the value read
 */
public record InputProperties(
    String prompt,
    String variable
) implements NodeProperties {

    public static final String PROMPT = "prompt";
    public static final String VARIABLE = "variable";

    public InputProperties {
        prompt = prompt == null ? "" : prompt;
        variable = variable == null ? "" : variable;
    }

    @Override
    public List<String> validate() {
        if (variable.isBlank()) {
            return List.of("Input must specify a variable to store the value");
        }
        return List.of();
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(PROMPT, prompt);
        map.put(VARIABLE, variable);
        return map;
    }
}
