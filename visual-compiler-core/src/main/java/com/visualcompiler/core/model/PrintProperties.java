package com.visualcompiler.core.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Payload of a PRINT node.
 *
 * @param text literal text, empty when absent
 * @param variables names of variables printed after the text
 */
public record PrintProperties(
    String text,
    List<String> variables
) implements NodeProperties {

    public static final String TEXT = "text";
    public static final String VARIABLES = "variables";

    /**
     * Compact constructor normalizing absent values.
     */
    public PrintProperties {
        text = text == null ? "" : text;
        variables = variables == null ? List.of() : List.copyOf(variables);
    }

    @Override
    public List<String> validate() {
        if (text.isEmpty() && variables.isEmpty()) {
            return List.of("Print statement must have text or variables");
        }
        return List.of();
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(TEXT, text);
        map.put(VARIABLES, variables);
        return map;
    }
}
