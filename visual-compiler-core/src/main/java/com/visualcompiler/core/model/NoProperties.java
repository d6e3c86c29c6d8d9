package com.visualcompiler.core.model;

import java.util.List;
import java.util.Map;

/**
 * Payload of START and END nodes, which carry no configuration.
 */
public record NoProperties() implements NodeProperties {

    public static final NoProperties INSTANCE = new NoProperties();

    @Override
    public List<String> validate() {
        return List.of();
    }

    @Override
    public Map<String, Object> toMap() {
        return Map.of();
    }
}
