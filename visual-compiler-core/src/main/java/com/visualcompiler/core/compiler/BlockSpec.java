package com.visualcompiler.core.compiler;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Block description as sent by a visual editor.
 *
 * @param id editor-side block identifier, referenced by connections
 * @param type block kind id such as {@code "print"}
 * @param x horizontal canvas coordinate, 0 when absent
 * @param y vertical canvas coordinate, 0 when absent
 * @param properties kind-specific properties; values are strings or lists of strings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BlockSpec(
    @JsonProperty("id") String id,
    @JsonProperty("type") String type,
    @JsonProperty("x") Double x,
    @JsonProperty("y") Double y,
    @JsonProperty("properties") Map<String, Object> properties
) {
    public BlockSpec {
        if (x == null) {
            x = 0.0;
        }
        if (y == null) {
            y = 0.0;
        }
        if (properties == null) {
            properties = Map.of();
        }
    }

    /**
     * Creates a block at the canvas origin.
     *
     * @param id block identifier
     * @param type block kind id
     * @param properties block properties
     * @return block spec
     */
    public static BlockSpec of(String id, String type, Map<String, Object> properties) {
        return new BlockSpec(id, type, 0.0, 0.0, properties);
    }
}
