package com.visualcompiler.core.language;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Objects;

/**
 * Input field of a block in the editor palette.
 *
 * @param name property key the field edits
 * @param type field widget, {@code "text"} or {@code "select"}
 * @param placeholder hint text for text fields, null for selects
 * @param options selectable values for select fields, empty otherwise
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record BlockInput(
    String name,
    String type,
    String placeholder,
    List<String> options
) {
    public BlockInput {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        options = options == null ? List.of() : List.copyOf(options);
    }

    static BlockInput text(String name, String placeholder) {
        return new BlockInput(name, "text", placeholder, List.of());
    }

    static BlockInput select(String name, List<String> options) {
        return new BlockInput(name, "select", null, options);
    }
}
