package com.visualcompiler.core.language;

import java.util.List;
import java.util.Objects;

/**
 * Palette entry describing one block kind to a visual editor.
 *
 * @param id block kind id
 * @param name display name
 * @param icon icon name
 * @param category palette category: flow, data, io or control
 * @param description short description
 * @param inputs editable fields, empty for blocks without configuration
 */
public record BlockDescriptor(
    String id,
    String name,
    String icon,
    String category,
    String description,
    List<BlockInput> inputs
) {
    public BlockDescriptor {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(name, "name must not be null");
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
    }
}
