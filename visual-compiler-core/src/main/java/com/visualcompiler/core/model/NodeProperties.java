package com.visualcompiler.core.model;

import java.util.List;
import java.util.Map;

/**
 * Typed payload of a node. There is one implementation per node kind, so the
 * property bag an editor sends is checked and normalized once, at construction.
 *
 * <p>Payloads are immutable. Patching a node's properties replaces its payload
 * with a merged copy (see {@link com.visualcompiler.core.factory.NodeFactory#update}).
 */
public sealed interface NodeProperties
    permits NoProperties, VariableProperties, PrintProperties, InputProperties,
            AssignProperties, IfProperties, WhileProperties, ForProperties {

    /**
     * Checks the payload's required properties.
     *
     * @return structural error messages, empty when the payload is complete
     */
    List<String> validate();

    /**
     * Returns the payload as a string-keyed property bag using the wire key names.
     *
     * @return ordered property map
     */
    Map<String, Object> toMap();
}
