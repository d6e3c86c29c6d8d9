package com.visualcompiler.core.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Payload of a VARIABLE node.
 *
 * @param varName declared variable name
 * @param dataType declared abstract type
 * @param initialValue initial value as typed by the user, empty when absent
 */
public record VariableProperties(
    String varName,
    DataType dataType,
    String initialValue
) implements NodeProperties {

    public static final String VAR_NAME = "var_name";
    public static final String DATA_TYPE = "data_type";
    public static final String INITIAL_VALUE = "initial_value";

    /**
     * Compact constructor normalizing absent values.
     */
    public VariableProperties {
        varName = varName == null ? "" : varName;
        dataType = dataType == null ? DataType.INT : dataType;
        initialValue = initialValue == null ? "" : initialValue;
    }

    /**
     * Whether an initial value was supplied.
     *
     * @return true if the initial value is not blank
     */
    public boolean hasInitialValue() {
        return !initialValue.isBlank();
    }

    @Override
    public List<String> validate() {
        if (varName.isBlank()) {
            return List.of("Variable name is required");
        }
        return List.of();
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(VAR_NAME, varName);
        map.put(DATA_TYPE, dataType.id());
        map.put(INITIAL_VALUE, initialValue);
        return map;
    }
}
