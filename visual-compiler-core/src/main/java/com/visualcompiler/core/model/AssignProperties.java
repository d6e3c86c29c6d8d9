package com.visualcompiler.core.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Payload of an ASSIGN node. The expression is kept verbatim; it is never parsed.
 *
 * @param variable assignment target
 * @param expression right-hand side, copied into generated code as is
 */
public record AssignProperties(
    String variable,
    String expression
) implements NodeProperties {

    public static final String VARIABLE = "variable";
    public static final String EXPRESSION = "expression";

    public AssignProperties {
        variable = variable == null ? "" : variable;
        expression = expression == null ? "" : expression;
    }

    @Override
    public List<String> validate() {
        List<String> errors = new ArrayList<>();
        if (variable.isBlank()) {
            errors.add("Assignment must specify a variable");
        }
        if (expression.isBlank()) {
            errors.add("Assignment must have an expression");
        }
        return errors;
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(VARIABLE, variable);
        map.put(EXPRESSION, expression);
        return map;
    }
}
