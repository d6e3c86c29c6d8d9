package com.visualcompiler.core.semantic;

import com.visualcompiler.core.graph.ProgramGraph;
import com.visualcompiler.core.model.AssignProperties;
import com.visualcompiler.core.model.InputProperties;
import com.visualcompiler.core.model.Node;
import com.visualcompiler.core.model.PrintProperties;
import com.visualcompiler.core.model.VariableProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Tracks variable declarations across a program graph.
 *
 * <p>Nodes are visited once, in graph insertion order (not flow order):
 * <ul>
 *   <li>Variable: declares {@code var_name}; declaring it again is an error</li>
 *   <li>Input / Assign: implicitly declare their target variable</li>
 *   <li>Print: every printed variable must already be declared</li>
 * </ul>
 *
 * <p>All errors are collected; the check never stops at the first one.
 */
public class SemanticChecker {

    private static final Logger log = LoggerFactory.getLogger(SemanticChecker.class);

    /**
     * Checks the graph's variable usage.
     *
     * @param graph graph to check
     * @return semantic errors, empty when none were found
     */
    public List<String> check(ProgramGraph graph) {
        Objects.requireNonNull(graph, "graph must not be null");

        Set<String> declaredVariables = new HashSet<>();
        List<String> errors = new ArrayList<>();

        for (Node node : graph.nodes()) {
            switch (node.kind()) {
                case VARIABLE -> checkDeclaration(node.properties(VariableProperties.class), declaredVariables, errors);
                case INPUT -> declareImplicitly(node.properties(InputProperties.class).variable(), declaredVariables);
                case ASSIGN -> declareImplicitly(node.properties(AssignProperties.class).variable(), declaredVariables);
                case PRINT -> checkUsage(node.properties(PrintProperties.class), declaredVariables, errors);
                default -> {
                    // no variable semantics
                }
            }
        }

        log.debug("Semantic check finished: {} declared variables, {} errors", declaredVariables.size(), errors.size());
        return errors;
    }

    private void checkDeclaration(VariableProperties variable, Set<String> declared, List<String> errors) {
        String name = variable.varName();
        if (name.isEmpty()) {
            return;
        }
        if (!declared.add(name)) {
            errors.add("Variable '" + name + "' is already declared");
        }
    }

    private void declareImplicitly(String name, Set<String> declared) {
        if (!name.isEmpty()) {
            declared.add(name);
        }
    }

    private void checkUsage(PrintProperties print, Set<String> declared, List<String> errors) {
        for (String name : print.variables()) {
            if (!name.isEmpty() && !declared.contains(name)) {
                errors.add("Variable '" + name + "' used in print but not declared");
            }
        }
    }
}
