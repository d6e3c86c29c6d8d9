package com.visualcompiler.core.language;

import com.visualcompiler.core.model.AssignProperties;
import com.visualcompiler.core.model.ForProperties;
import com.visualcompiler.core.model.IfProperties;
import com.visualcompiler.core.model.InputProperties;
import com.visualcompiler.core.model.NodeKind;
import com.visualcompiler.core.model.PrintProperties;
import com.visualcompiler.core.model.VariableProperties;
import com.visualcompiler.core.model.WhileProperties;

import java.util.List;
import java.util.Objects;

/**
 * Block palette offered to editors for a target language.
 *
 * <p>The palette is the same for every language except for the Variable block's
 * {@code data_type} options, which list the abstract types the language maps.
 */
public final class BlockCatalog {

    private BlockCatalog() {
        // Utility class
    }

    /**
     * Returns the palette for a language.
     *
     * @param language target language
     * @return block descriptors in palette order
     */
    public static List<BlockDescriptor> blocksFor(TargetLanguage language) {
        Objects.requireNonNull(language, "language must not be null");
        List<String> dataTypes = LanguageConfigs.get(language).dataTypes().keySet().stream()
            .sorted()
            .toList();

        return List.of(
            new BlockDescriptor(NodeKind.START.id(), "Start", "play", "flow",
                "Program starting point", List.of()),
            new BlockDescriptor(NodeKind.END.id(), "End", "stop", "flow",
                "Program ending point", List.of()),
            new BlockDescriptor(NodeKind.VARIABLE.id(), "Variable", "box", "data",
                "Declare a variable", List.of(
                    BlockInput.text(VariableProperties.VAR_NAME, "Variable name"),
                    BlockInput.select(VariableProperties.DATA_TYPE, dataTypes),
                    BlockInput.text(VariableProperties.INITIAL_VALUE, "Initial value (optional)"))),
            new BlockDescriptor(NodeKind.PRINT.id(), "Print", "message-square", "io",
                "Display output", List.of(
                    BlockInput.text(PrintProperties.TEXT, "Text to print"),
                    BlockInput.text(PrintProperties.VARIABLES, "Variables to print (comma separated)"))),
            new BlockDescriptor(NodeKind.INPUT.id(), "Input", "edit", "io",
                "Get user input", List.of(
                    BlockInput.text(InputProperties.PROMPT, "Input prompt"),
                    BlockInput.text(InputProperties.VARIABLE, "Variable to store input"))),
            new BlockDescriptor(NodeKind.ASSIGN.id(), "Assign", "equal", "data",
                "Assign value to variable", List.of(
                    BlockInput.text(AssignProperties.VARIABLE, "Variable name"),
                    BlockInput.text(AssignProperties.EXPRESSION, "Expression or value"))),
            new BlockDescriptor(NodeKind.IF.id(), "If", "git-branch", "control",
                "Conditional statement", List.of(
                    BlockInput.text(IfProperties.CONDITION, "Condition (e.g., x > 5)"))),
            new BlockDescriptor(NodeKind.WHILE.id(), "While", "repeat", "control",
                "While loop", List.of(
                    BlockInput.text(WhileProperties.CONDITION, "Loop condition"))),
            new BlockDescriptor(NodeKind.FOR.id(), "For", "rotate-cw", "control",
                "For loop", List.of(
                    BlockInput.text(ForProperties.INIT, "Initialization (e.g., i = 0)"),
                    BlockInput.text(ForProperties.CONDITION, "Condition (e.g., i < 10)"),
                    BlockInput.text(ForProperties.INCREMENT, "Increment (e.g., i++)")))
        );
    }
}
