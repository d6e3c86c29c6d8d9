package com.visualcompiler.core.generator;

import com.visualcompiler.core.graph.ProgramGraph;
import com.visualcompiler.core.language.BlockStyle;
import com.visualcompiler.core.language.IoStyle;
import com.visualcompiler.core.language.LanguageConfig;
import com.visualcompiler.core.language.LanguageConfigs;
import com.visualcompiler.core.language.TargetLanguage;
import com.visualcompiler.core.model.AssignProperties;
import com.visualcompiler.core.model.DataType;
import com.visualcompiler.core.model.ForProperties;
import com.visualcompiler.core.model.IfProperties;
import com.visualcompiler.core.model.InputProperties;
import com.visualcompiler.core.model.Node;
import com.visualcompiler.core.model.PrintProperties;
import com.visualcompiler.core.model.VariableProperties;
import com.visualcompiler.core.model.WhileProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Lowers a program graph into source text of one target language.
 *
 * <p>Generation follows the flow of the program: starting at the Start node, nodes are
 * emitted depth-first along their connections. A visited set keyed by node id makes
 * sure no node is emitted twice, so graphs containing cycles terminate.
 *
 * <h2>Block nodes</h2>
 * <p>If, While and For nodes treat their own connections as their body: the body is
 * emitted one indentation level deeper, the block is closed, and traversal continues
 * with the block's {@linkplain Node#next() successor} when one is connected. Conditions,
 * expressions and for-loop clauses are copied verbatim; nothing is parsed or checked.
 *
 * <h2>Degenerate input</h2>
 * <p>Generation never fails on user data. Missing properties fall back to default
 * literals (condition {@code true}, loop count {@link GeneratorConfig#defaultLoopCount()}),
 * and a graph without Start node produces only the program skeleton.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * CodeGenerator generator = new CodeGenerator(TargetLanguage.C);
 * String source = generator.generate(graph);
 * }</pre>
 *
 * <p>A generator instance keeps per-call state and must not be shared between threads.
 * Build one per compile request.
 */
public class CodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CodeGenerator.class);

    private static final String INDENT = "    ";
    private static final String LINE_SEPARATOR = "\n";

    private static final String DEFAULT_VARIABLE_NAME = "variable";
    private static final String DEFAULT_INPUT_VARIABLE = "input_var";
    private static final String DEFAULT_ASSIGN_VARIABLE = "var";
    private static final String DEFAULT_EXPRESSION = "0";
    private static final String DEFAULT_FOR_INIT = "i = 0";
    private static final String DEFAULT_FOR_INCREMENT = "i++";
    private static final int STRING_BUFFER_SIZE = 256;

    private final TargetLanguage language;
    private final LanguageConfig config;
    private final GeneratorConfig generatorConfig;

    private final List<String> outputLines = new ArrayList<>();
    private final Map<String, DataType> declaredVariables = new HashMap<>();
    private int indentLevel;

    /**
     * Creates a generator with default settings.
     *
     * @param language target language
     */
    public CodeGenerator(TargetLanguage language) {
        this(language, GeneratorConfig.defaults());
    }

    /**
     * Creates a generator.
     *
     * @param language target language
     * @param generatorConfig generation settings
     */
    public CodeGenerator(TargetLanguage language, GeneratorConfig generatorConfig) {
        this.language = Objects.requireNonNull(language, "language must not be null");
        this.generatorConfig = Objects.requireNonNull(generatorConfig, "generatorConfig must not be null");
        this.config = LanguageConfigs.get(language);
    }

    public TargetLanguage language() {
        return language;
    }

    /**
     * Generates the complete source text of a program.
     *
     * @param graph program graph
     * @return source text, one statement per line, four spaces per indentation level
     */
    public String generate(ProgramGraph graph) {
        Objects.requireNonNull(graph, "graph must not be null");

        outputLines.clear();
        declaredVariables.clear();
        indentLevel = 0;

        appendPreamble();
        graph.startNode().ifPresentOrElse(
            start -> emit(start, new HashSet<>()),
            () -> log.debug("No start node, emitting program skeleton only"));
        appendEpilogue();

        log.info("Generated {} lines of {} code", outputLines.size(), config.name());
        return String.join(LINE_SEPARATOR, outputLines);
    }

    // ==================== Program skeleton ====================

    private void appendPreamble() {
        config.preamble().forEach(this::addLine);
        Map<String, String> values = Map.of(LanguageConfigs.CLASS_NAME_SLOT, generatorConfig.className());
        for (String opener : config.scopeOpeners()) {
            addLine(LanguageConfig.fill(opener, values));
            indentLevel++;
        }
        config.entryStatements().forEach(this::addLine);
    }

    private void appendEpilogue() {
        config.exitStatements().forEach(this::addLine);
        for (int i = 0; i < config.scopeOpeners().size(); i++) {
            indentLevel--;
            addLine(config.template("block_end"));
        }
    }

    // ==================== Traversal ====================

    private void emit(Node node, Set<String> visited) {
        if (!visited.add(node.id())) {
            return;
        }
        log.debug("Emitting {}", node);

        switch (node.kind()) {
            case START -> addComment("Program Start");
            case END -> {
                addComment("Program End");
                return;
            }
            case VARIABLE -> emitVariable(node.properties(VariableProperties.class));
            case PRINT -> emitPrint(node.properties(PrintProperties.class));
            case INPUT -> emitInput(node.properties(InputProperties.class));
            case ASSIGN -> emitAssign(node.properties(AssignProperties.class));
            case IF -> {
                emitBlock(node, config.render("if", Map.of("condition", conditionOrDefault(
                    node.properties(IfProperties.class).condition()))), visited);
                return;
            }
            case WHILE -> {
                emitBlock(node, config.render("while", Map.of("condition", conditionOrDefault(
                    node.properties(WhileProperties.class).condition()))), visited);
                return;
            }
            case FOR -> {
                emitBlock(node, forHeader(node.properties(ForProperties.class)), visited);
                return;
            }
        }

        for (Node connected : node.connections()) {
            emit(connected, visited);
        }
    }

    private void emitBlock(Node node, String header, Set<String> visited) {
        boolean braces = config.blockStyle() == BlockStyle.BRACES;
        addLine(braces ? header + " " + config.template("block_start") : header);

        indentLevel++;
        for (Node bodyNode : node.connections()) {
            emit(bodyNode, visited);
        }
        indentLevel--;

        if (braces) {
            addLine(config.template("block_end"));
        }

        node.next().ifPresent(successor -> emit(successor, visited));
    }

    // ==================== Statements ====================

    private void emitVariable(VariableProperties variable) {
        String name = orDefault(variable.varName(), DEFAULT_VARIABLE_NAME);
        DataType dataType = variable.dataType();
        String type = config.typeFor(dataType.id());

        if (!config.template("variable_declaration").contains("{type}")) {
            if (variable.hasInitialValue()) {
                addLine(config.render("variable_assignment", Map.of(
                    "name", name, "value", formatValue(variable.initialValue(), dataType))));
            } else {
                addComment("Variable: " + name + " (" + dataType.id() + ")");
            }
        } else {
            String declaration;
            if (dataType == DataType.STRING && config.ioStyle() == IoStyle.STDIO) {
                // scanf needs writable storage
                declaration = "char " + name + "[" + STRING_BUFFER_SIZE + "]";
            } else {
                String slot = dataType == DataType.ARRAY && !config.template("array_declaration").isEmpty()
                    ? "array_declaration"
                    : "variable_declaration";
                declaration = config.render(slot, Map.of("type", type, "name", name));
            }
            if (variable.hasInitialValue()) {
                declaration += " = " + formatValue(variable.initialValue(), dataType);
            }
            addStatement(declaration);
        }

        declaredVariables.put(name, dataType);
    }

    private void emitPrint(PrintProperties print) {
        String text = print.text();
        List<String> variables = print.variables();
        if (text.isEmpty() && variables.isEmpty()) {
            return;
        }

        List<String> parts = new ArrayList<>();
        if (!text.isEmpty()) {
            parts.add(quote(text));
        }
        parts.addAll(variables);

        switch (config.ioStyle()) {
            case STDIO -> emitPrintf(text, variables);
            case IOSTREAM -> addStatement(config.render("print", Map.of("args", String.join(" << \" \" << ", parts))));
            case PYTHON_BUILTINS -> addStatement(config.render("print", Map.of("args", String.join(", ", parts))));
            case JAVA_CONSOLE -> addStatement(config.render("print", Map.of("args", String.join(" + \" \" + ", parts))));
        }
    }

    private void emitPrintf(String text, List<String> variables) {
        String literal = escape(text).replace("%", "%%");
        if (variables.isEmpty()) {
            addStatement("printf(\"" + literal + "\\n\")");
            return;
        }
        List<String> specifiers = variables.stream()
            .map(name -> formatSpecifier(declaredVariables.get(name)))
            .toList();
        String format = literal + String.join(" ", specifiers) + "\\n";
        addStatement(config.render("print", Map.of("format", format, "args", String.join(", ", variables))));
    }

    private void emitInput(InputProperties input) {
        String variable = orDefault(input.variable(), DEFAULT_INPUT_VARIABLE);
        String prompt = input.prompt();
        boolean declared = declaredVariables.containsKey(variable);
        DataType type = declared && declaredVariables.get(variable) != null
            ? declaredVariables.get(variable)
            : DataType.INT;

        switch (config.ioStyle()) {
            case STDIO -> {
                if (!prompt.isEmpty()) {
                    addStatement("printf(\"" + escape(prompt).replace("%", "%%") + "\")");
                }
                declareForRead(variable, type, declared);
                if (type == DataType.STRING) {
                    addStatement("scanf(\"%s\", " + variable + ")");
                } else {
                    addStatement(config.render("input", Map.of("format", formatSpecifier(type), "variable", variable)));
                }
            }
            case IOSTREAM -> {
                if (!prompt.isEmpty()) {
                    addStatement("cout << " + quote(prompt));
                }
                declareForRead(variable, type, declared);
                addStatement(config.render("input", Map.of("variable", variable)));
            }
            case PYTHON_BUILTINS -> {
                String read = prompt.isEmpty() ? "input()" : "input(" + quote(prompt) + ")";
                addStatement(variable + " = " + pythonConversion(type, read));
            }
            case JAVA_CONSOLE -> {
                if (!prompt.isEmpty()) {
                    addStatement("System.out.print(" + quote(prompt) + ")");
                }
                String read = config.render("input", Map.of("variable", variable, "method", scannerMethod(type)));
                addStatement(declared ? read : config.typeFor(type.id()) + " " + read);
            }
        }

        declaredVariables.putIfAbsent(variable, type);
    }

    private void emitAssign(AssignProperties assign) {
        String variable = orDefault(assign.variable(), DEFAULT_ASSIGN_VARIABLE);
        String expression = orDefault(assign.expression(), DEFAULT_EXPRESSION);
        addStatement(config.render("variable_assignment", Map.of("name", variable, "value", expression)));
        declaredVariables.putIfAbsent(variable, null);
    }

    private String forHeader(ForProperties loop) {
        String init = orDefault(loop.init(), DEFAULT_FOR_INIT);
        String condition = orDefault(loop.condition(), "i < " + generatorConfig.defaultLoopCount());
        String increment = orDefault(loop.increment(), DEFAULT_FOR_INCREMENT);

        if (!config.countedLoops()) {
            return config.render("for", Map.of("init", init, "condition", condition, "increment", increment));
        }

        return CountedLoop.recognize(init, condition, increment)
            .map(counted -> config.render("for", Map.of(
                "variable", counted.variable(), "start", counted.start(), "end", counted.end())))
            .orElseGet(() -> config.render("for", Map.of(
                    "variable", CountedLoop.loopVariable(init),
                    "start", "0",
                    "end", String.valueOf(generatorConfig.defaultLoopCount())))
                + "  " + config.commentPrefix() + " " + init + "; " + condition + "; " + increment);
    }

    // ==================== Helpers ====================

    private void declareForRead(String variable, DataType type, boolean declared) {
        if (!declared) {
            addStatement(config.typeFor(type.id()) + " " + variable);
        }
    }

    private String formatValue(String value, DataType dataType) {
        return switch (dataType) {
            case STRING -> value.startsWith("\"") ? value : quote(value);
            case BOOLEAN -> {
                String normalized = value.trim().toLowerCase(Locale.ROOT);
                yield normalized.equals("true") || normalized.equals("1")
                    ? config.trueLiteral()
                    : config.falseLiteral();
            }
            case ARRAY -> config.arrayOpen() + stripBrackets(value.trim()) + config.arrayClose();
            default -> value;
        };
    }

    private static String stripBrackets(String value) {
        if (value.length() >= 2
            && ((value.startsWith("[") && value.endsWith("]")) || (value.startsWith("{") && value.endsWith("}")))) {
            return value.substring(1, value.length() - 1).trim();
        }
        return value;
    }

    private static String formatSpecifier(DataType type) {
        if (type == null) {
            return "%d";
        }
        return switch (type) {
            case FLOAT -> "%f";
            case STRING -> "%s";
            default -> "%d";
        };
    }

    private static String scannerMethod(DataType type) {
        return switch (type) {
            case FLOAT -> "nextFloat";
            case STRING -> "nextLine";
            case BOOLEAN -> "nextBoolean";
            default -> "nextInt";
        };
    }

    private static String pythonConversion(DataType type, String read) {
        return switch (type) {
            case FLOAT -> "float(" + read + ")";
            case STRING -> read;
            case BOOLEAN -> read + ".strip().lower() in (\"true\", \"1\")";
            case ARRAY -> read + ".split()";
            default -> "int(" + read + ")";
        };
    }

    private String conditionOrDefault(String condition) {
        return orDefault(condition, config.trueLiteral());
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }

    private static String quote(String text) {
        return "\"" + escape(text) + "\"";
    }

    private static String escape(String text) {
        return text.replace("\\", "\\\\")
            .replace("\"", "\\\"")
            .replace("\n", "\\n")
            .replace("\r", "\\r")
            .replace("\t", "\\t");
    }

    private void addComment(String text) {
        addLine(config.commentPrefix() + " " + text);
    }

    private void addStatement(String statement) {
        addLine(statement + config.statementEnd());
    }

    private void addLine(String line) {
        outputLines.add(line.isBlank() ? "" : INDENT.repeat(indentLevel) + line);
    }
}
