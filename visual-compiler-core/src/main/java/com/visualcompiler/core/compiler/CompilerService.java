package com.visualcompiler.core.compiler;

import com.visualcompiler.core.factory.NodeFactory;
import com.visualcompiler.core.generator.CodeGenerator;
import com.visualcompiler.core.generator.GeneratorConfig;
import com.visualcompiler.core.graph.ProgramGraph;
import com.visualcompiler.core.language.TargetLanguage;
import com.visualcompiler.core.model.EdgeKind;
import com.visualcompiler.core.model.NodeKind;
import com.visualcompiler.core.model.Position;
import com.visualcompiler.core.semantic.SemanticChecker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Compiles visual programs into source text.
 *
 * <p>Orchestrates the full pipeline:
 * <ol>
 *   <li>Build a {@link ProgramGraph} from block and connection specs</li>
 *   <li>Validate node properties (stage {@link CompilationStage#VALIDATION})</li>
 *   <li>Resolve the language and check variable usage
 *       (stage {@link CompilationStage#SEMANTIC_ANALYSIS})</li>
 *   <li>Generate source text (stage {@link CompilationStage#CODE_GENERATION})</li>
 * </ol>
 *
 * <p>Each stage only runs when the previous one reported no errors. Warnings are
 * carried along and never stop the pipeline.
 *
 * <p>The service itself holds no per-request state: every call builds its own graph and
 * generator, so one instance can serve concurrent requests.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * CompilerService compiler = new CompilerService();
 * CompilationResult result = compiler.compile(programSpec);
 * if (result.success()) {
 *     System.out.println(result.code());
 * }
 * }</pre>
 */
public class CompilerService {

    private static final Logger log = LoggerFactory.getLogger(CompilerService.class);

    static final String EMPTY_PROGRAM_ERROR = "Program must have at least one block";
    static final String MISSING_START_BLOCK_WARNING = "Consider adding a Start block to clearly mark the beginning";
    static final String MISSING_END_BLOCK_WARNING = "Consider adding an End block to clearly mark the end";

    private final NodeFactory nodeFactory;
    private final SemanticChecker semanticChecker;
    private final GeneratorConfig generatorConfig;

    /**
     * Creates a compiler with default generation settings.
     */
    public CompilerService() {
        this(GeneratorConfig.defaults());
    }

    /**
     * Creates a compiler.
     *
     * @param generatorConfig generation settings
     */
    public CompilerService(GeneratorConfig generatorConfig) {
        this(new NodeFactory(), new SemanticChecker(), generatorConfig);
    }

    CompilerService(NodeFactory nodeFactory, SemanticChecker semanticChecker, GeneratorConfig generatorConfig) {
        this.nodeFactory = Objects.requireNonNull(nodeFactory, "nodeFactory must not be null");
        this.semanticChecker = Objects.requireNonNull(semanticChecker, "semanticChecker must not be null");
        this.generatorConfig = Objects.requireNonNull(generatorConfig, "generatorConfig must not be null");
    }

    /**
     * Compiles a program into the language named by its document.
     *
     * @param program program document
     * @return compilation result, never null
     */
    public CompilationResult compile(ProgramSpec program) {
        Objects.requireNonNull(program, "program must not be null");
        return compile(program.blocks(), program.connections(), program.language());
    }

    /**
     * Compiles a program.
     *
     * @param blocks block specs
     * @param connections connection specs
     * @param languageId target language id
     * @return compilation result, never null
     */
    public CompilationResult compile(List<BlockSpec> blocks, List<ConnectionSpec> connections, String languageId) {
        try {
            ProgramGraph graph = buildGraph(blocks, connections);
            log.info("Built program graph with {} nodes", graph.size());

            List<String> validationErrors = graph.validate();
            List<String> warnings = graph.warnings();
            if (!validationErrors.isEmpty()) {
                log.info("Validation failed with {} errors", validationErrors.size());
                return CompilationResult.failure(CompilationStage.VALIDATION, validationErrors, warnings, languageId);
            }

            Optional<TargetLanguage> language = TargetLanguage.fromId(languageId);
            List<String> semanticErrors = analyze(graph, language, languageId);
            if (!semanticErrors.isEmpty()) {
                log.info("Semantic analysis failed with {} errors", semanticErrors.size());
                return CompilationResult.failure(CompilationStage.SEMANTIC_ANALYSIS, semanticErrors, warnings, languageId);
            }

            CodeGenerator generator = new CodeGenerator(language.orElseThrow(), generatorConfig);
            String code = generator.generate(graph);
            return CompilationResult.success(code, language.get().id(), warnings, graph.serialize());
        } catch (RuntimeException e) {
            log.error("Compilation failed", e);
            return CompilationResult.failure(CompilationStage.COMPILATION,
                List.of("Compilation error: " + e.getMessage()), List.of(), languageId);
        }
    }

    /**
     * Builds a program graph from editor specs.
     *
     * <p>Blocks of unknown kind are skipped. Connections refer to editor block ids, which
     * are mapped to the generated node ids; connections whose endpoints are unknown are
     * skipped as well.
     *
     * @param blocks block specs, may be null
     * @param connections connection specs, may be null
     * @return program graph
     */
    public ProgramGraph buildGraph(List<BlockSpec> blocks, List<ConnectionSpec> connections) {
        ProgramGraph graph = new ProgramGraph();
        Map<String, String> nodeIds = new HashMap<>();

        for (BlockSpec block : blocks == null ? List.<BlockSpec>of() : blocks) {
            Position position = new Position(block.x(), block.y());
            nodeFactory.create(block.type(), position, block.properties()).ifPresent(node -> {
                graph.addNode(node);
                if (block.id() != null) {
                    nodeIds.put(block.id(), node.id());
                }
            });
        }

        for (ConnectionSpec connection : connections == null ? List.<ConnectionSpec>of() : connections) {
            String from = nodeIds.getOrDefault(connection.from(), connection.from());
            String to = nodeIds.getOrDefault(connection.to(), connection.to());
            if (!graph.connect(from, to, EdgeKind.fromNameOrDefault(connection.kind()))) {
                log.debug("Connection {} -> {} not added", connection.from(), connection.to());
            }
        }
        return graph;
    }

    /**
     * Checks a raw block list before it is compiled: unique Start/End blocks, a non-empty
     * program, and blocks carrying a type and an id.
     *
     * @param blocks block specs, may be null
     * @param connections connection specs, may be null
     * @return structural report
     */
    public StructureReport validateStructure(List<BlockSpec> blocks, List<ConnectionSpec> connections) {
        List<BlockSpec> blockList = blocks == null ? List.of() : blocks;
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        long startBlocks = countBlocks(blockList, NodeKind.START);
        long endBlocks = countBlocks(blockList, NodeKind.END);

        if (startBlocks > 1) {
            errors.add("Program can only have one Start block");
        }
        if (endBlocks > 1) {
            errors.add("Program can only have one End block");
        }
        if (blockList.isEmpty()) {
            errors.add(EMPTY_PROGRAM_ERROR);
        }
        if (startBlocks == 0) {
            warnings.add(MISSING_START_BLOCK_WARNING);
        }
        if (endBlocks == 0) {
            warnings.add(MISSING_END_BLOCK_WARNING);
        }

        for (BlockSpec block : blockList) {
            if (block.type() == null || block.type().isBlank()) {
                errors.add("Found block without type");
            }
            if (block.id() == null || block.id().isBlank()) {
                errors.add("Found block without ID");
            }
        }

        return new StructureReport(errors, warnings, blockList.size(),
            connections == null ? 0 : connections.size());
    }

    private List<String> analyze(ProgramGraph graph, Optional<TargetLanguage> language, String languageId) {
        if (language.isEmpty()) {
            return List.of("Unsupported language: " + languageId);
        }
        if (graph.isEmpty()) {
            return List.of(EMPTY_PROGRAM_ERROR);
        }
        return semanticChecker.check(graph);
    }

    private static long countBlocks(List<BlockSpec> blocks, NodeKind kind) {
        return blocks.stream()
            .filter(block -> NodeKind.fromId(block.type()).filter(kind::equals).isPresent())
            .count();
    }
}
