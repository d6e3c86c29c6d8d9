package com.visualcompiler.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.visualcompiler.core.generator.GeneratorConfig;

/**
 * Root configuration of the visual compiler.
 *
 * <p>Loaded from {@code visual-compiler.yaml}. Sections left out of the file take their
 * default values, so a file containing only {@code language: java} is valid.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * language: python
 *
 * generator:
 *   className: VisualProgram
 *   defaultLoopCount: 10
 *
 * output:
 *   directory: "./build/generated"
 *   emitGraph: true
 *   fileName: program
 * }</pre>
 *
 * @param language default target language id
 * @param generator code generation settings
 * @param output output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CompilerConfig(
    @JsonProperty("language") String language,
    @JsonProperty("generator") GeneratorSettings generator,
    @JsonProperty("output") OutputConfig output
) {
    public static final String DEFAULT_LANGUAGE = "python";

    public CompilerConfig {
        if (language == null || language.isBlank()) {
            language = DEFAULT_LANGUAGE;
        }
        if (generator == null) {
            generator = GeneratorSettings.defaults();
        }
        if (output == null) {
            output = OutputConfig.defaults();
        }
    }

    /**
     * Creates the default configuration: Python output into {@code ./build/generated}
     * together with the program graph.
     *
     * @return default configuration
     */
    public static CompilerConfig defaults() {
        return new CompilerConfig(DEFAULT_LANGUAGE, GeneratorSettings.defaults(), OutputConfig.defaults());
    }

    /**
     * Converts the generator section into the settings the code generator takes.
     *
     * @return generator config
     */
    public GeneratorConfig toGeneratorConfig() {
        return new GeneratorConfig(generator.className(), generator.defaultLoopCount() == null ? 0 : generator.defaultLoopCount());
    }

    /**
     * Code generation settings.
     *
     * @param className class wrapper name for Java output
     * @param defaultLoopCount iteration count for loops that are not simple counted ranges
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record GeneratorSettings(
        @JsonProperty("className") String className,
        @JsonProperty("defaultLoopCount") Integer defaultLoopCount
    ) {
        static GeneratorSettings defaults() {
            return new GeneratorSettings(GeneratorConfig.DEFAULT_CLASS_NAME, GeneratorConfig.DEFAULT_LOOP_COUNT);
        }
    }

    /**
     * Output configuration.
     *
     * @param directory output directory path
     * @param emitGraph whether to write the serialized graph next to the source file
     * @param fileName base name of the generated source file, without extension
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("directory") String directory,
        @JsonProperty("emitGraph") Boolean emitGraph,
        @JsonProperty("fileName") String fileName
    ) {
        public static final String DEFAULT_DIRECTORY = "./build/generated";
        public static final String DEFAULT_FILE_NAME = "program";

        public OutputConfig {
            if (directory == null || directory.isBlank()) {
                directory = DEFAULT_DIRECTORY;
            }
            if (emitGraph == null) {
                emitGraph = Boolean.TRUE;
            }
            if (fileName == null || fileName.isBlank()) {
                fileName = DEFAULT_FILE_NAME;
            }
        }

        static OutputConfig defaults() {
            return new OutputConfig(DEFAULT_DIRECTORY, true, DEFAULT_FILE_NAME);
        }
    }
}
