package com.visualcompiler.core.generator;

/**
 * Configuration for code generation.
 *
 * @param className name of the class wrapper for languages that need one
 * @param defaultLoopCount iteration count used when a for loop cannot be lowered to a counted range
 */
public record GeneratorConfig(
    String className,
    int defaultLoopCount
) {
    public static final String DEFAULT_CLASS_NAME = "VisualProgram";
    public static final int DEFAULT_LOOP_COUNT = 10;

    /**
     * Compact constructor with validation.
     */
    public GeneratorConfig {
        if (className == null || className.isBlank()) {
            className = DEFAULT_CLASS_NAME;
        }
        if (defaultLoopCount <= 0) {
            defaultLoopCount = DEFAULT_LOOP_COUNT;
        }
    }

    /**
     * Creates a default configuration.
     *
     * @return default generator config
     */
    public static GeneratorConfig defaults() {
        return new GeneratorConfig(DEFAULT_CLASS_NAME, DEFAULT_LOOP_COUNT);
    }
}
