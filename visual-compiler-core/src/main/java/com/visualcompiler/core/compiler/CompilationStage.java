package com.visualcompiler.core.compiler;

/**
 * Pipeline stage a compilation ended in.
 */
public enum CompilationStage {
    /** Structural validation of node properties failed */
    VALIDATION,

    /** Variable declaration checks or language resolution failed */
    SEMANTIC_ANALYSIS,

    /** Source text was generated */
    CODE_GENERATION,

    /** An unexpected failure interrupted the pipeline */
    COMPILATION
}
