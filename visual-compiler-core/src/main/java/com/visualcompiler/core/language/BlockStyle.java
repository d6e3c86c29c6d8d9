package com.visualcompiler.core.language;

/**
 * How a language delimits statement blocks.
 */
public enum BlockStyle {
    /** Blocks are wrapped in curly braces */
    BRACES,

    /** Blocks are delimited by indentation alone */
    INDENTATION
}
