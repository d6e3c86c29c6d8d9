package com.visualcompiler.core.language;

/**
 * Console I/O idiom of a language, selecting how Print and Input blocks are lowered.
 */
public enum IoStyle {
    /** {@code printf} with format placeholders, {@code scanf} into addresses */
    STDIO,

    /** {@code cout <<} stream insertion, {@code cin >>} extraction */
    IOSTREAM,

    /** {@code print(...)} argument list, {@code input(...)} with conversion */
    PYTHON_BUILTINS,

    /** {@code System.out.println} with {@code +} concatenation, {@code Scanner} reads */
    JAVA_CONSOLE
}
