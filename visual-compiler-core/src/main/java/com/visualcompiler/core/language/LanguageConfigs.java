package com.visualcompiler.core.language;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Static configuration table of all supported target languages.
 *
 * <p>Adding a language means adding a {@link TargetLanguage} constant, an entry here and,
 * when its console idiom is new, an {@link IoStyle} case in the generator.
 */
public final class LanguageConfigs {

    /** Placeholder of the class wrapper name in scope openers. */
    public static final String CLASS_NAME_SLOT = "className";

    private static final Map<TargetLanguage, LanguageConfig> CONFIGS = createConfigs();

    private LanguageConfigs() {
        // Utility class
    }

    /**
     * Returns the configuration of a language.
     *
     * @param language target language
     * @return language configuration
     */
    public static LanguageConfig get(TargetLanguage language) {
        Objects.requireNonNull(language, "language must not be null");
        return CONFIGS.get(language);
    }

    /**
     * Returns the configuration of a language given by id.
     *
     * @param languageId language id such as {@code "python"}
     * @return configuration, or empty when the language is unsupported
     */
    public static Optional<LanguageConfig> find(String languageId) {
        return TargetLanguage.fromId(languageId).map(CONFIGS::get);
    }

    /**
     * Lists the supported languages in declaration order.
     *
     * @return language ids and display names
     */
    public static List<LanguageSummary> availableLanguages() {
        return CONFIGS.entrySet().stream()
            .map(entry -> new LanguageSummary(entry.getKey().id(), entry.getValue().name()))
            .toList();
    }

    private static Map<TargetLanguage, LanguageConfig> createConfigs() {
        Map<TargetLanguage, LanguageConfig> configs = new EnumMap<>(TargetLanguage.class);

        configs.put(TargetLanguage.C, new LanguageConfig(
            "C",
            ".c",
            List.of(
                "int", "float", "char", "double", "void", "if", "else", "while",
                "for", "do", "break", "continue", "return", "switch", "case",
                "default", "printf", "scanf", "main", "include", "stdio.h"
            ),
            Map.of(
                "int", "int",
                "float", "float",
                "string", "char*",
                "boolean", "int",
                "array", "int[]"
            ),
            Map.ofEntries(
                Map.entry("variable_declaration", "{type} {name}"),
                Map.entry("array_declaration", "int {name}[]"),
                Map.entry("variable_assignment", "{name} = {value}"),
                Map.entry("print", "printf(\"{format}\", {args})"),
                Map.entry("input", "scanf(\"{format}\", &{variable})"),
                Map.entry("if", "if ({condition})"),
                Map.entry("while", "while ({condition})"),
                Map.entry("for", "for ({init}; {condition}; {increment})"),
                Map.entry("block_start", "{"),
                Map.entry("block_end", "}"),
                Map.entry("statement_end", ";"),
                Map.entry("main_function", "int main()"),
                Map.entry("return", "return 0;")
            ),
            List.of("#include <stdio.h>", "#include <stdlib.h>", ""),
            List.of("int main() {"),
            List.of(),
            List.of("return 0;"),
            "//",
            BlockStyle.BRACES,
            IoStyle.STDIO,
            "1",
            "0",
            "{",
            "}",
            false
        ));

        configs.put(TargetLanguage.CPP, new LanguageConfig(
            "C++",
            ".cpp",
            List.of(
                "int", "float", "char", "double", "bool", "string", "void", "if",
                "else", "while", "for", "do", "break", "continue", "return",
                "switch", "case", "default", "cout", "cin", "endl", "using",
                "namespace", "std", "main", "include", "iostream"
            ),
            Map.of(
                "int", "int",
                "float", "float",
                "string", "string",
                "boolean", "bool",
                "array", "vector<int>"
            ),
            Map.ofEntries(
                Map.entry("variable_declaration", "{type} {name}"),
                Map.entry("variable_assignment", "{name} = {value}"),
                Map.entry("print", "cout << {args} << endl"),
                Map.entry("input", "cin >> {variable}"),
                Map.entry("if", "if ({condition})"),
                Map.entry("while", "while ({condition})"),
                Map.entry("for", "for ({init}; {condition}; {increment})"),
                Map.entry("block_start", "{"),
                Map.entry("block_end", "}"),
                Map.entry("statement_end", ";"),
                Map.entry("main_function", "int main()"),
                Map.entry("return", "return 0;")
            ),
            List.of("#include <iostream>", "#include <string>", "#include <vector>", "using namespace std;", ""),
            List.of("int main() {"),
            List.of(),
            List.of("return 0;"),
            "//",
            BlockStyle.BRACES,
            IoStyle.IOSTREAM,
            "true",
            "false",
            "{",
            "}",
            false
        ));

        configs.put(TargetLanguage.PYTHON, new LanguageConfig(
            "Python",
            ".py",
            List.of(
                "def", "if", "elif", "else", "while", "for", "in", "break",
                "continue", "return", "class", "import", "from", "as", "try",
                "except", "finally", "with", "lambda", "and", "or", "not",
                "True", "False", "None", "print", "input", "len", "range"
            ),
            Map.of(
                "int", "int",
                "float", "float",
                "string", "str",
                "boolean", "bool",
                "array", "list"
            ),
            Map.ofEntries(
                Map.entry("variable_declaration", "{name}"),
                Map.entry("variable_assignment", "{name} = {value}"),
                Map.entry("print", "print({args})"),
                Map.entry("input", "{variable} = input(\"{prompt}\")"),
                Map.entry("if", "if {condition}:"),
                Map.entry("while", "while {condition}:"),
                Map.entry("for", "for {variable} in range({start}, {end}):"),
                Map.entry("block_start", ""),
                Map.entry("block_end", ""),
                Map.entry("statement_end", ""),
                Map.entry("main_function", "def main():"),
                Map.entry("return", "return")
            ),
            List.of("# Visual Programming Compiler Generated Code", "# Generated for Python", ""),
            List.of(),
            List.of(),
            List.of(),
            "#",
            BlockStyle.INDENTATION,
            IoStyle.PYTHON_BUILTINS,
            "True",
            "False",
            "[",
            "]",
            true
        ));

        configs.put(TargetLanguage.JAVA, new LanguageConfig(
            "Java",
            ".java",
            List.of(
                "public", "private", "protected", "static", "void", "int", "float",
                "double", "char", "boolean", "String", "if", "else", "while",
                "for", "do", "break", "continue", "return", "switch", "case",
                "default", "class", "main", "System", "out", "println", "Scanner",
                "nextInt", "nextLine", "import", "java", "util"
            ),
            Map.of(
                "int", "int",
                "float", "float",
                "string", "String",
                "boolean", "boolean",
                "array", "int[]"
            ),
            Map.ofEntries(
                Map.entry("variable_declaration", "{type} {name}"),
                Map.entry("variable_assignment", "{name} = {value}"),
                Map.entry("print", "System.out.println({args})"),
                Map.entry("input", "{variable} = scanner.{method}()"),
                Map.entry("if", "if ({condition})"),
                Map.entry("while", "while ({condition})"),
                Map.entry("for", "for ({init}; {condition}; {increment})"),
                Map.entry("block_start", "{"),
                Map.entry("block_end", "}"),
                Map.entry("statement_end", ";"),
                Map.entry("main_function", "public static void main(String[] args)"),
                Map.entry("return", "return;")
            ),
            List.of("import java.util.Scanner;", ""),
            List.of("public class {" + CLASS_NAME_SLOT + "} {", "public static void main(String[] args) {"),
            List.of("Scanner scanner = new Scanner(System.in);"),
            List.of("scanner.close();"),
            "//",
            BlockStyle.BRACES,
            IoStyle.JAVA_CONSOLE,
            "true",
            "false",
            "{",
            "}",
            false
        ));

        return Collections.unmodifiableMap(configs);
    }
}
