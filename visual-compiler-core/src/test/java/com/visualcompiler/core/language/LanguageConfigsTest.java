package com.visualcompiler.core.language;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link LanguageConfigs} and {@link LanguageConfig}.
 */
class LanguageConfigsTest {

    @Test
    void availableLanguages_listsAllInDeclarationOrder() {
        assertThat(LanguageConfigs.availableLanguages()).containsExactly(
            new LanguageSummary("c", "C"),
            new LanguageSummary("cpp", "C++"),
            new LanguageSummary("python", "Python"),
            new LanguageSummary("java", "Java"));
    }

    @Test
    void find_unknownLanguage_isEmpty() {
        assertThat(LanguageConfigs.find("rust")).isEmpty();
        assertThat(LanguageConfigs.find(null)).isEmpty();
    }

    @Test
    void find_isCaseInsensitive() {
        assertThat(LanguageConfigs.find("CPP").orElseThrow().extension()).isEqualTo(".cpp");
    }

    @ParameterizedTest
    @EnumSource(TargetLanguage.class)
    void everyLanguage_mapsAllDataTypes(TargetLanguage language) {
        LanguageConfig config = LanguageConfigs.get(language);

        assertThat(config.dataTypes()).containsOnlyKeys("int", "float", "string", "boolean", "array");
        assertThat(config.syntax()).containsKeys(
            "variable_declaration", "variable_assignment", "print", "input",
            "if", "while", "for", "block_start", "block_end", "statement_end");
    }

    @Test
    void typeFor_returnsConcreteSpelling() {
        assertThat(LanguageConfigs.get(TargetLanguage.C).typeFor("string")).isEqualTo("char*");
        assertThat(LanguageConfigs.get(TargetLanguage.PYTHON).typeFor("string")).isEqualTo("str");
        assertThat(LanguageConfigs.get(TargetLanguage.CPP).typeFor("array")).isEqualTo("vector<int>");
    }

    @Test
    void statementEnd_differsBetweenBraceAndIndentLanguages() {
        assertThat(LanguageConfigs.get(TargetLanguage.JAVA).statementEnd()).isEqualTo(";");
        assertThat(LanguageConfigs.get(TargetLanguage.PYTHON).statementEnd()).isEmpty();
    }

    @Test
    void render_fillsPlaceholders() {
        LanguageConfig c = LanguageConfigs.get(TargetLanguage.C);

        assertThat(c.render("for", Map.of("init", "i = 0", "condition", "i < 3", "increment", "i++")))
            .isEqualTo("for (i = 0; i < 3; i++)");
    }

    @Test
    void fill_keepsUnknownPlaceholdersAndInsertsValuesLiterally() {
        String filled = LanguageConfig.fill("if ({condition}) {other}", Map.of("condition", "a == \"{b}\" && $x"));

        assertThat(filled).isEqualTo("if (a == \"{b}\" && $x) {other}");
    }

    @Test
    void template_unknownSlot_isEmpty() {
        assertThat(LanguageConfigs.get(TargetLanguage.C).template("lambda")).isEmpty();
    }
}
