package com.visualcompiler.core.factory;

import com.visualcompiler.core.model.AssignProperties;
import com.visualcompiler.core.model.DataType;
import com.visualcompiler.core.model.ForProperties;
import com.visualcompiler.core.model.NoProperties;
import com.visualcompiler.core.model.Node;
import com.visualcompiler.core.model.NodeKind;
import com.visualcompiler.core.model.Position;
import com.visualcompiler.core.model.PrintProperties;
import com.visualcompiler.core.model.VariableProperties;
import com.visualcompiler.core.model.WhileProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link NodeFactory}.
 */
class NodeFactoryTest {

    private NodeFactory factory;

    @BeforeEach
    void setUp() {
        factory = new NodeFactory();
    }

    @ParameterizedTest
    @ValueSource(strings = {"start", "end", "variable", "print", "input", "assign", "if", "while", "for"})
    void create_knownKind_returnsNodeOfThatKind(String kind) {
        Optional<Node> node = factory.create(kind, Position.origin(), Map.of());

        assertThat(node).isPresent();
        assertThat(node.get().kind().id()).isEqualTo(kind);
    }

    @ParameterizedTest
    @CsvSource({
        "start, 0",
        "end, 0",
        "variable, 1",
        "print, 1",
        "input, 1",
        "assign, 2",
        "if, 1",
        "while, 1",
        "for, 1"
    })
    void create_withoutProperties_validatesToMinimalErrorSet(String kind, int expectedErrors) {
        Node node = factory.create(kind, null, Map.of()).orElseThrow();

        assertThat(node.validate()).hasSize(expectedErrors);
    }

    @Test
    void create_unknownKind_returnsEmpty() {
        assertThat(factory.create("switch", Position.origin(), Map.of())).isEmpty();
        assertThat(factory.create(null, Position.origin(), Map.of())).isEmpty();
    }

    @Test
    void create_kindIsCaseInsensitive() {
        assertThat(factory.create("WHILE", null, null).orElseThrow().kind()).isEqualTo(NodeKind.WHILE);
    }

    @Test
    void create_variable_readsAllProperties() {
        Node node = factory.create("variable", new Position(100, 40), Map.of(
            "var_name", "x", "data_type", "float", "initial_value", "2.5")).orElseThrow();

        VariableProperties properties = node.properties(VariableProperties.class);
        assertThat(properties.varName()).isEqualTo("x");
        assertThat(properties.dataType()).isEqualTo(DataType.FLOAT);
        assertThat(properties.initialValue()).isEqualTo("2.5");
        assertThat(node.position()).isEqualTo(new Position(100, 40));
    }

    @Test
    void create_variableWithoutProperties_usesDefaults() {
        Node node = factory.create("variable", null, null).orElseThrow();

        VariableProperties properties = node.properties(VariableProperties.class);
        assertThat(properties.varName()).isEmpty();
        assertThat(properties.dataType()).isEqualTo(DataType.INT);
        assertThat(properties.hasInitialValue()).isFalse();
        assertThat(node.position()).isEqualTo(Position.origin());
    }

    @Test
    void create_unknownDataType_fallsBackToInt() {
        Node node = factory.create("variable", null, Map.of("var_name", "x", "data_type", "decimal")).orElseThrow();

        assertThat(node.properties(VariableProperties.class).dataType()).isEqualTo(DataType.INT);
    }

    @Test
    void create_numericValues_areReadAsText() {
        Node node = factory.create("variable", null, Map.of("var_name", "x", "initial_value", 42)).orElseThrow();

        assertThat(node.properties(VariableProperties.class).initialValue()).isEqualTo("42");
    }

    @Test
    void create_printWithCommaSeparatedVariables_splitsAndTrims() {
        Node node = factory.create("print", null, Map.of("text", "Sum:", "variables", "a, b,, c ")).orElseThrow();

        assertThat(node.properties(PrintProperties.class).variables()).containsExactly("a", "b", "c");
    }

    @Test
    void create_printWithVariableList_keepsOrder() {
        Node node = factory.create("print", null, Map.of("variables", List.of("y", "x"))).orElseThrow();

        assertThat(node.properties(PrintProperties.class).variables()).containsExactly("y", "x");
    }

    @Test
    void create_startAndEnd_haveNoProperties() {
        assertThat(factory.create("start", null, Map.of("text", "ignored")).orElseThrow().properties())
            .isSameAs(NoProperties.INSTANCE);
    }

    @Test
    void create_nestedObjectWhereTextExpected_returnsEmpty() {
        Map<String, Object> properties = Map.of("condition", Map.of("left", "x"));

        assertThat(factory.create("if", null, properties)).isEmpty();
    }

    @Test
    void create_generatesDistinctIds() {
        Node first = factory.create("start", null, null).orElseThrow();
        Node second = factory.create("start", null, null).orElseThrow();

        assertThat(first.id()).isNotEqualTo(second.id());
    }

    @Test
    void update_mergesOnlyGivenKeys() {
        Node node = factory.create("for", null, Map.of(
            "init", "i = 0", "condition", "i < 10", "increment", "i++")).orElseThrow();

        boolean updated = factory.update(node, Map.of("condition", "i < 20"));

        assertThat(updated).isTrue();
        ForProperties properties = node.properties(ForProperties.class);
        assertThat(properties.init()).isEqualTo("i = 0");
        assertThat(properties.condition()).isEqualTo("i < 20");
        assertThat(properties.increment()).isEqualTo("i++");
    }

    @Test
    void update_ignoresKeysOfOtherKinds() {
        Node node = factory.create("assign", null, Map.of("variable", "x", "expression", "1")).orElseThrow();

        boolean updated = factory.update(node, Map.of("var_name", "y", "expression", "x + 1"));

        assertThat(updated).isTrue();
        assertThat(node.properties(AssignProperties.class).variable()).isEqualTo("x");
        assertThat(node.properties(AssignProperties.class).expression()).isEqualTo("x + 1");
    }

    @Test
    void update_printVariablesFromString_splits() {
        Node node = factory.create("print", null, Map.of("text", "Values")).orElseThrow();

        factory.update(node, Map.of("variables", "x,y"));

        assertThat(node.properties(PrintProperties.class).variables()).containsExactly("x", "y");
        assertThat(node.properties(PrintProperties.class).text()).isEqualTo("Values");
    }

    @Test
    void update_malformedValue_leavesNodeUntouched() {
        Node node = factory.create("while", null, Map.of("condition", "x > 0")).orElseThrow();
        Map<String, Object> properties = new HashMap<>();
        properties.put("condition", List.of("x", ">", "0"));

        boolean updated = factory.update(node, properties);

        assertThat(updated).isFalse();
        assertThat(node.properties(WhileProperties.class).condition()).isEqualTo("x > 0");
    }

    @Test
    void update_emptyProperties_returnsTrue() {
        Node node = factory.create("end", null, null).orElseThrow();

        assertThat(factory.update(node, Map.of())).isTrue();
        assertThat(factory.update(node, null)).isTrue();
    }

    @Test
    void update_nullValue_keepsCurrentValue() {
        Node node = factory.create("variable", null, Map.of(
            "var_name", "name", "data_type", "string", "initial_value", "Ada")).orElseThrow();
        Map<String, Object> properties = new HashMap<>();
        properties.put("data_type", null);
        properties.put("initial_value", null);

        assertThat(factory.update(node, properties)).isTrue();

        VariableProperties variable = node.properties(VariableProperties.class);
        assertThat(variable.dataType()).isEqualTo(DataType.STRING);
        assertThat(variable.initialValue()).isEqualTo("Ada");
    }
}
