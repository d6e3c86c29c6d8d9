package com.visualcompiler.core.graph;

import com.visualcompiler.core.model.DataType;
import com.visualcompiler.core.model.EdgeKind;
import com.visualcompiler.core.model.NoProperties;
import com.visualcompiler.core.model.Node;
import com.visualcompiler.core.model.NodeKind;
import com.visualcompiler.core.model.Position;
import com.visualcompiler.core.model.PrintProperties;
import com.visualcompiler.core.model.VariableProperties;
import com.visualcompiler.core.model.WhileProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ProgramGraph}.
 */
class ProgramGraphTest {

    private ProgramGraph graph;

    @BeforeEach
    void setUp() {
        graph = new ProgramGraph();
    }

    private static Node start() {
        return new Node(NodeKind.START, Position.origin(), NoProperties.INSTANCE);
    }

    private static Node end() {
        return new Node(NodeKind.END, Position.origin(), NoProperties.INSTANCE);
    }

    private static Node print(String text) {
        return new Node(NodeKind.PRINT, new Position(10, 20), new PrintProperties(text, List.of()));
    }

    @Test
    void addNode_firstStartAndEnd_becomeAnchors() {
        Node start = start();
        Node end = end();

        assertThat(graph.addNode(start)).isEqualTo(AddOutcome.ADDED);
        assertThat(graph.addNode(end)).isEqualTo(AddOutcome.ADDED);

        assertThat(graph.startNode()).contains(start);
        assertThat(graph.endNode()).contains(end);
        assertThat(graph.size()).isEqualTo(2);
    }

    @Test
    void addNode_secondStart_keepsFirstAnchorAndReportsError() {
        Node first = start();
        Node second = start();
        graph.addNode(first);

        AddOutcome outcome = graph.addNode(second);

        assertThat(outcome).isEqualTo(AddOutcome.DUPLICATE_START);
        assertThat(graph.startNode()).contains(first);
        assertThat(graph.nodes()).containsExactly(first, second);
        assertThat(graph.validate()).containsExactly("Program can only have one Start block");
    }

    @Test
    void addNode_secondEnd_reportsError() {
        graph.addNode(end());

        assertThat(graph.addNode(end())).isEqualTo(AddOutcome.DUPLICATE_END);
        assertThat(graph.validate()).containsExactly("Program can only have one End block");
    }

    @Test
    void addNode_sameNodeTwice_isRejected() {
        Node node = print("hi");
        graph.addNode(node);

        assertThat(graph.addNode(node)).isEqualTo(AddOutcome.DUPLICATE_ID);
        assertThat(graph.size()).isEqualTo(1);
    }

    @Test
    void connect_knownNodes_addsFlowEdge() {
        Node start = start();
        Node print = print("hi");
        graph.addNode(start);
        graph.addNode(print);

        assertThat(graph.connect(start.id(), print.id())).isTrue();
        assertThat(start.connections()).containsExactly(print);
    }

    @Test
    void connect_unknownEndpointOrSelfLoop_isNoOp() {
        Node print = print("hi");
        graph.addNode(print);

        assertThat(graph.connect(print.id(), "missing")).isFalse();
        assertThat(graph.connect("missing", print.id())).isFalse();
        assertThat(graph.connect(null, print.id())).isFalse();
        assertThat(graph.connect(print.id(), print.id())).isFalse();
        assertThat(print.connections()).isEmpty();
    }

    @Test
    void connect_duplicateEdge_isIgnored() {
        Node a = print("a");
        Node b = print("b");
        graph.addNode(a);
        graph.addNode(b);

        graph.connect(a.id(), b.id());
        assertThat(graph.connect(a.id(), b.id())).isFalse();
        assertThat(a.connections()).hasSize(1);
    }

    @Test
    void connect_nextEdgeOnBlock_setsSuccessor() {
        Node loop = new Node(NodeKind.WHILE, null, new WhileProperties("x > 0"));
        Node body = print("body");
        Node after = print("after");
        graph.addNode(loop);
        graph.addNode(body);
        graph.addNode(after);

        graph.connect(loop.id(), body.id());
        graph.connect(loop.id(), after.id(), EdgeKind.NEXT);

        assertThat(loop.connections()).containsExactly(body);
        assertThat(loop.next()).contains(after);
    }

    @Test
    void connect_nextEdgeOnPlainNode_actsAsFlow() {
        Node a = print("a");
        Node b = print("b");
        graph.addNode(a);
        graph.addNode(b);

        graph.connect(a.id(), b.id(), EdgeKind.NEXT);

        assertThat(a.connections()).containsExactly(b);
        assertThat(a.next()).isEmpty();
    }

    @Test
    void validate_collectsErrorsOfAllNodes() {
        graph.addNode(start());
        graph.addNode(new Node(NodeKind.VARIABLE, null, new VariableProperties("", DataType.INT, "")));
        graph.addNode(print(""));

        assertThat(graph.validate()).containsExactly(
            "Variable name is required",
            "Print statement must have text or variables");
    }

    @Test
    void warnings_missingStartAndEnd_reportsBoth() {
        graph.addNode(print("hi"));

        assertThat(graph.validate()).isEmpty();
        assertThat(graph.warnings()).containsExactly(
            ProgramGraph.MISSING_START_WARNING,
            ProgramGraph.MISSING_END_WARNING);
    }

    @Test
    void warnings_completeProgram_isEmpty() {
        graph.addNode(start());
        graph.addNode(end());

        assertThat(graph.warnings()).isEmpty();
    }

    @Test
    void serialize_recordsNodesAnchorsAndEdges() {
        Node start = start();
        Node loop = new Node(NodeKind.WHILE, null, new WhileProperties("x > 0"));
        Node body = print("body");
        Node end = end();
        graph.addNode(start);
        graph.addNode(loop);
        graph.addNode(body);
        graph.addNode(end);
        graph.connect(start.id(), loop.id());
        graph.connect(loop.id(), body.id());
        graph.connect(loop.id(), end.id(), EdgeKind.NEXT);

        SerializedGraph serialized = graph.serialize();

        assertThat(serialized.startNodeId()).isEqualTo(start.id());
        assertThat(serialized.endNodeId()).isEqualTo(end.id());
        assertThat(serialized.nodes().keySet()).containsExactly(start.id(), loop.id(), body.id(), end.id());

        SerializedNode serializedStart = serialized.nodes().get(start.id());
        assertThat(serializedStart.type()).isEqualTo("start");
        assertThat(serializedStart.connections()).containsExactly(loop.id());
        assertThat(serializedStart.body()).isNull();

        SerializedNode serializedLoop = serialized.nodes().get(loop.id());
        assertThat(serializedLoop.properties()).containsEntry("condition", "x > 0");
        assertThat(serializedLoop.body()).containsExactly(body.id());
        assertThat(serializedLoop.next()).isEqualTo(end.id());

        assertThat(serialized.nodes().get(body.id()).position()).isEqualTo(new Position(10, 20));
    }

    @Test
    void serialize_emptyGraph_hasNoAnchors() {
        SerializedGraph serialized = graph.serialize();

        assertThat(serialized.nodes()).isEmpty();
        assertThat(serialized.startNodeId()).isNull();
        assertThat(serialized.endNodeId()).isNull();
        assertThat(graph.isEmpty()).isTrue();
    }
}
