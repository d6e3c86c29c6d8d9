package com.visualcompiler.core.factory;

import com.visualcompiler.core.model.AssignProperties;
import com.visualcompiler.core.model.DataType;
import com.visualcompiler.core.model.ForProperties;
import com.visualcompiler.core.model.IfProperties;
import com.visualcompiler.core.model.InputProperties;
import com.visualcompiler.core.model.NoProperties;
import com.visualcompiler.core.model.Node;
import com.visualcompiler.core.model.NodeKind;
import com.visualcompiler.core.model.NodeProperties;
import com.visualcompiler.core.model.Position;
import com.visualcompiler.core.model.PrintProperties;
import com.visualcompiler.core.model.VariableProperties;
import com.visualcompiler.core.model.WhileProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds typed nodes from the untyped block descriptions a visual editor sends.
 *
 * <p>The factory is permissive because editors send partial state while the user is
 * still typing:
 * <ul>
 *   <li>missing string properties default to the empty string</li>
 *   <li>a missing {@code variables} list on a Print block defaults to empty</li>
 *   <li>unknown {@code data_type} values fall back to {@code int}</li>
 *   <li>numbers and booleans are accepted where strings are expected</li>
 * </ul>
 *
 * <p>Only an unknown block kind, or a value that cannot be read as text at all (a nested
 * object where a string is expected), yields an empty result. Nothing is thrown, so one
 * bad block never aborts building the rest of a graph.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * NodeFactory factory = new NodeFactory();
 * Optional<Node> node = factory.create("variable", new Position(100, 40),
 *     Map.of("var_name", "x", "data_type", "int", "initial_value", "5"));
 * }</pre>
 */
public class NodeFactory {

    private static final Logger log = LoggerFactory.getLogger(NodeFactory.class);

    /**
     * Creates a node for the given block kind.
     *
     * @param kind block kind id such as {@code "print"}
     * @param position canvas position, origin when null
     * @param properties block property bag, may be null
     * @return created node, or empty when the kind is unknown or a property is malformed
     */
    public Optional<Node> create(String kind, Position position, Map<String, ?> properties) {
        Optional<NodeKind> nodeKind = NodeKind.fromId(kind);
        if (nodeKind.isEmpty()) {
            log.warn("Ignoring block of unknown kind: {}", kind);
            return Optional.empty();
        }

        PropertyReader reader = new PropertyReader(properties == null ? Map.of() : properties);
        try {
            Node node = new Node(nodeKind.get(), position, buildProperties(nodeKind.get(), reader));
            log.debug("Created node {}", node);
            return Optional.of(node);
        } catch (MalformedPropertyException e) {
            log.warn("Could not create {} block: {}", kind, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Merges the given properties into an existing node.
     *
     * <p>Only keys present in {@code properties} with a non-null value are changed; keys
     * the node's kind does not know are ignored. When a recognized key carries a value that cannot be read,
     * the node is left untouched.
     *
     * @param node node to patch
     * @param properties properties to merge
     * @return true if the node was updated (or there was nothing to update)
     */
    public boolean update(Node node, Map<String, ?> properties) {
        Objects.requireNonNull(node, "node must not be null");
        if (properties == null || properties.isEmpty()) {
            return true;
        }

        PropertyReader reader = new PropertyReader(properties);
        try {
            node.replaceProperties(mergeProperties(node.properties(), reader));
            log.debug("Updated properties of {}", node);
            return true;
        } catch (MalformedPropertyException e) {
            log.warn("Could not update {}: {}", node, e.getMessage());
            return false;
        }
    }

    private NodeProperties buildProperties(NodeKind kind, PropertyReader reader) {
        return switch (kind) {
            case START, END -> NoProperties.INSTANCE;
            case VARIABLE -> new VariableProperties(
                reader.string(VariableProperties.VAR_NAME, ""),
                DataType.fromIdOrDefault(reader.string(VariableProperties.DATA_TYPE, "int")),
                reader.string(VariableProperties.INITIAL_VALUE, ""));
            case PRINT -> new PrintProperties(
                reader.string(PrintProperties.TEXT, ""),
                reader.names(PrintProperties.VARIABLES, List.of()));
            case INPUT -> new InputProperties(
                reader.string(InputProperties.PROMPT, ""),
                reader.string(InputProperties.VARIABLE, ""));
            case ASSIGN -> new AssignProperties(
                reader.string(AssignProperties.VARIABLE, ""),
                reader.string(AssignProperties.EXPRESSION, ""));
            case IF -> new IfProperties(reader.string(IfProperties.CONDITION, ""));
            case WHILE -> new WhileProperties(reader.string(WhileProperties.CONDITION, ""));
            case FOR -> new ForProperties(
                reader.string(ForProperties.INIT, ""),
                reader.string(ForProperties.CONDITION, ""),
                reader.string(ForProperties.INCREMENT, ""));
        };
    }

    private NodeProperties mergeProperties(NodeProperties current, PropertyReader reader) {
        if (current instanceof VariableProperties p) {
            return new VariableProperties(
                reader.string(VariableProperties.VAR_NAME, p.varName()),
                reader.hasValue(VariableProperties.DATA_TYPE)
                    ? DataType.fromIdOrDefault(reader.string(VariableProperties.DATA_TYPE, null))
                    : p.dataType(),
                reader.string(VariableProperties.INITIAL_VALUE, p.initialValue()));
        }
        if (current instanceof PrintProperties p) {
            return new PrintProperties(
                reader.string(PrintProperties.TEXT, p.text()),
                reader.names(PrintProperties.VARIABLES, p.variables()));
        }
        if (current instanceof InputProperties p) {
            return new InputProperties(
                reader.string(InputProperties.PROMPT, p.prompt()),
                reader.string(InputProperties.VARIABLE, p.variable()));
        }
        if (current instanceof AssignProperties p) {
            return new AssignProperties(
                reader.string(AssignProperties.VARIABLE, p.variable()),
                reader.string(AssignProperties.EXPRESSION, p.expression()));
        }
        if (current instanceof IfProperties p) {
            return new IfProperties(reader.string(IfProperties.CONDITION, p.condition()));
        }
        if (current instanceof WhileProperties p) {
            return new WhileProperties(reader.string(WhileProperties.CONDITION, p.condition()));
        }
        if (current instanceof ForProperties p) {
            return new ForProperties(
                reader.string(ForProperties.INIT, p.init()),
                reader.string(ForProperties.CONDITION, p.condition()),
                reader.string(ForProperties.INCREMENT, p.increment()));
        }
        return current;
    }

    /**
     * Reads values out of a loosely typed property bag.
     */
    private static final class PropertyReader {

        private final Map<String, ?> properties;

        PropertyReader(Map<String, ?> properties) {
            this.properties = properties;
        }

        boolean hasValue(String key) {
            return properties.get(key) != null;
        }

        /**
         * Reads a scalar as text. Absent or null values yield the fallback.
         */
        String string(String key, String fallback) {
            Object value = properties.get(key);
            if (value == null) {
                return fallback;
            }
            if (value instanceof String || value instanceof Number
                || value instanceof Boolean || value instanceof Character) {
                return value.toString();
            }
            throw new MalformedPropertyException(key, value);
        }

        /**
         * Reads a list of names given either as a list or as comma-separated text.
         * Entries are trimmed and blank entries dropped.
         */
        List<String> names(String key, List<String> fallback) {
            Object value = properties.get(key);
            if (value == null) {
                return fallback;
            }
            if (value instanceof String text) {
                return splitNames(Arrays.asList(text.split(",")));
            }
            if (value instanceof Collection<?> items) {
                for (Object item : items) {
                    if (item != null && !(item instanceof String) && !(item instanceof Number)) {
                        throw new MalformedPropertyException(key, value);
                    }
                }
                return splitNames(items);
            }
            throw new MalformedPropertyException(key, value);
        }

        private static List<String> splitNames(Collection<?> items) {
            return items.stream()
                .filter(Objects::nonNull)
                .map(item -> item.toString().trim())
                .filter(name -> !name.isEmpty())
                .toList();
        }
    }

    private static final class MalformedPropertyException extends RuntimeException {

        MalformedPropertyException(String key, Object value) {
            super("property '" + key + "' cannot be read as text: " + value.getClass().getSimpleName());
        }
    }
}
