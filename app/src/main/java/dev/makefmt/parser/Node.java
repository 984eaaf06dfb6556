package dev.makefmt.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A single parsed element of a Makefile.
 *
 * <p>Nodes are immutable: formatting rules derive replacements through the {@code with*} methods
 * and leave the input untouched. When {@code raw} is non-empty it is the authoritative text of the
 * node and is written verbatim; an empty {@code raw} asks the writer to rebuild the line from
 * {@code fields}.
 *
 * @param type     the node kind
 * @param line     1-indexed source line of the first physical line covered, 0 for synthetic nodes
 * @param raw      original text, physical lines joined with {@code \n}
 * @param children recipe lines (and comments interleaved with them) owned by a {@link NodeType#RULE}
 *                 node, empty for every other kind
 * @param fields   kind-specific attributes
 */
public record Node(NodeType type, int line, String raw, List<Node> children, NodeFields fields) {

    public Node {
        Objects.requireNonNull(type, "type");
        raw = raw == null ? "" : raw;
        children = children == null ? List.of() : List.copyOf(children);
        fields = fields == null ? NoFields.INSTANCE : fields;
    }

    public static Node of(NodeType type, String raw, NodeFields fields) {
        return new Node(type, 0, raw, List.of(), fields);
    }

    public static Node of(NodeType type, String raw) {
        return new Node(type, 0, raw, List.of(), NoFields.INSTANCE);
    }

    public boolean is(NodeType expected) {
        return type == expected;
    }

    public boolean hasRaw() {
        return !raw.isEmpty();
    }

    /**
     * Returns the fields of this node as the requested variant.
     *
     * @throws IllegalStateException if the node carries a different variant
     */
    public <T extends NodeFields> T fields(Class<T> variant) {
        if (!variant.isInstance(fields)) {
            throw new IllegalStateException(type + " node at line " + line + " has no " + variant.getSimpleName());
        }
        return variant.cast(fields);
    }

    public Node withRaw(String newRaw) {
        return new Node(type, line, newRaw, children, fields);
    }

    public Node withFields(NodeFields newFields) {
        return new Node(type, line, raw, children, newFields);
    }

    public Node withChildren(List<Node> newChildren) {
        return new Node(type, line, raw, newChildren, fields);
    }

    public Node withType(NodeType newType) {
        return new Node(newType, line, raw, children, fields);
    }

    /**
     * Returns a deep copy: fields are copied and children are copied recursively.
     */
    public Node copy() {
        List<Node> copiedChildren = new ArrayList<>(children.size());
        for (Node child : children) {
            copiedChildren.add(child.copy());
        }
        return new Node(type, line, raw, copiedChildren, fields.copy());
    }
}
