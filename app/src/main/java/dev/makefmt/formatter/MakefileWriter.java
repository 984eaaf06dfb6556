package dev.makefmt.formatter;

import dev.makefmt.parser.AssignmentFields;
import dev.makefmt.parser.CommentFields;
import dev.makefmt.parser.ConditionalFields;
import dev.makefmt.parser.IncludeFields;
import dev.makefmt.parser.Node;
import dev.makefmt.parser.RuleFields;
import dev.makefmt.parser.TextFields;
import java.util.List;

/**
 * Serializes nodes back into Makefile text.
 *
 * <p>Nodes with a non-empty raw text are written verbatim, which keeps unmodified input
 * byte-for-byte identical. Nodes whose raw text was cleared by a formatting rule are rebuilt from
 * their fields.
 */
public class MakefileWriter {

    public String write(List<Node> nodes) {
        StringBuilder builder = new StringBuilder();
        for (Node node : nodes) {
            writeNode(builder, node);
            builder.append('\n');
        }
        return builder.toString();
    }

    /**
     * Returns the text of a single node without its children: the raw text when present,
     * otherwise the form rebuilt from its fields.
     */
    public static String render(Node node) {
        if (node.hasRaw()) {
            return node.raw();
        }
        StringBuilder builder = new StringBuilder();
        reconstruct(builder, node);
        return builder.toString();
    }

    private void writeNode(StringBuilder builder, Node node) {
        if (node.hasRaw()) {
            builder.append(node.raw());
        } else {
            reconstruct(builder, node);
        }
        for (Node child : node.children()) {
            builder.append('\n');
            writeNode(builder, child);
        }
    }

    private static void reconstruct(StringBuilder builder, Node node) {
        switch (node.type()) {
            case BLANK_LINE -> {
                // the line terminator alone
            }
            case COMMENT, SECTION_HEADER -> appendComment(builder, node.fields(CommentFields.class));
            case BANNER_COMMENT -> builder.append(node.fields(CommentFields.class).text());
            case ASSIGNMENT -> appendAssignment(builder, node.fields(AssignmentFields.class));
            case RULE -> appendRule(builder, node.fields(RuleFields.class));
            case RECIPE -> builder.append('\t').append(node.fields(TextFields.class).text());
            case CONDITIONAL -> appendConditional(builder, node.fields(ConditionalFields.class));
            case INCLUDE -> appendInclude(builder, node.fields(IncludeFields.class));
            case DIRECTIVE, RAW -> builder.append(node.fields(TextFields.class).text());
        }
    }

    private static void appendComment(StringBuilder builder, CommentFields fields) {
        builder.append(fields.prefix());
        if (!fields.text().isEmpty()) {
            builder.append(' ').append(fields.text());
        }
    }

    private static void appendAssignment(StringBuilder builder, AssignmentFields fields) {
        builder.append(fields.name()).append(' ').append(fields.operator());
        if (!fields.value().isEmpty()) {
            builder.append(' ').append(fields.value());
        }
    }

    private static void appendRule(StringBuilder builder, RuleFields fields) {
        builder.append(String.join(" ", fields.targets())).append(':');
        if (!fields.prerequisites().isEmpty()) {
            builder.append(' ').append(String.join(" ", fields.prerequisites()));
        }
        if (!fields.orderOnly().isEmpty()) {
            builder.append(" | ").append(String.join(" ", fields.orderOnly()));
        }
        if (!fields.inlineHelp().isEmpty()) {
            builder.append(" ## ").append(fields.inlineHelp());
        }
    }

    private static void appendConditional(StringBuilder builder, ConditionalFields fields) {
        builder.append(fields.directive());
        if (!fields.condition().isEmpty()) {
            builder.append(' ').append(fields.condition());
        }
    }

    private static void appendInclude(StringBuilder builder, IncludeFields fields) {
        builder.append(fields.kind());
        if (!fields.paths().isEmpty()) {
            builder.append(' ').append(String.join(" ", fields.paths()));
        }
    }
}
