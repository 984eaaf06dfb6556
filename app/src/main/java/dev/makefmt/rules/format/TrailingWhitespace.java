package dev.makefmt.rules.format;

import dev.makefmt.config.FormatterConfig;
import dev.makefmt.formatter.FormatRule;
import dev.makefmt.parser.AssignmentFields;
import dev.makefmt.parser.CommentFields;
import dev.makefmt.parser.ConditionalFields;
import dev.makefmt.parser.Node;
import dev.makefmt.parser.NodeFields;
import dev.makefmt.parser.RuleFields;
import dev.makefmt.parser.TextFields;
import java.util.ArrayList;
import java.util.List;

/**
 * Removes trailing spaces and tabs from every physical line and every text field.
 */
public class TrailingWhitespace implements FormatRule {

    @Override
    public String name() {
        return "trim_trailing_whitespace";
    }

    @Override
    public List<Node> format(List<Node> nodes, FormatterConfig config) {
        if (!config.trimTrailingWhitespace()) {
            return nodes;
        }
        List<Node> result = new ArrayList<>(nodes.size());
        for (Node node : nodes) {
            result.add(trim(node));
        }
        return result;
    }

    private static Node trim(Node node) {
        List<Node> children = new ArrayList<>(node.children().size());
        for (Node child : node.children()) {
            children.add(trim(child));
        }
        Node trimmed = new Node(node.type(), node.line(), trimLines(node.raw()), children, trimFields(node.fields()));
        return trimmed.equals(node) ? node : trimmed;
    }

    private static NodeFields trimFields(NodeFields fields) {
        if (fields instanceof CommentFields comment) {
            return comment.withText(trimLines(comment.text()));
        }
        if (fields instanceof AssignmentFields assignment) {
            return assignment.withValue(trimLines(assignment.value()));
        }
        if (fields instanceof RuleFields rule) {
            return rule.withInlineHelp(trimLines(rule.inlineHelp()));
        }
        if (fields instanceof ConditionalFields conditional) {
            return conditional.withCondition(trimLines(conditional.condition()));
        }
        if (fields instanceof TextFields text) {
            return text.withText(trimLines(text.text()));
        }
        return fields;
    }

    static String trimLines(String value) {
        if (value.indexOf('\n') < 0) {
            return stripTrailing(value);
        }
        String[] lines = value.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            lines[i] = stripTrailing(lines[i]);
        }
        return String.join("\n", lines);
    }

    // spaces and tabs only; a trailing \r belongs to the content
    private static String stripTrailing(String line) {
        int end = line.length();
        while (end > 0 && (line.charAt(end - 1) == ' ' || line.charAt(end - 1) == '\t')) {
            end--;
        }
        return line.substring(0, end);
    }
}
