package dev.makefmt.rules.format;

import dev.makefmt.config.FormatterConfig;
import dev.makefmt.config.SpacingMode;
import dev.makefmt.formatter.FormatRule;
import dev.makefmt.parser.AssignmentFields;
import dev.makefmt.parser.Node;
import java.util.ArrayList;
import java.util.List;

/**
 * Normalizes the spacing around assignment operators.
 *
 * <p>In {@code space} mode the raw text is cleared so the writer rebuilds {@code NAME := value};
 * in {@code no_space} mode the raw text becomes {@code NAME:=value}. Continued assignments keep
 * their line breaks: only the name and operator on their first line are rewritten. An assignment
 * whose unspaced form would split at another operator in its value keeps its spaces.
 */
public class AssignmentSpacing implements FormatRule {

    @Override
    public String name() {
        return "assignment_spacing";
    }

    @Override
    public List<Node> format(List<Node> nodes, FormatterConfig config) {
        SpacingMode mode = config.assignmentSpacing();
        if (mode == SpacingMode.PRESERVE) {
            return nodes;
        }
        List<Node> result = new ArrayList<>(nodes.size());
        for (Node node : nodes) {
            result.add(AssignmentLines.isEligible(node) ? normalize(node, mode) : node);
        }
        return result;
    }

    private static Node normalize(Node node, SpacingMode mode) {
        AssignmentFields fields = node.fields(AssignmentFields.class);
        String raw;
        if (AssignmentLines.isContinued(node)) {
            raw = AssignmentLines.rewriteHead(node.raw(), fields, fields.name(), mode == SpacingMode.SPACE);
            if (raw == null) {
                return node;
            }
        } else if (mode == SpacingMode.SPACE) {
            raw = "";
        } else {
            raw = AssignmentLines.compact(fields.name(), fields);
            if (raw == null) {
                return node;
            }
        }
        return raw.equals(node.raw()) ? node : node.withRaw(raw);
    }
}
