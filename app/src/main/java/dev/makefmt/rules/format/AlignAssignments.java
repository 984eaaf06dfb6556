package dev.makefmt.rules.format;

import dev.makefmt.config.FormatterConfig;
import dev.makefmt.config.SpacingMode;
import dev.makefmt.formatter.FormatRule;
import dev.makefmt.parser.AssignmentFields;
import dev.makefmt.parser.Node;
import java.util.ArrayList;
import java.util.List;

/**
 * Pads the names of consecutive assignments so their operators line up.
 *
 * <p>A group is a maximal run of two or more assignments; any other node, including blank lines
 * and comments, ends it. Names are measured without existing padding.
 *
 * <p>Outside {@code no_space} mode the raw text is cleared, so alignment also normalizes the
 * operator to single spaces when spacing is set to {@code preserve}.
 */
public class AlignAssignments implements FormatRule {

    @Override
    public String name() {
        return "align_assignments";
    }

    @Override
    public List<Node> format(List<Node> nodes, FormatterConfig config) {
        if (!config.alignAssignments()) {
            return nodes;
        }
        List<Node> result = new ArrayList<>(nodes);
        int index = 0;
        while (index < result.size()) {
            if (!AssignmentLines.isEligible(result.get(index))) {
                index++;
                continue;
            }
            int start = index;
            while (index < result.size() && AssignmentLines.isEligible(result.get(index))) {
                index++;
            }
            if (index - start > 1) {
                alignGroup(result, start, index, config.assignmentSpacing());
            }
        }
        return result;
    }

    private static void alignGroup(List<Node> nodes, int start, int end, SpacingMode mode) {
        int width = 0;
        for (int i = start; i < end; i++) {
            width = Math.max(width, nodes.get(i).fields(AssignmentFields.class).name().strip().length());
        }
        for (int i = start; i < end; i++) {
            nodes.set(i, align(nodes.get(i), width, mode));
        }
    }

    private static Node align(Node node, int width, SpacingMode mode) {
        AssignmentFields fields = node.fields(AssignmentFields.class);
        String name = fields.name().strip();
        String padded = name + " ".repeat(width - name.length());

        Node aligned;
        if (AssignmentLines.isContinued(node)) {
            String raw = AssignmentLines.rewriteHead(node.raw(), fields, padded, mode != SpacingMode.NO_SPACE);
            if (raw == null) {
                return node;
            }
            aligned = node.withRaw(raw).withFields(fields.withName(padded));
        } else if (mode == SpacingMode.NO_SPACE) {
            String raw = AssignmentLines.compact(padded, fields);
            if (raw == null) {
                return node;
            }
            aligned = node.withRaw(raw);
        } else {
            aligned = node.withRaw("").withFields(fields.withName(padded));
        }
        return aligned.equals(node) ? node : aligned;
    }
}
