package dev.makefmt.rules.format;

import dev.makefmt.config.FormatterConfig;
import dev.makefmt.formatter.FormatRule;
import dev.makefmt.parser.Node;
import dev.makefmt.parser.NodeType;
import java.util.ArrayList;
import java.util.List;

/**
 * Collapses runs of blank lines to at most {@code max_blank_lines}. A negative maximum keeps
 * every blank line.
 */
public class BlankLines implements FormatRule {

    @Override
    public String name() {
        return "max_blank_lines";
    }

    @Override
    public List<Node> format(List<Node> nodes, FormatterConfig config) {
        int max = config.maxBlankLines();
        if (max < 0) {
            return nodes;
        }
        List<Node> result = new ArrayList<>(nodes.size());
        int run = 0;
        for (Node node : nodes) {
            if (node.is(NodeType.BLANK_LINE)) {
                run++;
                if (run > max) {
                    continue;
                }
            } else {
                run = 0;
            }
            result.add(node);
        }
        return result;
    }
}
