package dev.makefmt.rules.format;

import dev.makefmt.config.FormatterConfig;
import dev.makefmt.formatter.FormatRule;
import dev.makefmt.parser.Node;
import dev.makefmt.parser.NodeType;
import java.util.ArrayList;
import java.util.List;

/**
 * Drops trailing blank lines so the writer's line terminator is the only final newline.
 */
public class FinalNewline implements FormatRule {

    @Override
    public String name() {
        return "insert_final_newline";
    }

    @Override
    public List<Node> format(List<Node> nodes, FormatterConfig config) {
        if (!config.insertFinalNewline()) {
            return nodes;
        }
        int end = nodes.size();
        while (end > 0 && nodes.get(end - 1).is(NodeType.BLANK_LINE)) {
            end--;
        }
        return new ArrayList<>(nodes.subList(0, end));
    }
}
