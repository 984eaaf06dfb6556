package dev.makefmt.rules.format;

import dev.makefmt.config.FormatterConfig;
import dev.makefmt.formatter.FormatRule;
import dev.makefmt.parser.MakefileParser;
import dev.makefmt.parser.Node;
import java.util.ArrayList;
import java.util.List;

/**
 * Moves the trailing backslashes of continuation lines to one column.
 *
 * <p>The column is {@code backslash_column} (1-based), or when that is 0 the column right after
 * the longest continued line of the node plus one space. A backslash is always preceded by at
 * least one space, even when the content runs past the column. Columns are counted in characters.
 */
public class BackslashAlign implements FormatRule {

    @Override
    public String name() {
        return "align_backslash_continuations";
    }

    @Override
    public List<Node> format(List<Node> nodes, FormatterConfig config) {
        if (!config.alignBackslashContinuations()) {
            return nodes;
        }
        List<Node> result = new ArrayList<>(nodes.size());
        for (Node node : nodes) {
            result.add(align(node, config.backslashColumn()));
        }
        return result;
    }

    private static Node align(Node node, int column) {
        List<Node> children = new ArrayList<>(node.children().size());
        for (Node child : node.children()) {
            children.add(align(child, column));
        }
        Node aligned = node.withRaw(alignRaw(node.raw(), column)).withChildren(children);
        return aligned.equals(node) ? node : aligned;
    }

    /**
     * Aligns the backslashes of one raw text; text without continuation lines is returned as is.
     */
    static String alignRaw(String raw, int column) {
        String[] lines = raw.split("\n", -1);
        int widest = -1;
        for (String line : lines) {
            if (MakefileParser.hasContinuation(line)) {
                widest = Math.max(widest, content(line).length());
            }
        }
        if (widest < 0) {
            return raw;
        }

        int target = column == 0 ? widest + 2 : column;
        for (int i = 0; i < lines.length; i++) {
            if (!MakefileParser.hasContinuation(lines[i])) {
                continue;
            }
            String content = content(lines[i]);
            int padding = Math.max(target - 1 - content.length(), 1);
            lines[i] = content + " ".repeat(padding) + "\\";
        }
        return String.join("\n", lines);
    }

    private static String content(String line) {
        String trimmed = MakefileParser.stripTrailingBlanks(line);
        return MakefileParser.stripTrailingBlanks(trimmed.substring(0, trimmed.length() - 1));
    }
}
