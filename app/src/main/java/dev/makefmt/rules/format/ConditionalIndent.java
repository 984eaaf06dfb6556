package dev.makefmt.rules.format;

import dev.makefmt.config.FormatterConfig;
import dev.makefmt.formatter.FormatRule;
import dev.makefmt.formatter.MakefileWriter;
import dev.makefmt.parser.ConditionalFields;
import dev.makefmt.parser.MakefileParser;
import dev.makefmt.parser.Node;
import dev.makefmt.parser.NodeType;
import java.util.ArrayList;
import java.util.List;

/**
 * Indents the lines inside {@code ifeq}/{@code ifdef} blocks by {@code conditional_indent}
 * spaces per nesting level.
 *
 * <p>{@code else} lines up with its opening directive and {@code endif} closes the level before
 * it is rendered. Existing leading spaces are replaced, so formatted output is stable. Blank
 * lines, banners, section headers and tab-led lines keep their text.
 */
public class ConditionalIndent implements FormatRule {

    @Override
    public String name() {
        return "indent_conditionals";
    }

    @Override
    public List<Node> format(List<Node> nodes, FormatterConfig config) {
        if (!config.indentConditionals() || config.conditionalIndent() <= 0) {
            return nodes;
        }
        Indenter indenter = new Indenter(config);
        List<Node> result = new ArrayList<>(nodes.size());
        int level = 0;
        for (Node node : nodes) {
            if (!node.is(NodeType.CONDITIONAL)) {
                result.add(indenter.indent(node, level));
                continue;
            }
            ConditionalFields fields = node.fields(ConditionalFields.class);
            if (fields.opensBlock()) {
                result.add(indenter.indent(node, level));
                level++;
            } else if (fields.isElse()) {
                result.add(indenter.indent(node, level - 1));
            } else if (fields.isEndif()) {
                level = Math.max(level - 1, 0);
                result.add(indenter.indent(node, level));
            } else {
                result.add(indenter.indent(node, level));
            }
        }
        return result;
    }

    private static final class Indenter {

        private final String unit;
        private final boolean realignBackslashes;
        private final int backslashColumn;

        private Indenter(FormatterConfig config) {
            this.unit = " ".repeat(config.conditionalIndent());
            this.realignBackslashes = config.alignBackslashContinuations();
            this.backslashColumn = config.backslashColumn();
        }

        private Node indent(Node node, int level) {
            if (level <= 0 || node.is(NodeType.BLANK_LINE)
                    || node.is(NodeType.BANNER_COMMENT) || node.is(NodeType.SECTION_HEADER)) {
                return node;
            }
            String text = MakefileWriter.render(node);
            if (text.isEmpty() || text.startsWith("\t")) {
                return node;
            }

            String indented = unit.repeat(level) + stripLeadingSpaces(text);
            if (realignBackslashes && MakefileParser.hasContinuation(indented.split("\n", -1)[0])) {
                // the first line grew, so its backslash column may have moved
                indented = BackslashAlign.alignRaw(indented, backslashColumn);
            }
            return indented.equals(node.raw()) ? node : node.withRaw(indented);
        }

        private static String stripLeadingSpaces(String text) {
            int start = 0;
            while (start < text.length() && text.charAt(start) == ' ') {
                start++;
            }
            return text.substring(start);
        }
    }
}
