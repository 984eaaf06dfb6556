package dev.makefmt.rules.format;

import dev.makefmt.config.FormatterConfig;
import dev.makefmt.formatter.FormatRule;
import dev.makefmt.parser.CommentFields;
import dev.makefmt.parser.MakefileParser;
import dev.makefmt.parser.Node;
import dev.makefmt.parser.NodeType;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns {@code #comment} into {@code # comment}. Only single-{@code #} comments are touched;
 * shebangs and a bare {@code #} are kept. The inserted space shifts the first physical line, so a
 * continued comment has its backslashes realigned when alignment is enabled.
 */
public class CommentSpacing implements FormatRule {

    @Override
    public String name() {
        return "space_after_comment";
    }

    @Override
    public List<Node> format(List<Node> nodes, FormatterConfig config) {
        if (!config.spaceAfterComment()) {
            return nodes;
        }
        List<Node> result = new ArrayList<>(nodes.size());
        for (Node node : nodes) {
            result.add(node.is(NodeType.RULE) ? normalizeChildren(node, config) : normalize(node, config));
        }
        return result;
    }

    // comments between recipe lines are owned by the rule
    private static Node normalizeChildren(Node rule, FormatterConfig config) {
        List<Node> children = new ArrayList<>(rule.children().size());
        boolean changed = false;
        for (Node child : rule.children()) {
            Node normalized = normalize(child, config);
            changed |= normalized != child;
            children.add(normalized);
        }
        return changed ? rule.withChildren(children) : rule;
    }

    private static Node normalize(Node node, FormatterConfig config) {
        if (!node.is(NodeType.COMMENT)) {
            return node;
        }
        CommentFields fields = node.fields(CommentFields.class);
        if (!"#".equals(fields.prefix())) {
            return node;
        }
        // a comment reached through a leading continuation line does not start with '#'
        String first = firstLine(node.raw());
        if (!first.stripLeading().startsWith("#")) {
            return node;
        }
        String trimmed = node.raw().strip();
        if (trimmed.length() < 2 || trimmed.startsWith("#!")) {
            return node;
        }
        char next = trimmed.charAt(1);
        if (next == ' ' || next == '\t') {
            return node;
        }
        String raw = "# " + trimmed.substring(1);
        if (config.alignBackslashContinuations() && MakefileParser.hasContinuation(firstLine(raw))) {
            raw = BackslashAlign.alignRaw(raw, config.backslashColumn());
        }
        String text = MakefileParser.logicalLine(raw).strip().substring(1).strip();
        return node.withRaw(raw).withFields(fields.withText(text));
    }

    private static String firstLine(String raw) {
        int newline = raw.indexOf('\n');
        return newline < 0 ? raw : raw.substring(0, newline);
    }
}
