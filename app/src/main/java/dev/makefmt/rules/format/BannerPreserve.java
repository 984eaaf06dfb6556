package dev.makefmt.rules.format;

import dev.makefmt.config.FormatterConfig;
import dev.makefmt.formatter.FormatRule;
import dev.makefmt.parser.CommentFields;
import dev.makefmt.parser.MakefileParser;
import dev.makefmt.parser.Node;
import dev.makefmt.parser.NodeType;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Guard that runs last and puts banner comments and section headers back to their parsed text if
 * an earlier rule altered them. It has no configuration switch.
 */
public class BannerPreserve implements FormatRule {

    private static final Logger LOGGER = LoggerFactory.getLogger(BannerPreserve.class);

    @Override
    public String name() {
        return "preserve_banner_comments";
    }

    @Override
    public List<Node> format(List<Node> nodes, FormatterConfig config) {
        List<Node> restored = restoreAll(nodes);
        return restored == null ? nodes : restored;
    }

    /**
     * @return the list with restored nodes, or {@code null} when every node is intact
     */
    private static List<Node> restoreAll(List<Node> nodes) {
        List<Node> result = null;
        for (int i = 0; i < nodes.size(); i++) {
            Node node = nodes.get(i);
            Node restored = restore(node);
            if (restored != node) {
                if (result == null) {
                    result = new ArrayList<>(nodes);
                }
                result.set(i, restored);
            }
        }
        return result;
    }

    private static Node restore(Node node) {
        switch (node.type()) {
            case RULE -> {
                List<Node> children = restoreAll(node.children());
                return children == null ? node : node.withChildren(children);
            }
            case BANNER_COMMENT -> {
                String text = node.fields(CommentFields.class).text();
                if (!node.hasRaw() || MakefileParser.logicalLine(node.raw()).strip().equals(text)) {
                    return node;
                }
                return restored(node, text);
            }
            case SECTION_HEADER -> {
                String text = node.fields(CommentFields.class).text();
                if (!node.hasRaw() || isIntactHeader(node.raw(), text)) {
                    return node;
                }
                return restored(node, text.isEmpty() ? "##@" : "##@ " + text);
            }
            default -> {
                return node;
            }
        }
    }

    private static boolean isIntactHeader(String raw, String text) {
        String line = MakefileParser.logicalLine(raw).strip();
        return line.startsWith("##@") && line.substring(3).strip().equals(text);
    }

    private static Node restored(Node node, String raw) {
        LOGGER.warn("Restored {} at line {} that an earlier rule had changed", node.type(), node.line());
        return node.withRaw(raw);
    }
}
