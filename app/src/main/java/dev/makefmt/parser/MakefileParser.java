package dev.makefmt.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Line-by-line Makefile classifier producing an ordered list of {@link Node}s.
 *
 * <p>Parsing never fails: content that matches no known construct is kept verbatim as a
 * {@link NodeType#RAW} node, so {@link #parse(String)} accepts any input, including empty text,
 * binary data and unterminated {@code define} blocks.
 */
public class MakefileParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(MakefileParser.class);

    private static final Set<String> DIRECTIVE_KEYWORDS = Set.of(
            ".PHONY",
            ".DEFAULT_GOAL",
            ".SUFFIXES",
            ".DELETE_ON_ERROR",
            ".SECONDARY",
            ".PRECIOUS",
            ".INTERMEDIATE",
            ".NOTPARALLEL",
            ".ONESHELL",
            ".POSIX",
            ".SILENT",
            ".IGNORE",
            ".EXPORT_ALL_VARIABLES",
            "export",
            "unexport",
            "vpath",
            "override");

    // ^#+$ | # followed by 3+ of = - # | box-style "## Title ##"
    private static final Pattern BANNER_PATTERN = Pattern.compile(
            "#+|#\\s*[=\\-#]{3,}\\s*|#{2,}\\s+.*\\s+#{2,}", Pattern.DOTALL);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public List<Node> parse(String source) {
        List<String> lines = splitLines(source);
        List<Node> nodes = new ParseState(lines).run();
        LOGGER.debug("Parsed {} nodes from {} lines", nodes.size(), lines.size());
        return nodes;
    }

    /**
     * Splits source into physical lines. A final newline does not produce a trailing empty line.
     */
    static List<String> splitLines(String source) {
        if (source == null || source.isEmpty()) {
            return List.of();
        }
        List<String> lines = new ArrayList<>(Arrays.asList(source.split("\n", -1)));
        if (lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        return lines;
    }

    /**
     * Returns the logical line a node's raw text was classified from: backslash-continued physical
     * lines are joined with a single space after dropping each backslash and the blanks after it.
     */
    public static String logicalLine(String raw) {
        return joinLogicalLine(splitLines(raw));
    }

    private static String joinLogicalLine(List<String> physical) {
        if (physical.size() == 1 && !hasContinuation(physical.get(0))) {
            return physical.get(0);
        }
        List<String> parts = new ArrayList<>(physical.size());
        for (String line : physical) {
            if (hasContinuation(line)) {
                String stripped = stripTrailingBlanks(line);
                parts.add(stripped.substring(0, stripped.length() - 1));
            } else {
                parts.add(line);
            }
        }
        return String.join(" ", parts);
    }

    public static boolean hasContinuation(String line) {
        return stripTrailingBlanks(line).endsWith("\\");
    }

    public static String stripTrailingBlanks(String value) {
        int end = value.length();
        while (end > 0 && (value.charAt(end - 1) == ' ' || value.charAt(end - 1) == '\t')) {
            end--;
        }
        return value.substring(0, end);
    }

    static List<String> splitWords(String value) {
        String stripped = value.strip();
        if (stripped.isEmpty()) {
            return List.of();
        }
        return List.of(WHITESPACE.split(stripped));
    }

    static boolean isBannerComment(String trimmed) {
        if (!trimmed.startsWith("#") || trimmed.equals("#")) {
            return false;
        }
        return BANNER_PATTERN.matcher(trimmed).matches();
    }

    /**
     * Mutable per-call parser state; nodes are frozen into immutable {@link Node}s at the end.
     */
    private static final class ParseState {

        private final List<String> lines;
        private final List<PendingNode> nodes = new ArrayList<>();
        private boolean inRule;
        private boolean inDefine;

        private ParseState(List<String> lines) {
            this.lines = lines;
        }

        private List<Node> run() {
            for (int index = 0; index < lines.size(); index++) {
                if (inDefine) {
                    index = captureDefineBody(index);
                    continue;
                }

                int count = continuationLength(index);
                List<String> physical = lines.subList(index, index + count);
                String joined = joinLogicalLine(physical);
                String raw = String.join("\n", physical);

                PendingNode node = classify(joined, raw);
                node.line = index + 1;
                index += count - 1;

                add(node);
            }

            List<Node> result = new ArrayList<>(nodes.size());
            for (PendingNode pending : nodes) {
                result.add(pending.build());
            }
            return result;
        }

        private void add(PendingNode node) {
            switch (node.type) {
                case RULE -> {
                    inRule = true;
                    nodes.add(node);
                }
                case RECIPE -> {
                    int parentIndex = findRuleParent();
                    if (parentIndex >= 0) {
                        PendingNode parent = nodes.get(parentIndex);
                        // comments between the rule and this recipe line move with it to keep order
                        while (nodes.size() > parentIndex + 1) {
                            parent.children.add(nodes.remove(parentIndex + 1).build());
                        }
                        parent.children.add(node.build());
                        return;
                    }
                    node.type = NodeType.RAW;
                    node.fields = new TextFields(node.raw);
                    nodes.add(node);
                }
                case BLANK_LINE -> {
                    inRule = false;
                    nodes.add(node);
                }
                case COMMENT, SECTION_HEADER, BANNER_COMMENT -> nodes.add(node);
                default -> {
                    inRule = false;
                    nodes.add(node);
                }
            }
        }

        private int findRuleParent() {
            for (int i = nodes.size() - 1; i >= 0; i--) {
                switch (nodes.get(i).type) {
                    case RULE:
                        return i;
                    case RECIPE, COMMENT, BANNER_COMMENT, SECTION_HEADER, BLANK_LINE:
                        continue;
                    default:
                        return -1;
                }
            }
            return -1;
        }

        /**
         * Appends lines to the open define node up to and including {@code endef}.
         *
         * @return the index of the last consumed line
         */
        private int captureDefineBody(int start) {
            PendingNode defineNode = nodes.get(nodes.size() - 1);
            StringBuilder raw = new StringBuilder(defineNode.raw);
            int index = start;
            while (index < lines.size()) {
                String line = lines.get(index);
                raw.append('\n').append(line);
                if (line.strip().equals("endef")) {
                    inDefine = false;
                    defineNode.raw = raw.toString();
                    defineNode.fields = new TextFields(defineNode.raw);
                    return index;
                }
                index++;
            }
            inDefine = false;
            defineNode.raw = raw.toString();
            defineNode.fields = new TextFields(defineNode.raw);
            LOGGER.debug("define block starting at line {} is not terminated", defineNode.line);
            return index;
        }

        private int continuationLength(int start) {
            int index = start;
            while (index < lines.size() && hasContinuation(lines.get(index))) {
                index++;
            }
            if (index < lines.size()) {
                index++;
            }
            return index - start;
        }


        private PendingNode classify(String joined, String raw) {
            String trimmed = joined.strip();

            if (trimmed.isEmpty()) {
                // a lone trailing backslash joins to nothing but is still content
                if (!raw.isBlank()) {
                    return new PendingNode(NodeType.RAW, raw, new TextFields(raw));
                }
                return new PendingNode(NodeType.BLANK_LINE, raw, NoFields.INSTANCE);
            }

            if (trimmed.startsWith("define ") || trimmed.startsWith("define\t") || trimmed.equals("define")) {
                inDefine = true;
                return new PendingNode(NodeType.RAW, raw, new TextFields(raw));
            }

            if (trimmed.startsWith("##@")) {
                return new PendingNode(NodeType.SECTION_HEADER, raw,
                        new CommentFields("##@", trimmed.substring(3).strip(), false));
            }

            if (isBannerComment(trimmed)) {
                return new PendingNode(NodeType.BANNER_COMMENT, raw, new CommentFields("", trimmed, false));
            }

            if (trimmed.startsWith("#")) {
                String prefix = trimmed.startsWith("##") ? "##" : "#";
                return new PendingNode(NodeType.COMMENT, raw,
                        new CommentFields(prefix, trimmed.substring(prefix.length()).strip(), false));
            }

            if (joined.startsWith("\t") && inRule) {
                return new PendingNode(NodeType.RECIPE, raw, new TextFields(joined.substring(1)));
            }

            PendingNode node = tryConditional(trimmed, raw);
            if (node == null) {
                node = tryInclude(trimmed, raw);
            }
            if (node == null) {
                node = tryDirective(trimmed, raw);
            }
            if (node == null) {
                node = tryAssignment(trimmed, raw);
            }
            if (node == null) {
                node = tryRule(trimmed, raw);
            }
            if (node == null) {
                node = new PendingNode(NodeType.RAW, raw, new TextFields(raw));
            }
            return node;
        }
    }

    private static String keywordArgument(String trimmed, String keyword) {
        if (trimmed.equals(keyword)) {
            return "";
        }
        if (trimmed.startsWith(keyword + " ") || trimmed.startsWith(keyword + "\t")) {
            return trimmed.substring(keyword.length()).strip();
        }
        return null;
    }

    private static PendingNode tryConditional(String trimmed, String raw) {
        for (String keyword : ConditionalFields.KEYWORDS) {
            String condition = keywordArgument(trimmed, keyword);
            if (condition != null) {
                return new PendingNode(NodeType.CONDITIONAL, raw, new ConditionalFields(keyword, condition));
            }
        }
        return null;
    }

    private static PendingNode tryInclude(String trimmed, String raw) {
        for (String keyword : IncludeFields.KEYWORDS) {
            String paths = keywordArgument(trimmed, keyword);
            if (paths != null) {
                return new PendingNode(NodeType.INCLUDE, raw, new IncludeFields(keyword, splitWords(paths)));
            }
        }
        return null;
    }

    private static PendingNode tryDirective(String trimmed, String raw) {
        int end = 0;
        while (end < trimmed.length()) {
            char ch = trimmed.charAt(end);
            if (ch == ' ' || ch == '\t' || ch == ':') {
                break;
            }
            end++;
        }
        if (DIRECTIVE_KEYWORDS.contains(trimmed.substring(0, end))) {
            return new PendingNode(NodeType.DIRECTIVE, raw, new TextFields(trimmed));
        }
        return null;
    }

    private static PendingNode tryAssignment(String trimmed, String raw) {
        AssignmentFields fields = splitAssignment(trimmed);
        return fields == null ? null : new PendingNode(NodeType.ASSIGNMENT, raw, fields);
    }

    /**
     * Splits a trimmed logical line into name, operator and value the way {@link #parse} does.
     *
     * @return the assignment parts, or {@code null} when the line is not an assignment
     */
    public static AssignmentFields splitAssignment(String trimmed) {
        for (String operator : AssignmentFields.OPERATORS) {
            int index = trimmed.indexOf(operator);
            if (index < 0) {
                continue;
            }
            if (index > 0 && isPartialOperator(operator, trimmed.charAt(index - 1))) {
                continue;
            }

            String name = trimmed.substring(0, index).strip();
            if (name.isEmpty() || name.contains(":")) {
                continue;
            }
            if (name.indexOf(' ') >= 0 || name.indexOf('\t') >= 0) {
                List<String> parts = splitWords(name);
                if (parts.size() != 2 || !parts.get(0).equals("override")) {
                    continue;
                }
                name = "override " + parts.get(1);
            }

            String value = trimmed.substring(index + operator.length()).strip();
            return new AssignmentFields(name, operator, value);
        }
        return null;
    }

    private static boolean isPartialOperator(String operator, char previous) {
        if (operator.equals("=")) {
            return previous == ':' || previous == '?' || previous == '+' || previous == '!';
        }
        if (operator.equals(":=")) {
            return previous == ':';
        }
        return false;
    }

    private static boolean containsAssignmentOperator(String text) {
        for (String operator : AssignmentFields.OPERATORS) {
            if (text.contains(operator)) {
                return true;
            }
        }
        return false;
    }

    private static PendingNode tryRule(String trimmed, String raw) {
        int helpIndex = trimmed.indexOf("##");
        String head = helpIndex >= 0 ? trimmed.substring(0, helpIndex) : trimmed;
        if (containsAssignmentOperator(head)) {
            return null;
        }
        int colon = head.indexOf(':');
        if (colon < 0) {
            return null;
        }
        List<String> targets = splitWords(head.substring(0, colon));
        if (targets.isEmpty()) {
            return null;
        }

        String rest = head.substring(colon + 1).strip();
        String inlineHelp = helpIndex >= 0 ? trimmed.substring(helpIndex + 2).strip() : "";

        List<String> prerequisites;
        List<String> orderOnly;
        int pipe = rest.indexOf('|');
        if (pipe >= 0) {
            prerequisites = splitWords(rest.substring(0, pipe));
            orderOnly = splitWords(rest.substring(pipe + 1));
        } else {
            prerequisites = splitWords(rest);
            orderOnly = List.of();
        }
        return new PendingNode(NodeType.RULE, raw, new RuleFields(targets, prerequisites, orderOnly, inlineHelp));
    }

    private static final class PendingNode {

        private NodeType type;
        private int line;
        private String raw;
        private NodeFields fields;
        private final List<Node> children = new ArrayList<>();

        private PendingNode(NodeType type, String raw, NodeFields fields) {
            this.type = type;
            this.raw = raw;
            this.fields = fields;
        }

        private Node build() {
            return new Node(type, line, raw, children, fields);
        }
    }
}
