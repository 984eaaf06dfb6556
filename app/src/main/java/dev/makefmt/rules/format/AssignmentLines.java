package dev.makefmt.rules.format;

import dev.makefmt.parser.AssignmentFields;
import dev.makefmt.parser.MakefileParser;
import dev.makefmt.parser.Node;
import dev.makefmt.parser.NodeType;

/**
 * Text helpers shared by the assignment rules.
 */
final class AssignmentLines {

    private AssignmentLines() {
    }

    /**
     * Whether the assignment's raw text spans several physical lines or ends with a backslash.
     * Such nodes cannot be rebuilt from their fields without losing the line breaks.
     */
    static boolean isContinued(Node node) {
        String raw = node.raw();
        return raw.indexOf('\n') >= 0 || MakefileParser.hasContinuation(raw);
    }

    /**
     * Tab-led assignments are recipe lines to make; their text is left alone.
     */
    static boolean isEligible(Node node) {
        return node.is(NodeType.ASSIGNMENT) && !node.raw().startsWith("\t");
    }

    /**
     * Rewrites the name and operator on the first physical line of a continued assignment and
     * keeps every following line unchanged.
     *
     * @return the rewritten raw text, or {@code null} when the first line does not hold the
     *         operator or the unspaced head would split at a different operator
     */
    static String rewriteHead(String raw, AssignmentFields fields, String name, boolean spaced) {
        int newline = raw.indexOf('\n');
        String first = newline < 0 ? raw : raw.substring(0, newline);
        String remainder = newline < 0 ? "" : raw.substring(newline);

        String operator = fields.operator();
        int index = first.indexOf(operator);
        if (index < 0) {
            return null;
        }
        String head = first.substring(0, index).strip().replaceAll("\\s+", " ");
        if (!head.equals(fields.name().strip())) {
            return null;
        }

        String rest = first.substring(index + operator.length()).stripLeading();
        String separator = spaced ? " " : "";
        StringBuilder builder = new StringBuilder(name).append(separator).append(operator);
        if (!rest.isEmpty()) {
            builder.append(separator).append(rest);
        }
        String rewritten = builder.append(remainder).toString();
        return spaced || reparsesAs(rewritten, fields) ? rewritten : null;
    }

    /**
     * Single-line {@code name+operator[+value]} form without spaces.
     *
     * @return the compact text, or {@code null} when dropping the spaces would let another
     *         operator in the value take over, as in {@code b = CC := gcc}
     */
    static String compact(String name, AssignmentFields fields) {
        String compacted = name + fields.operator() + fields.value();
        return reparsesAs(compacted, fields) ? compacted : null;
    }

    private static boolean reparsesAs(String raw, AssignmentFields fields) {
        AssignmentFields reparsed = MakefileParser.splitAssignment(MakefileParser.logicalLine(raw).strip());
        return reparsed != null
                && reparsed.name().equals(fields.name().strip())
                && reparsed.operator().equals(fields.operator());
    }
}
