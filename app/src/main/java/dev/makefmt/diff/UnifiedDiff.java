package dev.makefmt.diff;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders line-based unified diffs.
 *
 * <pre>
 * --- a/Makefile
 * +++ b/Makefile
 * &#64;&#64; -1,2 +1,2 &#64;&#64;
 * -VAR:=val
 * +VAR := val
 *  all: build
 * </pre>
 */
public final class UnifiedDiff {

    /** Unchanged lines shown around each change. */
    static final int CONTEXT_LINES = 3;

    private UnifiedDiff() {
    }

    /**
     * Returns the unified diff from {@code oldText} to {@code newText}, or an empty string when
     * both are equal. Every output line ends with a newline, including lines whose source text had
     * none.
     *
     * @param name file name used in the {@code ---}/{@code +++} headers
     */
    public static String unified(String name, String oldText, String newText) {
        if (oldText.equals(newText)) {
            return "";
        }
        List<String> oldLines = splitLines(oldText);
        List<String> newLines = splitLines(newText);
        List<Hunk> hunks = hunks(MyersDiff.diff(oldLines, newLines));
        if (hunks.isEmpty()) {
            return "";
        }

        StringBuilder builder = new StringBuilder();
        builder.append("--- a/").append(name).append('\n');
        builder.append("+++ b/").append(name).append('\n');
        for (Hunk hunk : hunks) {
            hunk.appendTo(builder, oldLines, newLines);
        }
        return builder.toString();
    }

    /**
     * Splits text after each {@code \n}, keeping the terminators. Empty text has no lines.
     */
    static List<String> splitLines(String text) {
        List<String> lines = new ArrayList<>();
        int start = 0;
        while (start < text.length()) {
            int newline = text.indexOf('\n', start);
            int end = newline < 0 ? text.length() : newline + 1;
            lines.add(text.substring(start, end));
            start = end;
        }
        return lines;
    }

    static List<Hunk> hunks(List<Edit> edits) {
        List<int[]> regions = new ArrayList<>();
        for (int i = 0; i < edits.size(); i++) {
            if (!edits.get(i).isChange()) {
                continue;
            }
            int[] last = regions.isEmpty() ? null : regions.get(regions.size() - 1);
            if (last != null && i <= last[1] + 1) {
                last[1] = i;
            } else {
                regions.add(new int[] {i, i});
            }
        }

        List<int[]> merged = new ArrayList<>();
        for (int[] region : regions) {
            int[] last = merged.isEmpty() ? null : merged.get(merged.size() - 1);
            if (last != null && region[0] - last[1] <= 2 * CONTEXT_LINES) {
                last[1] = region[1];
            } else {
                merged.add(region);
            }
        }

        List<Hunk> hunks = new ArrayList<>(merged.size());
        for (int[] region : merged) {
            int start = Math.max(region[0] - CONTEXT_LINES, 0);
            int end = Math.min(region[1] + CONTEXT_LINES, edits.size() - 1);
            hunks.add(Hunk.of(edits.subList(start, end + 1)));
        }
        return hunks;
    }

    /**
     * One {@code @@} block.
     *
     * @param oldStart 0-based first old line, 0 when the hunk holds no old line
     * @param oldCount old lines covered
     * @param newStart 0-based first new line, 0 when the hunk holds no new line
     * @param newCount new lines covered
     * @param edits    edits rendered in this hunk, context included
     */
    record Hunk(int oldStart, int oldCount, int newStart, int newCount, List<Edit> edits) {

        Hunk {
            edits = List.copyOf(edits);
        }

        static Hunk of(List<Edit> edits) {
            int oldStart = 0;
            int newStart = 0;
            for (Edit edit : edits) {
                if (edit.oldIndex() >= 0) {
                    oldStart = edit.oldIndex();
                    break;
                }
            }
            for (Edit edit : edits) {
                if (edit.newIndex() >= 0) {
                    newStart = edit.newIndex();
                    break;
                }
            }
            int oldCount = 0;
            int newCount = 0;
            for (Edit edit : edits) {
                switch (edit.kind()) {
                    case EQUAL -> {
                        oldCount++;
                        newCount++;
                    }
                    case DELETE -> oldCount++;
                    case INSERT -> newCount++;
                }
            }
            return new Hunk(oldStart, oldCount, newStart, newCount, edits);
        }

        String header() {
            return "@@ -" + (oldStart + 1) + "," + oldCount + " +" + (newStart + 1) + "," + newCount + " @@";
        }

        void appendTo(StringBuilder builder, List<String> oldLines, List<String> newLines) {
            builder.append(header()).append('\n');
            for (Edit edit : edits) {
                switch (edit.kind()) {
                    case EQUAL -> appendLine(builder, ' ', oldLines.get(edit.oldIndex()));
                    case DELETE -> appendLine(builder, '-', oldLines.get(edit.oldIndex()));
                    case INSERT -> appendLine(builder, '+', newLines.get(edit.newIndex()));
                }
            }
        }

        private static void appendLine(StringBuilder builder, char marker, String line) {
            builder.append(marker).append(line);
            if (!line.endsWith("\n")) {
                builder.append('\n');
            }
        }
    }
}
