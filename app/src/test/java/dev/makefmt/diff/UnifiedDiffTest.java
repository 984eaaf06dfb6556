package dev.makefmt.diff;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class UnifiedDiffTest {

    @Test
    void rendersAppendedLine() {
        String diff = UnifiedDiff.unified("f", "line1\nline2\n", "line1\nline2\nline3\n");

        assertThat(diff).isEqualTo("--- a/f\n+++ b/f\n@@ -1,2 +1,3 @@\n line1\n line2\n+line3\n");
    }

    @Test
    void equalTextsProduceNoDiff() {
        assertThat(UnifiedDiff.unified("Makefile", "a\nb\n", "a\nb\n")).isEmpty();
        assertThat(UnifiedDiff.unified("Makefile", "", "")).isEmpty();
    }

    @Test
    void emptyOldTextStartsAtLineOne() {
        assertThat(UnifiedDiff.unified("f", "", "a\n")).isEqualTo("--- a/f\n+++ b/f\n@@ -1,0 +1,1 @@\n+a\n");
    }

    @Test
    void terminatesLinesMissingANewline() {
        assertThat(UnifiedDiff.unified("f", "a\nb", "a\nc"))
                .isEqualTo("--- a/f\n+++ b/f\n@@ -1,2 +1,2 @@\n a\n-b\n+c\n");
    }

    @Test
    void distantChangesGetSeparateHunks() {
        List<String> oldLines = numbered(20);
        List<String> newLines = new ArrayList<>(oldLines);
        newLines.set(1, "changed 2");
        newLines.set(17, "changed 18");

        String diff = UnifiedDiff.unified("Makefile", join(oldLines), join(newLines));

        assertThat(diff.lines().filter(line -> line.startsWith("@@")))
                .containsExactly("@@ -1,5 +1,5 @@", "@@ -15,6 +15,6 @@");
        assertThat(diff).contains("-line 2\n+changed 2\n", "-line 18\n+changed 18\n");
    }

    @Test
    void nearbyChangesShareAHunk() {
        List<String> oldLines = numbered(12);
        List<String> newLines = new ArrayList<>(oldLines);
        newLines.set(2, "changed 3");
        newLines.set(8, "changed 9");

        String diff = UnifiedDiff.unified("Makefile", join(oldLines), join(newLines));

        assertThat(diff.lines().filter(line -> line.startsWith("@@"))).containsExactly("@@ -1,12 +1,12 @@");
    }

    @Test
    void formattingDiffShowsRemovedAndAddedLines() {
        String diff = UnifiedDiff.unified("Makefile", "VAR:=val\nall: build\n", "VAR := val\nall: build\n");

        assertThat(diff).isEqualTo("--- a/Makefile\n+++ b/Makefile\n@@ -1,2 +1,2 @@\n-VAR:=val\n+VAR := val\n all: build\n");
    }

    @Test
    void splitLinesKeepsTerminators() {
        assertThat(UnifiedDiff.splitLines("a\n\nb")).containsExactly("a\n", "\n", "b");
        assertThat(UnifiedDiff.splitLines("")).isEmpty();
    }

    private static List<String> numbered(int count) {
        List<String> lines = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            lines.add("line " + i);
        }
        return lines;
    }

    private static String join(List<String> lines) {
        return String.join("\n", lines) + "\n";
    }
}
