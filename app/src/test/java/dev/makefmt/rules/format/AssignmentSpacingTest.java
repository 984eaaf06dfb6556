package dev.makefmt.rules.format;

import static org.assertj.core.api.Assertions.assertThat;

import dev.makefmt.config.FormatterConfig;
import dev.makefmt.config.SpacingMode;
import dev.makefmt.parser.Node;
import java.util.List;
import org.junit.jupiter.api.Test;

class AssignmentSpacingTest {

    private final AssignmentSpacing rule = new AssignmentSpacing();

    private static FormatterConfig spacing(SpacingMode mode) {
        return FormatterConfig.builder().assignmentSpacing(mode).build();
    }

    @Test
    void spaceModeRebuildsSingleSpaces() {
        String source = "A:=1\nB   ?=   2\nC+=x y\nD!=date\nE ::= e\nEMPTY=\n";

        assertThat(RuleFixture.apply(rule, source, spacing(SpacingMode.SPACE)))
                .isEqualTo("A := 1\nB ?= 2\nC += x y\nD != date\nE ::= e\nEMPTY =\n");
    }

    @Test
    void noSpaceModeRemovesSpaces() {
        assertThat(RuleFixture.apply(rule, "A := 1\nB  +=  x y\n", spacing(SpacingMode.NO_SPACE)))
                .isEqualTo("A:=1\nB+=x y\n");
    }

    @Test
    void noSpaceModeKeepsSpacesWhenTheValueHoldsAnotherOperator() {
        String source = "b = CC := gcc\nX = a != b\nY := 1\n";

        assertThat(RuleFixture.apply(rule, source, spacing(SpacingMode.NO_SPACE)))
                .isEqualTo("b = CC := gcc\nX = a != b\nY:=1\n");
    }

    @Test
    void noSpaceModeKeepsContinuedHeadWhenAnotherOperatorWouldWin() {
        String source = "b = CC:=gcc \\\n  more\nSRCS = a.c \\\n  b.c\n";

        assertThat(RuleFixture.apply(rule, source, spacing(SpacingMode.NO_SPACE)))
                .isEqualTo("b = CC:=gcc \\\n  more\nSRCS=a.c \\\n  b.c\n");
    }

    @Test
    void preserveModeReturnsInput() {
        List<Node> nodes = RuleFixture.parse("A:=1\n");

        assertThat(rule.format(nodes, spacing(SpacingMode.PRESERVE))).isSameAs(nodes);
    }

    @Test
    void continuedAssignmentOnlyRewritesItsFirstLine() {
        String source = "SRCS   :=   a.c \\\n\t  b.c \\\n\tc.c\n";

        assertThat(RuleFixture.apply(rule, source, spacing(SpacingMode.SPACE)))
                .isEqualTo("SRCS := a.c \\\n\t  b.c \\\n\tc.c\n");
        assertThat(RuleFixture.apply(rule, source, spacing(SpacingMode.NO_SPACE)))
                .isEqualTo("SRCS:=a.c \\\n\t  b.c \\\n\tc.c\n");
    }

    @Test
    void continuationBeforeTheOperatorIsLeftAlone() {
        String source = "LONG_NAME \\\n  := value\n";

        assertThat(RuleFixture.apply(rule, source, spacing(SpacingMode.SPACE))).isEqualTo(source);
    }

    @Test
    void tabLedAssignmentsAreNotTouched() {
        String source = "\tFOO=bar\n";

        assertThat(RuleFixture.apply(rule, source, spacing(SpacingMode.SPACE))).isEqualTo(source);
    }

    @Test
    void otherNodesKeepTheirText() {
        String source = "override CFLAGS+=-O2\nall:  deps\n\tX=1 ./run\n";

        assertThat(RuleFixture.apply(rule, source, spacing(SpacingMode.SPACE))).isEqualTo(source);
    }

    @Test
    void alreadyFormattedNodesAreReturnedAsIs() {
        List<Node> nodes = RuleFixture.parse("A:=1\n");

        List<Node> result = rule.format(nodes, spacing(SpacingMode.NO_SPACE));

        assertThat(result.get(0)).isSameAs(nodes.get(0));
    }
}
