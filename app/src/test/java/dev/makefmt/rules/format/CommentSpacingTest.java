package dev.makefmt.rules.format;

import static org.assertj.core.api.Assertions.assertThat;

import dev.makefmt.config.FormatterConfig;
import dev.makefmt.parser.CommentFields;
import dev.makefmt.parser.Node;
import java.util.List;
import org.junit.jupiter.api.Test;

class CommentSpacingTest {

    private final CommentSpacing rule = new CommentSpacing();

    @Test
    void insertsSpaceAfterHash() {
        List<Node> result = rule.format(RuleFixture.parse("#comment here\n"), FormatterConfig.defaults());

        assertThat(result.get(0).raw()).isEqualTo("# comment here");
        assertThat(result.get(0).fields(CommentFields.class).text()).isEqualTo("comment here");
    }

    @Test
    void leavesSpecialCommentsAlone() {
        String source = "#!/usr/bin/make -f\n#\n# spaced\n#\ttabbed\n##help text\n##@Section\n#####\n";

        assertThat(RuleFixture.apply(rule, source)).isEqualTo(source);
    }

    @Test
    void normalizesCommentsBetweenRecipeLines() {
        assertThat(RuleFixture.apply(rule, "all:\n\techo a\n#note\n\techo b\n"))
                .isEqualTo("all:\n\techo a\n# note\n\techo b\n");
    }

    @Test
    void spacedCommentsAreReturnedAsIs() {
        List<Node> nodes = RuleFixture.parse("# fine\nall:\n\techo\n");

        List<Node> result = rule.format(nodes, FormatterConfig.defaults());

        assertThat(result.get(0)).isSameAs(nodes.get(0));
        assertThat(result.get(1)).isSameAs(nodes.get(1));
    }

    @Test
    void continuedCommentKeepsBackslashAtConfiguredColumn() {
        List<Node> result = rule.format(RuleFixture.parse("#TODO fix \\\n  this later\n"), FormatterConfig.defaults());

        String raw = result.get(0).raw();
        assertThat(raw).isEqualTo("# TODO fix" + " ".repeat(68) + "\\\n  this later");
        assertThat(raw.indexOf('\\')).isEqualTo(78);
        assertThat(result.get(0).fields()).isEqualTo(RuleFixture.parse(raw + "\n").get(0).fields());
    }

    @Test
    void continuedCommentOnlyGainsTheSpaceWhenAlignmentIsOff() {
        FormatterConfig config = FormatterConfig.builder().alignBackslashContinuations(false).build();

        assertThat(RuleFixture.apply(rule, "#TODO fix \\\n  this later\n", config))
                .isEqualTo("# TODO fix \\\n  this later\n");
    }

    @Test
    void commentJoinedOntoLeadingBackslashLineIsLeftAlone() {
        List<Node> nodes = RuleFixture.parse("\\\n#x\n");

        List<Node> result = rule.format(nodes, FormatterConfig.defaults());

        assertThat(result.get(0)).isSameAs(nodes.get(0));
    }

    @Test
    void disabledLeavesInputAlone() {
        List<Node> nodes = RuleFixture.parse("#comment\n");
        FormatterConfig config = FormatterConfig.builder().spaceAfterComment(false).build();

        assertThat(rule.format(nodes, config)).isSameAs(nodes);
    }
}
