package dev.makefmt.formatter;

import static org.assertj.core.api.Assertions.assertThat;

import dev.makefmt.config.FormatterConfig;
import dev.makefmt.config.SpacingMode;
import dev.makefmt.rules.FormatRules;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class MakefileFormatterTest {

    private static MakefileFormatter formatter(FormatterConfig config) {
        return new MakefileFormatter(config, FormatRules.defaults());
    }

    @Test
    void addsSpacesAroundAssignmentOperator() {
        assertThat(formatter(FormatterConfig.defaults()).format("VAR:=val\n")).isEqualTo("VAR := val\n");
    }

    @Test
    void collapsesBlankLineRuns() {
        FormatterConfig config = FormatterConfig.builder().maxBlankLines(2).build();

        assertThat(formatter(config).format("a\n\n\n\nb\n")).isEqualTo("a\n\n\nb\n");
    }

    @Test
    void alignsConsecutiveAssignments() {
        String source = "PROJECT_NAME := makefmt\n"
                + "PROJECT_OWNER := donaldgifford\n"
                + "DESCRIPTION := GNU Make formatter\n";

        assertThat(formatter(FormatterConfig.defaults()).format(source)).isEqualTo("PROJECT_NAME  := makefmt\n"
                + "PROJECT_OWNER := donaldgifford\n"
                + "DESCRIPTION   := GNU Make formatter\n");
    }

    @Test
    void formatsEmptyInputToEmptyOutput() {
        assertThat(formatter(FormatterConfig.defaults()).format("")).isEmpty();
    }

    @Test
    void withoutRulesOnlyAddsTheFinalNewline() {
        MakefileFormatter identity = new MakefileFormatter(FormatterConfig.defaults(), List.of());

        assertThat(identity.format("VAR:=val   \n\n\n\n#x")).isEqualTo("VAR:=val   \n\n\n\n#x\n");
    }

    @Test
    void continuedCommentIsStableAfterOnePass() {
        MakefileFormatter formatter = formatter(FormatterConfig.defaults());

        String once = formatter.format("#TODO fix \\\n  this later\n");

        assertThat(once).isEqualTo("# TODO fix" + " ".repeat(68) + "\\\n  this later\n");
        assertThat(formatter.format(once)).isEqualTo(once);
    }

    @Test
    void commentAfterLoneBackslashKeepsTheBackslash() {
        MakefileFormatter formatter = formatter(FormatterConfig.defaults());

        String once = formatter.format("\\\n#x\n");

        assertThat(once).isEqualTo(" ".repeat(78) + "\\\n#x\n");
        assertThat(formatter.format(once)).isEqualTo(once);
    }

    @Test
    void crlfInputKeepsCrlfOnEveryLine() {
        MakefileFormatter formatter = formatter(FormatterConfig.defaults());

        String once = formatter.format("A = 1\r\nB=2\r\n#c\r\n");

        assertThat(once).isEqualTo("A = 1\r\nB = 2\r\n# c\r\n");
        assertThat(formatter.format(once)).isEqualTo(once);
    }

    @Test
    void noSpaceModeLeavesAssignmentsWithAnOperatorInTheValue() {
        MakefileFormatter formatter = formatter(FormatterConfig.builder().assignmentSpacing(SpacingMode.NO_SPACE).build());

        String once = formatter.format("b = CC := gcc\nY := 1\n");

        assertThat(once).isEqualTo("b = CC := gcc\nY:=1\n");
        assertThat(formatter.format(once)).isEqualTo(once);
    }

    @ParameterizedTest
    @ValueSource(strings = {"basic", "recipes"})
    void matchesGoldenOutput(String name) throws IOException {
        String input = resource("/golden/" + name + "/input.mk");
        String expected = resource("/golden/" + name + "/expected.mk");

        assertThat(formatter(FormatterConfig.defaults()).format(input)).isEqualTo(expected);
    }

    @ParameterizedTest
    @ValueSource(strings = {"basic", "recipes"})
    void formattingIsIdempotent(String name) throws IOException {
        String input = resource("/golden/" + name + "/input.mk");
        List<FormatterConfig> configs = List.of(
                FormatterConfig.defaults(),
                FormatterConfig.builder().assignmentSpacing(SpacingMode.NO_SPACE).build(),
                FormatterConfig.builder().backslashColumn(0).build(),
                FormatterConfig.builder().conditionalIndent(4).maxBlankLines(0).build());

        for (FormatterConfig config : configs) {
            MakefileFormatter formatter = formatter(config);
            String once = formatter.format(input);
            assertThat(formatter.format(once)).as("second pass with %s", config).isEqualTo(once);
        }
    }

    private static String resource(String path) throws IOException {
        try (InputStream in = MakefileFormatterTest.class.getResourceAsStream(path)) {
            assertThat(in).as("resource %s", path).isNotNull();
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
