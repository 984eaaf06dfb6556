package dev.makefmt.runner;

import static org.assertj.core.api.Assertions.assertThat;

import dev.makefmt.config.FormatterConfig;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FormatRunnerTest {

    private static final String UNFORMATTED = "VAR:=val\n";
    private static final String FORMATTED = "VAR := val\n";

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private FormatRunner runner(String stdin) {
        return new FormatRunner(FormatterConfig.defaults(),
                new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)),
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private static RunOptions stdin(boolean check, boolean diff) {
        return new RunOptions(List.of(), check, diff, false, false, false);
    }

    private static RunOptions files(List<Path> files, boolean check, boolean diff, boolean quiet, boolean verbose) {
        return new RunOptions(files, check, diff, !check && !diff, quiet, verbose);
    }

    @Test
    void printsFormattedStdin() {
        int exitCode = runner(UNFORMATTED).run(stdin(false, false));

        assertThat(exitCode).isEqualTo(FormatRunner.EXIT_OK);
        assertThat(stdout()).isEqualTo(FORMATTED);
        assertThat(stderr()).isEmpty();
    }

    @Test
    void checkReportsUnformattedStdinThroughExitCode() {
        assertThat(runner(UNFORMATTED).run(stdin(true, false))).isEqualTo(FormatRunner.EXIT_FORMAT_DIFF);
        assertThat(runner(FORMATTED).run(stdin(true, false))).isEqualTo(FormatRunner.EXIT_OK);
        assertThat(stdout()).isEmpty();
    }

    @Test
    void diffOfStdinUsesPlaceholderName() {
        int exitCode = runner(UNFORMATTED).run(stdin(false, true));

        assertThat(exitCode).isEqualTo(FormatRunner.EXIT_FORMAT_DIFF);
        assertThat(stdout()).isEqualTo("--- a/<stdin>\n+++ b/<stdin>\n@@ -1,1 +1,1 @@\n-VAR:=val\n+VAR := val\n");
    }

    @Test
    void writeWithoutFilesIsRejected() {
        int exitCode = runner(UNFORMATTED).run(new RunOptions(List.of(), false, false, true, false, false));

        assertThat(exitCode).isEqualTo(FormatRunner.EXIT_ERROR);
        assertThat(stderr()).contains("makefmt: --write needs file arguments; standard input is printed to standard output");
        assertThat(stdout()).isEmpty();
    }

    @Test
    void rewritesFilesInPlace() throws IOException {
        Path makefile = write("Makefile", UNFORMATTED);
        Path clean = write("clean.mk", FORMATTED);

        int exitCode = runner("").run(files(List.of(makefile, clean), false, false, false, false));

        assertThat(exitCode).isEqualTo(FormatRunner.EXIT_OK);
        assertThat(Files.readString(makefile)).isEqualTo(FORMATTED);
        assertThat(Files.readString(clean)).isEqualTo(FORMATTED);
        assertThat(stdout()).isEmpty();
    }

    @Test
    void checkListsUnformattedFilesWithoutWriting() throws IOException {
        Path makefile = write("Makefile", UNFORMATTED);
        Path clean = write("clean.mk", FORMATTED);

        int exitCode = runner("").run(files(List.of(makefile, clean), true, false, false, false));

        assertThat(exitCode).isEqualTo(FormatRunner.EXIT_FORMAT_DIFF);
        assertThat(stderr()).isEqualTo(makefile + System.lineSeparator());
        assertThat(Files.readString(makefile)).isEqualTo(UNFORMATTED);
    }

    @Test
    void quietCheckPrintsNothing() throws IOException {
        Path makefile = write("Makefile", UNFORMATTED);

        int exitCode = runner("").run(files(List.of(makefile), true, false, true, false));

        assertThat(exitCode).isEqualTo(FormatRunner.EXIT_FORMAT_DIFF);
        assertThat(stderr()).isEmpty();
    }

    @Test
    void verboseListsEveryFile() throws IOException {
        Path makefile = write("Makefile", UNFORMATTED);
        Path clean = write("clean.mk", FORMATTED);

        runner("").run(files(List.of(makefile, clean), false, false, false, true));

        assertThat(stderr()).isEqualTo(makefile + System.lineSeparator() + clean + System.lineSeparator());
    }

    @Test
    void diffPrintsPatchAndKeepsFile() throws IOException {
        Path makefile = write("Makefile", UNFORMATTED);

        int exitCode = runner("").run(files(List.of(makefile), false, true, false, false));

        assertThat(exitCode).isEqualTo(FormatRunner.EXIT_FORMAT_DIFF);
        assertThat(stdout()).startsWith("--- a/" + makefile + "\n+++ b/" + makefile + "\n")
                .contains("-VAR:=val\n+VAR := val\n");
        assertThat(Files.readString(makefile)).isEqualTo(UNFORMATTED);
    }

    @Test
    void missingFileFailsButOtherFilesAreStillProcessed() throws IOException {
        Path missing = tempDir.resolve("missing.mk");
        Path makefile = write("Makefile", UNFORMATTED);

        int exitCode = runner("").run(files(List.of(missing, makefile), false, false, false, false));

        assertThat(exitCode).isEqualTo(FormatRunner.EXIT_ERROR);
        assertThat(stderr()).contains("makefmt: reading " + missing + ": no such file or directory");
        assertThat(Files.readString(makefile)).isEqualTo(FORMATTED);
    }

    @Test
    void formatSourceUsesConfiguredRules() {
        FormatRunner runner = new FormatRunner(FormatterConfig.builder().maxBlankLines(0).build(),
                new ByteArrayInputStream(new byte[0]), new PrintStream(out), new PrintStream(err));

        assertThat(runner.formatSource("a\n\n\nb\n")).isEqualTo("a\nb\n");
    }

    private Path write(String name, String content) throws IOException {
        Path path = tempDir.resolve(name);
        Files.writeString(path, content, StandardCharsets.UTF_8);
        return path;
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }
}
