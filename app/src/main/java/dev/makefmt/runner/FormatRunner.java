package dev.makefmt.runner;

import dev.makefmt.config.FormatterConfig;
import dev.makefmt.diff.UnifiedDiff;
import dev.makefmt.formatter.MakefileFormatter;
import dev.makefmt.rules.FormatRules;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Formats standard input or a list of files and selects the process exit code.
 */
public class FormatRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(FormatRunner.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FORMAT_DIFF = 1;
    public static final int EXIT_ERROR = 2;

    static final String STDIN_NAME = "<stdin>";

    private final MakefileFormatter formatter;
    private final InputStream in;
    private final PrintStream out;
    private final PrintStream err;

    public FormatRunner(FormatterConfig config, InputStream in, PrintStream out, PrintStream err) {
        this(new MakefileFormatter(config, FormatRules.defaults()), in, out, err);
    }

    public FormatRunner(MakefileFormatter formatter, InputStream in, PrintStream out, PrintStream err) {
        this.formatter = Objects.requireNonNull(formatter, "formatter");
        this.in = Objects.requireNonNull(in, "in");
        this.out = Objects.requireNonNull(out, "out");
        this.err = Objects.requireNonNull(err, "err");
    }

    /**
     * Runs the formatter and returns {@link #EXIT_OK}, {@link #EXIT_FORMAT_DIFF} when check or diff
     * mode found unformatted input, or {@link #EXIT_ERROR} when an input could not be read or
     * written. With several files the highest code wins. Asking to write back standard input is
     * an error.
     */
    public int run(RunOptions options) {
        if (options.readsStdin()) {
            if (options.write()) {
                return fail("--write needs file arguments; standard input is printed to standard output", null);
            }
            return runStdin(options);
        }
        int exitCode = EXIT_OK;
        for (Path path : options.files()) {
            exitCode = Math.max(exitCode, runFile(options, path));
        }
        return exitCode;
    }

    public String formatSource(String source) {
        return formatter.format(source);
    }

    private int runStdin(RunOptions options) {
        String input;
        try {
            input = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            return fail("reading stdin: " + reason(ex), ex);
        }
        String output = formatSource(input);

        if (options.check()) {
            return input.equals(output) ? EXIT_OK : EXIT_FORMAT_DIFF;
        }
        if (options.diff()) {
            return printDiff(STDIN_NAME, input, output);
        }
        out.print(output);
        out.flush();
        return EXIT_OK;
    }

    private int runFile(RunOptions options, Path path) {
        try {
            String input = read(path);
            String output = formatSource(input);
            if (options.verbose()) {
                err.println(path);
            }

            if (options.check()) {
                if (input.equals(output)) {
                    return EXIT_OK;
                }
                if (!options.quiet()) {
                    err.println(path);
                }
                return EXIT_FORMAT_DIFF;
            }
            if (options.diff()) {
                return printDiff(path.toString(), input, output);
            }
            if (!input.equals(output)) {
                write(path, output);
                LOGGER.debug("Rewrote {}", path);
            }
            return EXIT_OK;
        } catch (UncheckedIOException ex) {
            return fail(ex.getMessage(), ex.getCause());
        }
    }

    private int printDiff(String name, String input, String output) {
        String diff = UnifiedDiff.unified(name, input, output);
        if (diff.isEmpty()) {
            return EXIT_OK;
        }
        out.print(diff);
        out.flush();
        return EXIT_FORMAT_DIFF;
    }

    private static String read(Path path) {
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("reading " + path + ": " + reason(ex), ex);
        }
    }

    private static void write(Path path, String content) {
        try {
            Files.writeString(path, content, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("writing " + path + ": " + reason(ex), ex);
        }
    }

    private int fail(String message, Throwable cause) {
        LOGGER.debug("Run failed: {}", message, cause);
        err.println("makefmt: " + message);
        return EXIT_ERROR;
    }

    private static String reason(IOException ex) {
        if (ex instanceof NoSuchFileException) {
            return "no such file or directory";
        }
        if (ex instanceof AccessDeniedException) {
            return "permission denied";
        }
        return ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
    }
}
