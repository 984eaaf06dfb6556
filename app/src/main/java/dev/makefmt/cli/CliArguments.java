package dev.makefmt.cli;

import dev.makefmt.config.LogFormat;
import dev.makefmt.runner.RunOptions;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;

@CommandLine.Command(name = "makefmt", mixinStandardHelpOptions = true, versionProvider = VersionProvider.class,
        description = "Format Makefiles. With no files, reads standard input and writes the result to standard output.")
public class CliArguments {

    @CommandLine.Option(names = "--check", description = "Exit with 1 if any input is not formatted; nothing is written")
    private boolean check;

    @CommandLine.Option(names = "--diff", description = "Print a unified diff of the changes instead of applying them")
    private boolean diff;

    @CommandLine.Option(names = {"-w", "--write"}, description = "Write the result back to each file (default for files); not allowed with standard input")
    private boolean write;

    @CommandLine.Option(names = "--config", description = "Config file; by default makefmt.yml, makefmt.yaml, .makefmt.yml or .makefmt.yaml", paramLabel = "FILE")
    private Path configPath;

    @CommandLine.Option(names = {"-q", "--quiet"}, description = "Do not list unformatted files in check mode")
    private boolean quiet;

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "List files as they are processed and enable debug logging")
    private boolean verbose;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Parameters(paramLabel = "FILE", arity = "0..*", description = "Makefiles to format")
    private List<Path> files = new ArrayList<>();

    public boolean check() {
        return check;
    }

    public boolean diff() {
        return diff;
    }

    public boolean write() {
        return write;
    }

    public Path configPath() {
        return configPath;
    }

    public boolean quiet() {
        return quiet;
    }

    public boolean verbose() {
        return verbose;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public List<Path> files() {
        return files;
    }

    public RunOptions toRunOptions() {
        return new RunOptions(files, check, diff, write, quiet, verbose);
    }
}
