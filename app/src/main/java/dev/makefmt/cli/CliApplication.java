package dev.makefmt.cli;

import dev.makefmt.config.Config;
import dev.makefmt.config.ConfigException;
import dev.makefmt.config.ConfigLoader;
import dev.makefmt.config.EnvironmentReader;
import dev.makefmt.logging.LoggingConfigurator;
import dev.makefmt.runner.FormatRunner;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and runner.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    private final ConfigLoader configLoader;
    private final InputStream in;
    private final PrintStream out;
    private final PrintStream err;
    private final Path workingDirectory;

    public CliApplication() {
        this(new ConfigLoader(EnvironmentReader.system()), System.in, System.out, System.err,
                Path.of("").toAbsolutePath());
    }

    CliApplication(ConfigLoader configLoader, InputStream in, PrintStream out, PrintStream err, Path workingDirectory) {
        this.configLoader = configLoader;
        this.in = in;
        this.out = out;
        this.err = err;
        this.workingDirectory = workingDirectory;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            LoggingConfigurator.configure(configLoader.resolveLogFormat(cliArguments.logFormat()), cliArguments.verbose());
            config = configLoader.load(cliArguments.configPath(), workingDirectory);
        } catch (ConfigException ex) {
            err.println("makefmt: " + ex.getMessage());
            return FormatRunner.EXIT_ERROR;
        }
        LOGGER.debug("Using {}", config.source().map(path -> "config file " + path).orElse("default settings"));

        FormatRunner runner = new FormatRunner(config.formatter(), in, out, err);
        return runner.run(cliArguments.toRunOptions());
    }
}
