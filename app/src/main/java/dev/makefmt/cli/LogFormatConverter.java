package dev.makefmt.cli;

import dev.makefmt.config.ConfigException;
import dev.makefmt.config.LogFormat;
import picocli.CommandLine;

/**
 * Parses {@code --log-format}; invalid values are reported by picocli as usage errors.
 */
public class LogFormatConverter implements CommandLine.ITypeConverter<LogFormat> {

    @Override
    public LogFormat convert(String value) {
        try {
            return LogFormat.from(value);
        } catch (ConfigException ex) {
            throw new CommandLine.TypeConversionException("'" + value + "' is not a log format (expected text or json)");
        }
    }
}
