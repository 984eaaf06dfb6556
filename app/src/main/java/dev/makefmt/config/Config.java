package dev.makefmt.config;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable runtime configuration assembled from defaults and an optional config file.
 *
 * @param formatter the formatter settings
 * @param source    the config file the settings were read from, empty when defaults are used
 */
public record Config(FormatterConfig formatter, Optional<Path> source) {

    public Config {
        Objects.requireNonNull(formatter, "formatter");
        source = source == null ? Optional.empty() : source;
    }

    public static Config defaults() {
        return new Config(FormatterConfig.defaults(), Optional.empty());
    }
}
