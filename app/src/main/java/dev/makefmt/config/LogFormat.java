package dev.makefmt.config;

import java.util.Locale;

/**
 * Supported log output formats.
 */
public enum LogFormat {
    TEXT,
    JSON;

    public static LogFormat from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ConfigException("Log format must be provided");
        }
        try {
            return LogFormat.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new ConfigException("Unsupported log format: " + raw + " (expected text or json)", ex);
        }
    }
}
