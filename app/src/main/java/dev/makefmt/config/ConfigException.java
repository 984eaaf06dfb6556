package dev.makefmt.config;

/**
 * Runtime exception raised when configuration cannot be located, read or interpreted.
 */
public class ConfigException extends RuntimeException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
