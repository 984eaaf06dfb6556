package dev.makefmt.config;

import java.util.Optional;

/**
 * Looks up environment values; tests substitute a map-backed lambda.
 */
@FunctionalInterface
public interface EnvironmentReader {

    Optional<String> get(String key);

    /**
     * Returns the trimmed value of {@code key}, treating blank values as absent.
     */
    default Optional<String> nonBlank(String key) {
        return get(key)
                .map(String::trim)
                .filter(value -> !value.isEmpty());
    }

    /**
     * Reader backed by the process environment.
     */
    static EnvironmentReader system() {
        return key -> Optional.ofNullable(System.getenv(key));
    }
}
