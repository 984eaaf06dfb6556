package dev.makefmt.config;

/**
 * Spacing policy around assignment operators.
 */
public enum SpacingMode {
    /** {@code VAR := value}. */
    SPACE("space"),
    /** {@code VAR:=value}. */
    NO_SPACE("no_space"),
    /** Leave the original spacing alone. */
    PRESERVE("preserve");

    private final String key;

    SpacingMode(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static SpacingMode from(String raw) {
        if (raw == null || raw.isBlank()) {
            return SPACE;
        }
        String normalized = raw.trim();
        for (SpacingMode spacing : values()) {
            if (spacing.key.equalsIgnoreCase(normalized) || spacing.name().equalsIgnoreCase(normalized)) {
                return spacing;
            }
        }
        throw new ConfigException("Unsupported assignment_spacing: " + raw + " (expected space, no_space or preserve)");
    }
}
