package dev.makefmt.config;

import java.util.Locale;

/**
 * Indentation character used for recipe lines.
 */
public enum IndentStyle {
    TAB,
    SPACE;

    public static IndentStyle from(String raw) {
        if (raw == null || raw.isBlank()) {
            return TAB;
        }
        try {
            return IndentStyle.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new ConfigException("Unsupported indent_style: " + raw, ex);
        }
    }
}
