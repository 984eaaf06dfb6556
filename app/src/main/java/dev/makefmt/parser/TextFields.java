package dev.makefmt.parser;

/**
 * Fields of nodes described by a single text value: recipes (text after the leading tab),
 * directives (the trimmed line) and raw nodes.
 */
public record TextFields(String text) implements NodeFields {

    public static final TextFields EMPTY = new TextFields("");

    public TextFields {
        text = text == null ? "" : text;
    }

    public TextFields withText(String text) {
        return new TextFields(text);
    }

    @Override
    public TextFields copy() {
        return new TextFields(text);
    }
}
