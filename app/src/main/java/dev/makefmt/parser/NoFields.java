package dev.makefmt.parser;

/**
 * Fields of nodes that carry no attributes beyond their raw text (blank lines).
 */
public record NoFields() implements NodeFields {

    public static final NoFields INSTANCE = new NoFields();

    @Override
    public NoFields copy() {
        return INSTANCE;
    }
}
