package dev.makefmt.parser;

import java.util.List;

/**
 * Fields of a conditional directive line.
 */
public record ConditionalFields(String directive, String condition) implements NodeFields {

    public static final List<String> KEYWORDS = List.of("ifeq", "ifneq", "ifdef", "ifndef", "else", "endif");

    public ConditionalFields {
        directive = directive == null ? "" : directive;
        condition = condition == null ? "" : condition;
    }

    /**
     * Returns whether this directive opens a new conditional block.
     */
    public boolean opensBlock() {
        return switch (directive) {
            case "ifeq", "ifneq", "ifdef", "ifndef" -> true;
            default -> false;
        };
    }

    public boolean isElse() {
        return "else".equals(directive);
    }

    public boolean isEndif() {
        return "endif".equals(directive);
    }

    public ConditionalFields withCondition(String condition) {
        return new ConditionalFields(directive, condition);
    }

    @Override
    public ConditionalFields copy() {
        return new ConditionalFields(directive, condition);
    }
}
