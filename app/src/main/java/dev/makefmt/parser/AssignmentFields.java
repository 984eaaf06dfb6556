package dev.makefmt.parser;

import java.util.List;

/**
 * Fields of a variable assignment.
 *
 * @param name     the variable name; {@code override NAME} is kept as one compound name
 * @param operator one of {@link #OPERATORS}
 * @param value    the trimmed right-hand side, possibly empty
 */
public record AssignmentFields(String name, String operator, String value) implements NodeFields {

    /** Assignment operators, longest first so that {@code ::=} wins over {@code :=}. */
    public static final List<String> OPERATORS = List.of("::=", "!=", "?=", "+=", ":=", "=");

    public AssignmentFields {
        name = name == null ? "" : name;
        operator = operator == null ? "" : operator;
        value = value == null ? "" : value;
    }

    public AssignmentFields withName(String name) {
        return new AssignmentFields(name, operator, value);
    }

    public AssignmentFields withValue(String value) {
        return new AssignmentFields(name, operator, value);
    }

    @Override
    public AssignmentFields copy() {
        return new AssignmentFields(name, operator, value);
    }
}
