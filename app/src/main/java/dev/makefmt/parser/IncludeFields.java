package dev.makefmt.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Fields of an include directive.
 *
 * @param kind  {@code include}, {@code -include} or {@code sinclude}
 * @param paths whitespace-separated include paths
 */
public record IncludeFields(String kind, List<String> paths) implements NodeFields {

    public static final List<String> KEYWORDS = List.of("include", "-include", "sinclude");

    public IncludeFields {
        kind = kind == null ? "" : kind;
        paths = paths == null ? List.of() : List.copyOf(paths);
    }

    @Override
    public IncludeFields copy() {
        return new IncludeFields(kind, new ArrayList<>(paths));
    }
}
