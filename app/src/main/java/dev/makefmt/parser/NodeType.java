package dev.makefmt.parser;

/**
 * Classification of a parsed Makefile line.
 */
public enum NodeType {
    /** A line starting with {@code #}. */
    COMMENT,
    /** A {@code ##@ Section Name} line. */
    SECTION_HEADER,
    /** A decorative separator such as {@code ###...}, {@code # ===...} or {@code ## box ##}. */
    BANNER_COMMENT,
    /** An empty or whitespace-only line. */
    BLANK_LINE,
    /** A variable assignment ({@code VAR = value}, {@code VAR := value}, ...). */
    ASSIGNMENT,
    /** A target definition ({@code target: prerequisites}). */
    RULE,
    /** A tab-led recipe line owned by a rule. */
    RECIPE,
    /** A conditional directive ({@code ifeq}, {@code ifdef}, {@code else}, {@code endif}, ...). */
    CONDITIONAL,
    /** An include directive ({@code include}, {@code -include}, {@code sinclude}). */
    INCLUDE,
    /** A special directive ({@code .PHONY}, {@code export}, {@code override}, ...). */
    DIRECTIVE,
    /** Anything else, preserved verbatim (including define/endef blocks). */
    RAW;

    public boolean isCommentLike() {
        return this == COMMENT || this == SECTION_HEADER || this == BANNER_COMMENT;
    }
}
