package dev.makefmt.config;

import java.util.Objects;

/**
 * Formatter settings read by the formatting rules.
 *
 * @param indentStyle                 recipe indentation character
 * @param tabWidth                    display width of a tab
 * @param maxBlankLines               maximum consecutive blank lines, negative disables collapsing
 * @param insertFinalNewline          end the file with exactly one newline
 * @param trimTrailingWhitespace      strip trailing spaces and tabs
 * @param alignAssignments            column-align operators of consecutive assignments
 * @param assignmentSpacing           spacing around assignment operators
 * @param alignBackslashContinuations align trailing backslashes of continuation lines
 * @param backslashColumn             1-based backslash column, 0 picks the column automatically
 * @param spaceAfterComment           insert a space after {@code #}
 * @param indentConditionals          indent the bodies of conditional blocks
 * @param conditionalIndent           spaces per conditional nesting level
 */
public record FormatterConfig(
        IndentStyle indentStyle,
        int tabWidth,
        int maxBlankLines,
        boolean insertFinalNewline,
        boolean trimTrailingWhitespace,
        boolean alignAssignments,
        SpacingMode assignmentSpacing,
        boolean alignBackslashContinuations,
        int backslashColumn,
        boolean spaceAfterComment,
        boolean indentConditionals,
        int conditionalIndent
) {

    public FormatterConfig {
        Objects.requireNonNull(indentStyle, "indentStyle");
        Objects.requireNonNull(assignmentSpacing, "assignmentSpacing");
        if (tabWidth < 1) {
            throw new ConfigException("tab_width must be at least 1");
        }
        if (backslashColumn < 0) {
            throw new ConfigException("backslash_column must be zero (auto) or greater");
        }
        if (conditionalIndent < 0) {
            throw new ConfigException("conditional_indent must be zero or greater");
        }
    }

    public static FormatterConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .indentStyle(indentStyle)
                .tabWidth(tabWidth)
                .maxBlankLines(maxBlankLines)
                .insertFinalNewline(insertFinalNewline)
                .trimTrailingWhitespace(trimTrailingWhitespace)
                .alignAssignments(alignAssignments)
                .assignmentSpacing(assignmentSpacing)
                .alignBackslashContinuations(alignBackslashContinuations)
                .backslashColumn(backslashColumn)
                .spaceAfterComment(spaceAfterComment)
                .indentConditionals(indentConditionals)
                .conditionalIndent(conditionalIndent);
    }

    /**
     * Builder pre-populated with the default settings.
     */
    public static final class Builder {

        private IndentStyle indentStyle = IndentStyle.TAB;
        private int tabWidth = 4;
        private int maxBlankLines = 2;
        private boolean insertFinalNewline = true;
        private boolean trimTrailingWhitespace = true;
        private boolean alignAssignments = true;
        private SpacingMode assignmentSpacing = SpacingMode.SPACE;
        private boolean alignBackslashContinuations = true;
        private int backslashColumn = 79;
        private boolean spaceAfterComment = true;
        private boolean indentConditionals = true;
        private int conditionalIndent = 2;

        private Builder() {
        }

        public Builder indentStyle(IndentStyle indentStyle) {
            this.indentStyle = indentStyle;
            return this;
        }

        public Builder tabWidth(int tabWidth) {
            this.tabWidth = tabWidth;
            return this;
        }

        public Builder maxBlankLines(int maxBlankLines) {
            this.maxBlankLines = maxBlankLines;
            return this;
        }

        public Builder insertFinalNewline(boolean insertFinalNewline) {
            this.insertFinalNewline = insertFinalNewline;
            return this;
        }

        public Builder trimTrailingWhitespace(boolean trimTrailingWhitespace) {
            this.trimTrailingWhitespace = trimTrailingWhitespace;
            return this;
        }

        public Builder alignAssignments(boolean alignAssignments) {
            this.alignAssignments = alignAssignments;
            return this;
        }

        public Builder assignmentSpacing(SpacingMode assignmentSpacing) {
            this.assignmentSpacing = assignmentSpacing;
            return this;
        }

        public Builder alignBackslashContinuations(boolean alignBackslashContinuations) {
            this.alignBackslashContinuations = alignBackslashContinuations;
            return this;
        }

        public Builder backslashColumn(int backslashColumn) {
            this.backslashColumn = backslashColumn;
            return this;
        }

        public Builder spaceAfterComment(boolean spaceAfterComment) {
            this.spaceAfterComment = spaceAfterComment;
            return this;
        }

        public Builder indentConditionals(boolean indentConditionals) {
            this.indentConditionals = indentConditionals;
            return this;
        }

        public Builder conditionalIndent(int conditionalIndent) {
            this.conditionalIndent = conditionalIndent;
            return this;
        }

        public FormatterConfig build() {
            return new FormatterConfig(indentStyle, tabWidth, maxBlankLines, insertFinalNewline,
                    trimTrailingWhitespace, alignAssignments, assignmentSpacing, alignBackslashContinuations,
                    backslashColumn, spaceAfterComment, indentConditionals, conditionalIndent);
        }
    }
}
