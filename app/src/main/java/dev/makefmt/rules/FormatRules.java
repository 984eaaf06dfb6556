package dev.makefmt.rules;

import dev.makefmt.formatter.FormatRule;
import dev.makefmt.rules.format.AlignAssignments;
import dev.makefmt.rules.format.AssignmentSpacing;
import dev.makefmt.rules.format.BackslashAlign;
import dev.makefmt.rules.format.BannerPreserve;
import dev.makefmt.rules.format.BlankLines;
import dev.makefmt.rules.format.CommentSpacing;
import dev.makefmt.rules.format.ConditionalIndent;
import dev.makefmt.rules.format.FinalNewline;
import dev.makefmt.rules.format.TrailingWhitespace;
import java.util.List;

/**
 * The formatting rules in the order they are applied.
 */
public final class FormatRules {

    private FormatRules() {
    }

    /**
     * Returns a new list of the built-in rules. Whitespace cleanup runs first so later rules see
     * trimmed text, and the banner guard runs last.
     */
    public static List<FormatRule> defaults() {
        return List.of(
                new TrailingWhitespace(),
                new FinalNewline(),
                new BlankLines(),
                new AssignmentSpacing(),
                new AlignAssignments(),
                new BackslashAlign(),
                new CommentSpacing(),
                new ConditionalIndent(),
                new BannerPreserve());
    }
}
