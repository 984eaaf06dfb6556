package dev.makefmt.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Fields of a target definition.
 *
 * @param targets       the targets before the colon; pattern targets such as {@code %} are allowed
 * @param prerequisites normal prerequisites
 * @param orderOnly     prerequisites after {@code |}
 * @param inlineHelp    the trailing {@code ## description} text, trimmed
 */
public record RuleFields(List<String> targets,
                         List<String> prerequisites,
                         List<String> orderOnly,
                         String inlineHelp) implements NodeFields {

    public RuleFields {
        targets = targets == null ? List.of() : List.copyOf(targets);
        prerequisites = prerequisites == null ? List.of() : List.copyOf(prerequisites);
        orderOnly = orderOnly == null ? List.of() : List.copyOf(orderOnly);
        inlineHelp = inlineHelp == null ? "" : inlineHelp;
    }

    public RuleFields withInlineHelp(String inlineHelp) {
        return new RuleFields(targets, prerequisites, orderOnly, inlineHelp);
    }

    @Override
    public RuleFields copy() {
        return new RuleFields(new ArrayList<>(targets), new ArrayList<>(prerequisites),
                new ArrayList<>(orderOnly), inlineHelp);
    }
}
