package dev.makefmt.rules.format;

import dev.makefmt.config.FormatterConfig;
import dev.makefmt.formatter.FormatRule;
import dev.makefmt.formatter.MakefileWriter;
import dev.makefmt.parser.MakefileParser;
import dev.makefmt.parser.Node;
import java.util.List;

/**
 * Runs a single rule over parsed text and writes the result back.
 */
final class RuleFixture {

    private RuleFixture() {
    }

    static List<Node> parse(String source) {
        return new MakefileParser().parse(source);
    }

    static String apply(FormatRule rule, String source) {
        return apply(rule, source, FormatterConfig.defaults());
    }

    static String apply(FormatRule rule, String source, FormatterConfig config) {
        return new MakefileWriter().write(rule.format(parse(source), config));
    }
}
