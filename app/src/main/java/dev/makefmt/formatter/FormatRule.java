package dev.makefmt.formatter;

import dev.makefmt.config.FormatterConfig;
import dev.makefmt.parser.Node;
import java.util.List;

/**
 * A single formatting policy applied to the whole node list.
 *
 * <p>Implementations must not modify their input. Nodes a rule leaves alone are returned as the
 * same instances so that later rules can tell untouched nodes apart from rewritten ones.
 */
public interface FormatRule {

    /**
     * Returns the configuration key of this rule, e.g. {@code trim_trailing_whitespace}.
     */
    String name();

    List<Node> format(List<Node> nodes, FormatterConfig config);
}
