package dev.makefmt.formatter;

import dev.makefmt.config.FormatterConfig;
import dev.makefmt.parser.Node;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies formatting rules in order, feeding each rule's output to the next one.
 */
public class FormatEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(FormatEngine.class);

    public List<Node> run(List<Node> nodes, FormatterConfig config, List<? extends FormatRule> rules) {
        Objects.requireNonNull(nodes, "nodes");
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(rules, "rules");
        List<Node> result = nodes;
        for (FormatRule rule : rules) {
            List<Node> next = rule.format(result, config);
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("Rule {} {} ({} -> {} nodes)", rule.name(),
                        next == result ? "left nodes unchanged" : "produced new nodes", result.size(), next.size());
            }
            result = next;
        }
        return result;
    }
}
