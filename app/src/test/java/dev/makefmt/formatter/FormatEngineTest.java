package dev.makefmt.formatter;

import static org.assertj.core.api.Assertions.assertThat;

import dev.makefmt.config.FormatterConfig;
import dev.makefmt.parser.Node;
import dev.makefmt.parser.NodeType;
import dev.makefmt.parser.TextFields;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class FormatEngineTest {

    private final FormatEngine engine = new FormatEngine();

    @Test
    void returnsInputWhenNoRulesGiven() {
        List<Node> nodes = List.of(Node.of(NodeType.RAW, "x", new TextFields("x")));

        assertThat(engine.run(nodes, FormatterConfig.defaults(), List.of())).isSameAs(nodes);
    }

    @Test
    void feedsEachRuleTheOutputOfThePreviousOne() {
        List<String> calls = new ArrayList<>();
        AppendingRule first = new AppendingRule("first", calls);
        AppendingRule second = new AppendingRule("second", calls);

        List<Node> result = engine.run(List.of(), FormatterConfig.defaults(), List.of(first, second));

        assertThat(calls).containsExactly("first:0", "second:1");
        assertThat(result).extracting(Node::raw).containsExactly("first", "second");
    }

    private static final class AppendingRule implements FormatRule {

        private final String name;
        private final List<String> calls;

        private AppendingRule(String name, List<String> calls) {
            this.name = name;
            this.calls = calls;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public List<Node> format(List<Node> nodes, FormatterConfig config) {
            calls.add(name + ":" + nodes.size());
            List<Node> result = new ArrayList<>(nodes);
            result.add(Node.of(NodeType.RAW, name, new TextFields(name)));
            return result;
        }
    }
}
