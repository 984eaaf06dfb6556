package dev.makefmt.formatter;

import dev.makefmt.config.FormatterConfig;
import dev.makefmt.parser.MakefileParser;
import dev.makefmt.parser.Node;
import java.util.List;
import java.util.Objects;

/**
 * Parses, formats and writes Makefile text with a fixed rule list and configuration.
 */
public class MakefileFormatter {

    private static final String CRLF = "\r\n";

    private final MakefileParser parser;
    private final FormatEngine engine;
    private final MakefileWriter writer;
    private final List<FormatRule> rules;
    private final FormatterConfig config;

    public MakefileFormatter(FormatterConfig config, List<? extends FormatRule> rules) {
        this(new MakefileParser(), new FormatEngine(), new MakefileWriter(), config, rules);
    }

    public MakefileFormatter(MakefileParser parser, FormatEngine engine, MakefileWriter writer,
                             FormatterConfig config, List<? extends FormatRule> rules) {
        this.parser = Objects.requireNonNull(parser, "parser");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.writer = Objects.requireNonNull(writer, "writer");
        this.config = Objects.requireNonNull(config, "config");
        this.rules = List.copyOf(rules);
    }

    /**
     * Formats {@code source}. Input containing {@code \r\n} is formatted with {@code \n} line
     * endings and every line of the result is then ended with {@code \r\n}.
     */
    public String format(String source) {
        boolean crlf = source.contains(CRLF);
        List<Node> nodes = parser.parse(crlf ? source.replace(CRLF, "\n") : source);
        List<Node> formatted = engine.run(nodes, config, rules);
        String written = writer.write(formatted);
        return crlf ? written.replace("\n", CRLF) : written;
    }

    public FormatterConfig config() {
        return config;
    }

    public List<FormatRule> rules() {
        return rules;
    }
}
