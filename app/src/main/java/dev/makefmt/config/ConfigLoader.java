package dev.makefmt.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Builds a {@link Config} from an explicit or discovered YAML file layered over the defaults.
 *
 * <p>Partial files are supported: keys missing from the {@code formatter} section keep their
 * default values.
 */
public class ConfigLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConfigLoader.class);

    static final String ENV_CONFIG = "MAKEFMT_CONFIG";
    static final String ENV_LOG_FORMAT = "MAKEFMT_LOG_FORMAT";

    /** Config file names searched in the working directory, in order. */
    static final List<String> CONFIG_FILE_NAMES = List.of(
            "makefmt.yml",
            "makefmt.yaml",
            ".makefmt.yml",
            ".makefmt.yaml");

    static final String SECTION_FORMATTER = "formatter";

    static final String KEY_INDENT_STYLE = "indent_style";
    static final String KEY_TAB_WIDTH = "tab_width";
    static final String KEY_MAX_BLANK_LINES = "max_blank_lines";
    static final String KEY_INSERT_FINAL_NEWLINE = "insert_final_newline";
    static final String KEY_TRIM_TRAILING_WHITESPACE = "trim_trailing_whitespace";
    static final String KEY_ALIGN_ASSIGNMENTS = "align_assignments";
    static final String KEY_ASSIGNMENT_SPACING = "assignment_spacing";
    static final String KEY_ALIGN_BACKSLASH_CONTINUATIONS = "align_backslash_continuations";
    static final String KEY_BACKSLASH_COLUMN = "backslash_column";
    static final String KEY_SPACE_AFTER_COMMENT = "space_after_comment";
    static final String KEY_INDENT_CONDITIONALS = "indent_conditionals";
    static final String KEY_CONDITIONAL_INDENT = "conditional_indent";

    private static final Set<String> FORMATTER_KEYS = Set.of(
            KEY_INDENT_STYLE, KEY_TAB_WIDTH, KEY_MAX_BLANK_LINES, KEY_INSERT_FINAL_NEWLINE,
            KEY_TRIM_TRAILING_WHITESPACE, KEY_ALIGN_ASSIGNMENTS, KEY_ASSIGNMENT_SPACING,
            KEY_ALIGN_BACKSLASH_CONTINUATIONS, KEY_BACKSLASH_COLUMN, KEY_SPACE_AFTER_COMMENT,
            KEY_INDENT_CONDITIONALS, KEY_CONDITIONAL_INDENT);

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    /**
     * Loads the configuration.
     *
     * @param explicitPath     config file named on the command line, may be {@code null}
     * @param workingDirectory directory searched for a config file when no path is given
     * @throws ConfigException if the selected file cannot be read or parsed
     */
    public Config load(Path explicitPath, Path workingDirectory) {
        Optional<Path> requested = Optional.ofNullable(explicitPath)
                .or(() -> environmentReader.nonBlank(ENV_CONFIG).map(Path::of));
        if (requested.isPresent()) {
            Path path = requested.get();
            if (!path.isAbsolute() && workingDirectory != null) {
                path = workingDirectory.resolve(path);
            }
            return new Config(readFile(path), Optional.of(path));
        }

        Optional<Path> discovered = workingDirectory == null ? Optional.empty() : discover(workingDirectory);
        if (discovered.isEmpty()) {
            LOGGER.debug("No config file found in {}; using defaults", workingDirectory);
            return Config.defaults();
        }
        return new Config(readFile(discovered.get()), discovered);
    }

    /**
     * Returns the first config file present in {@code directory}, following
     * {@link #CONFIG_FILE_NAMES} order.
     */
    public Optional<Path> discover(Path directory) {
        for (String name : CONFIG_FILE_NAMES) {
            Path candidate = directory.resolve(name);
            if (Files.isRegularFile(candidate)) {
                LOGGER.debug("Discovered config file {}", candidate);
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * Resolves the log format: the command-line value wins, then {@code MAKEFMT_LOG_FORMAT},
     * then {@link LogFormat#TEXT}.
     */
    public LogFormat resolveLogFormat(LogFormat cliValue) {
        if (cliValue != null) {
            return cliValue;
        }
        return environmentReader.nonBlank(ENV_LOG_FORMAT)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private FormatterConfig readFile(Path path) {
        String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (NoSuchFileException ex) {
            throw new ConfigException("config file not found: " + path, ex);
        } catch (IOException ex) {
            throw new ConfigException("reading config file " + path + ": " + ex.getMessage(), ex);
        }
        FormatterConfig config = parse(content, path.toString());
        LOGGER.debug("Loaded formatter settings from {}", path);
        return config;
    }

    /**
     * Parses YAML text and overlays its {@code formatter} section on the defaults.
     *
     * @param content YAML document
     * @param origin  name used in error messages
     */
    public FormatterConfig parse(String content, String origin) {
        Object document;
        try {
            document = new Yaml(new SafeConstructor(new LoaderOptions())).load(content);
        } catch (YAMLException ex) {
            throw new ConfigException("parsing config file " + origin + ": " + ex.getMessage(), ex);
        }
        if (document == null) {
            return FormatterConfig.defaults();
        }
        if (!(document instanceof Map<?, ?> root)) {
            throw new ConfigException("parsing config file " + origin + ": top level must be a mapping");
        }

        for (Object key : root.keySet()) {
            if (!SECTION_FORMATTER.equals(key)) {
                LOGGER.debug("Ignoring config section '{}' in {}", key, origin);
            }
        }
        Object section = root.get(SECTION_FORMATTER);
        if (section == null) {
            return FormatterConfig.defaults();
        }
        if (!(section instanceof Map<?, ?> values)) {
            throw new ConfigException("parsing config file " + origin + ": 'formatter' must be a mapping");
        }
        for (Object key : values.keySet()) {
            if (!FORMATTER_KEYS.contains(String.valueOf(key))) {
                LOGGER.debug("Ignoring unknown formatter setting '{}' in {}", key, origin);
            }
        }

        FormatterConfig defaults = FormatterConfig.defaults();
        try {
            return FormatterConfig.builder()
                    .indentStyle(readString(values, KEY_INDENT_STYLE)
                            .map(IndentStyle::from)
                            .orElse(defaults.indentStyle()))
                    .tabWidth(readInt(values, KEY_TAB_WIDTH, defaults.tabWidth()))
                    .maxBlankLines(readInt(values, KEY_MAX_BLANK_LINES, defaults.maxBlankLines()))
                    .insertFinalNewline(readBoolean(values, KEY_INSERT_FINAL_NEWLINE, defaults.insertFinalNewline()))
                    .trimTrailingWhitespace(readBoolean(values, KEY_TRIM_TRAILING_WHITESPACE, defaults.trimTrailingWhitespace()))
                    .alignAssignments(readBoolean(values, KEY_ALIGN_ASSIGNMENTS, defaults.alignAssignments()))
                    .assignmentSpacing(readString(values, KEY_ASSIGNMENT_SPACING)
                            .map(SpacingMode::from)
                            .orElse(defaults.assignmentSpacing()))
                    .alignBackslashContinuations(readBoolean(values, KEY_ALIGN_BACKSLASH_CONTINUATIONS,
                            defaults.alignBackslashContinuations()))
                    .backslashColumn(readInt(values, KEY_BACKSLASH_COLUMN, defaults.backslashColumn()))
                    .spaceAfterComment(readBoolean(values, KEY_SPACE_AFTER_COMMENT, defaults.spaceAfterComment()))
                    .indentConditionals(readBoolean(values, KEY_INDENT_CONDITIONALS, defaults.indentConditionals()))
                    .conditionalIndent(readInt(values, KEY_CONDITIONAL_INDENT, defaults.conditionalIndent()))
                    .build();
        } catch (ConfigException ex) {
            throw new ConfigException("parsing config file " + origin + ": " + ex.getMessage(), ex);
        }
    }

    private static Optional<String> readString(Map<?, ?> values, String key) {
        Object value = values.get(key);
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof String text) {
            return Optional.of(text);
        }
        throw new ConfigException(key + " must be a string but was " + value);
    }

    private static int readInt(Map<?, ?> values, String key, int defaultValue) {
        Object value = values.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Integer number) {
            return number;
        }
        throw new ConfigException(key + " must be an integer but was " + value);
    }

    private static boolean readBoolean(Map<?, ?> values, String key, boolean defaultValue) {
        Object value = values.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean flag) {
            return flag;
        }
        throw new ConfigException(key + " must be true or false but was " + value);
    }
}
