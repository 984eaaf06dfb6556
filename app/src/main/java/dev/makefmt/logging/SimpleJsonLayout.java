package dev.makefmt.logging;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.core.CoreConstants;
import ch.qos.logback.core.LayoutBase;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import org.slf4j.event.KeyValuePair;

/**
 * One JSON object per log event, for machine-read stderr when {@code --log-format json} is used.
 *
 * <p>Fields: {@code ts}, {@code level}, {@code logger}, {@code msg}, then {@code error} when the
 * event carries a throwable and one field per SLF4J key/value pair.
 */
public class SimpleJsonLayout extends LayoutBase<ILoggingEvent> {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ISO_OFFSET_DATE_TIME;

    @Override
    public String doLayout(ILoggingEvent event) {
        JsonLine line = new JsonLine();
        line.field("ts", TIMESTAMP.format(Instant.ofEpochMilli(event.getTimeStamp()).atOffset(ZoneOffset.UTC)));
        line.field("level", event.getLevel().toString());
        line.field("logger", event.getLoggerName());
        line.field("msg", event.getFormattedMessage());

        IThrowableProxy throwable = event.getThrowableProxy();
        if (throwable != null) {
            line.field("error", throwable.getClassName() + ": " + throwable.getMessage());
        }
        List<KeyValuePair> pairs = event.getKeyValuePairs();
        if (pairs != null) {
            for (KeyValuePair pair : pairs) {
                line.field(pair.key, pair.value == null ? null : String.valueOf(pair.value));
            }
        }
        return line.close();
    }

    private static final class JsonLine {

        private final StringBuilder builder = new StringBuilder(192).append('{');
        private boolean first = true;

        private void field(String name, String value) {
            if (!first) {
                builder.append(',');
            }
            first = false;
            appendString(name);
            builder.append(':');
            if (value == null) {
                builder.append("null");
            } else {
                appendString(value);
            }
        }

        private String close() {
            return builder.append('}').append(CoreConstants.LINE_SEPARATOR).toString();
        }

        private void appendString(String value) {
            builder.append('"');
            for (int i = 0; i < value.length(); i++) {
                char ch = value.charAt(i);
                switch (ch) {
                    case '"' -> builder.append("\\\"");
                    case '\\' -> builder.append("\\\\");
                    case '\n' -> builder.append("\\n");
                    case '\r' -> builder.append("\\r");
                    case '\t' -> builder.append("\\t");
                    default -> {
                        if (ch < 0x20) {
                            builder.append(String.format("\\u%04x", (int) ch));
                        } else {
                            builder.append(ch);
                        }
                    }
                }
            }
            builder.append('"');
        }
    }
}
