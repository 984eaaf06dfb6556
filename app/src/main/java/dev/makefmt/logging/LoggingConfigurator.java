package dev.makefmt.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.OutputStreamAppender;
import ch.qos.logback.core.encoder.Encoder;
import ch.qos.logback.core.encoder.LayoutWrappingEncoder;
import dev.makefmt.config.LogFormat;
import org.slf4j.LoggerFactory;

/**
 * Adjusts the logback setup from {@code logback.xml} to the command-line options: encoder format
 * of the stderr appender and the level of the application loggers.
 */
public final class LoggingConfigurator {

    static final String APPLICATION_LOGGER = "dev.makefmt";

    private static final String TEXT_PATTERN = "%d{yyyy-MM-dd HH:mm:ss.SSS} %-5level [%thread] %logger{36} - %msg%n";

    private LoggingConfigurator() {
    }

    /**
     * @param format  encoder format for every stream appender of the root logger
     * @param verbose log {@code dev.makefmt} at DEBUG; otherwise it inherits the root level
     */
    public static void configure(LogFormat format, boolean verbose) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        for (var iterator = root.iteratorForAppenders(); iterator.hasNext(); ) {
            Appender<ILoggingEvent> appender = iterator.next();
            if (appender instanceof OutputStreamAppender<ILoggingEvent> streamAppender) {
                restartAppender(streamAppender, encoderFor(format, context));
            }
        }
        context.getLogger(APPLICATION_LOGGER).setLevel(verbose ? Level.DEBUG : null);
    }

    private static Encoder<ILoggingEvent> encoderFor(LogFormat format, LoggerContext context) {
        return switch (format) {
            case JSON -> {
                LayoutWrappingEncoder<ILoggingEvent> encoder = new LayoutWrappingEncoder<>();
                encoder.setContext(context);
                SimpleJsonLayout layout = new SimpleJsonLayout();
                layout.setContext(context);
                layout.start();
                encoder.setLayout(layout);
                encoder.start();
                yield encoder;
            }
            case TEXT -> {
                PatternLayoutEncoder encoder = new PatternLayoutEncoder();
                encoder.setContext(context);
                encoder.setPattern(TEXT_PATTERN);
                encoder.start();
                yield encoder;
            }
        };
    }

    private static void restartAppender(OutputStreamAppender<ILoggingEvent> appender, Encoder<ILoggingEvent> encoder) {
        boolean running = appender.isStarted();
        if (running) {
            appender.stop();
        }
        appender.setEncoder(encoder);
        if (running) {
            appender.start();
        }
    }
}
