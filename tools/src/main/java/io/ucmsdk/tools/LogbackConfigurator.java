package io.ucmsdk.tools;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.encoder.Encoder;
import org.slf4j.LoggerFactory;

/**
 * Points all logging of a CLI run at {@code stderr}, leaving {@code stdout}
 * to command output.
 *
 * <p>
 * {@code logging.level} applies to the SDK's own {@code io.ucmsdk} loggers.
 * Libraries stay at {@code WARN} unless the level asks for less, so that
 * {@code DEBUG} shows the call pipeline without Jackson or schema-validator
 * chatter.
 */
final class LogbackConfigurator {

    static final String APPENDER_NAME = "STDERR";
    static final String SDK_LOGGER = "io.ucmsdk";
    static final String TEXT_PATTERN = "%d{HH:mm:ss.SSS} %-5level %logger{36} - %msg%n";

    private LogbackConfigurator() {}

    /**
     * @param format {@code json} or {@code text}
     * @param level  level name for the SDK loggers; unknown names mean
     *               {@code INFO}
     */
    static void configure(String format, String level) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Level sdkLevel = Level.toLevel(level, Level.INFO);

        ConsoleAppender<ILoggingEvent> stderr = new ConsoleAppender<>();
        stderr.setContext(context);
        stderr.setName(APPENDER_NAME);
        stderr.setTarget("System.err");
        stderr.setEncoder(encoder(context, format));
        stderr.start();

        Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        root.detachAndStopAllAppenders();
        root.addAppender(stderr);
        root.setLevel(sdkLevel.isGreaterOrEqual(Level.WARN) ? sdkLevel : Level.WARN);
        context.getLogger(SDK_LOGGER).setLevel(sdkLevel);
    }

    private static Encoder<ILoggingEvent> encoder(LoggerContext context, String format) {
        if ("json".equalsIgnoreCase(format)) {
            JsonEncoder json = new JsonEncoder();
            json.setContext(context);
            json.start();
            return json;
        }
        PatternLayoutEncoder text = new PatternLayoutEncoder();
        text.setContext(context);
        text.setPattern(TEXT_PATTERN);
        text.start();
        return text;
    }
}
