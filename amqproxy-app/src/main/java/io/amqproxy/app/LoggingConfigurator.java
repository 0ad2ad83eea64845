/*
 * Copyright AMQProxy Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.amqproxy.app;

import java.util.Locale;
import java.util.Map;

import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;

/**
 * Applies the configured log level and output format to Logback at startup.
 */
final class LoggingConfigurator {

    private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);

    static final String JOURNAL_STREAM = "JOURNAL_STREAM";
    static final String STDOUT_APPENDER = "STDOUT";
    static final String JOURNAL_APPENDER = "JOURNAL";
    // journald stamps every line itself
    static final String JOURNAL_PATTERN = "%-5level %logger{36} %msg%n";

    private LoggingConfigurator() {
    }

    /**
     * Sets the root level and, when running under systemd, swaps the stdout appender for one
     * without timestamps.
     *
     * @param logLevel one of trace, debug, info, warn, error or off
     * @param env the process environment
     */
    static void configure(String logLevel, Map<String, String> env) {
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (!(factory instanceof LoggerContext context)) {
            LOGGER.warn("Log level {} requested but backend {} does not support dynamic configuration",
                    logLevel, factory.getClass().getName());
            return;
        }
        Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        root.setLevel(toLevel(logLevel));
        if (env.containsKey(JOURNAL_STREAM) && root.getAppender(JOURNAL_APPENDER) == null) {
            root.addAppender(journalAppender(context));
            root.detachAppender(STDOUT_APPENDER);
        }
    }

    static Level toLevel(String logLevel) {
        return Level.toLevel(logLevel.toUpperCase(Locale.ROOT), Level.INFO);
    }

    private static ConsoleAppender<ILoggingEvent> journalAppender(LoggerContext context) {
        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(JOURNAL_PATTERN);
        encoder.start();

        ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setContext(context);
        appender.setName(JOURNAL_APPENDER);
        appender.setEncoder(encoder);
        appender.start();
        return appender;
    }
}
