package dev.uimigrator.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.OutputStreamAppender;
import ch.qos.logback.core.encoder.LayoutWrappingEncoder;
import dev.uimigrator.config.LogFormat;
import java.io.ByteArrayOutputStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LoggingConfiguratorTest {

    private LoggerContext context;
    private OutputStreamAppender<ILoggingEvent> appender;

    @BeforeEach
    void setUp() {
        context = new LoggerContext();
        context.start();
        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern("%msg%n");
        encoder.start();
        appender = new OutputStreamAppender<>();
        appender.setContext(context);
        appender.setEncoder(encoder);
        appender.setOutputStream(new ByteArrayOutputStream());
        appender.start();
        context.getLogger(Logger.ROOT_LOGGER_NAME).addAppender(appender);
    }

    @Test
    void jsonFormatWrapsJsonLayout() {
        LoggingConfigurator.configure(context, LogFormat.JSON, false);

        assertThat(appender.getEncoder()).isInstanceOf(LayoutWrappingEncoder.class);
        assertThat(((LayoutWrappingEncoder<ILoggingEvent>) appender.getEncoder()).getLayout()).isInstanceOf(JsonLogLayout.class);
        assertThat(appender.isStarted()).isTrue();
    }

    @Test
    void textFormatUsesPatternWithMdcKeys() {
        LoggingConfigurator.configure(context, LogFormat.TEXT, false);

        assertThat(appender.getEncoder()).isInstanceOf(PatternLayoutEncoder.class);
        assertThat(((PatternLayoutEncoder) appender.getEncoder()).getPattern())
                .contains("%X{document}")
                .contains("%X{stage}");
    }

    @Test
    void verboseSetsApplicationLoggerToDebug() {
        LoggingConfigurator.configure(context, LogFormat.TEXT, true);

        assertThat(context.getLogger(LoggingConfigurator.APPLICATION_LOGGER).getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    void quietRunLeavesLevelsFromConfiguration() {
        LoggingConfigurator.configure(context, LogFormat.TEXT, false);

        assertThat(context.getLogger(LoggingConfigurator.APPLICATION_LOGGER).getLevel()).isNull();
    }
}
