package ai.sourcebridge.translator.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.LoggingEvent;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SimpleJsonLayoutTest {

    private static LoggingEvent event(LoggerContext context, String message) {
        LoggingEvent event = new LoggingEvent();
        event.setLevel(Level.INFO);
        event.setLoggerName("test.logger");
        event.setMessage(message);
        event.setThreadName("main");
        event.setTimeStamp(0L);
        event.setLoggerContext(context);
        return event;
    }

    private static SimpleJsonLayout startedLayout(LoggerContext context) {
        SimpleJsonLayout layout = new SimpleJsonLayout();
        layout.setContext(context);
        layout.start();
        return layout;
    }

    @Test
    void formatsEventAsJson() {
        LoggerContext context = new LoggerContext();
        context.start();

        String json = startedLayout(context).doLayout(event(context, "hello world"));

        assertThat(json).startsWith("{\"timestamp\":\"1970-01-01T00:00:00Z\"");
        assertThat(json).contains("\"message\":\"hello world\"");
        assertThat(json).contains("\"logger\":\"test.logger\"");
        assertThat(json).contains("\"level\":\"INFO\"");
        assertThat(json).doesNotContain("\"mdc\"");
        assertThat(json).endsWith(System.lineSeparator());
    }

    @Test
    void writesLanguagesFromMdcInKeyOrder() {
        LoggerContext context = new LoggerContext();
        context.start();
        LoggingEvent event = event(context, "Translating main.cpp");
        event.setMDCPropertyMap(Map.of("targetLanguage", "Python", "sourceLanguage", "C++"));

        String json = startedLayout(context).doLayout(event);

        assertThat(json).contains("\"mdc\":{\"sourceLanguage\":\"C++\",\"targetLanguage\":\"Python\"}");
    }

    @Test
    void escapesQuotesAndLineBreaks() {
        assertThat(SimpleJsonLayout.quote("print(\"a\")\n\tb\\")).isEqualTo("\"print(\\\"a\\\")\\n\\tb\\\\\"");
        assertThat(SimpleJsonLayout.quote("\u0001")).isEqualTo("\"\\u0001\"");
        assertThat(SimpleJsonLayout.quote(null)).isEqualTo("null");
    }
}
