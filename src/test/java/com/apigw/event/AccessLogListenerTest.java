package com.apigw.event;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AccessLogListenerTest {

    private final Logger accessLogger = (Logger) LoggerFactory.getLogger("ACCESS_LOG");
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();
    private final AccessLogListener listener = new AccessLogListener(List.of("/health"));

    @BeforeEach
    void setUp() {
        appender.start();
        accessLogger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        accessLogger.detachAppender(appender);
    }

    private static RequestCompletedEvent event(String path, int status) {
        return RequestCompletedEvent.builder()
                .requestId("req-1")
                .method("GET")
                .path(path)
                .status(status)
                .duration(Duration.ofMillis(12))
                .clientIp("10.0.0.1")
                .route("/api/*")
                .requestHeaders(Map.of("Authorization", "Bearer secret", "Accept", "*/*"))
                .build();
    }

    @Test
    void levelFollowsStatusClass() {
        listener.onRequestCompleted(event("/api/a", 200));
        listener.onRequestCompleted(event("/api/a", 404));
        listener.onRequestCompleted(event("/api/a", 502));
        listener.onRequestCompleted(event("/api/a", 0));

        assertThat(appender.list).extracting(ILoggingEvent::getLevel)
                .containsExactly(Level.INFO, Level.WARN, Level.ERROR, Level.ERROR);
    }

    @Test
    void excludedPathsAreNotLogged() {
        listener.onRequestCompleted(event("/health", 200));

        assertThat(appender.list).isEmpty();
    }

    @Test
    void lineContainsRequestFactsWithoutSecrets() {
        String line = listener.format(event("/api/a", 200));

        assertThat(line).contains("[req-1] GET /api/a 200 12ms", "ip=10.0.0.1", "route=/api/*", "instance=-");
        assertThat(line).doesNotContain("secret");
        assertThat(line).contains("Authorization=" + AccessLogListener.MASK);
    }

    @Test
    void sanitizeMasksSensitiveHeadersCaseInsensitively() {
        Map<String, String> sanitized = AccessLogListener.sanitize(Map.of(
                "cookie", "session=1", "X-API-KEY", "k", "Accept", "text/plain"));

        assertThat(sanitized.get("Cookie")).isEqualTo(AccessLogListener.MASK);
        assertThat(sanitized.get("x-api-key")).isEqualTo(AccessLogListener.MASK);
        assertThat(sanitized.get("accept")).isEqualTo("text/plain");
        assertThat(AccessLogListener.sanitize(null)).isEmpty();
    }
}
