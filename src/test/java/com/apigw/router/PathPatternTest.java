package com.apigw.router;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PathPatternTest {

    @Test
    void bindsNamedSegmentsPositionally() {
        PathPattern pattern = PathPattern.compile("/api/users/:userId/orders/:orderId");

        assertThat(pattern.isDynamic()).isTrue();
        assertThat(pattern.getParamNames()).containsExactly("userId", "orderId");
        assertThat(pattern.match("/api/users/7/orders/99"))
                .containsExactly(Map.entry("userId", "7"), Map.entry("orderId", "99"));
    }

    @Test
    void namedSegmentDoesNotSpanSlashes() {
        PathPattern pattern = PathPattern.compile("/api/users/:id");

        assertThat(pattern.match("/api/users/1/2")).isNull();
        assertThat(pattern.match("/api/users")).isNull();
    }

    @Test
    void wildcardMatchesAnyRemainderWithoutCapturing() {
        PathPattern pattern = PathPattern.compile("/api/echo/*");

        assertThat(pattern.match("/api/echo/a/b/c")).isEmpty();
        assertThat(pattern.match("/api/other")).isNull();
    }

    @Test
    void literalCharactersAreNotRegex() {
        PathPattern pattern = PathPattern.compile("/api/v1.0/:id");

        assertThat(pattern.match("/api/v1.0/5")).containsEntry("id", "5");
        assertThat(pattern.match("/api/v1x0/5")).isNull();
    }

    @Test
    void literalPrefixStopsBeforeFirstDynamicSegment() {
        assertThat(PathPattern.compile("/api/echo/*").getLiteralPrefix()).isEqualTo("/api/echo");
        assertThat(PathPattern.compile("/api/users/:id").getLiteralPrefix()).isEqualTo("/api/users");
        assertThat(PathPattern.compile("/*").getLiteralPrefix()).isEmpty();
        assertThat(PathPattern.compile("/api/health").getLiteralPrefix()).isEqualTo("/api/health");
    }
}
