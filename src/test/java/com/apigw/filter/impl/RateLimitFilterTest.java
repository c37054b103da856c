package com.apigw.filter.impl;

import com.apigw.config.GatewayProperties;
import com.apigw.filter.FilterChain;
import com.apigw.model.GatewayResponse;
import com.apigw.model.RequestContext;
import com.apigw.resilience.FixedWindowRateLimiter;
import com.apigw.support.MutableClock;
import com.apigw.support.TestContexts;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class RateLimitFilterTest {

    private final MutableClock clock = MutableClock.startingAt(5_000_000L);
    private final FixedWindowRateLimiter limiter =
            new FixedWindowRateLimiter(2, Duration.ofSeconds(10), clock, null);
    private final AtomicInteger forwarded = new AtomicInteger();

    @AfterEach
    void tearDown() {
        limiter.close();
    }

    private RateLimitFilter filter(String keyHeader, List<String> skipPaths) {
        GatewayProperties properties = new GatewayProperties();
        properties.getRateLimit().setKeyHeader(keyHeader);
        properties.getRateLimit().setSkipPaths(skipPaths);
        return new RateLimitFilter(properties, limiter);
    }

    private FilterChain chain(RateLimitFilter filter) {
        return new FilterChain(List.of(filter), context -> {
            forwarded.incrementAndGet();
            return Mono.just(GatewayResponse.json(200, Map.of("ok", true)));
        });
    }

    @Test
    void allowedRequestsCarryQuotaHeaders() {
        RateLimitFilter filter = filter(null, List.of());
        RequestContext context = TestContexts.get("/api/users");

        StepVerifier.create(chain(filter).filter(context)).expectNextCount(1).verifyComplete();

        assertThat(context.getResponseHeaders().get(RateLimitFilter.HEADER_LIMIT)).isEqualTo("2");
        assertThat(context.getResponseHeaders().get(RateLimitFilter.HEADER_REMAINING)).isEqualTo("1");
        assertThat(context.getResponseHeaders().get(RateLimitFilter.HEADER_RESET)).isEqualTo("5010000");
    }

    @Test
    void rejectsOverQuotaWith429AndRetryAfter() {
        RateLimitFilter filter = filter(null, List.of());
        FilterChain chain = chain(filter);
        chain.filter(TestContexts.get("/a")).block();
        chain.filter(TestContexts.get("/a")).block();
        clock.advanceMillis(2500);

        StepVerifier.create(chain.filter(TestContexts.get("/a")))
                .assertNext(response -> {
                    assertThat(response.getStatusCode()).isEqualTo(429);
                    assertThat(response.getHeaders())
                            .containsEntry("Retry-After", "8")
                            .containsEntry(RateLimitFilter.HEADER_LIMIT, "2")
                            .containsEntry(RateLimitFilter.HEADER_REMAINING, "0")
                            .containsEntry(RateLimitFilter.HEADER_RESET, "5010000");
                    assertThat(response.bodyAsString()).contains("RATE_LIMIT_EXCEEDED");
                })
                .verifyComplete();

        assertThat(forwarded).hasValue(2);
    }

    @Test
    void keysByConfiguredHeaderBeforeClientIp() {
        RateLimitFilter filter = filter("X-API-Key", List.of());
        DefaultHttpHeaders withKey = new DefaultHttpHeaders();
        withKey.set("X-API-Key", "tenant-1");

        assertThat(filter.resolveKey(TestContexts.request("GET", "/a", withKey, "10.0.0.1")))
                .isEqualTo("x-api-key:tenant-1");
        assertThat(filter.resolveKey(TestContexts.request("GET", "/a", new DefaultHttpHeaders(), "10.0.0.1")))
                .isEqualTo("10.0.0.1");
    }

    @Test
    void differentClientsHaveSeparateQuotas() {
        RateLimitFilter filter = filter(null, List.of());
        FilterChain chain = chain(filter);
        for (int i = 0; i < 2; i++) {
            chain.filter(TestContexts.request("GET", "/a", new DefaultHttpHeaders(), "10.0.0.1")).block();
        }

        GatewayResponse other = chain.filter(
                TestContexts.request("GET", "/a", new DefaultHttpHeaders(), "10.0.0.2")).block();

        assertThat(other.getStatusCode()).isEqualTo(200);
    }

    @Test
    void skipPathsBypassCounting() {
        RateLimitFilter filter = filter(null, List.of("/public/**"));
        FilterChain chain = chain(filter);

        for (int i = 0; i < 5; i++) {
            assertThat(chain.filter(TestContexts.get("/public/docs/index")).block().getStatusCode())
                    .isEqualTo(200);
        }
        assertThat(limiter.size()).isZero();
    }
}
