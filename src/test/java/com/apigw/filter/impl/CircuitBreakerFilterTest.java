package com.apigw.filter.impl;

import com.apigw.config.GatewayProperties;
import com.apigw.exception.CircuitOpenException;
import com.apigw.exception.ErrorCode;
import com.apigw.exception.GatewayException;
import com.apigw.exception.ProxyException;
import com.apigw.filter.FilterChain;
import com.apigw.model.GatewayResponse;
import com.apigw.model.RequestContext;
import com.apigw.model.RouteConfig;
import com.apigw.resilience.CircuitState;
import com.apigw.router.Router;
import com.apigw.support.MutableClock;
import com.apigw.support.TestContexts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;

class CircuitBreakerFilterTest {

    private final MutableClock clock = MutableClock.startingAt(0L);
    private final Router router = new Router();
    private final GatewayProperties properties = new GatewayProperties();
    private final AtomicInteger backendCalls = new AtomicInteger();

    @BeforeEach
    void setUp() {
        properties.getCircuitBreaker().setThreshold(2);
        properties.getCircuitBreaker().setTimeoutMs(5000);
        router.addRoute("/orders/*", RouteConfig.builder().target("http://orders").build());
        router.addRoute("/users/*", RouteConfig.builder().target("http://users").build());
    }

    private FilterChain chain(CircuitBreakerFilter filter, Function<RequestContext, Mono<GatewayResponse>> backend) {
        return new FilterChain(List.of(filter), context -> {
            backendCalls.incrementAndGet();
            return backend.apply(context);
        });
    }

    private static Mono<GatewayResponse> failing(RequestContext context) {
        return Mono.error(ProxyException.badGateway(new IOException("reset")));
    }

    @Test
    void opensAfterThresholdAndRejectsWithoutCallingBackend() {
        CircuitBreakerFilter filter = new CircuitBreakerFilter(properties, router, clock);
        FilterChain chain = chain(filter, CircuitBreakerFilterTest::failing);

        for (int i = 0; i < 2; i++) {
            StepVerifier.create(chain.filter(TestContexts.get("/orders/1")))
                    .expectError(ProxyException.class)
                    .verify();
        }

        StepVerifier.create(chain.filter(TestContexts.get("/orders/1")))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(CircuitOpenException.class);
                    assertThat(((CircuitOpenException) e).getRetryAfter()).isEqualTo(Duration.ofSeconds(5));
                })
                .verify();

        assertThat(backendCalls).hasValue(2);
        assertThat(filter.getStats(CircuitBreakerFilter.GLOBAL_CIRCUIT).getState()).isEqualTo(CircuitState.OPEN);
    }

    @Test
    void serverErrorStatusCountsAsFailure() {
        CircuitBreakerFilter filter = new CircuitBreakerFilter(properties, router, clock);
        FilterChain streamed = chain(filter, context -> {
            context.setResponseStatus(503);
            return Mono.empty();
        });

        streamed.filter(TestContexts.get("/orders/1")).block();
        streamed.filter(TestContexts.get("/orders/1")).block();

        assertThat(filter.getStats(CircuitBreakerFilter.GLOBAL_CIRCUIT).getState()).isEqualTo(CircuitState.OPEN);
    }

    @Test
    void clientErrorsDoNotTripTheBreaker() {
        CircuitBreakerFilter filter = new CircuitBreakerFilter(properties, router, clock);
        FilterChain chain = chain(filter,
                context -> Mono.just(GatewayResponse.unauthorized("no", context.getRequestId())));

        for (int i = 0; i < 5; i++) {
            chain.filter(TestContexts.get("/orders/1")).block();
        }

        assertThat(filter.getStats(CircuitBreakerFilter.GLOBAL_CIRCUIT).getState()).isEqualTo(CircuitState.CLOSED);
        assertThat(backendCalls).hasValue(5);
    }

    @Test
    void routeScopeIsolatesCircuits() {
        properties.getCircuitBreaker().setScope(GatewayProperties.CircuitBreakerScope.ROUTE);
        CircuitBreakerFilter filter = new CircuitBreakerFilter(properties, router, clock);
        FilterChain chain = chain(filter, context -> context.getPath().startsWith("/orders")
                ? failing(context)
                : Mono.just(GatewayResponse.json(200, "ok")));

        for (int i = 0; i < 2; i++) {
            chain.filter(TestContexts.get("/orders/1")).onErrorResume(e -> Mono.empty()).block();
        }

        assertThat(filter.getStats("/orders/*").getState()).isEqualTo(CircuitState.OPEN);
        assertThat(chain.filter(TestContexts.get("/users/1")).block().getStatusCode()).isEqualTo(200);
        assertThat(filter.getStats("/users/*").getState()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    void halfOpenProbeSuccessesCloseCircuit() {
        CircuitBreakerFilter filter = new CircuitBreakerFilter(properties, router, clock);
        AtomicInteger attempt = new AtomicInteger();
        FilterChain chain = chain(filter, context -> attempt.incrementAndGet() <= 2
                ? failing(context)
                : Mono.just(GatewayResponse.json(200, "ok")));
        for (int i = 0; i < 2; i++) {
            chain.filter(TestContexts.get("/orders/1")).onErrorResume(e -> Mono.empty()).block();
        }

        clock.advanceMillis(5000);
        chain.filter(TestContexts.get("/orders/1")).block();

        assertThat(filter.getStats(CircuitBreakerFilter.GLOBAL_CIRCUIT).getState()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    void unmatchedRoutesPassThroughInRouteScope() {
        properties.getCircuitBreaker().setScope(GatewayProperties.CircuitBreakerScope.ROUTE);
        CircuitBreakerFilter filter = new CircuitBreakerFilter(properties, router, clock);
        FilterChain chain = chain(filter, context -> Mono.just(GatewayResponse.notFound("none", null)));

        chain.filter(TestContexts.get("/missing")).block();

        assertThat(filter.getAllStats()).isEmpty();
    }

    @Test
    void classifiesFailures() {
        assertThat(CircuitBreakerFilter.isFailure(new CircuitOpenException("global", Duration.ZERO))).isFalse();
        assertThat(CircuitBreakerFilter.isFailure(new GatewayException(ErrorCode.UNAUTHORIZED))).isFalse();
        assertThat(CircuitBreakerFilter.isFailure(new GatewayException(ErrorCode.SERVICE_UNAVAILABLE))).isTrue();
        assertThat(CircuitBreakerFilter.isFailure(new IllegalStateException())).isTrue();
    }

    @Test
    void resetClosesCircuit() {
        CircuitBreakerFilter filter = new CircuitBreakerFilter(properties, router, clock);
        filter.getOrCreate(CircuitBreakerFilter.GLOBAL_CIRCUIT).open();

        filter.reset(CircuitBreakerFilter.GLOBAL_CIRCUIT);

        assertThat(filter.getStats(CircuitBreakerFilter.GLOBAL_CIRCUIT).getState()).isEqualTo(CircuitState.CLOSED);
    }
}
