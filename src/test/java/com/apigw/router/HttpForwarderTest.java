package com.apigw.router;

import com.apigw.config.GatewayProperties;
import com.apigw.discovery.LoadBalancer;
import com.apigw.discovery.LoadBalancingAlgorithm;
import com.apigw.exception.ErrorCode;
import com.apigw.exception.GatewayException;
import com.apigw.model.RequestContext;
import com.apigw.model.RouteConfig;
import com.apigw.model.RouteDefinition;
import com.apigw.support.TestContexts;
import io.netty.channel.ConnectTimeoutException;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.timeout.ReadTimeoutException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

class HttpForwarderTest {

    private final Router router = new Router();
    private final LoadBalancer loadBalancer = new LoadBalancer(LoadBalancingAlgorithm.ROUND_ROBIN);
    private final HttpForwarder forwarder = new HttpForwarder(new GatewayProperties.HandlerProperties(), loadBalancer);

    @AfterEach
    void tearDown() {
        forwarder.close();
    }

    private static String target(String base, RouteDefinition route, String uri) {
        return HttpForwarder.buildTargetUrl(base, route, TestContexts.get(uri));
    }

    @Test
    void rebasesRemainderOfPathOntoTarget() {
        RouteDefinition route = router.addRoute("/api/users/:id",
                RouteConfig.builder().target("http://users:3001/users").build());

        assertThat(target(route.getTarget(), route, "/api/users/42?x=1&y=2"))
                .isEqualTo("http://users:3001/users/42?x=1&y=2");
    }

    @Test
    void wildcardRouteKeepsNestedSegments() {
        RouteDefinition route = router.addRoute("/api/files/*",
                RouteConfig.builder().target("http://files/").build());

        assertThat(target("http://files/", route, "/api/files/a/b/c.txt")).isEqualTo("http://files/a/b/c.txt");
    }

    @Test
    void exactRouteForwardsToTargetRoot() {
        RouteDefinition exact = router.addRoute("/status", RouteConfig.builder().target("http://svc").build());
        RouteDefinition withPath = router.addRoute("/v1/status",
                RouteConfig.builder().target("http://svc/internal/status").build());

        assertThat(target("http://svc", exact, "/status")).isEqualTo("http://svc/");
        assertThat(target("http://svc/internal/status", withPath, "/v1/status"))
                .isEqualTo("http://svc/internal/status");
    }

    @Test
    void forwardHeadersDropHopByHopAndAddForwardingInfo() {
        HttpHeaders inbound = new DefaultHttpHeaders();
        inbound.set("Host", "gateway.example.com");
        inbound.set("Connection", "keep-alive");
        inbound.set("Keep-Alive", "timeout=5");
        inbound.set("Transfer-Encoding", "chunked");
        inbound.set("X-Forwarded-For", "203.0.113.7");
        inbound.set("Accept", "application/json");
        RequestContext context = TestContexts.request("GET", "/api/users/1", inbound, "198.51.100.2");

        HttpHeaders headers = forwarder.buildForwardHeaders(context, URI.create("http://users:3001/users/1"));

        assertThat(headers.get("Host")).isEqualTo("users:3001");
        assertThat(headers.contains("Connection")).isFalse();
        assertThat(headers.contains("Keep-Alive")).isFalse();
        assertThat(headers.contains("Transfer-Encoding")).isFalse();
        assertThat(headers.get("Accept")).isEqualTo("application/json");
        assertThat(headers.get("X-Forwarded-Proto")).isEqualTo("http");
        assertThat(headers.get("X-Forwarded-Host")).isEqualTo("gateway.example.com");
        assertThat(headers.get("X-Forwarded-For")).isEqualTo("203.0.113.7, 198.51.100.2");
        assertThat(headers.get(HttpForwarder.X_REQUEST_ID)).isEqualTo(context.getRequestId());
    }

    @Test
    void serviceWithoutInstancesFailsWithServiceUnavailable() {
        router.addRoute("/orders/*", RouteConfig.builder().service("orders").build());
        RequestContext context = TestContexts.get("/orders/1");
        router.match(context);

        StepVerifier.create(forwarder.forward(context))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(GatewayException.class);
                    assertThat(((GatewayException) e).getErrorCode()).isEqualTo(ErrorCode.SERVICE_UNAVAILABLE);
                })
                .verify();
    }

    @Test
    void forwardRequiresMatchedRoute() {
        StepVerifier.create(forwarder.forward(TestContexts.get("/nothing")))
                .expectError(IllegalStateException.class)
                .verify();
    }

    @Test
    void onlyTransportFailuresAreRetried() {
        assertThat(HttpForwarder.isRetriable(new ConnectException("refused"))).isTrue();
        assertThat(HttpForwarder.isRetriable(new IOException("reset"))).isTrue();
        assertThat(HttpForwarder.isRetriable(new ConnectTimeoutException("slow"))).isFalse();
        assertThat(HttpForwarder.isRetriable(ReadTimeoutException.INSTANCE)).isFalse();
        assertThat(HttpForwarder.isRetriable(new IllegalStateException())).isFalse();
    }

    @Test
    void timeoutsAreRecognised() {
        assertThat(HttpForwarder.isTimeout(ReadTimeoutException.INSTANCE)).isTrue();
        assertThat(HttpForwarder.isTimeout(new ConnectTimeoutException("slow"))).isTrue();
        assertThat(HttpForwarder.isTimeout(new TimeoutException())).isTrue();
        assertThat(HttpForwarder.isTimeout(new ConnectException("refused"))).isFalse();
    }
}
