package com.apigw.router;

import com.apigw.model.RetryPolicy;
import com.apigw.model.RouteConfig;
import com.apigw.model.RouteDefinition;
import com.apigw.model.RouteMatch;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RouterTest {

    private Router router;

    @BeforeEach
    void setUp() {
        router = new Router();
    }

    private static RouteConfig target(String url, String... methods) {
        RouteConfig.RouteConfigBuilder builder = RouteConfig.builder().target(url);
        for (String method : methods) {
            builder.method(method);
        }
        return builder.build();
    }

    @Test
    void exactRouteRequiresPathAndMethod() {
        router.addRoute("/api/health", target("http://a", "GET"));

        assertThat(router.match("/api/health", "GET")).isNotNull();
        assertThat(router.match("/api/health", "POST")).isNull();
        assertThat(router.match("/api/healthz", "GET")).isNull();
    }

    @Test
    void registeringSameExactPathReplacesPreviousRoute() {
        router.addRoute("/api/items", target("http://old", "GET"));
        router.addRoute("/api/items", target("http://new", "GET"));

        RouteMatch match = router.match("/api/items", "GET");
        assertThat(match.getRoute().getTarget()).isEqualTo("http://new");
        assertThat(router.size()).isEqualTo(1);
    }

    @Test
    void parameterizedRouteExtractsBindings() {
        router.addRoute("/api/users/:id", target("http://users", "GET"));

        RouteMatch match = router.match("/api/users/42", "GET");

        assertThat(match).isNotNull();
        assertThat(match.getParams()).containsEntry("id", "42");
        assertThat(match.param("id")).isEqualTo("42");
    }

    @Test
    void methodMismatchFallsThroughToLaterPattern() {
        router.addRoute("/api/users/:id", target("http://readers", "GET"));
        router.addRoute("/api/users/*", target("http://writers", "POST"));

        RouteMatch match = router.match("/api/users/42", "POST");

        assertThat(match).isNotNull();
        assertThat(match.getRoute().getTarget()).isEqualTo("http://writers");
    }

    @Test
    void exactRouteWinsOverPattern() {
        router.addRoute("/api/users/:id", target("http://pattern", "GET"));
        router.addRoute("/api/users/me", target("http://exact", "GET"));

        assertThat(router.match("/api/users/me", "GET").getRoute().getTarget()).isEqualTo("http://exact");
    }

    @Test
    void firstRegisteredPatternWins() {
        router.addRoute("/api/*", target("http://first", "GET"));
        router.addRoute("/api/users/:id", target("http://second", "GET"));

        assertThat(router.match("/api/users/1", "GET").getRoute().getTarget()).isEqualTo("http://first");
    }

    @Test
    void queryStringIsParsedIntoMatchNotRoute() {
        router.addRoute("/api/search", target("http://search", "GET"));

        RouteMatch match = router.match("/api/search?q=java&page=2&q=ignored", "GET");

        assertThat(match.getQuery()).containsEntry("q", "java").containsEntry("page", "2");
    }

    @Test
    void pathIsNormalizedBeforeMatching() {
        router.addRoute("api//orders/", target("http://orders", "GET"));

        assertThat(router.match("/api/orders/", "GET")).isNotNull();
        assertThat(router.match("//api/orders", "GET")).isNotNull();
    }

    @Test
    void appliesRouteDefaults() {
        RouteDefinition route = router.addRoute("/api/defaults", RouteConfig.builder().target("http://d").build());

        assertThat(route.getMethods()).containsExactly("GET");
        assertThat(route.isRequireAuth()).isFalse();
        assertThat(route.getTimeout()).isEqualTo(Duration.ofMillis(30000));
        assertThat(route.getRetry()).isEqualTo(RetryPolicy.NONE);
        assertThat(route.getMetadata()).isEmpty();
    }

    @Test
    void methodsAreCaseInsensitive() {
        router.addRoute("/api/lower", target("http://l", "post"));

        assertThat(router.match("/api/lower", "POST")).isNotNull();
    }

    @Test
    void removeRouteDeletesFromBothTables() {
        router.addRoute("/api/a", target("http://a", "GET"));
        router.addRoute("/api/b/:id", target("http://b", "GET"));

        assertThat(router.removeRoute("/api/a")).isTrue();
        assertThat(router.removeRoute("/api/b/:id")).isTrue();
        assertThat(router.removeRoute("/api/missing")).isFalse();
        assertThat(router.size()).isZero();
        assertThat(router.match("/api/b/1", "GET")).isNull();
    }

    @Test
    void rejectsRouteWithoutTargetOrService() {
        assertThatThrownBy(() -> router.addRoute("/api/none", RouteConfig.builder().build()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void clearRemovesEverything() {
        router.addRoute("/api/a", target("http://a", "GET"));
        router.addRoute("/api/*", target("http://b", "GET"));

        router.clear();

        assertThat(router.getRoutes()).isEmpty();
    }
}
