package com.apigw.filter;

import com.apigw.model.GatewayResponse;
import com.apigw.model.RequestContext;
import com.apigw.support.TestContexts;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class FilterChainTest {

    private final List<String> trace = new ArrayList<>();

    private GatewayFilter recording(String name, boolean enabled) {
        return new GatewayFilter() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public int getOrder() {
                return 0;
            }

            @Override
            public boolean isEnabled() {
                return enabled;
            }

            @Override
            public Mono<GatewayResponse> filter(RequestContext context, FilterChain chain) {
                trace.add(name);
                return chain.filter(context);
            }
        };
    }

    private Mono<GatewayResponse> terminal(RequestContext context) {
        trace.add("handler");
        return Mono.just(GatewayResponse.json(200, Map.of("ok", true)));
    }

    @Test
    void runsFiltersInOrderThenHandler() {
        FilterChain chain = new FilterChain(List.of(recording("a", true), recording("b", true)), this::terminal);

        StepVerifier.create(chain.filter(TestContexts.get("/x")))
                .assertNext(response -> assertThat(response.getStatusCode()).isEqualTo(200))
                .verifyComplete();

        assertThat(trace).containsExactly("a", "b", "handler");
    }

    @Test
    void skipsDisabledFilters() {
        FilterChain chain = new FilterChain(List.of(recording("a", false), recording("b", true)), this::terminal);

        StepVerifier.create(chain.filter(TestContexts.get("/x"))).expectNextCount(1).verifyComplete();

        assertThat(trace).containsExactly("b", "handler");
    }

    @Test
    void filterCanShortCircuit() {
        GatewayFilter reject = new GatewayFilter() {
            @Override
            public String getName() {
                return "reject";
            }

            @Override
            public int getOrder() {
                return 0;
            }

            @Override
            public Mono<GatewayResponse> filter(RequestContext context, FilterChain chain) {
                trace.add("reject");
                return Mono.just(GatewayResponse.forbidden("nope", context.getRequestId()));
            }
        };
        FilterChain chain = new FilterChain(List.of(reject, recording("b", true)), this::terminal);

        StepVerifier.create(chain.filter(TestContexts.get("/x")))
                .assertNext(response -> assertThat(response.getStatusCode()).isEqualTo(403))
                .verifyComplete();

        assertThat(trace).containsExactly("reject");
    }

    @Test
    void nothingRunsUntilSubscribed() {
        FilterChain chain = new FilterChain(List.of(recording("a", true)), this::terminal);

        Mono<GatewayResponse> pending = chain.filter(TestContexts.get("/x"));
        assertThat(trace).isEmpty();

        StepVerifier.create(pending).expectNextCount(1).verifyComplete();
        assertThat(trace).containsExactly("a", "handler");
    }

    @Test
    void emptyFilterListGoesStraightToHandler() {
        FilterChain chain = new FilterChain(List.of(), this::terminal);

        StepVerifier.create(chain.filter(TestContexts.get("/x"))).expectNextCount(1).verifyComplete();

        assertThat(chain.size()).isZero();
        assertThat(trace).containsExactly("handler");
    }
}
