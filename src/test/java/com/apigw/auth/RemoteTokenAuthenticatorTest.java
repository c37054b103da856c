package com.apigw.auth;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServer;
import reactor.test.StepVerifier;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class RemoteTokenAuthenticatorTest {

    private DisposableServer authServer;
    private RemoteTokenAuthenticator authenticator;

    @BeforeEach
    void setUp() {
        authServer = HttpServer.create()
                .host("127.0.0.1")
                .port(0)
                .route(routes -> routes.get("/verify", (request, response) -> {
                    String authorization = request.requestHeaders().get("Authorization");
                    if ("Bearer admin-token".equals(authorization)) {
                        return response.header("Content-Type", "application/json")
                                .sendString(Mono.just("{\"subject\":\"alice\",\"roles\":[\"admin\",\"ops\"]}"));
                    }
                    if ("Bearer plain-token".equals(authorization)) {
                        return response.sendString(Mono.just("ok"));
                    }
                    if ("Bearer slow-token".equals(authorization)) {
                        return Mono.delay(Duration.ofSeconds(2)).then(response.send().then());
                    }
                    if ("Bearer broken-token".equals(authorization)) {
                        return response.status(HttpResponseStatus.INTERNAL_SERVER_ERROR).sendString(Mono.just("oops"));
                    }
                    return response.status(HttpResponseStatus.UNAUTHORIZED).send();
                }))
                .bindNow();
        authenticator = new RemoteTokenAuthenticator("http://127.0.0.1:" + authServer.port() + "/",
                Duration.ofMillis(500), new ObjectMapper());
    }

    @AfterEach
    void tearDown() {
        authServer.disposeNow();
    }

    @Test
    void validTokenYieldsPrincipalWithRoles() {
        StepVerifier.create(authenticator.authenticate("admin-token", "req-1"))
                .assertNext(principal -> {
                    assertThat(principal.getSubject()).isEqualTo("alice");
                    assertThat(principal.getRoles()).containsExactlyInAnyOrder("admin", "ops");
                })
                .verifyComplete();
    }

    @Test
    void nonJsonSuccessBodyYieldsAnonymousPrincipal() {
        StepVerifier.create(authenticator.authenticate("plain-token", "req-2"))
                .assertNext(principal -> assertThat(principal.getRoles()).isEmpty())
                .verifyComplete();
    }

    @Test
    void rejectedTokenCompletesEmpty() {
        StepVerifier.create(authenticator.authenticate("wrong", "req-3")).verifyComplete();
    }

    @Test
    void unexpectedStatusCompletesEmpty() {
        StepVerifier.create(authenticator.authenticate("broken-token", "req-4")).verifyComplete();
    }

    @Test
    void slowAuthServerFails() {
        StepVerifier.create(authenticator.authenticate("slow-token", "req-5"))
                .expectError()
                .verify(Duration.ofSeconds(5));
    }
}
