package com.apigw.discovery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

/**
 * 基于 HTTP 的健康探测
 * GET {instance-url}{health-path}，任意 2xx 视为健康
 *
 * @author Gateway Team
 * @version 1.0.0
 */
public class HttpHealthProbe implements HealthProbe {

    private static final Logger log = LoggerFactory.getLogger(HttpHealthProbe.class);

    private final HttpClient httpClient;

    public HttpHealthProbe(Duration timeout) {
        this.httpClient = HttpClient.create()
                .responseTimeout(timeout);
    }

    @Override
    public Mono<Boolean> probe(ServiceInstance instance, String healthPath) {
        String url = instance.getUrl() + healthPath;
        return httpClient.get()
                .uri(url)
                .response()
                .map(response -> {
                    int code = response.status().code();
                    log.debug("健康检查 {} -> {}", url, code);
                    return code >= 200 && code < 300;
                });
    }
}
