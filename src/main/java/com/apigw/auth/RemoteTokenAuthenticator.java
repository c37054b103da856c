package com.apigw.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashSet;
import java.util.Set;

/**
 * 调用外部认证服务校验 Token
 * 验证接口：GET {auth-server-url}/verify，请求头 Authorization: Bearer {token}
 * 200 表示有效，响应体中可选的 subject 与 roles 字段作为身份信息；401 表示无效
 *
 * @author Gateway Team
 * @version 1.0.0
 */
public class RemoteTokenAuthenticator implements Authenticator {

    private static final Logger log = LoggerFactory.getLogger(RemoteTokenAuthenticator.class);

    private final String authServerUrl;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public RemoteTokenAuthenticator(String authServerUrl, Duration timeout, ObjectMapper objectMapper) {
        this.authServerUrl = authServerUrl.endsWith("/")
                ? authServerUrl.substring(0, authServerUrl.length() - 1) : authServerUrl;
        this.timeout = timeout;
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.create().responseTimeout(timeout);
    }

    @Override
    public Mono<AuthenticatedPrincipal> authenticate(String credential, String requestId) {
        return httpClient
                .headers(headers -> {
                    headers.add("Authorization", "Bearer " + credential);
                    headers.add("X-Request-Id", requestId);
                })
                .get()
                .uri(authServerUrl + "/verify")
                .responseSingle((response, body) -> {
                    int status = response.status().code();
                    if (status == 200) {
                        return body.asString(StandardCharsets.UTF_8)
                                .defaultIfEmpty("")
                                .map(this::toPrincipal);
                    }
                    if (status == 401 || status == 403) {
                        return Mono.<AuthenticatedPrincipal>empty();
                    }
                    return body.asString(StandardCharsets.UTF_8)
                            .defaultIfEmpty("")
                            .flatMap(msg -> {
                                log.warn("[{}] 认证服务返回异常状态: {}, body: {}", requestId, status, msg);
                                return Mono.<AuthenticatedPrincipal>empty();
                            });
                })
                .timeout(timeout)
                .doOnError(e -> log.error("[{}] Token 验证请求失败: {}", requestId, e.toString()));
    }

    private AuthenticatedPrincipal toPrincipal(String body) {
        if (body.isEmpty()) {
            return new AuthenticatedPrincipal(null, Set.of());
        }
        try {
            JsonNode node = objectMapper.readTree(body);
            String subject = node.hasNonNull("subject") ? node.get("subject").asText() : null;
            Set<String> roles = new HashSet<>();
            JsonNode rolesNode = node.get("roles");
            if (rolesNode != null && rolesNode.isArray()) {
                rolesNode.forEach(role -> roles.add(role.asText()));
            }
            return new AuthenticatedPrincipal(subject, roles);
        } catch (Exception e) {
            log.debug("认证服务响应体不是 JSON，按无角色身份处理: {}", e.getMessage());
            return new AuthenticatedPrincipal(null, Set.of());
        }
    }
}
