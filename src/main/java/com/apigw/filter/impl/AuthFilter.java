package com.apigw.filter.impl;

import com.apigw.auth.AuthenticatedPrincipal;
import com.apigw.auth.Authenticator;
import com.apigw.auth.CredentialResolver;
import com.apigw.config.GatewayProperties;
import com.apigw.filter.FilterChain;
import com.apigw.filter.GatewayFilter;
import com.apigw.model.GatewayResponse;
import com.apigw.model.RequestContext;
import com.apigw.model.RouteMatch;
import com.apigw.router.Router;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;
import org.springframework.util.AntPathMatcher;
import reactor.core.publisher.Mono;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 鉴权过滤器
 * 仅对 auth=true 的路由生效；凭证校验委托给 {@link Authenticator}
 *
 * 路由元数据 roles（逗号分隔）要求身份至少具备其中一个角色，否则返回 403。
 * 未配置认证组件时，需要鉴权的请求一律拒绝。
 *
 * @author Gateway Team
 * @version 1.0.0
 */
@Component
public class AuthFilter implements GatewayFilter {

    private static final Logger log = LoggerFactory.getLogger(AuthFilter.class);

    public static final String META_ROLES = "roles";

    private final GatewayProperties.AuthProperties properties;
    private final Router router;
    private final ObjectProvider<Authenticator> authenticatorProvider;
    private final AntPathMatcher pathMatcher = new AntPathMatcher();

    public AuthFilter(GatewayProperties properties, Router router, ObjectProvider<Authenticator> authenticatorProvider) {
        this.properties = properties.getSecurity().getAuth();
        this.router = router;
        this.authenticatorProvider = authenticatorProvider;
    }

    @Override
    public String getName() {
        return "AuthFilter";
    }

    @Override
    public int getOrder() {
        return 300;
    }

    @Override
    public boolean isEnabled() {
        return properties.isEnabled();
    }

    @Override
    public Mono<GatewayResponse> filter(RequestContext context, FilterChain chain) {
        String requestId = context.getRequestId();

        if (shouldSkipAuth(context.getPath())) {
            log.debug("[{}] 路径 {} 在跳过鉴权列表中", requestId, context.getPath());
            return chain.filter(context);
        }

        RouteMatch match = router.match(context);
        if (match == null || !match.getRoute().isRequireAuth()) {
            return chain.filter(context);
        }

        String credential = CredentialResolver.resolve(context);
        if (credential == null) {
            log.warn("[{}] 缺少认证凭证: {} {}", requestId, context.getMethod(), context.getPath());
            return Mono.just(GatewayResponse.unauthorized("Missing authentication token", requestId));
        }

        Authenticator authenticator = authenticatorProvider.getIfAvailable();
        if (authenticator == null) {
            log.error("[{}] 未配置认证组件 (gateway.security.auth.auth-server-url)，拒绝请求", requestId);
            return Mono.just(GatewayResponse.unauthorized("Authentication is not available", requestId));
        }

        return authenticator.authenticate(credential, requestId)
                .map(Optional::of)
                .defaultIfEmpty(Optional.<AuthenticatedPrincipal>empty())
                .onErrorResume(e -> {
                    log.error("[{}] 调用认证组件失败: {}", requestId, e.toString());
                    return Mono.just(Optional.<AuthenticatedPrincipal>empty());
                })
                .flatMap(principal -> {
                    if (principal.isEmpty()) {
                        log.warn("[{}] Token 验证失败", requestId);
                        return Mono.just(GatewayResponse.unauthorized("Invalid authentication token", requestId));
                    }
                    context.setPrincipal(principal.get());

                    Set<String> required = requiredRoles(match);
                    if (!required.isEmpty() && !hasAnyRole(principal.get(), required)) {
                        log.warn("[{}] 权限不足: subject={}, required={}", requestId,
                                principal.get().getSubject(), required);
                        return Mono.just(GatewayResponse.forbidden("Insufficient permissions", requestId));
                    }

                    log.debug("[{}] 鉴权通过: subject={}", requestId, principal.get().getSubject());
                    return chain.filter(context);
                });
    }

    private static Set<String> requiredRoles(RouteMatch match) {
        String roles = match.getRoute().getMetadata().get(META_ROLES);
        Set<String> result = new LinkedHashSet<>();
        if (roles == null) {
            return result;
        }
        for (String role : roles.split(",")) {
            if (!role.trim().isEmpty()) {
                result.add(role.trim());
            }
        }
        return result;
    }

    private static boolean hasAnyRole(AuthenticatedPrincipal principal, Set<String> required) {
        for (String role : required) {
            if (principal.hasRole(role)) {
                return true;
            }
        }
        return false;
    }

    private boolean shouldSkipAuth(String path) {
        List<String> skipPaths = properties.getSkipPaths();
        if (skipPaths == null || skipPaths.isEmpty()) {
            return false;
        }
        for (String skipPath : skipPaths) {
            if (pathMatcher.match(skipPath, path)) {
                return true;
            }
        }
        return false;
    }
}
