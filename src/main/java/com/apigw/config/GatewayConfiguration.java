package com.apigw.config;

import com.apigw.auth.Authenticator;
import com.apigw.auth.RemoteTokenAuthenticator;
import com.apigw.discovery.HealthProbe;
import com.apigw.discovery.HttpHealthProbe;
import com.apigw.discovery.LoadBalancer;
import com.apigw.discovery.PoolSynchronizer;
import com.apigw.discovery.ServiceRegistry;
import com.apigw.event.AccessLogListener;
import com.apigw.event.GatewayEventListener;
import com.apigw.event.GatewayEventPublisher;
import com.apigw.resilience.FixedWindowRateLimiter;
import com.apigw.router.HttpForwarder;
import com.apigw.router.Router;
import com.apigw.server.NettyHttpServer;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;

/**
 * 网关组件装配
 *
 * @author Gateway Team
 * @version 1.0.0
 */
@Configuration
public class GatewayConfiguration {

    private static final Logger log = LoggerFactory.getLogger(GatewayConfiguration.class);

    /**
     * 路由器，加载 gateway.routes 中的静态路由
     */
    @Bean
    public Router router(GatewayProperties properties) {
        Router router = new Router();
        for (GatewayProperties.RouteProperties route : properties.getRoutes()) {
            router.addRoute(route.getPath(), route.toRouteConfig());
        }
        log.info("从配置加载路由 {} 条", router.size());
        return router;
    }

    @Bean
    public LoadBalancer loadBalancer(GatewayProperties properties) {
        return new LoadBalancer(properties.getLoadBalancer().getAlgorithm());
    }

    @Bean
    public HealthProbe healthProbe(GatewayProperties properties) {
        return new HttpHealthProbe(Duration.ofMillis(properties.getDiscovery().getHealthCheckTimeoutMs()));
    }

    @Bean
    public PoolSynchronizer poolSynchronizer(LoadBalancer loadBalancer) {
        return new PoolSynchronizer(loadBalancer);
    }

    @Bean(destroyMethod = "close")
    public ServiceRegistry serviceRegistry(GatewayProperties properties, HealthProbe healthProbe,
                                           PoolSynchronizer poolSynchronizer) {
        GatewayProperties.DiscoveryProperties discovery = properties.getDiscovery();
        ServiceRegistry registry = new ServiceRegistry(ServiceRegistry.Settings.builder()
                .healthCheck(discovery.isHealthCheck())
                .healthCheckInterval(Duration.ofMillis(discovery.getHealthCheckIntervalMs()))
                .healthCheckTimeout(Duration.ofMillis(discovery.getHealthCheckTimeoutMs()))
                .defaultHealthPath(discovery.getDefaultHealthPath())
                .build(), healthProbe);
        registry.addListener(poolSynchronizer);
        return registry;
    }

    @Bean(destroyMethod = "close")
    public FixedWindowRateLimiter fixedWindowRateLimiter(GatewayProperties properties) {
        GatewayProperties.RateLimitProperties rateLimit = properties.getRateLimit();
        return new FixedWindowRateLimiter(rateLimit.getMax(), Duration.ofMillis(rateLimit.getWindowMs()));
    }

    @Bean(destroyMethod = "close")
    public HttpForwarder httpForwarder(GatewayProperties properties, LoadBalancer loadBalancer) {
        return new HttpForwarder(properties.getHandler(), loadBalancer);
    }

    @Bean
    public AccessLogListener accessLogListener(GatewayProperties properties) {
        return new AccessLogListener(List.of(properties.getServer().getHealthPath()));
    }

    @Bean
    public GatewayEventPublisher gatewayEventPublisher(List<GatewayEventListener> listeners) {
        return new GatewayEventPublisher(listeners);
    }

    /**
     * 配置了外部认证服务地址时启用远程 Token 校验
     */
    @Bean
    @ConditionalOnProperty(prefix = "gateway.security.auth", name = "auth-server-url")
    public Authenticator remoteTokenAuthenticator(GatewayProperties properties, ObjectMapper objectMapper) {
        GatewayProperties.AuthProperties auth = properties.getSecurity().getAuth();
        log.info("启用外部认证服务: {}", auth.getAuthServerUrl());
        return new RemoteTokenAuthenticator(auth.getAuthServerUrl(), Duration.ofMillis(auth.getTimeoutMs()),
                objectMapper);
    }

    @Bean
    public NettyHttpServer nettyHttpServer(GatewayProperties properties, Router router,
                                           HttpForwarder httpForwarder, GatewayEventPublisher eventPublisher) {
        return new NettyHttpServer(properties.getServer(), router, httpForwarder, eventPublisher);
    }
}
