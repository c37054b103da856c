package com.apigw.config;

import com.apigw.discovery.LoadBalancingAlgorithm;
import com.apigw.discovery.ServiceDefinition;
import com.apigw.discovery.ServiceInstance;
import com.apigw.model.RetryPolicy;
import com.apigw.model.RouteConfig;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 网关配置属性类
 * 从 application.yml 绑定配置到 Java 对象
 *
 * @author Gateway Team
 * @version 1.0.0
 */
@Data
@Validated
@ConfigurationProperties(prefix = "gateway")
public class GatewayProperties {

    /**
     * 服务器配置
     */
    @Valid
    private ServerProperties server = new ServerProperties();

    /**
     * 转发配置
     */
    @Valid
    private HandlerProperties handler = new HandlerProperties();

    /**
     * 安全配置
     */
    @Valid
    private SecurityProperties security = new SecurityProperties();

    /**
     * 限流配置
     */
    @Valid
    private RateLimitProperties rateLimit = new RateLimitProperties();

    /**
     * 熔断配置
     */
    @Valid
    private CircuitBreakerProperties circuitBreaker = new CircuitBreakerProperties();

    private LoadBalancerProperties loadBalancer = new LoadBalancerProperties();

    /**
     * 服务发现配置
     */
    @Valid
    private DiscoveryProperties discovery = new DiscoveryProperties();

    /**
     * 路由配置列表
     */
    @Valid
    private List<RouteProperties> routes = new ArrayList<>();

    /**
     * 服务器配置
     */
    @Data
    public static class ServerProperties {
        /**
         * 服务端口，0 表示随机端口
         */
        @Min(0)
        @Max(65535)
        private int port = 8080;

        private String host = "0.0.0.0";

        /**
         * 内部健康检查路径，在过滤器之前处理
         */
        @NotBlank
        private String healthPath = "/health";

        private SslProperties ssl = new SslProperties();
    }

    /**
     * TLS 配置，启用后只监听 HTTPS
     */
    @Data
    public static class SslProperties {
        private boolean enabled = false;

        /**
         * PEM 证书链文件
         */
        private String certificate;

        /**
         * PEM 私钥文件（PKCS#8）
         */
        private String privateKey;
    }

    /**
     * 后端转发配置
     */
    @Data
    public static class HandlerProperties {
        /**
         * 每个协议连接池的最大连接数
         */
        @Min(1)
        private int maxConnections = 50;

        private int pendingAcquireTimeoutMs = 45000;

        private int maxIdleTimeMs = 30000;

        private int connectTimeoutMs = 5000;
    }

    /**
     * 安全配置
     */
    @Data
    public static class SecurityProperties {
        /**
         * 鉴权配置
         */
        private AuthProperties auth = new AuthProperties();
    }

    /**
     * 鉴权配置
     */
    @Data
    public static class AuthProperties {
        /**
         * 是否启用鉴权，关闭后路由上的 auth 标记不生效
         */
        private boolean enabled = true;

        /**
         * 跳过鉴权的路径（Ant 风格）
         */
        private List<String> skipPaths = new ArrayList<>();

        /**
         * 外部认证服务地址，验证接口为 {authServerUrl}/verify
         */
        private String authServerUrl;

        private int timeoutMs = 500;
    }

    /**
     * 固定窗口限流配置
     */
    @Data
    public static class RateLimitProperties {
        private boolean enabled = true;

        /**
         * 每个窗口允许的请求数
         */
        @Min(1)
        private int max = 100;

        @Min(1)
        private long windowMs = 60000;

        /**
         * 作为限流键的请求头（如 X-API-Key），为空或请求中缺失时使用客户端 IP
         */
        private String keyHeader;

        /**
         * 不限流的路径（Ant 风格）
         */
        private List<String> skipPaths = new ArrayList<>();
    }

    /**
     * 熔断配置
     */
    @Data
    public static class CircuitBreakerProperties {
        private boolean enabled = true;

        private CircuitBreakerScope scope = CircuitBreakerScope.GLOBAL;

        /**
         * 监控窗口内触发熔断的失败次数
         */
        @Min(1)
        private int threshold = 5;

        /**
         * 打开状态持续时间
         */
        @Min(1)
        private long timeoutMs = 60000;

        @Min(1)
        private long monitoringPeriodMs = 60000;
    }

    /**
     * 熔断粒度
     */
    public enum CircuitBreakerScope {
        /**
         * 所有请求共用一个熔断器
         */
        GLOBAL,
        /**
         * 每个路由一个熔断器
         */
        ROUTE
    }

    @Data
    public static class LoadBalancerProperties {
        private LoadBalancingAlgorithm algorithm = LoadBalancingAlgorithm.ROUND_ROBIN;
    }

    /**
     * 服务发现配置
     */
    @Data
    public static class DiscoveryProperties {
        private boolean healthCheck = false;

        @Min(1)
        private long healthCheckIntervalMs = 30000;

        @Min(1)
        private long healthCheckTimeoutMs = 5000;

        private String defaultHealthPath = "/health";

        /**
         * 启动时注册的服务
         */
        @Valid
        private List<ServiceProperties> services = new ArrayList<>();
    }

    /**
     * 静态服务定义
     */
    @Data
    public static class ServiceProperties {
        @NotBlank
        private String name;

        private Map<String, String> metadata = new HashMap<>();

        @Valid
        private List<InstanceProperties> instances = new ArrayList<>();

        public ServiceDefinition toServiceDefinition() {
            ServiceDefinition.ServiceDefinitionBuilder builder = ServiceDefinition.builder()
                    .name(name)
                    .metadata(metadata);
            for (InstanceProperties instance : instances) {
                builder.instance(ServiceInstance.builder()
                        .id(instance.getId())
                        .url(instance.getUrl())
                        .metadata(instance.getMetadata())
                        .build());
            }
            return builder.build();
        }
    }

    @Data
    public static class InstanceProperties {
        private String id;

        @NotBlank
        private String url;

        private Map<String, String> metadata = new HashMap<>();
    }

    /**
     * 路由配置
     */
    @Data
    public static class RouteProperties {
        /**
         * 路径模式，支持 :name 参数与 * 通配
         */
        @NotBlank
        private String path;

        /**
         * 静态目标地址
         */
        private String target;

        /**
         * 负载均衡服务名，设置后替代 target
         */
        private String service;

        private List<String> methods = new ArrayList<>(List.of("GET"));

        private boolean auth = false;

        @Min(1)
        private long timeoutMs = RouteConfig.DEFAULT_TIMEOUT.toMillis();

        private RetryProperties retry = new RetryProperties();

        private Map<String, String> metadata = new HashMap<>();

        public RouteConfig toRouteConfig() {
            return RouteConfig.builder()
                    .target(target)
                    .service(service)
                    .methods(methods)
                    .auth(auth)
                    .timeout(Duration.ofMillis(timeoutMs))
                    .retry(RetryPolicy.of(retry.getAttempts(), Duration.ofMillis(retry.getDelayMs())))
                    .metadata(metadata)
                    .build();
        }
    }

    @Data
    public static class RetryProperties {
        @Min(0)
        private int attempts = 0;

        @Min(0)
        private long delayMs = 1000;
    }
}
