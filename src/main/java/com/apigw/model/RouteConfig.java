package com.apigw.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * 路由注册参数
 * 对应 route(path, {target, methods, auth, timeout, retry}) 注册接口
 *
 * @author Gateway Team
 * @version 1.0.0
 */
@Value
@Builder
public class RouteConfig {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofMillis(30000);

    /**
     * 静态目标地址，例如 http://users-service:3001/users
     */
    String target;

    /**
     * 负载均衡服务名，设置后由负载均衡器选出的实例地址替换 target
     */
    String service;

    /**
     * 允许的 HTTP 方法，为空时默认 GET
     */
    @Singular
    List<String> methods;

    boolean auth;

    @Builder.Default
    Duration timeout = DEFAULT_TIMEOUT;

    @Builder.Default
    RetryPolicy retry = RetryPolicy.NONE;

    @Singular("metadataEntry")
    Map<String, String> metadata;
}
