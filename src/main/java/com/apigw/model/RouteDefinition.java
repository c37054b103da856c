package com.apigw.model;

import com.apigw.router.PathPattern;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Map;
import java.util.Set;

/**
 * 路由定义模型
 * 注册后不可变，路径模式在注册时编译为匹配器
 *
 * @author Gateway Team
 * @version 1.0.0
 */
@Value
@Builder
public class RouteDefinition {

    /**
     * 注册时的路径模式（支持 :name 参数和 * 通配符）
     */
    String path;

    PathPattern pattern;

    /**
     * 允许的 HTTP 方法（大写）
     */
    Set<String> methods;

    String target;

    /**
     * 负载均衡服务名，可为空
     */
    String service;

    boolean requireAuth;

    Duration timeout;

    RetryPolicy retry;

    Map<String, String> metadata;

    /**
     * 是否为参数化/通配路由
     */
    public boolean isDynamic() {
        return pattern.isDynamic();
    }

    public boolean allowsMethod(String method) {
        return method != null && methods.contains(method.toUpperCase());
    }

    public boolean isLoadBalanced() {
        return service != null && !service.isEmpty();
    }
}
