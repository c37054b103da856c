package com.apigw.router;

import com.apigw.model.RequestContext;
import com.apigw.model.RetryPolicy;
import com.apigw.model.RouteConfig;
import com.apigw.model.RouteDefinition;
import com.apigw.model.RouteMatch;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 路由器
 * 负责将 (method, path) 匹配到路由定义
 *
 * 精确路径路由与模式路由分开存放：先查精确表（O(1)），
 * 再按注册顺序尝试模式路由，第一个路径与方法都匹配的路由胜出。
 *
 * @author Gateway Team
 * @version 2.0.0
 */
public class Router {

    private static final Logger log = LoggerFactory.getLogger(Router.class);

    /**
     * 精确路径路由表，同一路径后注册的覆盖先注册的
     */
    private final Map<String, RouteDefinition> exactRoutes = new ConcurrentHashMap<>();

    /**
     * 模式路由列表（线程安全，读多写少）
     */
    private final CopyOnWriteArrayList<RouteDefinition> dynamicRoutes = new CopyOnWriteArrayList<>();

    /**
     * 添加路由
     *
     * @param path   路径模式
     * @param config 路由参数
     * @return 注册后的路由定义
     */
    public RouteDefinition addRoute(String path, RouteConfig config) {
        if (path == null || path.isEmpty()) {
            throw new IllegalArgumentException("Route path must not be empty");
        }
        if (config == null || ((config.getTarget() == null || config.getTarget().isEmpty())
                && (config.getService() == null || config.getService().isEmpty()))) {
            throw new IllegalArgumentException("Route " + path + " requires a target or a service");
        }

        String normalized = normalizePath(path);
        RouteDefinition route = RouteDefinition.builder()
                .path(normalized)
                .pattern(PathPattern.compile(normalized))
                .methods(normalizeMethods(config.getMethods()))
                .target(config.getTarget())
                .service(config.getService())
                .requireAuth(config.isAuth())
                .timeout(config.getTimeout() != null ? config.getTimeout() : RouteConfig.DEFAULT_TIMEOUT)
                .retry(config.getRetry() != null ? config.getRetry() : RetryPolicy.NONE)
                .metadata(config.getMetadata() != null ? Map.copyOf(config.getMetadata()) : Map.of())
                .build();

        if (route.isDynamic()) {
            dynamicRoutes.add(route);
        } else {
            RouteDefinition previous = exactRoutes.put(normalized, route);
            if (previous != null) {
                log.info("路由 {} 已存在，覆盖旧定义 (methods={})", normalized, previous.getMethods());
            }
        }

        log.info("注册路由: {} {} -> {}", String.join(",", route.getMethods()), normalized,
                route.isLoadBalanced() ? "lb://" + route.getService() : route.getTarget());
        return route;
    }

    /**
     * 移除路由
     *
     * @param path 注册时的路径模式
     * @return 是否有路由被移除
     */
    public boolean removeRoute(String path) {
        String normalized = normalizePath(path);
        boolean removed = exactRoutes.remove(normalized) != null;
        removed |= dynamicRoutes.removeIf(r -> r.getPath().equals(normalized));
        if (removed) {
            log.info("移除路由: {}", normalized);
        }
        return removed;
    }

    /**
     * 匹配路由
     *
     * @param uri    请求 URI（可包含查询参数）
     * @param method HTTP 方法
     * @return 匹配结果，未找到返回 null
     */
    public RouteMatch match(String uri, String method) {
        if (uri == null || method == null) {
            return null;
        }

        QueryStringDecoder decoder = new QueryStringDecoder(uri);
        String path = normalizePath(decoder.rawPath());
        Map<String, String> query = flattenQuery(decoder.parameters());

        RouteDefinition exact = exactRoutes.get(path);
        if (exact != null && exact.allowsMethod(method)) {
            log.debug("请求 {} {} 精确匹配路由 {}", method, path, exact.getPath());
            return new RouteMatch(exact, Collections.emptyMap(), query);
        }

        // 路径匹配但方法不允许的路由不阻止后续路由的尝试
        for (RouteDefinition route : dynamicRoutes) {
            Map<String, String> params = route.getPattern().match(path);
            if (params != null && route.allowsMethod(method)) {
                log.debug("请求 {} {} 匹配路由 {} params={}", method, path, route.getPath(), params);
                return new RouteMatch(route, params, query);
            }
        }

        log.debug("请求 {} {} 未匹配任何路由", method, path);
        return null;
    }

    /**
     * 匹配请求上下文对应的路由
     * 结果缓存在上下文中，过滤器与转发器共用同一次匹配
     *
     * @param context 请求上下文
     * @return 匹配结果，未找到返回 null
     */
    public RouteMatch match(RequestContext context) {
        RouteMatch cached = context.getRoute();
        if (cached != null) {
            return cached;
        }
        RouteMatch match = match(context.getUri(), context.getMethod());
        if (match != null) {
            context.setRoute(match);
        }
        return match;
    }

    /**
     * 获取所有路由（精确路由在前，模式路由按注册顺序在后）
     */
    public List<RouteDefinition> getRoutes() {
        List<RouteDefinition> routes = new ArrayList<>(exactRoutes.values());
        routes.addAll(dynamicRoutes);
        return routes;
    }

    public int size() {
        return exactRoutes.size() + dynamicRoutes.size();
    }

    /**
     * 清空所有路由
     */
    public void clear() {
        exactRoutes.clear();
        dynamicRoutes.clear();
        log.info("已清空所有路由");
    }

    /**
     * 规范化路径：去掉查询串，补齐前导斜杠，合并重复斜杠，去掉结尾斜杠
     */
    static String normalizePath(String path) {
        String p = path;
        int q = p.indexOf('?');
        if (q >= 0) {
            p = p.substring(0, q);
        }
        if (!p.startsWith("/")) {
            p = "/" + p;
        }
        p = p.replaceAll("/{2,}", "/");
        if (p.length() > 1 && p.endsWith("/")) {
            p = p.substring(0, p.length() - 1);
        }
        return p;
    }

    private static Set<String> normalizeMethods(List<String> methods) {
        if (methods == null || methods.isEmpty()) {
            return Set.of("GET");
        }
        Set<String> result = new LinkedHashSet<>();
        for (String m : methods) {
            result.add(m.trim().toUpperCase(Locale.ROOT));
        }
        return Collections.unmodifiableSet(result);
    }

    private static Map<String, String> flattenQuery(Map<String, List<String>> parameters) {
        if (parameters.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, String> query = new LinkedHashMap<>();
        parameters.forEach((key, values) -> query.put(key, values.isEmpty() ? "" : values.get(0)));
        return query;
    }
}
