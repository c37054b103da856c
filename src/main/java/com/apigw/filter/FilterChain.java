package com.apigw.filter;

import com.apigw.model.GatewayResponse;
import com.apigw.model.RequestContext;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.function.Function;

/**
 * 过滤器链
 * 按注册顺序执行过滤器，全部放行后交给终端处理器（路由匹配 + 转发）
 *
 * @author Gateway Team
 * @version 1.0.0
 */
public class FilterChain {

    private final List<GatewayFilter> filters;
    private final Function<RequestContext, Mono<GatewayResponse>> handler;
    private final int currentIndex;

    /**
     * 构造过滤器链
     *
     * @param filters 过滤器列表（按执行顺序）
     * @param handler 终端处理器
     */
    public FilterChain(List<GatewayFilter> filters, Function<RequestContext, Mono<GatewayResponse>> handler) {
        this(filters, handler, 0);
    }

    private FilterChain(List<GatewayFilter> filters, Function<RequestContext, Mono<GatewayResponse>> handler,
                        int currentIndex) {
        this.filters = filters;
        this.handler = handler;
        this.currentIndex = currentIndex;
    }

    /**
     * 执行下一个过滤器
     *
     * @param context 请求上下文
     * @return 响应的 Mono
     */
    public Mono<GatewayResponse> filter(RequestContext context) {
        if (filters == null || currentIndex >= filters.size()) {
            return Mono.defer(() -> handler.apply(context));
        }

        GatewayFilter currentFilter = filters.get(currentIndex);

        // 跳过禁用的过滤器
        if (!currentFilter.isEnabled()) {
            return next().filter(context);
        }

        return Mono.defer(() -> currentFilter.filter(context, next()));
    }

    private FilterChain next() {
        return new FilterChain(filters, handler, currentIndex + 1);
    }

    public int size() {
        return filters != null ? filters.size() : 0;
    }
}
