package com.apigw.filter;

import com.apigw.model.GatewayResponse;
import com.apigw.model.RequestContext;
import reactor.core.publisher.Mono;

/**
 * 网关过滤器接口
 * 过滤器可以调用 chain 继续处理，也可以直接返回响应终止请求
 *
 * @author Gateway Team
 * @version 1.0.0
 */
public interface GatewayFilter {

    /**
     * 获取过滤器名称
     *
     * @return 过滤器名称
     */
    String getName();

    /**
     * 获取过滤器顺序
     * 数值越小越先注册，Spring 容器中的过滤器按此排序后依次注册
     *
     * @return 顺序值
     */
    int getOrder();

    /**
     * 执行过滤逻辑
     *
     * @param context 请求上下文
     * @param chain   过滤器链
     * @return 需要由网关写回的响应；为空表示响应已由转发器流式写出
     */
    Mono<GatewayResponse> filter(RequestContext context, FilterChain chain);

    /**
     * 是否启用
     *
     * @return true 表示启用
     */
    default boolean isEnabled() {
        return true;
    }
}
