package com.apigw.server;

import com.apigw.event.GatewayEventPublisher;
import com.apigw.event.RequestCompletedEvent;
import com.apigw.exception.CircuitOpenException;
import com.apigw.exception.GatewayException;
import com.apigw.exception.ProxyException;
import com.apigw.filter.FilterChain;
import com.apigw.filter.GatewayFilter;
import com.apigw.model.GatewayResponse;
import com.apigw.model.RequestContext;
import com.apigw.model.RouteMatch;
import com.apigw.router.HttpForwarder;
import com.apigw.router.Router;
import com.apigw.util.IpUtils;
import com.apigw.util.TraceIdGenerator;
import io.netty.buffer.Unpooled;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.SignalType;
import reactor.netty.Connection;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;
import java.util.function.Supplier;

/**
 * HTTP 请求处理器
 * 为每个请求建立上下文，依次执行过滤器、路由匹配与转发，统一处理异常并发出完成事件
 *
 * @author Gateway Team
 * @version 1.0.0
 */
public class HttpRequestHandler implements BiFunction<HttpServerRequest, HttpServerResponse, Publisher<Void>> {

    private static final Logger log = LoggerFactory.getLogger(HttpRequestHandler.class);

    private final List<GatewayFilter> filters;
    private final Router router;
    private final HttpForwarder httpForwarder;
    private final GatewayEventPublisher eventPublisher;
    private final String healthPath;
    private final Supplier<GatewayHealth> healthSupplier;

    /**
     * @param filters        过滤器列表（按注册顺序执行，可在运行期追加）
     * @param router         路由器
     * @param httpForwarder  转发器
     * @param eventPublisher 事件分发
     * @param healthPath     健康检查路径
     * @param healthSupplier 健康信息
     */
    public HttpRequestHandler(List<GatewayFilter> filters, Router router, HttpForwarder httpForwarder,
                              GatewayEventPublisher eventPublisher, String healthPath,
                              Supplier<GatewayHealth> healthSupplier) {
        this.filters = filters;
        this.router = router;
        this.httpForwarder = httpForwarder;
        this.eventPublisher = eventPublisher;
        this.healthPath = healthPath;
        this.healthSupplier = healthSupplier;
    }

    @Override
    public Publisher<Void> apply(HttpServerRequest request, HttpServerResponse response) {
        RequestContext context = buildContext(request, response);
        log.debug("[{}] 收到请求: {} {}", context.getRequestId(), context.getMethod(), context.getUri());

        Mono<GatewayResponse> pipeline;
        if (healthPath.equals(context.getPath())) {
            pipeline = Mono.fromSupplier(() -> GatewayResponse.json(200, healthSupplier.get()));
        } else {
            pipeline = new FilterChain(List.copyOf(filters), this::dispatch).filter(context);
        }

        return pipeline
                .flatMap(gatewayResponse -> sendResponse(context, gatewayResponse))
                .onErrorResume(e -> handleError(context, e))
                .doFinally(signal -> emitCompleted(context, signal));
    }

    /**
     * 过滤器全部放行后：匹配路由，未匹配返回 404，匹配则转发
     */
    Mono<GatewayResponse> dispatch(RequestContext context) {
        RouteMatch match = router.match(context);
        if (match == null) {
            log.debug("[{}] 未找到匹配的路由: {} {}", context.getRequestId(), context.getMethod(), context.getPath());
            return Mono.just(GatewayResponse.notFound(
                    "No route found for " + context.getMethod() + " " + context.getPath(), context.getRequestId()));
        }
        return httpForwarder.forward(context);
    }

    /**
     * 构建请求上下文
     */
    private RequestContext buildContext(HttpServerRequest request, HttpServerResponse response) {
        HttpHeaders headers = request.requestHeaders();
        String uri = request.uri();
        QueryStringDecoder decoder = new QueryStringDecoder(uri);
        String query = decoder.rawQuery();

        String clientIp = IpUtils.getRealIp(
                headers.get("X-Forwarded-For"),
                headers.get("X-Real-IP"),
                IpUtils.hostAddress(request.remoteAddress()));

        return RequestContext.builder()
                .requestId(extractOrGenerateRequestId(headers))
                .startTime(Instant.now())
                .method(request.method().name())
                .uri(uri)
                .path(decoder.rawPath())
                .queryString(query.isEmpty() ? null : query)
                .scheme(request.scheme())
                .clientIp(clientIp)
                .requestHeaders(headers)
                .request(request)
                .response(response)
                .build();
    }

    /**
     * 写回网关生成的响应
     */
    private Mono<Void> sendResponse(RequestContext context, GatewayResponse gatewayResponse) {
        HttpServerResponse response = context.getResponse();
        context.setResponseStatus(gatewayResponse.getStatusCode());

        response.status(HttpResponseStatus.valueOf(gatewayResponse.getStatusCode()));
        for (Map.Entry<String, String> entry : context.getResponseHeaders()) {
            response.header(entry.getKey(), entry.getValue());
        }
        if (gatewayResponse.getHeaders() != null) {
            gatewayResponse.getHeaders().forEach((key, value) -> {
                if (value != null) {
                    response.header(key, value);
                }
            });
        }
        response.header(HttpForwarder.X_REQUEST_ID, context.getRequestId());

        byte[] body = gatewayResponse.getBody();
        if (body != null && body.length > 0) {
            response.header(HttpHeaderNames.CONTENT_LENGTH, String.valueOf(body.length));
            return response.sendObject(Unpooled.wrappedBuffer(body)).then();
        }
        response.header(HttpHeaderNames.CONTENT_LENGTH, "0");
        return response.send().then();
    }

    /**
     * 处理错误
     * 网关异常按错误码映射状态；其他异常返回不含内部细节的 500；响应已开始写出时直接关闭连接
     */
    private Mono<Void> handleError(RequestContext context, Throwable e) {
        String requestId = context.getRequestId();
        HttpServerResponse response = context.getResponse();

        if (!(e instanceof GatewayException) || e instanceof ProxyException) {
            eventPublisher.publishError(requestId, e);
        }

        if (response.hasSentHeaders()) {
            log.error("[{}] 响应已开始写出后发生错误，关闭连接: {}", requestId, e.toString());
            response.withConnection(Connection::dispose);
            return Mono.empty();
        }

        GatewayResponse errorResponse;
        if (e instanceof GatewayException) {
            GatewayException ge = (GatewayException) e;
            errorResponse = GatewayResponse.error(ge, requestId);
            if (e instanceof CircuitOpenException) {
                long retryAfterMs = ((CircuitOpenException) e).getRetryAfter().toMillis();
                errorResponse.addHeader("Retry-After",
                        String.valueOf(GatewayResponse.toRetryAfterSeconds(retryAfterMs)));
            }
            log.warn("[{}] 请求失败: {} {} -> {} {}", requestId, context.getMethod(), context.getPath(),
                    ge.getErrorCode().getStatus().code(), ge.getMessage());
        } else {
            log.error("[{}] 请求处理异常: {}", requestId, e.getMessage(), e);
            errorResponse = GatewayResponse.internalServerError(requestId);
        }

        return sendResponse(context, errorResponse)
                .onErrorResume(sendError -> {
                    log.error("[{}] 写回错误响应失败: {}", requestId, sendError.toString());
                    return Mono.empty();
                });
    }

    /**
     * 发出完成事件（无论成功、失败或取消）
     */
    private void emitCompleted(RequestContext context, SignalType signal) {
        if (signal == SignalType.CANCEL) {
            log.debug("[{}] 客户端断开连接，请求取消", context.getRequestId());
        }

        Map<String, String> headers = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : context.getRequestHeaders()) {
            headers.putIfAbsent(entry.getKey(), entry.getValue());
        }

        RouteMatch route = context.getRoute();
        RequestCompletedEvent event = RequestCompletedEvent.builder()
                .requestId(context.getRequestId())
                .method(context.getMethod())
                .path(context.getPath())
                .status(context.getResponseStatus())
                .duration(context.elapsed())
                .clientIp(context.getClientIp())
                .route(route != null ? route.getRoute().getPath() : null)
                .instance(context.getSelectedInstance() != null ? context.getSelectedInstance().getUrl() : null)
                .requestHeaders(headers)
                .build();

        log.debug("[{}] 请求处理完成: {} {} status={} 耗时 {}ms", context.getRequestId(), context.getMethod(),
                context.getPath(), event.getStatus(), event.getDuration().toMillis());
        eventPublisher.publishRequestCompleted(event);
    }

    /**
     * 提取或生成请求 ID
     */
    private String extractOrGenerateRequestId(HttpHeaders headers) {
        String requestId = headers.get(HttpForwarder.X_REQUEST_ID);
        if (!TraceIdGenerator.isValid(requestId)) {
            requestId = TraceIdGenerator.generate();
        }
        return requestId;
    }
}
