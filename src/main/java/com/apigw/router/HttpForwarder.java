package com.apigw.router;

import com.apigw.config.GatewayProperties;
import com.apigw.discovery.LoadBalancer;
import com.apigw.discovery.PoolInstance;
import com.apigw.exception.ErrorCode;
import com.apigw.exception.GatewayException;
import com.apigw.exception.ProxyException;
import com.apigw.model.GatewayResponse;
import com.apigw.model.RequestContext;
import com.apigw.model.RetryPolicy;
import com.apigw.model.RouteDefinition;
import com.apigw.util.IpUtils;
import io.netty.channel.ChannelOption;
import io.netty.channel.ConnectTimeoutException;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.timeout.ReadTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.netty.ByteBufFlux;
import reactor.netty.http.client.HttpClient;
import reactor.netty.http.client.HttpClientResponse;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;
import reactor.netty.resources.ConnectionProvider;
import reactor.util.retry.Retry;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * HTTP 转发器
 * 将已匹配路由的请求流式转发到后端，并把后端响应流式写回客户端
 *
 * <ul>
 *     <li>按协议维护两个有界连接池（http / https）</li>
 *     <li>请求体与响应体均不做整体缓冲</li>
 *     <li>仅对建立连接阶段的传输失败按路由策略退避重试；响应开始写出后不再重试</li>
 *     <li>超时不重试，映射为 504；其余传输失败映射为 502</li>
 * </ul>
 *
 * @author Gateway Team
 * @version 1.0.0
 */
public class HttpForwarder implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HttpForwarder.class);

    /**
     * 不转发的逐跳头（小写）
     */
    private static final Set<String> HOP_BY_HOP_HEADERS = Set.of(
            "connection", "keep-alive", "proxy-connection", "transfer-encoding",
            "te", "trailer", "upgrade", "proxy-authenticate", "proxy-authorization");

    public static final String X_REQUEST_ID = "X-Request-Id";

    private final LoadBalancer loadBalancer;

    private final ConnectionProvider plainProvider;
    private final ConnectionProvider secureProvider;
    private final HttpClient plainClient;
    private final HttpClient secureClient;

    public HttpForwarder(GatewayProperties.HandlerProperties config, LoadBalancer loadBalancer) {
        this.loadBalancer = loadBalancer;
        this.plainProvider = buildProvider("gateway-http", config);
        this.secureProvider = buildProvider("gateway-https", config);
        this.plainClient = buildClient(plainProvider, config);
        this.secureClient = buildClient(secureProvider, config).secure();

        log.info("HTTP 转发器初始化完成: maxConnections={}, pendingAcquireTimeout={}ms, maxIdleTime={}ms",
                config.getMaxConnections(), config.getPendingAcquireTimeoutMs(), config.getMaxIdleTimeMs());
    }

    private static ConnectionProvider buildProvider(String name, GatewayProperties.HandlerProperties config) {
        return ConnectionProvider.builder(name)
                .maxConnections(config.getMaxConnections())
                .pendingAcquireTimeout(Duration.ofMillis(config.getPendingAcquireTimeoutMs()))
                .maxIdleTime(Duration.ofMillis(config.getMaxIdleTimeMs()))
                .build();
    }

    private static HttpClient buildClient(ConnectionProvider provider, GatewayProperties.HandlerProperties config) {
        return HttpClient.create(provider)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, config.getConnectTimeoutMs())
                // 重试只由路由的重试策略控制
                .disableRetry(true)
                .followRedirect(false);
    }

    /**
     * 转发请求
     * 上下文中必须已有匹配的路由；负载均衡路由在此选择实例，并在请求结束（包括取消）时释放
     *
     * @param context 请求上下文
     * @return 响应已流式写出时为空；失败时为 {@link GatewayException}
     */
    public Mono<GatewayResponse> forward(RequestContext context) {
        return Mono.defer(() -> {
            RouteDefinition route = context.getRouteDefinition();
            if (route == null) {
                return Mono.error(new IllegalStateException("No route bound to request " + context.getRequestId()));
            }

            if (!route.isLoadBalanced()) {
                return proxy(context, route, route.getTarget());
            }

            String service = route.getService();
            PoolInstance instance = loadBalancer.getNext(service, context);
            if (instance == null) {
                log.warn("[{}] 服务 {} 没有可用实例", context.getRequestId(), service);
                return Mono.error(new GatewayException(ErrorCode.SERVICE_UNAVAILABLE,
                        "No healthy instance available for service: " + service));
            }
            context.setSelectedInstance(instance);
            return proxy(context, route, instance.getUrl())
                    .doFinally(signal -> loadBalancer.release(instance));
        });
    }

    private Mono<GatewayResponse> proxy(RequestContext context, RouteDefinition route, String base) {
        String requestId = context.getRequestId();
        String targetUrl = buildTargetUrl(base, route, context);
        URI targetUri = URI.create(targetUrl);
        HttpClient client = "https".equalsIgnoreCase(targetUri.getScheme()) ? secureClient : plainClient;
        HttpHeaders forwardHeaders = buildForwardHeaders(context, targetUri);
        HttpMethod method = HttpMethod.valueOf(context.getMethod());
        boolean hasBody = hasBody(context.getRequestHeaders());

        AtomicBoolean responseStarted = new AtomicBoolean();
        AtomicBoolean bodyConsumed = new AtomicBoolean();
        AtomicInteger attempts = new AtomicInteger();

        log.info("[{}] 转发请求: {} {} -> {}", requestId, context.getMethod(), context.getPath(), targetUrl);

        Mono<Void> exchange = Mono.defer(() -> {
            int attempt = attempts.incrementAndGet();
            HttpClient.RequestSender sender = client
                    .responseTimeout(route.getTimeout())
                    .headers(headers -> headers.set(forwardHeaders))
                    .request(method)
                    .uri(targetUrl);

            HttpClient.ResponseReceiver<?> receiver = sender;
            HttpServerRequest inbound = context.getRequest();
            if (hasBody && inbound != null) {
                receiver = sender.send(Flux.defer(() -> {
                    bodyConsumed.set(true);
                    return inbound.receive().retain();
                }));
            }

            return receiver
                    .response((response, body) -> {
                        responseStarted.set(true);
                        return writeResponse(context, response, body);
                    })
                    .then()
                    .doOnError(e -> log.warn("[{}] 第 {} 次转发失败: {} -> {}",
                            requestId, attempt, targetUrl, e.toString()));
        });

        RetryPolicy retry = route.getRetry();
        if (retry.isEnabled()) {
            exchange = exchange.retryWhen(Retry.backoff(retry.getAttempts(), retry.getDelay())
                    .jitter(0d)
                    .filter(e -> !responseStarted.get() && !bodyConsumed.get() && isRetriable(e))
                    .doBeforeRetry(signal -> log.info("[{}] {}ms 后重试第 {} 次: {}", requestId,
                            retry.backoff((int) signal.totalRetries()).toMillis(),
                            signal.totalRetries() + 1, targetUrl))
                    .onRetryExhaustedThrow((spec, signal) -> signal.failure()));
        }

        return exchange
                .onErrorMap(e -> !(e instanceof GatewayException), e -> toProxyException(requestId, targetUrl, e))
                .doOnSuccess(unused -> log.debug("[{}] 转发完成: status={}, attempts={}",
                        requestId, context.getResponseStatus(), attempts.get()))
                .then(Mono.empty());
    }

    /**
     * 将后端响应写回客户端
     */
    private Mono<Void> writeResponse(RequestContext context, HttpClientResponse response,
                                     ByteBufFlux body) {
        HttpServerResponse outbound = context.getResponse();
        context.setResponseStatus(response.status().code());
        if (outbound == null) {
            return body.then();
        }

        outbound.status(response.status());
        HttpHeaders target = outbound.responseHeaders();
        for (Map.Entry<String, String> entry : response.responseHeaders()) {
            if (!HOP_BY_HOP_HEADERS.contains(entry.getKey().toLowerCase())) {
                target.add(entry.getKey(), entry.getValue());
            }
        }
        for (Map.Entry<String, String> entry : context.getResponseHeaders()) {
            target.set(entry.getKey(), entry.getValue());
        }
        target.set(X_REQUEST_ID, context.getRequestId());

        return outbound.send(body.retain()).then();
    }

    /**
     * 构建转发请求头：去除逐跳头，Host 改为目标地址，追加 X-Forwarded-* 与请求 ID
     */
    HttpHeaders buildForwardHeaders(RequestContext context, URI targetUri) {
        HttpHeaders source = context.getRequestHeaders();
        HttpHeaders headers = new DefaultHttpHeaders();
        for (Map.Entry<String, String> entry : source) {
            String name = entry.getKey().toLowerCase();
            if (!HOP_BY_HOP_HEADERS.contains(name) && !"host".equals(name)) {
                headers.add(entry.getKey(), entry.getValue());
            }
        }

        headers.set(HttpHeaderNames.HOST, targetUri.getRawAuthority());
        headers.set("X-Forwarded-Proto", context.getScheme());
        String originalHost = source.get(HttpHeaderNames.HOST);
        if (originalHost != null) {
            headers.set("X-Forwarded-Host", originalHost);
        }

        String peer = null;
        HttpServerRequest inbound = context.getRequest();
        if (inbound != null) {
            peer = IpUtils.hostAddress(inbound.remoteAddress());
        }
        String forwardedFor = IpUtils.appendForwardedFor(source.get("X-Forwarded-For"),
                peer != null ? peer : context.getClientIp());
        if (forwardedFor != null) {
            headers.set("X-Forwarded-For", forwardedFor);
        }
        headers.set(X_REQUEST_ID, context.getRequestId());
        return headers;
    }

    /**
     * 计算目标地址：剥离路由的字面前缀，把剩余路径接到目标地址之后，保留查询串
     *
     * 例如路由 /api/users/:id 指向 http://users:3001/users，
     * 请求 /api/users/42?x=1 转发到 http://users:3001/users/42?x=1
     */
    static String buildTargetUrl(String base, RouteDefinition route, RequestContext context) {
        String path = Router.normalizePath(context.getPath());
        String prefix = route.getPattern().getLiteralPrefix();

        String remainder = path;
        if (!prefix.isEmpty() && path.startsWith(prefix)) {
            remainder = path.substring(prefix.length());
        }

        String root = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
        StringBuilder url = new StringBuilder(root);
        if (!remainder.isEmpty() && !"/".equals(remainder)) {
            if (!remainder.startsWith("/")) {
                url.append('/');
            }
            url.append(remainder);
        } else if (URI.create(root).getRawPath().isEmpty()) {
            url.append('/');
        }

        String query = context.getQueryString();
        if (query != null && !query.isEmpty()) {
            url.append('?').append(query);
        }
        return url.toString();
    }

    private static boolean hasBody(HttpHeaders headers) {
        String length = headers.get(HttpHeaderNames.CONTENT_LENGTH);
        if (length != null) {
            try {
                return Long.parseLong(length.trim()) > 0;
            } catch (NumberFormatException e) {
                return false;
            }
        }
        String encoding = headers.get(HttpHeaderNames.TRANSFER_ENCODING);
        return encoding != null && encoding.toLowerCase().contains("chunked");
    }

    /**
     * 只有连接或传输层失败可以重试；超时不重试
     */
    static boolean isRetriable(Throwable e) {
        return e instanceof IOException && !(e instanceof ConnectTimeoutException);
    }

    static boolean isTimeout(Throwable e) {
        return e instanceof ReadTimeoutException
                || e instanceof ConnectTimeoutException
                || e instanceof TimeoutException;
    }

    private static ProxyException toProxyException(String requestId, String targetUrl, Throwable e) {
        boolean timeout = isTimeout(e);
        log.warn("[{}] 后端请求{}: {} ({})", requestId, timeout ? "超时" : "失败", targetUrl, e.toString());
        return timeout ? ProxyException.timeout(e) : ProxyException.badGateway(e);
    }

    @Override
    public void close() {
        plainProvider.dispose();
        secureProvider.dispose();
        log.info("HTTP 转发器连接池已释放");
    }
}
