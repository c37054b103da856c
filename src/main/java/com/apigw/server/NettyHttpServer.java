package com.apigw.server;

import com.apigw.config.GatewayProperties;
import com.apigw.event.GatewayEventPublisher;
import com.apigw.filter.GatewayFilter;
import com.apigw.model.RouteConfig;
import com.apigw.model.RouteDefinition;
import com.apigw.router.HttpForwarder;
import com.apigw.router.Router;
import io.netty.channel.ChannelOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.netty.DisposableServer;
import reactor.netty.http.Http11SslContextSpec;
import reactor.netty.http.server.HttpServer;

import java.io.File;
import java.lang.management.ManagementFactory;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Netty HTTP 服务器
 * 网关的核心入口点：持有监听端口、过滤器列表与路由器，并管理启动与停止
 *
 * 同一实例只监听 HTTP 或 HTTPS 其中之一。停止时不再接受新连接，
 * 监听端口完全关闭后才发出 stopped 事件，且只发出一次。
 *
 * @author Gateway Team
 * @version 1.0.0
 */
public class NettyHttpServer {

    private static final Logger log = LoggerFactory.getLogger(NettyHttpServer.class);

    private static final Duration BIND_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);

    private final GatewayProperties.ServerProperties properties;
    private final Router router;
    private final GatewayEventPublisher eventPublisher;

    private final List<GatewayFilter> filters = new CopyOnWriteArrayList<>();
    private final HttpRequestHandler requestHandler;

    private final AtomicBoolean stopped = new AtomicBoolean();

    private volatile DisposableServer server;
    private volatile Instant startedAt;

    public NettyHttpServer(GatewayProperties.ServerProperties properties, Router router,
                           HttpForwarder httpForwarder, GatewayEventPublisher eventPublisher) {
        this.properties = properties;
        this.router = router;
        this.eventPublisher = eventPublisher;
        this.requestHandler = new HttpRequestHandler(filters, router, httpForwarder, eventPublisher,
                properties.getHealthPath(), this::getHealth);
    }

    /**
     * 注册过滤器，按注册顺序执行
     *
     * @param filter 过滤器
     * @return this
     */
    public NettyHttpServer use(GatewayFilter filter) {
        filters.add(filter);
        log.info("注册过滤器: {} (order={}, enabled={})", filter.getName(), filter.getOrder(), filter.isEnabled());
        return this;
    }

    /**
     * 注册路由
     *
     * @param path   路径模式
     * @param config 路由参数
     * @return 路由定义
     */
    public RouteDefinition route(String path, RouteConfig config) {
        return router.addRoute(path, config);
    }

    /**
     * 启动服务器（不阻塞）
     */
    public synchronized void start() {
        if (isRunning()) {
            throw new IllegalStateException("Gateway server is already running on port " + getPort());
        }

        log.info("正在启动 Netty HTTP 服务器...");
        HttpServer httpServer = HttpServer.create()
                .host(properties.getHost())
                .port(properties.getPort())
                // 配置 TCP 选项
                .option(ChannelOption.SO_BACKLOG, 1024)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childOption(ChannelOption.TCP_NODELAY, true)
                // 透传后端响应，不做二次压缩
                .compress(false)
                .accessLog(true)
                .handle(requestHandler);

        GatewayProperties.SslProperties ssl = properties.getSsl();
        if (ssl.isEnabled()) {
            Http11SslContextSpec sslContextSpec = Http11SslContextSpec.forServer(
                    new File(ssl.getCertificate()), new File(ssl.getPrivateKey()));
            httpServer = httpServer.secure(spec -> spec.sslContext(sslContextSpec));
        }

        try {
            this.server = httpServer.bindNow(BIND_TIMEOUT);
        } catch (Exception e) {
            log.error("Netty HTTP 服务器启动失败: {}", e.getMessage(), e);
            throw new IllegalStateException("Failed to start gateway server", e);
        }

        stopped.set(false);
        startedAt = Instant.now();
        server.onDispose().doFinally(signal -> fireStopped()).subscribe();

        log.info("========================================");
        log.info("  Gateway 启动成功!");
        log.info("  监听地址: {}://{}:{}", ssl.isEnabled() ? "https" : "http", properties.getHost(), server.port());
        log.info("  路由数量: {}, 过滤器数量: {}", router.size(), filters.size());
        log.info("========================================");

        eventPublisher.publishStarted(server.port());
    }

    /**
     * 阻塞当前线程直到服务器关闭
     */
    public void awaitShutdown() {
        DisposableServer current = server;
        if (current != null) {
            current.onDispose().block();
        }
    }

    /**
     * 停止服务器
     * 停止接受新连接，不强制中断进行中的请求
     */
    public synchronized void stop() {
        DisposableServer current = server;
        if (current == null) {
            return;
        }
        if (!current.isDisposed()) {
            log.info("正在停止 Netty HTTP 服务器...");
            try {
                current.disposeNow(SHUTDOWN_TIMEOUT);
            } catch (Exception e) {
                log.error("停止 Netty HTTP 服务器时发生错误: {}", e.getMessage(), e);
            }
        }
        fireStopped();
    }

    private void fireStopped() {
        if (stopped.compareAndSet(false, true)) {
            log.info("Netty HTTP 服务器已停止");
            eventPublisher.publishStopped();
        }
    }

    /**
     * 健康信息：运行时长、路由与过滤器数量、进程资源使用
     */
    public GatewayHealth getHealth() {
        Runtime runtime = Runtime.getRuntime();
        Instant started = startedAt;
        return GatewayHealth.builder()
                .status(isRunning() ? "UP" : "DOWN")
                .uptimeMs(started != null ? Duration.between(started, Instant.now()).toMillis() : 0)
                .routes(router.size())
                .middlewares(filters.size())
                .heapUsed(runtime.totalMemory() - runtime.freeMemory())
                .heapMax(runtime.maxMemory())
                .processors(runtime.availableProcessors())
                .threads(ManagementFactory.getThreadMXBean().getThreadCount())
                .timestamp(Instant.now().toString())
                .build();
    }

    /**
     * 检查服务器是否运行中
     *
     * @return 是否运行中
     */
    public boolean isRunning() {
        DisposableServer current = server;
        return current != null && !current.isDisposed();
    }

    /**
     * 获取服务器端口
     *
     * @return 端口号，未启动时为 -1
     */
    public int getPort() {
        DisposableServer current = server;
        return current != null ? current.port() : -1;
    }

    public List<GatewayFilter> getFilters() {
        return List.copyOf(filters);
    }
}
