package com.apigw;

import com.apigw.config.GatewayProperties;
import com.apigw.discovery.ServiceRegistry;
import com.apigw.filter.GatewayFilter;
import com.apigw.server.NettyHttpServer;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.Comparator;
import java.util.List;

/**
 * 网关启动类
 *
 * @author Gateway Team
 * @version 1.0.0
 */
@SpringBootApplication
@EnableConfigurationProperties(GatewayProperties.class)
public class GatewayApplication {

    private static final Logger log = LoggerFactory.getLogger(GatewayApplication.class);

    private NettyHttpServer nettyHttpServer;

    public static void main(String[] args) {
        SpringApplication.run(GatewayApplication.class, args);
    }

    /**
     * 注册静态服务、装配过滤器并启动 Netty HTTP 服务器
     */
    @Bean
    public CommandLineRunner startGateway(NettyHttpServer server, List<GatewayFilter> filters,
                                          ServiceRegistry serviceRegistry, GatewayProperties properties) {
        return args -> {
            for (GatewayProperties.ServiceProperties service : properties.getDiscovery().getServices()) {
                serviceRegistry.register(service.toServiceDefinition());
            }

            filters.stream()
                    .sorted(Comparator.comparingInt(GatewayFilter::getOrder))
                    .forEach(server::use);

            this.nettyHttpServer = server;
            server.start();

            // 阻塞主线程，保持服务器运行直到被关闭
            server.awaitShutdown();
        };
    }

    /**
     * 优雅关闭 Netty 服务器
     */
    @PreDestroy
    public void shutdown() {
        if (nettyHttpServer != null) {
            log.info("Shutting down gateway...");
            nettyHttpServer.stop();
        }
    }
}
