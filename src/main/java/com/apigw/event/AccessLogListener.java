package com.apigw.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * 访问日志
 * 每个完成的请求输出一行：2xx/3xx 为 INFO，4xx 为 WARN，5xx 为 ERROR
 *
 * @author Gateway Team
 * @version 1.0.0
 */
public class AccessLogListener implements GatewayEventListener {

    private static final Logger log = LoggerFactory.getLogger("ACCESS_LOG");

    private static final Set<String> SENSITIVE_HEADERS = Set.of("authorization", "cookie", "x-api-key");

    static final String MASK = "***";

    private final Set<String> excludePaths;

    public AccessLogListener(Collection<String> excludePaths) {
        this.excludePaths = excludePaths != null ? Set.copyOf(excludePaths) : Set.of();
    }

    @Override
    public void onRequestCompleted(RequestCompletedEvent event) {
        if (excludePaths.contains(event.getPath())) {
            return;
        }

        String line = format(event);
        int status = event.getStatus();
        if (status >= 500 || status == 0) {
            log.error(line);
        } else if (status >= 400) {
            log.warn(line);
        } else {
            log.info(line);
        }
    }

    @Override
    public void onError(String requestId, Throwable error) {
        log.error("[{}] 请求处理异常: {}", requestId, error.toString());
    }

    String format(RequestCompletedEvent event) {
        return String.format("[%s] %s %s %d %dms ip=%s route=%s instance=%s headers=%s",
                event.getRequestId(),
                event.getMethod(),
                event.getPath(),
                event.getStatus(),
                event.getDuration().toMillis(),
                event.getClientIp(),
                event.getRoute() != null ? event.getRoute() : "-",
                event.getInstance() != null ? event.getInstance() : "-",
                sanitize(event.getRequestHeaders()));
    }

    /**
     * 脱敏请求头
     */
    static Map<String, String> sanitize(Map<String, String> headers) {
        Map<String, String> sanitized = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers == null) {
            return sanitized;
        }
        headers.forEach((name, value) ->
                sanitized.put(name, SENSITIVE_HEADERS.contains(name.toLowerCase()) ? MASK : value));
        return sanitized;
    }
}
