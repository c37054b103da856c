package com.apigw.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 固定窗口限流器
 *
 * 每个键维护一个计数桶：窗口过期后整体替换为新桶，而不是在旧桶上递增。
 * 窗口边界两侧的突发请求最多可以达到限额的两倍，这是固定窗口的已知限制。
 *
 * @author Gateway Team
 * @version 1.0.0
 */
public class FixedWindowRateLimiter implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(FixedWindowRateLimiter.class);

    private final int max;
    private final long windowMs;
    private final Clock clock;

    private final ConcurrentHashMap<String, Bucket> buckets = new ConcurrentHashMap<>();

    /**
     * 过期桶清理任务
     */
    private final Disposable sweeper;

    public FixedWindowRateLimiter(int max, Duration window) {
        this(max, window, Clock.systemUTC(), window);
    }

    /**
     * @param max           每个窗口允许的请求数
     * @param window        窗口长度
     * @param clock         时钟
     * @param sweepInterval 清理间隔，为空时不启动清理任务
     */
    public FixedWindowRateLimiter(int max, Duration window, Clock clock, Duration sweepInterval) {
        if (max < 1 || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("Rate limit max and window must be positive");
        }
        this.max = max;
        this.windowMs = window.toMillis();
        this.clock = clock;
        this.sweeper = sweepInterval != null
                ? Flux.interval(sweepInterval).onBackpressureDrop().subscribe(tick -> sweep())
                : null;
        log.info("初始化固定窗口限流器: max={}, window={}ms", max, windowMs);
    }

    /**
     * 准入检查，放行时计数加一
     * 同一键的建桶、重置与递增在 compute 内原子完成
     *
     * @param key 限流键
     * @return 检查结果
     */
    public RateLimitResult tryAcquire(String key) {
        RateLimitResult[] result = new RateLimitResult[1];
        buckets.compute(key, (k, bucket) -> {
            long now = clock.millis();
            if (bucket == null || now >= bucket.resetAt) {
                bucket = new Bucket(now + windowMs);
            }
            if (bucket.count < max) {
                bucket.count++;
                result[0] = new RateLimitResult(true, max, max - bucket.count, bucket.resetAt, Duration.ZERO);
            } else {
                result[0] = new RateLimitResult(false, max, 0, bucket.resetAt,
                        Duration.ofMillis(bucket.resetAt - now));
            }
            return bucket;
        });
        return result[0];
    }

    /**
     * 清理窗口已过期的桶
     * 逐键使用 computeIfPresent，与并发的准入检查互斥
     *
     * @return 清理数量
     */
    public int sweep() {
        int removed = 0;
        for (String key : buckets.keySet()) {
            boolean[] expired = new boolean[1];
            buckets.computeIfPresent(key, (k, bucket) -> {
                if (clock.millis() >= bucket.resetAt) {
                    expired[0] = true;
                    return null;
                }
                return bucket;
            });
            if (expired[0]) {
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("清理过期限流桶 {} 个，剩余 {} 个", removed, buckets.size());
        }
        return removed;
    }

    public void reset(String key) {
        buckets.remove(key);
    }

    public void resetAll() {
        buckets.clear();
    }

    /**
     * 获取键的当前计数，不消耗配额
     *
     * @return 快照，键不存在或窗口已过期时返回 null
     */
    public RateLimitStats getStats(String key) {
        Bucket bucket = buckets.get(key);
        if (bucket == null) {
            return null;
        }
        if (clock.millis() >= bucket.resetAt) {
            return null;
        }
        int count = bucket.count;
        return new RateLimitStats(key, count, max, Math.max(0, max - count), bucket.resetAt);
    }

    public int size() {
        return buckets.size();
    }

    public int getMax() {
        return max;
    }

    public Duration getWindow() {
        return Duration.ofMillis(windowMs);
    }

    @Override
    public void close() {
        if (sweeper != null) {
            sweeper.dispose();
        }
        buckets.clear();
    }

    /**
     * 计数桶，只在 compute 回调内修改
     */
    private static final class Bucket {

        private final long resetAt;

        private volatile int count;

        private Bucket(long resetAt) {
            this.resetAt = resetAt;
        }
    }
}
