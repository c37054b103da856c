package com.apigw.resilience;

import com.apigw.exception.CircuitOpenException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * 熔断器
 *
 * <ul>
 *     <li>CLOSED：监控窗口内失败次数达到阈值时打开</li>
 *     <li>OPEN：超时后的第一次准入检查转为半开（惰性转换，无定时器）</li>
 *     <li>HALF_OPEN：累计 ceil(threshold / 2) 次成功后关闭，任意一次失败立即重新打开</li>
 * </ul>
 *
 * 状态转换在实例锁内完成，监听器在锁外回调。
 *
 * @author Gateway Team
 * @version 1.0.0
 */
public class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String name;
    private final CircuitBreakerConfig config;
    private final Clock clock;

    private final List<CircuitStateListener> listeners = new CopyOnWriteArrayList<>();

    private CircuitState state = CircuitState.CLOSED;

    /**
     * 窗口内的失败时间戳，按时间升序
     */
    private final Deque<Instant> failures = new ArrayDeque<>();

    private int halfOpenSuccesses;

    private Instant lastFailureTime;

    private Instant nextAttemptTime;

    public CircuitBreaker(String name, CircuitBreakerConfig config) {
        this(name, config, Clock.systemUTC());
    }

    public CircuitBreaker(String name, CircuitBreakerConfig config, Clock clock) {
        if (config.getThreshold() < 1) {
            throw new IllegalArgumentException("Circuit breaker threshold must be at least 1");
        }
        this.name = name;
        this.config = config;
        this.clock = clock;
    }

    public String getName() {
        return name;
    }

    /**
     * 在熔断保护下执行操作
     * 不允许准入时不调用 supplier，直接返回 {@link CircuitOpenException}
     *
     * @param operation 受保护的操作
     * @return 操作结果
     */
    public <T> Mono<T> execute(Supplier<Mono<T>> operation) {
        return Mono.defer(() -> {
            if (!tryAcquire()) {
                return Mono.error(new CircuitOpenException(name, getRetryAfter()));
            }
            return operation.get()
                    .doOnSuccess(value -> recordSuccess())
                    .doOnError(e -> recordFailure());
        });
    }

    /**
     * 准入检查
     *
     * @return 是否允许通过
     */
    public boolean tryAcquire() {
        CircuitState from;
        synchronized (this) {
            if (state != CircuitState.OPEN) {
                return true;
            }
            if (clock.instant().isBefore(nextAttemptTime)) {
                return false;
            }
            from = state;
            state = CircuitState.HALF_OPEN;
            halfOpenSuccesses = 0;
        }
        onTransition(from, CircuitState.HALF_OPEN);
        return true;
    }

    public void recordSuccess() {
        CircuitState from = null;
        synchronized (this) {
            if (state == CircuitState.HALF_OPEN) {
                halfOpenSuccesses++;
                if (halfOpenSuccesses >= config.getHalfOpenSuccessThreshold()) {
                    from = state;
                    toClosed();
                }
            }
        }
        if (from != null) {
            onTransition(from, CircuitState.CLOSED);
        }
    }

    public void recordFailure() {
        CircuitState from = null;
        synchronized (this) {
            Instant now = clock.instant();
            lastFailureTime = now;
            if (state == CircuitState.HALF_OPEN) {
                from = state;
                toOpen(now);
            } else if (state == CircuitState.CLOSED) {
                failures.addLast(now);
                pruneFailures(now);
                if (failures.size() >= config.getThreshold()) {
                    from = state;
                    toOpen(now);
                }
            }
        }
        if (from != null) {
            onTransition(from, CircuitState.OPEN);
        }
    }

    /**
     * 手动打开熔断
     */
    public void open() {
        CircuitState from;
        synchronized (this) {
            from = state;
            toOpen(clock.instant());
        }
        if (from != CircuitState.OPEN) {
            onTransition(from, CircuitState.OPEN);
        }
    }

    /**
     * 手动关闭熔断
     */
    public void close() {
        CircuitState from;
        synchronized (this) {
            from = state;
            toClosed();
        }
        if (from != CircuitState.CLOSED) {
            onTransition(from, CircuitState.CLOSED);
        }
    }

    /**
     * 重置为初始状态，并清除最近失败时间
     */
    public void reset() {
        synchronized (this) {
            lastFailureTime = null;
        }
        close();
    }

    public synchronized CircuitState getState() {
        return state;
    }

    /**
     * 距离下一次允许试探的剩余时间，非打开状态返回零
     */
    public synchronized Duration getRetryAfter() {
        if (state != CircuitState.OPEN || nextAttemptTime == null) {
            return Duration.ZERO;
        }
        Duration remaining = Duration.between(clock.instant(), nextAttemptTime);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    public synchronized CircuitBreakerStats getStats() {
        pruneFailures(clock.instant());
        return new CircuitBreakerStats(name, state, failures.size(), halfOpenSuccesses,
                lastFailureTime, state == CircuitState.OPEN ? nextAttemptTime : null);
    }

    public void addListener(CircuitStateListener listener) {
        listeners.add(listener);
    }

    public void removeListener(CircuitStateListener listener) {
        listeners.remove(listener);
    }

    private void toOpen(Instant now) {
        state = CircuitState.OPEN;
        nextAttemptTime = now.plus(config.getTimeout());
        halfOpenSuccesses = 0;
    }

    private void toClosed() {
        state = CircuitState.CLOSED;
        failures.clear();
        halfOpenSuccesses = 0;
        nextAttemptTime = null;
    }

    private void pruneFailures(Instant now) {
        Instant cutoff = now.minus(config.getMonitoringPeriod());
        while (!failures.isEmpty() && !failures.peekFirst().isAfter(cutoff)) {
            failures.pollFirst();
        }
    }

    private void onTransition(CircuitState from, CircuitState to) {
        if (to == CircuitState.OPEN) {
            log.warn("熔断器 {} 状态变更: {} -> {}", name, from, to);
        } else {
            log.info("熔断器 {} 状态变更: {} -> {}", name, from, to);
        }
        for (CircuitStateListener listener : listeners) {
            try {
                listener.onStateChange(name, from, to);
            } catch (Exception e) {
                log.error("熔断器 {} 状态监听器执行失败", name, e);
            }
        }
    }
}
