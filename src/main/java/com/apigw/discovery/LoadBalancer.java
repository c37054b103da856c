package com.apigw.discovery;

import com.apigw.model.RequestContext;
import com.apigw.util.IpUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 负载均衡器
 * 按服务名维护实例池，在健康实例中按配置的算法选择目标
 *
 * 选中实例时连接数加一，调用方在请求结束时必须调用 {@link #release(PoolInstance)}。
 *
 * @author Gateway Team
 * @version 1.0.0
 */
public class LoadBalancer {

    private static final Logger log = LoggerFactory.getLogger(LoadBalancer.class);

    private final LoadBalancingAlgorithm algorithm;

    private final Map<String, Pool> pools = new ConcurrentHashMap<>();

    public LoadBalancer(LoadBalancingAlgorithm algorithm) {
        this.algorithm = algorithm != null ? algorithm : LoadBalancingAlgorithm.ROUND_ROBIN;
        log.info("负载均衡器初始化完成，算法: {}", this.algorithm.getValue());
    }

    public LoadBalancingAlgorithm getAlgorithm() {
        return algorithm;
    }

    /**
     * 注册（或替换）服务实例池
     *
     * @param serviceName 服务名
     * @param instances   实例列表
     */
    public void register(String serviceName, List<ServiceInstance> instances) {
        List<PoolInstance> records = new ArrayList<>();
        for (ServiceInstance instance : instances) {
            PoolInstance record = PoolInstance.from(instance);
            record.setHealthy(instance.isHealthy());
            records.add(record);
        }
        pools.put(serviceName, new Pool(records));
        log.info("注册负载均衡池: service={}, instances={}", serviceName, records);
    }

    /**
     * 按地址注册服务实例池，权重均为 1
     */
    public void register(String serviceName, String... urls) {
        List<ServiceInstance> instances = new ArrayList<>();
        for (String url : urls) {
            instances.add(ServiceInstance.builder().url(url).build());
        }
        register(serviceName, instances);
    }

    /**
     * 选择下一个实例
     *
     * @param serviceName 服务名
     * @param context     请求上下文（ip-hash 使用客户端 IP），可以为空
     * @return 选中的实例，无健康实例时返回 null
     */
    public PoolInstance getNext(String serviceName, RequestContext context) {
        Pool pool = pools.get(serviceName);
        if (pool == null) {
            log.warn("负载均衡池不存在: {}", serviceName);
            return null;
        }

        List<PoolInstance> healthy = pool.healthyInstances();
        if (healthy.isEmpty()) {
            log.warn("服务 {} 没有健康实例", serviceName);
            return null;
        }

        PoolInstance selected;
        switch (algorithm) {
            case LEAST_CONNECTIONS:
                selected = leastConnections(healthy);
                break;
            case RANDOM:
                selected = random(healthy);
                break;
            case IP_HASH:
                selected = ipHash(healthy, context != null ? context.getClientIp() : null);
                break;
            case WEIGHTED:
                selected = weighted(healthy);
                break;
            case ROUND_ROBIN:
            default:
                selected = roundRobin(pool, healthy);
                break;
        }

        selected.acquire();
        log.debug("服务 {} 选中实例 {}，当前连接数 {}", serviceName, selected.getUrl(), selected.getConnections());
        return selected;
    }

    /**
     * 释放实例连接
     */
    public void release(String serviceName, String instanceUrl) {
        PoolInstance instance = find(serviceName, instanceUrl);
        if (instance != null) {
            instance.release();
        }
    }

    /**
     * 释放 {@link #getNext} 返回的实例
     * 直接作用于选中的实例记录，服务在请求期间被重新注册时不会影响新池的计数
     */
    public void release(PoolInstance instance) {
        if (instance != null) {
            instance.release();
        }
    }

    /**
     * 更新实例健康状态
     *
     * @return 实例是否存在
     */
    public boolean setHealth(String serviceName, String instanceUrl, boolean healthy) {
        PoolInstance instance = find(serviceName, instanceUrl);
        if (instance == null) {
            return false;
        }
        instance.setHealthy(healthy);
        log.info("负载均衡池 {} 中实例 {} 标记为{}", serviceName, instanceUrl, healthy ? "健康" : "不健康");
        return true;
    }

    public LoadBalancerStats getStats(String serviceName) {
        Pool pool = pools.get(serviceName);
        if (pool == null) {
            return null;
        }
        List<LoadBalancerStats.InstanceStats> stats = new ArrayList<>();
        int healthy = 0;
        int active = 0;
        for (PoolInstance instance : pool.instances) {
            if (instance.isHealthy()) {
                healthy++;
            }
            active += instance.getConnections();
            stats.add(new LoadBalancerStats.InstanceStats(instance.getUrl(), instance.isHealthy(),
                    instance.getConnections(), instance.getWeight(), instance.getLastUsed()));
        }
        return new LoadBalancerStats(serviceName, algorithm, pool.instances.size(), healthy, active, stats);
    }

    public List<LoadBalancerStats> getAllStats() {
        List<LoadBalancerStats> all = new ArrayList<>();
        for (String name : pools.keySet()) {
            LoadBalancerStats stats = getStats(name);
            if (stats != null) {
                all.add(stats);
            }
        }
        return all;
    }

    public boolean unregister(String serviceName) {
        boolean removed = pools.remove(serviceName) != null;
        if (removed) {
            log.info("移除负载均衡池: {}", serviceName);
        }
        return removed;
    }

    public void clear() {
        pools.clear();
    }

    private PoolInstance find(String serviceName, String instanceUrl) {
        Pool pool = pools.get(serviceName);
        if (pool == null) {
            return null;
        }
        for (PoolInstance instance : pool.instances) {
            if (instance.getUrl().equals(instanceUrl)) {
                return instance;
            }
        }
        return null;
    }

    // 游标按服务持久化，健康子集大小变化时不重置
    private PoolInstance roundRobin(Pool pool, List<PoolInstance> healthy) {
        int size = healthy.size();
        int index = pool.cursor.getAndUpdate(i -> (i + 1) % size);
        return healthy.get(index % size);
    }

    private PoolInstance leastConnections(List<PoolInstance> healthy) {
        PoolInstance best = healthy.get(0);
        for (PoolInstance instance : healthy) {
            if (instance.getConnections() < best.getConnections()) {
                best = instance;
            }
        }
        return best;
    }

    private PoolInstance random(List<PoolInstance> healthy) {
        return healthy.get(ThreadLocalRandom.current().nextInt(healthy.size()));
    }

    private PoolInstance ipHash(List<PoolInstance> healthy, String clientIp) {
        if (clientIp == null || clientIp.isEmpty() || IpUtils.UNKNOWN.equalsIgnoreCase(clientIp)) {
            return random(healthy);
        }
        int hash = 0;
        for (int i = 0; i < clientIp.length(); i++) {
            hash += clientIp.charAt(i);
        }
        return healthy.get(hash % healthy.size());
    }

    private PoolInstance weighted(List<PoolInstance> healthy) {
        int total = 0;
        for (PoolInstance instance : healthy) {
            total += instance.getWeight();
        }
        int point = ThreadLocalRandom.current().nextInt(total);
        for (PoolInstance instance : healthy) {
            point -= instance.getWeight();
            if (point < 0) {
                return instance;
            }
        }
        return healthy.get(healthy.size() - 1);
    }

    /**
     * 单个服务的实例池
     */
    private static final class Pool {

        private final List<PoolInstance> instances;

        private final AtomicInteger cursor = new AtomicInteger();

        private Pool(List<PoolInstance> instances) {
            this.instances = List.copyOf(instances);
        }

        private List<PoolInstance> healthyInstances() {
            List<PoolInstance> healthy = new ArrayList<>(instances.size());
            for (PoolInstance instance : instances) {
                if (instance.isHealthy()) {
                    healthy.add(instance);
                }
            }
            return healthy;
        }
    }
}
