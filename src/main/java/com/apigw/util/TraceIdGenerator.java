package com.apigw.util;

import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * 请求 ID 与实例 ID 生成器
 *
 * @author Gateway Team
 * @version 1.0.0
 */
public final class TraceIdGenerator {

    /**
     * 可接受的外部请求 ID：十六进制或 UUID 格式，16 到 64 位
     */
    private static final Pattern VALID_ID = Pattern.compile("^[a-fA-F0-9-]{16,64}$");

    /**
     * 高位存毫秒时间戳，低 16 位存毫秒内序号
     */
    private static final AtomicLong STATE = new AtomicLong();

    private static final long NODE_ID = ThreadLocalRandom.current().nextLong(0, 0xFFFF);

    private TraceIdGenerator() {
        // 工具类禁止实例化
    }

    /**
     * 生成请求 ID
     * 格式：时间戳(13位) + 节点标识(4位) + 序列号(4位) + 随机数(4位)
     *
     * @return 25 位十六进制字符串
     */
    public static String generate() {
        long now = System.currentTimeMillis();
        long next = STATE.updateAndGet(prev -> {
            long prevTime = prev >>> 16;
            return prevTime >= now ? prev + 1 : now << 16;
        });
        long timestamp = next >>> 16;
        long seq = next & 0xFFFF;
        int random = ThreadLocalRandom.current().nextInt(0, 0xFFFF);
        return String.format("%013x%04x%04x%04x", timestamp, NODE_ID, seq, random);
    }

    /**
     * 生成短 ID（UUID 去除横线），用于服务实例
     *
     * @return 32 位 ID
     */
    public static String generateShort() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    /**
     * 校验外部传入的请求 ID
     *
     * @param id 请求 ID
     * @return 是否有效
     */
    public static boolean isValid(String id) {
        return id != null && VALID_ID.matcher(id).matches();
    }
}
