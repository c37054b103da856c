package com.apigw.util;

import java.net.InetSocketAddress;

/**
 * 客户端地址工具类
 *
 * @author Gateway Team
 * @version 1.0.0
 */
public final class IpUtils {

    public static final String UNKNOWN = "unknown";

    private IpUtils() {
        // 工具类禁止实例化
    }

    /**
     * 获取客户端真实 IP
     * 优先级：X-Forwarded-For 首个有效地址 > X-Real-IP > 套接字远端地址
     *
     * @param xForwardedFor X-Forwarded-For 头
     * @param xRealIp       X-Real-IP 头
     * @param remoteAddress 套接字远端地址
     * @return 客户端 IP
     */
    public static String getRealIp(String xForwardedFor, String xRealIp, String remoteAddress) {
        if (xForwardedFor != null && !xForwardedFor.isEmpty()) {
            for (String ip : xForwardedFor.split(",")) {
                ip = ip.trim();
                if (!ip.isEmpty() && !UNKNOWN.equalsIgnoreCase(ip)) {
                    return ip;
                }
            }
        }

        if (xRealIp != null && !xRealIp.isEmpty() && !UNKNOWN.equalsIgnoreCase(xRealIp)) {
            return xRealIp.trim();
        }

        return remoteAddress != null ? remoteAddress : UNKNOWN;
    }

    /**
     * 提取套接字地址中的主机地址
     *
     * @param address 套接字地址，可以为空
     * @return 主机地址，无法解析时返回 null
     */
    public static String hostAddress(InetSocketAddress address) {
        if (address == null) {
            return null;
        }
        if (address.getAddress() != null) {
            return address.getAddress().getHostAddress();
        }
        return address.getHostString();
    }

    /**
     * 追加 X-Forwarded-For 链
     *
     * @param existing 原有的 X-Forwarded-For 值
     * @param clientIp 本跳看到的客户端地址
     * @return 新的 X-Forwarded-For 值
     */
    public static String appendForwardedFor(String existing, String clientIp) {
        if (clientIp == null || clientIp.isEmpty()) {
            return existing;
        }
        if (existing == null || existing.isEmpty()) {
            return clientIp;
        }
        return existing + ", " + clientIp;
    }
}
