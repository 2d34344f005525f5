package com.minichat.gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Netty WebSocket 网关。
 *
 * @param maxInboundPending 单连接排队未处理的入站帧上限，超过直接回错误帧
 */
@ConfigurationProperties(prefix = "chat.gateway.ws")
public record GatewayProperties(
        Boolean enabled,
        String host,
        Integer port,
        String path,
        Integer maxFrameBytes,
        Integer maxInboundPending
) {

    public String hostEffective() {
        return host == null || host.isBlank() ? "0.0.0.0" : host;
    }

    public int portEffective() {
        return port == null ? 8001 : port;
    }

    public String pathEffective() {
        return path == null || path.isBlank() ? "/ws" : path;
    }

    public int maxFrameBytesEffective() {
        return maxFrameBytes == null ? 65536 : Math.max(1024, maxFrameBytes);
    }

    public int maxInboundPendingEffective() {
        return maxInboundPending == null ? 64 : Math.max(1, maxInboundPending);
    }
}
