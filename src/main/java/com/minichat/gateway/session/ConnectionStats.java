package com.minichat.gateway.session;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;

/**
 * 单条连接的心跳状态，用于管理接口展示。
 */
public record ConnectionStats(
        String username,
        @JsonProperty("connection_id") String connectionId,
        @JsonProperty("connected_at") String connectedAt,
        @JsonProperty("last_activity") String lastActivity,
        @JsonProperty("last_pong") String lastPong,
        @JsonProperty("seconds_since_activity") long secondsSinceActivity,
        @JsonProperty("seconds_since_pong") long secondsSincePong,
        @JsonProperty("is_healthy") boolean healthy
) {

    static ConnectionStats of(ClientConnection c, Instant now, boolean healthy) {
        return new ConnectionStats(
                c.getUsername(),
                c.getConnectionId(),
                c.getConnectedAt().toString(),
                c.getLastActivityAt().toString(),
                c.getLastProbeAckAt().toString(),
                Duration.between(c.getLastActivityAt(), now).getSeconds(),
                Duration.between(c.getLastProbeAckAt(), now).getSeconds(),
                healthy);
    }
}
