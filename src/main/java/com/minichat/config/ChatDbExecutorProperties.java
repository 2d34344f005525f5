package com.minichat.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 阻塞 DB 操作专用线程池（WS 帧处理、握手鉴权查库都在这里跑，不占 Netty eventLoop）。
 */
@ConfigurationProperties(prefix = "chat.executors.db")
public record ChatDbExecutorProperties(
        Integer corePoolSize,
        Integer maxPoolSize,
        Integer queueCapacity,
        Duration taskTimeout
) {

    public int corePoolSizeEffective() {
        return corePoolSize == null ? 8 : Math.max(1, corePoolSize);
    }

    public int maxPoolSizeEffective() {
        return maxPoolSize == null ? 32 : Math.max(1, maxPoolSize);
    }

    public int queueCapacityEffective() {
        return queueCapacity == null ? 10_000 : Math.max(0, queueCapacity);
    }

    /** 单个 DB 任务的最长等待时间，超时后给客户端回错误帧。 */
    public Duration taskTimeoutEffective() {
        if (taskTimeout == null || taskTimeout.isNegative() || taskTimeout.isZero()) {
            return Duration.ofSeconds(3);
        }
        return taskTimeout;
    }
}
