package com.minichat.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 投递编排线程池：查收件人、pub/sub 镜像发布等可能阻塞的步骤。
 */
@ConfigurationProperties(prefix = "chat.executors.delivery")
public record ChatDeliveryExecutorProperties(
        Integer corePoolSize,
        Integer maxPoolSize,
        Integer queueCapacity
) {

    public int corePoolSizeEffective() {
        return corePoolSize == null ? 4 : Math.max(1, corePoolSize);
    }

    public int maxPoolSizeEffective() {
        return maxPoolSize == null ? 16 : Math.max(1, maxPoolSize);
    }

    public int queueCapacityEffective() {
        return queueCapacity == null ? 10_000 : Math.max(0, queueCapacity);
    }
}
