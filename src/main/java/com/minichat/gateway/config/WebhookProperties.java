package com.minichat.gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * @param timeout     单次 POST 的超时，默认 10s
 * @param maxRetries  总尝试次数，默认 3
 * @param backoffBase 退避基数，第 i 次失败后等待 base * 2^i，默认 1s
 * @param ioThreads   HttpClient 使用的线程数
 */
@ConfigurationProperties(prefix = "chat.webhook")
public record WebhookProperties(
        Duration timeout,
        Integer maxRetries,
        Duration backoffBase,
        Integer ioThreads
) {

    public Duration timeoutEffective() {
        return timeout == null || timeout.isZero() || timeout.isNegative() ? Duration.ofSeconds(10) : timeout;
    }

    public int maxRetriesEffective() {
        return maxRetries == null ? 3 : Math.max(1, maxRetries);
    }

    public Duration backoffBaseEffective() {
        return backoffBase == null || backoffBase.isNegative() ? Duration.ofSeconds(1) : backoffBase;
    }

    public int ioThreadsEffective() {
        return ioThreads == null ? 4 : Math.max(1, ioThreads);
    }
}
