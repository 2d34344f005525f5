package com.minichat.gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 心跳配置。
 *
 * <ul>
 *   <li>probeInterval：每条连接发 ping 的间隔，默认 30s</li>
 *   <li>staleAfter：超过这么久没有任何入站帧就断开，默认 90s（约 3 次 ping 没回应）</li>
 *   <li>ackWait：pong 等待时间，默认 10s。目前超时判定只看 staleAfter，这个值没有被使用</li>
 *   <li>schedulerThreads：心跳调度线程数</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "chat.liveness")
public record LivenessProperties(
        Duration probeInterval,
        Duration staleAfter,
        Duration ackWait,
        Integer schedulerThreads
) {

    public Duration probeIntervalEffective() {
        return positiveOr(probeInterval, Duration.ofSeconds(30));
    }

    public Duration staleAfterEffective() {
        return positiveOr(staleAfter, Duration.ofSeconds(90));
    }

    public Duration ackWaitEffective() {
        return positiveOr(ackWait, Duration.ofSeconds(10));
    }

    public int schedulerThreadsEffective() {
        return schedulerThreads == null ? 2 : Math.max(1, schedulerThreads);
    }

    private static Duration positiveOr(Duration v, Duration def) {
        return v == null || v.isZero() || v.isNegative() ? def : v;
    }
}
