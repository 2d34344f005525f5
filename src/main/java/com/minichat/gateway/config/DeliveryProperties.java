package com.minichat.gateway.config;

import com.minichat.delivery.WebhookPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * @param pushTimeout   单条连接推送的最长等待时间，超时视为连接已坏，直接断开
 * @param webhookPolicy webhook 与在线推送的关系，默认两者都尝试
 */
@ConfigurationProperties(prefix = "chat.delivery")
public record DeliveryProperties(
        Duration pushTimeout,
        WebhookPolicy webhookPolicy
) {

    public Duration pushTimeoutEffective() {
        return pushTimeout == null || pushTimeout.isZero() || pushTimeout.isNegative()
                ? Duration.ofSeconds(5) : pushTimeout;
    }

    public WebhookPolicy webhookPolicyEffective() {
        return webhookPolicy == null ? WebhookPolicy.ALWAYS : webhookPolicy;
    }
}
