package com.minichat.domain.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 消息存储配置。
 *
 * @param historyLimit 保留的消息条数上限，超过后按时间裁掉最老的（连同它们的已读回执）
 */
@ConfigurationProperties(prefix = "chat.store")
public record ChatStoreProperties(Integer historyLimit) {

    public int historyLimitEffective() {
        return historyLimit == null ? 100 : Math.max(1, historyLimit);
    }
}
