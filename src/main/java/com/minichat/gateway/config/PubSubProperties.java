package com.minichat.gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 外部 pub/sub 镜像（Redis）。默认关闭。
 */
@ConfigurationProperties(prefix = "chat.pubsub")
public record PubSubProperties(
        Boolean enabled,
        String roomChannel,
        String userChannelPrefix
) {

    public boolean enabledEffective() {
        return Boolean.TRUE.equals(enabled);
    }

    public String roomChannelEffective() {
        return roomChannel == null || roomChannel.isBlank() ? "room:main" : roomChannel;
    }

    public String userChannel(String username) {
        String prefix = userChannelPrefix == null || userChannelPrefix.isBlank() ? "user:" : userChannelPrefix;
        return prefix + username;
    }
}
