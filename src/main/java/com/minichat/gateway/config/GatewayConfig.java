package com.minichat.gateway.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({
        GatewayProperties.class,
        LivenessProperties.class,
        DeliveryProperties.class,
        WebhookProperties.class,
        PubSubProperties.class
})
public class GatewayConfig {
}
