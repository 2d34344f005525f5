package com.minichat.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.core.env.PropertySource;
import org.springframework.core.io.ClassPathResource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class ApplicationYamlParseTest {

    @Test
    void applicationYaml_ShouldBeParsable() throws Exception {
        var loader = new YamlPropertySourceLoader();
        List<PropertySource<?>> sources = loader.load("application", new ClassPathResource("application.yml"));
        assertNotNull(sources);
        assertFalse(sources.isEmpty());
    }

    @Test
    void applicationYaml_ShouldCarryLivenessAndWebhookDefaults() throws Exception {
        var loader = new YamlPropertySourceLoader();
        PropertySource<?> src = loader.load("application", new ClassPathResource("application.yml")).get(0);
        assertEquals("30s", String.valueOf(src.getProperty("chat.liveness.probe-interval")));
        assertEquals("90s", String.valueOf(src.getProperty("chat.liveness.stale-after")));
        assertEquals("3", String.valueOf(src.getProperty("chat.webhook.max-retries")));
        assertEquals("ALWAYS", String.valueOf(src.getProperty("chat.delivery.webhook-policy")));
    }
}
