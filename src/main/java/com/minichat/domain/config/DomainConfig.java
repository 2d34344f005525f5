package com.minichat.domain.config;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * 存储层装配：mapper 扫描 + 保留上限配置。
 */
@Configuration
@MapperScan("com.minichat.domain.mapper")
@EnableConfigurationProperties(ChatStoreProperties.class)
public class DomainConfig {
}
