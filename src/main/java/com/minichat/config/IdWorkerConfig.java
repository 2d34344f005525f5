package com.minichat.config;

import com.baomidou.mybatisplus.core.incrementer.DefaultIdentifierGenerator;
import com.baomidou.mybatisplus.core.incrementer.IdentifierGenerator;
import com.baomidou.mybatisplus.core.toolkit.IdWorker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 消息 id 使用 MyBatis-Plus 的雪花算法。多实例部署时必须给每个实例不同的 workerId，
 * 否则同一毫秒内可能生成重复 id。
 *
 * <p>workerId 取值顺序：chat.id.worker-id；否则取 chat.instance-id 末尾的数字减一（chat-1 → 0）；都没有则用默认值。</p>
 */
@Slf4j
@Configuration
public class IdWorkerConfig {

    private final long datacenterId;
    private final long workerId;

    public IdWorkerConfig(
            @Value("${chat.id.datacenter-id:1}") long datacenterId,
            @Value("${chat.id.worker-id:-1}") long workerId,
            @Value("${chat.instance-id:}") String instanceId
    ) {
        this.datacenterId = to5Bits(datacenterId);
        this.workerId = workerId >= 0 ? to5Bits(workerId) : workerIdFromInstance(instanceId);
    }

    @Bean
    public IdentifierGenerator identifierGenerator() {
        if (workerId < 0) {
            log.info("IdWorker: keep default sequence (no chat.id.worker-id and no numeric instance id)");
            return DefaultIdentifierGenerator.getInstance();
        }
        IdWorker.initSequence(workerId, datacenterId);
        log.info("IdWorker: workerId={}, datacenterId={}", workerId, datacenterId);
        return new DefaultIdentifierGenerator(workerId, datacenterId);
    }

    static long workerIdFromInstance(String instanceId) {
        if (instanceId == null || instanceId.isBlank()) {
            return -1;
        }
        int end = instanceId.length();
        int start = end;
        while (start > 0 && Character.isDigit(instanceId.charAt(start - 1))) {
            start--;
        }
        if (start == end) {
            return -1;
        }
        try {
            return to5Bits(Long.parseLong(instanceId.substring(start, end)) - 1);
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    private static long to5Bits(long v) {
        long x = v % 32;
        return x < 0 ? x + 32 : x;
    }
}
