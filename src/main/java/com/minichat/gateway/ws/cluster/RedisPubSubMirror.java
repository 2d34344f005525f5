package com.minichat.gateway.ws.cluster;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.minichat.delivery.PubSubMirror;
import com.minichat.domain.dto.MessageView;
import com.minichat.domain.entity.UserEntity;
import com.minichat.gateway.config.PubSubProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 把消息镜像到 Redis Pub/Sub：群聊发到 room 频道，私聊发到收件人的 user 频道。
 *
 * <p>订阅方（其它实例或外部推送服务）自行消费；这里只负责发布，不保证送达。</p>
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "chat.pubsub", name = "enabled", havingValue = "true")
public class RedisPubSubMirror implements PubSubMirror {

    /**
     * Redis 故障后的 fail-fast 窗口：窗口内直接跳过发布，不让每条消息都卡在 Redis 超时上。
     */
    static final long REDIS_FAIL_FAST_MS = 10_000;

    private final AtomicLong redisUnavailableUntilMs = new AtomicLong(0);

    private final StringRedisTemplate redis;
    private final ObjectMapper objectMapper;
    private final PubSubProperties props;
    private final Clock clock;

    public RedisPubSubMirror(StringRedisTemplate redis, ObjectMapper objectMapper, PubSubProperties props, Clock clock) {
        this.redis = redis;
        this.objectMapper = objectMapper;
        this.props = props;
        this.clock = clock;
    }

    @Override
    public boolean publishRoomMessage(MessageView view, UserEntity sender) {
        return publish(props.roomChannelEffective(), view);
    }

    @Override
    public boolean publishDirectMessage(MessageView view, UserEntity sender, UserEntity recipient) {
        if (recipient == null) {
            return false;
        }
        return publish(props.userChannel(recipient.getUsername()), view);
    }

    boolean publish(String channel, MessageView view) {
        if (view == null || shouldFailFast()) {
            return false;
        }
        try {
            String json = objectMapper.writeValueAsString(view);
            redis.convertAndSend(channel, json);
            return true;
        } catch (Exception e) {
            log.warn("pubsub publish failed: channel={}, messageId={}, err={}", channel, view.getId(), e.toString());
            markRedisDown();
            return false;
        }
    }

    private boolean shouldFailFast() {
        return clock.millis() < redisUnavailableUntilMs.get();
    }

    private void markRedisDown() {
        long until = clock.millis() + REDIS_FAIL_FAST_MS;
        redisUnavailableUntilMs.accumulateAndGet(until, Math::max);
    }
}
