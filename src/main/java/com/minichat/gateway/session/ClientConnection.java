package com.minichat.gateway.session;

import com.minichat.domain.entity.UserEntity;
import io.netty.channel.Channel;
import lombok.Getter;

import java.time.Instant;
import java.util.UUID;

/**
 * 一条已鉴权的 WS 连接。只存在内存里，进程重启即丢失。
 *
 * <p>同一个用户可以有多条连接，彼此独立：活跃时间各记各的，断开也只影响自己。</p>
 */
@Getter
public class ClientConnection {

    private final String connectionId;

    /** 建连时的身份快照。 */
    private final UserEntity identity;

    private final Channel channel;

    private final Instant connectedAt;

    /** 最近一次收到任意入站帧的时间，心跳超时只看它。 */
    private volatile Instant lastActivityAt;

    private volatile Instant lastProbeAckAt;

    public ClientConnection(UserEntity identity, Channel channel, Instant now) {
        this.connectionId = UUID.randomUUID().toString();
        this.identity = identity;
        this.channel = channel;
        this.connectedAt = now;
        this.lastActivityAt = now;
        this.lastProbeAckAt = now;
    }

    public String getUsername() {
        return identity.getUsername();
    }

    /** (identity, connection) 组成的唯一键。 */
    public String key() {
        return getUsername() + "/" + connectionId;
    }

    void touch(Instant now) {
        lastActivityAt = now;
    }

    void ackProbe(Instant now) {
        lastProbeAckAt = now;
        lastActivityAt = now;
    }
}
