package com.minichat.gateway.session;

import io.netty.channel.Channel;
import io.netty.util.AttributeKey;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import com.minichat.domain.entity.UserEntity;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 本机在线连接表：username -> (connectionId -> 连接)。
 *
 * <p>只维护本进程的连接。多实例时由 pub/sub 镜像把消息扇出到其它实例，本类不感知。</p>
 */
@Slf4j
@Component
public class ConnectionRegistry {

    public static final AttributeKey<ClientConnection> ATTR_CONNECTION = AttributeKey.valueOf("chat:connection");

    private final ConcurrentHashMap<String, ConcurrentHashMap<String, ClientConnection>> userConnections = new ConcurrentHashMap<>();

    private final LivenessMonitor livenessMonitor;
    private final Clock clock;

    public ConnectionRegistry(LivenessMonitor livenessMonitor, Clock clock) {
        this.livenessMonitor = livenessMonitor;
        this.clock = clock;
        livenessMonitor.onEvict(this::evict);
    }

    /**
     * 登记一条已鉴权连接并交给保活监控。
     */
    public ClientConnection connect(UserEntity identity, Channel ch) {
        ClientConnection conn = new ClientConnection(identity, ch, clock.instant());
        userConnections.compute(identity.getUsername(), (k, map) -> {
            ConcurrentHashMap<String, ClientConnection> m = map == null ? new ConcurrentHashMap<>() : map;
            m.put(conn.getConnectionId(), conn);
            return m;
        });
        ch.attr(ATTR_CONNECTION).set(conn);
        livenessMonitor.trackConnection(conn);
        log.info("ws connected: username={}, connectionId={}, total={}",
                conn.getUsername(), conn.getConnectionId(), connections(conn.getUsername()).size());
        return conn;
    }

    /**
     * 移除 (username, channel) 对应的连接；不存在时什么也不做，返回 false。
     */
    public boolean disconnect(String username, Channel ch) {
        if (username == null || ch == null) {
            return false;
        }
        List<ClientConnection> removed = new ArrayList<>();
        userConnections.computeIfPresent(username, (k, map) -> {
            map.values().removeIf(c -> {
                if (c.getChannel() == ch) {
                    removed.add(c);
                    return true;
                }
                return false;
            });
            return map.isEmpty() ? null : map;
        });
        if (removed.isEmpty()) {
            return false;
        }
        for (ClientConnection c : removed) {
            livenessMonitor.untrackConnection(c);
            log.info("ws disconnected: username={}, connectionId={}", username, c.getConnectionId());
        }
        return true;
    }

    public boolean disconnect(ClientConnection conn) {
        return conn != null && disconnect(conn.getUsername(), conn.getChannel());
    }

    /**
     * 强制剔除：先摘表，再关通道。
     */
    public void evict(ClientConnection conn, String reason) {
        disconnect(conn);
        Channel ch = conn.getChannel();
        if (ch != null && ch.isOpen()) {
            ch.close();
        }
        log.info("ws evicted: username={}, connectionId={}, reason={}", conn.getUsername(), conn.getConnectionId(), reason);
    }

    public ClientConnection find(Channel ch) {
        return ch == null ? null : ch.attr(ATTR_CONNECTION).get();
    }

    public List<ClientConnection> connections(String username) {
        Map<String, ClientConnection> map = username == null ? null : userConnections.get(username);
        if (map == null || map.isEmpty()) {
            return Collections.emptyList();
        }
        return new ArrayList<>(map.values());
    }

    public boolean isOnline(String username) {
        return !connections(username).isEmpty();
    }

    /**
     * 至少有一条连接在 staleAfter 内有过活动。
     */
    public boolean isHealthy(String username) {
        for (ClientConnection c : connections(username)) {
            if (livenessMonitor.isHealthy(c)) {
                return true;
            }
        }
        return false;
    }

    public List<String> listOnlineUsernames() {
        List<String> out = new ArrayList<>();
        for (Map.Entry<String, ConcurrentHashMap<String, ClientConnection>> e : userConnections.entrySet()) {
            if (!e.getValue().isEmpty()) {
                out.add(e.getKey());
            }
        }
        Collections.sort(out);
        return out;
    }

    public Collection<ClientConnection> allConnections() {
        List<ClientConnection> all = new ArrayList<>();
        for (Map<String, ClientConnection> map : userConnections.values()) {
            all.addAll(map.values());
        }
        return all;
    }

    public int totalConnections() {
        int n = 0;
        for (Map<String, ClientConnection> map : userConnections.values()) {
            n += map.size();
        }
        return n;
    }
}
