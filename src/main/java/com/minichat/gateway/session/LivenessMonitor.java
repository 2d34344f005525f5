package com.minichat.gateway.session;

import com.minichat.gateway.config.LivenessProperties;
import com.minichat.gateway.ws.WsFrame;
import com.minichat.gateway.ws.WsWriter;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiConsumer;

/**
 * 连接保活：每条连接一个可取消的定时任务，周期性下发 ping 并检查最近活跃时间。
 *
 * <p>超时判定只看最近一次入站帧（任意类型都算），pong 只是其中一种。
 * 探测写失败或通道已关闭时立即剔除，不等下一轮。</p>
 *
 * <p>剔除动作交给 {@link #onEvict} 注册的回调（通常是 {@link ConnectionRegistry}），
 * 本类只负责判定。</p>
 */
@Slf4j
@Component
public class LivenessMonitor implements SmartLifecycle {

    public static final String REASON_TIMEOUT = "liveness_timeout";
    public static final String REASON_PROBE_FAILED = "probe_failed";

    enum CheckResult {
        PROBED,
        STALE,
        PROBE_FAILED,
        UNTRACKED
    }

    private record Tracked(ClientConnection conn, ScheduledFuture<?> task) {
    }

    private final LivenessProperties props;
    private final WsWriter wsWriter;
    private final Clock clock;

    private final ConcurrentHashMap<String, Tracked> tracked = new ConcurrentHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile ScheduledThreadPoolExecutor scheduler;
    private volatile BiConsumer<ClientConnection, String> evictHandler = (conn, reason) -> conn.getChannel().close();

    public LivenessMonitor(LivenessProperties props, WsWriter wsWriter, Clock clock) {
        this.props = props;
        this.wsWriter = wsWriter;
        this.clock = clock;
    }

    public void onEvict(BiConsumer<ClientConnection, String> handler) {
        if (handler != null) {
            this.evictHandler = handler;
        }
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        AtomicInteger seq = new AtomicInteger();
        ScheduledThreadPoolExecutor s = new ScheduledThreadPoolExecutor(props.schedulerThreadsEffective(), r -> {
            Thread t = new Thread(r, "chat-liveness-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        s.setRemoveOnCancelPolicy(true);
        this.scheduler = s;
        log.info("liveness monitor started: probeInterval={}, staleAfter={}",
                props.probeIntervalEffective(), props.staleAfterEffective());
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        for (Tracked t : tracked.values()) {
            t.task().cancel(false);
        }
        tracked.clear();
        ScheduledThreadPoolExecutor s = this.scheduler;
        this.scheduler = null;
        if (s != null) {
            s.shutdownNow();
        }
        log.info("liveness monitor stopped");
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        // 早于 WS server 启动、晚于它停止
        return Integer.MIN_VALUE;
    }

    /**
     * 开始跟踪一条连接；同一连接重复调用会替换旧任务。
     */
    public void trackConnection(ClientConnection conn) {
        ScheduledThreadPoolExecutor s = this.scheduler;
        if (!running.get() || s == null) {
            log.warn("liveness monitor not running, connection untracked: key={}", conn.key());
            return;
        }
        long intervalMs = props.probeIntervalEffective().toMillis();
        tracked.compute(conn.key(), (k, prev) -> {
            if (prev != null) {
                prev.task().cancel(false);
            }
            ScheduledFuture<?> task = s.scheduleWithFixedDelay(() -> safeCheck(conn),
                    intervalMs, intervalMs, TimeUnit.MILLISECONDS);
            return new Tracked(conn, task);
        });
    }

    /**
     * 停止跟踪；未跟踪的连接返回 false。
     */
    public boolean untrackConnection(ClientConnection conn) {
        Tracked t = tracked.remove(conn.key());
        if (t == null) {
            return false;
        }
        t.task().cancel(false);
        return true;
    }

    public boolean isTracked(ClientConnection conn) {
        return tracked.containsKey(conn.key());
    }

    public void recordActivity(ClientConnection conn) {
        conn.touch(clock.instant());
    }

    public void recordProbeAck(ClientConnection conn) {
        conn.ackProbe(clock.instant());
    }

    public boolean isHealthy(ClientConnection conn) {
        Duration idle = Duration.between(conn.getLastActivityAt(), clock.instant());
        return idle.compareTo(props.staleAfterEffective()) < 0;
    }

    public List<ConnectionStats> connectionStats(String username) {
        Instant now = clock.instant();
        List<ConnectionStats> out = new ArrayList<>();
        for (Map.Entry<String, Tracked> e : tracked.entrySet()) {
            ClientConnection c = e.getValue().conn();
            if (username == null || username.equals(c.getUsername())) {
                out.add(ConnectionStats.of(c, now, isHealthy(c)));
            }
        }
        return out;
    }

    private void safeCheck(ClientConnection conn) {
        try {
            checkConnection(conn);
        } catch (Exception e) {
            log.warn("liveness check failed: key={}, err={}", conn.key(), e.toString());
        }
    }

    /**
     * 单轮检查：先看是否超时，没超时再发 ping。
     */
    CheckResult checkConnection(ClientConnection conn) {
        if (!tracked.containsKey(conn.key())) {
            return CheckResult.UNTRACKED;
        }
        Duration idle = Duration.between(conn.getLastActivityAt(), clock.instant());
        if (idle.compareTo(props.staleAfterEffective()) > 0) {
            log.info("connection stale, disconnecting: key={}, idleMs={}", conn.key(), idle.toMillis());
            forceDisconnect(conn, REASON_TIMEOUT);
            return CheckResult.STALE;
        }
        return sendProbe(conn) ? CheckResult.PROBED : CheckResult.PROBE_FAILED;
    }

    boolean sendProbe(ClientConnection conn) {
        Channel ch = conn.getChannel();
        if (ch == null || !ch.isActive()) {
            forceDisconnect(conn, REASON_PROBE_FAILED);
            return false;
        }
        ChannelFuture f = wsWriter.write(ch, WsFrame.ping(clock.instant().toString()));
        f.addListener(done -> {
            if (!done.isSuccess()) {
                log.debug("ping write failed: key={}, cause={}", conn.key(), String.valueOf(done.cause()));
                forceDisconnect(conn, REASON_PROBE_FAILED);
            }
        });
        return true;
    }

    void forceDisconnect(ClientConnection conn, String reason) {
        if (!untrackConnection(conn)) {
            return;
        }
        try {
            evictHandler.accept(conn, reason);
        } catch (Exception e) {
            log.warn("evict handler failed: key={}, reason={}, err={}", conn.key(), reason, e.toString());
        }
    }
}
