package com.minichat.delivery;

import com.minichat.domain.dto.MessageView;
import com.minichat.domain.entity.UserEntity;
import com.minichat.domain.service.UserService;
import com.minichat.gateway.config.DeliveryProperties;
import com.minichat.gateway.session.ClientConnection;
import com.minichat.gateway.session.ConnectionRegistry;
import com.minichat.gateway.ws.WsFrame;
import com.minichat.gateway.ws.WsWriter;
import io.netty.channel.ChannelFuture;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

/**
 * 消息落库之后的扇出：在线推送、webhook、pub/sub 镜像三条通道互相独立。
 *
 * <ul>
 *   <li>群聊：推给除发送方以外的所有在线用户；webhook 发给除发送方以外登记了地址的非 viewer 用户；镜像发布一次</li>
 *   <li>私聊：推给收件人的所有连接；收件人有地址则发 webhook；镜像发布一次</li>
 * </ul>
 *
 * <p>单条连接推送超时或写失败即剔除该连接，不重试。返回的 future 只在所有通道都结束后完成，且永远不会异常完成。</p>
 */
@Slf4j
@Component
public class DeliveryRouter {

    static final String EVICT_REASON = "push_failed";

    private final ConnectionRegistry connectionRegistry;
    private final WsWriter wsWriter;
    private final WebhookDispatcher webhookDispatcher;
    private final UserService userService;
    private final Optional<PubSubMirror> pubSubMirror;
    private final DeliveryProperties props;
    private final Executor deliveryExecutor;

    public DeliveryRouter(ConnectionRegistry connectionRegistry,
                          WsWriter wsWriter,
                          WebhookDispatcher webhookDispatcher,
                          UserService userService,
                          Optional<PubSubMirror> pubSubMirror,
                          DeliveryProperties props,
                          @Qualifier("chatDeliveryExecutor") Executor deliveryExecutor) {
        this.connectionRegistry = connectionRegistry;
        this.wsWriter = wsWriter;
        this.webhookDispatcher = webhookDispatcher;
        this.userService = userService;
        this.pubSubMirror = pubSubMirror;
        this.props = props;
        this.deliveryExecutor = deliveryExecutor;
    }

    /**
     * recipient 为 null 表示群聊消息。
     */
    public CompletableFuture<Void> dispatch(MessageView view, UserEntity sender, UserEntity recipient) {
        CompletableFuture<Void> routed;
        try {
            routed = CompletableFuture
                    .supplyAsync(() -> recipient == null ? routeRoom(view, sender) : routeDirect(view, sender, recipient),
                            deliveryExecutor)
                    .thenCompose(f -> f);
        } catch (RejectedExecutionException e) {
            log.warn("delivery rejected: messageId={}, err={}", view.getId(), e.toString());
            return CompletableFuture.completedFuture(null);
        }
        return routed.handle((v, e) -> {
            if (e != null) {
                log.warn("delivery failed: messageId={}, err={}", view.getId(), unwrap(e).toString());
            }
            return null;
        });
    }

    /**
     * 回执通知：推给作者的所有在线连接，尽力而为。
     */
    public CompletableFuture<Void> notifyReadReceipt(String author, Long messageId, String readBy) {
        WsFrame frame = WsFrame.readReceipt(messageId, readBy);
        try {
            return CompletableFuture
                    .supplyAsync(() -> pushToUser(author, frame), deliveryExecutor)
                    .thenCompose(f -> f)
                    .handle((v, e) -> {
                        if (e != null) {
                            log.debug("read receipt notify failed: author={}, messageId={}, err={}",
                                    author, messageId, unwrap(e).toString());
                        }
                        return null;
                    });
        } catch (RejectedExecutionException e) {
            log.warn("read receipt notify rejected: author={}, messageId={}", author, messageId);
            return CompletableFuture.completedFuture(null);
        }
    }

    CompletableFuture<Void> routeRoom(MessageView view, UserEntity sender) {
        String senderName = sender.getUsername();
        WsFrame frame = WsFrame.message(view);
        List<CompletableFuture<?>> attempts = new ArrayList<>();

        for (String username : connectionRegistry.listOnlineUsernames()) {
            if (!username.equals(senderName)) {
                attempts.add(pushToUser(username, frame));
            }
        }

        List<UserEntity> webhookTargets = new ArrayList<>();
        try {
            for (UserEntity u : userService.listChatUsers()) {
                if (!u.getUsername().equals(senderName) && shouldWebhook(u)) {
                    webhookTargets.add(u);
                }
            }
        } catch (Exception e) {
            log.warn("load webhook targets failed: messageId={}, err={}", view.getId(), e.toString());
        }
        attempts.add(webhookDispatcher.broadcast(view, webhookTargets, senderName));

        attempts.add(publish(view, () -> pubSubMirror.get().publishRoomMessage(view, sender)));
        return allSettled(attempts);
    }

    CompletableFuture<Void> routeDirect(MessageView view, UserEntity sender, UserEntity recipient) {
        List<CompletableFuture<?>> attempts = new ArrayList<>();
        boolean webhook = shouldWebhook(recipient);
        attempts.add(pushToUser(recipient.getUsername(), WsFrame.message(view)));
        if (webhook) {
            attempts.add(webhookDispatcher.deliver(recipient, view));
        }
        attempts.add(publish(view, () -> pubSubMirror.get().publishDirectMessage(view, sender, recipient)));
        return allSettled(attempts);
    }

    /**
     * WHEN_OFFLINE 下，在线判定取推送之前的状态。
     */
    private boolean shouldWebhook(UserEntity target) {
        if (target == null || !target.hasWebhook()) {
            return false;
        }
        return props.webhookPolicyEffective() == WebhookPolicy.ALWAYS
                || !connectionRegistry.isOnline(target.getUsername());
    }

    private CompletableFuture<Void> pushToUser(String username, WsFrame frame) {
        List<CompletableFuture<?>> pushes = new ArrayList<>();
        for (ClientConnection conn : connectionRegistry.connections(username)) {
            pushes.add(pushToConnection(conn, frame));
        }
        return allSettled(pushes);
    }

    /**
     * 单条连接推送，受 pushTimeout 约束。失败或超时即剔除这条连接，同一用户的其它连接不受影响。
     */
    CompletableFuture<Boolean> pushToConnection(ClientConnection conn, WsFrame frame) {
        CompletableFuture<Void> written = new CompletableFuture<>();
        try {
            ChannelFuture f = wsWriter.write(conn.getChannel(), frame);
            f.addListener(done -> {
                if (done.isSuccess()) {
                    written.complete(null);
                } else {
                    written.completeExceptionally(done.cause());
                }
            });
        } catch (Exception e) {
            written.completeExceptionally(e);
        }
        return written
                .orTimeout(props.pushTimeoutEffective().toMillis(), TimeUnit.MILLISECONDS)
                .handle((v, e) -> {
                    if (e == null) {
                        return true;
                    }
                    log.warn("live push failed, evicting: key={}, type={}, err={}",
                            conn.key(), frame.getType(), unwrap(e).toString());
                    connectionRegistry.evict(conn, EVICT_REASON);
                    return false;
                });
    }

    private CompletableFuture<Void> publish(MessageView view, BooleanSupplier action) {
        if (pubSubMirror.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        try {
            action.getAsBoolean();
        } catch (Exception e) {
            log.warn("pubsub publish failed: messageId={}, err={}", view.getId(), e.toString());
        }
        return CompletableFuture.completedFuture(null);
    }

    private static CompletableFuture<Void> allSettled(List<CompletableFuture<?>> futures) {
        if (futures.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        CompletableFuture<?>[] settled = new CompletableFuture[futures.size()];
        for (int i = 0; i < futures.size(); i++) {
            settled[i] = futures.get(i).handle((v, e) -> null);
        }
        return CompletableFuture.allOf(settled);
    }

    private static Throwable unwrap(Throwable t) {
        return t instanceof CompletionException && t.getCause() != null ? t.getCause() : t;
    }
}
