package com.minichat.gateway.ws;

import com.minichat.config.ChatDbExecutorProperties;
import com.minichat.domain.service.ChatService;
import com.minichat.gateway.session.ClientConnection;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * 已读回执相关帧：mark_read / mark_all_read / mark_room_read / mark_direct_read / get_unread_count。
 */
@Component
public class WsReadReceiptHandler extends WsDbHandlerSupport {

    private static final String MARKED_READ = "marked_read";

    private final ChatService chatService;

    public WsReadReceiptHandler(ChatService chatService,
                                @Qualifier("chatDbExecutor") Executor dbExecutor,
                                ChatDbExecutorProperties dbProps) {
        super(dbExecutor, dbProps);
        this.chatService = chatService;
    }

    /**
     * 重复标记同一条消息也回 success。
     */
    public CompletableFuture<WsFrame> markRead(ClientConnection conn, WsInboundFrame in) {
        return onDb(() -> {
            Long messageId = ChatService.parseMessageId(in.getMessageId());
            chatService.markRead(conn.getIdentity(), messageId);
            WsFrame out = WsFrame.of("marked_read");
            out.setMessageId(messageId);
            out.setStatus("success");
            return out;
        });
    }

    public CompletableFuture<WsFrame> markAllRead(ClientConnection conn) {
        return onDb(() -> {
            WsFrame out = WsFrame.of("marked_all_read");
            out.setMarkedAsRead(chatService.markAllRead(conn.getIdentity()));
            out.setStatus("success");
            return out;
        });
    }

    public CompletableFuture<WsFrame> markRoomRead(ClientConnection conn) {
        return onDb(() -> {
            WsFrame out = WsFrame.of("marked_room_read");
            out.setCount(chatService.markRoomRead(conn.getIdentity()));
            out.setStatus(MARKED_READ);
            return out;
        });
    }

    public CompletableFuture<WsFrame> markDirectRead(ClientConnection conn, WsInboundFrame in) {
        return onDb(() -> {
            int count = chatService.markDirectRead(conn.getIdentity(), in.getFromUsername());
            WsFrame out = WsFrame.of("marked_direct_read");
            out.setFromUsername(in.getFromUsername().trim());
            out.setCount(count);
            out.setStatus(MARKED_READ);
            return out;
        });
    }

    public CompletableFuture<WsFrame> unreadCount(ClientConnection conn) {
        return onDb(() -> WsFrame.unreadCount(chatService.unreadCount(conn.getIdentity())));
    }
}
