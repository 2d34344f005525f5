package com.minichat.gateway.ws;

import com.minichat.config.ChatDbExecutorProperties;
import com.minichat.domain.dto.MessagePage;
import com.minichat.domain.service.ChatService;
import com.minichat.gateway.session.ClientConnection;
import com.minichat.gateway.session.ConnectionRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * 只读查询帧：历史、未读列表、用户列表、在线用户、用户资料。
 */
@Component
public class WsQueryHandler extends WsDbHandlerSupport {

    private final ChatService chatService;
    private final ConnectionRegistry connectionRegistry;

    public WsQueryHandler(ChatService chatService,
                          ConnectionRegistry connectionRegistry,
                          @Qualifier("chatDbExecutor") Executor dbExecutor,
                          ChatDbExecutorProperties dbProps) {
        super(dbExecutor, dbProps);
        this.chatService = chatService;
        this.connectionRegistry = connectionRegistry;
    }

    public CompletableFuture<WsFrame> roomMessages(ClientConnection conn, WsInboundFrame in) {
        return onDb(() -> page("messages",
                chatService.roomHistory(conn.getIdentity(), in.getLimit(), in.getOffset(), in.getSince())));
    }

    public CompletableFuture<WsFrame> directMessages(ClientConnection conn, WsInboundFrame in) {
        return onDb(() -> page("direct_messages",
                chatService.directHistory(conn.getIdentity(), in.getLimit(), in.getOffset(), in.getSince())));
    }

    public CompletableFuture<WsFrame> unreadRoomMessages(ClientConnection conn, WsInboundFrame in) {
        return onDb(() -> {
            WsFrame out = WsFrame.of("unread_messages");
            out.setMessages(chatService.unreadRoomMessages(conn.getIdentity(), in.getLimit(), in.getOffset()));
            return out;
        });
    }

    public CompletableFuture<WsFrame> unreadDirectMessages(ClientConnection conn, WsInboundFrame in) {
        return onDb(() -> {
            WsFrame out = WsFrame.of("unread_direct_messages");
            out.setMessages(chatService.unreadDirectMessages(conn.getIdentity(), in.getLimit(), in.getOffset()));
            return out;
        });
    }

    public CompletableFuture<WsFrame> users(ClientConnection conn) {
        return onDb(() -> {
            WsFrame out = WsFrame.of("users");
            out.setUsers(chatService.listUsers(conn.getIdentity()));
            return out;
        });
    }

    public CompletableFuture<WsFrame> onlineUsers(ClientConnection conn) {
        return onDb(() -> {
            WsFrame out = WsFrame.of("online_users");
            out.setUsers(chatService.onlineUsers(conn.getIdentity(), connectionRegistry.listOnlineUsernames()));
            return out;
        });
    }

    public CompletableFuture<WsFrame> userProfile(ClientConnection conn, WsInboundFrame in) {
        return onDb(() -> {
            WsFrame out = WsFrame.of("user_profile");
            out.setUser(chatService.userProfile(conn.getIdentity(), in.getUsername()));
            return out;
        });
    }

    private static WsFrame page(String type, MessagePage page) {
        WsFrame out = WsFrame.of(type);
        out.setMessages(page.messages());
        out.setPagination(page.pagination());
        return out;
    }
}
