package com.minichat.gateway.ws;

import com.minichat.common.error.ChatException;
import com.minichat.gateway.session.ClientConnection;
import com.minichat.gateway.session.LivenessMonitor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * 按 type 把入站帧路由到具体处理器，并把结果或错误写回同一条连接。
 *
 * <p>返回的 future 在回复写出（或确定不需要回复）后完成，不会异常完成，串行队列据此推进。</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WsFrameDispatcher {

    static final String TIMEOUT_ERROR = "Request timed out";
    static final String BUSY_ERROR = "server_busy";
    static final String INTERNAL_ERROR = "internal_error";

    private final WsMessageHandler messageHandler;
    private final WsReadReceiptHandler readReceiptHandler;
    private final WsQueryHandler queryHandler;
    private final LivenessMonitor livenessMonitor;
    private final WsWriter wsWriter;

    public CompletableFuture<Void> dispatch(ClientConnection conn, WsInboundFrame in) {
        String type = in.typeOrDefault();
        CompletableFuture<WsFrame> reply;
        try {
            reply = route(conn, in, type);
        } catch (Exception e) {
            reply = CompletableFuture.failedFuture(e);
        }
        return reply
                .handle((frame, e) -> e == null ? frame : toErrorFrame(conn, type, e))
                .thenAccept(frame -> {
                    if (frame != null) {
                        wsWriter.write(conn.getChannel(), frame);
                    }
                });
    }

    private CompletableFuture<WsFrame> route(ClientConnection conn, WsInboundFrame in, String type) {
        return switch (type) {
            case "message" -> messageHandler.send(conn, in);
            case "delete_message" -> messageHandler.delete(conn, in);
            case "mark_read" -> readReceiptHandler.markRead(conn, in);
            case "mark_all_read" -> readReceiptHandler.markAllRead(conn);
            case "mark_room_read" -> readReceiptHandler.markRoomRead(conn);
            case "mark_direct_read" -> readReceiptHandler.markDirectRead(conn, in);
            case "get_unread_count" -> readReceiptHandler.unreadCount(conn);
            case "get_messages" -> queryHandler.roomMessages(conn, in);
            case "get_direct_messages" -> queryHandler.directMessages(conn, in);
            case "get_unread_messages" -> queryHandler.unreadRoomMessages(conn, in);
            case "get_unread_direct_messages" -> queryHandler.unreadDirectMessages(conn, in);
            case "get_users" -> queryHandler.users(conn);
            case "get_online_users" -> queryHandler.onlineUsers(conn);
            case "get_user_profile" -> queryHandler.userProfile(conn, in);
            case "pong" -> {
                livenessMonitor.recordProbeAck(conn);
                yield CompletableFuture.completedFuture(null);
            }
            default -> CompletableFuture.completedFuture(WsFrame.error("Unknown message type: " + type));
        };
    }

    WsFrame toErrorFrame(ClientConnection conn, String type, Throwable e) {
        Throwable cause = e;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof ChatException ce) {
            return WsFrame.error(ce.getMessage());
        }
        if (cause instanceof TimeoutException) {
            log.warn("ws frame timed out: type={}, key={}", type, conn.key());
            return WsFrame.error(TIMEOUT_ERROR);
        }
        if (cause instanceof RejectedExecutionException) {
            log.warn("ws frame rejected by executor: type={}, key={}", type, conn.key());
            return WsFrame.error(BUSY_ERROR);
        }
        log.error("ws frame failed: type={}, key={}", type, conn.key(), cause);
        return WsFrame.error(INTERNAL_ERROR);
    }
}
