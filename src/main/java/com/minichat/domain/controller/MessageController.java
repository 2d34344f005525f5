package com.minichat.domain.controller;

import com.minichat.auth.AuthContext;
import com.minichat.common.api.Result;
import com.minichat.domain.dto.MessagePage;
import com.minichat.domain.dto.MessageView;
import com.minichat.domain.dto.SendMessageRequest;
import com.minichat.domain.dto.UnreadCount;
import com.minichat.domain.service.ChatService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * 消息接口，与 WS 帧协议共用 {@link ChatService}，语义一致。
 */
@RequiredArgsConstructor
@RestController
@RequestMapping("/messages")
public class MessageController {

    private final ChatService chatService;

    /**
     * to_username 为空发群聊，否则发私聊。
     */
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Result<MessageView> send(@Valid @RequestBody SendMessageRequest req) {
        return Result.ok(chatService.send(AuthContext.require(), req.getContent(), req.getToUsername()));
    }

    @GetMapping
    public Result<MessagePage> roomHistory(
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer offset,
            @RequestParam(required = false) String since
    ) {
        return Result.ok(chatService.roomHistory(AuthContext.require(), limit, offset, since));
    }

    @GetMapping("/direct")
    public Result<MessagePage> directHistory(
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer offset,
            @RequestParam(required = false) String since
    ) {
        return Result.ok(chatService.directHistory(AuthContext.require(), limit, offset, since));
    }

    @GetMapping("/unread")
    public Result<List<MessageView>> unreadRoom(
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer offset
    ) {
        return Result.ok(chatService.unreadRoomMessages(AuthContext.require(), limit, offset));
    }

    @GetMapping("/direct/unread")
    public Result<List<MessageView>> unreadDirect(
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer offset
    ) {
        return Result.ok(chatService.unreadDirectMessages(AuthContext.require(), limit, offset));
    }

    @GetMapping("/unread/count")
    public Result<UnreadCount> unreadCount() {
        return Result.ok(chatService.unreadCount(AuthContext.require()));
    }

    @PostMapping("/{id}/read")
    public Result<Void> markRead(@PathVariable("id") Long id) {
        chatService.markRead(AuthContext.require(), id);
        return Result.okVoid();
    }

    @PostMapping("/mark-all-read")
    public Result<Map<String, Integer>> markAllRead() {
        return Result.ok(Map.of("marked_as_read", chatService.markAllRead(AuthContext.require())));
    }

    @DeleteMapping("/{id}")
    public Result<Void> delete(@PathVariable("id") Long id) {
        chatService.deleteMessage(AuthContext.require(), id);
        return Result.okVoid();
    }
}
