package com.minichat.domain.controller;

import com.minichat.auth.AuthContext;
import com.minichat.common.api.Result;
import com.minichat.domain.dto.UserProfile;
import com.minichat.domain.service.ChatService;
import com.minichat.gateway.session.ConnectionRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RequiredArgsConstructor
@RestController
@RequestMapping("/users")
public class UserController {

    private final ChatService chatService;
    private final ConnectionRegistry connectionRegistry;

    /**
     * 可参与聊天的用户（不含 viewer）。
     */
    @GetMapping
    public Result<List<UserProfile>> list() {
        return Result.ok(chatService.listUsers(AuthContext.require()));
    }

    /**
     * 仅本实例的在线连接。
     */
    @GetMapping("/online")
    public Result<List<UserProfile>> online() {
        return Result.ok(chatService.onlineUsers(AuthContext.require(), connectionRegistry.listOnlineUsernames()));
    }

    @GetMapping("/{username}")
    public Result<UserProfile> profile(@PathVariable("username") String username) {
        return Result.ok(chatService.userProfile(AuthContext.require(), username));
    }
}
