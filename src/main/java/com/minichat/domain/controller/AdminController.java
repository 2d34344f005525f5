package com.minichat.domain.controller;

import com.minichat.auth.AuthContext;
import com.minichat.common.api.Result;
import com.minichat.common.error.PermissionDeniedException;
import com.minichat.domain.entity.UserEntity;
import com.minichat.domain.enums.Permission;
import com.minichat.gateway.session.ConnectionRegistry;
import com.minichat.gateway.session.ConnectionStats;
import com.minichat.gateway.session.ConnectionsOverview;
import com.minichat.gateway.session.LivenessMonitor;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;

@RequiredArgsConstructor
@RestController
@RequestMapping("/admin")
public class AdminController {

    private final ConnectionRegistry connectionRegistry;
    private final LivenessMonitor livenessMonitor;

    /**
     * 本实例所有 WS 连接的心跳状态。
     */
    @GetMapping("/websocket/connections")
    public Result<ConnectionsOverview> connections() {
        UserEntity user = AuthContext.require();
        if (!user.hasPermission(Permission.ADMIN_ACCESS)) {
            throw new PermissionDeniedException(Permission.ADMIN_ACCESS, "Admin access required");
        }
        List<String> usernames = connectionRegistry.listOnlineUsernames();
        List<ConnectionStats> all = new ArrayList<>();
        for (String username : usernames) {
            all.addAll(livenessMonitor.connectionStats(username));
        }
        return Result.ok(new ConnectionsOverview(usernames.size(), all.size(), all));
    }
}
