package com.minichat.domain.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * 用户角色（对应表字段：t_user.role，库里存小写字符串）。
 *
 * <ul>
 *   <li>admin：全部权限</li>
 *   <li>member：收发房间消息与私信，可创建 bot</li>
 *   <li>viewer：只读；能看到全站私信，但不能被私信</li>
 *   <li>bot：只能发房间消息，不能收发私信</li>
 * </ul>
 */
@Getter
public enum Role {

    ADMIN("admin", EnumSet.allOf(Permission.class)),

    MEMBER("member", EnumSet.of(
            Permission.READ_MESSAGES,
            Permission.READ_USERS,
            Permission.SEND_ROOM_MESSAGE,
            Permission.SEND_DIRECT_MESSAGE,
            Permission.UPDATE_OWN_PROFILE,
            Permission.CREATE_BOT)),

    VIEWER("viewer", EnumSet.of(
            Permission.READ_MESSAGES,
            Permission.READ_USERS)),

    BOT("bot", EnumSet.of(
            Permission.READ_MESSAGES,
            Permission.READ_USERS,
            Permission.SEND_ROOM_MESSAGE,
            Permission.UPDATE_OWN_PROFILE));

    @EnumValue
    @JsonValue
    private final String value;

    private final Set<Permission> permissions;

    Role(String value, EnumSet<Permission> permissions) {
        this.value = value;
        this.permissions = Collections.unmodifiableSet(permissions);
    }

    public boolean hasPermission(Permission permission) {
        return permission != null && permissions.contains(permission);
    }

    public static Role fromString(String s) {
        if (s == null || s.isBlank()) {
            return null;
        }
        String v = s.trim().toLowerCase(Locale.ROOT);
        for (Role r : values()) {
            if (r.value.equals(v)) {
                return r;
            }
        }
        return null;
    }
}
