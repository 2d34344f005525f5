package com.minichat.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 细粒度权限。角色到权限的映射见 {@link Role}。
 */
@Getter
@RequiredArgsConstructor
public enum Permission {

    READ_MESSAGES("read_messages"),
    READ_USERS("read_users"),
    SEND_ROOM_MESSAGE("send_room_message"),
    SEND_DIRECT_MESSAGE("send_direct_message"),
    UPDATE_OWN_PROFILE("update_own_profile"),
    CREATE_BOT("create_bot"),
    ADMIN_ACCESS("admin_access"),
    UPDATE_ANY_USER("update_any_user"),
    DELETE_USER("delete_user"),
    DELETE_ANY_MESSAGE("delete_any_message");

    @JsonValue
    private final String value;
}
