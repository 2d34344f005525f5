package com.minichat.domain.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * total 恒等于 unreadRoom + unreadDirect，由构造方式保证。
 */
public record UnreadCount(
        @JsonProperty("unread_room_messages") long unreadRoom,
        @JsonProperty("unread_direct_messages") long unreadDirect,
        @JsonProperty("total_unread") long total
) {

    public static UnreadCount of(long unreadRoom, long unreadDirect) {
        return new UnreadCount(unreadRoom, unreadDirect, unreadRoom + unreadDirect);
    }
}
