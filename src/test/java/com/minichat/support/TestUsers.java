package com.minichat.support;

import com.minichat.domain.entity.UserEntity;
import com.minichat.domain.enums.Role;

public final class TestUsers {

    private TestUsers() {
    }

    public static UserEntity user(String username, Role role) {
        return UserEntity.builder()
                .username(username)
                .apiKey("key-" + username)
                .role(role)
                .build();
    }

    public static UserEntity member(String username) {
        return user(username, Role.MEMBER);
    }

    public static UserEntity withWebhook(UserEntity u, String url) {
        u.setWebhookUrl(url);
        return u;
    }
}
