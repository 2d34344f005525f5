package com.minichat.domain.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.minichat.domain.entity.UserEntity;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 对外公开的用户资料。api key、webhook 地址不在这里出现。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class UserProfile {

    private String username;

    private String role;

    private String logo;

    private String emoji;

    private boolean bot;

    private boolean viewer;

    public static UserProfile of(UserEntity user) {
        return new UserProfile(
                user.getUsername(),
                user.getRole() == null ? null : user.getRole().getValue(),
                user.getLogo(),
                user.getEmoji(),
                user.isBot(),
                user.isViewer());
    }
}
