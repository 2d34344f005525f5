package com.minichat.domain.enums;

import com.minichat.domain.entity.UserEntity;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static org.assertj.core.api.Assertions.assertThat;

class RoleTest {

    @Test
    void adminHasEveryPermission() {
        for (Permission p : Permission.values()) {
            assertThat(Role.ADMIN.hasPermission(p)).as(p.name()).isTrue();
        }
    }

    @Test
    void botCannotSendDirectMessages() {
        assertThat(Role.BOT.hasPermission(Permission.SEND_ROOM_MESSAGE)).isTrue();
        assertThat(Role.BOT.hasPermission(Permission.SEND_DIRECT_MESSAGE)).isFalse();
    }

    @Test
    void viewerIsReadOnly() {
        assertThat(Role.VIEWER.getPermissions())
                .containsExactlyInAnyOrderElementsOf(EnumSet.of(Permission.READ_MESSAGES, Permission.READ_USERS));
    }

    @Test
    void memberCannotAdministrate() {
        assertThat(Role.MEMBER.hasPermission(Permission.ADMIN_ACCESS)).isFalse();
        assertThat(Role.MEMBER.hasPermission(Permission.DELETE_ANY_MESSAGE)).isFalse();
        assertThat(Role.MEMBER.hasPermission(null)).isFalse();
    }

    @Test
    void fromStringAcceptsStoredValues() {
        assertThat(Role.fromString("viewer")).isEqualTo(Role.VIEWER);
        assertThat(Role.fromString("BOT")).isEqualTo(Role.BOT);
    }

    @Test
    void derivedFlagsFollowRole() {
        UserEntity viewer = UserEntity.builder().username("v").role(Role.VIEWER).build();
        UserEntity bot = UserEntity.builder().username("b").role(Role.BOT).build();
        UserEntity admin = UserEntity.builder().username("a").role(Role.ADMIN).build();

        assertThat(viewer.isViewer()).isTrue();
        assertThat(viewer.isAdmin()).isFalse();
        assertThat(bot.isBot()).isTrue();
        assertThat(admin.isAdmin()).isTrue();
        assertThat(DirectScope.of(viewer)).isEqualTo(DirectScope.ALL);
        assertThat(DirectScope.of(admin)).isEqualTo(DirectScope.OWN);
    }
}
