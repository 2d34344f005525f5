package com.minichat.domain.service.impl;

import com.minichat.common.error.ValidationException;
import com.minichat.domain.dto.MessageView;
import com.minichat.domain.entity.UserEntity;
import com.minichat.domain.enums.Role;
import com.minichat.domain.service.ChatService;
import com.minichat.support.ChatStoreTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.sql.Timestamp;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 用户行由外部直接写库，这里验证查询总能看到最新数据。
 */
@SpringBootTest
@ActiveProfiles("test")
class UserServiceImplTest extends ChatStoreTestSupport {

    @Autowired
    private ChatService chatService;

    private UserEntity alice;

    @BeforeEach
    void setUp() {
        resetStore();
        alice = createUser("alice", Role.MEMBER);
    }

    @Test
    void directSendSucceedsOnceRecipientRowAppears() {
        assertThatThrownBy(() -> chatService.send(alice, "hi dave", "dave"))
                .isInstanceOf(ValidationException.class)
                .hasMessage("User dave not found");
        assertThat(userService.findProfile("dave")).isNull();

        insertUser(9001L, "dave", "member");

        MessageView view = chatService.send(alice, "hi dave", "dave");
        assertThat(view.getToUsername()).isEqualTo("dave");
        assertThat(userService.findProfile("dave")).isNotNull();
    }

    @Test
    void webhookUrlChangeIsVisibleToNextLookup() {
        createUser("bob", Role.MEMBER);
        assertThat(userService.findByUsername("bob").hasWebhook()).isFalse();
        assertThat(userService.findProfile("bob").getWebhookUrl()).isNull();

        jdbcTemplate.update("update t_user set webhook_url = ? where username = ?", "http://hooks.local/bob", "bob");

        assertThat(userService.findByUsername("bob").getWebhookUrl()).isEqualTo("http://hooks.local/bob");
        // 权威查询顺带刷新了展示缓存
        assertThat(userService.findProfile("bob").getWebhookUrl()).isEqualTo("http://hooks.local/bob");
    }

    @Test
    void cachedProfileIsACopy() {
        UserEntity first = userService.findProfile("alice");
        first.setRole(Role.ADMIN);
        first.setEmoji("x");

        UserEntity second = userService.findProfile("alice");
        assertThat(second).isNotSameAs(first);
        assertThat(second.getRole()).isEqualTo(Role.MEMBER);
        assertThat(second.getEmoji()).isNull();
    }

    @Test
    void blankUsernameYieldsNull() {
        assertThat(userService.findByUsername(" ")).isNull();
        assertThat(userService.findProfile(null)).isNull();
    }

    private void insertUser(long id, String username, String role) {
        jdbcTemplate.update("insert into t_user (id, username, api_key, role, created_at) values (?, ?, ?, ?, ?)",
                id, username, "key-" + username, role, Timestamp.valueOf(LocalDateTime.now()));
    }
}
