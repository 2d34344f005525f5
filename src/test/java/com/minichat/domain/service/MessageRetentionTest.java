package com.minichat.domain.service;

import com.minichat.domain.dto.MessageView;
import com.minichat.domain.entity.UserEntity;
import com.minichat.domain.enums.Role;
import com.minichat.support.ChatStoreTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = "chat.store.history-limit=5")
@ActiveProfiles("test")
class MessageRetentionTest extends ChatStoreTestSupport {

    @Autowired
    private ChatService chatService;

    private UserEntity alice;
    private UserEntity bob;

    @BeforeEach
    void setUp() {
        resetStore();
        alice = createUser("alice", Role.MEMBER);
        bob = createUser("bob", Role.MEMBER);
    }

    @Test
    void oldestMessagesArePrunedPastLimit() {
        MessageView first = chatService.send(alice, "m1", null);
        chatService.markRead(bob, first.getId());
        for (int i = 2; i <= 7; i++) {
            chatService.send(alice, "m" + i, null);
        }

        assertThat(chatService.roomHistory(bob, 100, 0, null).messages())
                .extracting(MessageView::getContent)
                .containsExactly("m3", "m4", "m5", "m6", "m7");
        Integer receipts = jdbcTemplate.queryForObject("select count(*) from t_read_receipt", Integer.class);
        assertThat(receipts).isZero();
        assertThat(chatService.unreadCount(bob).unreadRoom()).isEqualTo(5);
    }
}
