package com.minichat.domain.service;

import com.minichat.common.error.NotFoundException;
import com.minichat.common.error.PermissionDeniedException;
import com.minichat.common.error.StorageException;
import com.minichat.common.error.ValidationException;
import com.minichat.delivery.DeliveryRouter;
import com.minichat.domain.dto.MessageView;
import com.minichat.domain.entity.MessageEntity;
import com.minichat.domain.entity.UserEntity;
import com.minichat.domain.enums.DirectScope;
import com.minichat.domain.enums.MessageType;
import com.minichat.domain.enums.Permission;
import com.minichat.domain.enums.Role;
import com.minichat.support.TestUsers;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class ChatServiceTest {

    private MessageService messageService;
    private ReadReceiptService readReceiptService;
    private UserService userService;
    private DeliveryRouter deliveryRouter;
    private ChatService svc;

    @BeforeEach
    void setUp() {
        messageService = mock(MessageService.class);
        readReceiptService = mock(ReadReceiptService.class);
        userService = mock(UserService.class);
        deliveryRouter = mock(DeliveryRouter.class);
        Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
        svc = new ChatService(messageService, readReceiptService, userService,
                new MessageViewAssembler(userService), deliveryRouter, clock);

        when(messageService.append(any())).thenAnswer(inv -> {
            MessageEntity m = inv.getArgument(0);
            m.setId(100L);
            return m;
        });
    }

    @Test
    void send_ShouldPersistThenDispatchRoomMessage() {
        UserEntity alice = TestUsers.member("alice");

        MessageView view = svc.send(alice, "hello", null);

        assertEquals(100L, view.getId());
        assertEquals("room", view.getMessageType());
        assertNull(view.getToUsername());
        assertEquals("2024-05-01T10:00:00Z", view.getTimestamp());
        verify(messageService).append(argThat(m -> m.getMessageType() == MessageType.ROOM));
        verify(deliveryRouter).dispatch(view, alice, null);
    }

    @Test
    void send_ShouldDispatchDirectMessageToRecipient() {
        UserEntity alice = TestUsers.member("alice");
        UserEntity bob = TestUsers.member("bob");
        when(userService.findByUsername("bob")).thenReturn(bob);

        MessageView view = svc.send(alice, "hi bob", " bob ");

        assertEquals("bob", view.getToUsername());
        assertEquals("direct", view.getMessageType());
        verify(deliveryRouter).dispatch(view, alice, bob);
    }

    @Test
    void send_ShouldRejectBlankAndOversizedContent() {
        UserEntity alice = TestUsers.member("alice");

        assertThrows(ValidationException.class, () -> svc.send(alice, "  ", null));
        assertThrows(ValidationException.class, () -> svc.send(alice, "x".repeat(ChatService.MAX_CONTENT_LENGTH + 1), null));
        verifyNoInteractions(deliveryRouter);
    }

    @Test
    void send_ShouldAcceptContentAtLimit() {
        MessageView view = svc.send(TestUsers.member("alice"), "x".repeat(ChatService.MAX_CONTENT_LENGTH), null);

        assertEquals(ChatService.MAX_CONTENT_LENGTH, view.getContent().length());
    }

    @Test
    void send_ShouldRejectUnknownViewerAndBotRecipients() {
        UserEntity alice = TestUsers.member("alice");
        when(userService.findByUsername("watcher")).thenReturn(TestUsers.user("watcher", Role.VIEWER));
        when(userService.findByUsername("helper")).thenReturn(TestUsers.user("helper", Role.BOT));

        ValidationException missing = assertThrows(ValidationException.class, () -> svc.send(alice, "hi", "ghost"));
        assertEquals("User ghost not found", missing.getMessage());
        assertThrows(ValidationException.class, () -> svc.send(alice, "hi", "watcher"));
        assertThrows(ValidationException.class, () -> svc.send(alice, "hi", "helper"));
        verify(messageService, never()).append(any());
    }

    @Test
    void send_ShouldNamePermissionWhenBotSendsDirect() {
        UserEntity bot = TestUsers.user("helper", Role.BOT);

        PermissionDeniedException e = assertThrows(PermissionDeniedException.class, () -> svc.send(bot, "hi", "alice"));

        assertTrue(e.getMessage().contains("send_direct_message"));
        assertTrue(e.getMessage().contains("'bot'"));
    }

    @Test
    void send_ShouldRejectViewerSender() {
        UserEntity viewer = TestUsers.user("watcher", Role.VIEWER);

        assertThrows(PermissionDeniedException.class, () -> svc.send(viewer, "hi", null));
    }

    @Test
    void send_ShouldWrapStorageFailure() {
        doThrow(new DataAccessResourceFailureException("db down")).when(messageService).append(any());

        assertThrows(StorageException.class, () -> svc.send(TestUsers.member("alice"), "hi", null));
        verifyNoInteractions(deliveryRouter);
    }

    @Test
    void send_ShouldSucceedEvenIfDispatchThrows() {
        when(deliveryRouter.dispatch(any(), any(), any())).thenThrow(new IllegalStateException("boom"));

        MessageView view = svc.send(TestUsers.member("alice"), "hi", null);

        assertEquals(100L, view.getId());
    }

    @Test
    void markRead_ShouldNotifyAuthorOnFirstRead() {
        when(messageService.getById(5L)).thenReturn(message(5L, "alice"));
        when(readReceiptService.markRead(5L, "bob")).thenReturn(true);

        assertTrue(svc.markRead(TestUsers.member("bob"), 5L));
        verify(deliveryRouter).notifyReadReceipt("alice", 5L, "bob");
    }

    @Test
    void markRead_ShouldStaySilentWhenAlreadyReadOrOwnMessage() {
        when(messageService.getById(5L)).thenReturn(message(5L, "alice"));
        when(readReceiptService.markRead(5L, "bob")).thenReturn(false);
        when(readReceiptService.markRead(5L, "alice")).thenReturn(true);

        assertFalse(svc.markRead(TestUsers.member("bob"), 5L));
        assertTrue(svc.markRead(TestUsers.member("alice"), 5L));
        verify(deliveryRouter, never()).notifyReadReceipt(anyString(), anyLong(), anyString());
    }

    @Test
    void markRead_ShouldThrowNotFoundForUnknownMessage() {
        NotFoundException e = assertThrows(NotFoundException.class, () -> svc.markRead(TestUsers.member("bob"), 9L));

        assertEquals("Message 9 not found", e.getMessage());
        verifyNoInteractions(readReceiptService);
    }

    @Test
    void markAllRead_ShouldWidenDirectScopeForViewer() {
        svc.markAllRead(TestUsers.user("watcher", Role.VIEWER));
        svc.markAllRead(TestUsers.member("bob"));

        verify(readReceiptService).markAllRead("watcher", DirectScope.ALL);
        verify(readReceiptService).markAllRead("bob", DirectScope.OWN);
    }

    @Test
    void deleteMessage_ShouldRequireDeletePermission() {
        PermissionDeniedException e = assertThrows(PermissionDeniedException.class,
                () -> svc.deleteMessage(TestUsers.member("bob"), 5L));

        assertEquals(Permission.DELETE_ANY_MESSAGE, e.getPermission());
        verify(messageService, never()).deleteMessage(anyLong());
    }

    @Test
    void deleteMessage_ShouldThrowNotFoundWhenNothingDeleted() {
        when(messageService.deleteMessage(5L)).thenReturn(false);

        assertThrows(NotFoundException.class, () -> svc.deleteMessage(TestUsers.user("root", Role.ADMIN), 5L));
    }

    @Test
    void parseMessageId_ShouldRejectGarbage() {
        assertEquals(42L, ChatService.parseMessageId(" 42 "));
        assertThrows(ValidationException.class, () -> ChatService.parseMessageId(null));
        assertThrows(ValidationException.class, () -> ChatService.parseMessageId("abc"));
    }

    private static MessageEntity message(Long id, String from) {
        MessageEntity m = new MessageEntity();
        m.setId(id);
        m.setFromUsername(from);
        m.setMessageType(MessageType.ROOM);
        return m;
    }
}
