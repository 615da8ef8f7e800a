package me.golemcore.apollo.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.apollo.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.apollo.domain.exception.ConversationNotFoundException;
import me.golemcore.apollo.domain.model.Conversation;
import me.golemcore.apollo.domain.model.Message;
import me.golemcore.apollo.domain.model.ToolInvocationRecord;
import me.golemcore.apollo.infrastructure.config.ApolloProperties;
import me.golemcore.apollo.infrastructure.config.AutoConfiguration;
import me.golemcore.apollo.port.outbound.StoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ConversationServiceTest {

    private static final String USER_ID = "user-1";
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-02-14T00:00:00Z"), ZoneId.of("UTC"));

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storage;
    private ObjectMapper objectMapper;
    private ConversationService service;

    @BeforeEach
    void setUp() {
        ApolloProperties properties = new ApolloProperties();
        properties.getStorage().setBasePath(tempDir.toString());
        storage = new LocalStorageAdapter(properties);
        storage.init();
        objectMapper = AutoConfiguration.objectMapper();
        service = new ConversationService(storage, objectMapper, CLOCK);
    }

    @Test
    void shouldCreateConversationWhenIdIsAbsent() {
        String id = service.getOrCreateConversation(USER_ID, null);

        Conversation conversation = service.findConversation(id).orElseThrow();
        assertEquals(USER_ID, conversation.getUserId());
        assertTrue(storage.exists(ConversationService.CONVERSATIONS_DIR, id + ".json").join());
    }

    @Test
    void shouldReturnExistingOwnedConversation() {
        String id = service.getOrCreateConversation(USER_ID, null);

        assertEquals(id, service.getOrCreateConversation(USER_ID, id));
    }

    @Test
    void shouldHideForeignConversation() {
        String id = service.getOrCreateConversation("user-2", null);

        assertThrows(ConversationNotFoundException.class, () -> service.getOrCreateConversation(USER_ID, id));
    }

    @Test
    void shouldRejectUnknownConversationId() {
        assertThrows(ConversationNotFoundException.class,
                () -> service.getOrCreateConversation(USER_ID, "does-not-exist"));
    }

    @Test
    void shouldAppendMessagesInOrderAndDeriveTitle() {
        String id = service.getOrCreateConversation(USER_ID, null);

        String first = service.appendMessage(id, message(Message.ROLE_USER, "Add buy milk to my tasks"));
        String second = service.appendMessage(id, message(Message.ROLE_ASSISTANT, "Done."));

        List<Message> messages = service.getRecentMessages(id, 10);
        assertEquals(2, messages.size());
        assertEquals(first, messages.get(0).getId());
        assertEquals(second, messages.get(1).getId());
        assertEquals(id, messages.get(0).getConversationId());
        assertEquals(CLOCK.instant(), messages.get(0).getTimestamp());
        assertEquals("Add buy milk to my tasks", service.findConversation(id).orElseThrow().getTitle());
    }

    @Test
    void shouldReturnOnlyNewestMessagesUpToLimit() {
        String id = service.getOrCreateConversation(USER_ID, null);
        for (int i = 0; i < 5; i++) {
            service.appendMessage(id, message(Message.ROLE_USER, "message " + i));
        }

        List<Message> recent = service.getRecentMessages(id, 2);

        assertEquals(List.of("message 3", "message 4"), recent.stream().map(Message::getContent).toList());
    }

    @Test
    void shouldRejectToolRoleAndEmptyContent() {
        String id = service.getOrCreateConversation(USER_ID, null);

        assertThrows(IllegalArgumentException.class,
                () -> service.appendMessage(id, message(Message.ROLE_TOOL, "{}")));
        assertThrows(IllegalArgumentException.class,
                () -> service.appendMessage(id, message(Message.ROLE_USER, "")));
    }

    @Test
    void shouldAllowEmptyAssistantMessageWithToolInvocations() {
        String id = service.getOrCreateConversation(USER_ID, null);
        Message assistant = Message.builder()
                .role(Message.ROLE_ASSISTANT)
                .content("")
                .toolInvocations(List.of(ToolInvocationRecord.builder()
                        .toolCallId("call_1").toolName("create_task").status("success").build()))
                .build();

        service.appendMessage(id, assistant);

        Message stored = service.getRecentMessages(id, 1).get(0);
        assertEquals(1, stored.getToolInvocations().size());
    }

    @Test
    void shouldReloadConversationsFromDisk() {
        String id = service.getOrCreateConversation(USER_ID, null);
        service.appendMessage(id, message(Message.ROLE_USER, "Remember me"));

        ConversationService restarted = new ConversationService(storage, objectMapper, CLOCK);

        assertEquals("Remember me", restarted.getRecentMessages(id, 10).get(0).getContent());
        assertEquals(1, restarted.listConversations(USER_ID).size());
        assertTrue(restarted.listConversations("user-2").isEmpty());
    }

    @Test
    void shouldRollBackMessageWhenPersistFails() {
        StoragePort failingStorage = mock(StoragePort.class);
        when(failingStorage.putTextAtomic(anyString(), anyString(), anyString(), anyBoolean()))
                .thenReturn(CompletableFuture.completedFuture(null))
                .thenReturn(CompletableFuture.failedFuture(new UncheckedIOException("disk full",
                        new java.io.IOException("disk full"))));
        ConversationService failing = new ConversationService(failingStorage, objectMapper, CLOCK);
        String id = failing.getOrCreateConversation(USER_ID, null);

        assertThrows(RuntimeException.class, () -> failing.appendMessage(id, message(Message.ROLE_USER, "hi")));

        assertTrue(failing.getRecentMessages(id, 10).isEmpty());
    }

    @Test
    void shouldTruncateLongTitles() {
        String title = ConversationService.deriveTitle("x".repeat(80));

        assertEquals(ConversationService.TITLE_MAX_CHARS + 3, title.length());
        assertTrue(title.endsWith("..."));
    }

    private static Message message(String role, String content) {
        return Message.builder().role(role).content(content).build();
    }
}
