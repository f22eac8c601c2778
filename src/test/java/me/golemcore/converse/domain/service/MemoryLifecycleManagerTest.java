package me.golemcore.converse.domain.service;

import me.golemcore.converse.domain.model.ConversationRecord;
import me.golemcore.converse.domain.model.MemoryStats;
import me.golemcore.converse.domain.model.MessageRecord;
import me.golemcore.converse.domain.model.MessageRole;
import me.golemcore.converse.infrastructure.config.ConverseProperties;
import me.golemcore.converse.testsupport.InMemoryConversationRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class MemoryLifecycleManagerTest {

    private static final String OWNER = "owner-1";
    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    private InMemoryConversationRepository repository;
    private ConversationMemoryTier memoryTier;
    private ConverseProperties properties;
    private ExecutorService writeExecutor;
    private ConversationStore store;

    @BeforeEach
    void setUp() {
        repository = new InMemoryConversationRepository();
        memoryTier = new ConversationMemoryTier();
        properties = new ConverseProperties();
        properties.getMemory().setConversationTtl(Duration.ofHours(24));
        writeExecutor = Executors.newSingleThreadExecutor();
        store = new ConversationStore(repository, memoryTier, properties, writeExecutor,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        writeExecutor.shutdownNow();
    }

    @Test
    void evictsConversationsIdleLongerThanTtl() throws Exception {
        ConversationRecord idle = store.findOrCreate(OWNER, "237600000001", "s1");
        ConversationRecord active = store.findOrCreate(OWNER, "237600000002", "s1");
        store.appendMessage(idle.getId(), message("m-1", "hello", NOW)).get();
        store.appendMessage(active.getId(), message("m-2", "hello again", NOW.plusSeconds(7200))).get();

        MemoryLifecycleManager.SweepResult result = managerAt(NOW.plus(Duration.ofHours(25))).sweep();

        assertEquals(1, result.expiredConversations());
        assertTrue(memoryTier.get(idle.getId()).isEmpty());
        assertTrue(memoryTier.get(active.getId()).isPresent());
        // eviction never touches the durable tier
        assertEquals(1, store.listMessages(idle.getId()).size());
        assertTrue(repository.findById(idle.getId()).isPresent());
    }

    @Test
    void neverEvictsConversationWithUnflushedMessages() {
        ConversationRecord conversation = store.findOrCreate(OWNER, "237600000001", "s1");
        repository.setFailing(true);
        assertThrows(ExecutionException.class,
                () -> store.appendMessage(conversation.getId(), message("m-1", "hello", NOW)).get());

        MemoryLifecycleManager.SweepResult result = managerAt(NOW.plus(Duration.ofDays(3))).sweep();

        assertEquals(0, result.expiredConversations());
        assertEquals(0, result.flushedMessages());
        assertEquals(1, memoryTier.messages(conversation.getId()).size());
    }

    @Test
    void sweepFlushesPendingMessagesBeforeEvicting() {
        ConversationRecord conversation = store.findOrCreate(OWNER, "237600000001", "s1");
        repository.setFailing(true);
        assertThrows(ExecutionException.class,
                () -> store.appendMessage(conversation.getId(), message("m-1", "hello", NOW)).get());
        repository.setFailing(false);

        MemoryLifecycleManager.SweepResult result = managerAt(NOW.plus(Duration.ofDays(3))).sweep();

        assertEquals(1, result.flushedMessages());
        assertEquals(1, result.expiredConversations());
        assertEquals(1, repository.findMessages(conversation.getId()).size());
    }

    @Test
    void evictsOldestConversationsOverCap() throws Exception {
        properties.getMemory().setMaxConversations(2);
        String[] ids = new String[3];
        for (int i = 0; i < 3; i++) {
            ConversationRecord conversation = store.findOrCreate(OWNER, "23760000000" + i, "s1");
            store.appendMessage(conversation.getId(), message("m-" + i, "hi " + i, NOW.plusSeconds(i))).get();
            ids[i] = conversation.getId();
        }

        MemoryLifecycleManager.SweepResult result = managerAt(NOW.plusSeconds(60)).sweep();

        assertEquals(1, result.evictedOverCap());
        assertEquals(2, memoryTier.size());
        assertTrue(memoryTier.get(ids[0]).isEmpty());
        assertTrue(memoryTier.get(ids[2]).isPresent());
    }

    @Test
    void trimsCachedHistoryButKeepsDurableHistory() throws Exception {
        properties.getMemory().setMaxMessagesPerConversation(3);
        ConversationRecord conversation = store.findOrCreate(OWNER, "237600000001", "s1");
        for (int i = 0; i < 5; i++) {
            store.appendMessage(conversation.getId(), message("m-" + i, "text " + i, NOW.plusSeconds(i))).get();
        }

        MemoryLifecycleManager.SweepResult result = managerAt(NOW.plusSeconds(60)).sweep();

        assertEquals(2, result.trimmedMessages());
        assertEquals(3, memoryTier.messages(conversation.getId()).size());
        assertEquals(5, store.listMessages(conversation.getId()).size());
    }

    @Test
    void reportsFootprint() throws Exception {
        ConversationRecord conversation = store.findOrCreate(OWNER, "237600000001", "s1");
        store.appendMessage(conversation.getId(), message("m-1", "one", NOW)).get();
        store.appendMessage(conversation.getId(), message("m-2", "two", NOW.plusSeconds(1))).get();

        MemoryStats stats = managerAt(NOW).stats();

        assertEquals(1, stats.getConversationCount());
        assertEquals(2, stats.getMessageCount());
        assertEquals(2.0, stats.getAverageMessagesPerConversation());
        assertEquals(1024 + 2 * 512, stats.getEstimatedBytes());
        assertTrue(stats.getEstimatedMemory().endsWith(" MB"));
    }

    private MemoryLifecycleManager managerAt(Instant instant) {
        return new MemoryLifecycleManager(memoryTier, store, properties, Clock.fixed(instant, ZoneOffset.UTC));
    }

    private static MessageRecord message(String id, String content, Instant createdAt) {
        return MessageRecord.builder()
                .id(id)
                .content(content)
                .role(MessageRole.INBOUND_PARTY)
                .createdAt(createdAt)
                .build();
    }
}
