package me.golemcore.converse.domain.service;

import me.golemcore.converse.domain.exception.ConversationNotFoundException;
import me.golemcore.converse.domain.exception.DurablePersistenceException;
import me.golemcore.converse.domain.model.ConversationRecord;
import me.golemcore.converse.domain.model.DeliveryStatus;
import me.golemcore.converse.domain.model.MessageRecord;
import me.golemcore.converse.domain.model.MessageRole;
import me.golemcore.converse.infrastructure.config.ConverseProperties;
import me.golemcore.converse.testsupport.InMemoryConversationRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class ConversationStoreTest {

    private static final String OWNER = "owner-1";
    private static final String ADDRESS = "237691234567@s.whatsapp.net";
    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    private InMemoryConversationRepository repository;
    private ConversationMemoryTier memoryTier;
    private ExecutorService writeExecutor;
    private ConverseProperties properties;
    private ConversationStore store;

    @BeforeEach
    void setUp() {
        repository = new InMemoryConversationRepository();
        memoryTier = new ConversationMemoryTier();
        writeExecutor = Executors.newFixedThreadPool(2);
        properties = new ConverseProperties();
        store = new ConversationStore(repository, memoryTier, properties, writeExecutor,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        writeExecutor.shutdownNow();
    }

    // ==================== findOrCreate ====================

    @Test
    void equivalentAddressesShareOneConversation() {
        ConversationRecord first = store.findOrCreate(OWNER, ADDRESS, "session-1");
        ConversationRecord second = store.findOrCreate(OWNER, "+237 691 234 567", "session-1");

        assertEquals(first.getId(), second.getId());
        assertEquals("237691234567", first.getNormalizedAddress());
        assertEquals(1, repository.conversationCount());
    }

    @Test
    void concurrentFindOrCreateAcrossNodesYieldsOneConversation() throws Exception {
        // every node has its own memory tier, only the durable tier is shared
        int nodes = 8;
        List<ConversationStore> stores = new ArrayList<>();
        for (int i = 0; i < nodes; i++) {
            stores.add(new ConversationStore(repository, new ConversationMemoryTier(), properties, writeExecutor,
                    Clock.fixed(NOW, ZoneOffset.UTC)));
        }
        String[] formats = { ADDRESS, "237691234567", "+237 691 234 567", "237691234567:2@s.whatsapp.net" };

        ExecutorService callers = Executors.newFixedThreadPool(nodes);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<ConversationRecord>> results = new ArrayList<>();
        for (int i = 0; i < nodes; i++) {
            ConversationStore node = stores.get(i);
            String raw = formats[i % formats.length];
            results.add(callers.submit(() -> {
                start.await();
                return node.findOrCreate(OWNER, raw, "session-1");
            }));
        }
        start.countDown();

        String id = results.get(0).get().getId();
        for (Future<ConversationRecord> result : results) {
            assertEquals(id, result.get().getId());
        }
        callers.shutdownNow();

        new ConversationReconciliationService(repository, store, properties).reconcileOwner(OWNER);
        assertEquals(1, repository.findByOwner(OWNER).size());
    }

    @Test
    void keepsSenderNameAndRelinksSession() {
        ConversationRecord created = store.findOrCreate(
                ChannelAddressNormalizer.resolve(OWNER, ADDRESS), "session-1", null);
        assertEquals("+237691234567", created.getDisplayName());

        ConversationRecord renamed = store.findOrCreate(
                ChannelAddressNormalizer.resolve(OWNER, ADDRESS), "session-2", "Awa");

        assertEquals("Awa", renamed.getDisplayName());
        assertEquals("session-2", renamed.getLinkedChannelSessionId());
        ConversationRecord durable = repository.findById(created.getId()).orElseThrow();
        assertEquals("Awa", durable.getDisplayName());
        assertEquals("session-2", durable.getLinkedChannelSessionId());
    }

    @Test
    void requireFailsForUnknownConversation() {
        assertThrows(ConversationNotFoundException.class, () -> store.require("missing"));
    }

    // ==================== messages ====================

    @Test
    void sameMessageIdIsStoredOnce() throws Exception {
        ConversationRecord conversation = store.findOrCreate(OWNER, ADDRESS, "session-1");

        Optional<MessageRecord> first = store.appendMessage(conversation.getId(), inbound("m-1", "Bonjour", NOW))
                .get();
        Optional<MessageRecord> second = store.appendMessage(conversation.getId(), inbound("m-1", "Bonjour", NOW))
                .get();

        assertTrue(first.isPresent());
        assertTrue(second.isEmpty());
        assertEquals(1, repository.messageInserts());
    }

    @Test
    void sameContentWithinWindowIsStoredOnce() throws Exception {
        ConversationRecord conversation = store.findOrCreate(OWNER, ADDRESS, "session-1");

        store.appendMessage(conversation.getId(), inbound("m-1", "Prix du fret ?", NOW)).get();
        Optional<MessageRecord> echoed = store.appendMessage(conversation.getId(),
                inbound("m-2", "Prix du fret ?", NOW.plusSeconds(2))).get();
        Optional<MessageRecord> repeated = store.appendMessage(conversation.getId(),
                inbound("m-3", "Prix du fret ?", NOW.plusSeconds(30))).get();

        assertTrue(echoed.isEmpty());
        assertTrue(repeated.isPresent());
        assertEquals(2, repository.findMessages(conversation.getId()).size());
    }

    @Test
    void sameTextFromDifferentRolesIsNotDuplicate() throws Exception {
        ConversationRecord conversation = store.findOrCreate(OWNER, ADDRESS, "session-1");
        MessageRecord reply = inbound("m-2", "Merci", NOW.plusSeconds(1));
        reply.setRole(MessageRole.AUTOMATED_AGENT);

        store.appendMessage(conversation.getId(), inbound("m-1", "Merci", NOW)).get();
        Optional<MessageRecord> stored = store.appendMessage(conversation.getId(), reply).get();

        assertTrue(stored.isPresent());
    }

    @Test
    void sequenceNumbersAreStrictlyIncreasing() throws Exception {
        ConversationRecord conversation = store.findOrCreate(OWNER, ADDRESS, "session-1");

        for (int i = 1; i <= 5; i++) {
            MessageRecord stored = store.appendMessage(conversation.getId(),
                    inbound("m-" + i, "message " + i, NOW.plusSeconds(i))).get().orElseThrow();
            assertEquals(i, stored.getSequenceNumber());
        }

        List<MessageRecord> listed = store.listMessages(conversation.getId());
        assertEquals(5, listed.size());
        for (int i = 1; i < listed.size(); i++) {
            assertTrue(listed.get(i).getSequenceNumber() > listed.get(i - 1).getSequenceNumber());
        }
    }

    @Test
    void messagesAreOrderedByArrivalWhenChannelTimestampIsCoarser() throws Exception {
        ConversationRecord conversation = store.findOrCreate(OWNER, ADDRESS, "session-1");
        MessageRecord reply = inbound("out-1", "Le fret coute 850 USD/CBM", NOW.plusMillis(700));
        reply.setRole(MessageRole.AUTOMATED_AGENT);

        store.appendMessage(conversation.getId(), inbound("in-1", "Prix du fret ?", NOW.minusSeconds(2))).get();
        store.appendMessage(conversation.getId(), reply).get();
        store.appendMessage(conversation.getId(), inbound("in-2", "Et le delai ?", NOW)).get();

        List<MessageRecord> listed = store.listMessages(conversation.getId());
        assertEquals(List.of("in-1", "out-1", "in-2"), listed.stream().map(MessageRecord::getId).toList());
        assertEquals(List.of(1L, 2L, 3L), listed.stream().map(MessageRecord::getSequenceNumber).toList());

        ConversationRecord durable = repository.findById(conversation.getId()).orElseThrow();
        assertEquals("Et le delai ?", durable.getLastMessageText());
        assertEquals(NOW.plusMillis(700), durable.getLastMessageAt());
    }

    @Test
    void pendingMessagesFollowDurableHistory() throws Exception {
        ConversationRecord conversation = store.findOrCreate(OWNER, ADDRESS, "session-1");
        store.appendMessage(conversation.getId(), inbound("in-1", "Bonjour", NOW)).get();
        repository.setFailing(true);
        assertThrows(ExecutionException.class, () -> store.appendMessage(conversation.getId(),
                inbound("in-2", "Vous etes la ?", NOW.minusSeconds(5))).get());
        repository.setFailing(false);

        List<MessageRecord> listed = store.listMessages(conversation.getId());

        assertEquals(List.of("in-1", "in-2"), listed.stream().map(MessageRecord::getId).toList());
        assertFalse(listed.get(1).isDurable());
    }

    @Test
    void inboundMessageUpdatesConversationPreviewAndUnread() throws Exception {
        ConversationRecord conversation = store.findOrCreate(OWNER, ADDRESS, "session-1");

        store.appendMessage(conversation.getId(), inbound("m-1", "Bonjour", NOW)).get();

        ConversationRecord durable = repository.findById(conversation.getId()).orElseThrow();
        assertEquals("Bonjour", durable.getLastMessageText());
        assertEquals(1, durable.getUnreadCount());
        assertTrue(durable.isOnline());

        ConversationRecord read = store.markRead(conversation.getId());
        assertEquals(0, read.getUnreadCount());
        assertEquals(0, repository.findById(conversation.getId()).orElseThrow().getUnreadCount());
    }

    @Test
    void deliveryStatusIsUpdatedInBothTiers() throws Exception {
        ConversationRecord conversation = store.findOrCreate(OWNER, ADDRESS, "session-1");
        MessageRecord reply = inbound("r-1", "Voici nos tarifs", NOW);
        reply.setRole(MessageRole.AUTOMATED_AGENT);
        store.appendMessage(conversation.getId(), reply).get();

        store.updateDeliveryStatus(conversation.getId(), "r-1", DeliveryStatus.DELIVERED, Map.of());

        assertEquals(DeliveryStatus.DELIVERED,
                repository.findMessages(conversation.getId()).get(0).getDeliveryStatus());
        assertEquals(DeliveryStatus.DELIVERED, memoryTier.messages(conversation.getId()).get(0).getDeliveryStatus());
    }

    // ==================== durable outages ====================

    @Test
    void failedDurableWriteKeepsMessageInMemoryUntilFlush() throws Exception {
        ConversationRecord conversation = store.findOrCreate(OWNER, ADDRESS, "session-1");
        repository.setFailing(true);

        ExecutionException failure = assertThrows(ExecutionException.class,
                () -> store.appendMessage(conversation.getId(), inbound("m-1", "Bonjour", NOW)).get());
        assertInstanceOf(DurablePersistenceException.class, failure.getCause());

        List<MessageRecord> visible = store.listMessages(conversation.getId());
        assertEquals(1, visible.size());
        assertFalse(visible.get(0).isDurable());

        repository.setFailing(false);
        assertEquals(1, store.flushPending());
        assertEquals(1, repository.findMessages(conversation.getId()).get(0).getSequenceNumber());
        assertTrue(memoryTier.dirtyConversationIds().isEmpty());
    }

    @Test
    void provisionalConversationIsPromotedWhenDurableTierRecovers() throws Exception {
        repository.setFailing(true);
        ConversationRecord provisional = store.findOrCreate(OWNER, ADDRESS, "session-1");
        assertTrue(memoryTier.isProvisional(provisional.getId()));
        assertThrows(ExecutionException.class,
                () -> store.appendMessage(provisional.getId(), inbound("m-1", "Bonjour", NOW)).get());

        repository.setFailing(false);
        store.flushPending();

        assertFalse(memoryTier.isProvisional(provisional.getId()));
        assertEquals(1, repository.conversationCount());
        assertEquals(1, repository.findMessages(provisional.getId()).size());
    }

    @Test
    void provisionalConversationFollowsDurableOneCreatedMeanwhile() throws Exception {
        repository.setFailing(true);
        ConversationRecord provisional = store.findOrCreate(OWNER, ADDRESS, "session-1");
        assertThrows(ExecutionException.class,
                () -> store.appendMessage(provisional.getId(), inbound("m-1", "Bonjour", NOW)).get());
        repository.setFailing(false);

        ConversationRecord other = ConversationRecord.builder()
                .id("durable-1")
                .ownerId(OWNER)
                .normalizedAddress("237691234567")
                .createdAt(NOW.minusSeconds(60))
                .updatedAt(NOW.minusSeconds(60))
                .build();
        repository.insertUnchecked(other);

        store.flushPending();

        assertEquals("durable-1", store.canonicalId(provisional.getId()));
        assertEquals(1, repository.findMessages("durable-1").size());
        assertEquals(1, repository.conversationCount());
    }

    // ==================== listForOwner ====================

    @Test
    void listMergesFieldsFromTheFreshestCopy() {
        Instant t0 = NOW.minusSeconds(300);
        ConversationRecord durable = ConversationRecord.builder()
                .id("c-1")
                .ownerId(OWNER)
                .normalizedAddress("237691234567")
                .lastMessageText("committed durably")
                .lastMessageAt(NOW)
                .unreadCount(1)
                .unreadUpdatedAt(t0)
                .createdAt(t0)
                .updatedAt(t0)
                .build();
        repository.insertUnchecked(durable);

        ConversationRecord cached = durable.copy();
        cached.setLastMessageText("older preview");
        cached.setLastMessageAt(NOW.minusSeconds(60));
        cached.setUnreadCount(5);
        cached.setUnreadUpdatedAt(NOW.minusSeconds(30));
        memoryTier.mirror(cached, false);

        List<ConversationRecord> listed = store.listForOwner(OWNER, null);

        assertEquals(1, listed.size());
        assertEquals("committed durably", listed.get(0).getLastMessageText());
        assertEquals(5, listed.get(0).getUnreadCount());
    }

    @Test
    void listFiltersBySessionAndOrdersByRecentActivity() throws Exception {
        ConversationRecord older = store.findOrCreate(OWNER, "237600000001", "session-1");
        ConversationRecord newer = store.findOrCreate(OWNER, "237600000002", "session-1");
        store.findOrCreate(OWNER, "237600000003", "session-2");
        store.appendMessage(older.getId(), inbound("m-1", "first", NOW)).get();
        store.appendMessage(newer.getId(), inbound("m-2", "second", NOW.plusSeconds(10))).get();

        List<ConversationRecord> listed = store.listForOwner(OWNER, "session-1");

        assertEquals(List.of(newer.getId(), older.getId()),
                listed.stream().map(ConversationRecord::getId).toList());
        assertEquals(3, store.listForOwner(OWNER, null).size());
    }

    private static MessageRecord inbound(String id, String content, Instant createdAt) {
        return MessageRecord.builder()
                .id(id)
                .content(content)
                .role(MessageRole.INBOUND_PARTY)
                .deliveryStatus(DeliveryStatus.RECEIVED)
                .createdAt(createdAt)
                .build();
    }
}
