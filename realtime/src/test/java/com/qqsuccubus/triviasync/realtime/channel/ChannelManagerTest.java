package com.qqsuccubus.triviasync.realtime.channel;

import com.qqsuccubus.triviasync.core.model.PresenceRecord;
import com.qqsuccubus.triviasync.core.model.PresenceRole;
import com.qqsuccubus.triviasync.core.model.PresenceStatus;
import com.qqsuccubus.triviasync.core.msg.BroadcastMessage;
import com.qqsuccubus.triviasync.core.msg.ConnectionEvent;
import com.qqsuccubus.triviasync.core.msg.TableChange;
import com.qqsuccubus.triviasync.core.util.JsonUtils;
import com.qqsuccubus.triviasync.realtime.backend.ChannelException;
import com.qqsuccubus.triviasync.realtime.backend.InMemoryRealtimeBackend;
import com.qqsuccubus.triviasync.realtime.config.SyncConfig;
import com.qqsuccubus.triviasync.realtime.metrics.MetricsService;
import com.qqsuccubus.triviasync.realtime.optimizer.PerformanceOptimizer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Channel lifecycle tests against the in-memory backend.
 */
class ChannelManagerTest {

    private VirtualTimeScheduler scheduler;
    private InMemoryRealtimeBackend backend;
    private PerformanceOptimizer optimizer;
    private ChannelManager channelManager;

    @BeforeEach
    void setUp() {
        scheduler = VirtualTimeScheduler.create();
        SyncConfig config = SyncConfig.builder().clientId("test-client").build();
        MetricsService metricsService = new MetricsService(new SimpleMeterRegistry(), config);
        backend = new InMemoryRealtimeBackend();
        optimizer = new PerformanceOptimizer(config, metricsService, scheduler);
        channelManager = new ChannelManager(backend, optimizer, metricsService, config, scheduler);
    }

    @AfterEach
    void tearDown() {
        channelManager.dispose().block();
        optimizer.dispose();
        scheduler.dispose();
    }

    private static TableChange answerInserted(int id) {
        return TableChange.inserted("answers", JsonUtils.objectNode().put("id", id), 0L);
    }

    private String subscribeAnswers(String id, List<TableChange> sink) {
        return channelManager.subscribeTable("answers", TableOptions.builder().id(id).build(), sink::add).block();
    }

    // ========== Subscribe Tests ==========

    @Test
    void testSubscribeTable_DeliversEvents() {
        List<TableChange> received = new ArrayList<>();

        StepVerifier.create(channelManager.subscribeTable("answers",
                TableOptions.builder().id("answers-r1").build(), received::add))
            .expectNext("answers-r1")
            .verifyComplete();

        backend.emitTableChange(answerInserted(1));
        backend.emitTableChange(answerInserted(2));

        assertEquals(2, received.size());
        assertEquals(1, received.get(0).getNewRecord().get("id").asInt());
        assertTrue(channelManager.isActive("answers-r1"));
        assertEquals(2, channelManager.getMetrics().getEventCount());
    }

    @Test
    void testSubscribeTable_DerivedIdContainsKindAndTable() {
        String id = channelManager.subscribeTable("answers", TableOptions.builder().build(), change -> { }).block();

        assertNotNull(id);
        assertTrue(id.startsWith("table-change_answers_"), id);
    }

    @Test
    @DisplayName("A duplicate id keeps the existing subscription")
    void testSubscribe_DuplicateIdReturnsExisting() {
        List<TableChange> first = new ArrayList<>();
        List<TableChange> second = new ArrayList<>();

        assertEquals("dup", subscribeAnswers("dup", first));
        assertEquals("dup", subscribeAnswers("dup", second));

        assertEquals(1, backend.subscribeCalls("answers"));
        assertEquals(1, channelManager.getAllSubscriptions().size());

        backend.emitTableChange(answerInserted(1));
        assertEquals(1, first.size());
        assertTrue(second.isEmpty());
    }

    @Test
    void testSubscribe_FailureRemovesSubscription() {
        backend.failSubscribes("answers", 1);

        StepVerifier.create(channelManager.subscribeTable("answers",
                TableOptions.builder().id("failing").build(), change -> { }))
            .expectError(ChannelException.class)
            .verify();

        assertTrue(channelManager.getSubscription("failing").isEmpty());
        assertEquals(0, channelManager.getMetrics().getTotalSubscriptions());
    }

    @Test
    void testSubscribeBroadcast_FiltersByEvent() {
        List<BroadcastMessage> received = new ArrayList<>();
        channelManager.subscribeBroadcast("room-1",
            BroadcastOptions.builder().event("question_revealed").build(), received::add).block();

        backend.emitBroadcast("room-1", "timer_tick", JsonUtils.objectNode());
        backend.emitBroadcast("room-1", "question_revealed", JsonUtils.objectNode().put("q", 3));

        assertEquals(1, received.size());
        assertEquals("question_revealed", received.get(0).getEvent());
    }

    @Test
    @DisplayName("A failing listener does not stop later events or other subscriptions")
    void testDispatch_ListenerFailureIsIsolated() {
        List<TableChange> healthy = new ArrayList<>();
        List<TableChange> attempted = new ArrayList<>();
        channelManager.subscribeTable("answers", TableOptions.builder().id("fragile").build(), change -> {
            attempted.add(change);
            throw new IllegalStateException("listener bug");
        }).block();
        subscribeAnswers("healthy", healthy);

        backend.emitTableChange(answerInserted(1));
        backend.emitTableChange(answerInserted(2));

        assertEquals(2, attempted.size());
        assertEquals(2, healthy.size());
        assertTrue(channelManager.isActive("fragile"));
    }

    // ========== Presence Tests ==========

    @Test
    void testSubscribePresence_SyncThenOwnJoin() {
        List<Map<String, List<PresenceRecord>>> syncs = new ArrayList<>();
        List<String> joins = new ArrayList<>();
        List<String> leaves = new ArrayList<>();
        PresenceCallbacks callbacks = PresenceCallbacks.builder()
            .onSync(syncs::add)
            .onJoin((key, records) -> joins.add(key))
            .onLeave((key, records) -> leaves.add(key))
            .build();
        PresenceRecord record = PresenceRecord.builder()
            .sessionId("s1")
            .userId("u1")
            .role(PresenceRole.PLAYER)
            .status(PresenceStatus.ONLINE)
            .build();

        channelManager.subscribePresence("presence:room:r1", record, callbacks, "p1").block();

        assertEquals(1, syncs.size());
        assertEquals(List.of("u1"), joins);
        assertEquals(List.of(record), backend.presenceOf("presence:room:r1").get("u1"));

        PresenceRecord away = record.withStatus(PresenceStatus.AWAY);
        channelManager.updatePresence("p1", away).block();
        assertEquals(List.of(away), backend.presenceOf("presence:room:r1").get("u1"));

        channelManager.untrackPresence("p1").block();
        assertEquals(List.of("u1"), leaves);
        assertTrue(backend.presenceOf("presence:room:r1").isEmpty());
    }

    // ========== Transport Lifecycle Tests ==========

    @Test
    void testTransportClose_MarksInactive() {
        subscribeAnswers("a1", new ArrayList<>());

        backend.emitConnection(ConnectionEvent.close(0L));

        assertFalse(channelManager.isActive("a1"));
        assertEquals(SubscriptionState.INACTIVE, channelManager.getChannelHealth().get("a1").getState());
        assertEquals(0, channelManager.getMetrics().getActiveSubscriptions());
    }

    @Test
    @DisplayName("Reopen restores inactive subscriptions with a fresh handle")
    void testTransportReopen_Resubscribes() {
        List<TableChange> received = new ArrayList<>();
        subscribeAnswers("a1", received);

        backend.emitConnection(ConnectionEvent.close(0L));
        scheduler.advanceTimeBy(Duration.ofSeconds(3));
        backend.emitConnection(ConnectionEvent.open(0L));

        assertTrue(channelManager.isActive("a1"));
        assertEquals(2, backend.subscribeCalls("answers"));
        assertEquals(1, channelManager.getChannelHealth().get("a1").getConnectionAttempts());
        assertEquals(3000L, channelManager.getMetrics().getLastReconnectTime());

        backend.emitTableChange(answerInserted(7));
        assertEquals(1, received.size());
    }

    @Test
    void testTransportReopen_RetriesFailedResubscribe() {
        subscribeAnswers("a1", new ArrayList<>());
        backend.emitConnection(ConnectionEvent.close(0L));
        backend.failSubscribes("answers", 2);

        backend.emitConnection(ConnectionEvent.open(0L));
        assertFalse(channelManager.isActive("a1"));

        scheduler.advanceTimeBy(Duration.ofSeconds(10));

        assertTrue(channelManager.isActive("a1"));
        assertEquals(4, backend.subscribeCalls("answers"));
    }

    @Test
    void testTransportError_CountsAttempts() {
        backend.emitConnection(ConnectionEvent.error(new RuntimeException("socket reset"), 0L));
        backend.emitConnection(ConnectionEvent.error(new RuntimeException("socket reset"), 0L));

        assertEquals(2, channelManager.getMetrics().getConnectionAttempts());
    }

    // ========== Unsubscribe Tests ==========

    @Test
    void testUnsubscribe_IsIdempotent() {
        List<TableChange> received = new ArrayList<>();
        subscribeAnswers("a1", received);

        StepVerifier.create(channelManager.unsubscribe("a1")).verifyComplete();
        StepVerifier.create(channelManager.unsubscribe("a1")).verifyComplete();

        assertEquals(0, backend.subscribedHandles("answers"));
        assertTrue(channelManager.getSubscription("a1").isEmpty());

        backend.emitTableChange(answerInserted(1));
        assertTrue(received.isEmpty());
    }

    @Test
    void testUnsubscribeAll_RemovesEverything() {
        subscribeAnswers("a1", new ArrayList<>());
        subscribeAnswers("a2", new ArrayList<>());
        channelManager.subscribeBroadcast("room-1", BroadcastOptions.builder().build(), message -> { }).block();

        channelManager.unsubscribeAll().block();

        assertTrue(channelManager.getAllSubscriptions().isEmpty());
        assertEquals(0, backend.subscribedHandles("answers"));
        assertEquals(0, backend.subscribedHandles("room-1"));
    }
}
