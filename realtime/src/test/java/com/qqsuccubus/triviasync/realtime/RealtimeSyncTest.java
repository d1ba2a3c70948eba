package com.qqsuccubus.triviasync.realtime;

import com.qqsuccubus.triviasync.core.model.GamePhase;
import com.qqsuccubus.triviasync.core.model.GameState;
import com.qqsuccubus.triviasync.core.model.PresenceRecord;
import com.qqsuccubus.triviasync.realtime.backend.InMemoryRealtimeBackend;
import com.qqsuccubus.triviasync.realtime.backend.InMemoryStateStore;
import com.qqsuccubus.triviasync.realtime.config.SyncConfig;
import com.qqsuccubus.triviasync.realtime.connection.ConnectionStatus;
import com.qqsuccubus.triviasync.realtime.presence.ContextType;
import com.qqsuccubus.triviasync.realtime.presence.PresenceJoinRequest;
import com.qqsuccubus.triviasync.realtime.state.SyncOutcome;
import com.qqsuccubus.triviasync.realtime.state.SyncResult;
import com.qqsuccubus.triviasync.realtime.subscription.TeamSubscriptionOptions;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.scheduler.VirtualTimeScheduler;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end wiring of the facade against in-memory transport and store.
 */
class RealtimeSyncTest {

    private VirtualTimeScheduler scheduler;
    private InMemoryRealtimeBackend backend;
    private InMemoryStateStore store;
    private RealtimeSync sync;

    @BeforeEach
    void setUp() {
        scheduler = VirtualTimeScheduler.create();
        backend = new InMemoryRealtimeBackend();
        store = new InMemoryStateStore();
        sync = new RealtimeSync(SyncConfig.builder().clientId("facade-client").build(), backend, store,
            new SimpleMeterRegistry(), scheduler);
    }

    @Test
    void testStart_ConnectsTransport() {
        sync.start();

        assertEquals(ConnectionStatus.CONNECTED, sync.getConnectionMonitor().getStatus());
        assertEquals(1, backend.connectCalls());
        assertTrue(sync.scrape().isEmpty());

        sync.close();
        scheduler.dispose();
    }

    @Test
    void testSynchronizerFor_OnePerGame() {
        assertSame(sync.synchronizerFor("g1"), sync.synchronizerFor("g1"));
        assertNotSame(sync.synchronizerFor("g1"), sync.synchronizerFor("g2"));

        SyncResult result = sync.synchronizerFor("g1").syncState(GameState.builder()
            .id("g1")
            .phase(GamePhase.PRE_GAME)
            .build()).block();

        assertNotNull(result);
        assertEquals(SyncOutcome.CLEAN, result.getOutcome());
        assertEquals(1L, store.get("g1").getVersion());

        sync.close();
        scheduler.dispose();
    }

    @Test
    @DisplayName("Closing leaves presence and releases every channel")
    void testClose_ReleasesEverything() {
        sync.start();
        PresenceRecord record = sync.getPresenceService().join(ContextType.ROOM, "r1", PresenceJoinRequest.builder()
            .userId("u1")
            .username("quizmaster")
            .build()).block();
        sync.getSubscriptionService().subscribeToTeam(TeamSubscriptionOptions.builder()
            .teamId("t1")
            .onAnswer(change -> { })
            .build()).block();

        assertNotNull(record);
        assertEquals(2, sync.getChannelManager().getAllSubscriptions().size());

        sync.close();

        assertTrue(sync.getChannelManager().getAllSubscriptions().isEmpty());
        assertTrue(backend.presenceOf("presence:room:r1").isEmpty());
        assertEquals(0, backend.subscribedHandles("team_answers"));
        assertTrue(sync.getPresenceService().getLocalPresence(record.getSessionId()).isEmpty());
        scheduler.dispose();
    }
}
