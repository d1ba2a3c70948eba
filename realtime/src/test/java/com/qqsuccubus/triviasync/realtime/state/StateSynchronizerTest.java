package com.qqsuccubus.triviasync.realtime.state;

import com.qqsuccubus.triviasync.core.metrics.MetricsNames;
import com.qqsuccubus.triviasync.core.metrics.MetricsTags;
import com.qqsuccubus.triviasync.core.model.GamePhase;
import com.qqsuccubus.triviasync.core.model.GameState;
import com.qqsuccubus.triviasync.realtime.backend.InMemoryStateStore;
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

class StateSynchronizerTest {

    private static final String GAME = "g1";

    private VirtualTimeScheduler scheduler;
    private SimpleMeterRegistry registry;
    private InMemoryStateStore store;
    private PerformanceOptimizer optimizer;
    private StateSynchronizer synchronizer;

    @BeforeEach
    void setUp() {
        scheduler = VirtualTimeScheduler.create();
        registry = new SimpleMeterRegistry();
        store = new InMemoryStateStore();
        SyncConfig config = SyncConfig.builder().clientId("client-a").build();
        MetricsService metricsService = new MetricsService(registry, config);
        optimizer = new PerformanceOptimizer(config, metricsService, scheduler);
        synchronizer = new StateSynchronizer(GAME, store, optimizer, metricsService, config, scheduler);
    }

    @AfterEach
    void tearDown() {
        synchronizer.dispose();
        optimizer.dispose();
        scheduler.dispose();
    }

    private static GameState state(GamePhase phase, int round) {
        return GameState.builder()
            .id(GAME)
            .roomId("r1")
            .hostId("h1")
            .phase(phase)
            .currentRound(round)
            .active(true)
            .build();
    }

    private double syncCount(String outcome) {
        return registry.get(MetricsNames.SYNC_TOTAL).tag(MetricsTags.OUTCOME, outcome).counter().count();
    }

    // ========== Sync Outcome Tests ==========

    @Test
    void testSync_EmptyStoreWritesFirstVersion() {
        SyncResult result = synchronizer.syncState(state(GamePhase.PRE_GAME, 0)).block();

        assertNotNull(result);
        assertTrue(result.isSuccess());
        assertEquals(SyncOutcome.CLEAN, result.getOutcome());
        assertEquals(1L, result.getVersion());
        assertEquals(1L, store.get(GAME).getVersion());
        assertEquals("client-a", store.get(GAME).getClientId());
        assertEquals(1L, synchronizer.getSyncStatus().getCurrentVersion());
        assertEquals(1, synchronizer.getSyncStatus().getHistorySize());
    }

    @Test
    void testSync_MatchingRemoteIsCleanWithoutWrite() {
        store.put(GAME, state(GamePhase.SCORING, 2), 4, 100L, "client-b");

        SyncResult result = synchronizer.syncState(state(GamePhase.SCORING, 2)).block();

        assertNotNull(result);
        assertEquals(SyncOutcome.CLEAN, result.getOutcome());
        assertEquals(4L, result.getVersion());
        assertNull(result.getConflict());
        assertEquals(0, store.writes());
        assertEquals(1.0, syncCount("clean"));
    }

    @Test
    @DisplayName("A conflict is resolved and written with the next version")
    void testSync_ConflictResolvedWithNextVersion() {
        scheduler.advanceTimeBy(Duration.ofSeconds(1));
        store.put(GAME, state(GamePhase.SCORING, 2), 4, 500L, "client-b");
        List<StateConflict> conflicts = new ArrayList<>();
        synchronizer.onConflict(conflicts::add);

        SyncResult result = synchronizer.syncState(state(GamePhase.ANSWER_REVIEW, 2).withLastUpdated(100L)).block();

        assertNotNull(result);
        assertEquals(SyncOutcome.RESOLVED, result.getOutcome());
        assertEquals(5L, result.getVersion());
        assertEquals(GamePhase.SCORING, result.getState().getPhase());
        assertEquals(ConflictType.VERSION, result.getConflict().getType());
        assertEquals(1, conflicts.size());
        assertEquals(5L, store.get(GAME).getVersion());
        assertEquals(1000L, store.get(GAME).getTimestamp());
        assertEquals(1.0, registry.get(MetricsNames.SYNC_CONFLICTS_TOTAL)
            .tag(MetricsTags.TYPE, "version").counter().count());
    }

    @Test
    void testSync_MergeStrategyCombinesFields() {
        store.put(GAME, state(GamePhase.SCORING, 2), 2, 500L, "client-b");

        SyncResult result = synchronizer.syncState(state(GamePhase.QUESTION_DISPLAY, 3).withLastUpdated(100L),
            SyncOptions.builder().strategy(ResolutionStrategy.MERGE).build()).block();

        assertNotNull(result);
        assertEquals(SyncOutcome.RESOLVED, result.getOutcome());
        assertEquals(GamePhase.SCORING, result.getState().getPhase());
        assertEquals(3, result.getState().getCurrentRound());
        assertEquals(3L, result.getVersion());
    }

    @Test
    @DisplayName("An attribute named timestamp survives an attribute merge")
    void testSync_MergeKeepsTimestampAttribute() {
        GameState remote = state(GamePhase.SCORING, 2).withAttributes(Map.of("timestamp", "remote-mark"));
        store.put(GAME, remote, 2, 500L, "client-b");
        GameState local = state(GamePhase.SCORING, 2)
            .withAttributes(Map.of("timestamp", "local-mark", "theme", "space"))
            .withLastUpdated(900L);

        SyncResult result = synchronizer.syncState(local,
            SyncOptions.builder().strategy(ResolutionStrategy.MERGE).build()).block();

        assertNotNull(result);
        assertEquals(SyncOutcome.RESOLVED, result.getOutcome());
        assertEquals(Map.of("timestamp", "local-mark", "theme", "space"), result.getState().getAttributes());
    }

    @Test
    void testSync_ForceLocalOverridesStrategy() {
        store.put(GAME, state(GamePhase.SCORING, 2), 2, 500L, "client-b");

        SyncResult result = synchronizer.syncState(state(GamePhase.ROUND_INTRO, 1).withLastUpdated(100L),
            SyncOptions.builder().strategy(ResolutionStrategy.REMOTE_WINS).forceLocal(true).build()).block();

        assertNotNull(result);
        assertEquals(GamePhase.ROUND_INTRO, result.getState().getPhase());
        assertEquals(GamePhase.ROUND_INTRO, store.get(GAME).getState().getPhase());
    }

    // ========== Concurrency Tests ==========

    @Test
    @DisplayName("A sync arriving while another runs is skipped and marked pending")
    void testSync_ConcurrentCallSkipped() {
        store.delayReads(Duration.ofSeconds(1), scheduler);
        List<SyncResult> firstResults = new ArrayList<>();
        synchronizer.syncState(state(GamePhase.PRE_GAME, 0)).subscribe(firstResults::add);

        StepVerifier.create(synchronizer.syncState(state(GamePhase.ROUND_INTRO, 1)))
            .assertNext(result -> {
                assertFalse(result.isSuccess());
                assertEquals(SyncOutcome.SKIPPED, result.getOutcome());
            })
            .verifyComplete();

        assertTrue(synchronizer.getSyncStatus().isInProgress());
        assertTrue(synchronizer.getSyncStatus().isPendingSync());

        scheduler.advanceTimeBy(Duration.ofSeconds(1));

        assertEquals(1, firstResults.size());
        assertEquals(SyncOutcome.CLEAN, firstResults.get(0).getOutcome());
        assertFalse(synchronizer.getSyncStatus().isInProgress());
        assertFalse(synchronizer.getSyncStatus().isPendingSync());
        assertEquals(1, store.reads());
        assertEquals(1.0, syncCount("skipped"));
    }

    @Test
    void testSync_PendingFollowUpReplayedOnce() {
        store.delayReads(Duration.ofSeconds(1), scheduler);
        List<SyncResult> results = new ArrayList<>();
        synchronizer.onSync(results::add);

        synchronizer.syncState(state(GamePhase.PRE_GAME, 0)).subscribe();
        synchronizer.syncState(state(GamePhase.ROUND_INTRO, 1), SyncOptions.builder().followUp(true).build()).block();

        scheduler.advanceTimeBy(Duration.ofSeconds(1));
        assertEquals(1, store.reads());

        scheduler.advanceTimeBy(Duration.ofSeconds(1));
        assertEquals(2, store.reads());
        assertEquals(2, results.size());
        assertEquals(2L, store.get(GAME).getVersion());
        assertEquals(GamePhase.ROUND_INTRO, store.get(GAME).getState().getPhase());

        scheduler.advanceTimeBy(Duration.ofSeconds(5));
        assertEquals(2, store.reads());
    }

    // ========== Retry Tests ==========

    @Test
    void testSync_TransientReadFailuresRetried() {
        store.failReads(2);
        List<SyncResult> results = new ArrayList<>();
        synchronizer.syncState(state(GamePhase.PRE_GAME, 0)).subscribe(results::add);

        scheduler.advanceTimeBy(Duration.ofSeconds(10));

        assertEquals(1, results.size());
        assertTrue(results.get(0).isSuccess());
        assertEquals(3, store.reads());
    }

    @Test
    void testSync_ExhaustedRetriesReportFailed() {
        store.failReads(100);
        List<SyncResult> results = new ArrayList<>();
        List<Throwable> errors = new ArrayList<>();
        synchronizer.onError(errors::add);

        synchronizer.syncState(state(GamePhase.PRE_GAME, 0)).subscribe(results::add);
        scheduler.advanceTimeBy(Duration.ofMinutes(1));

        assertEquals(1, results.size());
        assertEquals(SyncOutcome.FAILED, results.get(0).getOutcome());
        assertFalse(results.get(0).isSuccess());
        assertEquals("read of g1 failed", results.get(0).getError());
        assertEquals(4, store.reads());
        assertEquals(1, errors.size());
        assertEquals("read of g1 failed", synchronizer.getSyncStatus().getLastError());
        assertFalse(synchronizer.getSyncStatus().isInProgress());
    }

    // ========== History Tests ==========

    @Test
    void testRollback_WritesHistoricalStateAsNextVersion() {
        synchronizer.syncState(state(GamePhase.PRE_GAME, 0)).block();
        scheduler.advanceTimeBy(Duration.ofSeconds(5));
        synchronizer.syncState(state(GamePhase.ROUND_INTRO, 1)).block();
        assertEquals(2L, store.get(GAME).getVersion());

        GameState restored = synchronizer.rollbackToVersion(1).block();

        assertNotNull(restored);
        assertEquals(GamePhase.PRE_GAME, restored.getPhase());
        assertEquals(3L, store.get(GAME).getVersion());
        assertEquals(GamePhase.PRE_GAME, store.get(GAME).getState().getPhase());
        assertEquals(List.of(2L, 3L), synchronizer.getHistory(2).stream().map(StateVersion::getVersion).toList());

        StepVerifier.create(synchronizer.rollbackToVersion(99)).verifyComplete();
    }

    @Test
    void testRollback_ReturnsSnapshotWhenWriteBackFails() {
        synchronizer.syncState(state(GamePhase.PRE_GAME, 0)).block();
        scheduler.advanceTimeBy(Duration.ofSeconds(5));
        synchronizer.syncState(state(GamePhase.ROUND_INTRO, 1)).block();
        store.failWrites(100);
        List<Throwable> errors = new ArrayList<>();
        synchronizer.onError(errors::add);

        List<GameState> restored = new ArrayList<>();
        synchronizer.rollbackToVersion(1).subscribe(restored::add);
        scheduler.advanceTimeBy(Duration.ofMinutes(1));

        assertEquals(1, restored.size());
        assertEquals(GamePhase.PRE_GAME, restored.get(0).getPhase());
        assertEquals(2L, store.get(GAME).getVersion());
        assertEquals(2L, synchronizer.getSyncStatus().getCurrentVersion());
        assertEquals("write of g1 failed", synchronizer.getSyncStatus().getLastError());
        assertEquals(1, errors.size());
    }

    @Test
    void testClearHistory_EmptiesHistory() {
        synchronizer.syncState(state(GamePhase.PRE_GAME, 0)).block();

        synchronizer.clearHistory();

        assertTrue(synchronizer.getHistory(10).isEmpty());
        assertEquals(1L, synchronizer.getSyncStatus().getCurrentVersion());
    }
}
