package com.qqsuccubus.triviasync.realtime.presence;

import com.qqsuccubus.triviasync.core.model.NetworkQuality;
import com.qqsuccubus.triviasync.core.model.PresenceActivity;
import com.qqsuccubus.triviasync.core.model.PresenceRecord;
import com.qqsuccubus.triviasync.core.model.PresenceRole;
import com.qqsuccubus.triviasync.core.model.PresenceStatus;
import com.qqsuccubus.triviasync.realtime.channel.ChannelManager;
import com.qqsuccubus.triviasync.realtime.channel.PresenceCallbacks;
import com.qqsuccubus.triviasync.realtime.config.SyncConfig;
import com.qqsuccubus.triviasync.realtime.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Presence of local sessions and of everyone else in the same rooms and teams.
 * <p>
 * Each joined session gets its own presence subscription on {@code presence:<type>:<id>}, a
 * heartbeat that re-tracks the record with a fresh {@code lastSeen}, and an inactivity timer
 * that moves the session to AWAY and then OFFLINE exactly when the idle thresholds pass. The
 * timer is re-armed on every reported activity.
 * </p>
 */
public class PresenceService {
    private static final Logger log = LoggerFactory.getLogger(PresenceService.class);

    private final ChannelManager channelManager;
    private final MetricsService metricsService;
    private final SyncConfig config;
    private final Scheduler scheduler;

    // Local sessions: session id -> session
    private final Map<String, LocalSession> sessions = new ConcurrentHashMap<>();
    // Remote view: channel -> presence key -> records
    private final Map<String, Map<String, List<PresenceRecord>>> presenceState = new ConcurrentHashMap<>();

    private final Sinks.Many<PresenceEvent> eventSink = Sinks.many().multicast().directBestEffort();

    private volatile int peakConcurrentUsers;
    private volatile long averageSessionDurationMs;
    private volatile int endedSessions;

    public PresenceService(ChannelManager channelManager, MetricsService metricsService,
                           SyncConfig config, Scheduler scheduler) {
        this.channelManager = channelManager;
        this.metricsService = metricsService;
        this.config = config;
        this.scheduler = scheduler;
        metricsService.registerPresenceSessionsGauge(sessions::size);
    }

    /**
     * Joins a room or team context with a new session.
     *
     * @return the tracked record, carrying the new session id
     */
    public Mono<PresenceRecord> join(ContextType contextType, String contextId, PresenceJoinRequest request) {
        return Mono.defer(() -> {
            long now = now();
            String sessionId = "session-" + now + "-" + randomSuffix();
            String channel = contextType.channel(contextId);

            PresenceRecord record = PresenceRecord.builder()
                .sessionId(sessionId)
                .userId(request.getUserId())
                .username(request.getUsername())
                .displayName(request.getDisplayName() != null ? request.getDisplayName() : request.getUsername())
                .avatarUrl(request.getAvatarUrl())
                .role(request.getRole())
                .status(request.getStatus())
                .currentActivity(request.getActivity())
                .teamId(request.getTeamId())
                .teamName(request.getTeamName())
                .gameRoomId(request.getGameRoomId())
                .joinedAt(now)
                .lastSeen(now)
                .deviceInfo(DeviceFingerprint.fromUserAgent(request.getUserAgent()))
                .networkQuality(NetworkQuality.GOOD)
                .build();

            LocalSession session = new LocalSession(sessionId, contextType, contextId, channel,
                channel + ":" + sessionId, now, record);

            return channelManager.subscribePresence(channel, record, callbacks(contextType, contextId, channel),
                    session.subscriptionId)
                .doOnNext(id -> {
                    sessions.put(sessionId, session);
                    upsert(channel, record);
                    startTimers(session);
                    updatePeak();
                    log.info("User {} joined {} as {}", record.getUserId(), channel, sessionId);
                })
                .thenReturn(record);
        });
    }

    private PresenceCallbacks callbacks(ContextType contextType, String contextId, String channel) {
        return PresenceCallbacks.builder()
            .onSync(state -> {
                Map<String, List<PresenceRecord>> copy = new ConcurrentHashMap<>();
                state.forEach((key, records) -> copy.put(key, new ArrayList<>(records)));
                presenceState.put(channel, copy);
                updatePeak();
                emit(PresenceEventType.PRESENCE_SYNCED, contextType, contextId, null, null, null);
            })
            .onJoin((key, joined) -> {
                for (PresenceRecord record : joined) {
                    if (upsert(channel, record)) {
                        emit(PresenceEventType.USER_JOINED, contextType, contextId, record, null, null);
                    }
                }
                updatePeak();
            })
            .onLeave((key, left) -> {
                for (PresenceRecord record : left) {
                    if (remove(channel, record.getSessionId())) {
                        emit(PresenceEventType.USER_LEFT, contextType, contextId, record, null, null);
                    }
                }
            })
            .build();
    }

    private void startTimers(LocalSession session) {
        session.heartbeat = Flux.interval(config.getHeartbeatInterval(), config.getHeartbeatInterval(), scheduler)
            .concatMap(tick -> {
                PresenceRecord refreshed = session.record.withLastSeen(now());
                session.record = refreshed;
                return channelManager.updatePresence(session.subscriptionId, refreshed)
                    .doOnSuccess(v -> metricsService.recordHeartbeat(true))
                    .onErrorResume(err -> {
                        log.warn("Heartbeat failed for {}", session.sessionId, err);
                        metricsService.recordHeartbeat(false);
                        return Mono.empty();
                    });
            })
            .subscribe();

        armInactivity(session);
    }

    /**
     * Schedules the next idle transition of a session: AWAY for an ONLINE session, then OFFLINE.
     */
    private void armInactivity(LocalSession session) {
        Disposable previous = session.inactivityTimer;
        if (previous != null) {
            previous.dispose();
        }
        PresenceStatus status = session.record.getStatus();
        if (status == PresenceStatus.OFFLINE || sessions.get(session.sessionId) != session) {
            session.inactivityTimer = null;
            return;
        }
        long idle = now() - session.lastActivity;
        long awayAfter = config.getAwayAfter().toMillis();
        long threshold = status == PresenceStatus.ONLINE && idle < awayAfter ? awayAfter : config.getOfflineAfter().toMillis();
        // At least 1 ms so the timer never fires before this method returns
        long delay = Math.max(1, threshold - idle);

        session.inactivityTimer = Mono.delay(Duration.ofMillis(delay), scheduler)
            .then(Mono.defer(() -> checkInactivity(session)))
            .subscribe(v -> { },
                err -> log.error("Inactivity timer failed for {}", session.sessionId, err),
                () -> armInactivity(session));
    }

    private Mono<Void> checkInactivity(LocalSession session) {
        long idle = now() - session.lastActivity;
        PresenceStatus status = session.record.getStatus();

        if (idle >= config.getOfflineAfter().toMillis() && status != PresenceStatus.OFFLINE) {
            log.debug("Session {} idle for {} ms, going offline", session.sessionId, idle);
            return applyUpdate(session, PresenceUpdate.builder().status(PresenceStatus.OFFLINE).build());
        }
        if (idle >= config.getAwayAfter().toMillis() && status == PresenceStatus.ONLINE) {
            log.debug("Session {} idle for {} ms, going away", session.sessionId, idle);
            return applyUpdate(session, PresenceUpdate.builder().status(PresenceStatus.AWAY).build());
        }
        return Mono.empty();
    }

    /**
     * Reports user activity for a session; an AWAY or OFFLINE session comes back ONLINE.
     */
    public Mono<Void> recordActivity(String sessionId, ActivitySignal signal) {
        return Mono.defer(() -> {
            LocalSession session = sessions.get(sessionId);
            if (session == null) {
                log.warn("Activity {} for unknown session {}", signal, sessionId);
                return Mono.empty();
            }
            session.lastActivity = now();
            PresenceStatus status = session.record.getStatus();
            Mono<Void> update = status == PresenceStatus.AWAY || status == PresenceStatus.OFFLINE
                ? applyUpdate(session, PresenceUpdate.builder().status(PresenceStatus.ONLINE).build())
                : Mono.empty();
            armInactivity(session);
            return update;
        });
    }

    /**
     * Updates status, activity or team/room linkage of a local session and re-tracks it.
     */
    public Mono<Void> updatePresence(ContextType contextType, String contextId, String sessionId, PresenceUpdate update) {
        return Mono.defer(() -> {
            LocalSession session = sessions.get(sessionId);
            if (session == null || session.contextType != contextType || !session.contextId.equals(contextId)) {
                log.warn("No session {} in {} {}", sessionId, contextType, contextId);
                return Mono.empty();
            }
            session.lastActivity = now();
            Mono<Void> applied = applyUpdate(session, update);
            armInactivity(session);
            return applied;
        });
    }

    private Mono<Void> applyUpdate(LocalSession session, PresenceUpdate update) {
        PresenceRecord previous = session.record;
        PresenceRecord.PresenceRecordBuilder next = previous.toBuilder().lastSeen(now());
        if (update.getStatus() != null) {
            next.status(update.getStatus());
        }
        if (update.getActivity() != null) {
            next.currentActivity(update.getActivity());
        }
        if (update.getTeamId() != null) {
            next.teamId(update.getTeamId());
        }
        if (update.getTeamName() != null) {
            next.teamName(update.getTeamName());
        }
        if (update.getGameRoomId() != null) {
            next.gameRoomId(update.getGameRoomId());
        }
        if (update.getNetworkQuality() != null) {
            next.networkQuality(update.getNetworkQuality());
        }
        PresenceRecord updated = next.build();
        session.record = updated;
        upsert(session.channel, updated);

        if (previous.getStatus() != updated.getStatus()) {
            emit(PresenceEventType.STATUS_CHANGED, session.contextType, session.contextId, updated,
                previous.getStatus(), previous.getCurrentActivity());
        }
        if (previous.getCurrentActivity() != updated.getCurrentActivity()) {
            emit(PresenceEventType.ACTIVITY_CHANGED, session.contextType, session.contextId, updated,
                previous.getStatus(), previous.getCurrentActivity());
        }

        return channelManager.updatePresence(session.subscriptionId, updated)
            .onErrorResume(err -> {
                log.warn("Failed to re-track {}", session.sessionId, err);
                return Mono.empty();
            });
    }

    /**
     * Leaves a context. Unknown sessions are ignored.
     */
    public Mono<Void> leave(ContextType contextType, String contextId, String sessionId) {
        return Mono.defer(() -> {
            LocalSession session = sessions.get(sessionId);
            if (session == null || session.contextType != contextType || !session.contextId.equals(contextId)) {
                log.debug("Leave of unknown session {} in {} {}", sessionId, contextType, contextId);
                return Mono.empty();
            }
            return end(session);
        });
    }

    private Mono<Void> end(LocalSession session) {
        if (!sessions.remove(session.sessionId, session)) {
            return Mono.empty();
        }
        session.dispose();
        remove(session.channel, session.sessionId);
        recordSessionDuration(now() - session.joinedAt);
        emit(PresenceEventType.USER_LEFT, session.contextType, session.contextId, session.record, null, null);

        return channelManager.untrackPresence(session.subscriptionId)
            .then(channelManager.unsubscribe(session.subscriptionId))
            .onErrorResume(err -> {
                log.warn("Failed to leave presence channel {}", session.channel, err);
                return Mono.empty();
            })
            .doOnSuccess(v -> log.info("Session {} left {}", session.sessionId, session.channel));
    }

    private synchronized void recordSessionDuration(long durationMs) {
        averageSessionDurationMs = endedSessions == 0 ? durationMs : (averageSessionDurationMs + durationMs) / 2;
        endedSessions++;
    }

    // ---------------------------------------------------------------- presence state

    /**
     * @return true if the session was not present before
     */
    private boolean upsert(String channel, PresenceRecord record) {
        Map<String, List<PresenceRecord>> state = presenceState.computeIfAbsent(channel, k -> new ConcurrentHashMap<>());
        boolean[] added = {true};
        state.compute(record.getUserId(), (key, records) -> {
            List<PresenceRecord> next = new ArrayList<>();
            if (records != null) {
                for (PresenceRecord existing : records) {
                    if (existing.getSessionId().equals(record.getSessionId())) {
                        added[0] = false;
                    } else {
                        next.add(existing);
                    }
                }
            }
            next.add(record);
            return next;
        });
        return added[0];
    }

    private boolean remove(String channel, String sessionId) {
        Map<String, List<PresenceRecord>> state = presenceState.get(channel);
        if (state == null) {
            return false;
        }
        boolean removed = false;
        for (Map.Entry<String, List<PresenceRecord>> entry : state.entrySet()) {
            List<PresenceRecord> remaining = new ArrayList<>(entry.getValue());
            if (remaining.removeIf(r -> r.getSessionId().equals(sessionId))) {
                removed = true;
                if (remaining.isEmpty()) {
                    state.remove(entry.getKey());
                } else {
                    state.put(entry.getKey(), remaining);
                }
            }
        }
        return removed;
    }

    public Map<String, List<PresenceRecord>> getPresenceState(ContextType contextType, String contextId) {
        Map<String, List<PresenceRecord>> state = presenceState.get(contextType.channel(contextId));
        if (state == null) {
            return Map.of();
        }
        Map<String, List<PresenceRecord>> copy = new LinkedHashMap<>();
        state.forEach((key, records) -> copy.put(key, List.copyOf(records)));
        return copy;
    }

    public Optional<PresenceRecord> getLocalPresence(String sessionId) {
        LocalSession session = sessions.get(sessionId);
        return session == null ? Optional.empty() : Optional.of(session.record);
    }

    private List<PresenceRecord> allRecords() {
        Map<String, PresenceRecord> bySession = new HashMap<>();
        presenceState.values().forEach(state ->
            state.values().forEach(records ->
                records.forEach(r -> bySession.put(r.getSessionId(), r))));
        return new ArrayList<>(bySession.values());
    }

    private void updatePeak() {
        int online = (int) allRecords().stream()
            .filter(r -> r.getStatus() != null && r.getStatus().countsAsOnline())
            .count();
        if (online > peakConcurrentUsers) {
            peakConcurrentUsers = online;
        }
    }

    public PresenceMetrics getPresenceMetrics() {
        List<PresenceRecord> records = allRecords();
        Map<PresenceRole, Integer> byRole = new EnumMap<>(PresenceRole.class);
        Map<PresenceStatus, Integer> byStatus = new EnumMap<>(PresenceStatus.class);
        Map<PresenceActivity, Integer> byActivity = new EnumMap<>(PresenceActivity.class);
        int online = 0;
        for (PresenceRecord record : records) {
            if (record.getRole() != null) {
                byRole.merge(record.getRole(), 1, Integer::sum);
            }
            if (record.getStatus() != null) {
                byStatus.merge(record.getStatus(), 1, Integer::sum);
                if (record.getStatus().countsAsOnline()) {
                    online++;
                }
            }
            if (record.getCurrentActivity() != null) {
                byActivity.merge(record.getCurrentActivity(), 1, Integer::sum);
            }
        }
        return PresenceMetrics.builder()
            .totalUsers(records.size())
            .onlineUsers(online)
            .usersByRole(byRole)
            .usersByStatus(byStatus)
            .usersByActivity(byActivity)
            .peakConcurrentUsers(Math.max(peakConcurrentUsers, online))
            .averageSessionDurationMs(averageSessionDurationMs)
            .build();
    }

    // ---------------------------------------------------------------- events

    private void emit(PresenceEventType type, ContextType contextType, String contextId, PresenceRecord record,
                      PresenceStatus previousStatus, PresenceActivity previousActivity) {
        PresenceEvent event = PresenceEvent.builder()
            .type(type)
            .contextType(contextType)
            .contextId(contextId)
            .record(record)
            .previousStatus(previousStatus)
            .previousActivity(previousActivity)
            .timestamp(now())
            .build();
        synchronized (eventSink) {
            eventSink.tryEmitNext(event);
        }
    }

    public Flux<PresenceEvent> events() {
        return eventSink.asFlux();
    }

    public Disposable onPresenceEvent(Consumer<PresenceEvent> listener) {
        return events().subscribe(event -> {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                log.error("Presence listener failed on {}", event.getType(), e);
            }
        });
    }

    public Disposable onPresenceEvent(PresenceEventType type, Consumer<PresenceEvent> listener) {
        return onPresenceEvent(event -> {
            if (event.getType() == type) {
                listener.accept(event);
            }
        });
    }

    /**
     * Leaves every local session.
     */
    public Mono<Void> dispose() {
        return Flux.fromIterable(List.copyOf(sessions.values()))
            .concatMap(this::end)
            .then(Mono.fromRunnable(() -> {
                synchronized (eventSink) {
                    eventSink.tryEmitComplete();
                }
            }));
    }

    private static String randomSuffix() {
        // 9 base-36 characters
        long bound = 101_559_956_668_416L;
        String suffix = Long.toString(ThreadLocalRandom.current().nextLong(bound), 36);
        return "0".repeat(9 - suffix.length()) + suffix;
    }

    private long now() {
        return scheduler.now(TimeUnit.MILLISECONDS);
    }

    /**
     * State of one session joined from this client.
     */
    private static final class LocalSession {
        final String sessionId;
        final ContextType contextType;
        final String contextId;
        final String channel;
        final String subscriptionId;
        final long joinedAt;

        volatile PresenceRecord record;
        volatile long lastActivity;
        volatile Disposable heartbeat;
        volatile Disposable inactivityTimer;

        LocalSession(String sessionId, ContextType contextType, String contextId, String channel,
                     String subscriptionId, long joinedAt, PresenceRecord record) {
            this.sessionId = sessionId;
            this.contextType = contextType;
            this.contextId = contextId;
            this.channel = channel;
            this.subscriptionId = subscriptionId;
            this.joinedAt = joinedAt;
            this.record = record;
            this.lastActivity = joinedAt;
        }

        void dispose() {
            if (heartbeat != null) {
                heartbeat.dispose();
            }
            if (inactivityTimer != null) {
                inactivityTimer.dispose();
            }
        }
    }
}
