package com.qqsuccubus.triviasync.realtime.subscription;

import com.fasterxml.jackson.databind.JsonNode;
import com.qqsuccubus.triviasync.core.msg.BroadcastMessage;
import com.qqsuccubus.triviasync.core.msg.TableChange;
import com.qqsuccubus.triviasync.realtime.backend.RealtimeBackend;
import com.qqsuccubus.triviasync.realtime.channel.BroadcastOptions;
import com.qqsuccubus.triviasync.realtime.channel.ChannelManager;
import com.qqsuccubus.triviasync.realtime.channel.TableOptions;
import com.qqsuccubus.triviasync.realtime.config.SyncConfig;
import com.qqsuccubus.triviasync.realtime.metrics.MetricsService;
import com.qqsuccubus.triviasync.realtime.optimizer.PerformanceOptimizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Subscription groups for rooms, teams and hosts on top of {@link ChannelManager}.
 * <p>
 * Group creation is all-or-nothing: if any channel fails, the channels created so far are
 * removed and a {@link SubscriptionException} is raised. Host notifications published while the
 * host group is absent or disconnected are queued per host and replayed by priority when the
 * host subscribes or when a channel of its group is restored after a transport outage.
 * </p>
 */
public class SubscriptionService {
    private static final Logger log = LoggerFactory.getLogger(SubscriptionService.class);

    static final String LEADERBOARD_RPC = "get_room_leaderboard";

    private final ChannelManager channelManager;
    private final RealtimeBackend backend;
    private final PerformanceOptimizer optimizer;
    private final MetricsService metricsService;
    private final SyncConfig config;
    private final Scheduler scheduler;

    // Groups: group id -> group
    private final Map<String, SubscriptionGroup> groups = new ConcurrentHashMap<>();
    // Host queues: host id -> queued notifications, oldest first
    private final Map<String, Deque<QueuedNotification>> hostQueues = new ConcurrentHashMap<>();
    // Host handlers: host group id -> options of the latest subscription
    private final Map<String, HostSubscriptionOptions> hostOptions = new ConcurrentHashMap<>();
    private final AtomicLong notificationSeq = new AtomicLong();

    public SubscriptionService(ChannelManager channelManager, RealtimeBackend backend, PerformanceOptimizer optimizer,
                               MetricsService metricsService, SyncConfig config, Scheduler scheduler) {
        this.channelManager = channelManager;
        this.backend = backend;
        this.optimizer = optimizer;
        this.metricsService = metricsService;
        this.config = config;
        this.scheduler = scheduler;

        channelManager.resubscribed()
            .subscribe(this::onChannelRestored,
                err -> log.error("Resubscribe stream failed", err));
    }

    /**
     * One channel of a group to be created.
     */
    private record ChannelSpec(String name, Supplier<Mono<String>> subscribe) {
    }

    // ---------------------------------------------------------------- room / team

    public Mono<String> subscribeToRoom(RoomSubscriptionOptions options) {
        String roomId = options.getRoomId();
        String groupId = ContextKind.ROOM.groupId(roomId);
        String filter = "room_id=eq." + roomId;

        List<ChannelSpec> specs = new ArrayList<>();
        if (options.getOnGameStateChange() != null) {
            specs.add(table(groupId, "game_state", "game_rooms", "id=eq." + roomId, options.getOnGameStateChange()));
        }
        if (options.getOnTeamsChange() != null) {
            specs.add(table(groupId, "teams", "teams", filter, options.getOnTeamsChange()));
        }
        if (options.getOnQuestion() != null) {
            specs.add(broadcast(groupId, "questions", "room-questions:" + roomId, "*", options.getOnQuestion()));
        }
        if (options.getOnTimer() != null) {
            specs.add(broadcast(groupId, "timer", "room-timer:" + roomId, "*", options.getOnTimer()));
        }
        if (options.getOnLeaderboard() != null) {
            specs.add(broadcast(groupId, "leaderboard", "room-leaderboard:" + roomId, "*", options.getOnLeaderboard()));
        }
        return createGroup(groupId, ContextKind.ROOM, roomId, specs);
    }

    public Mono<String> subscribeToTeam(TeamSubscriptionOptions options) {
        String teamId = options.getTeamId();
        String groupId = ContextKind.TEAM.groupId(teamId);
        String filter = "team_id=eq." + teamId;

        List<ChannelSpec> specs = new ArrayList<>();
        if (options.getOnAnswer() != null) {
            specs.add(table(groupId, "answers", "team_answers", filter, options.getOnAnswer()));
        }
        if (options.getOnReview() != null) {
            specs.add(broadcast(groupId, "reviews", "team-reviews:" + teamId, "*", options.getOnReview()));
        }
        if (options.getOnMemberChange() != null) {
            specs.add(table(groupId, "members", "team_members", filter, options.getOnMemberChange()));
        }
        if (options.getOnStatus() != null) {
            specs.add(broadcast(groupId, "status", "team-status:" + teamId, "*", options.getOnStatus()));
        }
        return createGroup(groupId, ContextKind.TEAM, teamId, specs);
    }

    // ---------------------------------------------------------------- host

    /**
     * Subscribes the host channels of a room and replays everything queued for the host. Calling
     * it again for a subscribed room keeps the channels and replays with the new handlers.
     */
    public Mono<String> subscribeToHostNotifications(HostSubscriptionOptions options) {
        String roomId = options.getRoomId();
        String groupId = ContextKind.HOST.groupId(roomId);

        List<ChannelSpec> specs = new ArrayList<>();
        for (NotificationType type : NotificationType.values()) {
            Consumer<QueuedNotification> handler = options.handlerFor(type);
            if (handler == null) {
                continue;
            }
            String event = type == NotificationType.ANSWER_REVIEW ? "answer_pending_review" : "*";
            specs.add(broadcast(groupId, type.channelName(), type.channel(roomId), event,
                message -> handler.accept(toNotification(type, message, options.getHostId(), roomId))));
        }

        return createGroup(groupId, ContextKind.HOST, roomId, specs)
            .doOnSuccess(id -> {
                hostOptions.put(groupId, options);
                replayQueued(options);
            });
    }

    private void onChannelRestored(String channelId) {
        hostOptions.forEach((groupId, options) -> {
            SubscriptionGroup group = groups.get(groupId);
            if (group != null && group.getChannels().containsValue(channelId) && isHostConnected(options.getRoomId())) {
                replayQueued(options);
            }
        });
    }

    private QueuedNotification toNotification(NotificationType type, BroadcastMessage message, String hostId, String roomId) {
        return QueuedNotification.builder()
            .id(nextNotificationId())
            .type(type)
            .event(message.getEvent())
            .payload(message.getPayload())
            .timestamp(message.getSentAt())
            .priority(priorityOf(type, message.getEvent()))
            .hostId(hostId)
            .roomId(roomId)
            .build();
    }

    static NotificationPriority priorityOf(NotificationType type, String event) {
        if (type == NotificationType.EMERGENCY && "system_error".equals(event)) {
            return NotificationPriority.HIGH;
        }
        return type.defaultPriority();
    }

    /**
     * Sends a notification to a host, or queues it while the host is not subscribed.
     *
     * @param priority Replay priority, or null for the type's default
     */
    public Mono<Void> publishHostNotification(String hostId, String roomId, NotificationType type,
                                              String event, JsonNode payload, NotificationPriority priority) {
        return Mono.defer(() -> {
            if (isHostConnected(roomId)) {
                return backend.publish(type.channel(roomId), event, payload);
            }
            QueuedNotification notification = QueuedNotification.builder()
                .id(nextNotificationId())
                .type(type)
                .event(event)
                .payload(payload)
                .timestamp(now())
                .priority(priority != null ? priority : priorityOf(type, event))
                .hostId(hostId)
                .roomId(roomId)
                .build();
            queueForHost(notification);
            return Mono.empty();
        });
    }

    private boolean isHostConnected(String roomId) {
        SubscriptionGroup group = groups.get(ContextKind.HOST.groupId(roomId));
        return group != null
            && group.isActive()
            && group.getChannels().values().stream().anyMatch(channelManager::isActive);
    }

    private void queueForHost(QueuedNotification notification) {
        Deque<QueuedNotification> queue = hostQueues.computeIfAbsent(notification.getHostId(), k -> new ArrayDeque<>());
        synchronized (queue) {
            queue.addLast(notification);
            metricsService.recordHostNotificationQueued();
            while (queue.size() > config.getHostQueueCapacity()) {
                QueuedNotification dropped = queue.pollFirst();
                metricsService.recordHostNotificationDropped();
                log.warn("Host queue of {} full, dropped {} ({})", notification.getHostId(), dropped.getId(), dropped.getEvent());
            }
        }
        log.debug("Queued {} for host {} ({} priority)", notification.getEvent(), notification.getHostId(), notification.getPriority());
    }

    private void replayQueued(HostSubscriptionOptions options) {
        Deque<QueuedNotification> queue = hostQueues.remove(options.getHostId());
        if (queue == null) {
            return;
        }
        List<QueuedNotification> ordered;
        synchronized (queue) {
            ordered = new ArrayList<>(queue);
        }
        ordered.sort(QueuedNotification.REPLAY_ORDER);

        log.info("Replaying {} queued notifications to host {}", ordered.size(), options.getHostId());
        for (QueuedNotification notification : ordered) {
            Consumer<QueuedNotification> handler = options.handlerFor(notification.getType());
            if (handler == null) {
                log.debug("No handler for {} on host {}, skipping replay", notification.getType(), options.getHostId());
                continue;
            }
            try {
                handler.accept(notification);
            } catch (RuntimeException e) {
                log.error("Host handler failed replaying {}", notification.getId(), e);
            }
        }
        metricsService.recordHostNotificationsReplayed(ordered.size());
    }

    public List<QueuedNotification> getQueuedNotifications(String hostId) {
        Deque<QueuedNotification> queue = hostQueues.get(hostId);
        if (queue == null) {
            return List.of();
        }
        synchronized (queue) {
            return List.copyOf(queue);
        }
    }

    // ---------------------------------------------------------------- leaderboard

    /**
     * Fetches the room leaderboard through the backend RPC, cached for a short time.
     */
    public Mono<JsonNode> fetchLeaderboard(String roomId) {
        String cacheKey = "leaderboard:" + roomId;
        return Mono.defer(() -> {
            Optional<JsonNode> cached = optimizer.getCache(cacheKey, JsonNode.class);
            if (cached.isPresent()) {
                return Mono.just(cached.get());
            }
            return backend.rpc(LEADERBOARD_RPC, Map.of("room_id", roomId))
                .doOnNext(result -> optimizer.setCache(cacheKey, result, config.getLeaderboardCacheTtl(), 2))
                .doOnError(err -> log.error("Leaderboard RPC failed for room {}", roomId, err));
        });
    }

    // ---------------------------------------------------------------- group lifecycle

    private ChannelSpec table(String groupId, String name, String table, String filter, Consumer<TableChange> handler) {
        TableOptions options = TableOptions.builder()
            .id(groupId + ":" + name)
            .filter(filter)
            .build();
        return new ChannelSpec(name,
            () -> channelManager.subscribeTable(table, options, change -> {
                touch(groupId);
                handler.accept(change);
            }));
    }

    private ChannelSpec broadcast(String groupId, String name, String channel, String event, Consumer<BroadcastMessage> handler) {
        BroadcastOptions options = BroadcastOptions.builder()
            .id(groupId + ":" + name)
            .event(event)
            .build();
        return new ChannelSpec(name,
            () -> channelManager.subscribeBroadcast(channel, options, message -> {
                touch(groupId);
                handler.accept(message);
            }));
    }

    private Mono<String> createGroup(String groupId, ContextKind kind, String contextId, List<ChannelSpec> specs) {
        return Mono.defer(() -> {
            if (groups.containsKey(groupId)) {
                log.warn("Subscription group {} already exists", groupId);
                return Mono.just(groupId);
            }

            Map<String, String> created = new LinkedHashMap<>();
            return Flux.fromIterable(specs)
                .concatMap(spec -> spec.subscribe().get()
                    .doOnNext(channelId -> created.put(spec.name(), channelId)))
                .then(Mono.fromCallable(() -> {
                    groups.put(groupId, new SubscriptionGroup(groupId, kind, contextId, created, now()));
                    log.info("Subscription group {} created with channels {}", groupId, created.keySet());
                    return groupId;
                }))
                .onErrorResume(err -> {
                    log.error("Failed to create subscription group {}, removing {} channels", groupId, created.size(), err);
                    return Flux.fromIterable(created.values())
                        .concatMap(channelManager::unsubscribe)
                        .then(Mono.error(new SubscriptionException(groupId,
                            "Failed to create subscription group " + groupId, err)));
                });
        });
    }

    private void touch(String groupId) {
        SubscriptionGroup group = groups.get(groupId);
        if (group != null) {
            group.touch(now());
        }
    }

    /**
     * Removes a group and its channels. Channel failures are logged and skipped.
     */
    public Mono<Void> unsubscribe(String groupId) {
        return Mono.defer(() -> {
            SubscriptionGroup group = groups.remove(groupId);
            hostOptions.remove(groupId);
            if (group == null) {
                log.warn("Unsubscribe of unknown subscription group {}", groupId);
                return Mono.empty();
            }
            group.deactivate();
            return Flux.fromIterable(group.getChannels().values())
                .concatMap(channelId -> channelManager.unsubscribe(channelId)
                    .onErrorResume(err -> {
                        log.warn("Failed to remove channel {} of group {}", channelId, groupId, err);
                        return Mono.empty();
                    }))
                .then()
                .doOnSuccess(v -> log.info("Subscription group {} removed", groupId));
        });
    }

    public List<SubscriptionGroup> getActiveSubscriptions() {
        return groups.values().stream()
            .filter(SubscriptionGroup::isActive)
            .toList();
    }

    public Optional<SubscriptionGroup> getSubscriptionGroup(String groupId) {
        return Optional.ofNullable(groups.get(groupId));
    }

    /**
     * Removes every group and drops all queued host notifications.
     */
    public Mono<Void> cleanup() {
        return Flux.fromIterable(List.copyOf(groups.keySet()))
            .concatMap(this::unsubscribe)
            .then(Mono.fromRunnable(() -> {
                hostOptions.clear();
                hostQueues.clear();
            }));
    }

    private String nextNotificationId() {
        return "notif-" + now() + "-" + notificationSeq.incrementAndGet();
    }

    private long now() {
        return scheduler.now(TimeUnit.MILLISECONDS);
    }
}
