package com.qqsuccubus.triviasync.realtime;

import com.qqsuccubus.triviasync.realtime.backend.RealtimeBackend;
import com.qqsuccubus.triviasync.realtime.backend.RemoteStateStore;
import com.qqsuccubus.triviasync.realtime.channel.ChannelManager;
import com.qqsuccubus.triviasync.realtime.config.SyncConfig;
import com.qqsuccubus.triviasync.realtime.connection.ConnectionMonitor;
import com.qqsuccubus.triviasync.realtime.metrics.MetricsService;
import com.qqsuccubus.triviasync.realtime.metrics.PrometheusMetricsExporter;
import com.qqsuccubus.triviasync.realtime.optimizer.PerformanceOptimizer;
import com.qqsuccubus.triviasync.realtime.presence.PresenceService;
import com.qqsuccubus.triviasync.realtime.redis.RedisRealtimeBackend;
import com.qqsuccubus.triviasync.realtime.redis.RedisStateStore;
import com.qqsuccubus.triviasync.realtime.state.StateSynchronizer;
import com.qqsuccubus.triviasync.realtime.subscription.SubscriptionService;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.AccessLevel;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Wires the realtime sync layer of one client.
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>Build the optimizer, channel manager, connection monitor and the subscription and
 *       presence services on one shared scheduler</li>
 *   <li>Hand out one {@link StateSynchronizer} per game</li>
 *   <li>Tear everything down in dependency order on {@link #close()}</li>
 * </ul>
 * </p>
 */
@Getter
public class RealtimeSync implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RealtimeSync.class);

    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);

    private final SyncConfig config;
    private final RealtimeBackend backend;
    private final RemoteStateStore stateStore;
    private final Scheduler scheduler;
    private final MetricsService metricsService;
    private final PerformanceOptimizer optimizer;
    private final ChannelManager channelManager;
    private final ConnectionMonitor connectionMonitor;
    private final SubscriptionService subscriptionService;
    private final PresenceService presenceService;

    @Getter(AccessLevel.NONE)
    private final Map<String, StateSynchronizer> synchronizers = new ConcurrentHashMap<>();
    @Getter(AccessLevel.NONE)
    private final PrometheusMetricsExporter metricsExporter;

    public RealtimeSync(SyncConfig config, RealtimeBackend backend, RemoteStateStore stateStore,
                        MeterRegistry registry, Scheduler scheduler) {
        this(config, backend, stateStore, registry, scheduler, null);
    }

    private RealtimeSync(SyncConfig config, RealtimeBackend backend, RemoteStateStore stateStore,
                         MeterRegistry registry, Scheduler scheduler, PrometheusMetricsExporter metricsExporter) {
        this.config = config;
        this.backend = backend;
        this.stateStore = stateStore;
        this.scheduler = scheduler;
        this.metricsExporter = metricsExporter;

        this.metricsService = new MetricsService(registry, config);
        this.optimizer = new PerformanceOptimizer(config, metricsService, scheduler);
        this.channelManager = new ChannelManager(backend, optimizer, metricsService, config, scheduler);
        this.connectionMonitor = new ConnectionMonitor(backend, config, scheduler);
        this.subscriptionService = new SubscriptionService(channelManager, backend, optimizer, metricsService,
            config, scheduler);
        this.presenceService = new PresenceService(channelManager, metricsService, config, scheduler);
    }

    /**
     * Builds a client backed by Redis, exporting metrics to Prometheus.
     */
    public static RealtimeSync create(SyncConfig config) {
        log.info("Creating realtime sync for client {}", config.getClientId());
        log.info("  Redis: {}", config.getRedisUrl());

        PrometheusMetricsExporter exporter = new PrometheusMetricsExporter(config.getClientId());
        return new RealtimeSync(config,
            new RedisRealtimeBackend(config),
            new RedisStateStore(config),
            exporter.getRegistry(),
            Schedulers.newSingle("trivia-sync"),
            exporter);
    }

    /**
     * Starts periodic optimizer work and opens the transport.
     */
    public void start() {
        String clientId = config.getClientId();
        MDC.put("clientId", clientId);
        scheduler.schedule(() -> MDC.put("clientId", clientId));

        optimizer.start();
        connectionMonitor.start();
        log.info("Realtime sync {} started", clientId);
    }

    /**
     * @param gameId Game state id
     * @return the synchronizer of that game, created on first use
     */
    public StateSynchronizer synchronizerFor(String gameId) {
        return synchronizers.computeIfAbsent(gameId,
            id -> new StateSynchronizer(id, stateStore, optimizer, metricsService, config, scheduler));
    }

    /**
     * @return Prometheus text exposition, when built with {@link #create(SyncConfig)}
     */
    public Optional<String> scrape() {
        return Optional.ofNullable(metricsExporter).map(PrometheusMetricsExporter::scrape);
    }

    @Override
    public void close() {
        log.info("Shutting down realtime sync {}", config.getClientId());

        synchronizers.values().forEach(StateSynchronizer::dispose);
        synchronizers.clear();

        presenceService.dispose()
            .then(Mono.defer(subscriptionService::cleanup))
            .then(Mono.defer(channelManager::dispose))
            .onErrorResume(err -> {
                log.warn("Error while releasing channels", err);
                return Mono.empty();
            })
            .block(SHUTDOWN_TIMEOUT);

        connectionMonitor.dispose();
        optimizer.dispose();

        backend.close()
            .doOnError(err -> log.warn("Error while closing backend", err))
            .onErrorComplete()
            .block(SHUTDOWN_TIMEOUT);

        if (stateStore instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                log.warn("Error while closing state store", e);
            }
        }
        if (metricsExporter != null) {
            metricsExporter.close();
            scheduler.dispose();
        }
        log.info("Shutdown complete");
    }
}
