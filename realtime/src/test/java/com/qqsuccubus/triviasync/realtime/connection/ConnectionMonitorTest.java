package com.qqsuccubus.triviasync.realtime.connection;

import com.qqsuccubus.triviasync.core.msg.ConnectionEvent;
import com.qqsuccubus.triviasync.realtime.backend.ChannelException;
import com.qqsuccubus.triviasync.realtime.backend.InMemoryRealtimeBackend;
import com.qqsuccubus.triviasync.realtime.config.SyncConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConnectionMonitorTest {

    private VirtualTimeScheduler scheduler;
    private InMemoryRealtimeBackend backend;
    private ConnectionMonitor monitor;
    private final List<ConnectionStatus> statuses = new ArrayList<>();

    @BeforeEach
    void setUp() {
        scheduler = VirtualTimeScheduler.create();
        backend = new InMemoryRealtimeBackend();
        monitor = new ConnectionMonitor(backend, SyncConfig.builder().maxReconnectAttempts(3).build(), scheduler);
        monitor.statuses().subscribe(statuses::add);
    }

    @AfterEach
    void tearDown() {
        monitor.dispose();
        scheduler.dispose();
    }

    @Test
    void testStart_ConnectsImmediately() {
        monitor.start();

        assertEquals(ConnectionStatus.CONNECTED, monitor.getStatus());
        assertEquals(List.of(ConnectionStatus.DISCONNECTED, ConnectionStatus.CONNECTING, ConnectionStatus.CONNECTED),
            statuses);
    }

    @Test
    void testTransportClose_ReconnectsAfterBackoff() {
        monitor.start();

        backend.emitConnection(ConnectionEvent.close(0L));
        assertEquals(ConnectionStatus.RECONNECTING, monitor.getStatus());
        assertEquals(1, monitor.getReconnectAttempts());

        scheduler.advanceTimeBy(Duration.ofSeconds(5));

        assertEquals(ConnectionStatus.CONNECTED, monitor.getStatus());
        assertEquals(0, monitor.getReconnectAttempts());
        assertEquals(2, backend.connectCalls());
    }

    @Test
    void testConnectFailures_GiveUpThenManualRetry() {
        backend.failConnects(100);
        monitor.start();

        scheduler.advanceTimeBy(Duration.ofMinutes(1));

        assertEquals(ConnectionStatus.ERROR, monitor.getStatus());
        assertEquals(4, backend.connectCalls());
        assertInstanceOf(ChannelException.class, monitor.getLastError());

        backend.failConnects(0);
        monitor.retry();

        assertEquals(ConnectionStatus.CONNECTED, monitor.getStatus());
        assertEquals(0, monitor.getReconnectAttempts());
        assertNull(monitor.getLastError());
    }

    @Test
    void testTransportError_KeepsStatus() {
        monitor.start();

        backend.emitConnection(ConnectionEvent.error(new RuntimeException("frame too large"), 0L));

        assertEquals(ConnectionStatus.CONNECTED, monitor.getStatus());
        assertEquals("frame too large", monitor.getLastError().getMessage());
    }

    @Test
    void testCloseWhileNotConnected_IsIgnored() {
        backend.emitConnection(ConnectionEvent.close(0L));

        assertEquals(ConnectionStatus.DISCONNECTED, monitor.getStatus());
        assertEquals(0, backend.connectCalls());
    }
}
