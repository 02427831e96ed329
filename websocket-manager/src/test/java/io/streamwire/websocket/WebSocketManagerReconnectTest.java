package io.streamwire.websocket;

import io.streamwire.websocket.codec.JsonSubscriptionProtocol;
import io.streamwire.websocket.config.WebSocketConfig;
import io.streamwire.websocket.model.ConnectionState;
import io.streamwire.websocket.model.DisconnectReason;
import io.streamwire.websocket.model.ReconnectStrategy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Reconnect loop and keepalive tests for WebSocketManager.
 *
 * Tests:
 * - Reactive disconnects (server close, network drop, ping timeout) and recovery
 * - Proactive reconnects (triggerReconnect, shouldDisconnect poll)
 * - Retry exhaustion and shouldReconnect veto, both raising an alert
 * - shouldReconnect choosing its own delay
 * - Callback-controlled reconnect windows
 * - scheduleReconnect() and waitForReconnectWindow()
 */
class WebSocketManagerReconnectTest {

    private static final String URL = "ws://localhost:9000/stream";
    private static final Duration WAIT = Duration.ofSeconds(3);

    private final List<DisconnectReason> reasons = new CopyOnWriteArrayList<>();

    private FakeTransport transport;
    private WebSocketManager manager;

    @BeforeEach
    void setUp() {
        transport = new FakeTransport();
    }

    @AfterEach
    void tearDown() {
        if (manager != null) {
            manager.shutdown();
        }
    }

    private WebSocketConfig.Builder fastConfig() {
        return WebSocketConfig.builder()
            .name("reconnect-test")
            .pingInterval(Duration.ofMinutes(5))
            .reconnectDelay(Duration.ofMillis(10))
            .maxReconnectDelay(Duration.ofMillis(40))
            .reconnectCheckInterval(Duration.ofMillis(20));
    }

    private WebSocketManager newManager(WebSocketConfig config, ConnectionHooks.Builder hooks) {
        hooks.onDisconnect(reasons::add);
        manager = new WebSocketManager(URL, config, hooks.build(), transport, new JsonSubscriptionProtocol());
        return manager;
    }

    private WebSocketManager newManager(WebSocketConfig config) {
        return newManager(config, ConnectionHooks.builder());
    }

    @Test
    void testServerCloseReconnects() throws InterruptedException {
        newManager(fastConfig().build());
        manager.connect();

        transport.last().serverClose(1000, "maintenance");

        assertTrue(Await.until(() -> transport.attempts() == 2 && manager.isConnected(), WAIT));
        assertEquals(List.of(DisconnectReason.SERVER_CLOSE), reasons);
        assertEquals(2, manager.stats().getConnects());
        assertEquals(1, manager.stats().getReactiveDisconnects());
        assertEquals(0, manager.stats().getProactiveDisconnects());
    }

    @Test
    void testNetworkDropWithoutAutoReconnectStaysDisconnected() throws InterruptedException {
        newManager(fastConfig().autoReconnect(false).build());
        manager.connect();

        transport.last().drop();

        assertTrue(Await.until(() -> !reasons.isEmpty(), WAIT));
        assertEquals(List.of(DisconnectReason.NETWORK_ERROR), reasons);
        assertEquals(ConnectionState.DISCONNECTED, manager.state());
        Thread.sleep(100);
        assertEquals(1, transport.attempts());
    }

    @Test
    void testGivesUpAfterMaxAttempts() throws InterruptedException {
        newManager(fastConfig().maxReconnectAttempts(2).build());
        manager.connect();
        transport.refuseAll = true;

        transport.last().drop();

        assertTrue(Await.until(() -> manager.isDead(), WAIT));
        assertEquals(ConnectionState.DISCONNECTED, manager.state(), "Exhaustion is not terminal");
        assertFalse(manager.isShutdown());
        Thread.sleep(100);
        assertEquals(3, transport.attempts(), "Initial connect plus two retries");
    }

    @Test
    void testZeroMaxAttemptsNeverRetries() throws InterruptedException {
        newManager(fastConfig().maxReconnectAttempts(0).build());
        manager.connect();

        transport.last().drop();

        assertTrue(Await.until(() -> manager.isDead(), WAIT));
        Thread.sleep(100);
        assertEquals(1, transport.attempts());
    }

    @Test
    void testShouldReconnectFalseStopsRetrying() throws InterruptedException {
        newManager(fastConfig().build(), ConnectionHooks.builder().shouldReconnect(() -> false));
        manager.connect();

        transport.last().drop();

        assertTrue(Await.until(() -> manager.isDead(), WAIT));
        Thread.sleep(100);
        assertEquals(1, transport.attempts());
        assertEquals(ConnectionState.DISCONNECTED, manager.state());
    }

    @Test
    void testGivingUpRaisesAlert() throws InterruptedException {
        List<Map<String, Object>> alerts = new CopyOnWriteArrayList<>();
        List<String> channels = new CopyOnWriteArrayList<>();
        newManager(fastConfig().maxReconnectAttempts(1).build(), ConnectionHooks.builder()
            .onAlert((channel, message, context) -> {
                channels.add(channel);
                alerts.add(context);
            }));
        manager.connect();
        transport.refuseAll = true;

        transport.last().drop();

        assertTrue(Await.until(() -> alerts.size() == 1, WAIT));
        assertEquals(List.of(AlertHandler.WEBSOCKET_CHANNEL), channels);
        assertEquals("reconnect-test", alerts.get(0).get("name"));
        assertEquals(URL, alerts.get(0).get("url"));
        assertEquals(1, alerts.get(0).get("failedAttempts"));
        Thread.sleep(100);
        assertEquals(1, alerts.size(), "One alert per give-up");
    }

    @Test
    void testDeclinedReconnectRaisesAlert() throws InterruptedException {
        List<String> messages = new CopyOnWriteArrayList<>();
        newManager(fastConfig().build(), ConnectionHooks.builder()
            .reconnectDecision(ReconnectDecision::decline)
            .onAlert((channel, message, context) -> messages.add(message)));
        manager.connect();

        transport.last().drop();

        assertTrue(Await.until(() -> messages.size() == 1, WAIT));
        assertTrue(messages.get(0).contains("shouldReconnect declined"));
        assertEquals(1, transport.attempts());
    }

    @Test
    void testFailingAlertHookIsContained() throws InterruptedException {
        newManager(fastConfig().maxReconnectAttempts(0).build(), ConnectionHooks.builder()
            .onAlert((channel, message, context) -> {
                throw new IllegalStateException("mail server down");
            }));
        manager.connect();

        transport.last().drop();

        assertTrue(Await.until(() -> manager.isDead(), WAIT));
        assertEquals(ConnectionState.DISCONNECTED, manager.state());
    }

    @Test
    void testReconnectDecisionDelayOverridesBackoff() throws InterruptedException {
        newManager(fastConfig().build(), ConnectionHooks.builder()
            .reconnectDecision(() -> ReconnectDecision.after(Duration.ofMillis(400))));
        manager.connect();

        transport.last().drop();

        Thread.sleep(150);
        assertEquals(1, transport.attempts(), "Backoff of 10 ms replaced by 400 ms");
        assertEquals(ConnectionState.RECONNECTING, manager.state());
        assertTrue(Await.until(() -> manager.isConnected() && transport.attempts() == 2, WAIT));
    }

    @Test
    void testCallbackControlledHonoursRequestedDelay() throws InterruptedException {
        AtomicBoolean allowed = new AtomicBoolean(false);
        newManager(
            fastConfig().reconnectStrategy(ReconnectStrategy.CALLBACK_CONTROLLED).build(),
            ConnectionHooks.builder().reconnectDecision(() -> allowed.get()
                ? ReconnectDecision.after(Duration.ofMillis(300))
                : ReconnectDecision.decline())
        );
        manager.connect();
        transport.last().drop();
        Thread.sleep(100);
        assertEquals(ConnectionState.RECONNECTING, manager.state(), "A declined window keeps polling");

        allowed.set(true);

        Thread.sleep(150);
        assertEquals(1, transport.attempts());
        assertTrue(Await.until(() -> manager.isConnected() && transport.attempts() == 2, WAIT));
    }

    @Test
    void testFailingShouldReconnectProceeds() throws InterruptedException {
        newManager(fastConfig().build(), ConnectionHooks.builder()
            .reconnectDecision(() -> {
                throw new IllegalStateException("boom");
            }));
        manager.connect();

        transport.last().drop();

        assertTrue(Await.until(() -> manager.isConnected() && transport.attempts() == 2, WAIT));
    }

    @Test
    void testTriggerReconnectIsProactive() throws InterruptedException {
        newManager(fastConfig().build());
        manager.connect();

        manager.triggerReconnect();

        assertTrue(manager.waitConnected(WAIT));
        assertEquals(List.of(DisconnectReason.PROACTIVE_RECONNECT), reasons);
        assertEquals(1, manager.stats().getProactiveDisconnects());
        assertEquals(0, manager.stats().getReactiveDisconnects());
        assertEquals(2, manager.stats().getConnects());
        assertTrue(transport.connections.get(0).isClosed());
    }

    @Test
    void testTriggerReconnectWhenDisconnectedIsIgnored() {
        newManager(fastConfig().build());

        manager.triggerReconnect();

        assertEquals(ConnectionState.DISCONNECTED, manager.state());
        assertTrue(reasons.isEmpty());
        assertEquals(0, transport.attempts());
    }

    @Test
    void testPingTimeoutIsReactive() throws InterruptedException {
        transport.answerPings = false;
        newManager(fastConfig()
            .pingInterval(Duration.ofMillis(50))
            .pingTimeout(Duration.ofMillis(50))
            .autoReconnect(false)
            .build());
        manager.connect();

        assertTrue(Await.until(() -> !reasons.isEmpty(), WAIT));
        assertEquals(List.of(DisconnectReason.PING_TIMEOUT), reasons);
        assertEquals(ConnectionState.DISCONNECTED, manager.state());
        assertEquals(1, manager.stats().getReactiveDisconnects());
    }

    @Test
    void testAnsweredPingsKeepConnectionAlive() throws InterruptedException {
        newManager(fastConfig()
            .pingInterval(Duration.ofMillis(30))
            .pingTimeout(Duration.ofMillis(30))
            .build());
        manager.connect();

        assertTrue(Await.until(() -> transport.last().pingCount() >= 3, WAIT));
        assertTrue(manager.isConnected());
        assertTrue(reasons.isEmpty());
    }

    @Test
    void testShouldDisconnectTriggersProactiveReconnect() throws InterruptedException {
        AtomicBoolean rotate = new AtomicBoolean(true);
        newManager(
            fastConfig().pingInterval(Duration.ofMillis(30)).build(),
            ConnectionHooks.builder().shouldDisconnect(() -> rotate.getAndSet(false))
        );
        manager.connect();

        assertTrue(Await.until(() -> manager.stats().getConnects() == 2 && manager.isConnected(), WAIT));
        assertEquals(List.of(DisconnectReason.PROACTIVE_RECONNECT), reasons);
        assertEquals(1, manager.stats().getProactiveDisconnects());
    }

    @Test
    void testKillDuringReconnectStopsRetries() throws InterruptedException {
        newManager(fastConfig().reconnectDelay(Duration.ofMillis(300)).maxReconnectDelay(Duration.ofMillis(300)).build());
        manager.connect();
        transport.last().drop();
        assertTrue(Await.until(() -> manager.state() == ConnectionState.RECONNECTING, WAIT));

        manager.kill();

        assertEquals(ConnectionState.DISCONNECTED, manager.state());
        Thread.sleep(500);
        assertEquals(1, transport.attempts(), "Pending attempt was cancelled");
        assertEquals(List.of(DisconnectReason.NETWORK_ERROR), reasons, "No second hook without a live connection");
    }

    @Test
    void testCallbackControlledWaitsForPermission() throws InterruptedException {
        AtomicBoolean allowed = new AtomicBoolean(false);
        newManager(
            fastConfig().reconnectStrategy(ReconnectStrategy.CALLBACK_CONTROLLED).build(),
            ConnectionHooks.builder().shouldReconnect(allowed::get)
        );
        manager.connect();

        transport.last().drop();
        Thread.sleep(200);
        assertEquals(1, transport.attempts(), "No attempt until the window opens");
        assertEquals(ConnectionState.RECONNECTING, manager.state());

        allowed.set(true);
        assertTrue(manager.waitConnected(WAIT));
        assertEquals(2, transport.attempts());
    }

    @Test
    void testScheduleReconnect() throws InterruptedException {
        newManager(fastConfig().build());

        assertTrue(manager.scheduleReconnect(Duration.ofMillis(20)));
        assertEquals(ConnectionState.RECONNECTING, manager.state());
        assertTrue(manager.waitConnected(WAIT));

        assertFalse(manager.scheduleReconnect(Duration.ofMillis(20)), "Only valid from DISCONNECTED");
    }

    @Test
    void testWaitForReconnectWindow() throws InterruptedException {
        newManager(fastConfig().build());
        assertFalse(manager.waitForReconnectWindow(Duration.ofMillis(50)), "No hook means no window");

        AtomicInteger polls = new AtomicInteger();
        assertTrue(manager.waitForReconnectWindow(WAIT, () -> polls.incrementAndGet() >= 3));
        assertEquals(3, polls.get());

        assertFalse(manager.waitForReconnectWindow(Duration.ofMillis(60), () -> false));
    }

    @Test
    void testShutdownStopsReconnectLoop() throws InterruptedException {
        newManager(fastConfig().reconnectDelay(Duration.ofMillis(200)).maxReconnectDelay(Duration.ofMillis(200)).build());
        manager.connect();
        transport.refuseAll = true;
        transport.last().drop();
        assertTrue(Await.until(() -> manager.state() == ConnectionState.RECONNECTING, WAIT));

        manager.shutdown();

        Thread.sleep(400);
        assertEquals(ConnectionState.CLOSED, manager.state());
        assertEquals(1, transport.attempts());
    }
}
