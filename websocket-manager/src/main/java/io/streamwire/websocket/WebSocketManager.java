package io.streamwire.websocket;

import io.streamwire.websocket.codec.JsonMessageCodec;
import io.streamwire.websocket.codec.JsonSubscriptionProtocol;
import io.streamwire.websocket.codec.SubscriptionProtocol;
import io.streamwire.websocket.config.WebSocketConfig;
import io.streamwire.websocket.exception.WebSocketClosedException;
import io.streamwire.websocket.exception.WebSocketConnectionException;
import io.streamwire.websocket.exception.WebSocketTimeoutException;
import io.streamwire.websocket.model.ConnectionState;
import io.streamwire.websocket.model.ConnectionStats;
import io.streamwire.websocket.model.DisconnectReason;
import io.streamwire.websocket.model.ReconnectStrategy;
import io.streamwire.websocket.model.WebSocketMessage;
import io.streamwire.websocket.netty.NettyWebSocketTransport;
import io.streamwire.websocket.transport.InboundFrame;
import io.streamwire.websocket.transport.TransportClosedException;
import io.streamwire.websocket.transport.TransportConnection;
import io.streamwire.websocket.transport.WebSocketTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Keeps one long-lived WebSocket connection alive.
 *
 * <p>The manager runs three activities per connection: a read loop that decodes frames into a
 * bounded queue, a keepalive loop that pings and polls the disconnect policy, and a reconnect
 * loop that re-establishes reactive disconnects with backoff. Every torn-down connection is
 * reported to the disconnect hook with a {@link DisconnectReason}. When internal retries are
 * exhausted, or the connection was killed, the manager goes quiet in
 * {@link ConnectionState#DISCONNECTED} so a supervisor can rebuild it.
 *
 * <p>A frame taken off the wire always reaches the queue. Readers of torn-down connections
 * finish their pending frames; {@link #drainRemaining()} collects them after close.
 *
 * <p>Usage:
 * <pre>
 * try (WebSocketManager ws = new WebSocketManager("wss://stream.example.com/ws", config).connect()) {
 *     ws.subscribe("btcusdt@trade");
 *     ws.stream().forEach(message -&gt; handle(message));
 * }
 * </pre>
 */
public class WebSocketManager implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(WebSocketManager.class);

    private static final long STREAM_POLL_MS = 100;
    private static final int GOING_AWAY = 1001;

    private final URI uri;
    private final String name;
    private final WebSocketConfig config;
    private final ConnectionHooks hooks;
    private final WebSocketTransport transport;
    private final SubscriptionProtocol subscriptionProtocol;
    private final JsonMessageCodec codec = JsonMessageCodec.getInstance();
    private final ConnectionStats stats = new ConnectionStats();
    private final BlockingQueue<WebSocketMessage> messageQueue;
    private final ReconnectDelayPolicy reconnectPolicy;
    private final ReconnectScheduler reconnectScheduler;
    private final KeepaliveMonitor keepaliveMonitor;
    private final ConnectionSignal connectedSignal = new ConnectionSignal(false);
    private final ConnectionSignal disconnectedSignal = new ConnectionSignal(true);

    private final AtomicInteger activeReaders = new AtomicInteger();

    // guards state transitions, the live connection and the subscription set
    private final Object lock = new Object();
    private final Set<String> subscriptions = new LinkedHashSet<>();
    private TransportConnection connection;

    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private volatile boolean autoReconnect;
    private volatile boolean shutdown;
    private volatile long connectedAtNanos;

    public WebSocketManager(String url) {
        this(url, WebSocketConfig.defaults());
    }

    public WebSocketManager(String url, WebSocketConfig config) {
        this(url, config, ConnectionHooks.none());
    }

    /**
     * Creates a manager backed by the Netty transport.
     */
    public WebSocketManager(String url, WebSocketConfig config, ConnectionHooks hooks) {
        this(url, config, hooks, new NettyWebSocketTransport(), new JsonSubscriptionProtocol());
    }

    /**
     * Creates a manager.
     *
     * @param url                  ws:// or wss:// endpoint
     * @param config               Connection settings
     * @param hooks                Optional callbacks
     * @param transport            Opens the underlying connections
     * @param subscriptionProtocol Builds subscribe/unsubscribe wire messages
     */
    public WebSocketManager(
        String url,
        WebSocketConfig config,
        ConnectionHooks hooks,
        WebSocketTransport transport,
        SubscriptionProtocol subscriptionProtocol
    ) {
        this.uri = URI.create(Objects.requireNonNull(url, "url"));
        this.config = Objects.requireNonNull(config, "config");
        this.hooks = hooks == null ? ConnectionHooks.none() : hooks;
        this.transport = Objects.requireNonNull(transport, "transport");
        this.subscriptionProtocol = Objects.requireNonNull(subscriptionProtocol, "subscriptionProtocol");
        this.name = config.name() != null ? config.name() : (uri.getHost() != null ? uri.getHost() : url);
        this.autoReconnect = config.autoReconnect();
        this.messageQueue = config.queueSize() > 0
            ? new LinkedBlockingQueue<>(config.queueSize())
            : new LinkedBlockingQueue<>();
        this.reconnectPolicy = new ReconnectDelayPolicy(config);
        this.reconnectScheduler = new ReconnectScheduler(name);
        this.keepaliveMonitor = new KeepaliveMonitor(
            name, config.pingInterval(), config.pingTimeout(), new KeepaliveListener());
    }

    // ---------------------------------------------------------------- lifecycle

    /**
     * Opens the connection, replays subscriptions and starts the read and keepalive loops.
     *
     * <p>Does nothing when already connected or connecting, or once the manager is closed.
     * A failed open is handed to the reconnect loop when auto-reconnect is on.
     *
     * @return this manager
     * @throws WebSocketConnectionException if the open fails and auto-reconnect is off
     */
    public WebSocketManager connect() {
        synchronized (lock) {
            if (!state.canConnect()) {
                LOGGER.warn("{}: connect() ignored, manager is {}", name, state);
                return this;
            }
            if (state == ConnectionState.CONNECTED || state == ConnectionState.CONNECTING) {
                LOGGER.debug("{}: connect() ignored, already {}", name, state);
                return this;
            }
            reconnectScheduler.cancel();
            transitionTo(ConnectionState.CONNECTING);
        }

        LOGGER.info("{}: Connecting to {}", name, uri);
        try {
            openAndAttach();
        } catch (IOException | RuntimeException e) {
            if (handleFailedAttempt(e, false)) {
                return this;
            }
            throw new WebSocketConnectionException(uri.toString(), 1, e);
        }
        return this;
    }

    /**
     * Tears the connection down as if it crashed, without reconnecting.
     * The manager ends in {@link ConnectionState#DISCONNECTED}, left for a supervisor to replace.
     */
    public void kill() {
        stopLocally(DisconnectReason.KILLED, "kill()");
    }

    /**
     * Closes the connection on purpose and stops any pending reconnect, without retiring
     * the manager: {@link #connect()} may be called again. Counted as a proactive disconnect.
     */
    public void disconnect() {
        stopLocally(DisconnectReason.NORMAL_CLOSE, "disconnect()");
    }

    private void stopLocally(DisconnectReason reason, String operation) {
        TransportConnection source;
        synchronized (lock) {
            if (state == ConnectionState.CLOSED) {
                LOGGER.warn("{}: {} ignored, manager is closed", name, operation);
                return;
            }
            if (state == ConnectionState.DISCONNECTED) {
                LOGGER.debug("{}: {} ignored, already disconnected", name, operation);
                return;
            }
            reconnectScheduler.cancel();
            source = detachLocked();
            if (source != null) {
                stats.recordDisconnect(reason.isProactive());
            }
            transitionTo(ConnectionState.DISCONNECTED);
            signalDisconnectedLocked();
        }

        if (reason == DisconnectReason.KILLED) {
            LOGGER.warn("{}: Killed", name);
        } else {
            LOGGER.info("{}: Disconnected on request", name);
        }
        if (source != null) {
            source.close(TransportClosedException.NORMAL_CLOSURE, reason.name().toLowerCase());
            invokeOnDisconnect(reason);
        }
    }

    /**
     * Recycles a live connection on purpose. Counted as a proactive disconnect.
     * Only valid while connected.
     */
    public void triggerReconnect() {
        if (!dropConnection(null, DisconnectReason.PROACTIVE_RECONNECT, null)) {
            LOGGER.warn("{}: triggerReconnect() ignored in state {}", name, state);
        }
    }

    /**
     * Schedules a reconnect from {@link ConnectionState#DISCONNECTED} after the given delay.
     *
     * @return false if the manager is not disconnected
     */
    public boolean scheduleReconnect(Duration delay) {
        synchronized (lock) {
            if (state != ConnectionState.DISCONNECTED) {
                LOGGER.warn("{}: scheduleReconnect() ignored in state {}", name, state);
                return false;
            }
            transitionTo(ConnectionState.RECONNECTING);
        }
        reconnectPolicy.recordSuccess();
        LOGGER.info("{}: Reconnect scheduled in {} ms", name, delay.toMillis());
        reconnectScheduler.schedule(delay, this::runReconnectAttempt);
        return true;
    }

    /**
     * Retires the manager for good. Idempotent; always ends closed with {@link #isShutdown()} true.
     */
    public void shutdown() {
        closeInternal(DisconnectReason.SHUTDOWN);
    }

    /**
     * Closes the manager without marking it shut down, so a supervisor may replace it.
     */
    public void forceClose() {
        closeInternal(DisconnectReason.NORMAL_CLOSE);
    }

    /**
     * Same as {@link #forceClose()}.
     */
    @Override
    public void close() {
        forceClose();
    }

    // ---------------------------------------------------------------- messaging

    /**
     * Sends one message. Strings go out as text, byte arrays as binary frames,
     * anything else is serialized to JSON.
     *
     * @throws WebSocketClosedException if not connected or the write fails
     */
    public void send(Object message) {
        Objects.requireNonNull(message, "message");
        TransportConnection target;
        synchronized (lock) {
            if (!state.canSend() || connection == null) {
                throw new WebSocketClosedException(name + ": cannot send, connection is " + state);
            }
            target = connection;
        }

        try {
            if (message instanceof byte[] data) {
                target.sendBinary(data);
                stats.recordMessageSent(data.length);
            } else {
                String text = codec.encode(message);
                target.sendText(text);
                stats.recordMessageSent(text.getBytes(StandardCharsets.UTF_8).length);
            }
        } catch (IOException e) {
            dropConnection(target, reasonFor(e), e);
            throw new WebSocketClosedException(
                name + ": send failed", WebSocketClosedException.ABNORMAL_CLOSURE, e.getMessage(), e);
        }
    }

    /**
     * Takes the next queued message.
     *
     * @throws WebSocketTimeoutException if nothing arrives within the timeout
     */
    public WebSocketMessage receive(Duration timeout) throws InterruptedException {
        WebSocketMessage message = messageQueue.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
        if (message == null) {
            throw new WebSocketTimeoutException("receive", timeout);
        }
        return message;
    }

    /**
     * Returns a lazy stream over queued messages in arrival order. It blocks while the
     * queue is empty, survives reconnects, and ends once the manager is closed or the
     * consuming thread is interrupted. Messages left queued at close are picked up with
     * {@link #drainRemaining()}.
     */
    public Stream<WebSocketMessage> stream() {
        Iterator<WebSocketMessage> iterator = new Iterator<>() {
            private WebSocketMessage next;

            @Override
            public boolean hasNext() {
                while (next == null) {
                    if (state == ConnectionState.CLOSED) {
                        return false;
                    }
                    try {
                        next = messageQueue.poll(STREAM_POLL_MS, TimeUnit.MILLISECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return false;
                    }
                }
                return true;
            }

            @Override
            public WebSocketMessage next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                WebSocketMessage message = next;
                next = null;
                return message;
            }
        };
        return StreamSupport.stream(
            Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL),
            false
        );
    }

    /**
     * Takes every message still queued. On a closed manager this also waits for readers of
     * torn-down connections to hand over the frame they hold, so nothing received is left behind.
     */
    public List<WebSocketMessage> drainRemaining() throws InterruptedException {
        List<WebSocketMessage> drained = new ArrayList<>();
        while (true) {
            boolean complete = state != ConnectionState.CLOSED || activeReaders.get() == 0;
            messageQueue.drainTo(drained);
            if (complete) {
                return drained;
            }
            WebSocketMessage next = messageQueue.poll(STREAM_POLL_MS, TimeUnit.MILLISECONDS);
            if (next != null) {
                drained.add(next);
            }
        }
    }

    // ---------------------------------------------------------------- subscriptions

    /**
     * Adds channels to the persistent subscription set. Newly added channels are
     * subscribed on the wire right away when connected, and replayed on every reconnect.
     */
    public void subscribe(String... channels) {
        updateSubscriptions(true, channels);
    }

    /**
     * Removes channels from the subscription set. Unknown channels are ignored.
     */
    public void unsubscribe(String... channels) {
        updateSubscriptions(false, channels);
    }

    public Set<String> subscriptions() {
        synchronized (lock) {
            return Collections.unmodifiableSet(new LinkedHashSet<>(subscriptions));
        }
    }

    private void updateSubscriptions(boolean add, String... channels) {
        List<String> changed = new ArrayList<>();
        TransportConnection target;
        synchronized (lock) {
            if (state == ConnectionState.CLOSED) {
                LOGGER.warn("{}: {} ignored, manager is closed", name, add ? "subscribe()" : "unsubscribe()");
                return;
            }
            for (String channel : channels) {
                Objects.requireNonNull(channel, "channel");
                if (add ? subscriptions.add(channel) : subscriptions.remove(channel)) {
                    changed.add(channel);
                }
            }
            target = state == ConnectionState.CONNECTED ? connection : null;
        }

        if (target == null) {
            return;
        }
        for (String channel : changed) {
            String wire = add
                ? subscriptionProtocol.subscribeMessage(channel)
                : subscriptionProtocol.unsubscribeMessage(channel);
            if (!sendControl(target, wire)) {
                return;
            }
        }
    }

    private boolean sendControl(TransportConnection target, String wire) {
        try {
            target.sendText(wire);
            stats.recordMessageSent(wire.getBytes(StandardCharsets.UTF_8).length);
            LOGGER.debug("{}: Sent {}", name, wire);
            return true;
        } catch (IOException e) {
            LOGGER.warn("{}: Failed to send control message: {}", name, e.getMessage());
            dropConnection(target, reasonFor(e), e);
            return false;
        }
    }

    // ---------------------------------------------------------------- waiting

    /**
     * Waits until the manager is connected.
     *
     * @return true if connected within the timeout
     */
    public boolean waitConnected(Duration timeout) throws InterruptedException {
        return connectedSignal.await(timeout);
    }

    /**
     * Waits until the current connection ends. Returns true at once when not connected.
     *
     * @return true if disconnected within the timeout
     */
    public boolean waitDisconnected(Duration timeout) throws InterruptedException {
        if (state != ConnectionState.CONNECTED) {
            return true;
        }
        return disconnectedSignal.await(timeout);
    }

    /**
     * Polls the {@code shouldReconnect} hook until it allows a reconnect. A requested delay is ignored.
     *
     * @return true once allowed, false on timeout or when no hook is configured
     */
    public boolean waitForReconnectWindow(Duration timeout) throws InterruptedException {
        return waitForReconnectWindow(timeout, hooks.shouldReconnect() == null
            ? null
            : () -> reconnectDecision().allowed());
    }

    /**
     * Polls the given check every {@code reconnectCheckInterval} until it returns true.
     *
     * @return true once allowed, false on timeout or when {@code check} is null
     */
    public boolean waitForReconnectWindow(Duration timeout, BooleanSupplier check) throws InterruptedException {
        if (check == null) {
            return false;
        }
        long deadline = System.nanoTime() + timeout.toNanos();
        long pollMillis = Math.max(1, config.reconnectCheckInterval().toMillis());
        while (true) {
            if (invokeCheck(check, "reconnect window", false)) {
                return true;
            }
            long remainingMillis = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (remainingMillis <= 0) {
                return false;
            }
            Thread.sleep(Math.min(pollMillis, remainingMillis));
        }
    }

    // ---------------------------------------------------------------- introspection

    public ConnectionState state() {
        return state;
    }

    public boolean isConnected() {
        return state == ConnectionState.CONNECTED;
    }

    /**
     * Returns true when nothing inside the manager will bring the connection back.
     */
    public boolean isDead() {
        ConnectionState current = state;
        return current == ConnectionState.DISCONNECTED || current == ConnectionState.CLOSED;
    }

    public boolean isShutdown() {
        return shutdown;
    }

    /**
     * Time since the current connection was established, zero when not connected.
     */
    public Duration connectionDuration() {
        long connectedAt = connectedAtNanos;
        if (state != ConnectionState.CONNECTED || connectedAt == 0) {
            return Duration.ZERO;
        }
        return Duration.ofNanos(System.nanoTime() - connectedAt);
    }

    public ConnectionStats stats() {
        return stats;
    }

    /** Messages received but not yet consumed. */
    public int pendingMessages() {
        return messageQueue.size();
    }

    public String url() {
        return uri.toString();
    }

    public String name() {
        return name;
    }

    public WebSocketConfig config() {
        return config;
    }

    // ---------------------------------------------------------------- connection internals

    /**
     * Opens a transport and, unless the manager moved on meanwhile, makes it the live connection.
     */
    private void openAndAttach() throws IOException {
        TransportConnection opened = transport.open(uri, config.connectionTimeout());

        List<String> replay;
        synchronized (lock) {
            if (state != ConnectionState.CONNECTING) {
                replay = null;
            } else {
                connection = opened;
                connectedAtNanos = System.nanoTime();
                transitionTo(ConnectionState.CONNECTED);
                stats.recordConnect();
                replay = new ArrayList<>(subscriptions);
            }
        }
        if (replay == null) {
            LOGGER.info("{}: Discarding connection opened after the manager moved to {}", name, state);
            opened.close(TransportClosedException.NORMAL_CLOSURE, "superseded");
            return;
        }

        reconnectPolicy.recordSuccess();
        LOGGER.info("{}: Connected", name);

        for (String channel : replay) {
            if (!sendControl(opened, subscriptionProtocol.subscribeMessage(channel))) {
                return;
            }
        }
        if (!replay.isEmpty()) {
            LOGGER.info("{}: Replayed {} subscription(s)", name, replay.size());
        }

        synchronized (lock) {
            if (connection != opened) {
                return;
            }
            startReader(opened);
            keepaliveMonitor.start(opened);
        }

        invokeHook(hooks.onConnect(), "onConnect");

        synchronized (lock) {
            if (connection == opened) {
                disconnectedSignal.clear();
                connectedSignal.set();
            }
        }
    }

    /**
     * Starts a reader for the connection. It runs until the transport reports the close,
     * so closing the connection is what stops it.
     */
    private void startReader(TransportConnection source) {
        Thread thread = new Thread(() -> readLoop(source), name + "-reader");
        thread.setDaemon(true);
        activeReaders.incrementAndGet();
        thread.start();
    }

    private void readLoop(TransportConnection source) {
        try {
            while (true) {
                InboundFrame frame = source.receive();
                WebSocketMessage message = codec.decode(frame);
                invokeOnMessage(message);
                enqueue(message);
                stats.recordMessageReceived(message.sizeBytes());
            }
        } catch (TransportClosedException e) {
            dropConnection(source, reasonFor(e), e);
        } catch (IOException e) {
            dropConnection(source, DisconnectReason.NETWORK_ERROR, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.debug("{}: Reader stopped", name);
        } finally {
            activeReaders.decrementAndGet();
        }
    }

    /**
     * Blocks until the queue has room. An interrupt does not drop the message.
     */
    private void enqueue(WebSocketMessage message) {
        boolean interrupted = false;
        while (true) {
            try {
                messageQueue.put(message);
                break;
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Ends the live connection for a non-terminal reason and starts the reconnect loop
     * when auto-reconnect is on.
     *
     * @param expected the connection the caller observed, or null for whichever is live
     * @return false if that connection was no longer live
     */
    private boolean dropConnection(TransportConnection expected, DisconnectReason reason, Throwable cause) {
        TransportConnection source;
        boolean retry;
        synchronized (lock) {
            if (state != ConnectionState.CONNECTED || connection == null) {
                return false;
            }
            if (expected != null && connection != expected) {
                return false;
            }
            source = detachLocked();
            stats.recordDisconnect(reason.isProactive());
            retry = autoReconnect && !shutdown;
            transitionTo(retry ? ConnectionState.RECONNECTING : ConnectionState.DISCONNECTED);
            signalDisconnectedLocked();
        }

        if (reason.isProactive()) {
            LOGGER.info("{}: Disconnected ({})", name, reason);
        } else {
            LOGGER.warn("{}: Disconnected ({}){}", name, reason,
                cause != null ? ": " + cause.getMessage() : "");
        }
        source.close(TransportClosedException.NORMAL_CLOSURE, reason.name().toLowerCase());
        invokeOnDisconnect(reason);

        if (retry) {
            reconnectPolicy.recordSuccess();
            scheduleReconnectAttempt();
        }
        return true;
    }

    /**
     * Detaches the live connection and stops its keepalive. Its reader ends once the
     * caller closes the connection. Caller holds the lock.
     */
    private TransportConnection detachLocked() {
        TransportConnection source = connection;
        connection = null;
        connectedAtNanos = 0;
        keepaliveMonitor.stop();
        return source;
    }

    private void signalDisconnectedLocked() {
        connectedSignal.clear();
        disconnectedSignal.set();
    }

    private void closeInternal(DisconnectReason reason) {
        TransportConnection source;
        synchronized (lock) {
            if (reason == DisconnectReason.SHUTDOWN) {
                shutdown = true;
            }
            autoReconnect = false;
            if (state == ConnectionState.CLOSED) {
                LOGGER.debug("{}: Already closed", name);
                return;
            }
            source = detachLocked();
            if (source != null) {
                stats.recordDisconnect(reason.isProactive());
            }
            transitionTo(ConnectionState.CLOSED);
            signalDisconnectedLocked();
        }

        reconnectScheduler.close();
        keepaliveMonitor.close();
        if (source != null) {
            int code = reason == DisconnectReason.SHUTDOWN ? GOING_AWAY : TransportClosedException.NORMAL_CLOSURE;
            source.close(code, reason.name().toLowerCase());
            invokeOnDisconnect(reason);
        }
        LOGGER.info("{}: Closed ({})", name, reason);
    }

    // ---------------------------------------------------------------- reconnect loop

    private void scheduleReconnectAttempt() {
        if (!reconnectPolicy.shouldRetry()) {
            giveUp("max reconnect attempts (" + reconnectPolicy.getMaxAttempts() + ") reached");
            return;
        }
        if (config.reconnectStrategy() == ReconnectStrategy.CALLBACK_CONTROLLED) {
            reconnectScheduler.schedule(config.reconnectCheckInterval(), this::awaitReconnectPermission);
            return;
        }
        ReconnectDecision decision = reconnectDecision();
        if (!decision.allowed()) {
            giveUp("shouldReconnect declined");
            return;
        }
        Duration delay = decision.delay() != null ? decision.delay() : reconnectPolicy.nextDelay();
        LOGGER.info("{}: Scheduling reconnect attempt {} in {} ms",
            name, reconnectPolicy.getFailedAttempts() + 1, delay.toMillis());
        reconnectScheduler.schedule(delay, this::runReconnectAttempt);
    }

    private void awaitReconnectPermission() {
        if (state != ConnectionState.RECONNECTING) {
            return;
        }
        ReconnectDecision decision = reconnectDecision();
        if (!decision.allowed()) {
            reconnectScheduler.schedule(config.reconnectCheckInterval(), this::awaitReconnectPermission);
        } else if (decision.delay() != null && !decision.delay().isZero()) {
            LOGGER.info("{}: Reconnect allowed in {} ms", name, decision.delay().toMillis());
            reconnectScheduler.schedule(decision.delay(), this::runReconnectAttempt);
        } else {
            runReconnectAttempt();
        }
    }

    private void runReconnectAttempt() {
        synchronized (lock) {
            if (state != ConnectionState.RECONNECTING) {
                LOGGER.debug("{}: Reconnect attempt skipped in state {}", name, state);
                return;
            }
            transitionTo(ConnectionState.CONNECTING);
        }

        LOGGER.info("{}: Attempting reconnection #{}", name, reconnectPolicy.getFailedAttempts() + 1);
        try {
            openAndAttach();
        } catch (IOException | RuntimeException e) {
            if (!handleFailedAttempt(e, true)) {
                LOGGER.error("{}: Reconnect failed, auto-reconnect disabled", name);
            }
        }
    }

    /**
     * Handles a failed open.
     *
     * @param reconnectAttempt whether the open was a reconnect attempt, counted against the limit
     * @return true if the failure was absorbed (superseded or handed to the reconnect loop)
     */
    private boolean handleFailedAttempt(Exception e, boolean reconnectAttempt) {
        boolean retry;
        synchronized (lock) {
            if (state != ConnectionState.CONNECTING) {
                LOGGER.debug("{}: Ignoring failed attempt, manager moved to {}", name, state);
                return true;
            }
            retry = autoReconnect && !shutdown;
            transitionTo(retry ? ConnectionState.RECONNECTING : ConnectionState.DISCONNECTED);
        }
        LOGGER.warn("{}: Connection attempt failed: {}", name, e.getMessage());
        if (!retry) {
            return false;
        }
        if (reconnectAttempt) {
            reconnectPolicy.recordFailure();
        }
        scheduleReconnectAttempt();
        return true;
    }

    private void giveUp(String why) {
        synchronized (lock) {
            if (state != ConnectionState.RECONNECTING) {
                return;
            }
            transitionTo(ConnectionState.DISCONNECTED);
            signalDisconnectedLocked();
        }
        LOGGER.error("{}: Giving up reconnecting: {}", name, why);

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("name", name);
        context.put("url", uri.toString());
        context.put("reason", why);
        context.put("failedAttempts", reconnectPolicy.getFailedAttempts());
        invokeOnAlert(name + " stopped reconnecting: " + why, context);
    }

    // ---------------------------------------------------------------- helpers

    /**
     * Moves to the next state. Caller holds the lock. Nothing leaves CLOSED.
     */
    private void transitionTo(ConnectionState next) {
        ConnectionState previous = state;
        if (previous == next) {
            return;
        }
        if (previous == ConnectionState.CLOSED) {
            LOGGER.warn("{}: Refusing transition {} -> {}", name, previous, next);
            return;
        }
        state = next;
        LOGGER.debug("{}: {} -> {}", name, previous, next);
    }

    private static DisconnectReason reasonFor(IOException e) {
        if (e instanceof TransportClosedException closed && closed.isRemote()) {
            return DisconnectReason.SERVER_CLOSE;
        }
        return DisconnectReason.NETWORK_ERROR;
    }

    private void invokeHook(Runnable hook, String hookName) {
        if (hook == null) {
            return;
        }
        try {
            hook.run();
        } catch (RuntimeException e) {
            LOGGER.error("{}: Error in {} hook", name, hookName, e);
        }
    }

    private void invokeOnDisconnect(DisconnectReason reason) {
        Consumer<DisconnectReason> hook = hooks.onDisconnect();
        if (hook == null) {
            return;
        }
        try {
            hook.accept(reason);
        } catch (RuntimeException e) {
            LOGGER.error("{}: Error in onDisconnect hook", name, e);
        }
    }

    private void invokeOnMessage(WebSocketMessage message) {
        Consumer<WebSocketMessage> hook = hooks.onMessage();
        if (hook == null) {
            return;
        }
        try {
            hook.accept(message);
        } catch (RuntimeException e) {
            LOGGER.error("{}: Error in onMessage hook", name, e);
        }
    }

    private void invokeOnAlert(String message, Map<String, Object> context) {
        AlertHandler hook = hooks.onAlert();
        if (hook == null) {
            return;
        }
        try {
            hook.onAlert(AlertHandler.WEBSOCKET_CHANNEL, message, Collections.unmodifiableMap(context));
        } catch (RuntimeException e) {
            LOGGER.error("{}: Error in onAlert hook", name, e);
        }
    }

    /**
     * Consults {@code shouldReconnect}. A missing hook, a null answer or a failing hook all proceed.
     */
    private ReconnectDecision reconnectDecision() {
        Supplier<ReconnectDecision> hook = hooks.shouldReconnect();
        if (hook == null) {
            return ReconnectDecision.proceed();
        }
        try {
            ReconnectDecision decision = hook.get();
            return decision != null ? decision : ReconnectDecision.proceed();
        } catch (RuntimeException e) {
            LOGGER.error("{}: Error in shouldReconnect hook, assuming proceed", name, e);
            return ReconnectDecision.proceed();
        }
    }

    private boolean invokeCheck(BooleanSupplier check, String checkName, boolean fallback) {
        if (check == null) {
            return fallback;
        }
        try {
            return check.getAsBoolean();
        } catch (RuntimeException e) {
            LOGGER.error("{}: Error in {} hook, assuming {}", name, checkName, fallback, e);
            return fallback;
        }
    }

    private final class KeepaliveListener implements KeepaliveMonitor.Listener {

        @Override
        public boolean shouldDisconnect() {
            return invokeCheck(hooks.shouldDisconnect(), "shouldDisconnect", false);
        }

        @Override
        public void onDisconnectRequested(TransportConnection watched) {
            dropConnection(watched, DisconnectReason.PROACTIVE_RECONNECT, null);
        }

        @Override
        public void onKeepaliveFailure(TransportConnection watched, DisconnectReason reason, Throwable cause) {
            dropConnection(watched, reason, cause);
        }
    }

    @Override
    public String toString() {
        return "WebSocketManager{" + name + ", " + state + '}';
    }
}
