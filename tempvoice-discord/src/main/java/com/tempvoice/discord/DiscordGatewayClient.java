package com.tempvoice.discord;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tempvoice.common.config.TempVoiceConfig;
import com.tempvoice.voice.platform.PlatformEvent;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;

import java.util.List;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Gateway connection: identifies, keeps the heartbeat and forwards mapped
 * dispatches to a listener. A dropped connection is re-established with
 * exponential backoff; the GUILD_CREATE replay after a fresh identify resyncs
 * members and voice states.
 */
@Slf4j
public class DiscordGatewayClient implements AutoCloseable {

    public static final int OP_DISPATCH = 0;
    public static final int OP_HEARTBEAT = 1;
    public static final int OP_IDENTIFY = 2;
    public static final int OP_RECONNECT = 7;
    public static final int OP_INVALID_SESSION = 9;
    public static final int OP_HELLO = 10;
    public static final int OP_HEARTBEAT_ACK = 11;

    /** GUILDS | GUILD_MEMBERS | GUILD_VOICE_STATES. */
    public static final int INTENTS = 1 | (1 << 1) | (1 << 7);

    /** Close codes after which reconnecting cannot succeed. */
    private static final Set<Integer> FATAL_CLOSE_CODES = Set.of(4004, 4010, 4011, 4012, 4013, 4014);
    private static final long MIN_RECONNECT_DELAY_MS = 1_000;

    private final String gatewayUrl;
    private final String token;
    private final long maxReconnectDelayMs;
    private final DiscordGatewayEventMapper mapper;
    private final Consumer<PlatformEvent> listener;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "discord-gateway");
        t.setDaemon(true);
        return t;
    });

    private final AtomicLong sequence = new AtomicLong(-1);
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile WebSocket socket;
    private volatile ScheduledFuture<?> heartbeat;
    private volatile boolean ackPending;
    private volatile int reconnectAttempts;

    public DiscordGatewayClient(TempVoiceConfig.DiscordConfig config, DiscordGatewayEventMapper mapper,
            Consumer<PlatformEvent> listener) {
        this(config.getGatewayUrl(), config.getToken(), config.getReconnectMaxDelayMs(), mapper, listener,
                new OkHttpClient.Builder().readTimeout(0, TimeUnit.MILLISECONDS).build());
    }

    public DiscordGatewayClient(String gatewayUrl, String token, long maxReconnectDelayMs,
            DiscordGatewayEventMapper mapper, Consumer<PlatformEvent> listener, OkHttpClient httpClient) {
        if (DiscordApi.normalizeToken(token) == null) {
            throw new IllegalArgumentException("Discord bot token is not configured");
        }
        this.gatewayUrl = gatewayUrl;
        this.token = DiscordApi.normalizeToken(token);
        this.maxReconnectDelayMs = Math.max(MIN_RECONNECT_DELAY_MS, maxReconnectDelayMs);
        this.mapper = mapper;
        this.listener = listener;
        this.httpClient = httpClient;
    }

    public void start() {
        connect();
    }

    public boolean isConnected() {
        return socket != null;
    }

    private void connect() {
        if (closed.get()) {
            return;
        }
        log.info("Connecting to Discord gateway");
        Request request = new Request.Builder().url(gatewayUrl).build();
        httpClient.newWebSocket(request, new GatewayListener());
    }

    private final class GatewayListener extends WebSocketListener {

        @Override
        public void onOpen(WebSocket ws, Response response) {
            socket = ws;
        }

        @Override
        public void onMessage(WebSocket ws, String text) {
            try {
                handlePayload(ws, objectMapper.readTree(text));
            } catch (Exception e) {
                log.error("Failed to handle gateway payload", e);
            }
        }

        @Override
        public void onClosing(WebSocket ws, int code, String reason) {
            ws.close(1000, null);
        }

        @Override
        public void onClosed(WebSocket ws, int code, String reason) {
            if (FATAL_CLOSE_CODES.contains(code)) {
                log.error("Gateway closed with {} ({}), not reconnecting", code, reason);
                disconnected(ws, false);
                return;
            }
            log.warn("Gateway closed with {} ({})", code, reason);
            disconnected(ws, true);
        }

        @Override
        public void onFailure(WebSocket ws, Throwable t, Response response) {
            log.warn("Gateway connection failed: {}", t.getMessage());
            disconnected(ws, true);
        }
    }

    void handlePayload(WebSocket ws, JsonNode payload) {
        int op = payload.path("op").asInt(-1);
        if (payload.hasNonNull("s")) {
            sequence.set(payload.get("s").asLong());
        }
        switch (op) {
            case OP_HELLO -> {
                long interval = payload.path("d").path("heartbeat_interval").asLong(41_250);
                startHeartbeat(ws, interval);
                identify(ws);
            }
            case OP_DISPATCH -> dispatch(payload.path("t").asText(null), payload.path("d"));
            case OP_HEARTBEAT -> sendHeartbeat(ws);
            case OP_HEARTBEAT_ACK -> ackPending = false;
            case OP_RECONNECT -> {
                log.info("Gateway requested reconnect");
                ws.close(4000, "reconnect requested");
            }
            case OP_INVALID_SESSION -> {
                log.warn("Gateway session invalidated, identifying again");
                scheduler.schedule(() -> identify(ws), 2, TimeUnit.SECONDS);
            }
            default -> log.debug("Ignoring gateway op {}", op);
        }
    }

    private void dispatch(String type, JsonNode data) {
        if ("READY".equals(type)) {
            reconnectAttempts = 0;
            log.info("Gateway session ready, {} guilds", data.path("guilds").size());
            return;
        }
        List<PlatformEvent> events = mapper.map(type, data);
        for (PlatformEvent event : events) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                log.error("Event listener failed on {}", event, e);
            }
        }
    }

    private void identify(WebSocket ws) {
        ObjectNode properties = objectMapper.createObjectNode()
                .put("os", System.getProperty("os.name", "linux"))
                .put("browser", "tempvoice")
                .put("device", "tempvoice");
        ObjectNode data = objectMapper.createObjectNode()
                .put("token", token)
                .put("intents", INTENTS);
        data.set("properties", properties);
        send(ws, OP_IDENTIFY, data);
    }

    private void startHeartbeat(WebSocket ws, long intervalMs) {
        stopHeartbeat();
        ackPending = false;
        heartbeat = scheduler.scheduleAtFixedRate(() -> {
            if (ackPending) {
                log.warn("Heartbeat not acknowledged, reconnecting");
                ws.close(4000, "zombied connection");
                return;
            }
            ackPending = true;
            sendHeartbeat(ws);
        }, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    private void sendHeartbeat(WebSocket ws) {
        long seq = sequence.get();
        send(ws, OP_HEARTBEAT, seq >= 0 ? objectMapper.getNodeFactory().numberNode(seq)
                : objectMapper.nullNode());
    }

    private void send(WebSocket ws, int op, JsonNode data) {
        ObjectNode payload = objectMapper.createObjectNode().put("op", op);
        payload.set("d", data);
        if (!ws.send(payload.toString())) {
            log.warn("Gateway send of op {} failed", op);
        }
    }

    private void stopHeartbeat() {
        ScheduledFuture<?> current = heartbeat;
        if (current != null) {
            current.cancel(false);
            heartbeat = null;
        }
    }

    private synchronized void disconnected(WebSocket ws, boolean reconnect) {
        if (socket != null && socket != ws) {
            return;
        }
        socket = null;
        stopHeartbeat();
        if (!reconnect || closed.get()) {
            return;
        }
        int attempt = reconnectAttempts++;
        long delay = Math.min(maxReconnectDelayMs, MIN_RECONNECT_DELAY_MS << Math.min(attempt, 16));
        log.info("Reconnecting to gateway in {}ms", delay);
        scheduler.schedule(this::connect, delay, TimeUnit.MILLISECONDS);
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        stopHeartbeat();
        WebSocket current = socket;
        if (current != null) {
            current.close(1000, "shutdown");
        }
        scheduler.shutdownNow();
        log.info("Gateway client closed");
    }
}
