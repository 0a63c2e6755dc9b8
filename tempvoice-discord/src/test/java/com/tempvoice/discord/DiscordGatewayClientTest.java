package com.tempvoice.discord;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tempvoice.voice.platform.PlatformEvent;
import okhttp3.OkHttpClient;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Gateway session against a mock websocket endpoint.
 */
class DiscordGatewayClientTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    private MockWebServer server;
    private DiscordGatewayClient client;
    private final BlockingQueue<PlatformEvent> events = new LinkedBlockingQueue<>();
    private final BlockingQueue<JsonNode> received = new LinkedBlockingQueue<>();

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        client = new DiscordGatewayClient(server.url("/gateway").toString(), "Bot test-token", 1_000,
                new DiscordGatewayEventMapper(), events::add, new OkHttpClient());
    }

    @AfterEach
    void tearDown() throws IOException {
        client.close();
        server.shutdown();
    }

    /** Server side of one session: hello, then the given action once identified. */
    private MockResponse session(long heartbeatMs, SessionAction onIdentify) {
        return new MockResponse().withWebSocketUpgrade(new WebSocketListener() {
            @Override
            public void onOpen(WebSocket ws, Response response) {
                ws.send("{\"op\": 10, \"d\": {\"heartbeat_interval\": " + heartbeatMs + "}}");
            }

            @Override
            public void onMessage(WebSocket ws, String text) {
                try {
                    JsonNode payload = JSON.readTree(text);
                    received.add(payload);
                    int op = payload.path("op").asInt();
                    if (op == DiscordGatewayClient.OP_IDENTIFY) {
                        onIdentify.run(ws);
                    } else if (op == DiscordGatewayClient.OP_HEARTBEAT) {
                        ws.send("{\"op\": 11}");
                    }
                } catch (IOException e) {
                    throw new AssertionError(e);
                }
            }
        });
    }

    @FunctionalInterface
    private interface SessionAction {
        void run(WebSocket ws);
    }

    private JsonNode nextSent(int op) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (System.currentTimeMillis() < deadline) {
            JsonNode payload = received.poll(100, TimeUnit.MILLISECONDS);
            if (payload != null && payload.path("op").asInt() == op) {
                return payload;
            }
        }
        fail("no payload with op " + op);
        return null;
    }

    @Test
    void identifiesAndForwardsDispatches() throws Exception {
        server.enqueue(session(45_000, ws -> {
            ws.send("{\"op\": 0, \"s\": 1, \"t\": \"READY\", \"d\": {\"guilds\": []}}");
            ws.send("{\"op\": 0, \"s\": 2, \"t\": \"VOICE_STATE_UPDATE\", \"d\": "
                    + "{\"guild_id\": \"1\", \"user_id\": \"100\", \"channel_id\": \"10\"}}");
        }));

        client.start();

        JsonNode identify = nextSent(DiscordGatewayClient.OP_IDENTIFY);
        assertEquals("test-token", identify.path("d").path("token").asText());
        assertEquals(DiscordGatewayClient.INTENTS, identify.path("d").path("intents").asInt());
        PlatformEvent event = events.poll(5, TimeUnit.SECONDS);
        assertEquals(new PlatformEvent.MemberVoiceStateChanged(1, 100, null, 10L, false), event);
        assertTrue(client.isConnected());
    }

    @Test
    void heartbeatCarriesLastSequence() throws Exception {
        server.enqueue(session(50, ws -> ws.send(
                "{\"op\": 0, \"s\": 7, \"t\": \"GUILD_MEMBER_REMOVE\", \"d\": "
                        + "{\"guild_id\": \"1\", \"user\": {\"id\": \"5\"}}}")));

        client.start();

        assertEquals(new PlatformEvent.MemberRemoved(1, 5), events.poll(5, TimeUnit.SECONDS));
        long deadline = System.currentTimeMillis() + 5_000;
        JsonNode heartbeat;
        do {
            heartbeat = nextSent(DiscordGatewayClient.OP_HEARTBEAT);
        } while (heartbeat.path("d").asLong(-1) != 7 && System.currentTimeMillis() < deadline);
        assertEquals(7, heartbeat.path("d").asLong());
    }

    @Test
    void reconnectsAfterServerClose() throws Exception {
        server.enqueue(session(45_000, ws -> ws.close(4000, "unknown error")));
        server.enqueue(session(45_000, ws -> {
        }));

        client.start();

        nextSent(DiscordGatewayClient.OP_IDENTIFY);
        nextSent(DiscordGatewayClient.OP_IDENTIFY);
        assertEquals(2, server.getRequestCount());
    }

    @Test
    void authenticationFailureStopsReconnecting() throws Exception {
        server.enqueue(session(45_000, ws -> ws.close(4004, "Authentication failed.")));

        client.start();

        nextSent(DiscordGatewayClient.OP_IDENTIFY);
        Thread.sleep(1_500);
        assertEquals(1, server.getRequestCount());
        assertFalse(client.isConnected());
    }
}
