package com.tempvoice.discord;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tempvoice.common.config.TempVoiceConfig;
import com.tempvoice.voice.model.Overwrite;
import com.tempvoice.voice.model.PlatformException;
import com.tempvoice.voice.model.TargetRef;
import com.tempvoice.voice.model.VoiceErrorCode;
import com.tempvoice.voice.platform.CreateChannelRequest;
import com.tempvoice.voice.platform.PlatformChannel;
import com.tempvoice.voice.platform.PlatformCommandSink;
import lombok.extern.slf4j.Slf4j;
import okhttp3.*;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * {@link PlatformCommandSink} backed by the Discord REST API. Every command is
 * one asynchronous HTTP call; failures complete the future with a classified
 * {@link PlatformException}. Spacing and retries are left to the caller.
 */
@Slf4j
public class DiscordRestCommandSink implements PlatformCommandSink {

    private static final MediaType JSON = MediaType.parse("application/json");

    private final String baseUrl;
    private final String authorization;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public DiscordRestCommandSink(TempVoiceConfig.DiscordConfig config) {
        this(config.getApiBaseUrl(), config.getToken(), new OkHttpClient.Builder()
                .connectTimeout(Duration.ofMillis(config.getConnectTimeoutMs()))
                .readTimeout(Duration.ofMillis(config.getReadTimeoutMs()))
                .build());
    }

    public DiscordRestCommandSink(String baseUrl, String token, OkHttpClient httpClient) {
        if (DiscordApi.normalizeToken(token) == null) {
            throw new IllegalArgumentException("Discord bot token is not configured");
        }
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.authorization = DiscordApi.authorization(token);
        this.httpClient = httpClient;
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public CompletableFuture<Long> createVoiceChannel(CreateChannelRequest request) {
        List<Map<String, Object>> overwrites = new ArrayList<>();
        for (Overwrite overwrite : request.overwrites().overwrites()) {
            Map<String, Object> entry = overwriteBody(overwrite);
            entry.put("id", Long.toString(overwrite.target().id()));
            overwrites.add(entry);
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", request.name());
        body.put("type", DiscordApi.CHANNEL_TYPE_VOICE);
        body.put("parent_id", Long.toString(request.categoryId()));
        body.put("user_limit", request.limit());
        body.put("permission_overwrites", overwrites);
        return call("create channel", "POST", "/guilds/" + request.guildId() + "/channels", body,
                json -> json.path("id").asLong());
    }

    @Override
    public CompletableFuture<Void> deleteChannel(long guildId, long channelId) {
        return call("delete channel " + channelId, "DELETE", "/channels/" + channelId, null, json -> null);
    }

    @Override
    public CompletableFuture<Void> editOverwrite(long guildId, long channelId, Overwrite overwrite) {
        return call("edit overwrite on " + channelId, "PUT",
                "/channels/" + channelId + "/permissions/" + overwrite.target().id(), overwriteBody(overwrite),
                json -> null);
    }

    @Override
    public CompletableFuture<Void> removeOverwrite(long guildId, long channelId, TargetRef target) {
        return call("remove overwrite on " + channelId, "DELETE",
                "/channels/" + channelId + "/permissions/" + target.id(), null, json -> null);
    }

    @Override
    public CompletableFuture<Void> disconnectMember(long guildId, long memberId) {
        Map<String, Object> body = new HashMap<>();
        body.put("channel_id", null);
        return this.<Void>call("disconnect member " + memberId, "PATCH", "/guilds/" + guildId + "/members/" + memberId, body,
                json -> null)
                .exceptionally(err -> {
                    if (err instanceof MemberAbsent || err.getCause() instanceof MemberAbsent) {
                        log.debug("Member {} already out of voice in guild {}", memberId, guildId);
                        return null;
                    }
                    throw PlatformException.from(err);
                });
    }

    @Override
    public CompletableFuture<Void> moveMember(long guildId, long memberId, long channelId) {
        Map<String, Object> body = Map.of("channel_id", Long.toString(channelId));
        return call("move member " + memberId, "PATCH", "/guilds/" + guildId + "/members/" + memberId, body,
                json -> null);
    }

    @Override
    public CompletableFuture<Void> setChannelLimit(long guildId, long channelId, int limit) {
        return call("set limit on " + channelId, "PATCH", "/channels/" + channelId, Map.of("user_limit", limit),
                json -> null);
    }

    @Override
    public CompletableFuture<List<PlatformChannel>> listChannels(long guildId) {
        return call("list channels", "GET", "/guilds/" + guildId + "/channels", null, json -> {
            List<PlatformChannel> channels = new ArrayList<>();
            for (JsonNode channel : json) {
                int type = channel.path("type").asInt(-1);
                JsonNode parent = channel.path("parent_id");
                channels.add(new PlatformChannel(
                        channel.path("id").asLong(),
                        guildId,
                        parent.isNull() || parent.isMissingNode() ? null : parent.asLong(),
                        channel.path("name").asText(""),
                        type == DiscordApi.CHANNEL_TYPE_VOICE || type == DiscordApi.CHANNEL_TYPE_STAGE));
            }
            return channels;
        });
    }

    // ── HTTP ────────────────────────────────────────────────────────────

    private static Map<String, Object> overwriteBody(Overwrite overwrite) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("type", overwrite.target() instanceof TargetRef.Member
                ? DiscordApi.OVERWRITE_MEMBER : DiscordApi.OVERWRITE_ROLE);
        body.put("allow", Long.toString(overwrite.allow()));
        body.put("deny", Long.toString(overwrite.deny()));
        return body;
    }

    private <T> CompletableFuture<T> call(String operation, String method, String path, Object body,
            Function<JsonNode, T> parser) {
        CompletableFuture<T> future = new CompletableFuture<>();
        Request request;
        try {
            RequestBody requestBody = body != null
                    ? RequestBody.create(objectMapper.writeValueAsString(body), JSON)
                    : null;
            request = new Request.Builder()
                    .url(baseUrl + path)
                    .header("Authorization", authorization)
                    .header("User-Agent", DiscordApi.USER_AGENT)
                    .method(method, requestBody)
                    .build();
        } catch (JsonProcessingException e) {
            future.completeExceptionally(new PlatformException(VoiceErrorCode.INVALID_TARGET,
                    operation + ": could not encode request", e));
            return future;
        }

        httpClient.newCall(request).enqueue(new Callback() {
            @Override
            public void onFailure(Call call, IOException e) {
                log.warn("Discord {} failed: {}", operation, e.getMessage());
                future.completeExceptionally(new PlatformException(VoiceErrorCode.PLATFORM_UNAVAILABLE,
                        operation + " failed: " + e.getMessage(), e));
            }

            @Override
            public void onResponse(Call call, Response response) throws IOException {
                try (ResponseBody responseBody = response.body()) {
                    String text = responseBody != null ? responseBody.string() : "";
                    if (!response.isSuccessful()) {
                        DiscordApi.ApiError error = DiscordApi.parseError(response.code(), text,
                                response.header("Retry-After"));
                        if (DiscordApi.isMemberAbsent(error)) {
                            future.completeExceptionally(new MemberAbsent(operation));
                            return;
                        }
                        log.warn("Discord API error {} on {}: {}", response.code(), operation, error.message());
                        future.completeExceptionally(DiscordApi.toPlatformException(operation, error));
                        return;
                    }
                    JsonNode json = text.isBlank() ? objectMapper.nullNode() : objectMapper.readTree(text);
                    future.complete(parser.apply(json));
                } catch (RuntimeException | IOException e) {
                    log.error("Discord {} returned an unreadable response", operation, e);
                    future.completeExceptionally(new PlatformException(VoiceErrorCode.PLATFORM_UNAVAILABLE,
                            operation + ": unreadable response", e));
                }
            }
        });
        return future;
    }

    /** The target member is not connected to voice or not in the guild. */
    static final class MemberAbsent extends PlatformException {
        MemberAbsent(String operation) {
            super(VoiceErrorCode.NOT_FOUND, operation + ": member not connected");
        }
    }
}
