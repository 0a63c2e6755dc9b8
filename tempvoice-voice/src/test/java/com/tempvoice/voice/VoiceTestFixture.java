package com.tempvoice.voice;

import com.tempvoice.common.config.TempVoiceConfig;
import com.tempvoice.voice.model.VoiceChannelState;
import com.tempvoice.voice.permission.ConfigEntitlementPolicy;
import com.tempvoice.voice.platform.PlatformEvent;
import com.tempvoice.voice.store.SqlitePermissionStore;

import java.sql.SQLException;
import java.time.Clock;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.fail;

/**
 * A voice subsystem over an in-memory store and a recording platform, with
 * one guild: a trigger feeding two categories of capacity 2.
 */
public class VoiceTestFixture implements AutoCloseable {

    public static final long GUILD = 1L;
    public static final long TRIGGER = 10L;
    public static final long CATEGORY_A = 20L;
    public static final long CATEGORY_B = 21L;
    public static final long AFK = 99L;

    public final TempVoiceConfig config;
    public final SqlitePermissionStore store;
    public final RecordingCommandSink sink = new RecordingCommandSink();
    public final RecordingNotifier notifier = new RecordingNotifier();
    public final VoiceSubsystem voice;

    public VoiceTestFixture() {
        this(cfg -> {
        }, Clock.systemUTC());
    }

    public VoiceTestFixture(Consumer<TempVoiceConfig> customizer) {
        this(customizer, Clock.systemUTC());
    }

    public VoiceTestFixture(Consumer<TempVoiceConfig> customizer, Clock clock) {
        this.config = defaultConfig();
        customizer.accept(config);
        try {
            this.store = new SqlitePermissionStore(":memory:", clock);
        } catch (SQLException e) {
            throw new IllegalStateException(e);
        }
        this.voice = new VoiceSubsystem(() -> config, store, sink, notifier, new ConfigEntitlementPolicy(() -> config),
                clock);
    }

    public static TempVoiceConfig defaultConfig() {
        TempVoiceConfig.VoiceConfig voice = new TempVoiceConfig.VoiceConfig();
        voice.setGraceWindowMs(300);
        voice.setCommandTimeoutMs(2_000);
        voice.setCommandSpacingMs(0);
        voice.setRetryAttempts(2);
        voice.setRetryMinDelayMs(10);
        voice.setRetryMaxDelayMs(50);
        voice.setRetryJitter(0);

        TempVoiceConfig.TriggerConfig trigger = new TempVoiceConfig.TriggerConfig();
        trigger.setChannelId(TRIGGER);
        trigger.setCategoryIds(List.of(CATEGORY_A, CATEGORY_B));
        trigger.setNameFormat("{name}'s room");

        TempVoiceConfig.CategoryConfig a = new TempVoiceConfig.CategoryConfig();
        a.setId(CATEGORY_A);
        a.setCapacity(2);
        TempVoiceConfig.CategoryConfig b = new TempVoiceConfig.CategoryConfig();
        b.setId(CATEGORY_B);
        b.setCapacity(2);

        TempVoiceConfig.GuildConfig guild = new TempVoiceConfig.GuildConfig();
        guild.setGuildId(GUILD);
        guild.setAfkChannelId(AFK);
        guild.setTriggers(List.of(trigger));
        guild.setCategories(List.of(a, b));

        TempVoiceConfig config = new TempVoiceConfig();
        config.setVoice(voice);
        config.setGuilds(List.of(guild));
        return config;
    }

    public TempVoiceConfig.GuildConfig guild() {
        return config.findGuild(GUILD).orElseThrow();
    }

    // ── Events ──────────────────────────────────────────────────────────

    /** Make a member known to the guild, with roles. */
    public void member(long memberId, Long... roles) {
        join(voice.handle(new PlatformEvent.MemberUpdated(GUILD, memberId, Set.of(roles), "user" + memberId, false)));
    }

    public void bot(long memberId) {
        join(voice.handle(new PlatformEvent.MemberUpdated(GUILD, memberId, Set.of(), "bot" + memberId, true)));
    }

    /** Deliver a voice state change and wait for its processing. */
    public void move(long memberId, Long from, Long to) {
        join(voice.handle(new PlatformEvent.MemberVoiceStateChanged(GUILD, memberId, from, to, false)));
    }

    /**
     * Join the trigger, then follow the platform's move into the new channel.
     *
     * @return the created channel id
     */
    public long createChannel(long ownerId) {
        move(ownerId, null, TRIGGER);
        long channelId = voice.getRegistry().channelOwnedBy(GUILD, ownerId)
                .orElseThrow(() -> new AssertionError("no channel created for " + ownerId))
                .getId();
        move(ownerId, TRIGGER, channelId);
        return channelId;
    }

    public VoiceChannelState state(long channelId) {
        return voice.getRegistry().get(channelId)
                .orElseThrow(() -> new AssertionError("channel " + channelId + " not registered"));
    }

    // ── Waiting ─────────────────────────────────────────────────────────

    public static <T> T join(CompletableFuture<T> future) {
        try {
            return future.get(5, TimeUnit.SECONDS);
        } catch (Exception e) {
            throw new AssertionError("future did not complete", e);
        }
    }

    public static void await(BooleanSupplier condition, String description) {
        long deadline = System.currentTimeMillis() + 5_000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("timed out waiting for " + description);
            }
            sleep(10);
        }
    }

    public static void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AssertionError(e);
        }
    }

    @Override
    public void close() {
        voice.close();
        store.close();
    }
}
