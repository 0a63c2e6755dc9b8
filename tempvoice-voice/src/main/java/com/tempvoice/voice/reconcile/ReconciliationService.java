package com.tempvoice.voice.reconcile;

import com.tempvoice.common.config.TempVoiceConfig;
import com.tempvoice.voice.lifecycle.ChannelLifecycleManager;
import com.tempvoice.voice.model.PlatformException;
import com.tempvoice.voice.model.VoiceChannelState;
import com.tempvoice.voice.permission.PermissionEngine;
import com.tempvoice.voice.platform.GuildDirectory;
import com.tempvoice.voice.platform.GuildMember;
import com.tempvoice.voice.platform.PlatformChannel;
import com.tempvoice.voice.platform.PlatformCommandSink;
import com.tempvoice.voice.registry.ChannelRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Periodic repair of drift between the registry, the platform and the member
 * cache, for events that were missed or commands that failed.
 * <p>
 * Per guild: registry entries without a platform channel are evicted;
 * untracked channels in managed categories are deleted when empty or adopted
 * as ownerless when occupied; registry membership is synced with who is
 * actually connected; every live channel's overwrites are re-applied, which is
 * a no-op when nothing drifted. Blocks the calling maintenance thread.
 */
@Slf4j
public class ReconciliationService {

    private final Supplier<TempVoiceConfig> config;
    private final ChannelRegistry registry;
    private final GuildDirectory directory;
    private final PlatformCommandSink sink;
    private final ChannelLifecycleManager lifecycle;
    private final PermissionEngine engine;
    private final Clock clock;

    public ReconciliationService(Supplier<TempVoiceConfig> config, ChannelRegistry registry,
            GuildDirectory directory, PlatformCommandSink sink, ChannelLifecycleManager lifecycle,
            PermissionEngine engine, Clock clock) {
        this.config = config;
        this.registry = registry;
        this.directory = directory;
        this.sink = sink;
        this.lifecycle = lifecycle;
        this.engine = engine;
        this.clock = clock;
    }

    public ReconcileReport reconcileAll() {
        ReconcileReport total = ReconcileReport.EMPTY;
        for (TempVoiceConfig.GuildConfig guild : config.get().getGuilds()) {
            total = total.plus(reconcileGuild(guild));
        }
        if (!total.isClean()) {
            log.info("Reconciliation repaired drift: {}", total);
        }
        return total;
    }

    public ReconcileReport reconcileGuild(TempVoiceConfig.GuildConfig guild) {
        long guildId = guild.getGuildId();
        long timeoutMs = config.get().getVoice().getCommandTimeoutMs() * 3;
        Instant listedAt = clock.instant();
        List<PlatformChannel> channels;
        try {
            channels = sink.listChannels(guildId).get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new ReconcileReport(0, 0, 0, 0, 0, 1);
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Reconciliation of guild {} skipped, listing channels failed: {}", guildId,
                    PlatformException.from(e).getMessage());
            return new ReconcileReport(0, 0, 0, 0, 0, 1);
        }

        Set<Long> platformIds = new HashSet<>();
        for (PlatformChannel channel : channels) {
            platformIds.add(channel.id());
        }
        Set<Long> triggers = new HashSet<>();
        Set<Long> managedCategories = new HashSet<>();
        for (TempVoiceConfig.TriggerConfig trigger : guild.getTriggers()) {
            triggers.add(trigger.getChannelId());
            managedCategories.addAll(trigger.getCategoryIds());
        }
        for (TempVoiceConfig.CategoryConfig category : guild.getCategories()) {
            managedCategories.add(category.getId());
        }

        List<CompletableFuture<?>> work = new ArrayList<>();
        int evicted = 0;
        int deleted = 0;
        int adopted = 0;
        int joined = 0;
        int left = 0;

        // Channels registered after the listing started cannot be in it
        boolean creating = registry.hasPending(guildId);
        for (VoiceChannelState state : registry.channelsInGuild(guildId)) {
            if (creating || !state.getCreatedAt().isBefore(listedAt)) {
                continue;
            }
            if (!platformIds.contains(state.getId())) {
                log.info("Channel {} missing on the platform, evicting", state.getId());
                work.add(lifecycle.onChannelDeleted(state.getId()));
                evicted++;
            }
        }

        // A channel created moments ago may not be registered yet
        if (!creating) {
            for (PlatformChannel channel : channels) {
                if (!channel.voice() || channel.parentId() == null
                        || !managedCategories.contains(channel.parentId())
                        || triggers.contains(channel.id()) || registry.contains(channel.id())) {
                    continue;
                }
                List<Long> occupants = occupants(guildId, channel.id());
                if (occupants.isEmpty()) {
                    log.info("Deleting empty untracked channel {} in guild {}", channel.id(), guildId);
                    work.add(sink.deleteChannel(guildId, channel.id()));
                    deleted++;
                } else {
                    work.add(lifecycle.adopt(guildId, channel.id(), channel.parentId(), occupants));
                    adopted++;
                }
            }
        }

        for (VoiceChannelState state : registry.channelsInGuild(guildId)) {
            if (!state.isLive() || !platformIds.contains(state.getId())) {
                continue;
            }
            Set<Long> actual = new HashSet<>(occupants(guildId, state.getId()));
            for (Long member : actual) {
                if (!state.hasMember(member)) {
                    work.add(lifecycle.onMemberJoinExistingChannel(state.getId(), member));
                    joined++;
                }
            }
            for (Long member : state.getMembers()) {
                if (!actual.contains(member)) {
                    work.add(lifecycle.onMemberLeave(state.getId(), member));
                    left++;
                }
            }
            work.add(engine.reapplyChannel(state.getId()));
        }

        int failures = 0;
        try {
            CompletableFuture.allOf(work.toArray(new CompletableFuture[0])).get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failures++;
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Reconciliation of guild {} incomplete: {}", guildId, PlatformException.from(e).getMessage());
            failures++;
        }
        return new ReconcileReport(evicted, deleted, adopted, joined, left, failures);
    }

    private List<Long> occupants(long guildId, long channelId) {
        return directory.membersInChannel(guildId, channelId).stream()
                .filter(member -> !member.bot())
                .map(GuildMember::memberId)
                .toList();
    }
}
