package com.tempvoice.voice.autokick;

import com.tempvoice.common.infra.KeyedMailbox;
import com.tempvoice.voice.model.AutokickEntry;
import com.tempvoice.voice.model.VoiceErrorCode;
import com.tempvoice.voice.model.VoiceResult;
import com.tempvoice.voice.permission.EntitlementPolicy;
import com.tempvoice.voice.platform.GuildDirectory;
import com.tempvoice.voice.platform.GuildMember;
import com.tempvoice.voice.registry.ChannelRegistry;
import com.tempvoice.voice.registry.MailboxKeys;
import com.tempvoice.voice.store.PermissionStore;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Manages owners' autokick lists. Adding a member who is already in the
 * owner's channel triggers an immediate check.
 */
@Slf4j
public class AutokickService {

    private final PermissionStore store;
    private final ChannelRegistry registry;
    private final AutokickWorker worker;
    private final EntitlementPolicy entitlements;
    private final GuildDirectory directory;
    private final KeyedMailbox mailbox;

    public AutokickService(PermissionStore store, ChannelRegistry registry, AutokickWorker worker,
            EntitlementPolicy entitlements, GuildDirectory directory, KeyedMailbox mailbox) {
        this.store = store;
        this.registry = registry;
        this.worker = worker;
        this.entitlements = entitlements;
        this.directory = directory;
        this.mailbox = mailbox;
    }

    public CompletableFuture<VoiceResult<Void>> add(long guildId, long ownerId, long targetId) {
        if (targetId == ownerId) {
            return CompletableFuture.completedFuture(
                    VoiceResult.fail(VoiceErrorCode.INVALID_TARGET, "cannot autokick yourself"));
        }
        GuildMember target = directory.member(guildId, targetId).orElse(null);
        if (target == null) {
            return CompletableFuture.completedFuture(
                    VoiceResult.fail(VoiceErrorCode.INVALID_TARGET, "unknown member " + targetId));
        }
        if (target.bot()) {
            return CompletableFuture.completedFuture(
                    VoiceResult.fail(VoiceErrorCode.INVALID_TARGET, "cannot autokick a bot"));
        }
        return mailbox.submit(MailboxKeys.autokick(guildId, ownerId), () -> {
            if (store.isAutokicked(guildId, ownerId, targetId)) {
                return VoiceResult.<Void>fail(VoiceErrorCode.ALREADY_EXISTS, "already on the autokick list");
            }
            int limit = entitlements.autokickLimit(guildId, ownerId);
            if (store.autokicksOf(guildId, ownerId).size() >= limit) {
                return VoiceResult.<Void>fail(VoiceErrorCode.LIMIT_REACHED, "autokick limit of " + limit + " reached");
            }
            store.addAutokick(guildId, ownerId, targetId);
            log.debug("Owner {} added {} to autokick list in guild {}", ownerId, targetId, guildId);
            registry.channelOwnedBy(guildId, ownerId)
                    .filter(state -> state.hasMember(targetId))
                    .ifPresent(state -> worker.enqueue(state.getId(), targetId));
            return VoiceResult.ok();
        }).exceptionally(AutokickService::storeFailure);
    }

    public CompletableFuture<VoiceResult<Void>> remove(long guildId, long ownerId, long targetId) {
        return mailbox.submit(MailboxKeys.autokick(guildId, ownerId), () -> store.removeAutokick(guildId, ownerId, targetId)
                        ? VoiceResult.ok()
                        : VoiceResult.<Void>fail(VoiceErrorCode.NOT_FOUND, "not on the autokick list"))
                .exceptionally(AutokickService::storeFailure);
    }

    public List<AutokickEntry> list(long guildId, long ownerId) {
        return store.autokicksOf(guildId, ownerId);
    }

    public CompletableFuture<Integer> clear(long guildId, long ownerId) {
        return mailbox.submit(MailboxKeys.autokick(guildId, ownerId), () -> store.clearAutokicks(guildId, ownerId));
    }

    private static VoiceResult<Void> storeFailure(Throwable err) {
        log.error("Autokick list update failed: {}", err.getMessage(), err);
        return VoiceResult.fail(VoiceErrorCode.OPERATION_DEGRADED, "autokick list update failed");
    }
}
