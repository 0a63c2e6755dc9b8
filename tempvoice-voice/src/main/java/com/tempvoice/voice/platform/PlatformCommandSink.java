package com.tempvoice.voice.platform;

import com.tempvoice.voice.model.Overwrite;
import com.tempvoice.voice.model.TargetRef;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Commands issued to the chat platform. Futures fail with
 * {@link com.tempvoice.voice.model.PlatformException}.
 */
public interface PlatformCommandSink {

    /**
     * Create a voice channel.
     *
     * @return future with the new channel id
     */
    CompletableFuture<Long> createVoiceChannel(CreateChannelRequest request);

    CompletableFuture<Void> deleteChannel(long guildId, long channelId);

    /** Create or replace the overwrite for one target. */
    CompletableFuture<Void> editOverwrite(long guildId, long channelId, Overwrite overwrite);

    CompletableFuture<Void> removeOverwrite(long guildId, long channelId, TargetRef target);

    /** Disconnect a member from voice. Absent members are not an error. */
    CompletableFuture<Void> disconnectMember(long guildId, long memberId);

    CompletableFuture<Void> moveMember(long guildId, long memberId, long channelId);

    /** @param limit maximum occupants, 0 = unlimited */
    CompletableFuture<Void> setChannelLimit(long guildId, long channelId, int limit);

    CompletableFuture<List<PlatformChannel>> listChannels(long guildId);
}
