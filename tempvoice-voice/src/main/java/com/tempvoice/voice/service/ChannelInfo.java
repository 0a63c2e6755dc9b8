package com.tempvoice.voice.service;

import com.tempvoice.voice.model.ChannelPhase;

import java.util.List;

/**
 * Snapshot of a live channel for display.
 *
 * @param ownerId    null when the channel is ownerless
 * @param members    in join order
 * @param limit      0 = unlimited
 * @param moderators members holding a moderator grant from the owner
 */
public record ChannelInfo(
        long channelId,
        Long ownerId,
        long categoryId,
        List<Long> members,
        int limit,
        ChannelPhase phase,
        List<Long> moderators) {
}
