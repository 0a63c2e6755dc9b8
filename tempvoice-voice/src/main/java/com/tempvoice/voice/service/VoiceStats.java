package com.tempvoice.voice.service;

/**
 * Counters and gauges of the running subsystem, for administrators.
 *
 * @param voiceStateUpdates every voice state event, including mute and deafen changes
 * @param failedEvents      events whose handling failed
 * @param busyKeys          serial contexts with queued or running work
 */
public record VoiceStats(
        long voiceStateUpdates,
        long joins,
        long switches,
        long leaves,
        long failedEvents,
        long channelsCreated,
        long channelsDeleted,
        int liveChannels,
        int pendingCreations,
        long autokickChecks,
        long autokickEvictions,
        int busyKeys) {
}
