package com.tempvoice.voice.registry;

import com.tempvoice.common.config.TempVoiceConfig;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Picks the least-loaded category for a new channel. Load is live channels
 * plus reservations not yet acknowledged; a category at its capacity is never
 * chosen. Ties go to the earlier category in the trigger's list.
 */
@Slf4j
public class CategoryAllocator {

    private final ChannelRegistry registry;
    private final Map<Long, Map<Long, Integer>> reservations = new HashMap<>();

    public CategoryAllocator(ChannelRegistry registry) {
        this.registry = registry;
    }

    /**
     * Reserve a slot in one of the given categories.
     *
     * @param categories candidate categories in preference order
     * @return chosen category id, empty when every category is full
     */
    public synchronized Optional<Long> reserve(long guildId, List<TempVoiceConfig.CategoryConfig> categories) {
        Long best = null;
        double bestLoad = Double.MAX_VALUE;
        for (TempVoiceConfig.CategoryConfig category : categories) {
            int used = load(guildId, category.getId());
            if (used >= category.getCapacity()) {
                continue;
            }
            double ratio = (double) used / category.getCapacity();
            if (ratio < bestLoad) {
                bestLoad = ratio;
                best = category.getId();
            }
        }
        if (best == null) {
            log.debug("All {} categories full in guild {}", categories.size(), guildId);
            return Optional.empty();
        }
        reservations.computeIfAbsent(guildId, g -> new HashMap<>()).merge(best, 1, Integer::sum);
        return Optional.of(best);
    }

    /** Give back a reservation after the channel was registered or the creation failed. */
    public synchronized void release(long guildId, long categoryId) {
        Map<Long, Integer> guild = reservations.get(guildId);
        if (guild == null) {
            return;
        }
        guild.computeIfPresent(categoryId, (id, n) -> n > 1 ? n - 1 : null);
        if (guild.isEmpty()) {
            reservations.remove(guildId);
        }
    }

    /**
     * Register the channel and release the reservation in one step, so the slot
     * is never counted twice or not at all.
     */
    public synchronized void commit(long guildId, long categoryId, Runnable registration) {
        registration.run();
        release(guildId, categoryId);
    }

    public synchronized int load(long guildId, long categoryId) {
        Map<Long, Integer> guild = reservations.get(guildId);
        int reserved = guild != null ? guild.getOrDefault(categoryId, 0) : 0;
        return registry.liveInCategory(guildId, categoryId) + reserved;
    }

    /**
     * Resolve a trigger's category ids against the guild configuration. Ids
     * without a configured entry get default settings.
     */
    public static List<TempVoiceConfig.CategoryConfig> resolve(TempVoiceConfig.GuildConfig guild,
            List<Long> categoryIds) {
        return categoryIds.stream()
                .map(id -> guild.findCategory(id).orElseGet(() -> {
                    TempVoiceConfig.CategoryConfig defaults = new TempVoiceConfig.CategoryConfig();
                    defaults.setId(id);
                    return defaults;
                }))
                .toList();
    }
}
