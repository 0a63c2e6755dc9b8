package com.tempvoice.voice.registry;

import com.tempvoice.common.config.TempVoiceConfig;
import com.tempvoice.voice.model.ChannelPhase;
import com.tempvoice.voice.model.VoiceChannelState;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CategoryAllocatorTest {

    private static final long GUILD = 1L;

    private final ChannelRegistry registry = new ChannelRegistry(Duration.ofSeconds(30));
    private final CategoryAllocator allocator = new CategoryAllocator(registry);

    @Test
    void picksLowestLoadRatio() {
        List<TempVoiceConfig.CategoryConfig> categories = List.of(category(20, 2), category(21, 10));
        register(500, 20);

        // 20 is at 1/2, 21 at 0/10
        assertEquals(Optional.of(21L), allocator.reserve(GUILD, categories));
    }

    @Test
    void tieGoesToEarlierCategory() {
        List<TempVoiceConfig.CategoryConfig> categories = List.of(category(20, 4), category(21, 4));

        assertEquals(Optional.of(20L), allocator.reserve(GUILD, categories));
        assertEquals(Optional.of(21L), allocator.reserve(GUILD, categories));
        assertEquals(Optional.of(20L), allocator.reserve(GUILD, categories));
    }

    @Test
    void reservationsCountUntilReleased() {
        List<TempVoiceConfig.CategoryConfig> categories = List.of(category(20, 1));

        assertEquals(Optional.of(20L), allocator.reserve(GUILD, categories));
        assertTrue(allocator.reserve(GUILD, categories).isEmpty());

        allocator.release(GUILD, 20);
        assertEquals(Optional.of(20L), allocator.reserve(GUILD, categories));
    }

    @Test
    void fullPoolIsRejected() {
        List<TempVoiceConfig.CategoryConfig> categories = List.of(category(20, 1), category(21, 1));
        register(500, 20);
        register(501, 21);

        assertTrue(allocator.reserve(GUILD, categories).isEmpty());
    }

    @Test
    void commitTurnsReservationIntoLiveChannel() {
        List<TempVoiceConfig.CategoryConfig> categories = List.of(category(20, 2));
        allocator.reserve(GUILD, categories);
        assertEquals(1, allocator.load(GUILD, 20));

        allocator.commit(GUILD, 20, () -> register(500, 20));

        assertEquals(1, allocator.load(GUILD, 20));
        assertEquals(1, registry.liveInCategory(GUILD, 20));
    }

    @Test
    void destroyedChannelsFreeTheirSlot() {
        List<TempVoiceConfig.CategoryConfig> categories = List.of(category(20, 1));
        VoiceChannelState state = register(500, 20);
        assertTrue(allocator.reserve(GUILD, categories).isEmpty());

        state.setPhase(ChannelPhase.DESTROYED);

        assertEquals(Optional.of(20L), allocator.reserve(GUILD, categories));
    }

    @Test
    void unknownCategoryIdsResolveToDefaults() {
        TempVoiceConfig.GuildConfig guild = new TempVoiceConfig.GuildConfig();
        guild.setCategories(List.of(category(20, 3)));

        List<TempVoiceConfig.CategoryConfig> resolved = CategoryAllocator.resolve(guild, List.of(20L, 77L));

        assertEquals(3, resolved.get(0).getCapacity());
        assertEquals(77L, resolved.get(1).getId());
        assertEquals(50, resolved.get(1).getCapacity());
    }

    private VoiceChannelState register(long channelId, long categoryId) {
        VoiceChannelState state = new VoiceChannelState(channelId, GUILD, channelId + 1000, categoryId, 10L,
                Instant.now(), 0);
        registry.register(state);
        return state;
    }

    private static TempVoiceConfig.CategoryConfig category(long id, int capacity) {
        TempVoiceConfig.CategoryConfig category = new TempVoiceConfig.CategoryConfig();
        category.setId(id);
        category.setCapacity(capacity);
        return category;
    }
}
