package com.dns.cache.engine;

import com.dns.cache.core.model.RecordType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AddressCache Factory and Config Tests")
class AddressCacheFactoryTest {

    @Nested
    @DisplayName("AddressCache.create")
    class CreateTests {

        @Test
        @DisplayName("Should create an engine for a positive capacity")
        void createsEngine() {
            try (AddressCache cache = AddressCache.create(CacheConfig.ofCapacity(100))) {
                assertInstanceOf(TtlAddressCache.class, cache);
                assertEquals(100, cache.capacity());
            }
        }

        @Test
        @DisplayName("Should create a disabled cache for zero or negative capacity")
        void createsDisabled() {
            assertInstanceOf(NoOpAddressCache.class, AddressCache.create(CacheConfig.disabled()));
            assertInstanceOf(NoOpAddressCache.class, AddressCache.create(CacheConfig.ofCapacity(-5)));
        }
    }

    @Nested
    @DisplayName("NoOpAddressCache")
    class NoOpTests {

        @Test
        @DisplayName("Inserts succeed and every lookup misses")
        void disabledBehavior() {
            NoOpAddressCache cache = new NoOpAddressCache();

            assertEquals(InsertOutcome.DISABLED, cache.insert("a.com", 60, RecordType.A, new byte[]{1, 2, 3, 4}));
            assertTrue(cache.get("a.com", RecordType.A).isEmpty());
            assertEquals(0, cache.invalidateExpired());
            assertEquals(0, cache.size());
            assertEquals(0, cache.getStats().hitCount());
            assertFalse(cache.isClosed());
            assertDoesNotThrow(cache::close);
        }
    }

    @Nested
    @DisplayName("CacheConfig")
    class ConfigTests {

        @Test
        @DisplayName("Defaults should be a 10,000 entry full-scan cache")
        void defaults() {
            CacheConfig config = CacheConfig.defaults();
            assertEquals(10_000, config.capacity());
            assertEquals(10_000, config.maxDetachedEntries());
            assertEquals(SweepMode.FULL_SCAN, config.sweepMode());
            assertTrue(config.isEnabled());
            assertEquals(20_000, config.slotLimit());
        }

        @Test
        @DisplayName("Builder should default detached entries to the capacity")
        void builderDefaults() {
            CacheConfig config = CacheConfig.builder().capacity(50).build();
            assertEquals(50, config.maxDetachedEntries());

            CacheConfig explicit = CacheConfig.builder()
                    .capacity(50)
                    .maxDetachedEntries(5)
                    .sweepMode(SweepMode.STOP_AT_FIRST_FRESH)
                    .build();
            assertEquals(5, explicit.maxDetachedEntries());
            assertEquals(SweepMode.STOP_AT_FIRST_FRESH, explicit.sweepMode());
            assertEquals(55, explicit.slotLimit());
        }

        @Test
        @DisplayName("Should reject invalid values")
        void validation() {
            assertThrows(IllegalArgumentException.class, () -> new CacheConfig(10, 0, SweepMode.FULL_SCAN));
            assertThrows(NullPointerException.class, () -> new CacheConfig(10, 10, null));
        }

        @Test
        @DisplayName("Slot limit should not overflow")
        void slotLimitClamped() {
            CacheConfig config = new CacheConfig(Integer.MAX_VALUE, Integer.MAX_VALUE, SweepMode.FULL_SCAN);
            assertEquals(Integer.MAX_VALUE - 8, config.slotLimit());
        }
    }

    @Nested
    @DisplayName("CacheStats")
    class StatsTests {

        @Test
        @DisplayName("Hit rate should be zero without lookups")
        void emptyHitRate() {
            assertEquals(0.0, new CacheStats(0, 0, 0, 0, 0, 0, 10, 0).hitRate());
        }

        @Test
        @DisplayName("Hit rate should be hits over lookups")
        void hitRate() {
            CacheStats stats = new CacheStats(3, 1, 4, 0, 0, 4, 10, 0);
            assertEquals(0.75, stats.hitRate(), 0.0001);
        }
    }
}
