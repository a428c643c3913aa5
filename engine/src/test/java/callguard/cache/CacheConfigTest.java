package callguard.cache;

import callguard.core.model.InvalidConfigurationException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CacheConfigTest {

    @Test
    void defaults() {
        CacheConfig config = CacheConfig.defaults();

        assertEquals(1000, config.maxSize());
        assertEquals(1, config.stripes());
        assertEquals(Duration.ofDays(7), config.maxTtl());
        assertEquals(TtlPolicy.defaults(), config.policy());
    }

    @Test
    void withStripes_keepsOtherValues() {
        CacheConfig config = CacheConfig.defaults().withStripes(8);

        assertEquals(8, config.stripes());
        assertEquals(1000, config.maxSize());
    }

    @Test
    void stripesMustFitCapacity() {
        assertThrows(InvalidConfigurationException.class, () -> CacheConfig.defaults().withStripes(0));
        assertThrows(InvalidConfigurationException.class,
            () -> CacheConfig.of(4, TtlPolicy.defaults()).withStripes(5));
    }

    @Test
    void policyTtlAboveMaximum_isFatal() {
        TtlPolicy policy = new TtlPolicy(
            List.of(TtlRule.of("history", 3600)), Duration.ofSeconds(60), List.of(), Duration.ofSeconds(60));

        assertThrows(InvalidConfigurationException.class,
            () -> new CacheConfig(10, 1, Duration.ofMinutes(30), policy));
        assertDoesNotThrow(() -> new CacheConfig(10, 1, Duration.ofHours(1), policy));
    }

    @Test
    void invalidValues_areRejected() {
        assertThrows(InvalidConfigurationException.class, () -> CacheConfig.of(0, TtlPolicy.defaults()));
        assertThrows(InvalidConfigurationException.class,
            () -> new CacheConfig(10, 1, Duration.ZERO, TtlPolicy.defaults()));
        assertThrows(IllegalArgumentException.class, () -> CacheConfig.of(10, null));
    }

    @Test
    void maxTtlBeyondLimit_isRejected() {
        assertThrows(InvalidConfigurationException.class,
            () -> new CacheConfig(10, 1, Duration.ofDays(1_000_000), TtlPolicy.defaults()));
        assertDoesNotThrow(() -> new CacheConfig(10, 1, TTLCache.MAX_TTL_LIMIT, TtlPolicy.defaults()));
    }
}
