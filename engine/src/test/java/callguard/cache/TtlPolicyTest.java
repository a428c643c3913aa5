package callguard.cache;

import callguard.core.model.InvalidConfigurationException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TtlPolicyTest {

    private final TtlPolicy policy = TtlPolicy.defaults();

    @Test
    void defaults_firstMatchingRuleWins() {
        assertEquals(Duration.ofSeconds(120), policy.ttlFor("/simple/price"));
        assertEquals(Duration.ofSeconds(180), policy.ttlFor("/coins/markets"));
        assertEquals(Duration.ofSeconds(3600), policy.ttlFor("/coins/bitcoin/ohlc"));
        assertEquals(Duration.ofSeconds(7200), policy.ttlFor("/coins/bitcoin/history"));
        assertEquals(Duration.ofSeconds(600), policy.ttlFor("/coins/bitcoin"));
        assertEquals(Duration.ofSeconds(600), policy.ttlFor("/global"));
    }

    @Test
    void overlappingPatterns_resolveByDeclaredOrder() {
        // "market_chart" does not contain "markets", so its own rule applies
        assertEquals(Duration.ofSeconds(3600), policy.ttlFor("/coins/bitcoin/market_chart"));
        // "prices" contains "price", so the earlier rule decides
        assertEquals(Duration.ofSeconds(120), policy.ttlFor("/index/prices"));
    }

    @Test
    void unmatchedEndpoint_getsDefault() {
        assertEquals(Duration.ofSeconds(300), policy.ttlFor("/exchange_rates"));
        assertEquals(TtlPolicy.DEFAULT_TTL, policy.defaultTtl());
    }

    @Test
    void liveEndpoints_areDetectedByMarker() {
        assertTrue(policy.isLive("/simple/price"));
        assertTrue(policy.isLive("/coins/markets"));
        assertFalse(policy.isLive("/coins/bitcoin/ohlc"));
        assertFalse(policy.isLive("/global"));
    }

    @Test
    void longestTtl_coversRulesAndDefault() {
        assertEquals(Duration.ofSeconds(7200), policy.longestTtl());

        TtlPolicy onlyDefault = new TtlPolicy(List.of(), Duration.ofSeconds(42), List.of(), Duration.ofSeconds(1));
        assertEquals(Duration.ofSeconds(42), onlyDefault.longestTtl());
    }

    @Test
    void customRules_keepDeclaredOrder() {
        TtlPolicy custom = new TtlPolicy(
            List.of(TtlRule.of("ticker", 5), TtlRule.of("tick", 50)),
            Duration.ofSeconds(10),
            List.of("ticker"),
            Duration.ofSeconds(5));

        assertEquals(Duration.ofSeconds(5), custom.ttlFor("/0/public/ticker"));
        assertEquals(Duration.ofSeconds(50), custom.ttlFor("/ticks"));
        assertEquals(Duration.ofSeconds(10), custom.ttlFor("/assets"));
    }

    @Test
    void rulesAreCopied() {
        List<TtlRule> rules = new ArrayList<>(List.of(TtlRule.of("a", 1)));
        TtlPolicy p = new TtlPolicy(rules, Duration.ofSeconds(1), List.of(), Duration.ofSeconds(1));
        rules.add(TtlRule.of("b", 2));

        assertEquals(1, p.rules().size());
        assertThrows(UnsupportedOperationException.class, () -> p.rules().add(TtlRule.of("c", 3)));
    }

    @Test
    void invalidValues_areRejected() {
        assertThrows(InvalidConfigurationException.class, () -> TtlRule.of("", 10));
        assertThrows(InvalidConfigurationException.class, () -> TtlRule.of("x", -1));
        assertThrows(InvalidConfigurationException.class,
            () -> new TtlPolicy(List.of(), Duration.ofSeconds(-1), List.of(), Duration.ofSeconds(60)));
        assertThrows(InvalidConfigurationException.class,
            () -> new TtlPolicy(List.of(), Duration.ofSeconds(1), List.of(), Duration.ZERO));
        assertThrows(InvalidConfigurationException.class,
            () -> new TtlPolicy(List.of(), Duration.ofSeconds(1), List.of(""), Duration.ofSeconds(60)));
        assertThrows(IllegalArgumentException.class,
            () -> new TtlPolicy(null, Duration.ofSeconds(1), List.of(), Duration.ofSeconds(60)));
    }

    @Test
    void bucketWidthBeyondCeiling_isRejected() {
        assertThrows(InvalidConfigurationException.class,
            () -> TtlPolicy.defaults().withLiveBucketWidth(Duration.ofDays(1_000_000)));
        assertDoesNotThrow(() -> TtlPolicy.defaults().withLiveBucketWidth(TtlPolicy.MAX_BUCKET_WIDTH));
    }
}
