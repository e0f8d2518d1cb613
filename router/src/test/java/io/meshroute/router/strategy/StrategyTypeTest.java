package io.meshroute.router.strategy;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

class StrategyTypeTest {

    @Test
    void everyTypeCreatesMatchingStrategy() {
        for (StrategyType type : StrategyType.values()) {
            assertEquals(type, type.create(50).type());
        }
    }

    @Test
    void consistentHashUsesConfiguredReplicas() {
        LoadBalancingStrategy strategy = StrategyType.CONSISTENT_HASH.create(50);

        ConsistentHashStrategy hash = assertInstanceOf(ConsistentHashStrategy.class, strategy);
        assertEquals(50, hash.getRing().getReplicas());
    }

    @Test
    void parsesLenientNames() {
        assertEquals(StrategyType.WEIGHTED_ROUND_ROBIN, StrategyType.parse(" weighted-round-robin "));
        assertEquals(StrategyType.LEAST_CONNECTIONS, StrategyType.parse("least_connections"));
        assertThrows(IllegalArgumentException.class, () -> StrategyType.parse("random"));
    }
}
