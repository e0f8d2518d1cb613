package io.meshroute.router.strategy;

import io.meshroute.core.model.RequestContext;
import io.meshroute.core.model.ServiceInstance;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RoundRobinStrategyTest {

    private final RoundRobinStrategy strategy = new RoundRobinStrategy();

    @Test
    void cyclesThroughCandidatesInOrder() {
        List<ServiceInstance> candidates = List.of(
                new ServiceInstance("a", "localhost", 8001),
                new ServiceInstance("b", "localhost", 8002),
                new ServiceInstance("c", "localhost", 8003));

        List<String> picks = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            picks.add(strategy.select(candidates, RequestContext.EMPTY).orElseThrow().getId());
        }

        assertEquals(List.of("a", "b", "c", "a", "b", "c"), picks);
    }

    @Test
    void emptyCandidatesYieldNothing() {
        assertTrue(strategy.select(Collections.emptyList(), RequestContext.EMPTY).isEmpty());
    }

    @Test
    void shrinkingCandidateListStaysInBounds() {
        List<ServiceInstance> three = List.of(
                new ServiceInstance("a", "localhost", 8001),
                new ServiceInstance("b", "localhost", 8002),
                new ServiceInstance("c", "localhost", 8003));
        strategy.select(three, RequestContext.EMPTY);
        strategy.select(three, RequestContext.EMPTY);

        List<ServiceInstance> one = List.of(three.get(0));
        assertEquals("a", strategy.select(one, RequestContext.EMPTY).orElseThrow().getId());
    }
}
