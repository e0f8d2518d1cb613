package io.meshroute.router.registry;

import io.meshroute.core.model.ServiceInstance;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ServiceRegistryTest {

    private ServiceRegistry registry;
    private List<String> events;

    @BeforeEach
    void setUp() {
        registry = new ServiceRegistry();
        events = new ArrayList<>();
        registry.addListener(new RegistryListener() {
            @Override
            public void onRegistered(ServiceInstance instance) {
                events.add("+" + instance.getId());
            }

            @Override
            public void onDeregistered(ServiceInstance instance) {
                events.add("-" + instance.getId());
            }
        });
    }

    @Test
    void registerAndDeregisterNotifyListeners() {
        registry.register(new ServiceInstance("a", "localhost", 8001));
        registry.register(new ServiceInstance("b", "localhost", 8002));

        assertEquals(2, registry.size());
        assertTrue(registry.deregister("a").isPresent());
        assertTrue(registry.deregister("a").isEmpty());

        assertEquals(List.of("+a", "+b", "-a"), events);
        assertEquals(1, registry.size());
    }

    @Test
    void reRegistrationReplacesInstance() {
        registry.register(new ServiceInstance("a", "localhost", 8001));
        ServiceInstance replacement = new ServiceInstance("a", "otherhost", 9001);

        registry.register(replacement);

        assertEquals(1, registry.size());
        assertSame(replacement, registry.get("a").orElseThrow());
        assertEquals(List.of("+a", "-a", "+a"), events);
    }

    @Test
    void listHealthyFiltersUnhealthyInstances() {
        ServiceInstance healthy = new ServiceInstance("healthy", "localhost", 8001);
        ServiceInstance lowScore = new ServiceInstance("low", "localhost", 8002);
        lowScore.setHealthScore(0.5);
        ServiceInstance erroring = new ServiceInstance("erroring", "localhost", 8003);
        erroring.addErrors(10);
        registry.register(healthy);
        registry.register(lowScore);
        registry.register(erroring);

        assertEquals(List.of(healthy), registry.listHealthy());
        assertEquals(1, registry.healthyCount());
        assertEquals(3, registry.listAll().size());
    }

    @Test
    void clearDeregistersEverything() {
        registry.register(new ServiceInstance("a", "localhost", 8001));
        registry.register(new ServiceInstance("b", "localhost", 8002));

        registry.clear();

        assertEquals(0, registry.size());
        assertEquals(4, events.size());
    }
}
