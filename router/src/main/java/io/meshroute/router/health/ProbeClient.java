package io.meshroute.router.health;

import io.meshroute.core.model.ServiceInstance;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Liveness probe transport.
 */
public interface ProbeClient {

    /**
     * @return Mono of the HTTP status code answered by the instance; errors on
     * connection failure or timeout
     */
    Mono<Integer> probe(ServiceInstance instance, Duration timeout);
}
