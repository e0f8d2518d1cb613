package io.meshroute.router.redis;

import reactor.core.publisher.Mono;

/**
 * Interface for shared-store operations (Dependency Inversion Principle).
 * <p>
 * Enables testing with stub implementations and future Redis client swaps.
 * </p>
 */
public interface IRedisService {

    /**
     * Atomically prunes entries older than {@code nowMs - windowMs} from the sorted set,
     * counts what remains, inserts {@code member} scored {@code nowMs} and refreshes
     * the key expiry.
     *
     * @return Mono of the entry count before the insertion
     */
    Mono<Long> slidingWindowCount(String key, long nowMs, long windowMs, long ttlSeconds, String member);

    /**
     * Stores a string value with an expiry.
     */
    Mono<Void> setWithTtl(String key, String value, long ttlSeconds);

    /**
     * Closes Redis connection.
     */
    void close();
}
