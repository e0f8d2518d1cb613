package io.meshroute.router.redis;

import io.lettuce.core.RedisClient;
import io.lettuce.core.ScriptOutputType;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.reactive.RedisReactiveCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Reactive Redis service for rate limit windows and health/statistics publication.
 * <p>
 * All operations are non-blocking using Lettuce reactive API.
 * Implements IRedisService for dependency inversion.
 * </p>
 */
public class RedisService implements IRedisService {
    private static final Logger log = LoggerFactory.getLogger(RedisService.class);

    /**
     * Sliding window check as one atomic unit.
     * <p>Arguments:
     * <ol>
     *   <li>KEYS[1] - the rate limit key</li>
     *   <li>ARGV[1] - current timestamp in milliseconds</li>
     *   <li>ARGV[2] - window length in milliseconds</li>
     *   <li>ARGV[3] - key TTL in seconds</li>
     *   <li>ARGV[4] - unique member for this request</li>
     * </ol>
     * <p>Returns the number of requests in the window before this one.
     */
    static final String SLIDING_WINDOW_SCRIPT =
            """
            local key = KEYS[1]
            local now_ms = tonumber(ARGV[1])
            local window_ms = tonumber(ARGV[2])
            local ttl = tonumber(ARGV[3])

            redis.call('ZREMRANGEBYSCORE', key, 0, now_ms - window_ms)
            local count = redis.call('ZCARD', key)
            redis.call('ZADD', key, now_ms, ARGV[4])
            redis.call('EXPIRE', key, ttl)

            return count
            """;

    private final RedisClient client;
    private final StatefulRedisConnection<String, String> connection;
    private final RedisReactiveCommands<String, String> commands;

    public RedisService(String redisUrl) {
        this.client = RedisClient.create(redisUrl);
        this.connection = client.connect();
        this.commands = connection.reactive();
        log.info("Connected to Redis: {}", redisUrl);
    }

    @Override
    public Mono<Long> slidingWindowCount(String key, long nowMs, long windowMs, long ttlSeconds, String member) {
        return commands.<Long>eval(SLIDING_WINDOW_SCRIPT, ScriptOutputType.INTEGER, new String[]{key},
                        String.valueOf(nowMs), String.valueOf(windowMs), String.valueOf(ttlSeconds), member)
                .next();
    }

    @Override
    public Mono<Void> setWithTtl(String key, String value, long ttlSeconds) {
        return commands.setex(key, ttlSeconds, value).then();
    }

    @Override
    public void close() {
        connection.close();
        client.shutdown();
        log.info("Redis connection closed");
    }
}
