package io.meshroute.core.redis;

/**
 * Redis keyspace shared by router processes.
 * <p>
 * <b>Key design principles:</b>
 * <ul>
 *   <li>Namespace prefixes avoid collisions (rate_limit:, instance_health:, router:)</li>
 *   <li>Every key carries a TTL so abandoned subjects and removed instances expire</li>
 * </ul>
 * </p>
 */
public final class Keys {
    private Keys() {
    }

    /**
     * Sliding window of request timestamps: {@code rate_limit:{subjectKey}:{windowSeconds}}
     * <p>
     * <b>Type:</b> Sorted set (score = request time in epoch millis)
     * <br>
     * <b>TTL:</b> windowSeconds + 1, refreshed on every check.
     * </p>
     *
     * @param subjectKey    Subject the rule is counted against (e.g. {@code ip:10.0.0.1})
     * @param windowSeconds Rule window
     * @return Redis key
     */
    public static String rateLimit(String subjectKey, int windowSeconds) {
        return "rate_limit:" + subjectKey + ":" + windowSeconds;
    }

    /**
     * Last probe result of an instance: {@code instance_health:{instanceId}}
     * <p>
     * <b>Type:</b> String (JSON health check result)
     * <br>
     * <b>TTL:</b> probe interval + 1 second; a missing key means the instance was not probed recently.
     * </p>
     *
     * @param instanceId Instance identifier
     * @return Redis key
     */
    public static String instanceHealth(String instanceId) {
        return "instance_health:" + instanceId;
    }

    /**
     * Router statistics snapshot, JSON, 5 minute TTL.
     */
    public static String routerStats() {
        return "router:stats";
    }
}
