package io.meshroute.router.strategy;

/**
 * The closed set of selection algorithms.
 */
public enum StrategyType {
    ROUND_ROBIN,
    WEIGHTED_ROUND_ROBIN,
    LEAST_CONNECTIONS,
    RESPONSE_TIME,
    CONSISTENT_HASH;

    /**
     * Creates a fresh strategy of this type.
     *
     * @param hashReplicas Virtual replicas per instance, used by {@link #CONSISTENT_HASH}
     */
    public LoadBalancingStrategy create(int hashReplicas) {
        return switch (this) {
            case ROUND_ROBIN -> new RoundRobinStrategy();
            case WEIGHTED_ROUND_ROBIN -> new WeightedRoundRobinStrategy();
            case LEAST_CONNECTIONS -> new LeastConnectionsStrategy();
            case RESPONSE_TIME -> new ResponseTimeStrategy();
            case CONSISTENT_HASH -> new ConsistentHashStrategy(hashReplicas);
        };
    }

    /**
     * Parses names like {@code round_robin} or {@code ROUND-ROBIN}.
     */
    public static StrategyType parse(String name) {
        return StrategyType.valueOf(name.trim().toUpperCase().replace('-', '_'));
    }
}
