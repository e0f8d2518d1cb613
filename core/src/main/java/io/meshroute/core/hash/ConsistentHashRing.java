package io.meshroute.core.hash;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Predicate;

/**
 * Immutable consistent hash ring with virtual replicas.
 * <p>
 * <b>Consistent hashing properties:</b>
 * <ul>
 *   <li>Adding/removing an instance reassigns approximately 1/(n+1) of keys.</li>
 *   <li>Each instance owns {@code replicas} virtual points to smooth the distribution.</li>
 *   <li>Deterministic key → instance mapping for a fixed membership.</li>
 * </ul>
 * </p>
 * <p>
 * Membership changes produce a new ring ({@link #withInstance}, {@link #withoutInstance});
 * callers swap the reference. Safe for concurrent reads.
 * </p>
 */
public final class ConsistentHashRing {
    private static final Logger log = LoggerFactory.getLogger(ConsistentHashRing.class);

    public static final int DEFAULT_REPLICAS = 150;

    private final TreeMap<Long, String> ring; // hash → instanceId
    private final Set<String> members;
    private final int replicas;

    private ConsistentHashRing(TreeMap<Long, String> ring, Set<String> members, int replicas) {
        this.ring = ring;
        this.members = members;
        this.replicas = replicas;
    }

    public static ConsistentHashRing empty(int replicas) {
        if (replicas <= 0) {
            throw new IllegalArgumentException("replicas must be positive: " + replicas);
        }
        return new ConsistentHashRing(new TreeMap<>(), Collections.emptySet(), replicas);
    }

    /**
     * Builds a ring holding the given instance ids.
     *
     * @param instanceIds Instances to place on the ring
     * @param replicas    Virtual replicas per instance
     * @return Immutable ring
     */
    public static ConsistentHashRing fromInstances(Collection<String> instanceIds, int replicas) {
        ConsistentHashRing empty = empty(replicas);
        TreeMap<Long, String> ring = new TreeMap<>();
        Set<String> members = new LinkedHashSet<>();
        for (String id : instanceIds) {
            if (members.add(id)) {
                place(ring, id, replicas);
            }
        }
        if (members.isEmpty()) {
            return empty;
        }
        log.debug("Created ring with {} vnodes from {} instances", ring.size(), members.size());
        return new ConsistentHashRing(ring, Collections.unmodifiableSet(members), replicas);
    }

    public ConsistentHashRing withInstance(String instanceId) {
        if (members.contains(instanceId)) {
            return this;
        }
        TreeMap<Long, String> next = new TreeMap<>(ring);
        place(next, instanceId, replicas);
        Set<String> nextMembers = new LinkedHashSet<>(members);
        nextMembers.add(instanceId);
        return new ConsistentHashRing(next, Collections.unmodifiableSet(nextMembers), replicas);
    }

    public ConsistentHashRing withoutInstance(String instanceId) {
        if (!members.contains(instanceId)) {
            return this;
        }
        TreeMap<Long, String> next = new TreeMap<>(ring);
        next.values().removeIf(instanceId::equals);
        Set<String> nextMembers = new LinkedHashSet<>(members);
        nextMembers.remove(instanceId);
        return new ConsistentHashRing(next, Collections.unmodifiableSet(nextMembers), replicas);
    }

    private static void place(TreeMap<Long, String> ring, String instanceId, int replicas) {
        for (int i = 0; i < replicas; i++) {
            ring.put(Hashers.replicaHash(instanceId, i), instanceId);
        }
    }

    /**
     * Finds the owner of a routing key: the first vnode whose hash is ≥ key hash,
     * wrapping to the smallest entry.
     *
     * @param routingKey Key (userId, sessionId, ...)
     * @return Owning instance id, empty if the ring is empty
     */
    public Optional<String> successor(String routingKey) {
        return successor(routingKey, id -> true);
    }

    /**
     * Walks the ring clockwise from the key's position and returns the first instance
     * accepted by {@code eligible}. Every vnode is visited at most once, so an empty
     * result means the entire ring was exhausted.
     *
     * @param routingKey Key to locate
     * @param eligible   Filter for acceptable instances (e.g. healthy ones)
     * @return First eligible instance id in ring order
     */
    public Optional<String> successor(String routingKey, Predicate<String> eligible) {
        if (ring.isEmpty()) {
            return Optional.empty();
        }
        long hash = Hashers.murmur3Hash(routingKey);
        Set<String> rejected = new LinkedHashSet<>();

        Optional<String> found = scan(ring.tailMap(hash, true), eligible, rejected);
        if (found.isPresent() || rejected.size() == members.size()) {
            return found;
        }
        // Wrap around to the beginning
        return scan(ring.headMap(hash, false), eligible, rejected);
    }

    private Optional<String> scan(NavigableMap<Long, String> segment, Predicate<String> eligible, Set<String> rejected) {
        for (Map.Entry<Long, String> entry : segment.entrySet()) {
            String candidate = entry.getValue();
            if (rejected.contains(candidate)) {
                continue;
            }
            if (eligible.test(candidate)) {
                return Optional.of(candidate);
            }
            rejected.add(candidate);
            if (rejected.size() == members.size()) {
                break;
            }
        }
        return Optional.empty();
    }

    /**
     * Distinct instances in ring order starting at the key's position.
     * Useful for failover candidates.
     */
    public List<String> preferenceList(String routingKey) {
        List<String> result = new ArrayList<>();
        successor(routingKey, id -> {
            if (!result.contains(id)) {
                result.add(id);
            }
            return false;
        });
        return result;
    }

    /**
     * Theoretical fraction of keys that move when one instance joins: ~1/(n+1).
     */
    public double estimateReassignmentOnChange() {
        return 1.0 / (members.size() + 1);
    }

    public boolean contains(String instanceId) {
        return members.contains(instanceId);
    }

    public int getVnodeCount() {
        return ring.size();
    }

    public int getInstanceCount() {
        return members.size();
    }

    public int getReplicas() {
        return replicas;
    }
}
