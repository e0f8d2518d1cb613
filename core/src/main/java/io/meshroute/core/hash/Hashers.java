package io.meshroute.core.hash;

import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;

/**
 * Stable hash functions for the consistent hash ring.
 * <p>
 * Murmur3 is non-cryptographic but fast and well distributed, which is what
 * ring placement and routing-key lookup need on the hot path.
 * </p>
 */
public final class Hashers {
    private Hashers() {
    }

    /**
     * Computes Murmur3 128-bit hash and returns the lower 64 bits as a long.
     *
     * @param data Input bytes
     * @return 64-bit hash value (signed long)
     */
    public static long murmur3Hash(byte[] data) {
        return Hashing.murmur3_128().hashBytes(data).asLong();
    }

    /**
     * Computes Murmur3 hash of a UTF-8 string.
     *
     * @param str Input string
     * @return 64-bit hash value
     */
    public static long murmur3Hash(String str) {
        return murmur3Hash(str.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Ring position of a virtual replica: {@code hash(instanceId + ":" + replicaIndex)}.
     */
    public static long replicaHash(String instanceId, int replicaIndex) {
        return murmur3Hash(instanceId + ":" + replicaIndex);
    }
}
