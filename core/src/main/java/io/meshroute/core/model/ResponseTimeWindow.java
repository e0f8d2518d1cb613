package io.meshroute.core.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded window of recent response times (seconds), most recent first.
 * <p>
 * When full, recording a sample evicts the oldest one. All access is
 * synchronized; the window is updated from concurrent request completions.
 * </p>
 */
public final class ResponseTimeWindow {
    public static final int DEFAULT_CAPACITY = 100;

    private final int capacity;
    private final Deque<Double> samples;
    private double sum;

    public ResponseTimeWindow() {
        this(DEFAULT_CAPACITY);
    }

    public ResponseTimeWindow(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.samples = new ArrayDeque<>(capacity);
    }

    public synchronized void record(double responseTimeSeconds) {
        if (samples.size() == capacity) {
            sum -= samples.removeLast();
        }
        samples.addFirst(responseTimeSeconds);
        sum += responseTimeSeconds;
    }

    /**
     * @return mean of the retained samples, or 0.0 when empty
     */
    public synchronized double average() {
        return samples.isEmpty() ? 0.0 : sum / samples.size();
    }

    public synchronized int size() {
        return samples.size();
    }

    public synchronized boolean isEmpty() {
        return samples.isEmpty();
    }

    /**
     * @return copy of the samples, most recent first
     */
    public synchronized List<Double> snapshot() {
        return new ArrayList<>(samples);
    }

    public int capacity() {
        return capacity;
    }
}
