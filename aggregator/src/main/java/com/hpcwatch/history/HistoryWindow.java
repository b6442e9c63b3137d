package com.hpcwatch.history;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Bounded newest-first history of one signal for one entity.
 * <p>
 * {@link #push(Object)} adds at the front and evicts the oldest sample once the capacity is
 * exceeded, so {@code size() <= capacity()} always holds. Access is serialized per window.
 *
 * @param <S> sample type
 * @param <M> merged value type
 */
public class HistoryWindow<S, M> {

    private final int capacity;
    private final MergeRule<S, M> rule;
    private final Deque<S> samples;

    public HistoryWindow(int capacity, MergeRule<S, M> rule) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("History capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.rule = Objects.requireNonNull(rule, "rule");
        this.samples = new ArrayDeque<>(capacity + 1);
    }

    public synchronized void push(S sample) {
        samples.addFirst(Objects.requireNonNull(sample, "sample"));
        while (samples.size() > capacity) {
            samples.removeLast();
        }
    }

    public synchronized M merge() {
        return rule.merge(List.copyOf(samples));
    }

    public synchronized List<S> samples() {
        return List.copyOf(samples);
    }

    public synchronized int size() {
        return samples.size();
    }

    public int capacity() {
        return capacity;
    }
}
