package com.liquidity.backend.service.engine;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Fixed-capacity ring buffer of indicator values. Appending to a full window evicts the oldest value.
 * Not thread-safe; owned by a single engine.
 */
public class HistoricalWindow {

    private final int capacity;
    private final Deque<Double> values;

    public HistoricalWindow(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.values = new ArrayDeque<>(capacity);
    }

    public void append(double value) {
        if (values.size() == capacity) {
            values.removeFirst();
        }
        values.addLast(value);
    }

    public double[] toArray() {
        return values.stream().mapToDouble(Double::doubleValue).toArray();
    }

    public double latest() {
        Double last = values.peekLast();
        if (last == null) {
            throw new IllegalStateException("window is empty");
        }
        return last;
    }

    public int size() {
        return values.size();
    }

    public int capacity() {
        return capacity;
    }

    public boolean isFull() {
        return values.size() == capacity;
    }
}
