package org.calista.neuro.ai.learn;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Fixed-capacity ring buffer of transitions. Once full, each push overwrites the oldest entry.
 */
public final class ReplayBuffer {

    private final Transition[] ring;
    private int head; // next write slot
    private int size;

    public ReplayBuffer(int capacity) {
        if (capacity < 1) throw new IllegalArgumentException("capacity must be >= 1");
        this.ring = new Transition[capacity];
    }

    public void push(Transition t) {
        ring[head] = Objects.requireNonNull(t, "transition");
        head = (head + 1) % ring.length;
        if (size < ring.length) size++;
    }

    public int size() {
        return size;
    }

    public int capacity() {
        return ring.length;
    }

    /** {@code i}-th stored transition, 0 = oldest. */
    public Transition get(int i) {
        if (i < 0 || i >= size) throw new IndexOutOfBoundsException("index " + i + ", size " + size);
        int start = (size < ring.length) ? 0 : head;
        return ring[(start + i) % ring.length];
    }

    /**
     * Uniform sample of {@code n} distinct entries. Empty when fewer than {@code n} are stored.
     */
    public List<Transition> sample(int n, Random rnd) {
        Objects.requireNonNull(rnd, "rnd");
        if (n < 1 || size < n) return List.of();

        // partial Fisher-Yates over indices
        int[] idx = new int[size];
        for (int i = 0; i < size; i++) idx[i] = i;
        List<Transition> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            int j = i + rnd.nextInt(size - i);
            int tmp = idx[i];
            idx[i] = idx[j];
            idx[j] = tmp;
            out.add(get(idx[i]));
        }
        return out;
    }

    public void clear() {
        for (int i = 0; i < ring.length; i++) ring[i] = null;
        head = 0;
        size = 0;
    }
}
