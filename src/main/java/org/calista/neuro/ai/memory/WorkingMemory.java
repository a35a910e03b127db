package org.calista.neuro.ai.memory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Small ring buffer of recent percepts; pushing into a full buffer drops the oldest item.
 */
public final class WorkingMemory {

    private final WorkingMemoryItem[] ring;
    private int head;
    private int size;

    public WorkingMemory(int capacity) {
        if (capacity < 1) throw new IllegalArgumentException("capacity must be >= 1");
        this.ring = new WorkingMemoryItem[capacity];
    }

    public void push(WorkingMemoryItem item) {
        ring[head] = Objects.requireNonNull(item, "item");
        head = (head + 1) % ring.length;
        if (size < ring.length) size++;
    }

    /** Matching items, newest first. */
    public List<WorkingMemoryItem> recentMatching(Predicate<WorkingMemoryItem> predicate) {
        Objects.requireNonNull(predicate, "predicate");
        ArrayList<WorkingMemoryItem> out = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            WorkingMemoryItem it = ring[Math.floorMod(head - 1 - i, ring.length)];
            if (predicate.test(it)) out.add(it);
        }
        return List.copyOf(out);
    }

    /** All items, newest first. */
    public List<WorkingMemoryItem> snapshot() {
        return recentMatching(it -> true);
    }

    public int size() {
        return size;
    }

    public int capacity() {
        return ring.length;
    }
}
