package org.calista.neuro.ai.memory;

import org.calista.neuro.ai.action.Action;
import org.calista.neuro.ai.state.PhysiologySnapshot;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Bounded FIFO: the oldest episode is dropped once {@code capacity} is reached.
 */
public final class InMemoryEpisodicMemory implements EpisodicMemory {

    private final int capacity;
    private final ArrayDeque<Episode> episodes;

    public InMemoryEpisodicMemory(int capacity) {
        if (capacity < 1) throw new IllegalArgumentException("capacity must be >= 1");
        this.capacity = capacity;
        this.episodes = new ArrayDeque<>(capacity);
    }

    @Override
    public void add(long tick, PhysiologySnapshot state, Action action, double emotionWeight) {
        if (episodes.size() == capacity) episodes.removeFirst();
        episodes.addLast(new Episode(tick, state, action, emotionWeight));
    }

    @Override
    public List<Episode> recent(int window) {
        if (window <= 0 || episodes.isEmpty()) return List.of();
        int n = Math.min(window, episodes.size());
        ArrayList<Episode> out = new ArrayList<>(n);
        Iterator<Episode> it = episodes.descendingIterator();
        while (it.hasNext() && out.size() < n) out.add(it.next());
        Collections.reverse(out);
        return List.copyOf(out);
    }

    @Override
    public int size() {
        return episodes.size();
    }

    public int capacity() {
        return capacity;
    }
}
