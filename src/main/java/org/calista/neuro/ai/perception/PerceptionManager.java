package org.calista.neuro.ai.perception;

import org.calista.neuro.ai.env.Cell;
import org.calista.neuro.ai.env.EnvironmentSnapshot;
import org.calista.neuro.ai.env.GridPos;
import org.calista.neuro.ai.memory.WorkingMemory;
import org.calista.neuro.ai.memory.WorkingMemoryItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * PerceptionManager: зашумлённое восприятие локального окна.
 *
 * <p>Each cell is seen with probability {@code accuracy}; otherwise it reads as
 * {@link Cell#UNKNOWN}. Cells matching the attention focus get {@code focusBoost}
 * on top. Seen resources and obstacles go into working memory.</p>
 */
public final class PerceptionManager {
    private static final Logger log = LoggerFactory.getLogger(PerceptionManager.class);

    private final double accuracy;
    private final Random rnd;

    public PerceptionManager(double accuracy, Random rnd) {
        if (!(accuracy >= 0.0 && accuracy <= 1.0)) throw new IllegalArgumentException("accuracy must be in [0,1]");
        this.accuracy = accuracy;
        this.rnd = Objects.requireNonNull(rnd, "rnd");
    }

    public double accuracy() {
        return accuracy;
    }

    /**
     * @param otherAgents absolute positions of the other agents in the world
     */
    public Perception perceive(EnvironmentSnapshot snap,
                               AttentionFocus focus,
                               double focusBoost,
                               Collection<GridPos> otherAgents,
                               WorkingMemory workingMemory) {
        Objects.requireNonNull(snap, "snap");
        Objects.requireNonNull(focus, "focus");
        Objects.requireNonNull(otherAgents, "otherAgents");
        Objects.requireNonNull(workingMemory, "workingMemory");

        GridPos c = snap.center();
        int r = snap.radius();
        long tick = snap.tick();

        List<GridPos> food = new ArrayList<>();
        List<GridPos> water = new ArrayList<>();
        List<GridPos> obstacles = new ArrayList<>();

        for (int dr = -r; dr <= r; dr++) {
            for (int dc = -r; dc <= r; dc++) {
                Cell cell = snap.cellAtOffset(dr, dc);
                if (cell == Cell.BOUNDARY) continue;
                if (rnd.nextDouble() >= cellAccuracy(cell, focus, focusBoost)) continue;

                GridPos at = GridPos.of(c.x() + dr, c.y() + dc);
                switch (cell) {
                    case FOOD -> {
                        food.add(at);
                        workingMemory.push(new WorkingMemoryItem(WorkingMemoryItem.Kind.PERCEIVED_FOOD, at, tick));
                    }
                    case WATER -> {
                        water.add(at);
                        workingMemory.push(new WorkingMemoryItem(WorkingMemoryItem.Kind.PERCEIVED_WATER, at, tick));
                    }
                    case OBSTACLE -> {
                        obstacles.add(at);
                        workingMemory.push(new WorkingMemoryItem(WorkingMemoryItem.Kind.PERCEIVED_OBSTACLE, at, tick));
                    }
                    default -> {
                        // empty cells carry nothing to remember
                    }
                }
            }
        }

        List<GridPos> agents = new ArrayList<>();
        for (GridPos p : otherAgents) {
            if (p.equals(c) || p.chebyshev(c) > r) continue;
            if (rnd.nextDouble() < accuracy) {
                agents.add(p);
                workingMemory.push(new WorkingMemoryItem(WorkingMemoryItem.Kind.PERCEIVED_AGENT, p, tick));
            }
        }

        Perception out = new Perception(tick, snap.timeOfDay(), snap.weather(),
                snap.foodAvailable(), snap.waterAvailable(), food, water, obstacles, agents);
        if (log.isTraceEnabled()) {
            log.trace("perceive tick={} at {}: food={}, water={}, obstacles={}, agents={}",
                    tick, c, food, water, obstacles, agents);
        }
        return out;
    }

    /** A location target sharpens the whole field of view, other focuses only their own cell kind. */
    private double cellAccuracy(Cell cell, AttentionFocus focus, double focusBoost) {
        boolean focused = focus == AttentionFocus.LOCATION_TARGET
                || (focus == AttentionFocus.FOOD && cell == Cell.FOOD)
                || (focus == AttentionFocus.WATER && cell == Cell.WATER)
                || (focus == AttentionFocus.OBSTACLE && cell == Cell.OBSTACLE);
        return focused ? Math.min(1.0, accuracy + focusBoost) : accuracy;
    }
}
