package org.calista.neuro.ai.goal;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.neuro.ai.env.Cell;
import org.calista.neuro.ai.env.GridPos;
import org.calista.neuro.ai.state.Need;
import org.calista.neuro.ai.state.PhysiologySnapshot;

import java.util.Objects;
import java.util.Random;
import java.util.function.Function;

/**
 * Proposes new goals from the agent's state, at most once per cooldown window.
 *
 * <ul>
 *   <li>hunger above the trigger and no open hunger goal: "Satisfy Hunger"</li>
 *   <li>high curiosity and no open location/explore goal: explore a random cell</li>
 *   <li>an assigned clear-path obstacle has disappeared: close that goal</li>
 * </ul>
 */
public final class GoalGenerator {
    private static final Logger log = LogManager.getLogger(GoalGenerator.class);

    private final int cooldown;
    private final int gridSize;
    private final double hungerTrigger;
    private final double curiosityTrigger;
    private final Random rnd;

    private long lastRun = Long.MIN_VALUE;

    public GoalGenerator(int cooldown, int gridSize, double hungerTrigger, double curiosityTrigger, Random rnd) {
        if (cooldown < 0) throw new IllegalArgumentException("cooldown must be >= 0");
        if (gridSize < 1) throw new IllegalArgumentException("gridSize must be >= 1");
        this.cooldown = cooldown;
        this.gridSize = gridSize;
        this.hungerTrigger = hungerTrigger;
        this.curiosityTrigger = curiosityTrigger;
        this.rnd = Objects.requireNonNull(rnd, "rnd");
    }

    /**
     * @param probe world lookup used to check assigned obstacles
     * @return number of goals added or closed
     */
    public int generate(long tick, GoalStore store, PhysiologySnapshot body, double curiosity,
                        Function<GridPos, Cell> probe) {
        Objects.requireNonNull(store, "store");
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(probe, "probe");

        if (lastRun != Long.MIN_VALUE && tick - lastRun < cooldown) return 0;
        lastRun = tick;

        int changes = 0;

        if (body.hunger() > hungerTrigger && !hasActiveNeedGoal(store, Need.HUNGER)) {
            store.add(MaintainNeedLowGoal.of("goal_seek_food_" + tick, "Satisfy Hunger", 0.75, Need.HUNGER, 0.3, 5));
            changes++;
        }

        if (curiosity > curiosityTrigger
                && !store.hasActive(GoalKind.REACH_LOCATION)
                && !store.hasActive(GoalKind.EXPLORE_AREA)) {
            GridPos target = GridPos.of(rnd.nextInt(gridSize), rnd.nextInt(gridSize));
            store.add(ExploreAreaGoal.of("goal_explore_" + tick, 0.3, target));
            changes++;
        }

        for (Goal g : store.active()) {
            if (!(g instanceof ClearPathGoal c) || c.obstacle() == null) continue;
            if (probe.apply(c.obstacle()) != Cell.OBSTACLE) {
                store.apply(new GoalUpdate.MarkCompleted(c.id()));
                changes++;
            }
        }

        if (changes > 0) log.debug("goal generator at tick {}: {} change(s)", tick, changes);
        return changes;
    }

    private static boolean hasActiveNeedGoal(GoalStore store, Need need) {
        for (Goal g : store.active()) {
            if (g instanceof MaintainNeedLowGoal m && m.need() == need) return true;
        }
        return false;
    }
}
