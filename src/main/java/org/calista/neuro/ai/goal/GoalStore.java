package org.calista.neuro.ai.goal;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * GoalStore: append-only реестр целей агента.
 *
 * <ul>
 *   <li>id уникален, цели не удаляются</li>
 *   <li>изменения только через {@link GoalUpdate}</li>
 *   <li>порядок вставки сохраняется</li>
 * </ul>
 */
public final class GoalStore {
    private static final Logger log = LogManager.getLogger(GoalStore.class);

    private final LinkedHashMap<String, Goal> goals = new LinkedHashMap<>();

    public void add(Goal goal) {
        Objects.requireNonNull(goal, "goal");
        if (goals.containsKey(goal.id())) throw new IllegalArgumentException("duplicate goal id: " + goal.id());
        goals.put(goal.id(), goal);
        log.debug("goal added: {} '{}' (priority {})", goal.id(), goal.name(), goal.priority());
    }

    public Optional<Goal> get(String id) {
        return Optional.ofNullable(goals.get(id));
    }

    /** Snapshot in insertion order. */
    public List<Goal> all() {
        return List.copyOf(goals.values());
    }

    public List<Goal> active() {
        ArrayList<Goal> out = new ArrayList<>();
        for (Goal g : goals.values()) if (!g.completed()) out.add(g);
        return List.copyOf(out);
    }

    public boolean hasActive(GoalKind kind) {
        for (Goal g : goals.values()) if (!g.completed() && g.kind() == kind) return true;
        return false;
    }

    public int size() {
        return goals.size();
    }

    /**
     * Applies one update. Updates for unknown ids or of the wrong goal kind are logged and skipped.
     */
    public void apply(GoalUpdate update) {
        Objects.requireNonNull(update, "update");
        Goal g = goals.get(update.goalId());
        if (g == null) {
            log.warn("goal update for unknown id {}: {}", update.goalId(), update);
            return;
        }

        Goal next;
        if (update instanceof GoalUpdate.MarkCompleted) {
            next = g.withCompleted(true);
            if (!g.completed()) log.info("Goal completed: {} '{}'", g.id(), g.name());
        } else if (update instanceof GoalUpdate.SetDuration sd) {
            if (!(g instanceof MaintainNeedLowGoal m)) {
                log.warn("SetDuration on {} goal {}", g.kind(), g.id());
                return;
            }
            next = m.withDuration(sd.duration());
        } else if (update instanceof GoalUpdate.AssignObstacle ao) {
            if (!(g instanceof ClearPathGoal c)) {
                log.warn("AssignObstacle on {} goal {}", g.kind(), g.id());
                return;
            }
            next = c.withObstacle(ao.obstacle());
        } else {
            throw new IllegalStateException("unhandled goal update: " + update);
        }
        goals.put(g.id(), next);
    }

    public void applyAll(List<GoalUpdate> updates) {
        for (GoalUpdate u : Objects.requireNonNull(updates, "updates")) apply(u);
    }
}
