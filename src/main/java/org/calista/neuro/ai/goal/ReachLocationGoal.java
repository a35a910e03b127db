package org.calista.neuro.ai.goal;

import org.calista.neuro.ai.env.GridPos;

import java.util.Objects;
import java.util.Set;

public record ReachLocationGoal(String id,
                                String name,
                                double priority,
                                boolean completed,
                                String parentId,
                                Set<String> prerequisites,
                                GridPos target) implements Goal {

    public ReachLocationGoal {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(target, "target");
        Goal.checkPriority(priority);
        prerequisites = (prerequisites == null) ? Set.of() : Set.copyOf(prerequisites);
    }

    public static ReachLocationGoal of(String id, String name, double priority, GridPos target) {
        return new ReachLocationGoal(id, name, priority, false, null, Set.of(), target);
    }

    @Override
    public GoalKind kind() {
        return GoalKind.REACH_LOCATION;
    }

    @Override
    public ReachLocationGoal withCompleted(boolean c) {
        return new ReachLocationGoal(id, name, priority, c, parentId, prerequisites, target);
    }
}
