package org.calista.neuro.ai.goal;

import org.calista.neuro.ai.env.GridPos;

import java.util.Objects;
import java.util.Set;

/**
 * Remove an obstacle. {@code obstacle} stays {@code null} until one is assigned.
 */
public record ClearPathGoal(String id,
                            String name,
                            double priority,
                            boolean completed,
                            String parentId,
                            Set<String> prerequisites,
                            GridPos obstacle) implements Goal {

    public ClearPathGoal {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        Goal.checkPriority(priority);
        prerequisites = (prerequisites == null) ? Set.of() : Set.copyOf(prerequisites);
    }

    public static ClearPathGoal subGoalOf(String id, String name, double priority, String parentId) {
        return new ClearPathGoal(id, name, priority, false, Objects.requireNonNull(parentId, "parentId"), Set.of(), null);
    }

    @Override
    public GoalKind kind() {
        return GoalKind.CLEAR_PATH;
    }

    @Override
    public ClearPathGoal withCompleted(boolean c) {
        return new ClearPathGoal(id, name, priority, c, parentId, prerequisites, obstacle);
    }

    public ClearPathGoal withObstacle(GridPos pos) {
        return new ClearPathGoal(id, name, priority, completed, parentId, prerequisites, pos);
    }
}
