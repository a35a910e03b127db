package org.calista.neuro.ai.goal;

import org.calista.neuro.ai.env.GridPos;

import java.util.Objects;
import java.util.Set;

/** Go and look at a cell; completes on arrival. */
public record ExploreAreaGoal(String id,
                              String name,
                              double priority,
                              boolean completed,
                              String parentId,
                              Set<String> prerequisites,
                              GridPos target) implements Goal {

    public ExploreAreaGoal {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(target, "target");
        Goal.checkPriority(priority);
        prerequisites = (prerequisites == null) ? Set.of() : Set.copyOf(prerequisites);
    }

    public static ExploreAreaGoal of(String id, double priority, GridPos target) {
        return new ExploreAreaGoal(id, "Explore Area " + target, priority, false, null, Set.of(), target);
    }

    @Override
    public GoalKind kind() {
        return GoalKind.EXPLORE_AREA;
    }

    @Override
    public ExploreAreaGoal withCompleted(boolean c) {
        return new ExploreAreaGoal(id, name, priority, c, parentId, prerequisites, target);
    }
}
