package org.calista.neuro.ai.goal;

import org.calista.neuro.ai.state.Need;

import java.util.Objects;
import java.util.Set;

/**
 * Keep {@code need} below {@code threshold} for {@code requiredDuration} consecutive evaluations.
 */
public record MaintainNeedLowGoal(String id,
                                  String name,
                                  double priority,
                                  boolean completed,
                                  String parentId,
                                  Set<String> prerequisites,
                                  Need need,
                                  double threshold,
                                  int requiredDuration,
                                  int currentDuration) implements Goal {

    public MaintainNeedLowGoal {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(need, "need");
        Goal.checkPriority(priority);
        if (!(threshold > 0.0 && threshold <= 1.0)) throw new IllegalArgumentException("threshold must be in (0,1]");
        if (requiredDuration < 1) throw new IllegalArgumentException("requiredDuration must be >= 1");
        if (currentDuration < 0) throw new IllegalArgumentException("currentDuration must be >= 0");
        prerequisites = (prerequisites == null) ? Set.of() : Set.copyOf(prerequisites);
    }

    public static MaintainNeedLowGoal of(String id, String name, double priority,
                                         Need need, double threshold, int requiredDuration) {
        return new MaintainNeedLowGoal(id, name, priority, false, null, Set.of(), need, threshold, requiredDuration, 0);
    }

    @Override
    public GoalKind kind() {
        return GoalKind.MAINTAIN_NEED_LOW;
    }

    @Override
    public MaintainNeedLowGoal withCompleted(boolean c) {
        return new MaintainNeedLowGoal(id, name, priority, c, parentId, prerequisites,
                need, threshold, requiredDuration, currentDuration);
    }

    public MaintainNeedLowGoal withDuration(int d) {
        return new MaintainNeedLowGoal(id, name, priority, completed, parentId, prerequisites,
                need, threshold, requiredDuration, d);
    }
}
