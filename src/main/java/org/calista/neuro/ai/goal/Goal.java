package org.calista.neuro.ai.goal;

import java.util.Set;

/**
 * Goal: иммутабельная запись цели; изменения идут через {@link GoalStore#apply(GoalUpdate)}.
 *
 * <p>Goals are never removed, only marked completed.
 * {@code parentId} is {@code null} for top-level goals.</p>
 */
public sealed interface Goal permits ReachLocationGoal, MaintainNeedLowGoal, ClearPathGoal, ExploreAreaGoal {

    String id();

    String name();

    double priority();

    boolean completed();

    String parentId();

    Set<String> prerequisites();

    GoalKind kind();

    Goal withCompleted(boolean completed);

    static double checkPriority(double p) {
        if (!(p >= 0.0 && p <= 1.0)) throw new IllegalArgumentException("priority must be in [0,1], got " + p);
        return p;
    }
}
