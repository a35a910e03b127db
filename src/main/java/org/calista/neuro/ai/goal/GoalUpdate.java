package org.calista.neuro.ai.goal;

import org.calista.neuro.ai.env.GridPos;

import java.util.Objects;

/**
 * Goal bookkeeping requested by the decision logic and applied by the agent.
 */
public sealed interface GoalUpdate permits GoalUpdate.MarkCompleted, GoalUpdate.SetDuration, GoalUpdate.AssignObstacle {

    String goalId();

    record MarkCompleted(String goalId) implements GoalUpdate {
        public MarkCompleted {
            Objects.requireNonNull(goalId, "goalId");
        }
    }

    /** New consecutive-duration counter of a maintain-need goal. */
    record SetDuration(String goalId, int duration) implements GoalUpdate {
        public SetDuration {
            Objects.requireNonNull(goalId, "goalId");
            if (duration < 0) throw new IllegalArgumentException("duration must be >= 0");
        }
    }

    /** Points a clear-path goal at an obstacle. */
    record AssignObstacle(String goalId, GridPos obstacle) implements GoalUpdate {
        public AssignObstacle {
            Objects.requireNonNull(goalId, "goalId");
            Objects.requireNonNull(obstacle, "obstacle");
        }
    }
}
