package org.calista.neuro.ai.perception;

import org.calista.neuro.ai.goal.Goal;
import org.calista.neuro.ai.goal.MaintainNeedLowGoal;
import org.calista.neuro.ai.state.PhysiologySnapshot;

import java.util.List;
import java.util.Objects;

/**
 * Picks the attention focus: urgent needs first, then the top open goal, then visible obstacles.
 */
public final class Attention {

    private final double needThreshold;

    public Attention(double needThreshold) {
        this.needThreshold = needThreshold;
    }

    public AttentionFocus select(PhysiologySnapshot body, List<Goal> goals, Perception perception) {
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(goals, "goals");
        Objects.requireNonNull(perception, "perception");

        if (body.hunger() > needThreshold) return AttentionFocus.FOOD;
        if (body.thirst() > needThreshold) return AttentionFocus.WATER;
        if (body.fatigue() > needThreshold) return AttentionFocus.REST;

        Goal top = null;
        for (Goal g : goals) {
            if (g.completed()) continue;
            if (top == null || g.priority() > top.priority()) top = g;
        }
        if (top != null) return focusOf(top);

        if (perception.obstacleInSight()) return AttentionFocus.OBSTACLE;
        return AttentionFocus.NONE;
    }

    static AttentionFocus focusOf(Goal g) {
        return switch (g.kind()) {
            case REACH_LOCATION, EXPLORE_AREA -> AttentionFocus.LOCATION_TARGET;
            case CLEAR_PATH -> AttentionFocus.OBSTACLE;
            case MAINTAIN_NEED_LOW -> switch (((MaintainNeedLowGoal) g).need()) {
                case HUNGER -> AttentionFocus.FOOD;
                case THIRST -> AttentionFocus.WATER;
                case FATIGUE -> AttentionFocus.REST;
            };
        };
    }
}
