package org.calista.neuro.ai.memory;

import org.calista.neuro.ai.state.Need;

import java.util.Locale;
import java.util.Objects;

/**
 * Trigger of a procedure.
 */
public sealed interface ProcedureCondition
        permits ProcedureCondition.NeedHigh, ProcedureCondition.FoodInSight, ProcedureCondition.ObstacleBlockingPath {

    boolean holds(ProcedureContext ctx);

    String describe();

    /** need ≥ threshold */
    record NeedHigh(Need need, double threshold) implements ProcedureCondition {
        public NeedHigh {
            Objects.requireNonNull(need, "need");
            if (!(threshold >= 0.0 && threshold <= 1.0)) throw new IllegalArgumentException("threshold must be in [0,1]");
        }

        @Override
        public boolean holds(ProcedureContext ctx) {
            return ctx.need(need) >= threshold;
        }

        @Override
        public String describe() {
            return "When " + need.name().toLowerCase(Locale.ROOT) + " is high";
        }
    }

    /** Food is visible and the agent is at least somewhat hungry. */
    record FoodInSight(double minHunger) implements ProcedureCondition {
        @Override
        public boolean holds(ProcedureContext ctx) {
            return ctx.foodInSight() && ctx.need(Need.HUNGER) > minHunger;
        }

        @Override
        public String describe() {
            return "When food is in sight";
        }
    }

    /** An obstacle is visible while a location goal is still open. */
    record ObstacleBlockingPath() implements ProcedureCondition {
        @Override
        public boolean holds(ProcedureContext ctx) {
            return ctx.obstacleInSight() && ctx.hasActiveLocationGoal();
        }

        @Override
        public String describe() {
            return "When an obstacle is blocking a goal path";
        }
    }
}
