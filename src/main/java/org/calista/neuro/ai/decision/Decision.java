package org.calista.neuro.ai.decision;

import org.calista.neuro.ai.action.Action;
import org.calista.neuro.ai.goal.GoalUpdate;
import org.calista.neuro.ai.memory.ProcedureMatch;

import java.util.List;
import java.util.Objects;

/**
 * Output of one arbitration.
 *
 * @param goalUpdates goal bookkeeping the caller must apply, in order
 * @param procedure   best matching procedure at decision time, {@code null} if none matched;
 *                    used for outcome feedback whether or not it won
 */
public record Decision(Action action, Stage stage, List<GoalUpdate> goalUpdates, ProcedureMatch procedure) {

    public Decision {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(stage, "stage");
        goalUpdates = (goalUpdates == null) ? List.of() : List.copyOf(goalUpdates);
    }

    public static Decision forced(Action action) {
        return new Decision(action, Stage.FORCED, List.of(), null);
    }

    public Decision withAction(Action a, Stage s) {
        return new Decision(a, s, goalUpdates, procedure);
    }
}
