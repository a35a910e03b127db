package org.calista.neuro.ai.action;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.neuro.ai.env.Cell;
import org.calista.neuro.ai.env.Direction;
import org.calista.neuro.ai.env.Environment;
import org.calista.neuro.ai.env.GridPos;
import org.calista.neuro.ai.state.Need;
import org.calista.neuro.ai.state.PhysiologicalState;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * ActionExecutor: применяет эффекты действия к телу агента и к миру.
 *
 * <p>Stateless: position and body are passed in, the new position comes back in
 * the {@link ActionOutcome}. Unknown action ids are a no-op with a fixed penalty.</p>
 */
public final class ActionExecutor {
    private static final Logger log = LogManager.getLogger(ActionExecutor.class);

    public static final double UNKNOWN_ACTION_REWARD = -0.2;

    // order in which free cells next to a pushed obstacle are tried
    private static final List<Direction> PUSH_ORDER =
            List.of(Direction.RIGHT, Direction.DOWN, Direction.LEFT, Direction.UP);

    /**
     * Executes a raw action id. Anything {@link Action#fromId(String)} does not know
     * is logged and rewarded with {@link #UNKNOWN_ACTION_REWARD}; nothing else changes.
     */
    public ActionOutcome execute(String actionId, GridPos position, PhysiologicalState body, Environment env) {
        Optional<Action> a = Action.fromId(actionId);
        if (a.isEmpty()) {
            log.warn("unknown action '{}' at {}: no-op", actionId, position);
            return new ActionOutcome(null, UNKNOWN_ACTION_REWARD, Objects.requireNonNull(position, "position"), false);
        }
        return execute(a.get(), position, body, env);
    }

    public ActionOutcome execute(Action action, GridPos position, PhysiologicalState body, Environment env) {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(env, "env");

        return switch (action) {
            case SEEK_FOOD -> consume(action, Cell.FOOD, Need.HUNGER, -0.7, 0.5, 0.02, -0.1, position, body, env);
            case DRINK_WATER -> consume(action, Cell.WATER, Need.THIRST, -0.8, 0.6, 0.03, -0.15, position, body, env);
            case REST -> {
                body.adjust(Need.FATIGUE, -0.6);
                yield new ActionOutcome(action, 0.4, position, true);
            }
            case EXPLORE -> {
                body.adjust(Need.HUNGER, 0.05);
                body.adjust(Need.FATIGUE, 0.05);
                body.adjust(Need.THIRST, 0.05);
                yield new ActionOutcome(action, -0.05, position, false);
            }
            case MOVE_UP, MOVE_DOWN, MOVE_LEFT, MOVE_RIGHT -> move(action, position, env);
            case MOVE_OBJECT -> pushObstacle(position, env);
        };
    }

    // ----- effects -----

    private static ActionOutcome consume(Action action,
                                         Cell resource,
                                         Need need,
                                         double relief,
                                         double reward,
                                         double missPenaltyNeed,
                                         double missReward,
                                         GridPos position,
                                         PhysiologicalState body,
                                         Environment env) {
        if (env.cellAt(position) == resource && env.consume(position, resource)) {
            body.adjust(need, relief);
            log.debug("{} consumed {} at {}", action, resource, position);
            return new ActionOutcome(action, reward, position, true);
        }
        body.adjust(need, missPenaltyNeed);
        return new ActionOutcome(action, missReward, position, false);
    }

    private static ActionOutcome move(Action action, GridPos position, Environment env) {
        Direction d = action.direction().orElseThrow();
        GridPos next = position.step(d);
        if (env.canEnter(next)) {
            return new ActionOutcome(action, -0.01, next, true);
        }
        log.trace("{} blocked at {}", action, next);
        return new ActionOutcome(action, -0.1, position, false);
    }

    private static ActionOutcome pushObstacle(GridPos position, Environment env) {
        for (Direction toObstacle : Direction.values()) {
            GridPos obstacle = position.step(toObstacle);
            if (env.cellAt(obstacle) != Cell.OBSTACLE) continue;

            for (Direction push : PUSH_ORDER) {
                GridPos target = obstacle.step(push);
                if (target.equals(position)) continue;
                if (env.cellAt(target) != Cell.EMPTY) continue;
                if (env.relocateObstacle(obstacle, target)) {
                    log.debug("obstacle moved {} -> {}", obstacle, target);
                    return new ActionOutcome(Action.MOVE_OBJECT, 0.3, position, true);
                }
            }
        }
        return new ActionOutcome(Action.MOVE_OBJECT, -0.2, position, false);
    }
}
