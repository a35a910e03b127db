package org.calista.neuro.ai.decision;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.neuro.ai.action.Action;
import org.calista.neuro.ai.env.Cell;
import org.calista.neuro.ai.env.GridPos;
import org.calista.neuro.ai.env.Weather;
import org.calista.neuro.ai.goal.ClearPathGoal;
import org.calista.neuro.ai.goal.ExploreAreaGoal;
import org.calista.neuro.ai.goal.Goal;
import org.calista.neuro.ai.goal.GoalUpdate;
import org.calista.neuro.ai.goal.MaintainNeedLowGoal;
import org.calista.neuro.ai.goal.ReachLocationGoal;
import org.calista.neuro.ai.memory.ProcedureMatch;
import org.calista.neuro.ai.memory.SemanticMemory;
import org.calista.neuro.ai.memory.WorkingMemoryItem;
import org.calista.neuro.ai.state.Need;
import org.calista.neuro.ai.state.PhysiologySnapshot;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;

/**
 * Arbiter: сводит потребности, привычки, DQN, цели и память в одно действие за тик.
 *
 * <p>Precedence, each level short-circuiting when it decides:</p>
 * <ol>
 *   <li>critical need overrides (hunger, thirst, fatigue)</li>
 *   <li>procedural memory above the mode's activation threshold</li>
 *   <li>learner suggestion as the candidate</li>
 *   <li>goal pursuit (deliberative only)</li>
 *   <li>memory refinement (deliberative only)</li>
 *   <li>weather, curiosity and crowd modifiers</li>
 * </ol>
 *
 * Apart from the learner's exploration draw and its own {@link Random}, the arbiter only reads the
 * {@link AgentView}. Goal bookkeeping is returned as {@link GoalUpdate}s.
 */
public final class Arbiter {
    private static final Logger log = LogManager.getLogger(Arbiter.class);

    private static final Need[] CRITICAL_ORDER = {Need.HUNGER, Need.THIRST, Need.FATIGUE};
    private static final Action[] MOVES = {Action.MOVE_UP, Action.MOVE_DOWN, Action.MOVE_LEFT, Action.MOVE_RIGHT};

    private final ArbiterSettings settings;
    private final Random rnd;

    public Arbiter(ArbiterSettings settings, Random rnd) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.rnd = Objects.requireNonNull(rnd, "rnd");
    }

    public ArbiterSettings settings() {
        return settings;
    }

    public Decision decide(AgentView view, DecisionMode mode) {
        Objects.requireNonNull(view, "view");
        Objects.requireNonNull(mode, "mode");

        PhysiologySnapshot body = view.body();
        ProcedureMatch match = view.procedures().matching(view).orElse(null);

        // 1. critical
        for (Need n : CRITICAL_ORDER) {
            if (body.level(n) > settings.critical()) {
                trace(view, "critical {} {} -> {}", n, body.level(n), n.satisfiedBy());
                return new Decision(n.satisfiedBy(), Stage.CRITICAL, List.of(), match);
            }
        }

        // 2. procedural
        if (match != null && match.priority() >= settings.proceduralThreshold(mode)) {
            trace(view, "procedure {} ({}) -> {}", match.procedureId(), match.priority(), match.action());
            return new Decision(match.action(), Stage.PROCEDURAL, List.of(), match);
        }

        // 3. learner
        Action candidate = view.learner().selectAction(view.stateVector());
        Stage stage = Stage.LEARNER;
        List<GoalUpdate> updates = new ArrayList<>(2);

        // 4. goals
        if (mode == DecisionMode.DELIBERATIVE) {
            Goal goal = selectGoal(view.goals());
            if (goal != null) {
                Action a = pursue(goal, view, candidate, updates);
                if (a != candidate) {
                    candidate = a;
                    stage = Stage.GOAL;
                }
            }
        }

        // 5. memory
        if (mode == DecisionMode.DELIBERATIVE) {
            Action a = refineFromMemory(view, candidate);
            if (a != candidate) {
                candidate = a;
                stage = Stage.MEMORY;
            }
        }

        // 6. modifiers
        Action a = modify(view, mode, candidate);
        if (a != candidate) {
            candidate = a;
            stage = Stage.MODIFIER;
        }

        trace(view, "{} decision: {} via {}", mode, candidate, stage);
        return new Decision(candidate, stage, updates, match);
    }

    // ---------------------------------------------------------------------
    // Goals
    // ---------------------------------------------------------------------

    /**
     * Highest effective priority among open goals whose prerequisites are done.
     * A prerequisite id that names no goal counts as met. A clear-path goal with no obstacle
     * assigned has nothing to do and is skipped. Ties keep the earlier goal.
     */
    Goal selectGoal(List<Goal> goals) {
        Map<String, Goal> byId = new HashMap<>(goals.size() * 2);
        for (Goal g : goals) byId.put(g.id(), g);

        Goal best = null;
        double bestPriority = -1.0;
        for (Goal g : goals) {
            if (g.completed()) continue;
            if (!prerequisitesMet(g, byId)) continue;
            if (g instanceof ClearPathGoal c && c.obstacle() == null) continue;

            double p = g.priority();
            if (g.parentId() != null) {
                Goal parent = byId.get(g.parentId());
                if (parent != null && !parent.completed()) {
                    p = Math.min(1.0, p + parent.priority() * settings.goalParentBoost());
                }
            }
            if (p > bestPriority) {
                bestPriority = p;
                best = g;
            }
        }
        return best;
    }

    private static boolean prerequisitesMet(Goal g, Map<String, Goal> byId) {
        for (String pre : g.prerequisites()) {
            Goal p = byId.get(pre);
            if (p != null && !p.completed()) return false;
        }
        return true;
    }

    private Action pursue(Goal goal, AgentView view, Action candidate, List<GoalUpdate> updates) {
        return switch (goal.kind()) {
            case REACH_LOCATION -> reach((ReachLocationGoal) goal, view, candidate, updates);
            case MAINTAIN_NEED_LOW -> maintain((MaintainNeedLowGoal) goal, view, candidate, updates);
            case CLEAR_PATH -> clear((ClearPathGoal) goal, view, candidate, updates);
            case EXPLORE_AREA -> explore((ExploreAreaGoal) goal, view, candidate, updates);
        };
    }

    /**
     * Adjacency to a blocking obstacle is cardinal (Manhattan distance 1), not the eight-neighbourhood:
     * {@code MOVE_OBJECT} only pushes obstacles in the four cardinal directions, so a diagonal
     * obstacle is first approached along the larger axis.
     */
    private Action reach(ReachLocationGoal g, AgentView view, Action candidate, List<GoalUpdate> updates) {
        GridPos pos = view.position();
        GridPos target = g.target();
        if (pos.equals(target)) {
            updates.add(new GoalUpdate.MarkCompleted(g.id()));
            return Action.EXPLORE;
        }

        GridPos blocking = null;
        for (GridPos obs : view.perception().obstacleLocations()) {
            if (obs.within(pos, target)) {
                blocking = obs;
                break;
            }
        }
        ClearPathGoal sub = (blocking != null) ? openClearPathChild(g.id(), view.goals()) : null;
        if (sub != null) {
            updates.add(new GoalUpdate.AssignObstacle(sub.id(), blocking));
            if (pos.manhattan(blocking) == 1) return Action.MOVE_OBJECT;
            return Moves.largerAxisFirst(pos, blocking).orElse(candidate);
        }
        return Moves.rowsFirst(pos, target).orElse(candidate);
    }

    private static ClearPathGoal openClearPathChild(String parentId, List<Goal> goals) {
        for (Goal g : goals) {
            if (g instanceof ClearPathGoal c && !c.completed() && parentId.equals(c.parentId())) return c;
        }
        return null;
    }

    private Action maintain(MaintainNeedLowGoal g, AgentView view, Action candidate, List<GoalUpdate> updates) {
        double level = view.body().level(g.need());
        if (level < g.threshold()) {
            int d = g.currentDuration() + 1;
            updates.add(new GoalUpdate.SetDuration(g.id(), d));
            if (d >= g.requiredDuration()) updates.add(new GoalUpdate.MarkCompleted(g.id()));
            if (level >= g.threshold() * settings.goalSuggestFraction()) return g.need().satisfiedBy();
            return candidate;
        }
        if (g.currentDuration() != 0) updates.add(new GoalUpdate.SetDuration(g.id(), 0));
        return candidate;
    }

    private Action clear(ClearPathGoal g, AgentView view, Action candidate, List<GoalUpdate> updates) {
        GridPos obs = g.obstacle();
        if (obs == null) return candidate;

        // unprobed cells are assumed still blocked
        Cell cell = view.probe(obs);
        if (cell != Cell.OBSTACLE && cell != Cell.UNKNOWN) {
            updates.add(new GoalUpdate.MarkCompleted(g.id()));
            return Action.EXPLORE;
        }
        GridPos pos = view.position();
        if (pos.manhattan(obs) <= 1) return Action.MOVE_OBJECT;
        return Moves.largerAxisFirst(pos, obs).orElse(candidate);
    }

    private Action explore(ExploreAreaGoal g, AgentView view, Action candidate, List<GoalUpdate> updates) {
        GridPos pos = view.position();
        if (pos.equals(g.target())) {
            updates.add(new GoalUpdate.MarkCompleted(g.id()));
            return Action.EXPLORE;
        }
        return Moves.rowsFirst(pos, g.target()).orElse(candidate);
    }

    // ---------------------------------------------------------------------
    // Memory
    // ---------------------------------------------------------------------

    private Action refineFromMemory(AgentView view, Action candidate) {
        PhysiologySnapshot body = view.body();
        SemanticMemory sm = view.semantic();
        double th = settings.memoryNeed();
        Action c = candidate;

        if (body.hunger() > th
                && view.perception().foodInSight()
                && sm.retrieve("food").isPresent()
                && "reduces_hunger".equals(sm.inferProperty("food", "effect").orElse(null))
                && c != Action.SEEK_FOOD && !c.isSpatial()) {
            c = Action.SEEK_FOOD;
        }
        if (body.thirst() > th
                && view.perception().waterInSight()
                && sm.retrieve("water").isPresent()
                && "reduces_thirst".equals(sm.inferProperty("water", "effect").orElse(null))
                && c != Action.DRINK_WATER && !c.isSpatial()) {
            c = Action.DRINK_WATER;
        }
        if (body.fatigue() > th && sm.hasProperty("rest", "effect", "reduces_fatigue") && c != Action.REST) {
            c = Action.REST;
        }
        if (view.perception().weather() == Weather.STORMY
                && sm.hasProperty("shelter", "property", "provides_safety")
                && sm.hasProperty("shelter", "context", "bad_weather")
                && c != Action.REST) {
            c = Action.REST;
        }

        Optional<WorkingMemoryItem> recalled = recallResource(view);
        if (recalled.isPresent()) {
            WorkingMemoryItem item = recalled.get();
            Action satisfying = (item.kind() == WorkingMemoryItem.Kind.PERCEIVED_FOOD) ? Action.SEEK_FOOD : Action.DRINK_WATER;
            if (c != satisfying && !c.isSpatial()) {
                c = Moves.largerAxisFirst(view.position(), item.location()).orElse(c);
            }
        }
        return c;
    }

    /** Newest recent food/water percept, elsewhere than here, whose need is elevated. */
    private Optional<WorkingMemoryItem> recallResource(AgentView view) {
        for (WorkingMemoryItem it : view.workingMemory()) {
            Need need;
            if (it.kind() == WorkingMemoryItem.Kind.PERCEIVED_FOOD) need = Need.HUNGER;
            else if (it.kind() == WorkingMemoryItem.Kind.PERCEIVED_WATER) need = Need.THIRST;
            else continue;

            if (view.tick() - it.tick() > settings.memoryRecentTicks()) continue;
            if (it.location().equals(view.position())) continue;
            if (view.body().level(need) <= settings.memoryNeed()) continue;
            return Optional.of(it);
        }
        return Optional.empty();
    }

    // ---------------------------------------------------------------------
    // Modifiers
    // ---------------------------------------------------------------------

    private Action modify(AgentView view, DecisionMode mode, Action candidate) {
        PhysiologySnapshot body = view.body();
        Weather weather = view.perception().weather();
        Action c = candidate;

        if (weather == Weather.STORMY) {
            c = Action.REST;
        } else if (weather == Weather.RAINY && c == Action.EXPLORE && rnd.nextDouble() < settings.rainExploreChance()) {
            c = body.fatigue() < settings.rainFatigueCeiling() ? Action.REST : Action.SEEK_FOOD;
        }

        double calm = settings.calmNeedCeiling();
        if (view.curiosity() > settings.curiosity()
                && body.hunger() < calm && body.fatigue() < calm && body.thirst() < calm
                && !view.hasOpenGoals()
                && mode == DecisionMode.DELIBERATIVE
                && c != Action.EXPLORE && !c.isSpatial()) {
            c = MOVES[rnd.nextInt(MOVES.length)];
        }

        if (view.perception().otherAgentsInSight() && body.hunger() > settings.crowdHunger() && c == Action.EXPLORE) {
            c = Action.SEEK_FOOD;
        }
        return c;
    }

    private static void trace(AgentView view, String fmt, Object... args) {
        if (log.isDebugEnabled()) {
            Object[] all = new Object[args.length + 1];
            all[0] = view.tick();
            System.arraycopy(args, 0, all, 1, args.length);
            log.debug("[tick {}] " + fmt, all);
        }
    }
}
