package org.calista.neuro.ai.core;

import org.calista.neuro.ai.action.Action;
import org.calista.neuro.ai.action.ActionExecutor;
import org.calista.neuro.ai.action.RewardShaper;
import org.calista.neuro.ai.agent.Agent;
import org.calista.neuro.ai.consciousness.ConsciousnessSettings;
import org.calista.neuro.ai.decision.Arbiter;
import org.calista.neuro.ai.emotion.BasicEmotionStrategy;
import org.calista.neuro.ai.env.GridPos;
import org.calista.neuro.ai.goal.ClearPathGoal;
import org.calista.neuro.ai.goal.GoalGenerator;
import org.calista.neuro.ai.goal.GoalStore;
import org.calista.neuro.ai.goal.MaintainNeedLowGoal;
import org.calista.neuro.ai.goal.ReachLocationGoal;
import org.calista.neuro.ai.learn.impl.DqnLearner;
import org.calista.neuro.ai.memory.InMemoryEpisodicMemory;
import org.calista.neuro.ai.memory.InMemoryProceduralMemory;
import org.calista.neuro.ai.memory.InMemorySemanticMemory;
import org.calista.neuro.ai.memory.ProceduralMemory;
import org.calista.neuro.ai.memory.ProcedureCondition;
import org.calista.neuro.ai.memory.SemanticMemory;
import org.calista.neuro.ai.memory.WorkingMemory;
import org.calista.neuro.ai.perception.Attention;
import org.calista.neuro.ai.perception.PerceptionManager;
import org.calista.neuro.ai.state.BasicMoodStrategy;
import org.calista.neuro.ai.state.Need;
import org.calista.neuro.ai.state.PhysiologicalState;
import org.calista.neuro.io.FileIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Random;

/**
 * AgentFactory: собирает агента из конфига: тело, память, learner, арбитр.
 *
 * Each agent owns its own learner, replay buffer, goal store and memories;
 * only the random source is shared.
 */
public final class AgentFactory {

    private static final Logger log = LoggerFactory.getLogger(AgentFactory.class);

    public static final String GOAL_REACH_CENTER = "goal_reach_center";
    public static final String GOAL_CLEAR_OBSTACLE = "sub_goal_clear_obstacle";
    public static final String GOAL_STAY_FED = "goal_stay_fed";
    public static final String GOAL_STAY_HYDRATED = "goal_stay_hydrated";

    private final AgentConfig cfg;
    private final FileIO io; // nullable: learner then resolves model paths itself
    private final Random rnd;

    public AgentFactory(AgentConfig cfg, FileIO io, Random rnd) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.io = io;
        this.rnd = Objects.requireNonNull(rnd, "rnd");
    }

    public Agent create(String name, GridPos start) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(start, "start");

        AgentConfig.Physiology ph = cfg.physiology;
        PhysiologicalState body = new PhysiologicalState(
                new BasicMoodStrategy(ph.moodHungerWeight, ph.moodFatigueWeight, ph.moodThirstWeight),
                ph.hungerRate, ph.fatigueRate, ph.thirstRate,
                ph.initialHunger, ph.initialFatigue, ph.initialThirst);

        GoalStore goals = new GoalStore();
        if (cfg.goals.seedDefaults) seedGoals(goals, cfg.simulation.gridSize);

        ProceduralMemory procedural = new InMemoryProceduralMemory(cfg.memory.proceduralCapacity);
        seedProcedures(procedural);

        SemanticMemory semantic = new InMemorySemanticMemory(cfg.memory.semanticCapacity, rnd);
        seedFacts(semantic);

        ConsciousnessSettings cs = cfg.consciousnessSettings();

        Agent agent = Agent.builder(name)
                .position(start)
                .viewRadius(cfg.perception.viewRadius)
                .nightScale(ph.nightScale)
                .body(body)
                .emotionStrategy(new BasicEmotionStrategy())
                .learner(learner())
                .rewardShaper(new RewardShaper(cfg.emotion.rewardHighMood, cfg.emotion.rewardLowMood))
                .executor(new ActionExecutor())
                .perception(new PerceptionManager(cfg.perception.accuracy, rnd))
                .attention(new Attention(cfg.perception.attentionNeed))
                .goals(goals)
                .goalGenerator(new GoalGenerator(cfg.goals.generatorCooldown, cfg.simulation.gridSize,
                        cfg.goals.hungerTrigger, cfg.goals.curiosityTrigger, rnd))
                .procedural(procedural)
                .semantic(semantic)
                .episodic(new InMemoryEpisodicMemory(cfg.memory.episodicCapacity))
                .workingMemory(new WorkingMemory(cfg.memory.workingCapacity))
                .arbiter(new Arbiter(cfg.arbiterSettings(), rnd))
                .consciousnessSettings(cs)
                .build();

        log.debug("Agent {} created at {} with {} goals, {} procedures", name, start, goals.size(), procedural.procedures().size());
        return agent;
    }

    public DqnLearner learner() {
        AgentConfig.Learner l = cfg.learner;
        return DqnLearner.builder()
                .hidden(l.hidden)
                .learningRate(l.learningRate)
                .gamma(l.gamma)
                .epsilon(l.epsilon)
                .epsilonMin(l.epsilonMin)
                .epsilonDecay(l.epsilonDecay)
                .capacity(l.replayCapacity)
                .batchSize(l.batchSize)
                .targetSyncEvery(l.targetSyncEvery)
                .random(rnd)
                .fileIO(io)
                .build();
    }

    // ---------------------------------------------------------------------
    // Defaults
    // ---------------------------------------------------------------------

    /** Reach the centre, its clear-path sub-goal, stay fed, stay hydrated. */
    public static void seedGoals(GoalStore goals, int gridSize) {
        Objects.requireNonNull(goals, "goals");
        GridPos center = GridPos.of(gridSize / 2, gridSize / 2);
        goals.add(ReachLocationGoal.of(GOAL_REACH_CENTER, "Reach Center of Map", 0.9, center));
        goals.add(ClearPathGoal.subGoalOf(GOAL_CLEAR_OBSTACLE, "Clear Obstacle on Path", 0.85, GOAL_REACH_CENTER));
        goals.add(MaintainNeedLowGoal.of(GOAL_STAY_FED, "Stay Fed", 0.6, Need.HUNGER, 0.3, 20));
        goals.add(MaintainNeedLowGoal.of(GOAL_STAY_HYDRATED, "Stay Hydrated", 0.7, Need.THIRST, 0.2, 15));
    }

    public static void seedProcedures(ProceduralMemory procedural) {
        Objects.requireNonNull(procedural, "procedural");
        procedural.add("Emergency Food Search", new ProcedureCondition.NeedHigh(Need.HUNGER, 0.7), Action.SEEK_FOOD, 0.8);
        procedural.add("Fatigue Recovery", new ProcedureCondition.NeedHigh(Need.FATIGUE, 0.7), Action.REST, 0.7);
        procedural.add("Clear Obstacle", new ProcedureCondition.ObstacleBlockingPath(), Action.MOVE_OBJECT, 0.9);
        procedural.add("Emergency Water Search", new ProcedureCondition.NeedHigh(Need.THIRST, 0.7), Action.DRINK_WATER, 0.85);
    }

    public static void seedFacts(SemanticMemory semantic) {
        Objects.requireNonNull(semantic, "semantic");
        semantic.addFact("food", Map.of(SemanticMemory.IS_A, "resource", "property", "edible", "effect", "reduces_hunger"));
        semantic.addFact("water", Map.of(SemanticMemory.IS_A, "resource", "property", "drinkable", "effect", "reduces_thirst"));
        semantic.addFact("obstacle", Map.of(SemanticMemory.IS_A, "barrier", "property", "immovable_by_default",
                "action_needed", "move_object"));
        semantic.addFact("rest", Map.of(SemanticMemory.IS_A, "action", "effect", "reduces_fatigue", "context", "safe_place"));
        semantic.addFact("explore", Map.of(SemanticMemory.IS_A, "action", "effect", "gains_information",
                "cost", "increases_hunger_fatigue_thirst"));
        semantic.addFact("shelter", Map.of(SemanticMemory.IS_A, "structure", "property", "provides_safety",
                "context", "bad_weather"));
    }
}
