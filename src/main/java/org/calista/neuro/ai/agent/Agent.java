package org.calista.neuro.ai.agent;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.neuro.ai.action.Action;
import org.calista.neuro.ai.action.ActionExecutor;
import org.calista.neuro.ai.action.ActionOutcome;
import org.calista.neuro.ai.action.RewardShaper;
import org.calista.neuro.ai.consciousness.ConsciousHost;
import org.calista.neuro.ai.consciousness.ConsciousnessMachine;
import org.calista.neuro.ai.consciousness.ConsciousnessMode;
import org.calista.neuro.ai.consciousness.ConsciousnessSettings;
import org.calista.neuro.ai.consciousness.ConsciousnessSignals;
import org.calista.neuro.ai.consciousness.ConsciousnessState;
import org.calista.neuro.ai.decision.AgentView;
import org.calista.neuro.ai.decision.Arbiter;
import org.calista.neuro.ai.decision.Decision;
import org.calista.neuro.ai.decision.DecisionMode;
import org.calista.neuro.ai.emotion.Emotion;
import org.calista.neuro.ai.emotion.EmotionState;
import org.calista.neuro.ai.emotion.EmotionStrategy;
import org.calista.neuro.ai.env.Cell;
import org.calista.neuro.ai.env.Environment;
import org.calista.neuro.ai.env.EnvironmentSnapshot;
import org.calista.neuro.ai.env.GridPos;
import org.calista.neuro.ai.env.TimeOfDay;
import org.calista.neuro.ai.goal.ClearPathGoal;
import org.calista.neuro.ai.goal.Goal;
import org.calista.neuro.ai.goal.GoalGenerator;
import org.calista.neuro.ai.goal.GoalStore;
import org.calista.neuro.ai.learn.ValueLearner;
import org.calista.neuro.ai.memory.EpisodicMemory;
import org.calista.neuro.ai.memory.ProceduralMemory;
import org.calista.neuro.ai.memory.SemanticMemory;
import org.calista.neuro.ai.memory.WorkingMemory;
import org.calista.neuro.ai.memory.WorkingMemoryItem;
import org.calista.neuro.ai.perception.Attention;
import org.calista.neuro.ai.perception.AttentionFocus;
import org.calista.neuro.ai.perception.Perception;
import org.calista.neuro.ai.perception.PerceptionManager;
import org.calista.neuro.ai.state.PhysiologicalState;
import org.calista.neuro.ai.state.PhysiologySnapshot;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Agent: владелец всего состояния одного агента и порядок шагов тика.
 *
 * <p>Per tick, in this order:</p>
 * <ol>
 *   <li>sense (through the active consciousness state)</li>
 *   <li>physiology update (×night scale after dark)</li>
 *   <li>emotion update</li>
 *   <li>attention focus and mode transition</li>
 *   <li>goal generation</li>
 *   <li>think: arbitration, or the state's own choice</li>
 *   <li>apply goal updates returned with the decision</li>
 *   <li>act, procedure feedback</li>
 *   <li>reward shaping and learner update (not while asleep)</li>
 *   <li>episodic write</li>
 * </ol>
 *
 * Not thread-safe; the simulation ticks agents one after another.
 */
public final class Agent implements ConsciousHost {
    private static final Logger log = LogManager.getLogger(Agent.class);

    private final String name;
    private final int viewRadius;
    private final double nightScale;

    private final PhysiologicalState body;
    private final EmotionState emotions;
    private final EmotionStrategy emotionStrategy;
    private final ValueLearner learner;
    private final RewardShaper rewardShaper;
    private final ActionExecutor executor;
    private final PerceptionManager perceptionManager;
    private final Attention attentionSelector;
    private final GoalStore goals;
    private final GoalGenerator goalGenerator; // nullable
    private final ProceduralMemory procedural;
    private final SemanticMemory semantic;
    private final EpisodicMemory episodic;
    private final WorkingMemory workingMemory;
    private final Arbiter arbiter;
    private final ConsciousnessMachine consciousness;
    private final ConsciousnessSettings consciousnessSettings;

    private GridPos position;
    private AttentionFocus attention = AttentionFocus.NONE;
    private Perception perception = Perception.initial();
    private long tick;

    // bound for the duration of tick()
    private Environment env;
    private EnvironmentSnapshot snapshot;
    private Collection<GridPos> others = List.of();

    private Agent(Builder b) {
        this.name = Objects.requireNonNull(b.name, "name");
        if (b.viewRadius < 0) throw new IllegalArgumentException("viewRadius must be >= 0");
        if (!(b.nightScale > 0.0)) throw new IllegalArgumentException("nightScale must be > 0");
        this.viewRadius = b.viewRadius;
        this.nightScale = b.nightScale;
        this.position = Objects.requireNonNull(b.position, "position");

        this.body = Objects.requireNonNull(b.body, "body");
        this.emotions = (b.emotions != null) ? b.emotions : new EmotionState();
        this.emotionStrategy = Objects.requireNonNull(b.emotionStrategy, "emotionStrategy");
        this.learner = Objects.requireNonNull(b.learner, "learner");
        this.rewardShaper = (b.rewardShaper != null) ? b.rewardShaper : new RewardShaper();
        this.executor = (b.executor != null) ? b.executor : new ActionExecutor();
        this.perceptionManager = Objects.requireNonNull(b.perceptionManager, "perceptionManager");
        this.attentionSelector = Objects.requireNonNull(b.attention, "attention");
        this.goals = (b.goals != null) ? b.goals : new GoalStore();
        this.goalGenerator = b.goalGenerator;
        this.procedural = Objects.requireNonNull(b.procedural, "procedural");
        this.semantic = Objects.requireNonNull(b.semantic, "semantic");
        this.episodic = Objects.requireNonNull(b.episodic, "episodic");
        this.workingMemory = Objects.requireNonNull(b.workingMemory, "workingMemory");
        this.arbiter = Objects.requireNonNull(b.arbiter, "arbiter");
        this.consciousnessSettings = Objects.requireNonNull(b.consciousnessSettings, "consciousnessSettings");
        this.consciousness = (b.consciousness != null)
                ? b.consciousness
                : ConsciousnessMachine.standard(consciousnessSettings);

        this.consciousness.start(this);
    }

    // ---------------------------------------------------------------------
    // Tick
    // ---------------------------------------------------------------------

    /**
     * One sense → think → act cycle.
     *
     * @param otherAgents positions of the other agents in the world this tick
     */
    public TickResult tick(Environment environment, Collection<GridPos> otherAgents) {
        this.env = Objects.requireNonNull(environment, "environment");
        this.others = List.copyOf(Objects.requireNonNull(otherAgents, "otherAgents"));
        try {
            this.tick = env.tick();
            this.snapshot = env.observe(position, viewRadius);

            consciousness.current().sense(this);

            body.update(perception.timeOfDay() == TimeOfDay.NIGHT ? nightScale : 1.0);

            emotionStrategy.update(emotions, perception.foodAvailableGlobal(), perception.timeOfDay(), body.snapshot());

            if (consciousness.mode() != ConsciousnessMode.ASLEEP) {
                attention = attentionSelector.select(body.snapshot(), goals.all(), perception);
            }
            consciousness.evaluate(signals(), this);
            ConsciousnessState state = consciousness.current();

            if (goalGenerator != null && state.mode() != ConsciousnessMode.ASLEEP) {
                goalGenerator.generate(tick, goals, body.snapshot(), emotions.get(Emotion.CURIOSITY), env::cellAt);
            }

            Decision decision = state.think(this);
            goals.applyAll(decision.goalUpdates());

            PhysiologySnapshot before = body.snapshot();
            ActionOutcome outcome = state.act(this, decision.action());
            position = outcome.position();

            if (state.learns() && decision.procedure() != null && outcome.action() == decision.procedure().action()) {
                procedural.recordOutcome(decision.procedure().procedureId(), outcome.success());
            }

            PhysiologySnapshot after = body.snapshot();
            double reward = rewardShaper.shape(outcome.reward(), after.mood01());
            Action executed = (outcome.action() != null) ? outcome.action() : decision.action();
            if (state.learns()) {
                learner.update(before.toVector(), executed, reward, after.toVector());
            }

            episodic.add(tick, after, executed, emotions.intensity());

            if (log.isDebugEnabled()) {
                log.debug("{} tick={} mode={} action={} via {} reward={} at {} | {}",
                        name, tick, state.mode(), executed, decision.stage(),
                        String.format(Locale.ROOT, "%.3f", reward), position, body);
            }
            return new TickResult(tick, state.mode(), decision, outcome, reward);
        } finally {
            this.env = null;
            this.snapshot = null;
            this.others = List.of();
        }
    }

    private ConsciousnessSignals signals() {
        PhysiologySnapshot s = body.snapshot();
        boolean urgentGoal = false;
        for (Goal g : goals.active()) {
            if (g.priority() >= consciousnessSettings.focusGoalPriority()) {
                urgentGoal = true;
                break;
            }
        }
        return new ConsciousnessSignals(s.fatigue(), s.maxNeed(), urgentGoal);
    }

    // ---------------------------------------------------------------------
    // ConsciousHost
    // ---------------------------------------------------------------------

    @Override
    public void senseDefault(double focusBoost) {
        perception = perceptionManager.perceive(requireSnapshot(), attention, focusBoost, others, workingMemory);
    }

    @Override
    public void senseMinimal() {
        EnvironmentSnapshot s = requireSnapshot();
        perception = perception.asleep(s.tick(), s.timeOfDay(), s.weather());
    }

    @Override
    public Decision thinkDefault(DecisionMode mode) {
        return arbiter.decide(view(), mode);
    }

    @Override
    public ActionOutcome actDefault(Action action) {
        if (env == null) throw new IllegalStateException("act outside of tick()");
        return executor.execute(action, position, body, env);
    }

    /** Snapshot of everything the arbiter may read. */
    public AgentView view() {
        Map<GridPos, Cell> probes = new HashMap<>();
        if (env != null) {
            for (Goal g : goals.active()) {
                if (g instanceof ClearPathGoal c && c.obstacle() != null) probes.put(c.obstacle(), env.cellAt(c.obstacle()));
            }
        }
        return AgentView.builder()
                .tick(tick)
                .position(position)
                .body(body.snapshot())
                .curiosity(emotions.get(Emotion.CURIOSITY))
                .focus(attention)
                .perception(perception)
                .goals(goals.all())
                .workingMemory(workingMemory.snapshot())
                .probes(probes)
                .learner(learner)
                .procedures(procedural)
                .semantic(semantic)
                .build();
    }

    private EnvironmentSnapshot requireSnapshot() {
        if (snapshot == null) throw new IllegalStateException("sense outside of tick()");
        return snapshot;
    }

    @Override
    public String name() { return name; }

    @Override
    public long tick() { return tick; }

    @Override
    public GridPos position() { return position; }

    @Override
    public PhysiologicalState body() { return body; }

    @Override
    public AttentionFocus attention() { return attention; }

    @Override
    public void attention(AttentionFocus focus) { this.attention = Objects.requireNonNull(focus, "focus"); }

    @Override
    public List<Goal> goals() { return goals.all(); }

    @Override
    public List<WorkingMemoryItem> workingMemory() { return workingMemory.snapshot(); }

    // ---------------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------------

    public ConsciousnessMode mode() { return consciousness.mode(); }

    public ConsciousnessMachine consciousness() { return consciousness; }

    public EmotionState emotions() { return emotions; }

    public Perception perception() { return perception; }

    public ValueLearner learner() { return learner; }

    public GoalStore goalStore() { return goals; }

    public ProceduralMemory proceduralMemory() { return procedural; }

    public SemanticMemory semanticMemory() { return semantic; }

    public EpisodicMemory episodicMemory() { return episodic; }

    @Override
    public String toString() {
        return name + "@" + position + " [" + consciousness.mode() + "] " + body;
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static final class Builder {
        private final String name;
        private GridPos position = GridPos.of(0, 0);
        private int viewRadius = 1;
        private double nightScale = 1.5;

        private PhysiologicalState body;
        private EmotionState emotions;
        private EmotionStrategy emotionStrategy;
        private ValueLearner learner;
        private RewardShaper rewardShaper;
        private ActionExecutor executor;
        private PerceptionManager perceptionManager;
        private Attention attention;
        private GoalStore goals;
        private GoalGenerator goalGenerator;
        private ProceduralMemory procedural;
        private SemanticMemory semantic;
        private EpisodicMemory episodic;
        private WorkingMemory workingMemory;
        private Arbiter arbiter;
        private ConsciousnessMachine consciousness;
        private ConsciousnessSettings consciousnessSettings = ConsciousnessSettings.defaults();

        private Builder(String name) {
            this.name = name;
        }

        public Builder position(GridPos v) { this.position = v; return this; }
        public Builder viewRadius(int v) { this.viewRadius = v; return this; }
        public Builder nightScale(double v) { this.nightScale = v; return this; }
        public Builder body(PhysiologicalState v) { this.body = v; return this; }
        public Builder emotions(EmotionState v) { this.emotions = v; return this; }
        public Builder emotionStrategy(EmotionStrategy v) { this.emotionStrategy = v; return this; }
        public Builder learner(ValueLearner v) { this.learner = v; return this; }
        public Builder rewardShaper(RewardShaper v) { this.rewardShaper = v; return this; }
        public Builder executor(ActionExecutor v) { this.executor = v; return this; }
        public Builder perception(PerceptionManager v) { this.perceptionManager = v; return this; }
        public Builder attention(Attention v) { this.attention = v; return this; }
        public Builder goals(GoalStore v) { this.goals = v; return this; }
        public Builder goalGenerator(GoalGenerator v) { this.goalGenerator = v; return this; }
        public Builder procedural(ProceduralMemory v) { this.procedural = v; return this; }
        public Builder semantic(SemanticMemory v) { this.semantic = v; return this; }
        public Builder episodic(EpisodicMemory v) { this.episodic = v; return this; }
        public Builder workingMemory(WorkingMemory v) { this.workingMemory = v; return this; }
        public Builder arbiter(Arbiter v) { this.arbiter = v; return this; }
        public Builder consciousness(ConsciousnessMachine v) { this.consciousness = v; return this; }
        public Builder consciousnessSettings(ConsciousnessSettings v) { this.consciousnessSettings = v; return this; }

        public Agent build() {
            return new Agent(this);
        }
    }
}
