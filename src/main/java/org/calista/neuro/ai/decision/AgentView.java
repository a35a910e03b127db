package org.calista.neuro.ai.decision;

import org.calista.neuro.ai.env.Cell;
import org.calista.neuro.ai.env.GridPos;
import org.calista.neuro.ai.goal.Goal;
import org.calista.neuro.ai.goal.GoalKind;
import org.calista.neuro.ai.learn.ValueLearner;
import org.calista.neuro.ai.memory.ProceduralMemory;
import org.calista.neuro.ai.memory.ProcedureContext;
import org.calista.neuro.ai.memory.SemanticMemory;
import org.calista.neuro.ai.memory.WorkingMemoryItem;
import org.calista.neuro.ai.perception.AttentionFocus;
import org.calista.neuro.ai.perception.Perception;
import org.calista.neuro.ai.state.Need;
import org.calista.neuro.ai.state.PhysiologySnapshot;
import org.calista.neuro.ai.state.StateVector;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * AgentView: неизменяемый срез агента на один тик, единственный вход арбитра.
 *
 * <p>Values are copies. The learner and the memories are reachable only through
 * their query side; the arbiter never writes to them.</p>
 */
public final class AgentView implements ProcedureContext {

    private final long tick;
    private final GridPos position;
    private final PhysiologySnapshot body;
    private final double curiosity;
    private final AttentionFocus focus;
    private final Perception perception;
    private final List<Goal> goals;
    private final List<WorkingMemoryItem> workingMemory;
    private final Map<GridPos, Cell> probes;

    private final ValueLearner learner;
    private final ProceduralMemory procedures;
    private final SemanticMemory semantic;

    private AgentView(Builder b) {
        this.tick = b.tick;
        this.position = Objects.requireNonNull(b.position, "position");
        this.body = Objects.requireNonNull(b.body, "body");
        this.curiosity = b.curiosity;
        this.focus = (b.focus != null) ? b.focus : AttentionFocus.NONE;
        this.perception = Objects.requireNonNull(b.perception, "perception");
        this.goals = List.copyOf(b.goals);
        this.workingMemory = List.copyOf(b.workingMemory);
        this.probes = Map.copyOf(b.probes);
        this.learner = Objects.requireNonNull(b.learner, "learner");
        this.procedures = Objects.requireNonNull(b.procedures, "procedures");
        this.semantic = Objects.requireNonNull(b.semantic, "semantic");
    }

    public long tick() { return tick; }
    public GridPos position() { return position; }
    public PhysiologySnapshot body() { return body; }
    public double curiosity() { return curiosity; }
    public AttentionFocus focus() { return focus; }
    public Perception perception() { return perception; }
    public List<Goal> goals() { return goals; }

    /** Newest first. */
    public List<WorkingMemoryItem> workingMemory() { return workingMemory; }

    public ValueLearner learner() { return learner; }
    public ProceduralMemory procedures() { return procedures; }
    public SemanticMemory semantic() { return semantic; }

    public StateVector stateVector() {
        return body.toVector();
    }

    /**
     * World cell at a position the agent was asked to keep track of (assigned obstacles).
     * Unprobed positions read as {@link Cell#UNKNOWN}.
     */
    public Cell probe(GridPos pos) {
        return probes.getOrDefault(pos, Cell.UNKNOWN);
    }

    public boolean hasOpenGoals() {
        for (Goal g : goals) if (!g.completed()) return true;
        return false;
    }

    // ----- ProcedureContext -----

    @Override
    public double need(Need need) {
        return body.level(need);
    }

    @Override
    public boolean foodInSight() {
        return perception.foodInSight();
    }

    @Override
    public boolean obstacleInSight() {
        return perception.obstacleInSight();
    }

    @Override
    public boolean hasActiveLocationGoal() {
        for (Goal g : goals) if (!g.completed() && g.kind() == GoalKind.REACH_LOCATION) return true;
        return false;
    }

    // ----- Builder -----

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private long tick;
        private GridPos position;
        private PhysiologySnapshot body;
        private double curiosity;
        private AttentionFocus focus;
        private Perception perception = Perception.initial();
        private List<Goal> goals = List.of();
        private List<WorkingMemoryItem> workingMemory = List.of();
        private Map<GridPos, Cell> probes = Map.of();
        private ValueLearner learner;
        private ProceduralMemory procedures;
        private SemanticMemory semantic;

        private Builder() {
        }

        public Builder tick(long v) { this.tick = v; return this; }
        public Builder position(GridPos v) { this.position = v; return this; }
        public Builder body(PhysiologySnapshot v) { this.body = v; return this; }
        public Builder curiosity(double v) { this.curiosity = v; return this; }
        public Builder focus(AttentionFocus v) { this.focus = v; return this; }
        public Builder perception(Perception v) { this.perception = Objects.requireNonNull(v, "perception"); return this; }
        public Builder goals(List<Goal> v) { this.goals = Objects.requireNonNull(v, "goals"); return this; }
        public Builder workingMemory(List<WorkingMemoryItem> v) { this.workingMemory = Objects.requireNonNull(v, "workingMemory"); return this; }
        public Builder probes(Map<GridPos, Cell> v) { this.probes = Objects.requireNonNull(v, "probes"); return this; }
        public Builder learner(ValueLearner v) { this.learner = v; return this; }
        public Builder procedures(ProceduralMemory v) { this.procedures = v; return this; }
        public Builder semantic(SemanticMemory v) { this.semantic = v; return this; }

        public AgentView build() {
            return new AgentView(this);
        }
    }
}
