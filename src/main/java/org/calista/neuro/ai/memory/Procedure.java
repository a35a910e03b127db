package org.calista.neuro.ai.memory;

import org.calista.neuro.ai.action.Action;

import java.util.Objects;

/**
 * A condition → action habit. Base priority never changes; outcome counts adjust the effective one.
 */
public final class Procedure {

    private final String id;
    private final String name;
    private final ProcedureCondition condition;
    private final Action action;
    private final double basePriority;

    private int successCount;
    private int failureCount;

    Procedure(String id, String name, ProcedureCondition condition, Action action, double basePriority) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = Objects.requireNonNull(name, "name");
        this.condition = Objects.requireNonNull(condition, "condition");
        this.action = Objects.requireNonNull(action, "action");
        if (!(basePriority >= 0.0 && basePriority <= 1.0)) throw new IllegalArgumentException("priority must be in [0,1]");
        this.basePriority = basePriority;
    }

    /** Boosted ×1.1 (capped at 1) when successes dominate, ×0.8 when failures dominate. */
    public double effectivePriority() {
        if (successCount > failureCount && successCount > 0) return Math.min(1.0, basePriority * 1.1);
        if (failureCount > successCount && failureCount > 0) return Math.max(0.0, basePriority * 0.8);
        return basePriority;
    }

    void recordOutcome(boolean success) {
        if (success) successCount++;
        else failureCount++;
    }

    public String id() { return id; }
    public String name() { return name; }
    public ProcedureCondition condition() { return condition; }
    public Action action() { return action; }
    public double basePriority() { return basePriority; }
    public int successCount() { return successCount; }
    public int failureCount() { return failureCount; }

    @Override
    public String toString() {
        return "Procedure{" + id + " '" + name + "' -> " + action
                + ", priority=" + basePriority + ", ok=" + successCount + ", fail=" + failureCount + '}';
    }
}
