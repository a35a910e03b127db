package org.calista.neuro.ai.core;

import org.calista.neuro.ai.action.Action;
import org.calista.neuro.ai.consciousness.ConsciousnessMode;

import java.util.Map;

/**
 * Totals of one {@link Simulation#run()}.
 *
 * @param actionCounts  executed actions over all agents
 * @param modeTicks     agent-ticks spent in each consciousness mode
 * @param rewardByAgent sum of shaped rewards per agent name
 */
public record SimulationReport(long ticks,
                               Map<Action, Long> actionCounts,
                               Map<ConsciousnessMode, Long> modeTicks,
                               Map<String, Double> rewardByAgent) {

    public SimulationReport {
        actionCounts = Map.copyOf(actionCounts);
        modeTicks = Map.copyOf(modeTicks);
        rewardByAgent = Map.copyOf(rewardByAgent);
    }

    public long count(Action a) {
        return actionCounts.getOrDefault(a, 0L);
    }

    public long totalActions() {
        long n = 0;
        for (long c : actionCounts.values()) n += c;
        return n;
    }
}
