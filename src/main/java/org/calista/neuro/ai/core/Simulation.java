package org.calista.neuro.ai.core;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.neuro.ai.action.Action;
import org.calista.neuro.ai.agent.Agent;
import org.calista.neuro.ai.agent.TickResult;
import org.calista.neuro.ai.consciousness.ConsciousnessMode;
import org.calista.neuro.ai.env.Environment;
import org.calista.neuro.ai.env.GridPos;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Turn-based loop: per tick the environment advances once, then every agent
 * runs its full cycle in order. Single-threaded.
 */
public final class Simulation {
    private static final Logger log = LogManager.getLogger(Simulation.class);

    private final Environment env;
    private final List<Agent> agents;
    private final int ticks;
    private final Consumer<TickResult> listener; // nullable

    public Simulation(Environment env, List<Agent> agents, int ticks) {
        this(env, agents, ticks, null);
    }

    public Simulation(Environment env, List<Agent> agents, int ticks, Consumer<TickResult> listener) {
        this.env = Objects.requireNonNull(env, "env");
        this.agents = List.copyOf(Objects.requireNonNull(agents, "agents"));
        if (ticks < 0) throw new IllegalArgumentException("ticks must be >= 0");
        this.ticks = ticks;
        this.listener = listener;
    }

    public SimulationReport run() {
        Map<Action, Long> actions = new EnumMap<>(Action.class);
        Map<ConsciousnessMode, Long> modes = new EnumMap<>(ConsciousnessMode.class);
        Map<String, Double> rewards = new LinkedHashMap<>();
        for (Agent a : agents) rewards.put(a.name(), 0.0);

        log.info("Simulation start: agents={}, ticks={}", agents.size(), ticks);

        for (int t = 0; t < ticks; t++) {
            env.advance();
            for (Agent agent : agents) {
                TickResult r = agent.tick(env, othersOf(agent));

                Action executed = (r.outcome().action() != null) ? r.outcome().action() : r.decision().action();
                actions.merge(executed, 1L, Long::sum);
                modes.merge(r.mode(), 1L, Long::sum);
                rewards.merge(agent.name(), r.reward(), Double::sum);

                if (listener != null) listener.accept(r);
            }
        }

        SimulationReport report = new SimulationReport(ticks, actions, modes, rewards);
        log.info("Simulation done: ticks={}, actions={}, modes={}", ticks, report.actionCounts(), report.modeTicks());
        return report;
    }

    private List<GridPos> othersOf(Agent self) {
        List<GridPos> out = new ArrayList<>(agents.size());
        for (Agent a : agents) {
            if (a != self) out.add(a.position());
        }
        return out;
    }
}
