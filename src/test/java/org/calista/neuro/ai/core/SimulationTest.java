package org.calista.neuro.ai.core;

import org.calista.neuro.ai.action.Action;
import org.calista.neuro.ai.agent.Agent;
import org.calista.neuro.ai.consciousness.ConsciousnessMode;
import org.calista.neuro.ai.env.Cell;
import org.calista.neuro.ai.env.GridPos;
import org.calista.neuro.ai.env.TestGridWorld;
import org.calista.neuro.ai.env.Weather;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class SimulationTest {

    private AgentConfig cfg;

    @BeforeEach
    void setUp() {
        cfg = new AgentConfig();
        cfg.learner.hidden = new int[]{8};
        cfg.learner.batchSize = 4;
        cfg.learner.replayCapacity = 64;
        cfg.simulation.gridSize = 8;
        cfg.validate();
    }

    private List<Agent> agents(int n) {
        AgentFactory f = new AgentFactory(cfg, null, new Random(5));
        Agent[] out = new Agent[n];
        for (int i = 0; i < n; i++) out[i] = f.create("A" + i, AgentKernel.startOf(i, cfg.simulation.gridSize));
        return List.of(out);
    }

    @Test
    void run_shouldCountOneActionAndModePerAgentTick() {
        TestGridWorld world = new TestGridWorld(8)
                .put(1, 1, Cell.FOOD)
                .put(2, 5, Cell.WATER)
                .put(3, 3, Cell.OBSTACLE)
                .regrow(true)
                .dayLength(10);

        SimulationReport report = new Simulation(world, agents(3), 40).run();

        assertThat(world.tick()).isEqualTo(40);
        assertThat(report.totalActions()).isEqualTo(120);
        assertThat(report.modeTicks().values().stream().mapToLong(Long::longValue).sum()).isEqualTo(120);
        assertThat(report.rewardByAgent()).containsOnlyKeys("A0", "A1", "A2");
    }

    @Test
    void run_shouldSendAgentsToSleepWhenExhausted() {
        cfg.physiology.initialFatigue = 0.95;
        cfg.validate();

        SimulationReport report = new Simulation(new TestGridWorld(8).weather(Weather.SUNNY), agents(1), 1).run();

        assertThat(report.modeTicks()).containsEntry(ConsciousnessMode.ASLEEP, 1L);
        assertThat(report.count(Action.REST)).isEqualTo(1);
    }

    @Test
    void run_shouldHandleZeroTicks() {
        SimulationReport report = new Simulation(new TestGridWorld(4), agents(1), 0).run();

        assertThat(report.totalActions()).isZero();
        assertThat(report.rewardByAgent()).containsEntry("A0", 0.0);
    }

    @Test
    void constructor_shouldRejectNegativeTicks() {
        assertThatThrownBy(() -> new Simulation(new TestGridWorld(4), List.of(), -1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void agents_shouldNeverLeaveTheGrid() {
        List<Agent> agents = agents(2);
        new Simulation(new TestGridWorld(8), agents, 30).run();

        for (Agent a : agents) {
            assertThat(a.position().within(GridPos.of(0, 0), GridPos.of(7, 7))).isTrue();
        }
    }
}
