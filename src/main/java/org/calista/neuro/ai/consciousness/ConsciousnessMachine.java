package org.calista.neuro.ai.consciousness;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Exactly one active {@link ConsciousnessState} per agent. Transitions are checked once per tick
 * and run exit → switch → enter atomically.
 */
public final class ConsciousnessMachine {
    private static final Logger log = LogManager.getLogger(ConsciousnessMachine.class);

    private final TransitionTable table;
    private final EnumMap<ConsciousnessMode, ConsciousnessState> states;
    private ConsciousnessState current;

    public ConsciousnessMachine(TransitionTable table, Map<ConsciousnessMode, ConsciousnessState> states, ConsciousnessMode initial) {
        this.table = Objects.requireNonNull(table, "table");
        Objects.requireNonNull(states, "states");
        this.states = new EnumMap<>(ConsciousnessMode.class);
        for (ConsciousnessMode m : ConsciousnessMode.values()) {
            ConsciousnessState s = states.get(m);
            if (s == null) throw new IllegalArgumentException("no state for mode " + m);
            if (s.mode() != m) throw new IllegalArgumentException("state " + s + " registered as " + m);
            this.states.put(m, s);
        }
        this.current = this.states.get(Objects.requireNonNull(initial, "initial"));
    }

    public static ConsciousnessMachine standard(ConsciousnessSettings settings) {
        Map<ConsciousnessMode, ConsciousnessState> m = new EnumMap<>(ConsciousnessMode.class);
        m.put(ConsciousnessMode.AWAKE, new AwakeState(settings));
        m.put(ConsciousnessMode.ASLEEP, new AsleepState());
        m.put(ConsciousnessMode.FOCUSED, new FocusedState(settings));
        return new ConsciousnessMachine(TransitionTable.standard(settings), m, ConsciousnessMode.AWAKE);
    }

    /** Runs the initial state's enter hook. */
    public void start(ConsciousHost host) {
        current.enter(host);
    }

    /**
     * @return the new mode if a transition happened
     */
    public Optional<ConsciousnessMode> evaluate(ConsciousnessSignals signals, ConsciousHost host) {
        Optional<TransitionTable.Row> row = table.next(current.mode(), signals);
        if (row.isEmpty()) return Optional.empty();

        ConsciousnessState from = current;
        ConsciousnessState to = states.get(row.get().to());
        from.exit(host);
        current = to;
        to.enter(host);
        log.info("{} changed consciousness state from {} to {} ({}) at tick {}",
                host.name(), from.mode(), to.mode(), row.get().guard(), host.tick());
        return Optional.of(to.mode());
    }

    public ConsciousnessState current() {
        return current;
    }

    public ConsciousnessMode mode() {
        return current.mode();
    }
}
