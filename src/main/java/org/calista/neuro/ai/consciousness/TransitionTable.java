package org.calista.neuro.ai.consciousness;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * (current mode × guard) → next mode.
 *
 * <p>Guards leaving one mode are written to be mutually exclusive; {@link #next}
 * rejects a table where two of them hold at once.</p>
 */
public final class TransitionTable {

    public record Row(ConsciousnessMode from, String guard, Predicate<ConsciousnessSignals> when, ConsciousnessMode to) {
        public Row {
            Objects.requireNonNull(from, "from");
            Objects.requireNonNull(guard, "guard");
            Objects.requireNonNull(when, "when");
            Objects.requireNonNull(to, "to");
            if (from == to) throw new IllegalArgumentException("self transition: " + from);
        }
    }

    private final List<Row> rows;

    public TransitionTable(List<Row> rows) {
        this.rows = List.copyOf(Objects.requireNonNull(rows, "rows"));
    }

    /**
     * Standard table:
     * <pre>
     * AWAKE   fatigue > sleep                      → ASLEEP
     * AWAKE   fatigue ≤ sleep and (need > focus or urgent goal) → FOCUSED
     * ASLEEP  fatigue &lt; wake                       → AWAKE
     * FOCUSED fatigue > sleep                      → ASLEEP
     * FOCUSED fatigue ≤ sleep and trigger resolved → AWAKE
     * </pre>
     */
    public static TransitionTable standard(ConsciousnessSettings s) {
        Objects.requireNonNull(s, "settings");
        Predicate<ConsciousnessSignals> sleepy = sig -> sig.fatigue() > s.sleepFatigue();
        Predicate<ConsciousnessSignals> triggered = sig -> sig.maxNeed() > s.focusNeed() || sig.urgentGoal();

        List<Row> rows = new ArrayList<>();
        rows.add(new Row(ConsciousnessMode.AWAKE, "fatigue > " + s.sleepFatigue(), sleepy, ConsciousnessMode.ASLEEP));
        rows.add(new Row(ConsciousnessMode.AWAKE, "urgent need or goal", sleepy.negate().and(triggered), ConsciousnessMode.FOCUSED));
        rows.add(new Row(ConsciousnessMode.ASLEEP, "fatigue < " + s.wakeFatigue(), sig -> sig.fatigue() < s.wakeFatigue(), ConsciousnessMode.AWAKE));
        rows.add(new Row(ConsciousnessMode.FOCUSED, "fatigue > " + s.sleepFatigue(), sleepy, ConsciousnessMode.ASLEEP));
        rows.add(new Row(ConsciousnessMode.FOCUSED, "trigger resolved", sleepy.negate().and(triggered.negate()), ConsciousnessMode.AWAKE));
        return new TransitionTable(rows);
    }

    /**
     * @return the row whose guard holds for {@code from}, empty to stay
     * @throws IllegalStateException if more than one guard holds
     */
    public Optional<Row> next(ConsciousnessMode from, ConsciousnessSignals signals) {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(signals, "signals");
        Row hit = null;
        for (Row r : rows) {
            if (r.from() != from || !r.when().test(signals)) continue;
            if (hit != null) {
                throw new IllegalStateException("ambiguous transition from " + from + ": '"
                        + hit.guard() + "' and '" + r.guard() + "' both hold for " + signals);
            }
            hit = r;
        }
        return Optional.ofNullable(hit);
    }

    public List<Row> rows() {
        return rows;
    }
}
