package org.calista.neuro.ai.state;

/**
 * Immutable copy of the physiological state, used as "previous state" for reward and learning.
 */
public record PhysiologySnapshot(double hunger, double fatigue, double thirst, double mood) {

    public double level(Need need) {
        return switch (need) {
            case HUNGER -> hunger;
            case FATIGUE -> fatigue;
            case THIRST -> thirst;
        };
    }

    /** Mood mapped from [-1,1] onto [0,1]. */
    public double mood01() {
        return (mood + 1.0) / 2.0;
    }

    public double maxNeed() {
        return Math.max(hunger, Math.max(fatigue, thirst));
    }

    public StateVector toVector() {
        return StateVector.of(hunger, fatigue, thirst);
    }
}
