package org.calista.neuro.ai.state;

import java.util.Locale;
import java.util.Objects;

/**
 * Hunger / fatigue / thirst in [0,1] and the mood derived from them.
 * Owned by exactly one agent.
 */
public final class PhysiologicalState {

    private final MoodStrategy moodStrategy;
    private final double hungerRate;
    private final double fatigueRate;
    private final double thirstRate;

    private double hunger;
    private double fatigue;
    private double thirst;
    private double mood;

    public PhysiologicalState(MoodStrategy moodStrategy,
                              double hungerRate,
                              double fatigueRate,
                              double thirstRate,
                              double hunger,
                              double fatigue,
                              double thirst) {
        this.moodStrategy = Objects.requireNonNull(moodStrategy, "moodStrategy");
        if (hungerRate < 0 || fatigueRate < 0 || thirstRate < 0) {
            throw new IllegalArgumentException("need rates must be >= 0");
        }
        this.hungerRate = hungerRate;
        this.fatigueRate = fatigueRate;
        this.thirstRate = thirstRate;
        this.hunger = clamp01(hunger);
        this.fatigue = clamp01(fatigue);
        this.thirst = clamp01(thirst);
        recomputeMood();
    }

    /**
     * Needs grow by their per-tick rate times {@code timeScale} (1.5 at night), then mood is recomputed.
     */
    public void update(double timeScale) {
        double s = Double.isFinite(timeScale) && timeScale > 0 ? timeScale : 1.0;
        hunger = clamp01(hunger + hungerRate * s);
        fatigue = clamp01(fatigue + fatigueRate * s);
        thirst = clamp01(thirst + thirstRate * s);
        recomputeMood();
    }

    /** Adds {@code delta} (may be negative) to one need, clamped. */
    public void adjust(Need need, double delta) {
        switch (need) {
            case HUNGER -> hunger = clamp01(hunger + delta);
            case FATIGUE -> fatigue = clamp01(fatigue + delta);
            case THIRST -> thirst = clamp01(thirst + delta);
        }
        recomputeMood();
    }

    public PhysiologySnapshot snapshot() {
        return new PhysiologySnapshot(hunger, fatigue, thirst, mood);
    }

    public double level(Need need) {
        return switch (need) {
            case HUNGER -> hunger;
            case FATIGUE -> fatigue;
            case THIRST -> thirst;
        };
    }

    public double hunger() { return hunger; }
    public double fatigue() { return fatigue; }
    public double thirst() { return thirst; }
    public double mood() { return mood; }

    private void recomputeMood() {
        mood = moodStrategy.mood(hunger, fatigue, thirst);
    }

    private static double clamp01(double x) {
        if (!Double.isFinite(x)) return 0.0;
        return Math.max(0.0, Math.min(1.0, x));
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "Hunger: %.2f, Fatigue: %.2f, Thirst: %.2f, Mood: %.2f",
                hunger, fatigue, thirst, mood);
    }
}
