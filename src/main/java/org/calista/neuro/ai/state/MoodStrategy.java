package org.calista.neuro.ai.state;

/** Derives a mood scalar in [-1,1] from the needs. */
@FunctionalInterface
public interface MoodStrategy {
    double mood(double hunger, double fatigue, double thirst);
}
