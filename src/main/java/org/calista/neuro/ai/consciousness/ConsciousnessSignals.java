package org.calista.neuro.ai.consciousness;

/**
 * Inputs of the transition guards, sampled once per tick.
 *
 * @param fatigue    current fatigue
 * @param maxNeed    largest of hunger, fatigue and thirst
 * @param urgentGoal an open goal is at or above the focus priority
 */
public record ConsciousnessSignals(double fatigue, double maxNeed, boolean urgentGoal) {
}
