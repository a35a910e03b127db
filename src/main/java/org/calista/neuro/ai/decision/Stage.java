package org.calista.neuro.ai.decision;

/** Arbitration stage that produced the final action, in precedence order. */
public enum Stage {
    CRITICAL,
    PROCEDURAL,
    LEARNER,
    GOAL,
    MEMORY,
    MODIFIER,
    /** Forced by the consciousness state, the arbiter was not consulted (sleep). */
    FORCED,
    /** Focused state re-aimed the arbiter's action. */
    FOCUS
}
