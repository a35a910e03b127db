package org.calista.neuro.ai.decision;

/**
 * Reactive: fast, habit-driven, goals and memory are not consulted.
 * Deliberative: the full precedence chain runs.
 */
public enum DecisionMode {
    REACTIVE,
    DELIBERATIVE
}
