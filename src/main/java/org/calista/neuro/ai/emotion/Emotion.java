package org.calista.neuro.ai.emotion;

public enum Emotion {
    JOY,
    FEAR,
    CURIOSITY,
    FRUSTRATION
}
