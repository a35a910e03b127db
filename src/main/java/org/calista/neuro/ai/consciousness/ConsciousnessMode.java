package org.calista.neuro.ai.consciousness;

public enum ConsciousnessMode {
    AWAKE,
    ASLEEP,
    FOCUSED
}
