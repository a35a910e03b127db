package org.calista.neuro.ai.env;

public enum TimeOfDay {
    DAY,
    NIGHT
}
