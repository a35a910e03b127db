package org.calista.neuro.ai.env;

public enum Weather {
    SUNNY,
    RAINY,
    STORMY
}
