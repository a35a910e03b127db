package org.calista.neuro.ai.state;

import org.calista.neuro.ai.action.Action;

/**
 * Physiological need. Higher value = more urgent.
 */
public enum Need {
    HUNGER(Action.SEEK_FOOD),
    FATIGUE(Action.REST),
    THIRST(Action.DRINK_WATER);

    private final Action satisfiedBy;

    Need(Action satisfiedBy) {
        this.satisfiedBy = satisfiedBy;
    }

    public Action satisfiedBy() {
        return satisfiedBy;
    }
}
