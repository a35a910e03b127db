package org.calista.neuro.ai.consciousness;

/**
 * Mode transition and per-mode behaviour thresholds.
 *
 * @param sleepFatigue      fatigue above which the agent falls asleep
 * @param wakeFatigue       fatigue below which a sleeping agent wakes
 * @param focusNeed         a need above this makes an awake agent focus
 * @param focusGoalPriority an open goal at or above this priority makes an awake agent focus
 * @param reactiveNeed      a need above this switches awake decisions to reactive
 * @param awakeFocusBoost   perception bonus for the attended stimulus while awake
 * @param focusedBoost      perception bonus for the attended stimulus while focused
 * @param focusRecallTicks  how old a remembered resource may be for focused steering
 * @param focusNeedFloor    focus on a need only steers while that need is above this
 */
public record ConsciousnessSettings(double sleepFatigue,
                                    double wakeFatigue,
                                    double focusNeed,
                                    double focusGoalPriority,
                                    double reactiveNeed,
                                    double awakeFocusBoost,
                                    double focusedBoost,
                                    int focusRecallTicks,
                                    double focusNeedFloor) {

    public ConsciousnessSettings {
        if (!(wakeFatigue >= 0.0 && wakeFatigue < sleepFatigue && sleepFatigue <= 1.0)) {
            throw new IllegalArgumentException("need 0 <= wakeFatigue < sleepFatigue <= 1");
        }
        if (focusRecallTicks < 0) throw new IllegalArgumentException("focusRecallTicks must be >= 0");
    }

    public static ConsciousnessSettings defaults() {
        return new ConsciousnessSettings(0.9, 0.2, 0.7, 0.95, 0.8, 0.2, 0.3, 5, 0.3);
    }
}
