package org.calista.neuro.ai.decision;

/**
 * Arbitration thresholds.
 *
 * @param critical             need level above which its satisfying action wins outright
 * @param proceduralReactive   procedure priority needed in reactive mode
 * @param proceduralDeliberate procedure priority needed in deliberative mode
 * @param goalParentBoost      share of an open parent's priority added to a sub-goal
 * @param goalSuggestFraction  fraction of a maintain-need threshold at which the satisfying action is suggested
 * @param memoryNeed           need level that makes memory refinement look for help
 * @param memoryRecentTicks    how old a working-memory percept may be
 * @param curiosity            curiosity that triggers exploratory movement
 * @param calmNeedCeiling      every need must be below this for curiosity to act
 * @param rainExploreChance    chance that rain talks the agent out of exploring
 * @param rainFatigueCeiling   below this fatigue rain means rest, otherwise food
 * @param crowdHunger          hunger above which other agents in sight turn exploring into seeking food
 */
public record ArbiterSettings(double critical,
                              double proceduralReactive,
                              double proceduralDeliberate,
                              double goalParentBoost,
                              double goalSuggestFraction,
                              double memoryNeed,
                              int memoryRecentTicks,
                              double curiosity,
                              double calmNeedCeiling,
                              double rainExploreChance,
                              double rainFatigueCeiling,
                              double crowdHunger) {

    public ArbiterSettings {
        unit("critical", critical);
        unit("proceduralReactive", proceduralReactive);
        unit("proceduralDeliberate", proceduralDeliberate);
        unit("goalParentBoost", goalParentBoost);
        unit("goalSuggestFraction", goalSuggestFraction);
        unit("memoryNeed", memoryNeed);
        unit("curiosity", curiosity);
        unit("calmNeedCeiling", calmNeedCeiling);
        unit("rainExploreChance", rainExploreChance);
        unit("rainFatigueCeiling", rainFatigueCeiling);
        unit("crowdHunger", crowdHunger);
        if (memoryRecentTicks < 0) throw new IllegalArgumentException("memoryRecentTicks must be >= 0");
    }

    public static ArbiterSettings defaults() {
        return new ArbiterSettings(0.85, 0.7, 0.9, 0.1, 0.8, 0.6, 3, 0.6, 0.7, 0.5, 0.8, 0.5);
    }

    public double proceduralThreshold(DecisionMode mode) {
        return mode == DecisionMode.REACTIVE ? proceduralReactive : proceduralDeliberate;
    }

    private static void unit(String name, double v) {
        if (!(v >= 0.0 && v <= 1.0)) throw new IllegalArgumentException(name + " must be in [0,1], got " + v);
    }
}
