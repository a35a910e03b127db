package org.calista.neuro.ai.action;

/**
 * Mood-modulated reward: a good mood amplifies gains and softens penalties,
 * a bad mood does the opposite. Mood is expected in [0,1].
 */
public final class RewardShaper {

    private final double highMood;
    private final double lowMood;

    public RewardShaper() {
        this(0.7, 0.3);
    }

    public RewardShaper(double highMood, double lowMood) {
        if (lowMood < 0 || highMood > 1 || lowMood >= highMood) {
            throw new IllegalArgumentException("need 0 <= lowMood < highMood <= 1");
        }
        this.highMood = highMood;
        this.lowMood = lowMood;
    }

    public double shape(double rawReward, double mood01) {
        if (mood01 > highMood) {
            if (rawReward > 0) return rawReward * 1.2;
            if (rawReward < 0) return rawReward * 0.8;
        } else if (mood01 < lowMood) {
            if (rawReward > 0) return rawReward * 0.7;
            if (rawReward < 0) return rawReward * 1.3;
        }
        return rawReward;
    }
}
