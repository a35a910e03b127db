package org.calista.neuro.ai.state;

/**
 * Weighted sum of inverted needs, rescaled from [0,1] to [-1,1].
 * Weights must sum to 1.
 */
public final class BasicMoodStrategy implements MoodStrategy {

    private final double hungerWeight;
    private final double fatigueWeight;
    private final double thirstWeight;

    public BasicMoodStrategy() {
        this(0.4, 0.3, 0.3);
    }

    public BasicMoodStrategy(double hungerWeight, double fatigueWeight, double thirstWeight) {
        if (hungerWeight < 0 || fatigueWeight < 0 || thirstWeight < 0) {
            throw new IllegalArgumentException("mood weights must be >= 0");
        }
        double sum = hungerWeight + fatigueWeight + thirstWeight;
        if (!(sum > 0.0)) throw new IllegalArgumentException("mood weights must not all be 0");
        this.hungerWeight = hungerWeight / sum;
        this.fatigueWeight = fatigueWeight / sum;
        this.thirstWeight = thirstWeight / sum;
    }

    @Override
    public double mood(double hunger, double fatigue, double thirst) {
        double raw = (1.0 - hunger) * hungerWeight
                + (1.0 - fatigue) * fatigueWeight
                + (1.0 - thirst) * thirstWeight;
        return Math.max(-1.0, Math.min(1.0, raw * 2.0 - 1.0));
    }
}
