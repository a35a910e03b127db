package org.calista.neuro.ai.emotion;

import org.calista.neuro.ai.env.TimeOfDay;
import org.calista.neuro.ai.state.PhysiologySnapshot;

import java.util.Objects;

/**
 * Rule-based emotions:
 * joy rises with food and decays with hunger, fear grows at night,
 * frustration follows unmet needs, curiosity spikes when the body is content.
 */
public final class BasicEmotionStrategy implements EmotionStrategy {

    private static final double JOY_FOOD_BOOST = 0.1;
    private static final double JOY_HUNGER_DECAY = 0.05;
    private static final double FEAR_NIGHT_INCREASE = 0.1;
    private static final double FEAR_DAY_DECREASE = 0.05;
    private static final double FRUSTRATION_SCALE = 0.6;
    private static final double CURIOSITY_HIGH = 0.8;
    private static final double CURIOSITY_LOW = 0.2;
    private static final double CURIOSITY_NEED_THRESHOLD = 0.3;

    @Override
    public void update(EmotionState emotions, boolean foodAvailable, TimeOfDay timeOfDay, PhysiologySnapshot body) {
        Objects.requireNonNull(emotions, "emotions");
        Objects.requireNonNull(timeOfDay, "timeOfDay");
        Objects.requireNonNull(body, "body");

        if (foodAvailable) emotions.add(Emotion.JOY, JOY_FOOD_BOOST);
        else emotions.add(Emotion.JOY, -body.hunger() * JOY_HUNGER_DECAY);

        if (timeOfDay == TimeOfDay.NIGHT) emotions.add(Emotion.FEAR, FEAR_NIGHT_INCREASE);
        else emotions.add(Emotion.FEAR, -FEAR_DAY_DECREASE);

        emotions.set(Emotion.FRUSTRATION, FRUSTRATION_SCALE * (body.hunger() + body.fatigue()) / 2.0);

        boolean content = body.hunger() < CURIOSITY_NEED_THRESHOLD && body.fatigue() < CURIOSITY_NEED_THRESHOLD;
        emotions.set(Emotion.CURIOSITY, content ? CURIOSITY_HIGH : CURIOSITY_LOW);
    }
}
