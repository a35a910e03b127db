package org.calista.neuro.ai.emotion;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Emotion values, each clamped to [0,1].
 */
public final class EmotionState {

    private final EnumMap<Emotion, Double> values = new EnumMap<>(Emotion.class);

    public EmotionState() {
        values.put(Emotion.JOY, 0.5);
        values.put(Emotion.FEAR, 0.0);
        values.put(Emotion.CURIOSITY, 0.5);
        values.put(Emotion.FRUSTRATION, 0.0);
    }

    private EmotionState(Map<Emotion, Double> src) {
        values.putAll(src);
    }

    public double get(Emotion e) {
        return values.getOrDefault(Objects.requireNonNull(e, "emotion"), 0.0);
    }

    public void set(Emotion e, double v) {
        Objects.requireNonNull(e, "emotion");
        values.put(e, Double.isFinite(v) ? Math.max(0.0, Math.min(1.0, v)) : 0.0);
    }

    public void add(Emotion e, double delta) {
        set(e, get(e) + delta);
    }

    /** Strongest single emotion; weighs episodic memories. */
    public double intensity() {
        double m = 0.0;
        for (double v : values.values()) m = Math.max(m, v);
        return m;
    }

    public EmotionState copy() {
        return new EmotionState(values);
    }

    public Map<Emotion, Double> asMap() {
        return Map.copyOf(values);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<Emotion, Double> e : values.entrySet()) {
            if (sb.length() > 0) sb.append(", ");
            sb.append(e.getKey().name().toLowerCase(Locale.ROOT))
                    .append(": ")
                    .append(String.format(Locale.ROOT, "%.2f", e.getValue()));
        }
        return sb.toString();
    }
}
