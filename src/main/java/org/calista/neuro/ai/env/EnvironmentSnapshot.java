package org.calista.neuro.ai.env;

import java.util.Objects;

/**
 * Read-only view of the world handed to an agent once per tick.
 *
 * <p>The local view is a {@code (2r+1) x (2r+1)} square centred on the agent,
 * row-major, {@link Cell#BOUNDARY} outside the grid. The array is copied on the
 * way in and on the way out.</p>
 */
public final class EnvironmentSnapshot {

    private final long tick;
    private final TimeOfDay timeOfDay;
    private final Weather weather;
    private final boolean foodAvailable;
    private final boolean waterAvailable;
    private final GridPos center;
    private final int radius;
    private final Cell[][] local;

    public EnvironmentSnapshot(long tick,
                               TimeOfDay timeOfDay,
                               Weather weather,
                               boolean foodAvailable,
                               boolean waterAvailable,
                               GridPos center,
                               Cell[][] local) {
        this.tick = tick;
        this.timeOfDay = Objects.requireNonNull(timeOfDay, "timeOfDay");
        this.weather = Objects.requireNonNull(weather, "weather");
        this.foodAvailable = foodAvailable;
        this.waterAvailable = waterAvailable;
        this.center = Objects.requireNonNull(center, "center");
        Objects.requireNonNull(local, "local");
        if (local.length == 0 || local.length % 2 == 0 || local[0].length != local.length) {
            throw new IllegalArgumentException("local view must be an odd square, got " + local.length);
        }
        this.radius = local.length / 2;
        this.local = new Cell[local.length][];
        for (int i = 0; i < local.length; i++) this.local[i] = local[i].clone();
    }

    public long tick() { return tick; }
    public TimeOfDay timeOfDay() { return timeOfDay; }
    public Weather weather() { return weather; }
    public boolean foodAvailable() { return foodAvailable; }
    public boolean waterAvailable() { return waterAvailable; }
    public GridPos center() { return center; }
    public int radius() { return radius; }

    /** Cell at row/column offset from the centre, each in {@code [-radius, radius]}. */
    public Cell cellAtOffset(int dr, int dc) {
        if (Math.abs(dr) > radius || Math.abs(dc) > radius) {
            throw new IndexOutOfBoundsException("offset (" + dr + "," + dc + ") outside radius " + radius);
        }
        return local[dr + radius][dc + radius];
    }

    public Cell[][] localView() {
        Cell[][] out = new Cell[local.length][];
        for (int i = 0; i < local.length; i++) out[i] = local[i].clone();
        return out;
    }
}
