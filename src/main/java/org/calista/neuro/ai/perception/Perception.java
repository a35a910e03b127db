package org.calista.neuro.ai.perception;

import org.calista.neuro.ai.env.GridPos;
import org.calista.neuro.ai.env.TimeOfDay;
import org.calista.neuro.ai.env.Weather;

import java.util.List;
import java.util.Objects;

/**
 * What the agent believes about its surroundings this tick. Locations are absolute.
 */
public record Perception(long tick,
                         TimeOfDay timeOfDay,
                         Weather weather,
                         boolean foodAvailableGlobal,
                         boolean waterAvailableGlobal,
                         List<GridPos> foodLocations,
                         List<GridPos> waterLocations,
                         List<GridPos> obstacleLocations,
                         List<GridPos> otherAgents) {

    public Perception {
        Objects.requireNonNull(timeOfDay, "timeOfDay");
        Objects.requireNonNull(weather, "weather");
        foodLocations = List.copyOf(foodLocations);
        waterLocations = List.copyOf(waterLocations);
        obstacleLocations = List.copyOf(obstacleLocations);
        otherAgents = List.copyOf(otherAgents);
    }

    public static Perception initial() {
        return new Perception(0, TimeOfDay.DAY, Weather.SUNNY, false, false, List.of(), List.of(), List.of(), List.of());
    }

    public boolean foodInSight() {
        return !foodLocations.isEmpty();
    }

    public boolean waterInSight() {
        return !waterLocations.isEmpty();
    }

    public boolean obstacleInSight() {
        return !obstacleLocations.isEmpty();
    }

    public boolean otherAgentsInSight() {
        return !otherAgents.isEmpty();
    }

    /**
     * Sleeping sense: only the clock and the weather are refreshed, nothing is seen.
     */
    public Perception asleep(long tick, TimeOfDay timeOfDay, Weather weather) {
        return new Perception(tick, timeOfDay, weather, foodAvailableGlobal, waterAvailableGlobal,
                List.of(), List.of(), List.of(), List.of());
    }
}
