package org.calista.neuro.ai.action;

import org.calista.neuro.ai.env.Direction;

import java.util.Locale;
import java.util.Optional;

/**
 * Action set of an agent. Declaration order is the output order of the value network.
 */
public enum Action {
    SEEK_FOOD("seek_food"),
    REST("rest"),
    EXPLORE("explore"),
    MOVE_UP("move_up"),
    MOVE_DOWN("move_down"),
    MOVE_LEFT("move_left"),
    MOVE_RIGHT("move_right"),
    MOVE_OBJECT("move_object"),
    DRINK_WATER("drink_water");

    private final String id;

    Action(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public boolean isMove() {
        return this == MOVE_UP || this == MOVE_DOWN || this == MOVE_LEFT || this == MOVE_RIGHT;
    }

    /** Moves and object pushing: actions that already commit the agent to a spatial plan. */
    public boolean isSpatial() {
        return isMove() || this == MOVE_OBJECT;
    }

    public Optional<Direction> direction() {
        return switch (this) {
            case MOVE_UP -> Optional.of(Direction.UP);
            case MOVE_DOWN -> Optional.of(Direction.DOWN);
            case MOVE_LEFT -> Optional.of(Direction.LEFT);
            case MOVE_RIGHT -> Optional.of(Direction.RIGHT);
            default -> Optional.empty();
        };
    }

    public static Action move(Direction d) {
        return switch (d) {
            case UP -> MOVE_UP;
            case DOWN -> MOVE_DOWN;
            case LEFT -> MOVE_LEFT;
            case RIGHT -> MOVE_RIGHT;
        };
    }

    /** Lenient lookup by wire id ("seek_food") or enum name; empty for anything unknown. */
    public static Optional<Action> fromId(String id) {
        if (id == null || id.isBlank()) return Optional.empty();
        String k = id.trim().toLowerCase(Locale.ROOT);
        for (Action a : values()) {
            if (a.id.equals(k)) return Optional.of(a);
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return id;
    }
}
