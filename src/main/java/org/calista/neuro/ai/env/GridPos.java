package org.calista.neuro.ai.env;

/**
 * Grid coordinate. {@code x} is the row index (grows "down"), {@code y} the column index (grows "right").
 */
public record GridPos(int x, int y) {

    public static GridPos of(int x, int y) {
        return new GridPos(x, y);
    }

    public GridPos step(Direction d) {
        return new GridPos(x + d.dx, y + d.dy);
    }

    public int manhattan(GridPos other) {
        return Math.abs(x - other.x) + Math.abs(y - other.y);
    }

    /** Chebyshev distance: 1 for the eight neighbours. */
    public int chebyshev(GridPos other) {
        return Math.max(Math.abs(x - other.x), Math.abs(y - other.y));
    }

    /** True if this cell lies inside the axis-aligned box spanned by {@code a} and {@code b}. */
    public boolean within(GridPos a, GridPos b) {
        return Math.min(a.x, b.x) <= x && x <= Math.max(a.x, b.x)
                && Math.min(a.y, b.y) <= y && y <= Math.max(a.y, b.y);
    }

    @Override
    public String toString() {
        return "(" + x + "," + y + ")";
    }
}
