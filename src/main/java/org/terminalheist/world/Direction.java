package org.terminalheist.world;

import java.util.List;
import java.util.Optional;

public enum Direction {
    UP(0, -1),
    DOWN(0, 1),
    LEFT(-1, 0),
    RIGHT(1, 0);

    /** Fixed visitation order for neighbour scans, BFS expansion and patrol sampling. */
    public static final List<Direction> CARDINALS = List.of(UP, DOWN, LEFT, RIGHT);

    public final int dx;
    public final int dy;

    Direction(int dx, int dy) {
        this.dx = dx;
        this.dy = dy;
    }

    /** The direction of a single cardinal step from {@code from} to {@code to}, if they are adjacent. */
    public static Optional<Direction> between(Pos from, Pos to) {
        for (Direction d : CARDINALS) {
            if (from.step(d).equals(to)) return Optional.of(d);
        }
        return Optional.empty();
    }
}
