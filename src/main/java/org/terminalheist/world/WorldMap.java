package org.terminalheist.world;

import java.util.List;

/**
 * Read-only view of a floor's tiles, handed to renderers and other observers.
 */
public interface WorldMap {
    int width();
    int height();

    boolean inBounds(Pos p);
    boolean isWalkable(Pos p);
    boolean blocksSight(Pos p);

    Tile tile(Pos p);

    List<Pos> neighbors4(Pos p);

    boolean lineOfSight(Pos a, Pos b);

    /** One text row per grid row, newline separated, using {@link Tile#glyph()}. */
    String toAscii();

    default boolean inBounds(int x, int y) {
        return inBounds(new Pos(x, y));
    }

    default Tile tile(int x, int y) {
        return tile(new Pos(x, y));
    }

    default boolean isWalkable(int x, int y) {
        return isWalkable(new Pos(x, y));
    }
}
