package org.terminalheist.world;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Rejects floors that cannot be finished. Checks that the objective and exit are reachable
 * (doors count as passable, they can be opened) and, when any closed door exists, that a key can
 * be picked up without going through a door first.
 */
public final class PlacementValidator {

    private PlacementValidator() {}

    /**
     * @return the first problem found, or empty when the layout is solvable
     */
    public static Optional<String> validate(WorldMap grid, Pos start, Pos objective, Pos exit, List<Pos> keys) {
        if (Pathfinder.shortestPath(grid, p -> passableWithDoors(grid, p), start, objective).isEmpty()) {
            return Optional.of("objective " + objective + " unreachable from start " + start);
        }
        if (Pathfinder.shortestPath(grid, p -> passableWithDoors(grid, p), objective, exit).isEmpty()) {
            return Optional.of("exit " + exit + " unreachable from objective " + objective);
        }

        if (!hasClosedDoor(grid)) return Optional.empty();
        if (keys.isEmpty()) return Optional.of("doors present but no key placed");

        Set<Pos> noDoors = Pathfinder.reachable(grid, grid::isWalkable, start);
        for (Pos key : keys) {
            if (noDoors.contains(key)) return Optional.empty();
        }
        return Optional.of("no key reachable from start without crossing a door");
    }

    /** Anything but walls; closed doors are assumed openable. */
    static boolean passableWithDoors(WorldMap grid, Pos p) {
        return grid.inBounds(p) && grid.tile(p).kind() != TileKind.WALL;
    }

    private static boolean hasClosedDoor(WorldMap grid) {
        for (int y = 0; y < grid.height(); y++)
            for (int x = 0; x < grid.width(); x++)
                if (grid.tile(x, y).equals(Tile.CLOSED_DOOR)) return true;
        return false;
    }
}
