package org.terminalheist.world;

import org.terminalheist.item.ItemType;

import java.util.Objects;

/**
 * One grid cell. Each variant carries only the state its kind needs; walkability and sight
 * blocking depend on nothing else.
 */
public sealed interface Tile
        permits Tile.Floor, Tile.Wall, Tile.Door, Tile.Exit, Tile.Hazard, Tile.SlowTerrain, Tile.Pickup {

    Floor FLOOR = new Floor();
    Wall WALL = new Wall();
    Exit EXIT = new Exit();
    Door CLOSED_DOOR = new Door(false);
    Door OPEN_DOOR = new Door(true);
    Hazard ARMED_HAZARD = new Hazard(true);
    Hazard DISARMED_HAZARD = new Hazard(false);

    TileKind kind();

    boolean walkable();

    boolean blocksSight();

    char glyph();

    /** Turns it costs to enter this tile; only slow terrain costs more than one. */
    default int moveCost() {
        return 1;
    }

    record Floor() implements Tile {
        public TileKind kind() { return TileKind.FLOOR; }
        public boolean walkable() { return true; }
        public boolean blocksSight() { return false; }
        public char glyph() { return '.'; }
    }

    record Wall() implements Tile {
        public TileKind kind() { return TileKind.WALL; }
        public boolean walkable() { return false; }
        public boolean blocksSight() { return true; }
        public char glyph() { return '#'; }
    }

    record Door(boolean open) implements Tile {
        public TileKind kind() { return TileKind.DOOR; }
        public boolean walkable() { return open; }
        public boolean blocksSight() { return !open; }
        public char glyph() { return open ? '/' : '+'; }
    }

    record Exit() implements Tile {
        public TileKind kind() { return TileKind.EXIT; }
        public boolean walkable() { return true; }
        public boolean blocksSight() { return false; }
        public char glyph() { return '>'; }
    }

    record Hazard(boolean armed) implements Tile {
        public TileKind kind() { return TileKind.HAZARD; }
        public boolean walkable() { return true; }
        public boolean blocksSight() { return false; }
        public char glyph() { return armed ? '^' : '_'; }
    }

    record SlowTerrain(int cost) implements Tile {
        public SlowTerrain {
            if (cost < 2) throw new IllegalArgumentException("slow terrain cost must be >= 2, got " + cost);
        }

        public TileKind kind() { return TileKind.SLOW; }
        public boolean walkable() { return true; }
        public boolean blocksSight() { return false; }
        public char glyph() { return '~'; }

        @Override
        public int moveCost() {
            return cost;
        }
    }

    record Pickup(ItemType item) implements Tile {
        public Pickup {
            Objects.requireNonNull(item, "item");
        }

        public TileKind kind() { return TileKind.PICKUP; }
        public boolean walkable() { return true; }
        public boolean blocksSight() { return false; }
        public char glyph() { return item.glyph; }
    }

    static Pickup pickup(ItemType item) {
        return new Pickup(item);
    }

    static SlowTerrain slow(int cost) {
        return new SlowTerrain(cost);
    }

    /**
     * Inverse of {@link #glyph()}. Slow terrain parses with the given cost.
     *
     * @throws IllegalArgumentException for an unknown glyph
     */
    static Tile fromGlyph(char c, int slowCost) {
        return switch (c) {
            case '.', ' ' -> FLOOR;
            case '#' -> WALL;
            case '+' -> CLOSED_DOOR;
            case '/' -> OPEN_DOOR;
            case '>' -> EXIT;
            case '^' -> ARMED_HAZARD;
            case '_' -> DISARMED_HAZARD;
            case '~' -> slow(slowCost);
            default -> {
                ItemType item = ItemType.fromGlyph(c);
                if (item == null) throw new IllegalArgumentException("unknown tile glyph '" + c + "'");
                yield pickup(item);
            }
        };
    }
}
