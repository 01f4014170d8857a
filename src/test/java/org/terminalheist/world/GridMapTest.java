package org.terminalheist.world;

import org.terminalheist.item.ItemType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GridMapTest {

    @Nested
    @DisplayName("bounds and walkability")
    class BoundsTests {

        @Test
        @DisplayName("fresh grid is all floor")
        void freshGridIsFloor() {
            GridMap g = new GridMap(4, 3);
            assertEquals(12, g.countOf(TileKind.FLOOR));
            assertTrue(g.isWalkable(Pos.of(3, 2)));
        }

        @Test
        @DisplayName("out of bounds is never walkable and reads as wall")
        void outOfBoundsNotWalkable() {
            GridMap g = new GridMap(4, 3);
            assertFalse(g.inBounds(Pos.of(-1, 0)));
            assertFalse(g.inBounds(Pos.of(4, 0)));
            assertFalse(g.inBounds(Pos.of(0, 3)));
            assertFalse(g.isWalkable(Pos.of(4, 0)));
            assertEquals(TileKind.WALL, g.tile(Pos.of(-1, -1)).kind());
        }

        @Test
        @DisplayName("walkability follows tile kind and door state")
        void walkabilityPerKind() {
            assertTrue(Tile.FLOOR.walkable());
            assertFalse(Tile.WALL.walkable());
            assertFalse(Tile.CLOSED_DOOR.walkable());
            assertTrue(Tile.OPEN_DOOR.walkable());
            assertTrue(Tile.EXIT.walkable());
            assertTrue(Tile.ARMED_HAZARD.walkable());
            assertTrue(Tile.DISARMED_HAZARD.walkable());
            assertTrue(Tile.slow(3).walkable());
            assertTrue(Tile.pickup(ItemType.KEYCARD).walkable());
        }

        @Test
        @DisplayName("slow terrain below cost 2 is rejected")
        void slowTerrainCostValidated() {
            assertThrows(IllegalArgumentException.class, () -> Tile.slow(1));
        }
    }

    @Nested
    @DisplayName("setTile")
    class SetTileTests {

        @Test
        @DisplayName("writes inside the grid")
        void writesInside() {
            GridMap g = new GridMap(3, 3);
            assertTrue(g.setTile(Pos.of(1, 1), Tile.WALL));
            assertEquals(Tile.WALL, g.tile(Pos.of(1, 1)));
        }

        @Test
        @DisplayName("out-of-bounds write is a reported no-op")
        void outOfBoundsWriteIgnored() {
            GridMap g = new GridMap(3, 3);
            long before = g.layoutHash();
            assertFalse(g.setTile(Pos.of(3, 0), Tile.WALL));
            assertFalse(g.setTile(-1, 2, Tile.WALL));
            assertEquals(before, g.layoutHash());
        }
    }

    @Nested
    @DisplayName("neighbors4")
    class NeighborTests {

        @Test
        @DisplayName("interior cell has four neighbours in fixed order")
        void interior() {
            GridMap g = new GridMap(3, 3);
            assertEquals(List.of(Pos.of(1, 0), Pos.of(1, 2), Pos.of(0, 1), Pos.of(2, 1)), g.neighbors4(Pos.of(1, 1)));
        }

        @Test
        @DisplayName("corner and edge cells are bounds-filtered")
        void edges() {
            GridMap g = new GridMap(3, 3);
            assertEquals(List.of(Pos.of(0, 1), Pos.of(1, 0)), g.neighbors4(Pos.of(0, 0)));
            assertEquals(3, g.neighbors4(Pos.of(2, 1)).size());
        }
    }

    @Nested
    @DisplayName("lineOfSight")
    class LineOfSightTests {

        @Test
        @DisplayName("clear row and column corridors")
        void clearCorridor() {
            GridMap g = GridMap.parse(
                    ".....",
                    ".....",
                    ".....");
            assertTrue(g.lineOfSight(Pos.of(0, 1), Pos.of(4, 1)));
            assertTrue(g.lineOfSight(Pos.of(4, 1), Pos.of(0, 1)));
            assertTrue(g.lineOfSight(Pos.of(2, 0), Pos.of(2, 2)));
        }

        @Test
        @DisplayName("same cell always sees itself")
        void sameCell() {
            GridMap g = GridMap.parse("#");
            assertTrue(g.lineOfSight(Pos.of(0, 0), Pos.of(0, 0)));
        }

        @Test
        @DisplayName("walls and closed doors block, open doors do not")
        void blockers() {
            GridMap g = GridMap.parse(
                    "..#..",
                    "..+..",
                    "../..");
            assertFalse(g.lineOfSight(Pos.of(0, 0), Pos.of(4, 0)));
            assertFalse(g.lineOfSight(Pos.of(0, 1), Pos.of(4, 1)));
            assertTrue(g.lineOfSight(Pos.of(0, 2), Pos.of(4, 2)));
        }

        @Test
        @DisplayName("endpoints themselves do not block")
        void endpointsIgnored() {
            GridMap g = GridMap.parse("#...#");
            assertTrue(g.lineOfSight(Pos.of(0, 0), Pos.of(4, 0)));
        }

        @Test
        @DisplayName("diagonal pairs never see each other")
        void diagonalNeverSees() {
            GridMap g = new GridMap(5, 5);
            assertFalse(g.lineOfSight(Pos.of(0, 0), Pos.of(1, 1)));
            assertFalse(g.lineOfSight(Pos.of(0, 0), Pos.of(3, 1)));
        }
    }

    @Nested
    @DisplayName("parse / copy / hash")
    class TextTests {

        @Test
        @DisplayName("parse and toAscii round-trip every glyph")
        void parseRoundTrip() {
            String[] rows = {"#.+/>", "^_~k$"};
            GridMap g = GridMap.parse(rows);
            assertEquals(String.join("\n", rows), g.toAscii());
            assertEquals(new Tile.Pickup(ItemType.OBJECTIVE), g.tile(Pos.of(4, 1)));
        }

        @Test
        @DisplayName("unknown glyph is rejected")
        void unknownGlyph() {
            assertThrows(IllegalArgumentException.class, () -> GridMap.parse("..?"));
        }

        @Test
        @DisplayName("copy is independent of the original")
        void copyIndependent() {
            GridMap g = new GridMap(3, 3);
            GridMap c = g.copy();
            c.setTile(Pos.of(0, 0), Tile.WALL);
            assertEquals(Tile.FLOOR, g.tile(Pos.of(0, 0)));
            assertNotEquals(g.layoutHash(), c.layoutHash());
        }

        @Test
        @DisplayName("view follows the grid but cannot write to it")
        void readOnlyView() {
            GridMap g = GridMap.parse("..+", "...");
            WorldMap view = g.view();

            assertFalse(view instanceof GridMap);
            assertEquals(g.toAscii(), view.toAscii());
            assertFalse(view.isWalkable(Pos.of(2, 0)));

            g.setTile(Pos.of(2, 0), Tile.OPEN_DOOR);
            assertTrue(view.isWalkable(Pos.of(2, 0)));
            assertTrue(view.lineOfSight(Pos.of(0, 0), Pos.of(2, 0)));
        }

        @Test
        @DisplayName("layout hash depends on tiles, not identity")
        void layoutHashStable() {
            assertEquals(GridMap.parse("#..", ".+.").layoutHash(), GridMap.parse("#..", ".+.").layoutHash());
            assertNotEquals(GridMap.parse("#..", ".+.").layoutHash(), GridMap.parse("#..", "./.").layoutHash());
        }
    }
}
