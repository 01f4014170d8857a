package org.terminalheist.world;

import org.terminalheist.game.util.RNG;
import org.terminalheist.game.util.RunSeed;
import org.terminalheist.item.ItemType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DungeonGeneratorTest {

    private final DungeonGenerator generator = new DungeonGenerator();

    private static GenerationRequest.Builder request(long seed) {
        return GenerationRequest.builder().runSeed(RunSeed.ofNumber(seed));
    }

    private GenerationResult generateOk(GenerationRequest req) {
        GenerationOutcome outcome = generator.generate(req);
        assertTrue(outcome.isSuccess(), () -> "generation failed: " + outcome);
        return outcome.result();
    }

    @Nested
    @DisplayName("determinism")
    class DeterminismTests {

        @Test
        @DisplayName("same seed and floor give an identical floor")
        void sameSeedSameFloor() {
            GenerationResult a = generateOk(request(42).floorIndex(0).build());
            GenerationResult b = generateOk(request(42).floorIndex(0).build());

            assertEquals(a.toAscii(), b.toAscii());
            assertEquals(a.layoutHash(), b.layoutHash());
            assertEquals(a.start(), b.start());
            assertEquals(a.objective(), b.objective());
            assertEquals(a.exit(), b.exit());
            assertEquals(a.guardSpawns(), b.guardSpawns());
            assertEquals(a.attempts(), b.attempts());
        }

        @Test
        @DisplayName("floor 0 uses the run seed unchanged")
        void floorZeroUsesRunSeed() {
            GenerationResult r = generateOk(request(42).floorIndex(0).build());
            assertEquals(42L, r.combinedSeed());
        }

        @Test
        @DisplayName("generate(request) matches generate(request, forFloor stream)")
        void explicitStreamMatches() {
            GenerationRequest req = request(7).floorIndex(2).doorCount(1).build();
            GenerationResult a = generateOk(req);
            GenerationResult b = generator.generate(req, RNG.forFloor(req.runSeed(), 2)).result();
            assertEquals(a.layoutHash(), b.layoutHash());
        }

        @Test
        @DisplayName("text seeds are as reproducible as numeric ones")
        void textSeed() {
            GenerationRequest req = GenerationRequest.builder().runSeed(RunSeed.ofText("vault")).build();
            assertEquals(generateOk(req).toAscii(), generateOk(req).toAscii());
        }

        @Test
        @DisplayName("different floors of one run differ")
        void floorsDiffer() {
            GenerationResult f1 = generateOk(request(42).floorIndex(1).build());
            GenerationResult f2 = generateOk(request(42).floorIndex(2).build());
            assertNotEquals(f1.layoutHash(), f2.layoutHash());
        }
    }

    @Nested
    @DisplayName("invariants")
    class InvariantTests {

        @Test
        @DisplayName("objective and exit are reachable across many seeds")
        void reachableAcrossSeeds() {
            for (long seed = 1; seed <= 40; seed++) {
                GenerationResult r = generateOk(request(seed).build());
                GridMap g = r.grid();
                assertFalse(Pathfinder.shortestPath(g, p -> PlacementValidator.passableWithDoors(g, p), r.start(), r.objective()).isEmpty());
                assertFalse(Pathfinder.shortestPath(g, p -> PlacementValidator.passableWithDoors(g, p), r.objective(), r.exit()).isEmpty());
                assertEquals(new Tile.Pickup(ItemType.OBJECTIVE), g.tile(r.objective()));
                assertEquals(Tile.EXIT, g.tile(r.exit()));
            }
        }

        @Test
        @DisplayName("border is solid wall")
        void borderIsWall() {
            GridMap g = generateOk(request(3).build()).grid();
            for (int x = 0; x < g.width(); x++) {
                assertEquals(TileKind.WALL, g.tile(x, 0).kind());
                assertEquals(TileKind.WALL, g.tile(x, g.height() - 1).kind());
            }
            for (int y = 0; y < g.height(); y++) {
                assertEquals(TileKind.WALL, g.tile(0, y).kind());
                assertEquals(TileKind.WALL, g.tile(g.width() - 1, y).kind());
            }
        }

        @Test
        @DisplayName("guards respect minimum distances and spacing")
        void guardDistances() {
            GenerationRequest req = request(11).guardCount(3).guardMinDistance(5).guardSpacing(3).build();
            GenerationResult r = generateOk(req);
            GridMap g = r.grid();

            assertEquals(3, r.guardSpawns().size());
            List<Pos> spawns = r.guardSpawns();
            for (int i = 0; i < spawns.size(); i++) {
                Pos p = spawns.get(i);
                assertTrue(g.isWalkable(p));
                assertTrue(p.manhattan(r.start()) >= 5);
                assertTrue(p.manhattan(r.objective()) >= 5);
                assertTrue(p.manhattan(r.exit()) >= 5);
                for (int j = i + 1; j < spawns.size(); j++) {
                    assertTrue(p.manhattan(spawns.get(j)) >= 3);
                }
            }
        }

        @Test
        @DisplayName("doors always come with a key reachable without crossing them")
        void doorsComeWithKey() {
            for (long seed = 1; seed <= 20; seed++) {
                GenerationResult r = generateOk(request(seed).doorCount(2).build());
                GridMap g = r.grid();

                assertEquals(2, g.countOf(TileKind.DOOR));
                assertEquals(1, r.keySpawns().size());
                Pos key = r.keySpawns().get(0);
                assertEquals(new Tile.Pickup(ItemType.KEYCARD), g.tile(key));
                Set<Pos> noDoors = Pathfinder.reachable(g, g::isWalkable, r.start());
                assertTrue(noDoors.contains(key), "key unreachable for seed " + seed);
                assertTrue(key.manhattan(r.start()) >= req(seed).keyMinDistance());
            }
        }

        private GenerationRequest req(long seed) {
            return request(seed).build();
        }

        @Test
        @DisplayName("doors sit on chokepoints")
        void doorsOnChokepoints() {
            GenerationResult r = generateOk(request(5).doorCount(1).build());
            GridMap g = r.grid();
            Pos door = g.cellsOf(TileKind.DOOR).get(0);

            GridMap opened = g.copy();
            opened.setTile(door, Tile.FLOOR);
            assertTrue(DungeonGenerator.isChokepoint(opened, door));
        }

        @Test
        @DisplayName("no key without doors unless asked for")
        void keyOnlyWhenNeeded() {
            assertTrue(generateOk(request(9).build()).keySpawns().isEmpty());
            assertEquals(1, generateOk(request(9).placeKeys(true).build()).keySpawns().size());
        }

        @Test
        @DisplayName("slow terrain and hazards are scattered on free cells")
        void scatterCounts() {
            GenerationResult r = generateOk(request(13).slowTerrain(3, 4).hazardCount(2).build());
            GridMap g = r.grid();

            assertEquals(3, g.countOf(TileKind.SLOW));
            assertEquals(2, g.countOf(TileKind.HAZARD));
            for (Pos p : g.cellsOf(TileKind.SLOW)) assertEquals(4, g.tile(p).moveCost());
            for (Pos p : g.cellsOf(TileKind.HAZARD)) assertEquals(Tile.ARMED_HAZARD, g.tile(p));
            for (Pos guard : r.guardSpawns()) assertEquals(TileKind.FLOOR, g.tile(guard).kind());
        }

        @Test
        @DisplayName("result grid is a defensive copy")
        void resultGridIsCopy() {
            GenerationResult r = generateOk(request(1).build());
            long hash = r.layoutHash();
            r.grid().setTile(r.start(), Tile.WALL);
            assertEquals(hash, r.grid().layoutHash());
        }
    }

    @Nested
    @DisplayName("failures")
    class FailureTests {

        @Test
        @DisplayName("grid below the minimum size is invalid")
        void tooSmall() {
            GenerationOutcome o = generator.generate(request(1).size(4, 10).build());

            assertFalse(o.isSuccess());
            assertEquals(GenerationOutcome.Failure.CONFIG_INVALID, o.failure());
            assertEquals(0, o.attempts());
            assertThrows(IllegalStateException.class, o::result);
        }

        @Test
        @DisplayName("wall density outside [0,1] is invalid")
        void badDensity() {
            assertEquals(GenerationOutcome.Failure.CONFIG_INVALID,
                    generator.generate(request(1).wallDensity(1.5).build()).failure());
            assertEquals(GenerationOutcome.Failure.CONFIG_INVALID,
                    generator.generate(request(1).wallDensity(Double.NaN).build()).failure());
            assertEquals(GenerationOutcome.Failure.CONFIG_INVALID,
                    generator.generate(request(1).wallDensity(-0.1).build()).failure());
        }

        @Test
        @DisplayName("negative counts and zero attempts are invalid")
        void badCounts() {
            assertEquals(GenerationOutcome.Failure.CONFIG_INVALID,
                    generator.generate(request(1).guardCount(-1).build()).failure());
            assertEquals(GenerationOutcome.Failure.CONFIG_INVALID,
                    generator.generate(request(1).maxAttempts(0).build()).failure());
            assertEquals(GenerationOutcome.Failure.CONFIG_INVALID,
                    generator.generate(request(1).slowTerrain(1, 1).build()).failure());
        }

        @Test
        @DisplayName("a floor that cannot be carved exhausts the attempt cap")
        void exhausted() {
            GenerationOutcome o = generator.generate(request(1).size(5, 5).wallDensity(1.0).maxAttempts(3).build());

            assertEquals(GenerationOutcome.Failure.GENERATION_EXHAUSTED, o.failure());
            assertEquals(3, o.attempts());
            assertNotNull(o.reason());
        }

        @Test
        @DisplayName("impossible guard spacing exhausts instead of looping")
        void impossibleGuards() {
            GenerationOutcome o = generator.generate(request(1).size(6, 6).guardCount(5).guardMinDistance(20).maxAttempts(5).build());
            assertEquals(GenerationOutcome.Failure.GENERATION_EXHAUSTED, o.failure());
        }

        @Test
        @DisplayName("missing run seed is a programming error")
        void missingSeed() {
            assertThrows(NullPointerException.class, () -> GenerationRequest.builder().build());
        }
    }
}
