package org.terminalheist.world;

import org.terminalheist.game.util.RNG;
import org.terminalheist.item.ItemType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Carves random floors and keeps retrying until one is solvable.
 *
 * <p>Each attempt: wall border plus random interior walls, start/objective/exit from a shuffle of
 * the floor cells, a reachability check, then doors, guards, key, slow terrain and hazards, and
 * finally {@link PlacementValidator}. Every draw comes from one seeded stream, so the same request
 * always yields the same floor.</p>
 */
public final class DungeonGenerator {

    private static final Logger log = LoggerFactory.getLogger(DungeonGenerator.class);

    /** Generates with a fresh stream for the request's seed and floor. */
    public GenerationOutcome generate(GenerationRequest req) {
        Objects.requireNonNull(req, "req");
        return generate(req, RNG.forFloor(req.runSeed(), req.floorIndex()));
    }

    /**
     * Generates using the caller's floor stream, which the caller may keep drawing from afterwards
     * (guard setup does).
     */
    public GenerationOutcome generate(GenerationRequest req, RNG rng) {
        Objects.requireNonNull(req, "req");
        Objects.requireNonNull(rng, "rng");

        Optional<String> invalid = req.validate();
        if (invalid.isPresent()) {
            log.warn("Rejecting generation request {}: {}", req, invalid.get());
            return GenerationOutcome.failure(GenerationOutcome.Failure.CONFIG_INVALID, invalid.get(), 0);
        }

        String lastProblem = "no attempt made";
        for (int attempt = 1; attempt <= req.maxAttempts(); attempt++) {
            Attempt a = new Attempt(req, rng);
            String problem = a.run();
            if (problem == null) {
                GenerationResult result = new GenerationResult(a.grid, a.start, a.objective, a.exit,
                        a.guards, a.keys, attempt, rng.seed());
                log.info("Generated floor {} (seed {}) on attempt {}: start={} objective={} exit={} guards={}",
                        req.floorIndex(), req.runSeed(), attempt, a.start, a.objective, a.exit, a.guards.size());
                if (log.isDebugEnabled()) log.debug("Layout:\n{}", result.toAscii());
                return GenerationOutcome.success(result);
            }
            log.debug("Attempt {} for floor {} discarded: {}", attempt, req.floorIndex(), problem);
            lastProblem = problem;
        }

        String reason = "no valid floor after " + req.maxAttempts() + " attempts; last problem: " + lastProblem;
        log.warn("Generation exhausted for {}: {}", req, reason);
        return GenerationOutcome.failure(GenerationOutcome.Failure.GENERATION_EXHAUSTED, reason, req.maxAttempts());
    }

    /** A floor cell with walls on both sides along one axis and floor on both sides along the other. */
    static boolean isChokepoint(WorldMap g, Pos p) {
        if (g.tile(p).kind() != TileKind.FLOOR) return false;
        boolean wallsLeftRight = isWall(g, p.step(Direction.LEFT)) && isWall(g, p.step(Direction.RIGHT));
        boolean wallsUpDown = isWall(g, p.step(Direction.UP)) && isWall(g, p.step(Direction.DOWN));
        boolean openUpDown = g.isWalkable(p.step(Direction.UP)) && g.isWalkable(p.step(Direction.DOWN));
        boolean openLeftRight = g.isWalkable(p.step(Direction.LEFT)) && g.isWalkable(p.step(Direction.RIGHT));
        return (wallsLeftRight && openUpDown) || (wallsUpDown && openLeftRight);
    }

    private static boolean isWall(WorldMap g, Pos p) {
        return g.tile(p).kind() == TileKind.WALL;
    }

    /** One try at a floor. {@link #run()} returns null on success or a description of what failed. */
    private static final class Attempt {
        private final GenerationRequest req;
        private final RNG rng;
        private final GridMap grid;
        private final Set<Pos> used = new HashSet<>();

        private Pos start, objective, exit;
        private final List<Pos> doors = new ArrayList<>();
        private final List<Pos> guards = new ArrayList<>();
        private final List<Pos> keys = new ArrayList<>();

        Attempt(GenerationRequest req, RNG rng) {
            this.req = req;
            this.rng = rng;
            this.grid = new GridMap(req.width(), req.height());
        }

        String run() {
            carve();

            List<Pos> floors = grid.cellsOf(TileKind.FLOOR);
            rng.shuffle(floors);
            if (floors.size() < 3) return "only " + floors.size() + " floor cells";

            start = floors.get(0);
            objective = floors.get(1);
            exit = floors.get(2);
            used.add(start);
            used.add(objective);
            used.add(exit);

            if (Pathfinder.shortestPath(grid, this::notWall, start, objective).isEmpty()) {
                return "no path start->objective";
            }
            if (Pathfinder.shortestPath(grid, this::notWall, objective, exit).isEmpty()) {
                return "no path objective->exit";
            }

            List<Pos> rest = floors.subList(3, floors.size());

            String problem = placeDoors(rest);
            if (problem == null) problem = placeGuards(rest);
            if (problem == null) problem = placeKey(rest);
            if (problem != null) return problem;
            placeScatter(rest, req.slowTerrainCount(), Tile.slow(req.slowTerrainCost()));
            placeScatter(rest, req.hazardCount(), Tile.ARMED_HAZARD);

            grid.setTile(objective, Tile.pickup(ItemType.OBJECTIVE));
            grid.setTile(exit, Tile.EXIT);

            return PlacementValidator.validate(grid, start, objective, exit, keys).orElse(null);
        }

        private void carve() {
            int w = grid.width(), h = grid.height();
            for (int y = 0; y < h; y++) {
                for (int x = 0; x < w; x++) {
                    boolean border = x == 0 || y == 0 || x == w - 1 || y == h - 1;
                    if (border || rng.chance(req.wallDensity())) grid.setTile(x, y, Tile.WALL);
                }
            }
        }

        private String placeDoors(List<Pos> candidates) {
            if (req.doorCount() == 0) return null;
            for (Pos p : candidates) {
                if (doors.size() == req.doorCount()) break;
                if (used.contains(p) || !isChokepoint(grid, p)) continue;
                grid.setTile(p, Tile.CLOSED_DOOR);
                doors.add(p);
                used.add(p);
            }
            return doors.size() < req.doorCount()
                    ? "only " + doors.size() + " of " + req.doorCount() + " door sites" : null;
        }

        private String placeGuards(List<Pos> candidates) {
            for (Pos p : candidates) {
                if (guards.size() == req.guardCount()) break;
                if (used.contains(p)) continue;
                if (p.manhattan(start) < req.guardMinDistance()
                        || p.manhattan(objective) < req.guardMinDistance()
                        || p.manhattan(exit) < req.guardMinDistance()) continue;
                if (tooClose(p, guards, req.guardSpacing())) continue;
                guards.add(p);
                used.add(p);
            }
            return guards.size() < req.guardCount()
                    ? "only " + guards.size() + " of " + req.guardCount() + " guard spawns" : null;
        }

        private String placeKey(List<Pos> candidates) {
            if (!req.placeKeys() && doors.isEmpty()) return null;

            Set<Pos> withoutDoors = Pathfinder.reachable(grid, grid::isWalkable, start);
            for (Pos p : candidates) {
                if (used.contains(p) || !withoutDoors.contains(p)) continue;
                if (p.manhattan(start) < req.keyMinDistance()) continue;
                grid.setTile(p, Tile.pickup(ItemType.KEYCARD));
                keys.add(p);
                used.add(p);
                return null;
            }
            return "no key site reachable from start without doors";
        }

        private void placeScatter(List<Pos> candidates, int count, Tile tile) {
            int placed = 0;
            for (Pos p : candidates) {
                if (placed == count) break;
                if (used.contains(p)) continue;
                grid.setTile(p, tile);
                used.add(p);
                placed++;
            }
            if (placed < count) log.debug("Placed {} of {} {} tiles", placed, count, tile.kind());
        }

        private boolean notWall(Pos p) {
            return grid.tile(p).kind() != TileKind.WALL;
        }

        private static boolean tooClose(Pos p, List<Pos> others, int minDistance) {
            for (Pos o : others) {
                if (p.manhattan(o) < minDistance) return true;
            }
            return false;
        }
    }
}
