package org.terminalheist.world;

import java.util.List;
import java.util.Objects;

/**
 * A successfully generated floor. Immutable: {@link #grid()} hands out a fresh copy each time, and
 * guard/key positions are spawn points only. The caller builds the live agents.
 */
public final class GenerationResult {
    private final GridMap grid;
    private final Pos start;
    private final Pos objective;
    private final Pos exit;
    private final List<Pos> guardSpawns;
    private final List<Pos> keySpawns;
    private final int attempts;
    private final long combinedSeed;
    private final long layoutHash;

    GenerationResult(GridMap grid, Pos start, Pos objective, Pos exit,
                     List<Pos> guardSpawns, List<Pos> keySpawns, int attempts, long combinedSeed) {
        this.grid = grid.copy();
        this.start = Objects.requireNonNull(start, "start");
        this.objective = Objects.requireNonNull(objective, "objective");
        this.exit = Objects.requireNonNull(exit, "exit");
        this.guardSpawns = List.copyOf(guardSpawns);
        this.keySpawns = List.copyOf(keySpawns);
        this.attempts = attempts;
        this.combinedSeed = combinedSeed;
        this.layoutHash = this.grid.layoutHash();
    }

    /** A new mutable copy of the generated tiles; ownership passes to the caller. */
    public GridMap grid() {
        return grid.copy();
    }

    public Pos start() { return start; }
    public Pos objective() { return objective; }
    public Pos exit() { return exit; }
    public List<Pos> guardSpawns() { return guardSpawns; }
    public List<Pos> keySpawns() { return keySpawns; }

    /** 1-based number of the attempt that succeeded. */
    public int attempts() { return attempts; }

    public long combinedSeed() { return combinedSeed; }
    public long layoutHash() { return layoutHash; }

    public String toAscii() {
        return grid.toAscii();
    }

    @Override
    public String toString() {
        return "GenerationResult{" + grid.width() + "x" + grid.height() + ", start=" + start
                + ", objective=" + objective + ", exit=" + exit + ", guards=" + guardSpawns
                + ", keys=" + keySpawns + ", attempts=" + attempts + "}";
    }
}
