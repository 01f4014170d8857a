package org.terminalheist.game.util;

import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Seeded pseudorandom stream. One instance per floor drives generation and guard setup; the same
 * seed always produces the same sequence for every kind of draw.
 */
public final class RNG {
    private final long seed;
    private final Random r;

    public RNG(long seed) {
        this.seed = seed;
        this.r = new Random(seed);
    }

    /** Combined seed for a floor: the run seed XOR the floor index. Floor 0 leaves the run seed unchanged. */
    public static long combine(RunSeed runSeed, int floorIndex) {
        return runSeed.value() ^ floorIndex;
    }

    public static RNG forFloor(RunSeed runSeed, int floorIndex) {
        Objects.requireNonNull(runSeed, "runSeed");
        return new RNG(combine(runSeed, floorIndex));
    }

    /** The value this stream was created from. */
    public long seed() {
        return seed;
    }

    public int nextInt(int boundExclusive) {
        return r.nextInt(boundExclusive);
    }

    public int range(int minInclusive, int maxInclusive) {
        if (maxInclusive < minInclusive) throw new IllegalArgumentException("bad range");
        int span = (maxInclusive - minInclusive) + 1;
        return minInclusive + r.nextInt(span);
    }

    public boolean chance(double p) {
        return r.nextDouble() < p;
    }

    public float nextFloat() {
        return r.nextFloat();
    }

    public double nextDouble() {
        return r.nextDouble();
    }

    public long nextLong() {
        return r.nextLong();
    }

    /** In-place Fisher-Yates shuffle, last index down, drawing from this stream. */
    public <T> void shuffle(List<T> list) {
        for (int i = list.size() - 1; i > 0; i--) {
            int j = r.nextInt(i + 1);
            T tmp = list.get(i);
            list.set(i, list.get(j));
            list.set(j, tmp);
        }
    }

    public <T> T pick(List<T> options) {
        if (options.isEmpty()) throw new IllegalArgumentException("nothing to pick from");
        return options.get(r.nextInt(options.size()));
    }

    /**
     * Picks one option with probability proportional to its weight. Zero weights are never picked.
     */
    public <T> T weightedPick(List<T> options, int[] weights) {
        if (options.size() != weights.length) throw new IllegalArgumentException("options/weights size mismatch");

        int total = 0;
        for (int wt : weights) {
            if (wt < 0) throw new IllegalArgumentException("negative weight " + wt);
            total += wt;
        }
        if (total <= 0) throw new IllegalArgumentException("weights sum to zero");

        int roll = r.nextInt(total);
        for (int i = 0; i < weights.length; i++) {
            if ((roll -= weights[i]) < 0) return options.get(i);
        }
        throw new IllegalStateException("unreachable");
    }
}
