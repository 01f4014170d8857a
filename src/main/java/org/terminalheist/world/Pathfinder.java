package org.terminalheist.world;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.function.Predicate;
import java.util.function.ToIntFunction;

/**
 * Grid searches over 4-connected cells. Neighbours are always expanded in
 * {@link Direction#CARDINALS} order, so results are deterministic for a fixed grid.
 *
 * <p>All methods are stateless; callers pass the passability rule so the same search serves
 * guards (walkable tiles), generation (anything but walls) and validation (doors closed).</p>
 */
public final class Pathfinder {

    private Pathfinder() {}

    /** Shortest path over walkable tiles. */
    public static List<Pos> shortestPath(WorldMap grid, Pos start, Pos goal) {
        return shortestPath(grid, grid::isWalkable, start, goal);
    }

    /**
     * Breadth-first shortest path from {@code start} to {@code goal}.
     *
     * @param passable decides which in-bounds cells may be entered; also applied to both endpoints
     * @return the cells from start to goal inclusive, {@code [start]} when they are equal, or an
     *         empty list when an endpoint is out of bounds or impassable, or no path exists
     */
    public static List<Pos> shortestPath(WorldMap grid, Predicate<Pos> passable, Pos start, Pos goal) {
        if (!endpointsUsable(grid, passable, start, goal)) return List.of();
        if (start.equals(goal)) return List.of(start);

        int w = grid.width();
        int[] prev = new int[w * grid.height()];
        Arrays.fill(prev, -1);
        int startIdx = index(start, w);
        prev[startIdx] = startIdx;

        ArrayDeque<Pos> q = new ArrayDeque<>();
        q.add(start);

        while (!q.isEmpty()) {
            Pos cur = q.removeFirst();

            for (Direction d : Direction.CARDINALS) {
                Pos n = cur.step(d);
                if (!grid.inBounds(n)) continue;
                int ni = index(n, w);
                if (prev[ni] != -1) continue;
                if (!passable.test(n)) continue;

                prev[ni] = index(cur, w);
                if (n.equals(goal)) return rebuild(prev, startIdx, ni, w);
                q.addLast(n);
            }
        }
        return List.of();
    }

    /**
     * Lowest-cost path where entering a cell costs {@code cost.applyAsInt(cell)} (at least 1).
     * Equal-cost frontiers are expanded in insertion order.
     *
     * @return same conventions as {@link #shortestPath(WorldMap, Predicate, Pos, Pos)}
     */
    public static List<Pos> cheapestPath(WorldMap grid, Predicate<Pos> passable, ToIntFunction<Pos> cost,
                                         Pos start, Pos goal) {
        if (!endpointsUsable(grid, passable, start, goal)) return List.of();
        if (start.equals(goal)) return List.of(start);

        int w = grid.width();
        int size = w * grid.height();
        int[] dist = new int[size];
        int[] prev = new int[size];
        Arrays.fill(dist, Integer.MAX_VALUE);
        Arrays.fill(prev, -1);

        int startIdx = index(start, w);
        int goalIdx = index(goal, w);
        dist[startIdx] = 0;
        prev[startIdx] = startIdx;

        // {distance, insertion order, cell index}
        PriorityQueue<long[]> open = new PriorityQueue<>((a, b) ->
                a[0] != b[0] ? Long.compare(a[0], b[0]) : Long.compare(a[1], b[1]));
        long order = 0;
        open.add(new long[]{0, order++, startIdx});

        while (!open.isEmpty()) {
            long[] top = open.poll();
            int ci = (int) top[2];
            if (top[0] > dist[ci]) continue;
            if (ci == goalIdx) return rebuild(prev, startIdx, goalIdx, w);

            Pos cur = new Pos(ci % w, ci / w);
            for (Direction d : Direction.CARDINALS) {
                Pos n = cur.step(d);
                if (!grid.inBounds(n) || !passable.test(n)) continue;

                int ni = index(n, w);
                int nd = dist[ci] + Math.max(1, cost.applyAsInt(n));
                if (nd < dist[ni]) {
                    dist[ni] = nd;
                    prev[ni] = ci;
                    open.add(new long[]{nd, order++, ni});
                }
            }
        }
        return List.of();
    }

    /**
     * Every cell connected to {@code start} through passable cells, start included. Empty when the
     * start itself is out of bounds or impassable.
     */
    public static Set<Pos> reachable(WorldMap grid, Predicate<Pos> passable, Pos start) {
        Set<Pos> seen = new HashSet<>();
        if (!grid.inBounds(start) || !passable.test(start)) return seen;

        ArrayDeque<Pos> q = new ArrayDeque<>();
        seen.add(start);
        q.add(start);

        while (!q.isEmpty()) {
            Pos cur = q.removeFirst();
            for (Direction d : Direction.CARDINALS) {
                Pos n = cur.step(d);
                if (!grid.inBounds(n) || seen.contains(n) || !passable.test(n)) continue;
                seen.add(n);
                q.addLast(n);
            }
        }
        return seen;
    }

    private static boolean endpointsUsable(WorldMap grid, Predicate<Pos> passable, Pos start, Pos goal) {
        if (!grid.inBounds(start) || !grid.inBounds(goal)) return false;
        return passable.test(start) && passable.test(goal);
    }

    private static int index(Pos p, int w) {
        return p.y() * w + p.x();
    }

    private static List<Pos> rebuild(int[] prev, int startIdx, int goalIdx, int w) {
        ArrayList<Pos> reversed = new ArrayList<>();
        int cur = goalIdx;
        while (cur != startIdx) {
            reversed.add(new Pos(cur % w, cur / w));
            cur = prev[cur];
        }
        reversed.add(new Pos(startIdx % w, startIdx / w));
        Collections.reverse(reversed);
        return List.copyOf(reversed);
    }
}
