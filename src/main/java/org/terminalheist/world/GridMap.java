package org.terminalheist.world;

import org.terminalheist.game.GameConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Mutable rectangular tile store for one floor. A fresh grid is all floor; cells outside
 * {@code [0,width) x [0,height)} read as walls and ignore writes.
 */
public final class GridMap implements WorldMap {

    private static final Logger log = LoggerFactory.getLogger(GridMap.class);

    private final int w, h;
    private final Tile[][] tiles;

    public GridMap(int w, int h) {
        if (w <= 0 || h <= 0) throw new IllegalArgumentException("grid must be at least 1x1, got " + w + "x" + h);
        this.w = w;
        this.h = h;
        tiles = new Tile[w][h];

        for (int x = 0; x < w; x++)
            Arrays.fill(tiles[x], Tile.FLOOR);
    }

    /**
     * Builds a grid from text rows, one glyph per cell (see {@link Tile#glyph()}).
     * Rows shorter than the widest one are padded with floor.
     */
    public static GridMap parse(String... rows) {
        if (rows.length == 0) throw new IllegalArgumentException("no rows");
        int width = 0;
        for (String row : rows) width = Math.max(width, row.length());

        GridMap g = new GridMap(width, rows.length);
        for (int y = 0; y < rows.length; y++) {
            String row = rows[y];
            for (int x = 0; x < row.length(); x++) {
                g.tiles[x][y] = Tile.fromGlyph(row.charAt(x), GameConfig.SLOW_TERRAIN_COST);
            }
        }
        return g;
    }

    @Override
    public int width() { return w; }

    @Override
    public int height() { return h; }

    @Override
    public Tile tile(Pos p) {
        if (!inBounds(p)) return Tile.WALL;
        return tiles[p.x()][p.y()];
    }

    /**
     * @return false (and a warning) when {@code p} is out of bounds; the grid is left untouched
     */
    public boolean setTile(Pos p, Tile t) {
        Objects.requireNonNull(t, "tile");
        if (!inBounds(p)) {
            log.warn("Ignoring write of {} outside {}x{} grid at {}", t.kind(), w, h, p);
            return false;
        }
        tiles[p.x()][p.y()] = t;
        return true;
    }

    public boolean setTile(int x, int y, Tile t) {
        return setTile(new Pos(x, y), t);
    }

    @Override
    public boolean inBounds(Pos p) {
        return p.x() >= 0 && p.y() >= 0 && p.x() < w && p.y() < h;
    }

    @Override
    public boolean isWalkable(Pos p) {
        return inBounds(p) && tiles[p.x()][p.y()].walkable();
    }

    @Override
    public boolean blocksSight(Pos p) {
        if (!inBounds(p)) return true;
        return tiles[p.x()][p.y()].blocksSight();
    }

    @Override
    public List<Pos> neighbors4(Pos p) {
        List<Pos> out = new ArrayList<>(4);
        for (Direction d : Direction.CARDINALS) {
            Pos n = p.step(d);
            if (inBounds(n)) out.add(n);
        }
        return out;
    }

    /**
     * Straight row/column sight only: true when {@code a == b}, or when the two cells share exactly
     * one axis and nothing strictly between them blocks sight. Diagonal pairs never see each other.
     */
    @Override
    public boolean lineOfSight(Pos a, Pos b) {
        if (a.equals(b)) return true;
        if (!inBounds(a) || !inBounds(b)) return false;
        if (!a.sharesRowOrColumn(b)) return false;

        int sx = Integer.signum(b.x() - a.x());
        int sy = Integer.signum(b.y() - a.y());
        int x = a.x() + sx, y = a.y() + sy;

        while (x != b.x() || y != b.y()) {
            if (tiles[x][y].blocksSight()) return false;
            x += sx;
            y += sy;
        }
        return true;
    }

    public List<Pos> cellsOf(TileKind kind) {
        List<Pos> out = new ArrayList<>();
        for (int y = 0; y < h; y++)
            for (int x = 0; x < w; x++)
                if (tiles[x][y].kind() == kind) out.add(new Pos(x, y));
        return out;
    }

    public int countOf(TileKind kind) {
        int n = 0;
        for (int x = 0; x < w; x++)
            for (int y = 0; y < h; y++)
                if (tiles[x][y].kind() == kind) n++;
        return n;
    }

    public GridMap copy() {
        GridMap c = new GridMap(w, h);
        for (int x = 0; x < w; x++)
            System.arraycopy(tiles[x], 0, c.tiles[x], 0, h);
        return c;
    }

    /** Stable 64-bit FNV-1a hash over the dimensions and every tile glyph, row by row. */
    public long layoutHash() {
        long hash = 0xcbf29ce484222325L;
        hash = mix(hash, w);
        hash = mix(hash, h);
        for (int y = 0; y < h; y++)
            for (int x = 0; x < w; x++) {
                Tile t = tiles[x][y];
                hash = mix(hash, t.glyph());
                hash = mix(hash, t.moveCost());
            }
        return hash;
    }

    private static long mix(long hash, int value) {
        for (int shift = 0; shift < 32; shift += 8) {
            hash ^= (value >>> shift) & 0xff;
            hash *= 0x100000001b3L;
        }
        return hash;
    }

    @Override
    public String toAscii() {
        StringBuilder sb = new StringBuilder((w + 1) * h);
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) sb.append(tiles[x][y].glyph());
            if (y < h - 1) sb.append('\n');
        }
        return sb.toString();
    }

    /** Live read-only view of this grid; it cannot be cast back to a writable {@code GridMap}. */
    public WorldMap view() {
        return new ReadOnlyView();
    }

    @Override
    public String toString() {
        return "GridMap{" + w + "x" + h + "}";
    }

    private final class ReadOnlyView implements WorldMap {
        @Override public int width() { return w; }
        @Override public int height() { return h; }
        @Override public boolean inBounds(Pos p) { return GridMap.this.inBounds(p); }
        @Override public boolean isWalkable(Pos p) { return GridMap.this.isWalkable(p); }
        @Override public boolean blocksSight(Pos p) { return GridMap.this.blocksSight(p); }
        @Override public Tile tile(Pos p) { return GridMap.this.tile(p); }
        @Override public List<Pos> neighbors4(Pos p) { return GridMap.this.neighbors4(p); }
        @Override public boolean lineOfSight(Pos a, Pos b) { return GridMap.this.lineOfSight(a, b); }
        @Override public String toAscii() { return GridMap.this.toAscii(); }

        @Override
        public String toString() {
            return "WorldMap{" + w + "x" + h + "}";
        }
    }
}
