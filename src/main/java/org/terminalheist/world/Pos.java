package org.terminalheist.world;

/**
 * Integer grid coordinate. {@code x} is the column, {@code y} the row; (0,0) is the top-left cell.
 */
public record Pos(int x, int y) {

    public static Pos of(int x, int y) {
        return new Pos(x, y);
    }

    public Pos step(Direction d) {
        return new Pos(x + d.dx, y + d.dy);
    }

    public int manhattan(Pos other) {
        return Math.abs(x - other.x) + Math.abs(y - other.y);
    }

    public boolean sharesRowOrColumn(Pos other) {
        return x == other.x || y == other.y;
    }

    @Override
    public String toString() {
        return "(" + x + "," + y + ")";
    }
}
