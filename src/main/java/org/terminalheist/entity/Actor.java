package org.terminalheist.entity;

import org.terminalheist.world.Direction;
import org.terminalheist.world.Pos;

import java.util.Objects;

public abstract class Actor {
    protected Pos pos;
    protected Direction facing;

    protected Actor(Pos pos, Direction facing) {
        this.pos = Objects.requireNonNull(pos, "pos");
        this.facing = Objects.requireNonNull(facing, "facing");
    }

    public Pos pos() { return pos; }
    public Direction facing() { return facing; }

    public void moveTo(Pos p) {
        this.pos = Objects.requireNonNull(p, "pos");
    }

    public void face(Direction d) {
        this.facing = Objects.requireNonNull(d, "facing");
    }
}
