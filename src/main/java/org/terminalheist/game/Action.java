package org.terminalheist.game;

import org.terminalheist.world.Direction;

import java.util.Objects;

/** One discrete player input. */
public final class Action {

    public enum Kind {
        MOVE,
        WAIT,
        // opens an adjacent closed door when carrying a keycard
        INTERACT
    }

    public static final Action WAIT = new Action(Kind.WAIT, null);
    public static final Action INTERACT = new Action(Kind.INTERACT, null);

    private final Kind kind;
    private final Direction direction;

    private Action(Kind kind, Direction direction) {
        this.kind = kind;
        this.direction = direction;
    }

    public static Action move(Direction direction) {
        return new Action(Kind.MOVE, Objects.requireNonNull(direction, "direction"));
    }

    public Kind kind() { return kind; }

    /** @return the step direction for {@link Kind#MOVE}, otherwise null */
    public Direction direction() { return direction; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Action)) return false;
        Action other = (Action) o;
        return kind == other.kind && direction == other.direction;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, direction);
    }

    @Override
    public String toString() {
        return kind == Kind.MOVE ? "Move(" + direction + ")" : kind.name();
    }
}
