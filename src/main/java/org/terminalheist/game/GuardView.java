package org.terminalheist.game;

import org.terminalheist.entity.Guard;
import org.terminalheist.entity.GuardState;
import org.terminalheist.world.Direction;
import org.terminalheist.world.Pos;

/** Read-only copy of a guard for renderers. */
public record GuardView(int id, Pos pos, Direction facing, GuardState state, int turnsLeft, int cooldown) {

    static GuardView of(Guard g) {
        return new GuardView(g.id(), g.pos(), g.facing(), g.state(), g.turnsLeft(), g.cooldown());
    }
}
