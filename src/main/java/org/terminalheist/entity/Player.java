package org.terminalheist.entity;

import org.terminalheist.item.Inventory;
import org.terminalheist.item.ItemType;
import org.terminalheist.world.Direction;
import org.terminalheist.world.Pos;

public final class Player extends Actor {

    public final Inventory inv = new Inventory();

    public Player(Pos start) {
        super(start, Direction.DOWN);
    }

    public boolean hasKeycard() {
        return inv.has(ItemType.KEYCARD);
    }

    public boolean hasObjective() {
        return inv.has(ItemType.OBJECTIVE);
    }
}
