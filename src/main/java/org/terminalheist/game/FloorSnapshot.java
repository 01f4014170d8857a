package org.terminalheist.game;

import org.terminalheist.item.ItemType;
import org.terminalheist.world.Pos;
import org.terminalheist.world.WorldMap;

import java.util.List;
import java.util.Map;

/**
 * Everything a renderer needs after a step. The grid is a read-only view of a private copy, so
 * holding on to a snapshot never observes later turns and cannot change the floor.
 */
public record FloorSnapshot(int floorIndex, int turn, FloorStatus status, WorldMap grid, Pos player,
                            Map<ItemType, Integer> inventory, List<GuardView> guards) {

    public FloorSnapshot {
        inventory = Map.copyOf(inventory);
        guards = List.copyOf(guards);
    }
}
