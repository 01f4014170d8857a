package org.terminalheist.game.event;

import org.terminalheist.entity.GuardState;
import org.terminalheist.item.ItemType;
import org.terminalheist.world.Pos;

import java.util.List;

/**
 * Notifications for message log, audio and HUD collaborators. Each event carries everything a
 * listener needs, so nobody has to query the simulation mid-step.
 */
public sealed interface GameEvent {

    /** The turn being played: 1 for a floor's first accepted action, 0 for floor start. */
    int turn();

    record FloorStarted(int turn, int floorIndex, Pos start, int guardCount) implements GameEvent {}

    record PickupCollected(int turn, Pos pos, ItemType item, int newCount) implements GameEvent {}

    record DoorOpened(int turn, Pos pos) implements GameEvent {}

    record HazardTriggered(int turn, Pos pos, List<Integer> alertedGuards) implements GameEvent {
        public HazardTriggered {
            alertedGuards = List.copyOf(alertedGuards);
        }
    }

    record GuardStateChanged(int turn, int guardId, Pos pos, GuardState from, GuardState to) implements GameEvent {}

    record TurnCompleted(int turn, Pos playerPos) implements GameEvent {}

    record FloorWon(int turn, int floorIndex, Pos exit) implements GameEvent {}

    record FloorLost(int turn, int floorIndex, Pos pos, int guardId) implements GameEvent {}

    record RunCompleted(int turn, boolean won, int floorsCleared, int score) implements GameEvent {}
}
