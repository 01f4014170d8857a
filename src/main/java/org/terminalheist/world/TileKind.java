package org.terminalheist.world;

public enum TileKind {
    FLOOR,
    WALL,
    DOOR,
    EXIT,
    HAZARD,
    SLOW,
    PICKUP
}
