package org.terminalheist.game;

public enum FloorStatus {
    IN_PROGRESS,
    WON,
    LOST;

    public boolean isOver() {
        return this != IN_PROGRESS;
    }
}
