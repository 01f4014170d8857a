package org.terminalheist.game;

public enum RunStatus {
    NOT_STARTED,
    IN_PROGRESS,
    WON,
    LOST
}
