package org.terminalheist.entity;

public enum GuardState {
    /** Wandering with momentum; the initial state. */
    PATROL,
    /** Investigating a noise; walks to it but is not pursuing anyone. */
    ALERT,
    /** Pursuing the last place the player was seen. */
    CHASE
}
