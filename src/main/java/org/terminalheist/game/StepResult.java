package org.terminalheist.game;

import java.util.Objects;

/**
 * Outcome of {@link TurnSystem#step(Action)}. A rejected step changed nothing, including the turn
 * counter.
 *
 * @param accepted  whether the action was processed as a turn
 * @param rejection why it was not, or null when accepted
 * @param notice    informational detail about an accepted turn (never null)
 * @param turn      turn counter after the step
 * @param status    floor status after the step
 */
public record StepResult(boolean accepted, Rejection rejection, Notice notice, int turn, FloorStatus status) {

    public enum Rejection {
        /** Destination not walkable. */
        BLOCKED,
        /** The floor is already won or lost. */
        FLOOR_OVER
    }

    public enum Notice {
        NONE,
        /** Interact found no closed door next to the player. */
        NOTHING_TO_INTERACT,
        /** Interact found a closed door but the player carries no keycard. */
        NO_KEYCARD,
        /** Standing on the exit without the objective. */
        EXIT_LOCKED
    }

    public StepResult {
        Objects.requireNonNull(notice, "notice");
        Objects.requireNonNull(status, "status");
        if (accepted == (rejection != null)) {
            throw new IllegalArgumentException("accepted results carry no rejection, rejected ones must");
        }
    }

    static StepResult accepted(Notice notice, int turn, FloorStatus status) {
        return new StepResult(true, null, notice, turn, status);
    }

    static StepResult rejected(Rejection rejection, int turn, FloorStatus status) {
        return new StepResult(false, rejection, Notice.NONE, turn, status);
    }
}
