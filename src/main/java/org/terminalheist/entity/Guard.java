package org.terminalheist.entity;

import org.terminalheist.game.util.RNG;
import org.terminalheist.world.Direction;
import org.terminalheist.world.Pos;

import java.util.Objects;

/**
 * A guard's mutable state. Behaviour lives in {@code GuardBrain}; the guard only carries
 * what the brain reads and writes between activations.
 */
public final class Guard extends Actor {

    private final int id;
    private final RNG patrolRng;

    private GuardState state = GuardState.PATROL;
    private int turnsLeft;      // chase or alert countdown
    private int cooldown;       // activations to skip after entering slow terrain
    private Pos lastKnownTarget;

    /**
     * @param id        roster index, stable for the floor
     * @param patrolRng this guard's own stream for patrol direction picks
     */
    public Guard(int id, Pos pos, Direction facing, RNG patrolRng) {
        super(pos, facing);
        this.id = id;
        this.patrolRng = Objects.requireNonNull(patrolRng, "patrolRng");
    }

    public int id() { return id; }
    public RNG patrolRng() { return patrolRng; }

    public GuardState state() { return state; }
    public int turnsLeft() { return turnsLeft; }
    public int cooldown() { return cooldown; }

    /** @return where the guard is heading in ALERT/CHASE, or null */
    public Pos lastKnownTarget() { return lastKnownTarget; }

    public boolean onCooldown() {
        return cooldown > 0;
    }

    public void enter(GuardState next, int turns, Pos target) {
        this.state = Objects.requireNonNull(next, "state");
        this.turnsLeft = Math.max(0, turns);
        this.lastKnownTarget = target;
    }

    public void tickTurnsLeft() {
        if (turnsLeft > 0) turnsLeft--;
    }

    public void setCooldown(int activations) {
        this.cooldown = Math.max(0, activations);
    }

    public void tickCooldown() {
        if (cooldown > 0) cooldown--;
    }

    @Override
    public String toString() {
        return "Guard#" + id + "{" + pos + " " + state + " facing=" + facing + "}";
    }
}
