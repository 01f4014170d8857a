package org.terminalheist.ai;

import org.terminalheist.entity.Guard;
import org.terminalheist.entity.GuardState;
import org.terminalheist.world.Direction;
import org.terminalheist.world.Pathfinder;
import org.terminalheist.world.Pos;
import org.terminalheist.world.WorldMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Patrol / alert / chase behaviour for one guard activation.
 *
 * <p>A clear row/column sighting within vision range always puts the guard into CHASE with a full
 * countdown. Without a sighting a chase counts down and falls back to PATROL at zero. ALERT is only
 * entered through {@link #hear(Guard, Pos)} and behaves like a chase toward the noise that ends
 * when the countdown runs out or the guard arrives.</p>
 */
public final class GuardBrain {

    private static final Logger log = LoggerFactory.getLogger(GuardBrain.class);

    private final GuardTuning tuning;

    public GuardBrain(GuardTuning tuning) {
        this.tuning = Objects.requireNonNull(tuning, "tuning");
    }

    public GuardTuning tuning() {
        return tuning;
    }

    /**
     * What one activation did.
     *
     * @param skipped true when the guard sat out the activation on cooldown
     */
    public record Activation(int guardId, Pos from, Pos to, GuardState before, GuardState after, boolean skipped) {
        public boolean moved() {
            return !from.equals(to);
        }

        public boolean stateChanged() {
            return before != after;
        }
    }

    public boolean sees(Guard g, WorldMap grid, Pos player) {
        return g.pos().manhattan(player) <= tuning.visionRange() && grid.lineOfSight(g.pos(), player);
    }

    /** Runs one activation: cooldown, sighting/countdown transitions, then one movement step. */
    public Activation activate(Guard g, WorldMap grid, Pos player) {
        Pos from = g.pos();
        GuardState before = g.state();

        if (g.onCooldown()) {
            g.tickCooldown();
            return new Activation(g.id(), from, from, before, before, true);
        }

        updateState(g, grid, player);

        switch (g.state()) {
            case PATROL -> patrol(g, grid);
            case ALERT, CHASE -> pursue(g, grid);
        }

        if (!g.pos().equals(from)) {
            int cost = grid.tile(g.pos()).moveCost();
            if (cost > 1) g.setCooldown(cost - 1);
        }

        Activation a = new Activation(g.id(), from, g.pos(), before, g.state(), false);
        if (a.stateChanged()) log.debug("{} {} -> {}", g, before, g.state());
        return a;
    }

    /**
     * A noise at {@code source}. Patrolling or alerted guards in range start (or restart)
     * investigating it; chasing guards ignore it.
     *
     * @return true if the guard reacted
     */
    public boolean hear(Guard g, Pos source) {
        if (g.state() == GuardState.CHASE) return false;
        if (g.pos().manhattan(source) > tuning.hazardAlertRadius()) return false;
        g.enter(GuardState.ALERT, tuning.alertDuration(), source);
        return true;
    }

    private void updateState(Guard g, WorldMap grid, Pos player) {
        if (sees(g, grid, player)) {
            g.enter(GuardState.CHASE, tuning.chaseDuration(), player);
            return;
        }

        switch (g.state()) {
            case CHASE -> {
                g.tickTurnsLeft();
                if (g.turnsLeft() == 0) g.enter(GuardState.PATROL, 0, null);
            }
            case ALERT -> {
                g.tickTurnsLeft();
                if (g.turnsLeft() == 0 || g.pos().equals(g.lastKnownTarget())) g.enter(GuardState.PATROL, 0, null);
            }
            case PATROL -> { }
        }
    }

    private void patrol(Guard g, WorldMap grid) {
        Pos ahead = g.pos().step(g.facing());
        if (grid.isWalkable(ahead)) {
            g.moveTo(ahead);
            return;
        }

        List<Direction> open = new ArrayList<>(4);
        for (Direction d : Direction.CARDINALS) {
            if (grid.isWalkable(g.pos().step(d))) open.add(d);
        }
        if (open.isEmpty()) return;

        Direction d = g.patrolRng().pick(open);
        g.face(d);
        g.moveTo(g.pos().step(d));
    }

    private void pursue(Guard g, WorldMap grid) {
        Pos target = g.lastKnownTarget();
        if (target == null || target.equals(g.pos())) return;

        List<Pos> path = tuning.costAwarePursuit()
                ? Pathfinder.cheapestPath(grid, grid::isWalkable, p -> grid.tile(p).moveCost(), g.pos(), target)
                : Pathfinder.shortestPath(grid, g.pos(), target);
        if (path.size() < 2) return;

        Pos next = path.get(1);
        Direction.between(g.pos(), next).ifPresent(g::face);
        g.moveTo(next);
    }
}
