package org.terminalheist.game;

import org.terminalheist.ai.GuardBrain;
import org.terminalheist.entity.Guard;
import org.terminalheist.entity.GuardState;
import org.terminalheist.entity.Player;
import org.terminalheist.game.event.EventBus;
import org.terminalheist.game.event.GameEvent;
import org.terminalheist.game.util.RNG;
import org.terminalheist.item.ItemType;
import org.terminalheist.world.Direction;
import org.terminalheist.world.GenerationResult;
import org.terminalheist.world.GridMap;
import org.terminalheist.world.Pos;
import org.terminalheist.world.Tile;
import org.terminalheist.world.TileKind;
import org.terminalheist.world.WorldMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs one floor, one player action at a time. Each accepted step is, in order:
 * player action, pickup/hazard resolution on the player's tile, one activation per guard in
 * roster order, then capture and exit checks.
 *
 * <p>The turn system owns the grid, the player and the guard roster for the floor. Guards are
 * addressed by roster index and hold no reference back here. Not thread-safe.</p>
 */
public final class TurnSystem {

    private static final Logger log = LoggerFactory.getLogger(TurnSystem.class);

    private final int floorIndex;
    private final GridMap grid;
    private final WorldMap gridView;
    private final Player player;
    private final List<Guard> guards;
    private final GuardBrain brain;
    private final EventBus events;

    private int turn = 0;
    private FloorStatus status = FloorStatus.IN_PROGRESS;

    public TurnSystem(int floorIndex, GridMap grid, Pos start, List<Guard> guards, GuardBrain brain, EventBus events) {
        this.floorIndex = floorIndex;
        this.grid = Objects.requireNonNull(grid, "grid");
        this.gridView = grid.view();
        this.player = new Player(Objects.requireNonNull(start, "start"));
        this.guards = new ArrayList<>(guards);
        this.brain = Objects.requireNonNull(brain, "brain");
        this.events = Objects.requireNonNull(events, "events");

        for (int i = 0; i < this.guards.size(); i++) {
            if (this.guards.get(i).id() != i) {
                throw new IllegalArgumentException("guard at roster index " + i + " has id " + this.guards.get(i).id());
            }
        }
    }

    /**
     * Sets up a floor from a generation result. Guard facings and patrol streams are drawn from
     * {@code floorRng} here, in roster order; the stream is not used again once play starts.
     */
    public static TurnSystem fromGeneration(int floorIndex, GenerationResult result, RNG floorRng,
                                            GuardBrain brain, EventBus events) {
        List<Guard> roster = new ArrayList<>();
        List<Pos> spawns = result.guardSpawns();
        for (int i = 0; i < spawns.size(); i++) {
            Direction facing = Direction.CARDINALS.get(floorRng.nextInt(Direction.CARDINALS.size()));
            RNG patrol = new RNG(floorRng.nextLong());
            roster.add(new Guard(i, spawns.get(i), facing, patrol));
        }

        TurnSystem ts = new TurnSystem(floorIndex, result.grid(), result.start(), roster, brain, events);
        events.publish(new GameEvent.FloorStarted(0, floorIndex, result.start(), roster.size()));
        return ts;
    }

    /**
     * Processes exactly one action. Rejected actions (blocked move, floor already over) leave
     * every piece of state untouched.
     */
    public StepResult step(Action action) {
        Objects.requireNonNull(action, "action");
        if (status.isOver()) {
            log.debug("Rejecting {} on floor {}: already {}", action, floorIndex, status);
            return StepResult.rejected(StepResult.Rejection.FLOOR_OVER, turn, status);
        }

        int now = turn + 1;
        StepResult.Notice notice = StepResult.Notice.NONE;

        // 1. player action
        switch (action.kind()) {
            case MOVE -> {
                Pos dest = player.pos().step(action.direction());
                if (!grid.isWalkable(dest)) {
                    log.debug("Move {} from {} blocked by {}", action.direction(), player.pos(), grid.tile(dest).kind());
                    return StepResult.rejected(StepResult.Rejection.BLOCKED, turn, status);
                }
                player.face(action.direction());
                player.moveTo(dest);
            }
            case INTERACT -> notice = interact(now);
            case WAIT -> { }
        }

        // 2. pickups and hazards
        resolveTile(now);

        // 3. guard phase
        for (Guard g : guards) {
            GuardBrain.Activation a = brain.activate(g, grid, player.pos());
            if (a.stateChanged()) {
                events.publish(new GameEvent.GuardStateChanged(now, g.id(), g.pos(), a.before(), a.after()));
            }
        }

        // 4. terminal checks
        Guard captor = guardAt(player.pos());
        if (captor != null) {
            status = FloorStatus.LOST;
            log.info("Floor {} lost on turn {}: guard {} caught the player at {}", floorIndex, now, captor.id(), player.pos());
            events.publish(new GameEvent.FloorLost(now, floorIndex, player.pos(), captor.id()));
        } else if (grid.tile(player.pos()).kind() == TileKind.EXIT) {
            if (player.hasObjective()) {
                status = FloorStatus.WON;
                log.info("Floor {} won on turn {}", floorIndex, now);
                events.publish(new GameEvent.FloorWon(now, floorIndex, player.pos()));
            } else if (notice == StepResult.Notice.NONE) {
                notice = StepResult.Notice.EXIT_LOCKED;
            }
        }

        turn = now;
        events.publish(new GameEvent.TurnCompleted(turn, player.pos()));
        return StepResult.accepted(notice, turn, status);
    }

    // first closed door in neighbour order; the keycard is kept
    private StepResult.Notice interact(int now) {
        for (Direction d : Direction.CARDINALS) {
            Pos p = player.pos().step(d);
            if (grid.tile(p).equals(Tile.CLOSED_DOOR)) {
                if (!player.hasKeycard()) return StepResult.Notice.NO_KEYCARD;
                grid.setTile(p, Tile.OPEN_DOOR);
                player.face(d);
                events.publish(new GameEvent.DoorOpened(now, p));
                return StepResult.Notice.NONE;
            }
        }
        return StepResult.Notice.NOTHING_TO_INTERACT;
    }

    private void resolveTile(int now) {
        Pos here = player.pos();
        Tile t = grid.tile(here);

        if (t.kind() == TileKind.PICKUP) {
            ItemType item = ((Tile.Pickup) t).item();
            player.inv.add(item, 1);
            grid.setTile(here, Tile.FLOOR);
            events.publish(new GameEvent.PickupCollected(now, here, item, player.inv.count(item)));
        } else if (t.equals(Tile.ARMED_HAZARD)) {
            List<Integer> alerted = new ArrayList<>();
            for (Guard g : guards) {
                GuardState before = g.state();
                if (brain.hear(g, here)) {
                    alerted.add(g.id());
                    if (before != g.state()) {
                        events.publish(new GameEvent.GuardStateChanged(now, g.id(), g.pos(), before, g.state()));
                    }
                }
            }
            grid.setTile(here, Tile.DISARMED_HAZARD);
            events.publish(new GameEvent.HazardTriggered(now, here, alerted));
        }
    }

    private Guard guardAt(Pos p) {
        for (Guard g : guards) {
            if (g.pos().equals(p)) return g;
        }
        return null;
    }

    public int floorIndex() { return floorIndex; }
    public int turn() { return turn; }
    public FloorStatus status() { return status; }

    /** Live read-only view of the tiles; use {@link #snapshot()} to keep state across steps. */
    public WorldMap grid() { return gridView; }

    public Pos player() { return player.pos(); }

    public Direction playerFacing() { return player.facing(); }

    public int count(ItemType item) {
        return player.inv.count(item);
    }

    public Map<ItemType, Integer> inventory() {
        return Collections.unmodifiableMap(player.inv.snapshot());
    }

    public int guardCount() {
        return guards.size();
    }

    public GuardView guard(int id) {
        return GuardView.of(guards.get(id));
    }

    public List<GuardView> guardViews() {
        List<GuardView> out = new ArrayList<>(guards.size());
        for (Guard g : guards) out.add(GuardView.of(g));
        return Collections.unmodifiableList(out);
    }

    public FloorSnapshot snapshot() {
        return new FloorSnapshot(floorIndex, turn, status, grid.copy().view(), player.pos(), player.inv.snapshot(), guardViews());
    }
}
