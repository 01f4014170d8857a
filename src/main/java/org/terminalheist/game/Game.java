package org.terminalheist.game;

import org.terminalheist.ai.GuardBrain;
import org.terminalheist.game.event.EventBus;
import org.terminalheist.game.event.GameEvent;
import org.terminalheist.game.event.GameEventListener;
import org.terminalheist.game.util.RNG;
import org.terminalheist.game.util.RunSeed;
import org.terminalheist.world.DungeonGenerator;
import org.terminalheist.world.GenerationOutcome;
import org.terminalheist.world.GenerationRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * One run: a fixed number of floors generated from a single run seed. Owns the current floor's
 * {@link TurnSystem} and the run counters, and rebuilds floors deterministically on advance or
 * restart. Nothing here is persisted; a floor is always regenerated from seed and floor number.
 */
public final class Game {

    private static final Logger log = LoggerFactory.getLogger(Game.class);

    private final DungeonGenerator generator = new DungeonGenerator();
    private final DifficultyRamp ramp;
    private final int floorsPerRun;
    private final EventBus events;
    private final GameState state = new GameState();

    private RunSeed seed;
    private int floor;
    private TurnSystem current;

    public Game() {
        this(DifficultyRamp.standard(), GameConfig.FLOORS_PER_RUN, new EventBus());
    }

    public Game(DifficultyRamp ramp, int floorsPerRun, EventBus events) {
        if (floorsPerRun < 1) throw new IllegalArgumentException("floorsPerRun < 1");
        this.ramp = Objects.requireNonNull(ramp, "ramp");
        this.floorsPerRun = floorsPerRun;
        this.events = Objects.requireNonNull(events, "events");
        events.subscribe(state);
    }

    public EventBus.Subscription subscribe(GameEventListener listener) {
        return events.subscribe(listener);
    }

    /** Starts a run on floor 1. A failed generation leaves no floor in play. */
    public GenerationOutcome newRun(RunSeed seed) {
        this.seed = Objects.requireNonNull(seed, "seed");
        this.floor = 1;
        state.startRun(seed);
        log.info("New run with seed {}", seed);
        return generateFloor();
    }

    /**
     * Forwards one action to the current floor and settles the run when the floor ends.
     *
     * @throws IllegalStateException if no floor is in play
     */
    public StepResult step(Action action) {
        TurnSystem ts = requireFloor();
        StepResult r = ts.step(action);
        if (!r.accepted()) return r;

        if (r.status() == FloorStatus.LOST) {
            state.finish(RunStatus.LOST);
            events.publish(new GameEvent.RunCompleted(r.turn(), false, state.floorsCleared(), state.score()));
        } else if (r.status() == FloorStatus.WON && floor >= floorsPerRun) {
            state.finish(RunStatus.WON);
            log.info("Run {} won with score {}", seed, state.score());
            events.publish(new GameEvent.RunCompleted(r.turn(), true, state.floorsCleared(), state.score()));
        }
        return r;
    }

    /**
     * Moves on to the next floor after a win.
     *
     * @throws IllegalStateException unless the current floor is won and floors remain
     */
    public GenerationOutcome advanceFloor() {
        TurnSystem ts = requireFloor();
        if (ts.status() != FloorStatus.WON) throw new IllegalStateException("floor " + floor + " is not won");
        if (floor >= floorsPerRun) throw new IllegalStateException("run already finished on floor " + floor);
        floor++;
        return generateFloor();
    }

    /**
     * Regenerates the current floor from scratch; pending floor points are discarded.
     *
     * @throws IllegalStateException unless a run is in progress and the current floor is not yet won
     */
    public GenerationOutcome restartFloor() {
        if (seed == null) throw new IllegalStateException("no run started");
        if (isRunOver()) throw new IllegalStateException("run already finished as " + state.status());
        if (current != null && current.status() == FloorStatus.WON) {
            throw new IllegalStateException("floor " + floor + " is already won");
        }
        log.info("Restarting floor {}", floor);
        return generateFloor();
    }

    private GenerationOutcome generateFloor() {
        GenerationRequest req = ramp.requestFor(seed, floor);
        RNG rng = RNG.forFloor(seed, floor);
        GenerationOutcome outcome = generator.generate(req, rng);

        if (!outcome.isSuccess()) {
            log.warn("Floor {} of run {} could not be generated: {}", floor, seed, outcome.reason());
            current = null;
            return outcome;
        }

        state.startFloor(floor);
        current = TurnSystem.fromGeneration(floor, outcome.result(), rng, new GuardBrain(ramp.tuningFor(floor)), events);
        return outcome;
    }

    private TurnSystem requireFloor() {
        if (current == null) throw new IllegalStateException("no floor in play");
        return current;
    }

    /** @return the floor in play, or null before a run starts or after a failed generation */
    public TurnSystem current() {
        return current;
    }

    public int floor() { return floor; }
    public int floorsPerRun() { return floorsPerRun; }
    public RunSeed seed() { return seed; }
    public GameState state() { return state; }

    public boolean isRunOver() {
        return state.status() == RunStatus.WON || state.status() == RunStatus.LOST;
    }
}
