package org.terminalheist.game;

import org.terminalheist.game.event.GameEvent;
import org.terminalheist.game.event.GameEventListener;
import org.terminalheist.game.util.RunSeed;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Run-level counters and score, kept up to date from the event stream. This is the only state
 * that outlives a floor; {@link #snapshot()} is what a save/statistics collaborator stores.
 *
 * <p>Points earned on a floor stay pending until the floor is won, so restarting a floor
 * cannot farm pickups.</p>
 */
public final class GameState implements GameEventListener {

    private RunSeed runSeed;
    private int floorIndex;
    private int turnCount;
    private int totalTurns;
    private int keycards;
    private int objectives;
    private int floorsCleared;
    private int score;
    private int pendingScore;
    private RunStatus status = RunStatus.NOT_STARTED;

    void startRun(RunSeed seed) {
        this.runSeed = seed;
        this.floorIndex = 0;
        this.totalTurns = 0;
        this.floorsCleared = 0;
        this.score = 0;
        this.status = RunStatus.IN_PROGRESS;
        resetFloor();
    }

    void startFloor(int floor) {
        this.floorIndex = floor;
        this.status = RunStatus.IN_PROGRESS;
        resetFloor();
    }

    void finish(RunStatus result) {
        this.status = result;
    }

    private void resetFloor() {
        this.turnCount = 0;
        this.keycards = 0;
        this.objectives = 0;
        this.pendingScore = 0;
    }

    @Override
    public void onEvent(GameEvent event) {
        if (event instanceof GameEvent.PickupCollected) {
            switch (((GameEvent.PickupCollected) event).item()) {
                case KEYCARD -> {
                    keycards++;
                    pendingScore += GameConfig.SCORE_KEYCARD;
                }
                case OBJECTIVE -> {
                    objectives++;
                    pendingScore += GameConfig.SCORE_OBJECTIVE;
                }
            }
        } else if (event instanceof GameEvent.TurnCompleted) {
            turnCount = event.turn();
            totalTurns++;
        } else if (event instanceof GameEvent.FloorWon) {
            floorsCleared++;
            score += pendingScore + Math.max(0, GameConfig.SCORE_FLOOR_CLEAR - event.turn());
            pendingScore = 0;
        }
    }

    public RunSeed runSeed() { return runSeed; }
    public int floorIndex() { return floorIndex; }
    public int turnCount() { return turnCount; }
    public int totalTurns() { return totalTurns; }
    public int keycards() { return keycards; }
    public int objectives() { return objectives; }
    public int floorsCleared() { return floorsCleared; }
    public int pendingScore() { return pendingScore; }
    public RunStatus status() { return status; }

    /** Banked score; pending floor points are not included until the floor is won. */
    public int score() { return score; }

    /** Plain key/value counters in a fixed order, enough to resume statistics display. */
    public Map<String, Object> snapshot() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("runSeed", runSeed == null ? "" : runSeed.label());
        out.put("floorIndex", floorIndex);
        out.put("turnCount", turnCount);
        out.put("totalTurns", totalTurns);
        out.put("keycards", keycards);
        out.put("objectives", objectives);
        out.put("floorsCleared", floorsCleared);
        out.put("score", score);
        out.put("status", status.name());
        return Collections.unmodifiableMap(out);
    }
}
