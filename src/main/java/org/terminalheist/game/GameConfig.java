package org.terminalheist.game;

public final class GameConfig {
    private GameConfig() {}

    // Floor size in tiles
    public static final int GRID_W = 24;
    public static final int GRID_H = 14;
    public static final int MIN_GRID_SIZE = 5;

    // Generation
    public static final double WALL_DENSITY = 0.22;
    public static final int GUARD_COUNT = 2;
    public static final int GUARD_MIN_DISTANCE = 6;   // from start/objective/exit
    public static final int GUARD_SPACING = 3;        // between guards
    public static final int KEY_MIN_DISTANCE = 3;     // from start
    public static final int SLOW_TERRAIN_COST = 2;
    public static final int MAX_GEN_ATTEMPTS = 200;

    // Guard tuning
    public static final int VISION_RANGE = 6;
    public static final int CHASE_DURATION = 5;
    public static final int ALERT_DURATION = 4;
    public static final int HAZARD_ALERT_RADIUS = 5;

    // Run
    public static final int FLOORS_PER_RUN = 3;
    public static final int MAX_DOORS = 3;

    // Score
    public static final int SCORE_KEYCARD = 25;
    public static final int SCORE_OBJECTIVE = 100;
    public static final int SCORE_FLOOR_CLEAR = 500;
}
