package org.terminalheist.game;

import org.terminalheist.ai.GuardTuning;
import org.terminalheist.game.util.RunSeed;
import org.terminalheist.world.GenerationRequest;

import java.util.Objects;

/**
 * Turns a floor number (1-based) into generation parameters and guard tuning. Later floors get
 * more guards, doors, hazards and slow terrain, denser walls and longer chases.
 */
public final class DifficultyRamp {

    private static final double MAX_WALL_DENSITY = 0.30;

    private final int width;
    private final int height;
    private final double baseWallDensity;
    private final int baseGuards;
    private final GuardTuning baseTuning;

    public DifficultyRamp(int width, int height, double baseWallDensity, int baseGuards, GuardTuning baseTuning) {
        this.width = width;
        this.height = height;
        this.baseWallDensity = baseWallDensity;
        this.baseGuards = baseGuards;
        this.baseTuning = Objects.requireNonNull(baseTuning, "baseTuning");
    }

    public static DifficultyRamp standard() {
        return new DifficultyRamp(GameConfig.GRID_W, GameConfig.GRID_H, GameConfig.WALL_DENSITY,
                GameConfig.GUARD_COUNT, GuardTuning.defaults());
    }

    public GenerationRequest requestFor(RunSeed seed, int floor) {
        int step = Math.max(0, floor - 1);
        return GenerationRequest.builder()
                .size(width, height)
                .runSeed(seed)
                .floorIndex(floor)
                .wallDensity(Math.min(MAX_WALL_DENSITY, baseWallDensity + 0.02 * step))
                .guardCount(baseGuards + step)
                .placeKeys(true)
                .doorCount(Math.min(GameConfig.MAX_DOORS, step))
                .slowTerrain(2 + step, GameConfig.SLOW_TERRAIN_COST)
                .hazardCount(step + 1)
                .build();
    }

    public GuardTuning tuningFor(int floor) {
        int step = Math.max(0, floor - 1);
        return new GuardTuning(baseTuning.visionRange() + step / 2, baseTuning.chaseDuration() + step,
                baseTuning.alertDuration(), baseTuning.hazardAlertRadius(), baseTuning.costAwarePursuit());
    }
}
