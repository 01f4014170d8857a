package org.terminalheist.world;

import org.terminalheist.game.GameConfig;
import org.terminalheist.game.util.RunSeed;

import java.util.Objects;
import java.util.Optional;

/**
 * Parameters for one {@link DungeonGenerator#generate(GenerationRequest)} call. Values are taken as
 * given; {@link #validate()} reports degenerate ones instead of clamping them.
 */
public final class GenerationRequest {
    private final int width;
    private final int height;
    private final RunSeed runSeed;
    private final int floorIndex;
    private final double wallDensity;
    private final int guardCount;
    private final int guardMinDistance;
    private final int guardSpacing;
    private final boolean placeKeys;
    private final int keyMinDistance;
    private final int doorCount;
    private final int slowTerrainCount;
    private final int slowTerrainCost;
    private final int hazardCount;
    private final int maxAttempts;

    private GenerationRequest(Builder builder) {
        this.width = builder.width;
        this.height = builder.height;
        this.runSeed = builder.runSeed;
        this.floorIndex = builder.floorIndex;
        this.wallDensity = builder.wallDensity;
        this.guardCount = builder.guardCount;
        this.guardMinDistance = builder.guardMinDistance;
        this.guardSpacing = builder.guardSpacing;
        this.placeKeys = builder.placeKeys;
        this.keyMinDistance = builder.keyMinDistance;
        this.doorCount = builder.doorCount;
        this.slowTerrainCount = builder.slowTerrainCount;
        this.slowTerrainCost = builder.slowTerrainCost;
        this.hazardCount = builder.hazardCount;
        this.maxAttempts = builder.maxAttempts;
    }

    /**
     * @return a description of the first invalid parameter, or empty when the request is usable
     */
    public Optional<String> validate() {
        if (width < GameConfig.MIN_GRID_SIZE || height < GameConfig.MIN_GRID_SIZE) {
            return Optional.of("grid " + width + "x" + height + " is smaller than the minimum "
                    + GameConfig.MIN_GRID_SIZE + "x" + GameConfig.MIN_GRID_SIZE);
        }
        if (Double.isNaN(wallDensity) || wallDensity < 0.0 || wallDensity > 1.0) {
            return Optional.of("wall density " + wallDensity + " is outside [0,1]");
        }
        if (guardCount < 0) return Optional.of("guard count must not be negative: " + guardCount);
        if (doorCount < 0) return Optional.of("door count must not be negative: " + doorCount);
        if (slowTerrainCount < 0) return Optional.of("slow terrain count must not be negative: " + slowTerrainCount);
        if (hazardCount < 0) return Optional.of("hazard count must not be negative: " + hazardCount);
        if (guardMinDistance < 0 || guardSpacing < 0 || keyMinDistance < 0) {
            return Optional.of("minimum distances must not be negative");
        }
        if (slowTerrainCost < 2) return Optional.of("slow terrain cost must be at least 2: " + slowTerrainCost);
        if (maxAttempts < 1) return Optional.of("max attempts must be at least 1: " + maxAttempts);
        return Optional.empty();
    }

    public int width() { return width; }
    public int height() { return height; }
    public RunSeed runSeed() { return runSeed; }
    public int floorIndex() { return floorIndex; }
    public double wallDensity() { return wallDensity; }
    public int guardCount() { return guardCount; }
    public int guardMinDistance() { return guardMinDistance; }
    public int guardSpacing() { return guardSpacing; }
    public boolean placeKeys() { return placeKeys; }
    public int keyMinDistance() { return keyMinDistance; }
    public int doorCount() { return doorCount; }
    public int slowTerrainCount() { return slowTerrainCount; }
    public int slowTerrainCost() { return slowTerrainCost; }
    public int hazardCount() { return hazardCount; }
    public int maxAttempts() { return maxAttempts; }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "GenerationRequest{" + width + "x" + height + ", seed=" + runSeed + ", floor=" + floorIndex
                + ", density=" + wallDensity + ", guards=" + guardCount + ", doors=" + doorCount
                + ", slow=" + slowTerrainCount + ", hazards=" + hazardCount + "}";
    }

    public static final class Builder {
        private int width = GameConfig.GRID_W;
        private int height = GameConfig.GRID_H;
        private RunSeed runSeed;
        private int floorIndex = 0;
        private double wallDensity = GameConfig.WALL_DENSITY;
        private int guardCount = GameConfig.GUARD_COUNT;
        private int guardMinDistance = GameConfig.GUARD_MIN_DISTANCE;
        private int guardSpacing = GameConfig.GUARD_SPACING;
        private boolean placeKeys = false;
        private int keyMinDistance = GameConfig.KEY_MIN_DISTANCE;
        private int doorCount = 0;
        private int slowTerrainCount = 0;
        private int slowTerrainCost = GameConfig.SLOW_TERRAIN_COST;
        private int hazardCount = 0;
        private int maxAttempts = GameConfig.MAX_GEN_ATTEMPTS;

        private Builder() {
        }

        public Builder size(int width, int height) {
            this.width = width;
            this.height = height;
            return this;
        }

        public Builder runSeed(RunSeed runSeed) {
            this.runSeed = Objects.requireNonNull(runSeed, "runSeed");
            return this;
        }

        public Builder floorIndex(int floorIndex) {
            this.floorIndex = floorIndex;
            return this;
        }

        public Builder wallDensity(double wallDensity) {
            this.wallDensity = wallDensity;
            return this;
        }

        public Builder guardCount(int guardCount) {
            this.guardCount = guardCount;
            return this;
        }

        public Builder guardMinDistance(int guardMinDistance) {
            this.guardMinDistance = guardMinDistance;
            return this;
        }

        public Builder guardSpacing(int guardSpacing) {
            this.guardSpacing = guardSpacing;
            return this;
        }

        public Builder placeKeys(boolean placeKeys) {
            this.placeKeys = placeKeys;
            return this;
        }

        public Builder keyMinDistance(int keyMinDistance) {
            this.keyMinDistance = keyMinDistance;
            return this;
        }

        public Builder doorCount(int doorCount) {
            this.doorCount = doorCount;
            return this;
        }

        public Builder slowTerrain(int count, int cost) {
            this.slowTerrainCount = count;
            this.slowTerrainCost = cost;
            return this;
        }

        public Builder hazardCount(int hazardCount) {
            this.hazardCount = hazardCount;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public GenerationRequest build() {
            Objects.requireNonNull(runSeed, "runSeed must be set");
            return new GenerationRequest(this);
        }
    }
}
