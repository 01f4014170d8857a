package org.terminalheist.ai;

import org.terminalheist.game.GameConfig;

/**
 * Guard behaviour knobs, supplied by the difficulty collaborator.
 *
 * @param visionRange       max Manhattan distance at which a clear row/column sighting counts
 * @param chaseDuration     turns a chase lasts after the last sighting
 * @param alertDuration     turns a guard investigates a noise before giving up
 * @param hazardAlertRadius Manhattan radius within which a triggered hazard alerts guards
 * @param costAwarePursuit  pursue along the cheapest path (slow terrain weighted) instead of the shortest
 */
public record GuardTuning(int visionRange, int chaseDuration, int alertDuration, int hazardAlertRadius,
                          boolean costAwarePursuit) {

    public GuardTuning {
        if (visionRange < 0) throw new IllegalArgumentException("visionRange < 0");
        if (chaseDuration < 1) throw new IllegalArgumentException("chaseDuration < 1");
        if (alertDuration < 1) throw new IllegalArgumentException("alertDuration < 1");
        if (hazardAlertRadius < 0) throw new IllegalArgumentException("hazardAlertRadius < 0");
    }

    public static GuardTuning defaults() {
        return new GuardTuning(GameConfig.VISION_RANGE, GameConfig.CHASE_DURATION, GameConfig.ALERT_DURATION,
                GameConfig.HAZARD_ALERT_RADIUS, false);
    }

    public GuardTuning withVisionRange(int range) {
        return new GuardTuning(range, chaseDuration, alertDuration, hazardAlertRadius, costAwarePursuit);
    }

    public GuardTuning withCostAwarePursuit(boolean enabled) {
        return new GuardTuning(visionRange, chaseDuration, alertDuration, hazardAlertRadius, enabled);
    }
}
