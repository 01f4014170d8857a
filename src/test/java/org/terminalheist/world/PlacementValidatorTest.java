package org.terminalheist.world;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PlacementValidatorTest {

    @Test
    @DisplayName("open layout without doors is valid")
    void openLayoutValid() {
        GridMap g = GridMap.parse(
                "#####",
                "#.$>#",
                "#####");
        assertTrue(PlacementValidator.validate(g, Pos.of(1, 1), Pos.of(2, 1), Pos.of(3, 1), List.of()).isEmpty());
    }

    @Test
    @DisplayName("objective behind a wall is rejected")
    void unreachableObjective() {
        GridMap g = GridMap.parse(
                "######",
                "#.#$>#",
                "######");
        assertTrue(PlacementValidator.validate(g, Pos.of(1, 1), Pos.of(3, 1), Pos.of(4, 1), List.of()).isPresent());
    }

    @Test
    @DisplayName("exit unreachable from the objective is rejected")
    void unreachableExit() {
        GridMap g = GridMap.parse(
                "######",
                "#.$#>#",
                "######");
        String problem = PlacementValidator.validate(g, Pos.of(1, 1), Pos.of(2, 1), Pos.of(4, 1), List.of()).orElseThrow();
        assertTrue(problem.contains("exit"));
    }

    @Test
    @DisplayName("doors count as passable for objective and exit reachability")
    void doorsArePassableForReachability() {
        GridMap g = GridMap.parse(
                "#######",
                "#.k+$>#",
                "#######");
        assertTrue(PlacementValidator.validate(g, Pos.of(1, 1), Pos.of(4, 1), Pos.of(5, 1), List.of(Pos.of(2, 1))).isEmpty());
    }

    @Test
    @DisplayName("closed door without any key is rejected")
    void doorWithoutKey() {
        GridMap g = GridMap.parse(
                "######",
                "#.+$>#",
                "######");
        assertTrue(PlacementValidator.validate(g, Pos.of(1, 1), Pos.of(3, 1), Pos.of(4, 1), List.of()).isPresent());
    }

    @Test
    @DisplayName("key locked behind the only door is rejected")
    void keyBehindDoor() {
        GridMap g = GridMap.parse(
                "#######",
                "#.+k$>#",
                "#######");
        assertTrue(PlacementValidator.validate(g, Pos.of(1, 1), Pos.of(4, 1), Pos.of(5, 1), List.of(Pos.of(3, 1))).isPresent());
    }

    @Test
    @DisplayName("open doors need no key")
    void openDoorNeedsNoKey() {
        GridMap g = GridMap.parse(
                "######",
                "#./$>#",
                "######");
        assertTrue(PlacementValidator.validate(g, Pos.of(1, 1), Pos.of(3, 1), Pos.of(4, 1), List.of()).isEmpty());
    }
}
