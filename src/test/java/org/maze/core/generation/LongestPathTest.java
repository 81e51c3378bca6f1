package org.maze.core.generation;

import org.junit.jupiter.api.Test;
import org.maze.core.model.Cell;
import org.maze.core.model.Grid;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LongestPathTest {

    @Test
    void sameSeedGivesSameEndpoints() {
        LongestPath.Result first = run(5, 5, 31);
        LongestPath.Result second = run(5, 5, 31);

        assertEquals(first.start().row, second.start().row);
        assertEquals(first.start().column, second.start().column);
        assertEquals(first.goal().row, second.goal().row);
        assertEquals(first.goal().column, second.goal().column);
        assertEquals(first.length(), second.length());
    }

    @Test
    void findsTheDiameterOfATree() {
        for (MazeAlgorithm algorithm : Algorithms.AVAILABLE) {
            for (long seed = 1; seed <= 5; seed++) {
                Random rng = new Random(seed);
                Grid grid = algorithm.apply(Algorithms.newGrid(algorithm, 6, 7), rng);

                LongestPath.Result result = LongestPath.apply(grid, rng);

                assertEquals(bruteForceDiameter(grid), result.length(), algorithm.name() + " seed " + seed);
            }
        }
    }

    @Test
    void pathRunsFromStartToGoalThroughLinks() {
        Grid grid = new RecursiveBacktracker().apply(Grid.closed(8, 8), new Random(4));

        LongestPath.Result result = LongestPath.apply(grid, grid.at(0, 0));
        List<Cell> path = result.path();

        assertSame(result.start(), path.get(0));
        assertSame(result.goal(), path.get(path.size() - 1));
        assertEquals(result.length() + 1, path.size());
        for (int i = 1; i < path.size(); i++) {
            assertTrue(path.get(i - 1).isLinked(path.get(i)));
        }
    }

    @Test
    void straightCorridorSpansEndToEnd() {
        Grid grid = Grid.open(1, 6);

        LongestPath.Result result = LongestPath.apply(grid, grid.at(0, 2));

        assertEquals(5, result.length());
        assertEquals(5, Math.abs(result.start().column - result.goal().column));
    }

    @Test
    void singleCellHasZeroLength() {
        Grid grid = Grid.closed(1, 1);

        LongestPath.Result result = LongestPath.apply(grid, new Random(1));

        assertEquals(0, result.length());
        assertSame(result.start(), result.goal());
        assertEquals(List.of(grid.at(0, 0)), result.path());
    }

    @Test
    void leavesLinksUntouched() {
        Grid grid = new AldousBroder().apply(Grid.closed(5, 5), new Random(9));
        String before = MazeAssertions.signature(grid);

        LongestPath.apply(grid, new Random(9));

        assertEquals(before, MazeAssertions.signature(grid));
    }

    private static LongestPath.Result run(int rows, int columns, long seed) {
        Random rng = new Random(seed);
        Grid grid = new BinaryTree().apply(Grid.closed(rows, columns), rng);
        return LongestPath.apply(grid, rng);
    }

    private static int bruteForceDiameter(Grid grid) {
        int best = 0;
        for (Cell c : grid) {
            best = Math.max(best, c.distances().max().distance());
        }
        return best;
    }
}
