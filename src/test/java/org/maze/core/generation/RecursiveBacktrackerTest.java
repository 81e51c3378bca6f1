package org.maze.core.generation;

import org.junit.jupiter.api.Test;
import org.maze.core.model.Grid;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RecursiveBacktrackerTest {

    private final RecursiveBacktracker algorithm = new RecursiveBacktracker();

    @Test
    void producesSpanningTree() {
        for (long seed = 1; seed <= 20; seed++) {
            Grid grid = algorithm.apply(Grid.closed(10, 7), new Random(seed));
            MazeAssertions.assertSpanningTree(grid);
        }
    }

    @Test
    void sameSeedSameMaze() {
        Grid a = algorithm.apply(Grid.closed(12, 12), new Random(2024));
        Grid b = algorithm.apply(Grid.closed(12, 12), new Random(2024));

        assertEquals(MazeAssertions.signature(a), MazeAssertions.signature(b));
    }

    @Test
    void differentSeedsUsuallyDiffer() {
        Grid a = algorithm.apply(Grid.closed(12, 12), new Random(1));
        Grid b = algorithm.apply(Grid.closed(12, 12), new Random(2));

        assertNotEquals(MazeAssertions.signature(a), MazeAssertions.signature(b));
    }

    @Test
    void rejectsMissingRandomSource() {
        assertThrows(IllegalArgumentException.class, () -> algorithm.apply(Grid.closed(3, 3), null));
        assertThrows(IllegalArgumentException.class, () -> algorithm.apply(null, new Random(1)));
    }
}
