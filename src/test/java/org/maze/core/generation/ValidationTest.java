package org.maze.core.generation;

import org.junit.jupiter.api.Test;
import org.maze.core.model.Grid;
import org.maze.core.model.config.MazeSettings;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ValidationTest {

    @Test
    void carvedTreePasses() {
        MazeContext ctx = context(new BinaryTree(), 5, 5);
        ctx.grid = new BinaryTree().apply(Grid.closed(5, 5), new Random(1));

        assertDoesNotThrow(() -> Validation.afterCarve(ctx));
    }

    @Test
    void unreachableCellsFail() {
        MazeContext ctx = context(new BinaryTree(), 2, 2);
        ctx.grid = Grid.closed(2, 2);
        ctx.grid.at(0, 0).link(ctx.grid.at(0, 1));

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> Validation.afterCarve(ctx));
        assertTrue(e.getMessage().contains("unreachable"));
    }

    @Test
    void asymmetricLinkFails() {
        MazeContext ctx = context(new BinaryTree(), 1, 2);
        ctx.grid = Grid.closed(1, 2);
        ctx.grid.at(0, 0).link(ctx.grid.at(0, 1), false);

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> Validation.afterCarve(ctx));
        assertTrue(e.getMessage().contains("Asymmetric"));
    }

    @Test
    void wrongCellCountFails() {
        MazeContext ctx = context(new BinaryTree(), 3, 3);
        ctx.grid = Grid.closed(2, 2);

        assertThrows(IllegalStateException.class, () -> Validation.afterGrid(ctx));
    }

    @Test
    void gridInWrongStateFails() {
        MazeContext ctx = context(new RecursiveDivision(), 3, 3);
        ctx.grid = Grid.closed(3, 3);

        assertThrows(IllegalStateException.class, () -> Validation.afterGrid(ctx));
    }

    @Test
    void cyclesOnlyWarn() {
        MazeContext ctx = context(new RecursiveDivision(), 3, 3);
        ctx.grid = Grid.open(3, 3);

        assertDoesNotThrow(() -> Validation.afterCarve(ctx));
    }

    private static MazeContext context(MazeAlgorithm algorithm, int rows, int columns) {
        MazeContext ctx = new MazeContext(new MazeSettings(1L, rows, columns, algorithm.name()));
        ctx.algorithm = algorithm;
        return ctx;
    }
}
