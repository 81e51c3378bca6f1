package org.maze.core.generation;

import org.maze.core.model.Cell;
import org.maze.core.model.Grid;
import org.maze.core.model.GridState;

import java.util.Random;

/**
 * Carves walls into a fully open grid: split the region, wall the split line except one passage,
 * recurse into both halves.
 *
 * Without rooms the recursion runs down to one-cell-wide strips and the result is a perfect maze.
 * With rooms, a region under {@link #ROOM_SIZE} in both directions is left open one time in
 * {@link #ROOM_ODDS}; such rooms contain cycles.
 */
public class RecursiveDivision implements MazeAlgorithm {

    static final int TOO_SMALL = 1;
    static final int ROOM_SIZE = 5;
    static final int ROOM_ODDS = 4;

    private final boolean rooms;

    public RecursiveDivision() {
        this(false);
    }

    private RecursiveDivision(boolean rooms) {
        this.rooms = rooms;
    }

    public static RecursiveDivision withRooms() {
        return new RecursiveDivision(true);
    }

    public boolean leavesRooms() {
        return rooms;
    }

    @Override
    public String name() {
        return rooms ? "RecursiveDivisionRooms" : "RecursiveDivision";
    }

    @Override
    public GridState requiredState() {
        return GridState.OPEN;
    }

    @Override
    public Grid apply(Grid grid, Random rng) {
        Algorithms.checkPreconditions(this, grid, rng);
        divide(grid, rng, 0, 0, grid.rows, grid.columns);
        return grid;
    }

    private void divide(Grid grid, Random rng, int row, int column, int height, int width) {
        if (height <= TOO_SMALL || width <= TOO_SMALL) return;
        if (rooms && height < ROOM_SIZE && width < ROOM_SIZE && rng.nextInt(ROOM_ODDS) == 0) return;

        if (height > width) {
            divideHorizontally(grid, rng, row, column, height, width);
        } else {
            divideVertically(grid, rng, row, column, height, width);
        }
    }

    private void divideHorizontally(Grid grid, Random rng, int row, int column, int height, int width) {
        int southOf = rng.nextInt(height - 1);
        int passageAt = rng.nextInt(width);

        for (int x = 0; x < width; x++) {
            if (x == passageAt) continue;
            Cell cell = grid.at(row + southOf, column + x);
            cell.unlink(cell.south());
        }

        divide(grid, rng, row, column, southOf + 1, width);
        divide(grid, rng, row + southOf + 1, column, height - southOf - 1, width);
    }

    private void divideVertically(Grid grid, Random rng, int row, int column, int height, int width) {
        int eastOf = rng.nextInt(width - 1);
        int passageAt = rng.nextInt(height);

        for (int y = 0; y < height; y++) {
            if (y == passageAt) continue;
            Cell cell = grid.at(row + y, column + eastOf);
            cell.unlink(cell.east());
        }

        divide(grid, rng, row, column, height, eastOf + 1);
        divide(grid, rng, row, column + eastOf + 1, height, width - eastOf - 1);
    }
}
