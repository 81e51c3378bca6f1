package org.maze.core.generation;

import org.maze.core.model.Cell;
import org.maze.core.model.Grid;
import org.maze.core.model.GridState;

import java.util.Random;

/**
 * For every cell, opens either north or east (coin flip when both exist).
 * Leaves an unbroken corridor along the top row and the right column.
 */
public class BinaryTree implements MazeAlgorithm {

    @Override
    public String name() {
        return "BinaryTree";
    }

    @Override
    public GridState requiredState() {
        return GridState.CLOSED;
    }

    @Override
    public Grid apply(Grid grid, Random rng) {
        Algorithms.checkPreconditions(this, grid, rng);

        for (Cell cell : grid) {
            Cell north = cell.north();
            Cell east = cell.east();

            if (north != null && east != null) {
                cell.link(rng.nextInt(2) == 0 ? north : east);
            } else if (north != null) {
                cell.link(north);
            } else if (east != null) {
                cell.link(east);
            }
        }
        return grid;
    }
}
