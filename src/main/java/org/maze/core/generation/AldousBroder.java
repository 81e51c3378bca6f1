package org.maze.core.generation;

import org.maze.core.model.Cell;
import org.maze.core.model.Grid;
import org.maze.core.model.GridState;

import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * Random walk that links into every cell the first time it is entered. Uniform spanning tree,
 * but the walk can take a long time to cover a large grid.
 */
public class AldousBroder implements MazeAlgorithm {

    @Override
    public String name() {
        return "AldousBroder";
    }

    @Override
    public GridState requiredState() {
        return GridState.CLOSED;
    }

    @Override
    public Grid apply(Grid grid, Random rng) {
        Algorithms.checkPreconditions(this, grid, rng);

        Cell cell = grid.randomCell(rng);
        Set<Cell> visited = new HashSet<>();
        visited.add(cell);
        int unvisited = grid.size() - 1;

        while (unvisited > 0) {
            List<Cell> neighbors = cell.neighbors();
            Cell next = neighbors.get(rng.nextInt(neighbors.size()));
            if (visited.add(next)) {
                cell.link(next);
                unvisited--;
            }
            cell = next;
        }
        return grid;
    }
}
