package org.maze.core.generation;

import org.maze.core.model.Cell;
import org.maze.core.model.Grid;
import org.maze.core.topology.DistanceEngine;
import org.maze.core.topology.Distances;

import java.util.List;
import java.util.Random;

/**
 * Two-pass farthest-cell search. On a spanning tree the result is a diameter of the maze;
 * on a grid with cycles it is only a long path.
 * Read-only: link state is not touched.
 */
public final class LongestPath {

    private LongestPath() {}

    public static Result apply(Grid grid, Random rng) {
        if (grid == null) {
            throw new IllegalArgumentException("Grid is required");
        }
        return apply(grid, grid.randomCell(rng));
    }

    public static Result apply(Grid grid, Cell from) {
        Distances first = DistanceEngine.compute(grid, from);
        Cell start = first.max().cell();

        Distances second = DistanceEngine.compute(grid, start);
        Distances.Farthest goal = second.max();

        List<Cell> path = second.pathTo(goal.cell());
        return new Result(start, goal.cell(), goal.distance(), path);
    }

    /**
     * @param start  one end of the path (farthest cell from the search origin)
     * @param goal   the other end (farthest cell from {@code start})
     * @param length hop count between them
     * @param path   cells from start to goal inclusive
     */
    public record Result(Cell start, Cell goal, int length, List<Cell> path) {
    }
}
