package org.maze.core.generation;

import org.maze.core.model.Cell;
import org.maze.core.model.Grid;
import org.maze.core.topology.DistanceEngine;
import org.maze.core.topology.Distances;

import java.util.List;

public final class Validation {

    private Validation() {}

    public static void afterGrid(MazeContext ctx) {
        Grid grid = ctx.grid;
        if (grid == null) {
            throw new IllegalStateException("Grid not built after Grid stage");
        }
        checkCellCount(ctx);

        if (grid.initialState() != ctx.algorithm.requiredState()) {
            throw new IllegalStateException("Grid state " + grid.initialState() + " does not match "
                    + ctx.algorithm.name() + " (wants " + ctx.algorithm.requiredState() + ")");
        }
        if (!grid.isPristine()) {
            throw new IllegalStateException("Fresh " + grid.initialState() + " grid has unexpected links");
        }
    }

    public static void afterCarve(MazeContext ctx) {
        Grid grid = ctx.grid;
        checkCellCount(ctx);
        checkSymmetry(grid);

        Distances reach = DistanceEngine.compute(grid, grid.at(0, 0));
        if (reach.size() != grid.size()) {
            throw new IllegalStateException(ctx.algorithm.name() + " left unreachable cells: reached="
                    + reach.size() + " total=" + grid.size());
        }

        // connected + links == cells - 1  <=>  spanning tree
        int cycles = grid.linkCount() - (grid.size() - 1);
        if (cycles > 0) {
            System.out.println("[WARN] " + ctx.algorithm.name() + " produced " + cycles
                    + " extra link(s); longest path is not guaranteed to be the diameter");
        }
    }

    public static void afterLongestPath(MazeContext ctx) {
        LongestPath.Result lp = ctx.longestPath;
        if (lp == null) {
            throw new IllegalStateException("Longest path not computed");
        }
        List<Cell> path = lp.path();
        if (path.size() != lp.length() + 1) {
            throw new IllegalStateException("Path size " + path.size() + " does not match length " + lp.length());
        }
        if (path.get(0) != lp.start() || path.get(path.size() - 1) != lp.goal()) {
            throw new IllegalStateException("Path endpoints differ from " + lp.start() + " -> " + lp.goal());
        }
        for (int i = 1; i < path.size(); i++) {
            if (!path.get(i - 1).isLinked(path.get(i))) {
                throw new IllegalStateException("Path step not linked: " + path.get(i - 1) + " -> " + path.get(i));
            }
        }
    }

    public static void afterDeadEnds(MazeContext ctx) {
        for (Cell c : ctx.deadEnds) {
            if (c.linkCount() != 1) {
                throw new IllegalStateException("Dead end " + c + " has " + c.linkCount() + " links");
            }
        }
        if (ctx.deadEnds.isEmpty() && ctx.grid.size() > 1) {
            System.out.println("[WARN] No dead ends in " + ctx.grid);
        }
    }

    static void checkSymmetry(Grid grid) {
        for (Cell c : grid) {
            for (Cell n : c.links()) {
                if (!n.isLinked(c)) {
                    throw new IllegalStateException("Asymmetric link " + c + " -> " + n);
                }
            }
        }
    }

    private static void checkCellCount(MazeContext ctx) {
        int want = ctx.settings.rows * ctx.settings.columns;
        if (ctx.grid.size() != want) {
            throw new IllegalStateException("Wrong cell count have=" + ctx.grid.size() + " want=" + want);
        }
    }
}
