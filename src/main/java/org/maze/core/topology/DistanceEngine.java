package org.maze.core.topology;

import org.maze.core.model.Cell;
import org.maze.core.model.Grid;

import java.util.ArrayDeque;
import java.util.List;

/**
 * Breadth-first distances over the link graph. Every link weighs 1, so BFS gives the same
 * result a Dijkstra relaxation would.
 */
public final class DistanceEngine {

    private DistanceEngine() {}

    public static Distances compute(Grid grid, Cell start) {
        requireOwned(grid, start, "start");

        Distances distances = new Distances(start);
        ArrayDeque<Cell> frontier = new ArrayDeque<>();
        frontier.add(start);

        while (!frontier.isEmpty()) {
            Cell cell = frontier.poll();
            int next = distances.get(cell) + 1;
            for (Cell linked : cell.links()) {
                if (distances.contains(linked)) continue;
                distances.put(linked, next);
                frontier.add(linked);
            }
        }
        return distances;
    }

    /** Callers check {@code distances.contains(goal)} first. */
    public static List<Cell> pathTo(Distances distances, Cell goal) {
        return distances.pathTo(goal);
    }

    public static List<Cell> shortestPath(Grid grid, Cell start, Cell goal) {
        requireOwned(grid, goal, "goal");
        return compute(grid, start).pathTo(goal);
    }

    public static boolean pathExists(Grid grid, Cell start, Cell goal) {
        requireOwned(grid, goal, "goal");
        return compute(grid, start).contains(goal);
    }

    private static void requireOwned(Grid grid, Cell cell, String what) {
        if (grid == null) {
            throw new IllegalArgumentException("Grid is required");
        }
        if (cell == null || cell.grid() != grid) {
            throw new IllegalArgumentException("The " + what + " cell must belong to " + grid + ": " + cell);
        }
    }
}
