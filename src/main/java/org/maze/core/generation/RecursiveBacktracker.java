package org.maze.core.generation;

import org.maze.core.model.Cell;
import org.maze.core.model.Grid;
import org.maze.core.model.GridState;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * Depth-first carve with an explicit stack. Long, winding corridors with few branches.
 */
public class RecursiveBacktracker implements MazeAlgorithm {

    @Override
    public String name() {
        return "RecursiveBacktracker";
    }

    @Override
    public GridState requiredState() {
        return GridState.CLOSED;
    }

    @Override
    public Grid apply(Grid grid, Random rng) {
        Algorithms.checkPreconditions(this, grid, rng);

        Deque<Cell> stack = new ArrayDeque<>();
        Set<Cell> visited = new HashSet<>();

        Cell first = grid.randomCell(rng);
        visited.add(first);
        stack.push(first);

        while (!stack.isEmpty()) {
            Cell current = stack.peek();

            List<Cell> candidates = new ArrayList<>(4);
            for (Cell n : current.neighbors()) {
                if (!visited.contains(n)) candidates.add(n);
            }

            if (candidates.isEmpty()) {
                stack.pop();
            } else {
                Cell next = candidates.get(rng.nextInt(candidates.size()));
                current.link(next);
                visited.add(next);
                stack.push(next);
            }
        }
        return grid;
    }
}
