package org.maze.core.topology;

import org.maze.core.model.Cell;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hop counts from one root cell, captured from the link graph at computation time.
 * Cells that were not reached are absent; there is no sentinel distance.
 */
public class Distances {

    private final Cell root;
    // insertion order = BFS discovery order
    private final Map<Cell, Integer> cells = new LinkedHashMap<>();

    Distances(Cell root) {
        this.root = root;
        cells.put(root, 0);
    }

    void put(Cell cell, int distance) {
        cells.put(cell, distance);
    }

    public Cell root() {
        return root;
    }

    /** Distance to {@code cell}, or null when it was not reached. */
    public Integer get(Cell cell) {
        return cells.get(cell);
    }

    public boolean contains(Cell cell) {
        return cells.containsKey(cell);
    }

    /** Reached cells in BFS order, root first. */
    public List<Cell> cells() {
        return Collections.unmodifiableList(new ArrayList<>(cells.keySet()));
    }

    public int size() {
        return cells.size();
    }

    /** Farthest reached cell; the first one found wins a tie. */
    public Farthest max() {
        Cell maxCell = root;
        int maxDistance = 0;
        for (Map.Entry<Cell, Integer> e : cells.entrySet()) {
            if (e.getValue() > maxDistance) {
                maxCell = e.getKey();
                maxDistance = e.getValue();
            }
        }
        return new Farthest(maxCell, maxDistance);
    }

    /**
     * Walks back from {@code goal} to the root through linked neighbours whose distance is exactly
     * one less. Result is ordered root first, goal last.
     */
    public List<Cell> pathTo(Cell goal) {
        Integer goalDistance = cells.get(goal);
        if (goalDistance == null) {
            throw new IllegalArgumentException("Goal " + goal + " is not reachable from " + root);
        }

        List<Cell> path = new ArrayList<>(goalDistance + 1);
        Cell current = goal;
        int d = goalDistance;
        path.add(current);

        while (d > 0) {
            Cell previous = null;
            for (Cell n : current.links()) {
                Integer nd = cells.get(n);
                if (nd != null && nd == d - 1) {
                    previous = n;
                    break;
                }
            }
            if (previous == null) {
                // links changed after this snapshot was taken
                throw new IllegalStateException("Broken breadcrumb at " + current + " distance=" + d);
            }
            current = previous;
            d--;
            path.add(current);
        }

        Collections.reverse(path);
        return path;
    }

    public record Farthest(Cell cell, int distance) {
    }
}
