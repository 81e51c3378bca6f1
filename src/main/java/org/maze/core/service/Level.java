package org.maze.core.service;

import org.maze.core.generation.MazeStats;
import org.maze.core.model.Cell;
import org.maze.core.model.Grid;

import java.util.List;

/**
 * Finished level handed to collaborators: carved grid with tile markers, entry/exit cells and
 * dead ends for feature placement.
 */
public class Level {

    public final long seed;
    public final String algorithm;
    public final Grid grid;

    /** Player entry (one end of the longest path). */
    public final Cell start;
    /** Stairs (the other end). */
    public final Cell goal;
    public final List<Cell> path;
    public final List<Cell> deadEnds;

    public final MazeStats stats;

    public Level(long seed, String algorithm, Grid grid, Cell start, Cell goal,
                 List<Cell> path, List<Cell> deadEnds, MazeStats stats) {
        this.seed = seed;
        this.algorithm = algorithm;
        this.grid = grid;
        this.start = start;
        this.goal = goal;
        this.path = List.copyOf(path);
        this.deadEnds = List.copyOf(deadEnds);
        this.stats = stats;
    }

    public int pathLength() {
        return path.size() - 1;
    }
}
