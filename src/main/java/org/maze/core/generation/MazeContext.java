package org.maze.core.generation;

import org.maze.core.model.Cell;
import org.maze.core.model.Grid;
import org.maze.core.model.config.MazeSettings;

import java.util.List;
import java.util.Random;

/**
 * State of one level generation (one run = one context). Stages read and fill it in order.
 */
public class MazeContext {

    public final MazeSettings settings;

    /** The only random source of the run, seeded from settings. */
    public final Random rng;

    /** Resolved by the GRID stage. */
    public MazeAlgorithm algorithm;
    public Grid grid;

    /** Filled by LONGEST_PATH; null when the stage is disabled. */
    public LongestPath.Result longestPath;

    /** Filled by DEAD_ENDS; null when the stage is disabled. */
    public List<Cell> deadEnds;

    public MazeStats stats;

    public MazeContext(MazeSettings settings) {
        if (settings == null) {
            throw new IllegalArgumentException("Maze settings are required");
        }
        this.settings = settings;
        this.rng = new Random(settings.seed);
    }
}
