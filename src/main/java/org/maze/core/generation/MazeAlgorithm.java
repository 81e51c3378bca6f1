package org.maze.core.generation;

import org.maze.core.model.Grid;
import org.maze.core.model.GridState;

import java.util.Random;

/**
 * A maze generation strategy. Mutates link state in place and returns the same grid.
 * Each strategy is applied once to a freshly built grid in its {@link #requiredState()}.
 */
public interface MazeAlgorithm {
    String name();
    GridState requiredState();
    Grid apply(Grid grid, Random rng);
}
