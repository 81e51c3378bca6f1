package org.maze.core.generation;

public enum StageId {
    GRID,
    CARVE,
    LONGEST_PATH,
    DEAD_ENDS,
    TILES
}
