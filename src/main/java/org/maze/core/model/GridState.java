package org.maze.core.model;

/**
 * Initial link state of a freshly built grid.
 */
public enum GridState {
    /** All cells allocated, zero links. Starting point for passage-opening algorithms. */
    CLOSED,
    /** Every physically adjacent pair linked. Starting point for wall-carving algorithms. */
    OPEN
}
