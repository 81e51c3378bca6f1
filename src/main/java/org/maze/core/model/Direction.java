package org.maze.core.model;

/**
 * Physical adjacency directions on the rectangular lattice.
 * Declaration order (N, S, E, W) is the iteration order of neighbours and links.
 */
public enum Direction {
    NORTH(-1, 0),
    SOUTH(1, 0),
    EAST(0, 1),
    WEST(0, -1);

    public final int dRow;
    public final int dColumn;

    Direction(int dRow, int dColumn) {
        this.dRow = dRow;
        this.dColumn = dColumn;
    }

    public Direction opposite() {
        return switch (this) {
            case NORTH -> SOUTH;
            case SOUTH -> NORTH;
            case EAST -> WEST;
            case WEST -> EAST;
        };
    }

    int bit() {
        return 1 << ordinal();
    }
}
