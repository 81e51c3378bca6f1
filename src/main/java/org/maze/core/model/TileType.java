package org.maze.core.model;

/**
 * Tile markers written onto cells by the level layout.
 * The grid stores them, it never interprets them.
 */
public final class TileType {

    public static final char EMPTY = ' ';
    public static final char WALL = '#';
    public static final char PLAYER = '@';
    public static final char STAIRS = '%';

    private TileType() {}
}
