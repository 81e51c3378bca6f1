package org.maze.core.model;

import org.maze.core.topology.DistanceEngine;
import org.maze.core.topology.Distances;

import java.util.ArrayList;
import java.util.List;

/**
 * One node of the maze lattice.
 *
 * Rules:
 * - row/column and physical neighbours are fixed when the owning {@link Grid} is built.
 * - Neighbours are stored as indices into the grid's cell array, never as owning references.
 * - Links are a bit mask over {@link Direction}; only {@link #links} state and {@link #tile} mutate.
 */
public class Cell {

    private static final int NONE = -1;

    private final Grid grid;
    private final int index;

    public final int row;
    public final int column;

    /** Opaque marker for collaborators (rendering, feature placement). */
    public char tile = TileType.EMPTY;

    private final int[] neighborIndex = {NONE, NONE, NONE, NONE};
    private int links;

    Cell(Grid grid, int index, int row, int column) {
        this.grid = grid;
        this.index = index;
        this.row = row;
        this.column = column;
    }

    void wire(Direction d, int otherIndex) {
        neighborIndex[d.ordinal()] = otherIndex;
    }

    public Grid grid() {
        return grid;
    }

    public Cell north() {
        return neighbor(Direction.NORTH);
    }

    public Cell south() {
        return neighbor(Direction.SOUTH);
    }

    public Cell east() {
        return neighbor(Direction.EAST);
    }

    public Cell west() {
        return neighbor(Direction.WEST);
    }

    public Cell neighbor(Direction d) {
        int i = neighborIndex[d.ordinal()];
        return (i == NONE) ? null : grid.byIndex(i);
    }

    public void link(Cell other) {
        link(other, true);
    }

    /**
     * Opens the wall towards {@code other}. No-op if {@code other} is null or not a physical neighbour.
     * A one-way link breaks symmetry until the reverse link is made; only grid construction does that.
     */
    public void link(Cell other, boolean bidirectional) {
        Direction d = directionOf(other);
        if (d == null) return;

        links |= d.bit();
        if (bidirectional) {
            other.links |= d.opposite().bit();
        }
    }

    public void unlink(Cell other) {
        unlink(other, true);
    }

    public void unlink(Cell other, boolean bidirectional) {
        Direction d = directionOf(other);
        if (d == null) return;

        links &= ~d.bit();
        if (bidirectional) {
            other.links &= ~d.opposite().bit();
        }
    }

    public boolean isLinked(Cell other) {
        Direction d = directionOf(other);
        return d != null && (links & d.bit()) != 0;
    }

    public boolean hasLink(Direction d) {
        return (links & d.bit()) != 0 && neighborIndex[d.ordinal()] != NONE;
    }

    /** Physically adjacent cells (N, S, E, W order), regardless of link state. */
    public List<Cell> neighbors() {
        List<Cell> out = new ArrayList<>(4);
        for (Direction d : Direction.values()) {
            Cell n = neighbor(d);
            if (n != null) out.add(n);
        }
        return out;
    }

    /** Currently linked neighbours (N, S, E, W order). */
    public List<Cell> links() {
        List<Cell> out = new ArrayList<>(4);
        for (Direction d : Direction.values()) {
            if (hasLink(d)) out.add(neighbor(d));
        }
        return out;
    }

    public int linkCount() {
        return Integer.bitCount(links);
    }

    public boolean hasLinks() {
        return links != 0;
    }

    /** BFS distances rooted at this cell, snapshot of the current link graph. */
    public Distances distances() {
        return DistanceEngine.compute(grid, this);
    }

    private Direction directionOf(Cell other) {
        if (other == null || other.grid != grid) return null;
        for (Direction d : Direction.values()) {
            if (neighborIndex[d.ordinal()] == other.index) return d;
        }
        return null;
    }

    @Override
    public String toString() {
        return "Cell[" + row + "," + column + "]";
    }
}
