package org.maze.core.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Random;

/**
 * Rectangular arena of cells, row-major. Dimensions and adjacency never change after construction;
 * algorithms only touch link state.
 */
public class Grid implements Iterable<Cell> {

    public final int rows;
    public final int columns;

    private final Cell[] cells;
    private final List<Cell> view;
    private final GridState initialState;

    public static Grid closed(int rows, int columns) {
        return new Grid(rows, columns, GridState.CLOSED);
    }

    public static Grid open(int rows, int columns) {
        return new Grid(rows, columns, GridState.OPEN);
    }

    public static Grid create(GridState state, int rows, int columns) {
        return new Grid(rows, columns, state);
    }

    private Grid(int rows, int columns, GridState initialState) {
        if (rows < 1 || columns < 1) {
            throw new IllegalArgumentException("Grid dimensions must be positive: rows=" + rows + " columns=" + columns);
        }
        if (initialState == null) {
            throw new IllegalArgumentException("Initial grid state is required");
        }
        this.rows = rows;
        this.columns = columns;
        this.initialState = initialState;

        int size;
        try {
            size = Math.multiplyExact(rows, columns);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Grid too large: rows=" + rows + " columns=" + columns, e);
        }
        this.cells = new Cell[size];
        for (int i = 0; i < cells.length; i++) {
            cells[i] = new Cell(this, i, i / columns, i % columns);
        }
        this.view = Collections.unmodifiableList(Arrays.asList(cells));

        for (Cell c : cells) {
            for (Direction d : Direction.values()) {
                int r = c.row + d.dRow;
                int col = c.column + d.dColumn;
                if (inBounds(r, col)) {
                    c.wire(d, r * columns + col);
                }
            }
        }

        if (initialState == GridState.OPEN) {
            for (Cell c : cells) {
                // south/east only, the reverse side is covered by bidirectional link
                c.link(c.south());
                c.link(c.east());
            }
        }
    }

    /** Bounds-checked lookup; null when out of range. */
    public Cell at(int row, int column) {
        if (!inBounds(row, column)) return null;
        return cells[row * columns + column];
    }

    Cell byIndex(int index) {
        return cells[index];
    }

    public boolean inBounds(int row, int column) {
        return row >= 0 && row < rows && column >= 0 && column < columns;
    }

    /** All cells in row-major order (read-only view). */
    public List<Cell> cells() {
        return view;
    }

    @Override
    public Iterator<Cell> iterator() {
        return view.iterator();
    }

    public int size() {
        return cells.length;
    }

    public GridState initialState() {
        return initialState;
    }

    /** Cells with exactly one link. */
    public List<Cell> deadEnds() {
        List<Cell> out = new ArrayList<>();
        for (Cell c : cells) {
            if (c.linkCount() == 1) out.add(c);
        }
        return out;
    }

    public Cell randomCell(Random rng) {
        if (rng == null) {
            throw new IllegalArgumentException("Random source is required");
        }
        return cells[rng.nextInt(cells.length)];
    }

    /** Number of undirected links. Assumes symmetric links. */
    public int linkCount() {
        int total = 0;
        for (Cell c : cells) {
            total += c.linkCount();
        }
        return total / 2;
    }

    /** True while the grid is still in the exact state its constructor produced. */
    public boolean isPristine() {
        if (initialState == GridState.CLOSED) {
            for (Cell c : cells) {
                if (c.hasLinks()) return false;
            }
            return true;
        }
        for (Cell c : cells) {
            if (c.linkCount() != c.neighbors().size()) return false;
        }
        return true;
    }

    @Override
    public String toString() {
        return "Grid[" + rows + "x" + columns + ", " + initialState + "]";
    }
}
