package org.maze.core.generation;

import org.maze.core.model.Grid;
import org.maze.core.model.GridState;

import java.util.List;
import java.util.Locale;
import java.util.Random;

public final class Algorithms {

    /** Strategies a level can be generated with. */
    public static final List<MazeAlgorithm> AVAILABLE = List.of(
            new BinaryTree(),
            new AldousBroder(),
            new RecursiveBacktracker(),
            new RecursiveDivision()
    );

    private Algorithms() {}

    /**
     * Resolves "RecursiveBacktracker", "recursive_backtracker", "recursive-backtracker" alike.
     */
    public static MazeAlgorithm byName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Algorithm name is required");
        }
        String key = normalize(name);
        for (MazeAlgorithm a : AVAILABLE) {
            if (normalize(a.name()).equals(key)) return a;
        }
        MazeAlgorithm rooms = RecursiveDivision.withRooms();
        if (normalize(rooms.name()).equals(key)) return rooms;

        throw new IllegalArgumentException("Unknown maze algorithm: " + name);
    }

    public static MazeAlgorithm random(Random rng) {
        return AVAILABLE.get(rng.nextInt(AVAILABLE.size()));
    }

    /** Builds a grid in the state {@code algorithm} expects. */
    public static Grid newGrid(MazeAlgorithm algorithm, int rows, int columns) {
        return Grid.create(algorithm.requiredState(), rows, columns);
    }

    /**
     * Rejects a grid built in the wrong initial state or already carved.
     * Called first thing by every strategy.
     */
    static void checkPreconditions(MazeAlgorithm algorithm, Grid grid, Random rng) {
        if (grid == null) {
            throw new IllegalArgumentException(algorithm.name() + ": grid is required");
        }
        if (rng == null) {
            throw new IllegalArgumentException(algorithm.name() + ": random source is required");
        }
        GridState want = algorithm.requiredState();
        if (grid.initialState() != want) {
            throw new IllegalStateException(algorithm.name() + " requires a " + want
                    + " grid, got " + grid.initialState());
        }
        if (!grid.isPristine()) {
            throw new IllegalStateException(algorithm.name() + " requires a freshly built " + want
                    + " grid, links were already changed on " + grid);
        }
    }

    private static String normalize(String s) {
        return s.trim().replace("_", "").replace("-", "").toLowerCase(Locale.ROOT);
    }
}
