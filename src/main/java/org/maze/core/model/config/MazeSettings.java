package org.maze.core.model.config;

/**
 * Explicit inputs of one level generation. The seed fully determines the result together with
 * the dimensions and the algorithm.
 */
public class MazeSettings {

    public long seed;

    public int rows = 10;
    public int columns = 10;

    /** Algorithm name as accepted by {@code Algorithms.byName}; null = pick one with the seeded RNG. */
    public String algorithm;

    public MazeSettings(long seed) {
        this.seed = seed;
    }

    public MazeSettings(long seed, int rows, int columns, String algorithm) {
        this.seed = seed;
        this.rows = rows;
        this.columns = columns;
        this.algorithm = algorithm;
    }

    /** Same dimensions and algorithm, another seed. */
    public MazeSettings withSeed(long newSeed) {
        return new MazeSettings(newSeed, rows, columns, algorithm);
    }
}
