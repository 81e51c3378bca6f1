package org.maze.core.generation.stages;

import org.maze.core.generation.GenerationStage;
import org.maze.core.generation.LongestPath;
import org.maze.core.generation.MazeContext;
import org.maze.core.generation.StageId;
import org.maze.core.model.Cell;
import org.maze.core.model.Grid;


public class LongestPathStage implements GenerationStage {

    @Override
    public String name() {
        return "Longest Path (start/goal)";
    }

    @Override
    public void apply(MazeContext ctx) {
        ctx.longestPath = LongestPath.apply(ctx.grid, searchOrigin(ctx));
    }

    /** Uniform cell of the top-left quadrant. */
    private Cell searchOrigin(MazeContext ctx) {
        Grid grid = ctx.grid;
        int row = ctx.rng.nextInt((grid.rows - 1) / 2 + 1);
        int column = ctx.rng.nextInt((grid.columns - 1) / 2 + 1);
        return grid.at(row, column);
    }

    @Override
    public StageId id() {
        return StageId.LONGEST_PATH;
    }
}
