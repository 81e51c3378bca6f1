package org.maze.core.generation.stages;

import org.maze.core.generation.Algorithms;
import org.maze.core.generation.GenerationStage;
import org.maze.core.generation.MazeContext;
import org.maze.core.generation.StageId;


public class BuildGridStage implements GenerationStage {

    @Override
    public String name() {
        return "Build Grid";
    }

    @Override
    public void apply(MazeContext ctx) {
        // algorithm first: the grid's initial state depends on it
        ctx.algorithm = (ctx.settings.algorithm == null)
                ? Algorithms.random(ctx.rng)
                : Algorithms.byName(ctx.settings.algorithm);
        ctx.grid = Algorithms.newGrid(ctx.algorithm, ctx.settings.rows, ctx.settings.columns);
    }

    @Override
    public StageId id() {
        return StageId.GRID;
    }
}
