package org.maze.core.generation.stages;

import org.maze.core.generation.GenerationStage;
import org.maze.core.generation.MazeContext;
import org.maze.core.generation.StageId;


public class CarveStage implements GenerationStage {

    @Override
    public String name() {
        return "Carve Maze";
    }

    @Override
    public void apply(MazeContext ctx) {
        ctx.algorithm.apply(ctx.grid, ctx.rng);
    }

    @Override
    public StageId id() {
        return StageId.CARVE;
    }
}
